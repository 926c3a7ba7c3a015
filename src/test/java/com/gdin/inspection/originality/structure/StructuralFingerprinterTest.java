package com.gdin.inspection.originality.structure;

import com.gdin.inspection.originality.models.ContentUnit;
import com.gdin.inspection.originality.support.TestFixtures;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class StructuralFingerprinterTest {

    private final StructuralFingerprinter fingerprinter = new StructuralFingerprinter(TestFixtures.properties());

    private static final String PYTHON = """
            import math

            def distance(p, q):
                dx = p[0] - q[0]
                dy = p[1] - q[1]
                if dx == 0 and dy == 0:
                    return 0
                return math.sqrt(dx * dx + dy * dy)

            for point in points:
                print(distance(point, origin))
            """;

    private static final String PYTHON_RENAMED = """
            import math

            def dist(a, b):
                delta_x = a[0] - b[0]
                delta_y = a[1] - b[1]
                if delta_x == 0 and delta_y == 0:
                    return 0
                return math.sqrt(delta_x * delta_x + delta_y * delta_y)

            for pt in pts:
                print(dist(pt, center))
            """;

    private static final String JAVA = """
            public class Counter {
                private int count = 0;

                public int next(int step) {
                    if (step < 0) {
                        throw new IllegalArgumentException("negative");
                    }
                    count += step;
                    return count;
                }
            }
            """;

    private static final String JAVA_RENAMED = """
            public class Tally {
                private int total = 0;

                public int advance(int delta) {
                    if (delta < 0) {
                        throw new IllegalArgumentException("bad input");
                    }
                    total += delta;
                    return total;
                }
            }
            """;

    @Test
    public void testAddExampleSkeletonsMatch() {
        Skeleton a = fingerprinter.fingerprint("def add(a,b): return a+b");
        Skeleton b = fingerprinter.fingerprint("def add(x,y):\n    return x+y");
        log.info("a={} b={}", a.texts(), b.texts());
        assertEquals(List.of("FUNCTION@0", "RETURN@1", "op:ARITHMETIC"), a.texts());
        assertEquals(a.texts(), b.texts());
        assertEquals(1.0, fingerprinter.compare(a, b).similarity(), 1e-9);
    }

    @Test
    public void testConsistentRenamingDoesNotChangeSimilarity() {
        assertEquals(fingerprinter.fingerprint(PYTHON).texts(), fingerprinter.fingerprint(PYTHON_RENAMED).texts());
        assertEquals(fingerprinter.fingerprint(JAVA).texts(), fingerprinter.fingerprint(JAVA_RENAMED).texts());

        double original = fingerprinter.compare(fingerprinter.fingerprint(PYTHON), fingerprinter.fingerprint(JAVA)).similarity();
        double renamed = fingerprinter.compare(fingerprinter.fingerprint(PYTHON_RENAMED), fingerprinter.fingerprint(JAVA_RENAMED)).similarity();
        assertEquals(original, renamed, 1e-12);
        assertTrue(original < 1.0);
    }

    @Test
    public void testStructureIsCapturedWithDepth() {
        List<String> texts = fingerprinter.fingerprint(JAVA).texts();
        log.info("java skeleton: {}", texts);
        assertEquals("CLASS@0", texts.get(0));
        assertTrue(texts.contains("FUNCTION@1"));
        assertTrue(texts.contains("IF@2"));
        assertTrue(texts.contains("THROW@3"));
        assertTrue(texts.contains("op:COMPARISON"));
    }

    @Test
    public void testParseFailureDegradesToOpaqueToken() {
        Skeleton broken = fingerprinter.fingerprint("class A { int x = 1; /* never closed");
        assertTrue(broken.isParseFailed());
        assertEquals(List.of(Skeleton.OPAQUE_TOKEN), broken.texts());

        StructuralComparison c = fingerprinter.compare(broken, fingerprinter.fingerprint(JAVA));
        assertTrue(c.parseFailed());
        assertEquals(0.0, c.similarity(), 1e-9);
        assertTrue(c.spans().isEmpty());
    }

    @Test
    public void testNonCodeUnitIsNotParsed() {
        ContentUnit prose = TestFixtures.prose(0, "essay.txt", "This is an essay about counting.");
        ContentUnit code = TestFixtures.code(1, "Counter.java", JAVA);
        assertTrue(fingerprinter.fingerprint(prose).isParseFailed());
        assertFalse(fingerprinter.fingerprint(code).isParseFailed());
        assertTrue(fingerprinter.compare(prose, code).parseFailed());
    }
}
