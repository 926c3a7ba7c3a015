package com.gdin.inspection.originality.collaborator;

import com.gdin.inspection.originality.config.properties.OriginalityProperties;
import com.gdin.inspection.originality.exception.MalformedResponseException;
import com.gdin.inspection.originality.exception.SubsystemUnavailableException;
import com.gdin.inspection.originality.support.TestFixtures;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class CollaboratorCallsTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final OriginalityProperties properties = TestFixtures.properties();

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void testTransientFailureIsRetriedOnce() {
        CollaboratorCalls calls = TestFixtures.calls(executor, properties);
        AtomicInteger attempts = new AtomicInteger();

        String result = calls.call("flaky", () -> {
            if (attempts.incrementAndGet() == 1) throw new IllegalStateException("429 rate limit exceeded");
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(2, attempts.get());
    }

    @Test
    public void testSlowCallTimesOutAfterRetry() {
        properties.getResilience().setCallTimeout(Duration.ofMillis(100));
        CollaboratorCalls calls = TestFixtures.calls(executor, properties);
        AtomicInteger attempts = new AtomicInteger();

        SubsystemUnavailableException e = assertThrows(SubsystemUnavailableException.class,
                () -> calls.call("slow", () -> {
                    attempts.incrementAndGet();
                    try {
                        Thread.sleep(2_000);
                    } catch (InterruptedException interrupted) {
                        Thread.currentThread().interrupt();
                    }
                    return "late";
                }));

        assertEquals(SubsystemUnavailableException.Reason.TIMEOUT, e.getReason());
        assertEquals(2, attempts.get());
    }

    @Test
    public void testTimedOutCallReleasesItsThread() throws InterruptedException {
        ExecutorService twoThreads = Executors.newFixedThreadPool(2);
        try {
            properties.getResilience().setCallTimeout(Duration.ofMillis(300));
            CollaboratorCalls calls = TestFixtures.calls(twoThreads, properties);
            CountDownLatch interrupted = new CountDownLatch(2);

            SubsystemUnavailableException e = assertThrows(SubsystemUnavailableException.class,
                    () -> calls.call("hung", () -> {
                        try {
                            Thread.sleep(5_000);
                        } catch (InterruptedException ie) {
                            interrupted.countDown();
                            Thread.currentThread().interrupt();
                        }
                        return "late";
                    }));
            assertEquals(SubsystemUnavailableException.Reason.TIMEOUT, e.getReason());
            assertTrue(interrupted.await(2, TimeUnit.SECONDS), "超时的调用应当被中断");

            long start = System.nanoTime();
            assertEquals("ok", calls.call("healthy", () -> "ok"));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            log.info("healthy call after hung call: {} ms", elapsedMs);
            assertTrue(elapsedMs < 300);
        } finally {
            twoThreads.shutdownNow();
        }
    }

    @Test
    public void testAuthenticationFailureIsNotRetried() {
        CollaboratorCalls calls = TestFixtures.calls(executor, properties);
        AtomicInteger attempts = new AtomicInteger();

        SubsystemUnavailableException e = assertThrows(SubsystemUnavailableException.class,
                () -> calls.call("auth", () -> {
                    attempts.incrementAndGet();
                    throw new IllegalStateException("Invalid API-key provided");
                }));

        assertEquals(SubsystemUnavailableException.Reason.AUTHENTICATION, e.getReason());
        assertFalse(e.isRetryable());
        assertEquals(1, attempts.get());
    }

    @Test
    public void testMalformedResponsePassesThroughWithoutRetry() {
        CollaboratorCalls calls = TestFixtures.calls(executor, properties);
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(MalformedResponseException.class, () -> calls.call("parse", () -> {
            attempts.incrementAndGet();
            throw new MalformedResponseException("not json");
        }));
        assertEquals(1, attempts.get());
    }

    @Test
    public void testTranslateClassifiesFailures() {
        SubsystemUnavailableException refused = (SubsystemUnavailableException)
                CollaboratorCalls.translate("op", new ConnectException("Connection refused"));
        assertEquals(SubsystemUnavailableException.Reason.UNREACHABLE, refused.getReason());

        SubsystemUnavailableException timeout = (SubsystemUnavailableException)
                CollaboratorCalls.translate("op", new RuntimeException("Read timed out"));
        assertEquals(SubsystemUnavailableException.Reason.TIMEOUT, timeout.getReason());
        assertTrue(timeout.isRetryable());

        MalformedResponseException malformed = new MalformedResponseException("bad");
        assertSame(malformed, CollaboratorCalls.translate("op", malformed));
    }
}
