package com.gdin.inspection.originality.authorship;

import com.gdin.inspection.originality.exception.MalformedResponseException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class DeepAnalysisResponseParserTest {

    @Test
    public void testBreakdownWithSeparateEvidence() {
        DeepAnalysis analysis = DeepAnalysisResponseParser.parse("""
                {
                  "confidence_breakdown": {
                    "documentation_style": 85, "structure_formatting": "70", "naming_identifiers": 120,
                    "error_handling": 40, "complexity": 30, "personal_style": -5, "vibes": 99
                  },
                  "evidence": {"documentation_style": "每个函数都有 docstring"},
                  "ai_tool_signature": "Unknown"
                }
                """);

        assertTrue(analysis.isComplete());
        assertEquals(70.0, analysis.scores().get(AuthorshipDimension.STRUCTURE_FORMATTING), 1e-9);
        assertEquals(100.0, analysis.scores().get(AuthorshipDimension.NAMING), 1e-9);
        assertEquals(0.0, analysis.scores().get(AuthorshipDimension.PERSONAL_STYLE), 1e-9);
        assertEquals("每个函数都有 docstring", analysis.evidence().get(AuthorshipDimension.DOCUMENTATION_STYLE));
        assertNull(analysis.toolSignature());
    }

    @Test
    public void testPartialDimensions() {
        DeepAnalysis analysis = DeepAnalysisResponseParser.parse(
                "{\"dimensions\": {\"complexity\": {\"score\": 20, \"evidence\": \"逻辑简单\"}}, \"ai_tool_signature\": \"Copilot\"}");
        assertFalse(analysis.isComplete());
        assertEquals(1, analysis.scores().size());
        assertEquals("copilot", analysis.toolSignature());
    }

    @Test
    public void testMalformedOutputs() {
        assertThrows(MalformedResponseException.class, () -> DeepAnalysisResponseParser.parse("无法分析"));
        assertThrows(MalformedResponseException.class, () -> DeepAnalysisResponseParser.parse("{\"dimensions\": []}"));
        assertThrows(MalformedResponseException.class,
                () -> DeepAnalysisResponseParser.parse("{\"dimensions\": {\"documentation_style\": {\"score\": \"高\"}}}"));
    }
}
