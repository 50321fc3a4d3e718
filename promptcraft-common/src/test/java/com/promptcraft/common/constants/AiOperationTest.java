package com.promptcraft.common.constants;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AiOperationTest {

    @Test
    void resolvesByTagOrConstantName() {
        assertEquals(AiOperation.PROMPT_IMPROVE, AiOperation.fromTag("prompt-improve"));
        assertEquals(AiOperation.CODE_REVIEW, AiOperation.fromTag("CODE_REVIEW"));
    }

    @Test
    void rejectsUnknownTag() {
        assertThrows(IllegalArgumentException.class, () -> AiOperation.fromTag("poetry"));
    }

    @Test
    void bucketsComplexityByTokenEstimate() {
        assertEquals(ComplexityLevel.LOW, ComplexityLevel.fromEstimatedTokens(10));
        assertEquals(ComplexityLevel.MEDIUM, ComplexityLevel.fromEstimatedTokens(500));
        assertEquals(ComplexityLevel.HIGH, ComplexityLevel.fromEstimatedTokens(2000));
    }
}
