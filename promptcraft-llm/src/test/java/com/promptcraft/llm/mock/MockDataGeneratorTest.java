package com.promptcraft.llm.mock;

import com.promptcraft.common.constants.AiOperation;
import com.promptcraft.llm.model.ImproveMode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MockDataGeneratorTest {
    
    private final MockDataGenerator generator = new MockDataGenerator();
    
    @Test
    void tightenDropsFillerAndPoliteness() {
        String result = generator.improvePrompt("Please write a very really detailed summary of the document",
            ImproveMode.TIGHTEN);
        
        assertEquals("write a detailed summary of the document", result);
    }
    
    @Test
    void tightenKeepsOriginalWhenTooLittleWouldRemain() {
        assertEquals("Please just thanks", generator.improvePrompt("Please just thanks", ImproveMode.TIGHTEN));
    }
    
    @Test
    void expandAppendsTwoDistinctGuidanceSentences() {
        String result = generator.improvePrompt("Explain recursion", ImproveMode.EXPAND);
        
        assertTrue(result.startsWith("Explain recursion\n\n"));
        String guidance = result.substring("Explain recursion\n\n".length());
        String[] sentences = guidance.split("(?<=\\.) ");
        assertEquals(2, sentences.length);
        assertNotEquals(sentences[0], sentences[1]);
    }
    
    @Test
    void improveOperationReadsModeAndQuotedPrompt() {
        String content = generator.generate(AiOperation.PROMPT_IMPROVE,
            "You are an expert at making prompts more concise.",
            "Please improve this prompt:\n\n\"Could you very quickly write a poem\"");
        
        assertEquals("quickly write a poem", content);
    }
    
    @Test
    void modeDefaultsToExpand() {
        assertEquals(ImproveMode.TIGHTEN, generator.extractMode("Tighten the prompt"));
        assertEquals(ImproveMode.TIGHTEN, generator.extractMode("be CONCISE"));
        assertEquals(ImproveMode.EXPAND, generator.extractMode("add more context"));
        assertEquals(ImproveMode.EXPAND, generator.extractMode(null));
    }
    
    @Test
    void generateOperationBuildsScaffoldAroundDescription() {
        String content = generator.generate(AiOperation.PROMPT_GENERATE, "", "Create a prompt for: a haiku about rain");
        
        assertTrue(content.contains("Task: a haiku about rain"));
        assertTrue(content.contains("Output format:"));
    }
    
    @Test
    void summarizeReturnsFirstSentence() {
        String content = generator.generate(AiOperation.CONTENT_SUMMARIZE, "", "First sentence here. Second one follows.");
        
        assertEquals("First sentence here.", content);
    }
    
    @Test
    void summarizeTruncatesLongSentence() {
        String content = generator.generate(AiOperation.CONTENT_SUMMARIZE, "", "x".repeat(500));
        
        assertEquals(203, content.length());
        assertTrue(content.endsWith("..."));
    }
    
    @Test
    void otherOperationsEchoTheRequest() {
        String content = generator.generate(AiOperation.TRANSLATION, "", "translate me");
        
        assertTrue(content.endsWith("Original request: translate me"));
    }
    
    @Test
    void outputIsDeterministic() {
        for (AiOperation operation : AiOperation.values()) {
            assertEquals(
                generator.generate(operation, "system", "same input text"),
                generator.generate(operation, "system", "same input text"));
        }
        assertEquals(generator.generate(null, "", "abc"), generator.generate(null, "", "abc"));
    }
    
    @Test
    void tokenEstimates() {
        assertEquals(3, generator.inputTokens("abcd", "efghijkl"));
        assertEquals(0, generator.inputTokens(null, null));
        assertEquals(2, generator.outputTokens("abcd"));
        assertEquals(0, generator.outputTokens(null));
    }
}
