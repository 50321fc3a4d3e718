package com.promptcraft.llm.mock;

import com.promptcraft.common.constants.AiOperation;
import com.promptcraft.llm.model.ImproveMode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Offline generator backing the mock provider. Output is a pure function of the
 * operation and the input text: the same request always yields the same content.
 */
@Component
public class MockDataGenerator {
    
    private static final Set<String> FILLER_WORDS = Set.of(
        "very", "really", "quite", "rather", "somewhat", "basically", "actually", "literally", "just"
    );
    
    private static final Pattern[] REDUNDANT_PHRASES = {
        Pattern.compile("\\b(please|kindly|if you could|would you mind)\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(I would like|I want|I need)\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(can you|could you)\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(thank you|thanks)\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(kind of|sort of)\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\b(that is|which is|who is)\\b", Pattern.CASE_INSENSITIVE)
    };
    
    private static final List<String> EXPANSIONS = List.of(
        "Provide detailed and comprehensive information.",
        "Include specific examples and practical applications.",
        "Consider different perspectives and approaches.",
        "Ensure the response is well-structured and easy to understand.",
        "Focus on actionable insights and practical recommendations.",
        "Address potential challenges and provide solutions.",
        "Include relevant context and background information.",
        "Make sure to cover all important aspects thoroughly."
    );
    
    private static final List<String> GENERIC_RESPONSES = List.of(
        "This is a mock response for development purposes.",
        "Mock data generated for testing.",
        "Development mode: This would be the actual AI response.",
        "Test response - no actual AI processing performed.",
        "Mock content generated based on your request."
    );
    
    private static final Pattern QUOTED_PROMPT = Pattern.compile("(?s)^[^\"]*:\\s*\"(.*)\"\\s*$");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s");
    private static final int SUMMARY_MAX_CHARS = 200;
    private static final int MIN_TIGHTENED_WORDS = 3;
    
    public String generate(AiOperation operation, String systemPrompt, String userPrompt) {
        String input = userPrompt != null ? userPrompt : "";
        if (operation == null) {
            return genericResponse(input);
        }
        if (operation == AiOperation.PROMPT_IMPROVE) {
            return improvePrompt(unquote(input), extractMode(systemPrompt));
        }
        if (operation == AiOperation.PROMPT_GENERATE) {
            return generatePrompt(stripLeadIn(input));
        }
        if (operation == AiOperation.CONTENT_SUMMARIZE) {
            return summarize(input);
        }
        if (operation == AiOperation.CONTENT_EXPAND) {
            return expand(input);
        }
        return genericResponse(input);
    }
    
    public String improvePrompt(String originalPrompt, ImproveMode mode) {
        return mode == ImproveMode.TIGHTEN ? tighten(originalPrompt) : expand(originalPrompt);
    }
    
    /** Input tokens: one per four characters of system and user prompt. */
    public int inputTokens(String systemPrompt, String userPrompt) {
        int chars = (systemPrompt != null ? systemPrompt.length() : 0) + (userPrompt != null ? userPrompt.length() : 0);
        return (int) Math.ceil(chars / 4.0);
    }
    
    /** Output tokens: one per three characters of generated text. */
    public int outputTokens(String content) {
        return content == null ? 0 : (int) Math.ceil(content.length() / 3.0);
    }
    
    ImproveMode extractMode(String systemPrompt) {
        String lower = systemPrompt != null ? systemPrompt.toLowerCase(Locale.ROOT) : "";
        return lower.contains("tighten") || lower.contains("concise") ? ImproveMode.TIGHTEN : ImproveMode.EXPAND;
    }
    
    private String tighten(String originalPrompt) {
        String filtered = Arrays.stream(originalPrompt.split("\\s+"))
            .filter(word -> !FILLER_WORDS.contains(word.toLowerCase(Locale.ROOT)))
            .collect(Collectors.joining(" "));
        
        for (Pattern phrase : REDUNDANT_PHRASES) {
            filtered = phrase.matcher(filtered).replaceAll("");
        }
        String result = filtered.replaceAll("\\s{2,}", " ").trim();
        
        if (result.isEmpty() || result.split("\\s+").length < MIN_TIGHTENED_WORDS) {
            return originalPrompt.trim();
        }
        return result;
    }
    
    private String expand(String originalPrompt) {
        int first = pick(originalPrompt, EXPANSIONS.size());
        int second = (first + 1 + pick(originalPrompt + "#", EXPANSIONS.size() - 1)) % EXPANSIONS.size();
        return originalPrompt.trim() + "\n\n" + EXPANSIONS.get(first) + " " + EXPANSIONS.get(second);
    }
    
    private String generatePrompt(String description) {
        List<String> lines = new ArrayList<>();
        lines.add("You are an expert assistant.");
        lines.add("");
        lines.add("Task: " + description.trim());
        lines.add("");
        lines.add("Requirements:");
        lines.add("- Be clear and specific.");
        lines.add("- State any assumptions you make.");
        lines.add("");
        lines.add("Output format: a well-structured response with headings where useful.");
        return String.join("\n", lines);
    }
    
    private String summarize(String input) {
        String trimmed = input.trim();
        String firstSentence = SENTENCE_END.split(trimmed, 2)[0];
        if (firstSentence.length() > SUMMARY_MAX_CHARS) {
            return firstSentence.substring(0, SUMMARY_MAX_CHARS).trim() + "...";
        }
        return firstSentence;
    }
    
    private String genericResponse(String input) {
        return GENERIC_RESPONSES.get(pick(input, GENERIC_RESPONSES.size())) + "\n\nOriginal request: " + input;
    }
    
    private String unquote(String input) {
        Matcher matcher = QUOTED_PROMPT.matcher(input);
        return matcher.matches() ? matcher.group(1) : input;
    }
    
    private String stripLeadIn(String input) {
        int colon = input.indexOf(':');
        return colon >= 0 && colon < 40 ? input.substring(colon + 1) : input;
    }
    
    private int pick(String seed, int bound) {
        return Math.floorMod(seed.hashCode(), bound);
    }
}
