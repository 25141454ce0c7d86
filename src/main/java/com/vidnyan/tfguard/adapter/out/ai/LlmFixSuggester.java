package com.vidnyan.tfguard.adapter.out.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.tfguard.application.port.out.FixSuggester;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fix suggester backed by a chat model. The model is asked for a JSON object
 * with {@code before}, {@code after} and {@code description}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmFixSuggester implements FixSuggester {

    static final String SYSTEM_PROMPT = """
            You are a Terraform security and cost optimization expert.
            You produce the minimal HCL edit that resolves a policy violation.
            Answer with a single JSON object and nothing else.
            """;

    private final LlmClient llmClient;
    private final ObjectMapper objectMapper;

    @Override
    public boolean isAvailable() {
        return llmClient.isConfigured();
    }

    @Override
    public Suggestion suggestFix(String content, FixRequest request) {
        log.info("Requesting AI fix for {} on {}", request.policyCode(), request.resourceRef());
        String answer = llmClient.chat(SYSTEM_PROMPT, buildPrompt(content, request));
        return parseAnswer(answer);
    }

    static String buildPrompt(String content, FixRequest request) {
        return String.format("""
                Generate the minimal code change that fixes this violation.

                POLICY: %s - %s
                DESCRIPTION: %s
                VIOLATION: %s
                RESOURCE: %s (%s)
                SUGGESTION: %s

                TEMPLATE:
                ```hcl
                %s
                ```

                Respond in this exact JSON format only, no markdown or extra text:
                {
                  "before": "the exact lines of code to replace (or empty string if adding new code)",
                  "after": "the corrected or new code",
                  "description": "brief explanation of what was changed"
                }

                Rules:
                - Make the minimum change necessary
                - "before" must be an exact substring of the template, or empty when adding a new resource
                - Preserve existing formatting and indentation
                - Do not modify unrelated resources
                """,
                request.policyCode(), request.policyName(),
                request.policyDescription(),
                request.message(),
                request.resourceRef(), request.resourceType(),
                request.suggestion() != null ? request.suggestion() : "None provided",
                content);
    }

    /**
     * Read the outermost JSON object from the answer, ignoring any prose or
     * code fences around it.
     *
     * @throws IllegalArgumentException when no usable object is present
     */
    Suggestion parseAnswer(String answer) {
        int start = answer == null ? -1 : answer.indexOf('{');
        int end = answer == null ? -1 : answer.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("No JSON found in AI response");
        }
        try {
            JsonNode node = objectMapper.readTree(answer.substring(start, end + 1));
            return new Suggestion(
                    node.path("before").asText(""),
                    node.path("after").asText(""),
                    node.path("description").asText(""));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON in AI response: " + e.getOriginalMessage(), e);
        }
    }
}
