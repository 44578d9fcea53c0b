package com.taskflow.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} so sub-agents can ask for a typed verdict.
 * <p>
 * {@link BeanOutputConverter} derives a JSON schema from the target record and appends
 * the format instructions to the user prompt. When the converter cannot read the
 * answer (markdown fences, extra fields) a lenient Jackson pass is tried before giving up.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final ObjectMapper lenientMapper;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.chat.options.model:default}") String model) {
        this.chatClient = builder.build();
        this.lenientMapper = new ObjectMapper()
                .registerModule(new ParameterNamesModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        log.info("LlmService initialized with model {}", model);
    }

    /**
     * Sends a system + user prompt and returns the response deserialized into {@code outputType}.
     *
     * @throws LlmEmptyResponseException if the model answered with no content
     * @throws LlmParseException         if the answer is not valid JSON for {@code outputType}
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        log.info("LLM call complete -> {} ({} ms)", outputType.getSimpleName(), System.currentTimeMillis() - start);

        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName());
        }
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Structured conversion to {} failed: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseLeniently(response, outputType);
        }
    }

    <T> T parseLeniently(String json, Class<T> outputType) {
        String cleaned = stripCodeFence(json);
        try {
            return lenientMapper.readValue(cleaned, outputType);
        } catch (Exception e) {
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    static String stripCodeFence(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
