package com.taskflow.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskflow.core.model.Task;
import org.springframework.stereotype.Component;

/**
 * Serializes the task aggregate to and from its JSON document form.
 * <p>
 * The document is always produced whole from an immutable {@link Task}, so a stored
 * document is either the previous version or the next one, never a partial edit.
 */
@Component
public class TaskDocumentCodec {

    private final ObjectMapper objectMapper;

    public TaskDocumentCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(Task task) {
        try {
            return objectMapper.writeValueAsString(task);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task " + task.id(), e);
        }
    }

    public Task decode(String document) {
        try {
            return objectMapper.readValue(document, Task.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize task document", e);
        }
    }
}
