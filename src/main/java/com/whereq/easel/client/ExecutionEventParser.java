package com.whereq.easel.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parses JSON text frames of the event channel.
 *
 * Frames that are not JSON, or of a type execution tracking does not use, become
 * {@link ExecutionEvent#other()}.
 */
@Slf4j
@Component
public class ExecutionEventParser {

    static final String DEFAULT_ERROR_MESSAGE = "Execution error reported by engine";

    private final ObjectMapper objectMapper;

    public ExecutionEventParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExecutionEvent parse(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring non-JSON frame: {}", e.getOriginalMessage());
            return ExecutionEvent.other();
        }
        if (root == null || !root.isObject()) {
            return ExecutionEvent.other();
        }

        JsonNode data = root.path("data");
        String promptId = textOrNull(data.path("prompt_id"));
        switch (root.path("type").asText("")) {
            case "executing":
                return ExecutionEvent.executing(promptId, textOrNull(data.path("node")));
            case "execution_error":
                String message = textOrNull(data.path("exception_message"));
                return ExecutionEvent.executionError(promptId,
                    message == null || message.isEmpty() ? DEFAULT_ERROR_MESSAGE : message);
            default:
                return ExecutionEvent.other();
        }
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
