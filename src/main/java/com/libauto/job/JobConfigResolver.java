package com.libauto.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns whatever is stored in a job's config column into a key/value object.
 * <ul>
 * <li>objects are copied as-is</li>
 * <li>strings are parsed as JSON and resolved again</li>
 * <li>arrays are wrapped as {@code {"values": [...]}}</li>
 * <li>anything else, including unparseable text, becomes {@code {}}</li>
 * </ul>
 */
@Component
public class JobConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(JobConfigResolver.class);

    private final ObjectMapper objectMapper;

    public JobConfigResolver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode resolve(Object raw) {
        if (raw == null) {
            return objectMapper.createObjectNode();
        }
        if (raw instanceof CharSequence text) {
            return resolveText(text.toString());
        }
        JsonNode node;
        try {
            node = raw instanceof JsonNode jsonNode ? jsonNode : objectMapper.valueToTree(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring job config of type {} that cannot be converted to JSON", raw.getClass().getName());
            return objectMapper.createObjectNode();
        }
        return resolveNode(node);
    }

    private ObjectNode resolveNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return objectMapper.createObjectNode();
        }
        if (node.isObject()) {
            return ((ObjectNode) node).deepCopy();
        }
        if (node.isArray()) {
            ObjectNode wrapped = objectMapper.createObjectNode();
            wrapped.set("values", node.deepCopy());
            return wrapped;
        }
        if (node.isTextual()) {
            return resolveText(node.asText());
        }
        return objectMapper.createObjectNode();
    }

    private ObjectNode resolveText(String text) {
        if (text.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode parsed = objectMapper.readTree(text);
            if (parsed == null || parsed.isTextual()) {
                return objectMapper.createObjectNode();
            }
            return resolveNode(parsed);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unparseable job config: {}", e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }
}
