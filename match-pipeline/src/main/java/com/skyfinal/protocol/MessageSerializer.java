package com.skyfinal.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skyfinal.tactical.TacticalEvent;
import com.skyfinal.vision.VisualEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Handles serialization/deserialization of protocol messages and builds the
 * JSON payloads for pipeline events.
 *
 * Thread-safe: the ObjectMapper is configured once and shared by the
 * broadcaster and every channel handler.
 */
public class MessageSerializer {

    private static final Logger logger = LoggerFactory.getLogger(MessageSerializer.class);

    private final ObjectMapper objectMapper;

    public MessageSerializer() {
        this.objectMapper = new ObjectMapper();
    }

    public String serialize(Message message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize message: {}", message, e);
            throw new RuntimeException("Serialization failed", e);
        }
    }

    public Message deserialize(String json) {
        try {
            return objectMapper.readValue(json, Message.class);
        } catch (JsonProcessingException e) {
            logger.error("Failed to deserialize message: {}", json, e);
            throw new RuntimeException("Deserialization failed", e);
        }
    }

    public ObjectNode createObjectNode() {
        return objectMapper.createObjectNode();
    }

    /**
     * {@code {"type", "timestamp", "description", "metadata": {...}}}
     */
    public ObjectNode toPayload(TacticalEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", event.getType().name());
        node.put("timestamp", event.getTimestamp().toString());
        node.put("description", event.getDescription());
        ObjectNode metadata = node.putObject("metadata");
        for (Map.Entry<String, String> entry : event.getMetadata().entrySet()) {
            metadata.put(entry.getKey(), entry.getValue());
        }
        return node;
    }

    /**
     * {@code {"label", "timestamp", "flags": {...}}}, plus {@code "error"} for failures.
     */
    public ObjectNode toPayload(VisualEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("label", event.getLabel().name());
        node.put("timestamp", event.getTimestamp().toString());
        if (event.isError()) {
            node.put("error", event.getDetail());
        }
        ObjectNode flags = node.putObject("flags");
        event.toFlags().forEach(flags::put);
        return node;
    }

    public ArrayNode toEventArray(List<TacticalEvent> events) {
        ArrayNode array = objectMapper.createArrayNode();
        events.forEach(e -> array.add(toPayload(e)));
        return array;
    }

    public ArrayNode toStringArray(List<String> values) {
        ArrayNode array = objectMapper.createArrayNode();
        values.forEach(array::add);
        return array;
    }

    /**
     * Converts any Jackson-mappable value (e.g. history entries) to a tree.
     */
    public JsonNode toTree(Object value) {
        return objectMapper.valueToTree(value);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
