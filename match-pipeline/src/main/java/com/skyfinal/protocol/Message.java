package com.skyfinal.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Represents a message in the event stream protocol.
 *
 * JSON format:
 * {
 *     "type": "TACTICAL_EVENT",
 *     "seriesId": "2629390",
 *     "payload": { ... },
 *     "sequence": 42,
 *     "timestamp": 1234567890
 * }
 *
 * Pushed messages carry a sequence number that grows by one per broadcast,
 * so a subscriber can tell when it missed something. Replies carry none.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    private MessageType type;
    private String seriesId;
    private JsonNode payload;
    private Long sequence;
    private Long timestamp;

    // Default constructor for Jackson deserialization
    public Message() {
    }

    private Message(MessageType type, String seriesId, JsonNode payload, Long sequence, Long timestamp) {
        this.type = type;
        this.seriesId = seriesId;
        this.payload = payload;
        this.sequence = sequence;
        this.timestamp = timestamp;
    }

    public MessageType getType() {
        return type;
    }

    public String getSeriesId() {
        return seriesId;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public Long getSequence() {
        return sequence;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    // Setters for Jackson deserialization
    public void setType(MessageType type) {
        this.type = type;
    }

    public void setSeriesId(String seriesId) {
        this.seriesId = seriesId;
    }

    public void setPayload(JsonNode payload) {
        this.payload = payload;
    }

    public void setSequence(Long sequence) {
        this.sequence = sequence;
    }

    public void setTimestamp(Long timestamp) {
        this.timestamp = timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MessageType type;
        private String seriesId;
        private JsonNode payload;
        private Long sequence;
        private Long timestamp;

        public Builder type(MessageType type) {
            this.type = type;
            return this;
        }

        public Builder seriesId(String seriesId) {
            this.seriesId = seriesId;
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder sequence(Long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder timestamp(Long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Message build() {
            return new Message(type, seriesId, payload, sequence,
                    timestamp != null ? timestamp : System.currentTimeMillis());
        }
    }

    @Override
    public String toString() {
        return "Message{" +
                "type=" + type +
                ", seriesId='" + seriesId + '\'' +
                ", sequence=" + sequence +
                '}';
    }
}
