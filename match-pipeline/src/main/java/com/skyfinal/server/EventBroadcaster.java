package com.skyfinal.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyfinal.protocol.Message;
import com.skyfinal.protocol.MessageSerializer;
import com.skyfinal.protocol.MessageType;
import com.skyfinal.session.ClientSession;
import com.skyfinal.session.SessionManager;
import com.skyfinal.sink.EventSink;
import com.skyfinal.tactical.TacticalEvent;
import com.skyfinal.vision.VisualEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Pushes pipeline events to every connected subscriber.
 *
 * Called from the pipeline threads. Writes are queued by Netty, so a slow
 * subscriber never blocks polling or classification. Delivery is
 * best-effort: a subscriber that is not connected when an event happens
 * does not get it later.
 */
public class EventBroadcaster implements EventSink {

    private static final Logger logger = LoggerFactory.getLogger(EventBroadcaster.class);

    private final SessionManager sessionManager;
    private final MessageSerializer serializer;
    private final String seriesId;
    private final AtomicLong sequence = new AtomicLong();

    public EventBroadcaster(SessionManager sessionManager, MessageSerializer serializer, String seriesId) {
        this.sessionManager = sessionManager;
        this.serializer = serializer;
        this.seriesId = seriesId;
    }

    @Override
    public void onTacticalEvent(TacticalEvent event) {
        broadcast(MessageType.TACTICAL_EVENT, serializer.toPayload(event));
    }

    @Override
    public void onConclusion(String conclusion) {
        broadcast(MessageType.CONCLUSION, serializer.createObjectNode().put("conclusion", conclusion));
    }

    @Override
    public void onVisualEvent(VisualEvent event) {
        broadcast(MessageType.VISUAL_EVENT, serializer.toPayload(event));
    }

    private void broadcast(MessageType type, JsonNode payload) {
        Message message = Message.builder()
                .type(type)
                .seriesId(seriesId)
                .payload(payload)
                .sequence(sequence.incrementAndGet())
                .build();
        String json = serializer.serialize(message);

        int delivered = 0;
        for (ClientSession session : sessionManager.getAllSessions()) {
            if (session.isActive()) {
                session.send(json);
                delivered++;
            }
        }
        logger.debug("Broadcast {} to {} subscriber(s)", type, delivered);
    }

    /**
     * Sequence number of the last broadcast message.
     */
    public long getSequence() {
        return sequence.get();
    }
}
