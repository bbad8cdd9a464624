package com.skyfinal.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skyfinal.history.HistoryEntry;
import com.skyfinal.monitor.EventSurface;
import com.skyfinal.protocol.Message;
import com.skyfinal.protocol.MessageSerializer;
import com.skyfinal.protocol.MessageType;
import com.skyfinal.session.ClientSession;
import com.skyfinal.session.SessionManager;
import com.skyfinal.tactical.TacticalEvent;
import com.skyfinal.vision.VisualEvent;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Answers subscriber requests against the pipeline's read side.
 *
 * - GET_EVENTS: latest tactical and visual events
 * - GET_CONCLUSIONS: latest tactical conclusions
 * - GET_HISTORY: persisted snapshot history, optionally limited
 * - GET_STATUS: one-line round status
 * - CLEAR_EVENTS: drain the tactical event log, replying with what was drained
 *
 * Threading Model:
 * - Each channel is handled by a single Netty worker thread
 * - Reads go through the surface, which is safe to call from any thread
 *
 * Pushed events do not pass through here; see EventBroadcaster.
 */
public class EventFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger logger = LoggerFactory.getLogger(EventFrameHandler.class);

    private final SessionManager sessionManager;
    private final EventSurface surface;
    private final MessageSerializer serializer;
    private final String seriesId;

    public EventFrameHandler(SessionManager sessionManager, EventSurface surface,
                             MessageSerializer serializer, String seriesId) {
        this.sessionManager = sessionManager;
        this.surface = surface;
        this.serializer = serializer;
        this.seriesId = seriesId;
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        sessionManager.removeSession(ctx.channel());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (!(frame instanceof TextWebSocketFrame)) {
            logger.warn("Unsupported frame type: {}", frame.getClass().getName());
            return;
        }

        String json = ((TextWebSocketFrame) frame).text();
        ClientSession session = sessionManager.getSessionByChannel(ctx.channel());

        if (session == null) {
            logger.error("Received message from unknown channel");
            return;
        }

        Message message;
        try {
            message = serializer.deserialize(json);
        } catch (RuntimeException e) {
            sendError(session, "Invalid message format");
            return;
        }

        if (message.getType() == null) {
            sendError(session, "Message type is required");
            return;
        }
        handleMessage(session, message);
    }

    private void handleMessage(ClientSession session, Message message) {
        logger.debug("Received {} from {}", message.getType(), session.getSessionId());

        switch (message.getType()) {
            case GET_EVENTS -> sendEvents(session, surface.getLatestEvents());
            case GET_CONCLUSIONS -> sendConclusions(session);
            case GET_HISTORY -> sendHistory(session, message.getPayload());
            case GET_STATUS -> sendStatus(session);
            case CLEAR_EVENTS -> {
                List<TacticalEvent> drained = surface.drainEvents();
                logger.info("Subscriber {} drained {} tactical event(s)", session.getSessionId(), drained.size());
                sendEvents(session, drained);
            }
            default -> sendError(session, "Unsupported request: " + message.getType());
        }
    }

    // === Replies ===

    private void sendEvents(ClientSession session, List<TacticalEvent> events) {
        ObjectNode payload = serializer.createObjectNode();
        payload.set("events", serializer.toEventArray(events));

        ArrayNode visual = payload.putArray("visual");
        for (VisualEvent event : surface.getLatestVisualEvents()) {
            visual.add(serializer.toPayload(event));
        }
        reply(session, MessageType.EVENTS, payload);
    }

    private void sendConclusions(ClientSession session) {
        ObjectNode payload = serializer.createObjectNode();
        payload.set("conclusions", serializer.toStringArray(surface.getTacticalConclusions()));
        reply(session, MessageType.CONCLUSIONS, payload);
    }

    private void sendHistory(ClientSession session, JsonNode request) {
        List<HistoryEntry> entries = surface.getPersistedHistory();
        if (request != null && request.has("limit")) {
            int limit = request.get("limit").asInt();
            if (limit < 0) {
                sendError(session, "limit must not be negative");
                return;
            }
            entries = entries.subList(Math.max(0, entries.size() - limit), entries.size());
        }

        ObjectNode payload = serializer.createObjectNode();
        payload.set("entries", serializer.toTree(entries));
        reply(session, MessageType.HISTORY, payload);
    }

    private void sendStatus(ClientSession session) {
        ObjectNode payload = serializer.createObjectNode();
        payload.put("status", surface.describeRoundStatus());
        payload.put("subscribers", sessionManager.getSessionCount());
        reply(session, MessageType.STATUS, payload);
    }

    private void reply(ClientSession session, MessageType type, JsonNode payload) {
        Message response = Message.builder()
                .type(type)
                .seriesId(seriesId)
                .payload(payload)
                .build();
        session.send(serializer.serialize(response));
    }

    private void sendError(ClientSession session, String errorMessage) {
        ObjectNode payload = serializer.createObjectNode();
        payload.put("message", errorMessage);
        reply(session, MessageType.ERROR, payload);
    }

    // === Netty Event Handlers ===

    /**
     * Registers the subscriber once the WebSocket handshake is done, so pushed
     * events never reach a channel that still speaks plain HTTP. Closes
     * subscribers that went silent past the read timeout.
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            sessionManager.createSession(ctx.channel());
        } else if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Connection idle timeout, closing: {}", ctx.channel().id());
                ctx.close();
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("WebSocket error", cause);
        ctx.close();
    }
}
