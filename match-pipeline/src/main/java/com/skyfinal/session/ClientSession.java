package com.skyfinal.session;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Represents one connected event subscriber.
 *
 * Thread Safety:
 * - Session ID and channel are immutable after creation
 * - Netty queues writes, so send() may be called from any thread
 */
public class ClientSession {

    private final String sessionId;
    private final Channel channel;
    private final long connectedAt;
    private final AtomicLong messagesSent;

    public ClientSession(Channel channel) {
        this.sessionId = UUID.randomUUID().toString();
        this.channel = channel;
        this.connectedAt = System.currentTimeMillis();
        this.messagesSent = new AtomicLong();
    }

    public String getSessionId() {
        return sessionId;
    }

    public Channel getChannel() {
        return channel;
    }

    public long getConnectedAt() {
        return connectedAt;
    }

    public long getMessagesSent() {
        return messagesSent.get();
    }

    /**
     * Sends a text message to this subscriber. Dropped silently if the
     * channel has already closed.
     */
    public void send(String message) {
        if (isActive()) {
            channel.writeAndFlush(new TextWebSocketFrame(message));
            messagesSent.incrementAndGet();
        }
    }

    public boolean isActive() {
        return channel != null && channel.isActive();
    }

    @Override
    public String toString() {
        return "ClientSession{" +
                "sessionId='" + sessionId + '\'' +
                ", active=" + isActive() +
                ", sent=" + messagesSent.get() +
                '}';
    }
}
