package com.skyfinal.session;

import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks all connected subscribers.
 *
 * Thread Safety:
 * - Netty worker threads add and remove sessions
 * - The pipeline threads iterate them when broadcasting
 * - ConcurrentHashMap makes both safe without external locking
 */
public class SessionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    // Channel ID -> session, for lookups from Netty handlers
    private final Map<String, ClientSession> sessionsByChannelId;

    public SessionManager() {
        this.sessionsByChannelId = new ConcurrentHashMap<>();
    }

    public ClientSession createSession(Channel channel) {
        ClientSession session = new ClientSession(channel);
        sessionsByChannelId.put(channel.id().asLongText(), session);

        logger.info("Subscriber connected: {}", session.getSessionId());
        logger.debug("Total subscribers: {}", sessionsByChannelId.size());
        return session;
    }

    /**
     * @return the removed session, or null if the channel had none
     */
    public ClientSession removeSession(Channel channel) {
        ClientSession session = sessionsByChannelId.remove(channel.id().asLongText());
        if (session != null) {
            logger.info("Subscriber disconnected: {}", session.getSessionId());
            logger.debug("Total subscribers: {}", sessionsByChannelId.size());
        }
        return session;
    }

    public ClientSession getSessionByChannel(Channel channel) {
        return sessionsByChannelId.get(channel.id().asLongText());
    }

    /**
     * Returns a weakly consistent view; sessions may come and go while iterating.
     */
    public Collection<ClientSession> getAllSessions() {
        return sessionsByChannelId.values();
    }

    public int getSessionCount() {
        return sessionsByChannelId.size();
    }
}
