package com.skyfinal.tactical;

import com.skyfinal.sink.EventSink;
import com.skyfinal.state.ChangeEvent;
import com.skyfinal.state.PlayerState;
import com.skyfinal.state.Snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns snapshot changes into tactical events and conclusions.
 *
 * Rules:
 * - PLAYER_DIED while exactly one player of the snapshot is dead: log a
 *   FIRST_DEATH event and conclude the entry engagement was lost.
 * - WEAPON_CHANGE to a premium weapon: conclusion only, no event.
 *
 * The first-death test counts against every player in the snapshot, so a
 * player missing from the feed (disconnect) is not counted as dead.
 *
 * Thread Safety:
 * - The poller thread writes, consumers read and clear from other threads
 * - All access to the log and the conclusions goes through this monitor
 * - Sink notifications happen outside the lock
 */
public class TacticalEventDetector {

    private static final Logger logger = LoggerFactory.getLogger(TacticalEventDetector.class);

    private final Set<String> premiumWeapons;
    private final int visibleCount;
    private final EventSink sink;
    private final Clock clock;

    private final List<TacticalEvent> eventLog = new ArrayList<>();
    // Insertion ordered, so the newest conclusion is always last
    private final Set<String> conclusions = new LinkedHashSet<>();

    public TacticalEventDetector(Set<String> premiumWeapons, int visibleCount, EventSink sink, Clock clock) {
        this.premiumWeapons = Set.copyOf(premiumWeapons);
        this.visibleCount = visibleCount;
        this.sink = sink;
        this.clock = clock;
    }

    public TacticalEventDetector(Set<String> premiumWeapons, int visibleCount, EventSink sink) {
        this(premiumWeapons, visibleCount, sink, Clock.systemUTC());
    }

    /**
     * Applies the pattern rules to one change.
     *
     * @param change   a change detected between the previous and current snapshot
     * @param snapshot the current snapshot the change was detected in
     */
    public void processChange(ChangeEvent change, Snapshot snapshot) {
        switch (change.getType()) {
            case PLAYER_DIED -> handleDeath(change.getPlayer(), snapshot);
            case WEAPON_CHANGE -> handleWeaponChange(change.getPlayer(), change.getNewWeapon());
        }
    }

    private void handleDeath(PlayerState player, Snapshot snapshot) {
        long aliveCount = snapshot.getAliveCount();
        int totalPlayers = snapshot.getPlayerCount();
        if (aliveCount != totalPlayers - 1) {
            return;
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("player", player.getPlayerName());
        metadata.put("team", player.getTeamName());
        metadata.put("position", player.getPosition().describe());
        metadata.put("side", player.getSide());

        TacticalEvent event = new TacticalEvent(
                TacticalEventType.FIRST_DEATH,
                clock.instant(),
                "First death of the round: " + player.getPlayerName() + " (" + player.getTeamName() + ")",
                metadata);

        synchronized (this) {
            eventLog.add(event);
        }
        logger.info("{}", event.getDescription());
        try {
            sink.onTacticalEvent(event);
        } catch (RuntimeException e) {
            logger.warn("Event sink rejected {}: {}", event.getType(), e.toString());
        }

        addConclusion("Entry engagement lost by " + player.getTeamName()
                + " at " + player.getPosition().getRegion() + ".");
    }

    private void handleWeaponChange(PlayerState player, String newWeapon) {
        if (premiumWeapons.contains(newWeapon)) {
            addConclusion(player.getPlayerName() + " upgraded to " + newWeapon + ". Strength increased.");
        }
    }

    private void addConclusion(String text) {
        boolean added;
        synchronized (this) {
            added = conclusions.add(text);
        }
        if (added) {
            logger.info("Tactical conclusion: {}", text);
            try {
                sink.onConclusion(text);
            } catch (RuntimeException e) {
                logger.warn("Event sink rejected conclusion: {}", e.toString());
            }
        }
    }

    /**
     * Returns the most recent conclusions, oldest first.
     */
    public synchronized List<String> getTacticalConclusions() {
        return lastN(new ArrayList<>(conclusions));
    }

    /**
     * Returns the most recent events, oldest first.
     */
    public synchronized List<TacticalEvent> getLatestEvents() {
        return lastN(eventLog);
    }

    /**
     * Returns every event logged since the last {@link #clearEventLog()}.
     */
    public synchronized List<TacticalEvent> getEventLog() {
        return Collections.unmodifiableList(new ArrayList<>(eventLog));
    }

    /**
     * Returns every logged event and empties the log in one step.
     */
    public synchronized List<TacticalEvent> drainEvents() {
        List<TacticalEvent> drained = new ArrayList<>(eventLog);
        eventLog.clear();
        return Collections.unmodifiableList(drained);
    }

    /**
     * Empties the event log. Consumers call this once they have drained the
     * events they care about; nothing expires on its own.
     */
    public synchronized void clearEventLog() {
        eventLog.clear();
    }

    private <T> List<T> lastN(List<T> items) {
        int from = Math.max(0, items.size() - visibleCount);
        return Collections.unmodifiableList(new ArrayList<>(items.subList(from, items.size())));
    }
}
