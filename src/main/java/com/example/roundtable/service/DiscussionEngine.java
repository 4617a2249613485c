package com.example.roundtable.service;

import com.example.roundtable.analytics.DiscussionSummary;
import com.example.roundtable.analytics.SessionAnalytics;
import com.example.roundtable.config.RoundtableProperties;
import com.example.roundtable.model.*;
import com.example.roundtable.topic.FallbackTopics;
import com.example.roundtable.topic.TopicService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Discussion state machine: Idle -> Active -> Ended.
 * Starts a discussion once enough ready participants are present, rotates the speaker on a one-second
 * countdown, counts rounds and ends after the last round or when the room drops under the minimum.
 * Every entry point runs on the roundtable loop; ticks re-check the room before acting.
 */
@Service
public class DiscussionEngine {

    private static final Logger log = LoggerFactory.getLogger(DiscussionEngine.class);

    public static final String END_ROUNDS_COMPLETE = "rounds-complete";
    public static final String END_NOT_ENOUGH_PARTICIPANTS = "not-enough-participants";

    private final RoundtableProperties props;
    private final TopicService topics;
    private final SessionAnalytics analytics;
    private final RoomBroadcaster broadcaster;
    private final ScheduledExecutorService timers;
    private final Executor events;
    private final Clock clock;

    @Autowired
    public DiscussionEngine(RoundtableProperties props,
                            TopicService topics,
                            SessionAnalytics analytics,
                            RoomBroadcaster broadcaster,
                            RoundtableEventLoop loop) {
        this(props, topics, analytics, broadcaster, loop.scheduler(), loop, Clock.systemUTC());
    }

    /** Explicit timer/event executors (tests drive the countdown by hand). */
    DiscussionEngine(RoundtableProperties props,
                     TopicService topics,
                     SessionAnalytics analytics,
                     RoomBroadcaster broadcaster,
                     ScheduledExecutorService timers,
                     Executor events,
                     Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.topics = Objects.requireNonNull(topics, "topics");
        this.analytics = Objects.requireNonNull(analytics, "analytics");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.timers = Objects.requireNonNull(timers, "timers");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ========================================================================
    //  IDLE -> ACTIVE
    // ========================================================================

    public boolean startConditionsMet(Room room) {
        int min = props.minParticipants();
        return room.size() >= min && room.readyCount() >= min;
    }

    /**
     * Re-evaluated after every roster mutation. Requests a topic when the room qualifies; the discussion
     * becomes Active once the topic arrives (fallback included) and the room still qualifies.
     *
     * @return true if a start was initiated by this call
     */
    public boolean evaluateStart(Room room) {
        Discussion d = room.getDiscussion();
        if (room.isClosed() || !d.isIdle() || d.isStarting()) return false;
        if (!startConditionsMet(room)) return false;

        d.setStarting(true);
        log.info("Starting discussion in room {} ({} participants, {} ready)",
                room.getCode(), room.size(), room.readyCount());

        topics.nextTopic().whenCompleteAsync((topic, ex) -> {
            Topic chosen = topic;
            if (ex != null || chosen == null) {
                log.warn("No topic for room {} ({}), using fallback", room.getCode(), ex == null ? "empty" : ex.toString());
                chosen = FallbackTopics.random();
            }
            try {
                activate(room, chosen);
            } catch (RuntimeException e) {
                log.error("Discussion start failed in room {}", room.getCode(), e);
                if (d.isIdle()) d.setStarting(false);
            }
        }, events);
        return true;
    }

    private void activate(Room room, Topic topic) {
        Discussion d = room.getDiscussion();
        if (room.isClosed() || !d.isIdle()) {
            d.setStarting(false);
            return;
        }
        if (!startConditionsMet(room)) {
            d.setStarting(false);
            log.info("Discussion start in room {} abandoned: room no longer qualifies", room.getCode());
            return;
        }

        d.activate(topic, clock.instant());
        startCountdown(room);
        analytics.recordTopicUsage(topic);
        broadcaster.discussionStarted(room);
        log.info("Discussion started in room {}: topic='{}', first speaker={}",
                room.getCode(), topic.title(), room.currentSpeaker().map(Participant::getIdentity).orElse(null));
    }

    // ========================================================================
    //  TURNS
    // ========================================================================

    /**
     * Explicit advance requested by a participant.
     *
     * @throws RoundtableException NOT_ACTIVE, or NOT_CURRENT_SPEAKER under the CURRENT_SPEAKER policy
     */
    public void advanceTurn(Room room, Participant actor) {
        Discussion d = room.getDiscussion();
        if (!d.isActive()) {
            throw new RoundtableException(ErrorCode.NOT_ACTIVE, "No discussion is running in room " + room.getCode());
        }
        if (props.advancePolicy() == RoundtableProperties.AdvancePolicy.CURRENT_SPEAKER) {
            String speaker = room.currentSpeaker().map(Participant::getIdentity).orElse(null);
            if (actor == null || !Objects.equals(speaker, actor.getIdentity())) {
                throw new RoundtableException(ErrorCode.NOT_CURRENT_SPEAKER, "Only the current speaker can pass the turn");
            }
        }
        log.debug("Turn advanced in room {} by {}", room.getCode(), actor == null ? null : actor.getIdentity());
        rotate(room);
    }

    /** Countdown callback. Acts only if the room is live, Active and still on the turn it was scheduled for. */
    void tick(Room room, long turnSeq) {
        Discussion d = room.getDiscussion();
        if (room.isClosed() || !d.isActive() || d.getTurnSeq() != turnSeq) {
            log.debug("Stale tick ignored (room={}, seq={}, current={})", room.getCode(), turnSeq, d.getTurnSeq());
            return;
        }
        if (room.isEmpty()) {
            end(room, END_NOT_ENOUGH_PARTICIPANTS);
            return;
        }
        clampSpeakerIndex(room);

        int left = d.decrementTimeRemaining();
        broadcaster.tick(room);
        if (left <= 0) rotate(room);
    }

    /** Turn expiry and explicit advance share this path. */
    private void rotate(Room room) {
        Discussion d = room.getDiscussion();
        if (!d.isActive()) return;
        if (room.isEmpty()) {
            end(room, END_NOT_ENOUGH_PARTICIPANTS);
            return;
        }
        d.cancelTimer();

        int next = (Math.floorMod(d.getSpeakerIndex(), room.size()) + 1) % room.size();
        d.setSpeakerIndex(next);
        if (next == 0 && completeRound(room)) return;

        beginTurn(room);
    }

    /** Counts a wrap to index 0. Returns true if that ended the discussion. */
    private boolean completeRound(Room room) {
        Discussion d = room.getDiscussion();
        d.incrementRound();
        if (d.getRound() > props.maxRounds()) {
            end(room, END_ROUNDS_COMPLETE);
            return true;
        }
        return false;
    }

    private void beginTurn(Room room) {
        Discussion d = room.getDiscussion();
        d.resetTimeRemaining();
        broadcaster.speakerChanged(room);
        startCountdown(room);
    }

    /** One countdown per room: a new one always replaces (and cancels) the previous handle. */
    private void startCountdown(Room room) {
        Discussion d = room.getDiscussion();
        long seq = d.nextTurn();
        ScheduledFuture<?> f = timers.scheduleAtFixedRate(() -> {
            // a throw here would cancel every later run of this countdown
            try {
                tick(room, seq);
            } catch (RuntimeException e) {
                log.error("Countdown tick failed in room {} (seq={})", room.getCode(), seq, e);
            }
        }, 1, 1, TimeUnit.SECONDS);
        d.replaceTimer(f);
    }

    private void clampSpeakerIndex(Room room) {
        Discussion d = room.getDiscussion();
        int idx = d.getSpeakerIndex();
        if (idx < 0 || idx >= room.size()) {
            int clamped = Math.floorMod(idx, room.size());
            log.warn("Speaker index {} out of range in room {} (size {}), clamped to {}", idx, room.getCode(), room.size(), clamped);
            d.setSpeakerIndex(clamped);
        }
    }

    // ========================================================================
    //  ROSTER RECONCILIATION
    // ========================================================================

    /**
     * Re-anchors the speaker after a removal at {@code removedIndex}. Ends the discussion when the room drops
     * under the minimum. If the current speaker left, whoever now holds the slot speaks at once with a full turn.
     */
    public void onParticipantRemoved(Room room, int removedIndex) {
        Discussion d = room.getDiscussion();
        if (!d.isActive()) return;

        if (room.isEmpty() || room.size() < props.minParticipants()) {
            log.info("Not enough participants in room {} ({}), ending discussion", room.getCode(), room.size());
            end(room, END_NOT_ENOUGH_PARTICIPANTS);
            return;
        }

        int cur = d.getSpeakerIndex();
        if (removedIndex < 0 || removedIndex > cur) {
            clampSpeakerIndex(room);
            return;
        }
        if (removedIndex < cur) {
            // same speaker, shifted one slot left; countdown keeps running
            d.setSpeakerIndex(cur - 1);
            return;
        }

        // the current speaker left
        d.cancelTimer();
        if (cur >= room.size()) {
            d.setSpeakerIndex(0);
            if (completeRound(room)) return;
        } else {
            d.setSpeakerIndex(cur);
        }
        beginTurn(room);
    }

    // ========================================================================
    //  ACTIVE -> ENDED
    // ========================================================================

    public void end(Room room, String reason) {
        Discussion d = room.getDiscussion();
        if (!d.isActive()) return;

        int participants = room.size();
        Instant now = clock.instant();
        d.end(now);

        broadcaster.discussionEnded(room, reason);

        long duration = d.getStartedAt() == null ? 0 : Duration.between(d.getStartedAt(), now).getSeconds();
        Topic topic = d.getTopic();
        analytics.recordSession(new DiscussionSummary(
                UUID.randomUUID().toString(),
                room.getCode(),
                topic == null ? null : topic.title(),
                topic == null ? null : topic.category(),
                participants,
                d.getStartedAt(),
                now,
                duration,
                Math.max(0, d.getRound() - 1),
                reason));

        log.info("Discussion ended in room {} ({}, rounds completed={}, {}s)",
                room.getCode(), reason, Math.max(0, d.getRound() - 1), duration);
    }
}
