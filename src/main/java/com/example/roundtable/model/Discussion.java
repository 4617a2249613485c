package com.example.roundtable.model;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Per-room discussion state driven by DiscussionEngine.
 * Holds the handle of the room's single countdown; replacing the handle always cancels the previous one.
 * Only touched from the event loop thread, so no locking here.
 */
public class Discussion {

    public static final int NO_SPEAKER = -1;

    private final int turnDurationSeconds;

    private DiscussionStatus status = DiscussionStatus.IDLE;
    private Topic topic;
    private int speakerIndex = NO_SPEAKER;
    private int timeRemaining = 0;
    private int round = 1;

    /** True while a topic request is in flight (start already decided, not yet applied). */
    private boolean starting = false;

    private Instant startedAt;
    private Instant endedAt;

    private ScheduledFuture<?> timer;
    /** Bumped on every turn so ticks scheduled for an older turn can recognise themselves as stale. */
    private long turnSeq = 0;

    public Discussion(int turnDurationSeconds) {
        this.turnDurationSeconds = Math.max(1, turnDurationSeconds);
    }

    // --- lifecycle ---

    public DiscussionStatus getStatus() { return status; }
    public boolean isActive() { return status == DiscussionStatus.ACTIVE; }
    public boolean isIdle() { return status == DiscussionStatus.IDLE; }
    public boolean isEnded() { return status == DiscussionStatus.ENDED; }

    public boolean isStarting() { return starting; }
    public void setStarting(boolean starting) { this.starting = starting; }

    /** Idle -> Active. The caller guarantees a non-empty roster. */
    public void activate(Topic topic, Instant now) {
        if (status != DiscussionStatus.IDLE) {
            throw new IllegalStateException("Cannot start discussion in state " + status);
        }
        this.topic = Objects.requireNonNull(topic, "topic");
        this.status = DiscussionStatus.ACTIVE;
        this.starting = false;
        this.round = 1;
        this.speakerIndex = 0;
        this.timeRemaining = turnDurationSeconds;
        this.startedAt = now;
        this.endedAt = null;
    }

    /** Active -> Ended. Cancels the countdown; keeps topic/round for reporting. */
    public void end(Instant now) {
        cancelTimer();
        this.status = DiscussionStatus.ENDED;
        this.starting = false;
        this.speakerIndex = NO_SPEAKER;
        this.timeRemaining = 0;
        this.endedAt = now;
    }

    // --- turn state ---

    public Topic getTopic() { return topic; }

    public int getSpeakerIndex() { return speakerIndex; }
    public void setSpeakerIndex(int speakerIndex) { this.speakerIndex = speakerIndex; }

    public int getTimeRemaining() { return timeRemaining; }
    public void setTimeRemaining(int timeRemaining) { this.timeRemaining = timeRemaining; }
    public int decrementTimeRemaining() { return --timeRemaining; }
    public void resetTimeRemaining() { this.timeRemaining = turnDurationSeconds; }

    public int getRound() { return round; }
    public void incrementRound() { this.round++; }

    public int getTurnDurationSeconds() { return turnDurationSeconds; }

    public Instant getStartedAt() { return startedAt; }
    public Instant getEndedAt() { return endedAt; }

    // --- countdown handle ---

    public long getTurnSeq() { return turnSeq; }

    /** Starts a new turn: bumps the sequence, cancels the old countdown. Returns the new sequence. */
    public long nextTurn() {
        cancelTimer();
        return ++turnSeq;
    }

    public void replaceTimer(ScheduledFuture<?> next) {
        ScheduledFuture<?> prev = this.timer;
        this.timer = next;
        if (prev != null && prev != next) prev.cancel(false);
    }

    public void cancelTimer() {
        ScheduledFuture<?> prev = this.timer;
        this.timer = null;
        if (prev != null) prev.cancel(false);
    }

    public boolean hasTimer() {
        return timer != null && !timer.isDone();
    }

    @Override
    public String toString() {
        return "Discussion{" +
                "status=" + status +
                ", speakerIndex=" + speakerIndex +
                ", timeRemaining=" + timeRemaining +
                ", round=" + round +
                ", turnSeq=" + turnSeq +
                '}';
    }
}
