package com.example.roundtable.model;

/** Thrown when a role change would exceed the room's speaker slots. */
public class CapacityExceededException extends RoundtableException {

    private final int maxSpeakers;

    public CapacityExceededException(int maxSpeakers) {
        super(ErrorCode.CAPACITY_EXCEEDED, "All " + maxSpeakers + " speaker slots are taken");
        this.maxSpeakers = maxSpeakers;
    }

    public int getMaxSpeakers() {
        return maxSpeakers;
    }
}
