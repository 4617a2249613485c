package com.example.roundtable.model;

public enum DiscussionStatus {
    IDLE,
    ACTIVE,
    ENDED
}
