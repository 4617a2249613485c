package com.example.roundtable.model;

/** Reply codes sent to the offending client; never broadcast. */
public enum ErrorCode {
    INVALID_EVENT,
    NOT_IN_ROOM,
    INVALID_ROLE,
    CAPACITY_EXCEEDED,
    ROOM_LIMIT,
    NOT_ACTIVE,
    NOT_CURRENT_SPEAKER
}
