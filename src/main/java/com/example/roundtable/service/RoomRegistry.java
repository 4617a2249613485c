package com.example.roundtable.service;

import com.example.roundtable.config.RoundtableProperties;
import com.example.roundtable.model.ErrorCode;
import com.example.roundtable.model.Room;
import com.example.roundtable.model.RoundtableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Live rooms by id. A room is created by its first join and freed when its roster empties.
 * Accessed from the event loop only.
 */
@Component
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final RoundtableProperties props;
    private final Map<String, Room> rooms = new LinkedHashMap<>();

    public RoomRegistry(RoundtableProperties props) {
        this.props = props;
    }

    public Optional<Room> find(String roomId) {
        if (roomId == null) return Optional.empty();
        return Optional.ofNullable(rooms.get(roomId));
    }

    /**
     * @throws RoundtableException ROOM_LIMIT when a new room would exceed the configured bound
     */
    public Room getOrCreate(String roomId) {
        Room existing = rooms.get(roomId);
        if (existing != null) return existing;
        if (rooms.size() >= props.maxRooms()) {
            throw new RoundtableException(ErrorCode.ROOM_LIMIT,
                    "Server is at its limit of " + props.maxRooms() + " rooms");
        }
        Room room = new Room(roomId, props.turnDurationSeconds(), props.maxSpeakers());
        rooms.put(room.getCode(), room);
        log.info("Room created: {} (live rooms={})", room.getCode(), rooms.size());
        return room;
    }

    /** Drops the room and cancels its countdown. Later callbacks see {@link Room#isClosed()}. */
    public void destroy(Room room) {
        if (room == null) return;
        room.getDiscussion().cancelTimer();
        room.markClosed();
        if (rooms.remove(room.getCode(), room)) {
            log.info("Room destroyed: {} (live rooms={})", room.getCode(), rooms.size());
        }
    }

    public Collection<Room> all() {
        return new ArrayList<>(rooms.values());
    }

    public int size() {
        return rooms.size();
    }
}
