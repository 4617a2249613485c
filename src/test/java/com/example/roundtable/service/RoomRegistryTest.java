package com.example.roundtable.service;

import com.example.roundtable.config.RoundtableProperties;
import com.example.roundtable.config.RoundtableProperties.AdvancePolicy;
import com.example.roundtable.model.ErrorCode;
import com.example.roundtable.model.Room;
import com.example.roundtable.model.RoundtableException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RoomRegistryTest {

    private final RoomRegistry registry =
            new RoomRegistry(new RoundtableProperties(1, 4, 30, 3, 2, AdvancePolicy.ANYONE, null));

    @Test
    void getOrCreate_isIdempotent_andUsesConfiguredRules() {
        Room a = registry.getOrCreate("r1");
        assertSame(a, registry.getOrCreate("r1"));
        assertEquals(4, a.getMaxSpeakers());
        assertEquals(30, a.getDiscussion().getTurnDurationSeconds());
        assertEquals(1, registry.size());
    }

    @Test
    void roomLimit_rejectsNewRoomsOnly() {
        registry.getOrCreate("r1");
        registry.getOrCreate("r2");

        RoundtableException ex = assertThrows(RoundtableException.class, () -> registry.getOrCreate("r3"));
        assertEquals(ErrorCode.ROOM_LIMIT, ex.getCode());
        assertNotNull(registry.getOrCreate("r2"));
    }

    @Test
    void destroy_closesRoom_cancelsCountdown_andFreesSlot() {
        Room r = registry.getOrCreate("r1");
        ScheduledFuture<?> timer = mock(ScheduledFuture.class);
        r.getDiscussion().replaceTimer(timer);

        registry.destroy(r);

        assertTrue(r.isClosed());
        assertTrue(registry.find("r1").isEmpty());
        verify(timer).cancel(false);
        assertNotSame(r, registry.getOrCreate("r1"), "A later join starts from a fresh room");
    }
}
