package com.example.roundtable.service;

import com.example.roundtable.model.Participant;
import com.example.roundtable.model.Room;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RoomBroadcasterTest {

    private final RoomBroadcaster broadcaster = new RoomBroadcaster();

    private WebSocketSession session(String id) {
        WebSocketSession s = mock(WebSocketSession.class);
        when(s.getId()).thenReturn(id);
        when(s.isOpen()).thenReturn(true);
        broadcaster.register(s);
        return s;
    }

    @Test
    void broadcast_reachesRosterTransportsOnly() throws Exception {
        WebSocketSession a = session("ta");
        WebSocketSession b = session("tb");
        WebSocketSession outsider = session("tx");
        Room room = new Room("r1", 60, 6);
        room.add(new Participant("a", "ta", "A"));
        room.add(new Participant("b", "tb", "B"));

        broadcaster.rosterChanged(room);

        verify(a).sendMessage(any(TextMessage.class));
        verify(b).sendMessage(any(TextMessage.class));
        verify(outsider, never()).sendMessage(any());
    }

    @Test
    void failedSend_dropsTransport() throws Exception {
        WebSocketSession a = session("ta");
        doThrow(new IOException("broken pipe")).when(a).sendMessage(any());

        assertFalse(broadcaster.sendTo("ta", Map.of("type", "tick")));
        assertFalse(broadcaster.isConnected("ta"));
        assertEquals(0, broadcaster.connectedCount());
    }

    @Test
    void runtimeFailureOnSend_dropsTransportWithoutThrowing() throws Exception {
        WebSocketSession a = session("ta");
        WebSocketSession b = session("tb");
        doThrow(new IllegalStateException("closing")).when(a).sendMessage(any());
        Room room = new Room("r1", 60, 6);
        room.add(new Participant("a", "ta", "A"));
        room.add(new Participant("b", "tb", "B"));

        assertDoesNotThrow(() -> broadcaster.tick(room));

        verify(b).sendMessage(any(TextMessage.class));
        assertFalse(broadcaster.isConnected("ta"));
    }

    @Test
    void closedSession_isNotConnected() {
        WebSocketSession a = session("ta");
        when(a.isOpen()).thenReturn(false);

        assertFalse(broadcaster.isConnected("ta"));
        assertFalse(broadcaster.sendTo("ta", Map.of("type", "pong")));
    }

    @Test
    void participantView_usesWireNames() {
        Participant p = new Participant("a", "ta", "Ann");
        p.setReady(true);
        Map<String, Object> v = RoomBroadcaster.participantView(p);
        assertEquals("a", v.get("id"));
        assertEquals("listener", v.get("role"));
        assertEquals(true, v.get("isReady"));
    }
}
