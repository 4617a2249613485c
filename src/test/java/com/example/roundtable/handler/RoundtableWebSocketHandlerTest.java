package com.example.roundtable.handler;

import com.example.roundtable.model.CapacityExceededException;
import com.example.roundtable.model.ErrorCode;
import com.example.roundtable.model.RoundtableException;
import com.example.roundtable.service.RoomBroadcaster;
import com.example.roundtable.service.RoundtableEventLoop;
import com.example.roundtable.service.RoundtableService;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RoundtableWebSocketHandlerTest {

    private RoundtableService service;
    private RoomBroadcaster broadcaster;
    private RoundtableWebSocketHandler handler;
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        service = mock(RoundtableService.class);
        broadcaster = mock(RoomBroadcaster.class);
        RoundtableEventLoop loop = mock(RoundtableEventLoop.class);
        // run queued events inline
        doAnswer(inv -> {
            ((Runnable) inv.getArgument(0)).run();
            return null;
        }).when(loop).execute(any(Runnable.class));

        handler = new RoundtableWebSocketHandler(service, broadcaster, loop);
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
    }

    private void send(String payload) {
        handler.handleTextMessage(session, new TextMessage(payload));
    }

    @Test
    void open_readsIdentityAndAnonymousNameFromQuery() throws Exception {
        when(session.getUri()).thenReturn(new URI("ws://localhost/roundtable?userId=u-1&anonymousName=Quiet%20Owl"));

        handler.afterConnectionEstablished(session);

        verify(service).connect(session, "u-1", "Quiet Owl");
    }

    @Test
    void open_withoutQuery_passesNulls() throws Exception {
        when(session.getUri()).thenReturn(new URI("ws://localhost/roundtable"));
        handler.afterConnectionEstablished(session);
        verify(service).connect(session, null, null);
    }

    @Test
    void plainPing_answeredWithPong() {
        send("ping");
        verify(service).ping("s1");
    }

    @Test
    void malformedJson_rejectedToSenderOnly() {
        send("{not json");
        verify(broadcaster).error(eq("s1"), eq("error"), eq(ErrorCode.INVALID_EVENT), anyString());
        verifyNoInteractions(service);
    }

    @Test
    void frameWithoutType_rejected() {
        send("{\"roomId\":\"r1\"}");
        verify(broadcaster).error(eq("s1"), eq("error"), eq(ErrorCode.INVALID_EVENT), anyString());
    }

    @Test
    void unknownType_rejected() {
        send("{\"type\":\"dance\"}");
        verify(broadcaster).error(eq("s1"), eq("error"), eq(ErrorCode.INVALID_EVENT), contains("dance"));
    }

    @Test
    void joinRoomAlias_dispatchesJoin() {
        send("{\"type\":\"join-room\",\"roomId\":\"r1\",\"displayName\":\"Ann\",\"role\":\"speaker\"}");
        verify(service).join("s1", "r1", "Ann", "speaker");
    }

    @Test
    void joinFailure_repliedAsJoinError() {
        when(service.join(any(), any(), any(), any()))
                .thenThrow(new RoundtableException(ErrorCode.ROOM_LIMIT, "full"));

        send("{\"type\":\"join\",\"roomId\":\"r9\"}");

        verify(broadcaster).error("s1", "join-error", ErrorCode.ROOM_LIMIT, "full");
    }

    @Test
    void changeRoleFailure_repliedAsRoleError() {
        when(service.changeRole(any(), any(), any())).thenThrow(new CapacityExceededException(6));

        send("{\"type\":\"change-role\",\"identity\":\"u-2\",\"newRole\":\"speaker\"}");

        verify(service).changeRole("s1", "u-2", "speaker");
        verify(broadcaster).error(eq("s1"), eq("role-error"), eq(ErrorCode.CAPACITY_EXCEEDED), anyString());
    }

    @Test
    void userReadyAlias_defaultsToReady() {
        send("{\"type\":\"user-ready\"}");
        verify(service).setReady("s1", true);

        send("{\"type\":\"set-ready\",\"ready\":false}");
        verify(service).setReady("s1", false);
    }

    @Test
    void nextSpeakerAlias_notActive_repliedAsError() {
        doThrow(new RoundtableException(ErrorCode.NOT_ACTIVE, "idle")).when(service).advanceTurn("s1");

        send("{\"type\":\"next-speaker\"}");

        verify(broadcaster).error("s1", "error", ErrorCode.NOT_ACTIVE, "idle");
    }

    @Test
    void offerAlias_relaysOpaquePayload() {
        send("{\"type\":\"offer\",\"target\":\"s2\",\"payload\":{\"sdp\":\"v=0\"}}");

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(service).signal(eq("s1"), eq("offer"), eq("s2"), payload.capture());
        assertEquals("v=0", ((JsonNode) payload.getValue()).get("sdp").asText());
    }

    @Test
    void genericSignal_usesKindField() {
        send("{\"type\":\"signal\",\"kind\":\"candidate\",\"to\":\"s3\",\"data\":{\"c\":1}}");
        verify(service).signal(eq("s1"), eq("candidate"), eq("s3"), any());
    }

    @Test
    void leaveAndSync_dispatched() {
        send("{\"type\":\"leave-room\"}");
        send("{\"type\":\"request-sync\"}");
        verify(service).leave("s1");
        verify(service).requestSync("s1");
    }

    @Test
    void close_disconnectsTransport() {
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);
        verify(service).disconnect("s1");
    }

    @Test
    void unexpectedFailure_closesSocketWithServerError() throws Exception {
        doThrow(new IllegalStateException("boom")).when(service).setReady("s1", true);

        send("{\"type\":\"set-ready\"}");

        verify(session).close(CloseStatus.SERVER_ERROR);
        verify(broadcaster, never()).error(anyString(), anyString(), any(), anyString());
    }

    @Test
    void rejection_doesNotCloseSocket() throws Exception {
        doThrow(new RoundtableException(ErrorCode.NOT_IN_ROOM, "not in a room")).when(service).setReady("s1", true);

        send("{\"type\":\"set-ready\"}");

        verify(broadcaster).error("s1", "error", ErrorCode.NOT_IN_ROOM, "not in a room");
        verify(session, never()).close(any(CloseStatus.class));
    }

    @Test
    void parseQuery_decodesValues() throws Exception {
        Map<String, String> q = RoundtableWebSocketHandler.parseQuery(new URI("ws://h/x?userId=a%2Bb&displayName=J%C3%BCrgen"));
        assertEquals("a+b", q.get("userId"));
        assertEquals("Jürgen", q.get("displayName"));
    }
}
