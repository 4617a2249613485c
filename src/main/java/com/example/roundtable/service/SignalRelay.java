package com.example.roundtable.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Store-and-forward for offer/answer/candidate payloads. Holds no session state and never looks inside
 * the payload. An absent destination means the message is dropped without telling anyone.
 */
@Component
public class SignalRelay {

    private static final Logger log = LoggerFactory.getLogger(SignalRelay.class);

    private final RoomBroadcaster broadcaster;

    public SignalRelay(RoomBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    /** @return true if the payload was handed to the destination transport */
    public boolean relay(SignalKind kind, String senderTransportId, String destinationTransportId, Object payload) {
        if (kind == null || destinationTransportId == null || destinationTransportId.isBlank()) return false;
        if (!broadcaster.isConnected(destinationTransportId)) {
            log.debug("Signal {} from {} dropped: {} not connected", kind.wireName(), senderTransportId, destinationTransportId);
            return false;
        }

        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "signal-relayed");
        frame.put("kind", kind.wireName());
        frame.put("from", senderTransportId);
        frame.put("payload", payload);
        return broadcaster.sendTo(destinationTransportId, frame);
    }
}
