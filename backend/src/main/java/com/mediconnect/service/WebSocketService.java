package com.mediconnect.service;

import com.mediconnect.dto.RoomEnvelope;
import com.mediconnect.lifecycle.ConsultationTerminatedEvent;
import com.mediconnect.signaling.ConnectionGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class WebSocketService implements ConnectionGateway {

    static final String CONSULTATION_QUEUE = "/queue/consultation";

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Send to one STOMP session, addressed by its session id
     */
    @Override
    public void send(String connectionId, RoomEnvelope envelope) {
        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headers.setSessionId(connectionId);
        headers.setLeaveMutable(true);
        messagingTemplate.convertAndSendToUser(connectionId, CONSULTATION_QUEUE, envelope, headers.getMessageHeaders());
        log.debug("Sent {} to connection: {}", envelope.getType(), connectionId);
    }

    /**
     * Notify status subscribers that a consultation ended
     */
    @EventListener
    public void notifyConsultationEnded(ConsultationTerminatedEvent event) {
        String destination = "/topic/consultation/" + event.getConsultationId() + "/status";
        messagingTemplate.convertAndSend(destination,
            Map.of("status", event.getStatus().name(), "roomId", event.getRoomId()));
    }
}
