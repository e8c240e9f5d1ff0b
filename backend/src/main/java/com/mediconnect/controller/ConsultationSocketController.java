package com.mediconnect.controller;

import com.mediconnect.dto.RoomEnvelope;
import com.mediconnect.signaling.ConsultationMessageHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

/**
 * STOMP entry point. Clients send to {@code /app/consultation} and receive on
 * {@code /user/queue/consultation}. The sender is the user the connection authenticated as
 * on CONNECT.
 */
@Controller
@RequiredArgsConstructor
public class ConsultationSocketController {

    private final ConsultationMessageHandler handler;

    @MessageMapping("/consultation")
    public void onEnvelope(@Payload RoomEnvelope envelope, SimpMessageHeaderAccessor headers) {
        Principal user = headers.getUser();
        handler.handle(headers.getSessionId(), user != null ? user.getName() : null, envelope);
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        handler.onConnectionClosed(event.getSessionId());
    }
}
