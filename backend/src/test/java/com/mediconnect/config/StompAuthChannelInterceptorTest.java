package com.mediconnect.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

@ExtendWith(MockitoExtension.class)
@DisplayName("StompAuthChannelInterceptor Tests")
class StompAuthChannelInterceptorTest {

    @Mock
    private JwtDecoder jwtDecoder;

    @Mock
    private MessageChannel channel;

    @InjectMocks
    private StompAuthChannelInterceptor interceptor;

    private static Message<byte[]> frame(StompCommand command, String authorization) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(command);
        accessor.setSessionId("session-1");
        if (authorization != null) {
            accessor.setNativeHeader(StompAuthChannelInterceptor.AUTHORIZATION_HEADER, authorization);
        }
        accessor.setLeaveMutable(true);
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }

    private static Jwt jwt(String subject) {
        return Jwt.withTokenValue("token-1")
            .header("alg", "RS256")
            .subject(subject)
            .issuedAt(Instant.parse("2026-03-01T10:00:00Z"))
            .expiresAt(Instant.parse("2026-03-01T11:00:00Z"))
            .build();
    }

    @Test
    @DisplayName("Should make the token subject the session user on CONNECT")
    void shouldAuthenticateConnect() {
        // Arrange
        when(jwtDecoder.decode("token-1")).thenReturn(jwt("doc-1"));

        // Act
        Message<?> result = interceptor.preSend(frame(StompCommand.CONNECT, "Bearer token-1"), channel);

        // Assert
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(result, StompHeaderAccessor.class);
        assertThat(accessor.getUser()).isNotNull();
        assertThat(accessor.getUser().getName()).isEqualTo("doc-1");
    }

    @Test
    @DisplayName("Should refuse a CONNECT without a bearer token")
    void shouldRejectMissingToken() {
        assertThatThrownBy(() -> interceptor.preSend(frame(StompCommand.CONNECT, null), channel))
            .isInstanceOf(BadCredentialsException.class);
        assertThatThrownBy(() -> interceptor.preSend(frame(StompCommand.CONNECT, "Basic abc"), channel))
            .isInstanceOf(BadCredentialsException.class);
        verifyNoInteractions(jwtDecoder);
    }

    @Test
    @DisplayName("Should refuse a CONNECT whose token does not verify")
    void shouldRejectInvalidToken() {
        // Arrange
        when(jwtDecoder.decode("forged")).thenThrow(new BadJwtException("signature mismatch"));

        // Act & Assert
        assertThatThrownBy(() -> interceptor.preSend(frame(StompCommand.CONNECT, "Bearer forged"), channel))
            .isInstanceOf(BadCredentialsException.class);
    }

    @Test
    @DisplayName("Should pass frames other than CONNECT through untouched")
    void shouldIgnoreOtherFrames() {
        // Arrange
        Message<byte[]> send = frame(StompCommand.SEND, null);

        // Act
        Message<?> result = interceptor.preSend(send, channel);

        // Assert
        assertThat(result).isSameAs(send);
        verifyNoInteractions(jwtDecoder);
    }
}
