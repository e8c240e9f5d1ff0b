package com.mediconnect.controller;

import com.mediconnect.dto.ConsultationDTO;
import com.mediconnect.dto.MessageDTO;
import com.mediconnect.dto.ParticipantDTO;
import com.mediconnect.dto.RoomDTO;
import com.mediconnect.entity.ConsultationStatus;
import com.mediconnect.exception.ForbiddenOperationException;
import com.mediconnect.persistence.ConsultationFilter;
import com.mediconnect.room.SessionRegistry;
import com.mediconnect.service.ChatService;
import com.mediconnect.service.ConsultationRoomService;
import com.mediconnect.service.ConsultationService;
import com.mediconnect.service.RoomOpening;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/consultations")
@RequiredArgsConstructor
@Tag(name = "Consultations", description = "Telemedicine consultation management")
public class ConsultationController {

    private final ConsultationService consultationService;
    private final ConsultationRoomService roomService;
    private final ChatService chatService;
    private final SessionRegistry registry;

    @PostMapping
    @Operation(summary = "Schedule a consultation")
    public ResponseEntity<ConsultationDTO.Response> createConsultation(
            @AuthenticationPrincipal Jwt jwt,
            @RequestBody ConsultationDTO.CreateRequest request) {

        ConsultationDTO.Response response = consultationService.createConsultation(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    @Operation(summary = "Search consultations")
    public ResponseEntity<ConsultationDTO.PageResponse> listConsultations(
            @AuthenticationPrincipal Jwt jwt,
            @RequestParam(required = false) String patientId,
            @RequestParam(required = false) String doctorId,
            @RequestParam(required = false) ConsultationStatus status,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {

        String userId = userId(jwt);
        if (!isAdmin(jwt) && !userId.equals(patientId) && !userId.equals(doctorId)) {
            throw new ForbiddenOperationException("Filter by your own patientId or doctorId");
        }
        ConsultationFilter filter = ConsultationFilter.builder()
            .patientId(patientId)
            .doctorId(doctorId)
            .status(status)
            .from(from)
            .to(to)
            .build();
        return ResponseEntity.ok(consultationService.listConsultations(filter, page, size));
    }

    @GetMapping("/active")
    @Operation(summary = "Waiting and in-progress consultations of the calling doctor")
    public ResponseEntity<List<ConsultationDTO.Response>> getActiveConsultations(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(consultationService.getActiveConsultations(userId(jwt)));
    }

    @GetMapping("/upcoming")
    @Operation(summary = "Scheduled consultations of the caller within the next hours")
    public ResponseEntity<List<ConsultationDTO.Response>> getUpcomingConsultations(
            @AuthenticationPrincipal Jwt jwt,
            @RequestParam(defaultValue = "24") int hours) {
        return ResponseEntity.ok(consultationService.getUpcomingConsultations(userId(jwt), hours));
    }

    @GetMapping("/room/{roomId}")
    @Operation(summary = "Get consultation by room id")
    public ResponseEntity<ConsultationDTO.Response> getByRoomId(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String roomId) {
        return ResponseEntity.ok(consultationService.getByRoomId(roomId, userId(jwt), isAdmin(jwt)));
    }

    @GetMapping("/{consultationId}")
    @Operation(summary = "Get consultation details")
    public ResponseEntity<ConsultationDTO.Response> getConsultation(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID consultationId) {
        return ResponseEntity.ok(consultationService.getConsultation(consultationId, userId(jwt), isAdmin(jwt)));
    }

    @PostMapping("/{consultationId}/start")
    @Operation(summary = "Start a consultation")
    public ResponseEntity<ConsultationDTO.Response> startConsultation(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID consultationId) {
        return ResponseEntity.ok(consultationService.startConsultation(consultationId, userId(jwt), isAdmin(jwt)));
    }

    @PostMapping("/{consultationId}/end")
    @Operation(summary = "End a consultation")
    public ResponseEntity<ConsultationDTO.Response> endConsultation(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID consultationId) {
        return ResponseEntity.ok(consultationService.endConsultation(consultationId, userId(jwt), isAdmin(jwt)));
    }

    @PostMapping("/{consultationId}/cancel")
    @Operation(summary = "Cancel a consultation")
    public ResponseEntity<ConsultationDTO.Response> cancelConsultation(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID consultationId,
            @RequestBody ConsultationDTO.CancelRequest request) {
        return ResponseEntity.ok(consultationService.cancelConsultation(
            consultationId, request.getReason(), userId(jwt), isAdmin(jwt)));
    }

    @PatchMapping("/{consultationId}/clinical")
    @Operation(summary = "Record the clinical outcome of a completed consultation")
    public ResponseEntity<ConsultationDTO.Response> updateClinicalRecord(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID consultationId,
            @RequestBody ConsultationDTO.ClinicalUpdate update) {
        return ResponseEntity.ok(consultationService.updateClinicalRecord(
            consultationId, userId(jwt), isAdmin(jwt), update));
    }

    @PostMapping("/{consultationId}/room")
    @Operation(summary = "Open the live room and choose its transport")
    public ResponseEntity<RoomDTO.Response> openRoom(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID consultationId) {

        consultationService.getConsultation(consultationId, userId(jwt), isAdmin(jwt));
        RoomOpening opening = roomService.openRoom(consultationId);
        RoomDTO.Response response = RoomDTO.Response.builder()
            .roomId(opening.getRoomId())
            .consultationId(opening.getConsultationId())
            .transportMode(opening.getTransport().mode())
            .roomToken(opening.getTransport().roomToken())
            .created(opening.isCreated())
            .activeParticipants(registry.findRoom(opening.getRoomId())
                .map(room -> room.activeParticipantCount())
                .orElse(0))
            .warnings(opening.getWarnings())
            .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{consultationId}/messages")
    @Operation(summary = "Chat history")
    public ResponseEntity<List<MessageDTO.Response>> getMessages(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID consultationId) {

        consultationService.getConsultation(consultationId, userId(jwt), isAdmin(jwt));
        return ResponseEntity.ok(chatService.listMessages(consultationId));
    }

    @PostMapping("/{consultationId}/messages")
    @Operation(summary = "Post a chat message")
    public ResponseEntity<MessageDTO.Response> sendMessage(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID consultationId,
            @RequestBody MessageDTO.SendRequest request) {
        MessageDTO.Response response = chatService.send(consultationId, userId(jwt), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/{consultationId}/messages/{messageId}/read")
    @Operation(summary = "Mark a message as read")
    public ResponseEntity<MessageDTO.Response> markMessageRead(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID consultationId,
            @PathVariable UUID messageId) {

        consultationService.getConsultation(consultationId, userId(jwt), isAdmin(jwt));
        return ResponseEntity.ok(chatService.markRead(consultationId, messageId, userId(jwt)));
    }

    @GetMapping("/{consultationId}/participants")
    @Operation(summary = "Participants, live while the room is open")
    public ResponseEntity<List<ParticipantDTO.Response>> getParticipants(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID consultationId) {
        return ResponseEntity.ok(consultationService.getParticipants(consultationId, userId(jwt), isAdmin(jwt)));
    }

    @PostMapping("/{consultationId}/participants")
    @Operation(summary = "Invite a nurse or observer")
    public ResponseEntity<ParticipantDTO.Response> inviteParticipant(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID consultationId,
            @RequestBody ParticipantDTO.InviteRequest request) {
        ParticipantDTO.Response response = consultationService.inviteParticipant(
            consultationId, request, userId(jwt), isAdmin(jwt));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{consultationId}/participants/{participantId}/summary")
    @Operation(summary = "Presence and media summary of one participant")
    public ResponseEntity<ParticipantDTO.Summary> getParticipantSummary(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable UUID consultationId,
            @PathVariable String participantId) {
        return ResponseEntity.ok(consultationService.getParticipantSummary(
            consultationId, participantId, userId(jwt), isAdmin(jwt)));
    }

    private static String userId(Jwt jwt) {
        return jwt.getClaimAsString("sub");
    }

    private static boolean isAdmin(Jwt jwt) {
        return "ADMIN".equalsIgnoreCase(jwt.getClaimAsString("role"));
    }
}
