package com.mediconnect.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.mediconnect.dto.ConsultationDTO;
import com.mediconnect.dto.MessageDTO;
import com.mediconnect.dto.ParticipantDTO;
import com.mediconnect.dto.RoomEnvelope;
import com.mediconnect.entity.Consultation;
import com.mediconnect.entity.ConsultationMessage;
import com.mediconnect.entity.ConsultationParticipant;
import com.mediconnect.entity.ConsultationStatus;
import com.mediconnect.entity.MessageStatus;
import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.entity.ParticipantStatus;
import com.mediconnect.exception.ErrorCode;
import com.mediconnect.exception.ForbiddenOperationException;
import com.mediconnect.exception.RoomClosedException;
import com.mediconnect.exception.RoomNotFoundException;
import com.mediconnect.exception.TransportUnavailableException;
import com.mediconnect.room.RoomPolicy;
import com.mediconnect.support.ConsultationHarness;

@DisplayName("ConsultationRoomService Tests")
class ConsultationRoomServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-03T16:00:00Z");

    private ConsultationHarness harness;
    private ConsultationDTO.Response consultation;
    private String roomId;

    @BeforeEach
    void setUp() {
        harness = new ConsultationHarness(NOW);
        consultation = harness.schedule("pat-1", "doc-1", NOW);
        roomId = consultation.getRoomId();
    }

    private Consultation current() {
        return harness.lifecycle.require(consultation.getId());
    }

    @Nested
    @DisplayName("join")
    class JoinTests {

        @Test
        @DisplayName("Should move the consultation to WAITING, then IN_PROGRESS as patient and doctor arrive")
        void shouldDriveLifecycleFromJoins() {
            // Act
            JoinOutcome patient = harness.roomService.join(roomId, "pat-1", ParticipantRole.PATIENT, "conn-pat");
            ConsultationStatus afterPatient = current().getStatus();
            harness.clock.advance(Duration.ofMinutes(2));
            JoinOutcome doctor = harness.roomService.join(roomId, "doc-1", ParticipantRole.DOCTOR, "conn-doc");

            // Assert
            assertThat(patient.getStatus()).isEqualTo(ConsultationStatus.WAITING);
            assertThat(afterPatient).isEqualTo(ConsultationStatus.WAITING);
            assertThat(doctor.getStatus()).isEqualTo(ConsultationStatus.IN_PROGRESS);
            assertThat(current().getActualStartTime()).isEqualTo(NOW.plus(Duration.ofMinutes(2)));
            assertThat(harness.registry.activeParticipantCount(roomId)).isEqualTo(2);
        }

        @Test
        @DisplayName("Should answer the joiner first and then tell the others")
        void shouldAnnounceJoin() {
            // Act
            harness.roomService.join(roomId, "pat-1", ParticipantRole.PATIENT, "conn-pat");
            harness.roomService.join(roomId, "doc-1", ParticipantRole.DOCTOR, "conn-doc");

            // Assert
            assertThat(harness.gateway.typesFor("conn-pat"))
                .containsExactly(RoomEnvelope.Type.ROOM_JOINED, RoomEnvelope.Type.PARTICIPANT_JOINED);
            assertThat(harness.gateway.typesFor("conn-doc")).containsExactly(RoomEnvelope.Type.ROOM_JOINED);

            RoomEnvelope joined = harness.gateway.envelopesFor("conn-doc").get(0);
            assertThat(joined.getPayload().get("status").asText()).isEqualTo("IN_PROGRESS");
            assertThat(joined.getPayload().get("transportMode").asText()).isEqualTo("DIRECT");
            assertThat(joined.getPayload().get("participants")).hasSize(2);

            RoomEnvelope arrival = harness.gateway.last("conn-pat");
            assertThat(arrival.getPayload().get("userId").asText()).isEqualTo("doc-1");
            assertThat(arrival.getPayload().get("role").asText()).isEqualTo("DOCTOR");
        }

        @Test
        @DisplayName("Should reject joins to an unknown room")
        void shouldRejectUnknownRoom() {
            assertThatThrownBy(() -> harness.roomService.join("room-nope", "pat-1", ParticipantRole.PATIENT, "c"))
                .isInstanceOf(RoomNotFoundException.class);
        }

        @Test
        @DisplayName("Should reject joins once the consultation is cancelled")
        void shouldRejectJoinAfterCancel() {
            // Arrange
            harness.lifecycle.cancel(consultation.getId(), "rescheduled", "pat-1");

            // Act & Assert
            assertThatThrownBy(() -> harness.roomService.join(roomId, "pat-1", ParticipantRole.PATIENT, "c"))
                .isInstanceOf(RoomClosedException.class);
        }

        @Test
        @DisplayName("Should not let another user join as the doctor")
        void shouldRejectWrongDoctor() {
            // Act & Assert
            assertThatThrownBy(() -> harness.roomService.join(roomId, "doc-2", ParticipantRole.DOCTOR, "conn-doc2"))
                .isInstanceOf(ForbiddenOperationException.class);
            assertThat(harness.registry.findRoom(roomId)).isEmpty();
            assertThat(current().getStatus()).isEqualTo(ConsultationStatus.SCHEDULED);
            assertThat(current().getActualStartTime()).isNull();

            JoinOutcome doctor = harness.roomService.join(roomId, "doc-1", ParticipantRole.DOCTOR, "conn-doc");
            assertThat(doctor.getStatus()).isEqualTo(ConsultationStatus.IN_PROGRESS);
        }

        @Test
        @DisplayName("Should not let another user join as the patient")
        void shouldRejectWrongPatient() {
            // Arrange
            harness.roomService.join(roomId, "doc-1", ParticipantRole.DOCTOR, "conn-doc");

            // Act & Assert
            assertThatThrownBy(() -> harness.roomService.join(roomId, "pat-2", ParticipantRole.PATIENT, "conn-pat2"))
                .isInstanceOf(ForbiddenOperationException.class);
            assertThat(harness.registry.activeParticipantCount(roomId)).isEqualTo(1);
            assertThat(current().getPatientJoinedAt()).isNull();
        }

        @Test
        @DisplayName("Should not let the doctor take the patient slot")
        void shouldRejectDoctorAsPatient() {
            assertThatThrownBy(() -> harness.roomService.join(roomId, "doc-1", ParticipantRole.PATIENT, "conn-doc"))
                .isInstanceOf(ForbiddenOperationException.class);
        }

        @Test
        @DisplayName("Should admit a nurse only once invited")
        void shouldAdmitInvitedNurse() {
            // Arrange
            assertThatThrownBy(() -> harness.roomService.join(roomId, "nurse-1", ParticipantRole.NURSE, "conn-nurse"))
                .isInstanceOf(ForbiddenOperationException.class);
            harness.consultationService.inviteParticipant(consultation.getId(),
                new ParticipantDTO.InviteRequest("nurse-1", ParticipantRole.NURSE), "doc-1", false);

            // Act
            JoinOutcome nurse = harness.roomService.join(roomId, "nurse-1", ParticipantRole.NURSE, "conn-nurse");

            // Assert
            assertThat(nurse.getStatus()).isEqualTo(ConsultationStatus.WAITING);
            assertThat(harness.registry.activeParticipantCount(roomId)).isEqualTo(1);
            assertThatThrownBy(() -> harness.roomService.join(roomId, "nurse-1", ParticipantRole.OBSERVER, "conn-obs"))
                .isInstanceOf(ForbiddenOperationException.class);
        }

        @Test
        @DisplayName("Should refuse a join once the consultation was cancelled directly in the store")
        void shouldRejectJoinAfterExternalCancel() {
            // Arrange
            harness.store.modify(consultation.getId(), c -> {
                c.setStatus(ConsultationStatus.CANCELLED);
                c.setCancelledBy("admin-1");
            });

            // Act & Assert
            assertThatThrownBy(() -> harness.roomService.join(roomId, "pat-1", ParticipantRole.PATIENT, "conn-pat"))
                .isInstanceOf(RoomClosedException.class);
            assertThat(harness.store.stored(consultation.getId()).getStatus()).isEqualTo(ConsultationStatus.CANCELLED);
            assertThat(harness.registry.findRoom(roomId)).isEmpty();
        }

        @Test
        @DisplayName("Should undo the join when the consultation cannot be read")
        void shouldRollBackJoinWhenStoreUnreadable() {
            // Arrange
            harness.roomService.openRoom(consultation.getId());
            harness.store.setReadable(false);

            // Act & Assert
            assertThatThrownBy(() -> harness.roomService.join(roomId, "doc-1", ParticipantRole.DOCTOR, "conn-doc"))
                .isInstanceOf(IllegalStateException.class);
            assertThat(harness.registry.activeParticipantCount(roomId)).isZero();
            assertThat(harness.registry.findByConnection("conn-doc")).isEmpty();

            harness.store.setReadable(true);
            JoinOutcome doctor = harness.roomService.join(roomId, "doc-1", ParticipantRole.DOCTOR, "conn-doc");
            assertThat(doctor.getStatus()).isEqualTo(ConsultationStatus.IN_PROGRESS);
            assertThat(harness.registry.activeParticipantCount(roomId)).isEqualTo(1);
        }

        @Test
        @DisplayName("Should record the transport the room opened with")
        void shouldRecordTransport() {
            // Act
            harness.roomService.join(roomId, "pat-1", ParticipantRole.PATIENT, "conn-pat");

            // Assert
            assertThat(current().getTransportMode()).isEqualTo(Consultation.TransportMode.DIRECT);
        }
    }

    @Nested
    @DisplayName("openRoom")
    class OpenRoomTests {

        @Test
        @DisplayName("Should reuse the live room on a second open")
        void shouldReuseRoom() {
            // Act
            RoomOpening first = harness.roomService.openRoom(consultation.getId());
            RoomOpening second = harness.roomService.openRoom(consultation.getId());

            // Assert
            assertThat(first.isCreated()).isTrue();
            assertThat(second.isCreated()).isFalse();
            assertThat(second.getRoomId()).isEqualTo(first.getRoomId());
            assertThat(harness.registry.openRoomCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should open in direct mode with a warning when managed media fails")
        void shouldDegradeToDirect() {
            // Arrange
            when(harness.videoProvider.isConfigured()).thenReturn(true);
            when(harness.videoProvider.isHealthy()).thenReturn(true);
            when(harness.videoProvider.createManagedRoom(roomId)).thenThrow(new TransportUnavailableException("503"));

            // Act
            RoomOpening opening = harness.roomService.openRoom(consultation.getId());

            // Assert
            assertThat(opening.getTransport().mode()).isEqualTo(Consultation.TransportMode.DIRECT);
            assertThat(opening.getWarnings()).contains(ErrorCode.TRANSPORT_UNAVAILABLE);
        }

        @Test
        @DisplayName("Should never ask the video provider for a chat consultation")
        void shouldUseDirectForChat() {
            // Arrange
            ConsultationDTO.Response chat = harness.schedule("pat-2", "doc-2", NOW, Consultation.ConsultationType.CHAT);

            // Act
            RoomOpening opening = harness.roomService.openRoom(chat.getId());

            // Assert
            assertThat(opening.getTransport().mode()).isEqualTo(Consultation.TransportMode.DIRECT);
            verifyNoInteractions(harness.videoProvider);
        }
    }

    @Nested
    @DisplayName("Departures")
    class DepartureTests {

        @BeforeEach
        void joinBoth() {
            harness.roomService.join(roomId, "pat-1", ParticipantRole.PATIENT, "conn-pat");
            harness.roomService.join(roomId, "doc-1", ParticipantRole.DOCTOR, "conn-doc");
            harness.gateway.clear();
        }

        @Test
        @DisplayName("Should tell the others when a participant leaves")
        void shouldAnnounceLeave() {
            // Act
            harness.roomService.leave(roomId, "pat-1");

            // Assert
            assertThat(harness.gateway.typesFor("conn-doc")).containsExactly(RoomEnvelope.Type.PARTICIPANT_LEFT);
            assertThat(harness.gateway.typesFor("conn-pat")).isEmpty();
            assertThat(harness.registry.activeParticipantCount(roomId)).isEqualTo(1);
        }

        @Test
        @DisplayName("Should hold the slot of a dropped connection and resume it on rejoin")
        void shouldResumeAfterDrop() {
            // Act
            harness.roomService.connectionLost("conn-pat", "transport closed");
            harness.clock.advance(Duration.ofSeconds(30));
            JoinOutcome rejoin = harness.roomService.join(roomId, "pat-1", ParticipantRole.PATIENT, "conn-pat-2");

            // Assert
            assertThat(harness.gateway.typesFor("conn-doc"))
                .containsExactly(RoomEnvelope.Type.PARTICIPANT_DISCONNECTED, RoomEnvelope.Type.PARTICIPANT_JOINED);
            assertThat(rejoin.getHandle().isReconnected()).isTrue();
            assertThat(harness.gateway.envelopesFor("conn-pat-2").get(0).getPayload().get("reconnected").asBoolean())
                .isTrue();
            assertThat(current().getStatus()).isEqualTo(ConsultationStatus.IN_PROGRESS);
        }

        @Test
        @DisplayName("Should ignore a closed connection that was never bound")
        void shouldIgnoreUnknownConnection() {
            assertThat(harness.roomService.connectionLost("conn-unknown", "closed")).isEmpty();
        }

        @Test
        @DisplayName("Should close the room and record summaries when the consultation ends")
        void shouldCloseRoomOnEnd() {
            // Arrange
            harness.clock.advance(Duration.ofMinutes(12));

            // Act
            harness.consultationService.endConsultation(consultation.getId(), "doc-1", false);

            // Assert
            assertThat(harness.gateway.typesFor("conn-pat")).containsExactly(RoomEnvelope.Type.ROOM_CLOSED);
            assertThat(harness.gateway.typesFor("conn-doc")).containsExactly(RoomEnvelope.Type.ROOM_CLOSED);
            assertThat(harness.registry.findRoom(roomId)).isEmpty();
            List<ConsultationParticipant> rows = harness.store.findParticipants(consultation.getId());
            assertThat(rows).hasSize(2);
            assertThat(rows).extracting(ConsultationParticipant::getStatus).containsOnly(ParticipantStatus.LEFT);
            assertThat(rows).extracting(ConsultationParticipant::getDurationSeconds).containsOnly(720L);
        }
    }

    @Nested
    @DisplayName("Chat")
    class ChatTests {

        @Test
        @DisplayName("Should keep a message nobody received as SENT and replay it on the next join")
        void shouldReplayPendingMessages() throws Exception {
            // Arrange
            harness.roomService.join(roomId, "pat-1", ParticipantRole.PATIENT, "conn-pat");
            MessageDTO.Response sent = harness.chatService.sendFromRoom(roomId, "pat-1",
                MessageDTO.SendRequest.builder().content("I have a fever").build()).get();

            // Act
            harness.roomService.join(roomId, "doc-1", ParticipantRole.DOCTOR, "conn-doc");

            // Assert
            assertThat(sent.getStatus()).isEqualTo(MessageStatus.SENT);
            assertThat(harness.gateway.typesFor("conn-doc"))
                .containsExactly(RoomEnvelope.Type.ROOM_JOINED, RoomEnvelope.Type.CHAT_MESSAGE);
            ConsultationMessage stored = harness.store.findMessage(sent.getId()).orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(MessageStatus.DELIVERED);
        }

        @Test
        @DisplayName("Should mark a message delivered when someone receives it")
        void shouldDeliverLiveMessage() throws Exception {
            // Arrange
            harness.roomService.join(roomId, "pat-1", ParticipantRole.PATIENT, "conn-pat");
            harness.roomService.join(roomId, "doc-1", ParticipantRole.DOCTOR, "conn-doc");

            // Act
            MessageDTO.Response sent = harness.chatService.sendFromRoom(roomId, "doc-1",
                MessageDTO.SendRequest.builder().content("How long have you had it?").build()).get();

            // Assert
            assertThat(sent.getStatus()).isEqualTo(MessageStatus.DELIVERED);
            assertThat(sent.getSequence()).isPositive();
            assertThat(harness.gateway.last("conn-pat").getType()).isEqualTo(RoomEnvelope.Type.CHAT_MESSAGE);
        }

        @Test
        @DisplayName("Should advance a read receipt once and ignore repeats")
        void shouldMarkReadOnce() throws Exception {
            // Arrange
            harness.roomService.join(roomId, "pat-1", ParticipantRole.PATIENT, "conn-pat");
            harness.roomService.join(roomId, "doc-1", ParticipantRole.DOCTOR, "conn-doc");
            MessageDTO.Response sent = harness.chatService.sendFromRoom(roomId, "doc-1",
                MessageDTO.SendRequest.builder().content("Take paracetamol").build()).get();

            // Act
            MessageDTO.Response read = harness.chatService.markRead(consultation.getId(), sent.getId(), "pat-1");
            harness.clock.advance(Duration.ofMinutes(1));
            MessageDTO.Response again = harness.chatService.markRead(consultation.getId(), sent.getId(), "pat-1");

            // Assert
            assertThat(read.getStatus()).isEqualTo(MessageStatus.READ);
            assertThat(again.getStatus()).isEqualTo(MessageStatus.READ);
            assertThat(again.getReadAt()).isEqualTo(read.getReadAt());
        }
    }

    @Nested
    @DisplayName("Housekeeping")
    class HousekeepingTests {

        @Test
        @DisplayName("Should close a room that stayed empty past the grace period")
        void shouldSweepEmptyRoom() {
            // Arrange
            harness.roomService.join(roomId, "pat-1", ParticipantRole.PATIENT, "conn-pat");
            harness.roomService.leave(roomId, "pat-1");
            harness.clock.advance(RoomPolicy.DEFAULTS.getEmptyRoomGrace());

            // Act
            int closed = harness.roomService.sweepRooms();

            // Assert
            assertThat(closed).isEqualTo(1);
            assertThat(harness.registry.openRoomCount()).isZero();
            assertThat(current().getStatus()).isEqualTo(ConsultationStatus.WAITING);
        }

        @Test
        @DisplayName("Should mark overdue consultations nobody joined as no-shows")
        void shouldDetectNoShows() {
            // Arrange
            ConsultationDTO.Response joined = harness.schedule("pat-2", "doc-2", NOW);
            harness.roomService.join(joined.getRoomId(), "pat-2", ParticipantRole.PATIENT, "conn-pat-2");
            harness.clock.advance(Duration.ofMinutes(16));

            // Act
            int marked = harness.roomService.detectNoShows();

            // Assert
            assertThat(marked).isEqualTo(1);
            assertThat(current().getStatus()).isEqualTo(ConsultationStatus.NO_SHOW);
            assertThat(harness.lifecycle.require(joined.getId()).getStatus()).isEqualTo(ConsultationStatus.WAITING);
        }

        @Test
        @DisplayName("Should leave consultations scheduled in the future alone")
        void shouldIgnoreFutureConsultations() {
            // Arrange
            harness.schedule("pat-3", "doc-3", NOW.plus(Duration.ofHours(2)));
            harness.clock.advance(Duration.ofMinutes(16));

            // Act
            int marked = harness.roomService.detectNoShows();

            // Assert
            assertThat(marked).isEqualTo(1);
            assertThat(current().getStatus()).isEqualTo(ConsultationStatus.NO_SHOW);
        }
    }
}
