package com.mediconnect.persistence;

import com.mediconnect.entity.Consultation;
import com.mediconnect.entity.ConsultationMessage;
import com.mediconnect.entity.ConsultationParticipant;
import com.mediconnect.entity.ConsultationStatus;
import com.mediconnect.entity.MessageStatus;
import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.entity.ParticipantStatus;
import com.mediconnect.exception.MessageNotFoundException;
import com.mediconnect.repository.ConsultationMessageRepository;
import com.mediconnect.repository.ConsultationParticipantRepository;
import com.mediconnect.repository.ConsultationRepository;
import com.mediconnect.room.ConnectionEvent;
import com.mediconnect.room.ParticipantSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
@Slf4j
public class JpaConsultationStore implements ConsultationStore {

    private static final Instant SEARCH_FLOOR = Instant.EPOCH;
    private static final Instant SEARCH_CEILING = LocalDate.of(9999, 12, 31).atStartOfDay().toInstant(ZoneOffset.UTC);

    private final ConsultationRepository consultationRepository;
    private final ConsultationMessageRepository messageRepository;
    private final ConsultationParticipantRepository participantRepository;

    @Override
    @Transactional
    public Consultation saveConsultation(Consultation consultation) {
        if (consultation.getVersion() == null) {
            Optional<Consultation> stored = consultationRepository.findById(consultation.getId());
            if (stored.isPresent()) {
                log.debug("Consultation {} already inserted", consultation.getId());
                return stored.get();
            }
        }
        return consultationRepository.saveAndFlush(consultation);
    }

    @Override
    @Transactional
    public Consultation updateConsultationStatus(Consultation consultation) {
        Optional<Consultation> stored = consultationRepository.findById(consultation.getId());
        if (stored.isEmpty()) {
            return consultationRepository.saveAndFlush(consultation);
        }
        Consultation row = stored.get();
        if (!Objects.equals(row.getVersion(), consultation.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(Consultation.class, consultation.getId());
        }
        row.setStatus(consultation.getStatus());
        row.setActualStartTime(consultation.getActualStartTime());
        row.setActualEndTime(consultation.getActualEndTime());
        row.setDurationSeconds(consultation.getDurationSeconds());
        row.setDurationMinutes(consultation.getDurationMinutes());
        row.setPatientJoinedAt(consultation.getPatientJoinedAt());
        row.setDoctorJoinedAt(consultation.getDoctorJoinedAt());
        row.setTransportMode(consultation.getTransportMode());
        row.setManagedRoomRef(consultation.getManagedRoomRef());
        row.setCancellationReason(consultation.getCancellationReason());
        row.setCancelledBy(consultation.getCancelledBy());
        row.setCancelledAt(consultation.getCancelledAt());
        return consultationRepository.saveAndFlush(row);
    }

    @Override
    @Transactional
    public ConsultationMessage appendMessage(ConsultationMessage message) {
        Optional<ConsultationMessage> stored = messageRepository.findById(message.getId());
        if (stored.isPresent()) {
            ConsultationMessage row = stored.get();
            if (row.getStatus() != message.getStatus() && !row.getStatus().canAdvanceTo(message.getStatus())) {
                log.debug("Message {} already {} in store; keeping it", row.getId(), row.getStatus());
                return row;
            }
            row.setStatus(message.getStatus());
            row.setDeliveredAt(message.getDeliveredAt());
            row.setReadAt(message.getReadAt());
            return messageRepository.save(row);
        }
        return messageRepository.save(message);
    }

    @Override
    @Transactional
    public ConsultationMessage updateMessageStatus(UUID messageId, MessageStatus status, Instant at) {
        ConsultationMessage message = messageRepository.findById(messageId)
            .orElseThrow(() -> new MessageNotFoundException("Message not found: " + messageId));
        if (!message.getStatus().canAdvanceTo(status)) {
            return message;
        }
        message.setStatus(status);
        if (status == MessageStatus.DELIVERED || status == MessageStatus.READ) {
            if (message.getDeliveredAt() == null) {
                message.setDeliveredAt(at);
            }
        }
        if (status == MessageStatus.READ) {
            message.setReadAt(at);
        }
        return messageRepository.save(message);
    }

    @Override
    @Transactional
    public ConsultationParticipant saveParticipantSummary(UUID consultationId, ParticipantSummary summary) {
        UUID id = ConsultationParticipant.idFor(consultationId, summary.getUserId());
        ConsultationParticipant row = participantRepository.findById(id)
            .orElseGet(() -> ConsultationParticipant.builder()
                .consultationId(consultationId)
                .userId(summary.getUserId())
                .role(summary.getRole())
                .build());
        row.setId(id);
        row.setStatus(summary.getStatus());
        row.setJoinedAt(summary.getJoinedAt());
        row.setLeftAt(summary.getLeftAt());
        row.setDurationSeconds(summary.getDurationSeconds());
        if (summary.getMediaState() != null) {
            row.setAudioEnabled(summary.getMediaState().isAudioEnabled());
            row.setVideoEnabled(summary.getMediaState().isVideoEnabled());
            row.setScreenShareEnabled(summary.getMediaState().isScreenShareEnabled());
        }
        row.setDisconnectionCount((int) summary.getConnectionHistory().stream()
            .filter(e -> e.getKind() == ConnectionEvent.Kind.DISCONNECTED)
            .count());
        row.setLastQuality(summary.getQuality() != null ? summary.getQuality().name() : null);
        return participantRepository.save(row);
    }

    @Override
    @Transactional
    public ConsultationParticipant inviteParticipant(UUID consultationId, String userId, ParticipantRole role) {
        UUID id = ConsultationParticipant.idFor(consultationId, userId);
        return participantRepository.findById(id).orElseGet(() -> {
            ConsultationParticipant row = ConsultationParticipant.builder()
                .consultationId(consultationId)
                .userId(userId)
                .role(role)
                .status(ParticipantStatus.INVITED)
                .build();
            row.setId(id);
            return participantRepository.save(row);
        });
    }

    @Override
    public Optional<Consultation> findConsultation(UUID id) {
        return consultationRepository.findById(id);
    }

    @Override
    public Optional<Consultation> findByRoomId(String roomId) {
        return consultationRepository.findByRoomId(roomId);
    }

    @Override
    public Page<Consultation> search(ConsultationFilter filter, Pageable pageable) {
        return consultationRepository.search(
            filter.getPatientId(),
            filter.getDoctorId(),
            filter.getStatus(),
            filter.getFrom() != null ? filter.getFrom() : SEARCH_FLOOR,
            filter.getTo() != null ? filter.getTo() : SEARCH_CEILING,
            pageable);
    }

    @Override
    public List<Consultation> findActiveForDoctor(String doctorId) {
        return consultationRepository.findByDoctorIdAndStatusInOrderByScheduledStartTimeAsc(
            doctorId, EnumSet.of(ConsultationStatus.WAITING, ConsultationStatus.IN_PROGRESS));
    }

    @Override
    public List<Consultation> findUpcoming(String userId, Instant from, Instant to) {
        return consultationRepository.findUpcomingForUser(userId, ConsultationStatus.SCHEDULED, from, to);
    }

    @Override
    public List<Consultation> findOverdueScheduled(Instant cutoff) {
        return consultationRepository.findByStatusAndScheduledStartTimeBefore(ConsultationStatus.SCHEDULED, cutoff);
    }

    @Override
    public List<ConsultationMessage> findMessages(UUID consultationId) {
        return messageRepository.findByConsultationIdOrderByCreatedAtAsc(consultationId);
    }

    @Override
    public List<ConsultationMessage> findUndeliveredMessages(UUID consultationId) {
        return messageRepository.findByConsultationIdAndStatusOrderByCreatedAtAsc(consultationId, MessageStatus.SENT);
    }

    @Override
    public Optional<ConsultationMessage> findMessage(UUID messageId) {
        return messageRepository.findById(messageId);
    }

    @Override
    public List<ConsultationParticipant> findParticipants(UUID consultationId) {
        return participantRepository.findByConsultationIdOrderByCreatedAtAsc(consultationId);
    }
}
