package com.mediconnect.persistence;

import com.mediconnect.entity.Consultation;
import com.mediconnect.entity.ConsultationMessage;
import com.mediconnect.entity.ConsultationParticipant;
import com.mediconnect.entity.MessageStatus;
import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.room.ParticipantSummary;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for consultations, their chat messages and participant summaries.
 * Every write is keyed by a service-assigned id, so repeating a write is harmless.
 */
public interface ConsultationStore {

    /**
     * Inserts a consultation that has no version yet, or overwrites the stored row when the
     * versions match.
     *
     * @return the stored consultation carrying its new version
     * @throws org.springframework.dao.OptimisticLockingFailureException if the stored row has moved on
     */
    Consultation saveConsultation(Consultation consultation);

    /**
     * Writes the lifecycle columns (status, timings, join markers, cancellation) of the given
     * consultation, leaving clinical fields as stored. The write only lands if the stored row
     * still has the given consultation's version.
     *
     * @return the stored consultation carrying its new version
     * @throws org.springframework.dao.OptimisticLockingFailureException if the stored row has moved on
     */
    Consultation updateConsultationStatus(Consultation consultation);

    /**
     * Stores a chat message. A stored status further along than the incoming one is kept.
     */
    ConsultationMessage appendMessage(ConsultationMessage message);

    ConsultationMessage updateMessageStatus(UUID messageId, MessageStatus status, Instant at);

    ConsultationParticipant saveParticipantSummary(UUID consultationId, ParticipantSummary summary);

    /**
     * Records an invitation unless the user already has a participant row.
     */
    ConsultationParticipant inviteParticipant(UUID consultationId, String userId, ParticipantRole role);

    Optional<Consultation> findConsultation(UUID id);

    Optional<Consultation> findByRoomId(String roomId);

    Page<Consultation> search(ConsultationFilter filter, Pageable pageable);

    List<Consultation> findActiveForDoctor(String doctorId);

    List<Consultation> findUpcoming(String userId, Instant from, Instant to);

    List<Consultation> findOverdueScheduled(Instant cutoff);

    List<ConsultationMessage> findMessages(UUID consultationId);

    List<ConsultationMessage> findUndeliveredMessages(UUID consultationId);

    Optional<ConsultationMessage> findMessage(UUID messageId);

    List<ConsultationParticipant> findParticipants(UUID consultationId);
}
