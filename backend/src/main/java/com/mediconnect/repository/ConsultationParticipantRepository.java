package com.mediconnect.repository;

import com.mediconnect.entity.ConsultationParticipant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ConsultationParticipantRepository extends JpaRepository<ConsultationParticipant, UUID> {
    List<ConsultationParticipant> findByConsultationIdOrderByCreatedAtAsc(UUID consultationId);
}
