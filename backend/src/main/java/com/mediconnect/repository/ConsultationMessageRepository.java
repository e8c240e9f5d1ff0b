package com.mediconnect.repository;

import com.mediconnect.entity.ConsultationMessage;
import com.mediconnect.entity.MessageStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ConsultationMessageRepository extends JpaRepository<ConsultationMessage, UUID> {
    List<ConsultationMessage> findByConsultationIdOrderByCreatedAtAsc(UUID consultationId);

    List<ConsultationMessage> findByConsultationIdAndStatusOrderByCreatedAtAsc(UUID consultationId, MessageStatus status);
}
