package com.mediconnect.repository;

import com.mediconnect.entity.Consultation;
import com.mediconnect.entity.ConsultationStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ConsultationRepository extends JpaRepository<Consultation, UUID> {
    Optional<Consultation> findByRoomId(String roomId);

    List<Consultation> findByDoctorIdAndStatusInOrderByScheduledStartTimeAsc(
        String doctorId, Collection<ConsultationStatus> statuses);

    List<Consultation> findByStatusAndScheduledStartTimeBefore(ConsultationStatus status, Instant cutoff);

    @Query("SELECT c FROM Consultation c WHERE (c.patientId = :userId OR c.doctorId = :userId) " +
           "AND c.status = :status AND c.scheduledStartTime BETWEEN :from AND :to " +
           "ORDER BY c.scheduledStartTime ASC")
    List<Consultation> findUpcomingForUser(
        @Param("userId") String userId,
        @Param("status") ConsultationStatus status,
        @Param("from") Instant from,
        @Param("to") Instant to
    );

    @Query("SELECT c FROM Consultation c WHERE " +
           "(:patientId IS NULL OR c.patientId = :patientId) AND " +
           "(:doctorId IS NULL OR c.doctorId = :doctorId) AND " +
           "(:status IS NULL OR c.status = :status) AND " +
           "c.scheduledStartTime BETWEEN :from AND :to")
    Page<Consultation> search(
        @Param("patientId") String patientId,
        @Param("doctorId") String doctorId,
        @Param("status") ConsultationStatus status,
        @Param("from") Instant from,
        @Param("to") Instant to,
        Pageable pageable
    );
}
