package com.mediconnect.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "consultations", indexes = {
    @Index(name = "idx_consultation_patient", columnList = "patient_id"),
    @Index(name = "idx_consultation_doctor", columnList = "doctor_id"),
    @Index(name = "idx_consultation_status_start", columnList = "status, scheduled_start_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Consultation extends BaseEntity {

    @Version
    @Column(name = "row_version")
    private Long version;

    @Column(name = "consultation_number", nullable = false, unique = true)
    private String consultationNumber; // CON-XXXXXXXXXX

    @Column(name = "patient_id", nullable = false)
    private String patientId;

    @Column(name = "doctor_id", nullable = false)
    private String doctorId;

    @Column(name = "appointment_id")
    private UUID appointmentId; // Reference into the appointment service

    @Enumerated(EnumType.STRING)
    @Column(name = "consultation_type", nullable = false)
    private ConsultationType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ConsultationStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ConsultationPriority priority;

    @Column(name = "scheduled_start_time", nullable = false)
    private Instant scheduledStartTime;

    @Column(name = "actual_start_time")
    private Instant actualStartTime;

    @Column(name = "actual_end_time")
    private Instant actualEndTime;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    @Column(name = "room_id", nullable = false, unique = true)
    private String roomId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transport_mode")
    private TransportMode transportMode;

    @Column(name = "managed_room_ref")
    private String managedRoomRef;

    @Column(name = "reason_for_visit", columnDefinition = "TEXT")
    private String reasonForVisit;

    @Column(name = "chief_complaint", columnDefinition = "TEXT")
    private String chiefComplaint;

    @Column(name = "patient_notes", columnDefinition = "TEXT")
    private String patientNotes;

    @Column(name = "is_recorded")
    private boolean recorded;

    @Column(name = "recording_consent")
    private boolean recordingConsent;

    // Clinical fields, written after the session ends

    @Column(columnDefinition = "TEXT")
    private String diagnosis;

    @Column(name = "treatment_plan", columnDefinition = "TEXT")
    private String treatmentPlan;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "consultation_prescriptions", joinColumns = @JoinColumn(name = "consultation_id"))
    @Builder.Default
    private List<Prescription> prescriptions = new ArrayList<>();

    @Embedded
    private Vitals vitals;

    @Column(name = "follow_up_required")
    private Boolean followUpRequired;

    @Column(name = "follow_up_date")
    private Instant followUpDate;

    @Column(name = "follow_up_instructions", columnDefinition = "TEXT")
    private String followUpInstructions;

    @Column(name = "doctor_private_notes", columnDefinition = "TEXT")
    private String doctorPrivateNotes;

    @Column(name = "doctor_shared_notes", columnDefinition = "TEXT")
    private String doctorSharedNotes;

    @Column(name = "patient_rating")
    private Integer patientRating; // 1-5

    @Column(name = "patient_feedback", columnDefinition = "TEXT")
    private String patientFeedback;

    @Column(name = "patient_joined_at")
    private Instant patientJoinedAt;

    @Column(name = "doctor_joined_at")
    private Instant doctorJoinedAt;

    @Column(name = "cancellation_reason", columnDefinition = "TEXT")
    private String cancellationReason;

    @Column(name = "cancelled_by")
    private String cancelledBy;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    /**
     * Detached deep copy, including the inherited id and timestamps.
     */
    public Consultation copy() {
        Consultation copy = toBuilder()
            .prescriptions(prescriptions != null ? new ArrayList<>(prescriptions) : new ArrayList<>())
            .vitals(vitals != null ? new Vitals(vitals.getHeartRate(), vitals.getSystolic(), vitals.getDiastolic(),
                vitals.getTemperature(), vitals.getOxygenSaturation(), vitals.getWeight(), vitals.getHeight()) : null)
            .build();
        copy.setId(getId());
        copy.setCreatedAt(getCreatedAt());
        copy.setUpdatedAt(getUpdatedAt());
        return copy;
    }

    public enum ConsultationType {
        VIDEO,
        AUDIO,
        CHAT
    }

    public enum ConsultationPriority {
        ROUTINE,
        URGENT,
        EMERGENCY
    }

    public enum TransportMode {
        DIRECT,
        MANAGED
    }

    @Embeddable
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Prescription {
        private String medication;
        private String dosage;
        private String frequency;
        private String duration;
        @Column(columnDefinition = "TEXT")
        private String instructions;
    }

    @Embeddable
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Vitals {
        @Column(name = "heart_rate")
        private Integer heartRate;
        @Column(name = "bp_systolic")
        private Integer systolic;
        @Column(name = "bp_diastolic")
        private Integer diastolic;
        private Double temperature;
        @Column(name = "oxygen_saturation")
        private Double oxygenSaturation;
        private Double weight;
        private Double height;
    }
}
