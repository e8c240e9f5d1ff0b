package com.mediconnect.dto;

import com.mediconnect.entity.Consultation;
import com.mediconnect.entity.ConsultationStatus;
import com.mediconnect.exception.ErrorCode;
import lombok.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public class ConsultationDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateRequest {
        private String patientId;
        private String doctorId;
        private UUID appointmentId;
        private Consultation.ConsultationType type;
        private Consultation.ConsultationPriority priority;
        private Instant scheduledStartTime;
        private String reasonForVisit;
        private String chiefComplaint;
        private String patientNotes;
        private boolean recorded;
        private boolean recordingConsent;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private UUID id;
        private String consultationNumber;
        private String patientId;
        private String doctorId;
        private UUID appointmentId;
        private Consultation.ConsultationType type;
        private ConsultationStatus status;
        private Consultation.ConsultationPriority priority;
        private Instant scheduledStartTime;
        private Instant actualStartTime;
        private Instant actualEndTime;
        private Integer durationMinutes;
        private Long durationSeconds;
        private String roomId;
        private Consultation.TransportMode transportMode;
        private String reasonForVisit;
        private String chiefComplaint;
        private String patientNotes;
        private boolean recorded;
        private String diagnosis;
        private String treatmentPlan;
        private List<Prescription> prescriptions;
        private Vitals vitals;
        private Boolean followUpRequired;
        private Instant followUpDate;
        private String followUpInstructions;
        private String doctorSharedNotes;
        private String doctorPrivateNotes;
        private Integer patientRating;
        private String patientFeedback;
        private Instant patientJoinedAt;
        private Instant doctorJoinedAt;
        private String cancellationReason;
        private String cancelledBy;
        private Instant cancelledAt;
        private Instant createdAt;
        private List<ErrorCode> warnings;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CancelRequest {
        private String reason;
    }

    /**
     * Clinical record written after the session. Null fields are left untouched.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ClinicalUpdate {
        private String diagnosis;
        private String treatmentPlan;
        private List<Prescription> prescriptions;
        private Vitals vitals;
        private Boolean followUpRequired;
        private Instant followUpDate;
        private String followUpInstructions;
        private String doctorPrivateNotes;
        private String doctorSharedNotes;
        private Integer patientRating;
        private String patientFeedback;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Prescription {
        private String medication;
        private String dosage;
        private String frequency;
        private String duration;
        private String instructions;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Vitals {
        private Integer heartRate;
        private Integer systolic;
        private Integer diastolic;
        private Double temperature;
        private Double oxygenSaturation;
        private Double weight;
        private Double height;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PageResponse {
        private List<Response> content;
        private int page;
        private int size;
        private long totalElements;
        private int totalPages;
    }
}
