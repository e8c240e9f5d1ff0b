package com.mediconnect.service;

import com.mediconnect.dto.ConsultationDTO;
import com.mediconnect.dto.ParticipantDTO;
import com.mediconnect.entity.Consultation;
import com.mediconnect.entity.ConsultationParticipant;
import com.mediconnect.entity.ConsultationStatus;
import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.exception.AlreadyExistsException;
import com.mediconnect.exception.ErrorCode;
import com.mediconnect.exception.ForbiddenOperationException;
import com.mediconnect.exception.InvalidRequestException;
import com.mediconnect.exception.InvalidTransitionException;
import com.mediconnect.exception.NotJoinedException;
import com.mediconnect.exception.RoomNotFoundException;
import com.mediconnect.lifecycle.ConsultationLifecycle;
import com.mediconnect.lifecycle.TransitionResult;
import com.mediconnect.persistence.ConsultationFilter;
import com.mediconnect.persistence.ConsultationStore;
import com.mediconnect.persistence.PersistenceWriter;
import com.mediconnect.room.ParticipantSnapshot;
import com.mediconnect.room.ParticipantSummary;
import com.mediconnect.room.ParticipantTracker;
import com.mediconnect.room.Room;
import com.mediconnect.room.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ConsultationService {

    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final String UPPER_ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int MAX_PAGE_SIZE = 100;

    private final SecureRandom random = new SecureRandom();

    private final ConsultationLifecycle lifecycle;
    private final ConsultationStore store;
    private final PersistenceWriter writer;
    private final SessionRegistry registry;
    private final ParticipantTracker tracker;
    private final Clock clock;

    public ConsultationDTO.Response createConsultation(ConsultationDTO.CreateRequest request) {
        if (request.getPatientId() == null || request.getPatientId().isBlank()) {
            throw new InvalidRequestException("patientId is required");
        }
        if (request.getDoctorId() == null || request.getDoctorId().isBlank()) {
            throw new InvalidRequestException("doctorId is required");
        }
        if (request.getScheduledStartTime() == null) {
            throw new InvalidRequestException("scheduledStartTime is required");
        }

        Consultation consultation = Consultation.builder()
            .consultationNumber("CON-" + randomString(UPPER_ALPHANUMERIC, 10))
            .patientId(request.getPatientId())
            .doctorId(request.getDoctorId())
            .appointmentId(request.getAppointmentId())
            .type(request.getType() != null ? request.getType() : Consultation.ConsultationType.VIDEO)
            .priority(request.getPriority() != null ? request.getPriority() : Consultation.ConsultationPriority.ROUTINE)
            .status(ConsultationStatus.SCHEDULED)
            .scheduledStartTime(request.getScheduledStartTime())
            .roomId("room-" + randomString(ALPHANUMERIC, 16))
            .reasonForVisit(request.getReasonForVisit())
            .chiefComplaint(request.getChiefComplaint())
            .patientNotes(request.getPatientNotes())
            .recorded(request.isRecorded())
            .recordingConsent(request.isRecordingConsent())
            .build();
        consultation.setId(UUID.randomUUID());
        consultation.setCreatedAt(clock.instant());

        TransitionResult result = lifecycle.register(consultation);
        invite(consultation.getId(), consultation.getDoctorId(), ParticipantRole.DOCTOR);
        invite(consultation.getId(), consultation.getPatientId(), ParticipantRole.PATIENT);

        log.info("Consultation {} created: patient {} with doctor {} at {}", consultation.getConsultationNumber(),
            consultation.getPatientId(), consultation.getDoctorId(), consultation.getScheduledStartTime());
        return mapToResponse(result.getConsultation(), result.getWarnings(), true);
    }

    public ConsultationDTO.Response getConsultation(UUID consultationId, String userId, boolean admin) {
        Consultation consultation = lifecycle.require(consultationId);
        requireParty(consultation, userId, admin);
        return mapToResponse(consultation, null, admin || userId.equals(consultation.getDoctorId()));
    }

    public ConsultationDTO.Response getByRoomId(String roomId, String userId, boolean admin) {
        Consultation consultation = lifecycle.findByRoom(roomId)
            .orElseThrow(() -> new RoomNotFoundException("Room not found: " + roomId));
        requireParty(consultation, userId, admin);
        return mapToResponse(consultation, null, admin || userId.equals(consultation.getDoctorId()));
    }

    public ConsultationDTO.PageResponse listConsultations(ConsultationFilter filter, int page, int size) {
        if (page < 0 || size < 1) {
            throw new InvalidRequestException("page must be >= 0 and size >= 1");
        }
        PageRequest pageable = PageRequest.of(page, Math.min(size, MAX_PAGE_SIZE),
            Sort.by(Sort.Direction.DESC, "scheduledStartTime"));
        Page<Consultation> result = store.search(filter, pageable);
        return ConsultationDTO.PageResponse.builder()
            .content(result.getContent().stream()
                .map(c -> mapToResponse(c, null, false))
                .collect(Collectors.toList()))
            .page(result.getNumber())
            .size(result.getSize())
            .totalElements(result.getTotalElements())
            .totalPages(result.getTotalPages())
            .build();
    }

    public List<ConsultationDTO.Response> getActiveConsultations(String doctorId) {
        return store.findActiveForDoctor(doctorId).stream()
            .map(c -> mapToResponse(c, null, true))
            .collect(Collectors.toList());
    }

    public List<ConsultationDTO.Response> getUpcomingConsultations(String userId, int hours) {
        if (hours < 1) {
            throw new InvalidRequestException("hours must be positive");
        }
        Instant now = clock.instant();
        return store.findUpcoming(userId, now, now.plus(Duration.ofHours(hours))).stream()
            .map(c -> mapToResponse(c, null, userId.equals(c.getDoctorId())))
            .collect(Collectors.toList());
    }

    public ConsultationDTO.Response startConsultation(UUID consultationId, String userId, boolean admin) {
        TransitionResult result = lifecycle.start(consultationId, userId, admin);
        return mapToResponse(result.getConsultation(), result.getWarnings(), true);
    }

    public ConsultationDTO.Response endConsultation(UUID consultationId, String userId, boolean admin) {
        TransitionResult result = lifecycle.end(consultationId, userId, admin);
        log.info("Consultation {} completed after {} minute(s)", consultationId,
            result.getConsultation().getDurationMinutes());
        return mapToResponse(result.getConsultation(), result.getWarnings(), true);
    }

    public ConsultationDTO.Response cancelConsultation(UUID consultationId, String reason, String userId, boolean admin) {
        Consultation consultation = lifecycle.require(consultationId);
        requireParty(consultation, userId, admin);
        TransitionResult result = lifecycle.cancel(consultationId, reason, userId);
        return mapToResponse(result.getConsultation(), result.getWarnings(),
            admin || userId.equals(consultation.getDoctorId()));
    }

    /**
     * Records the clinical outcome once the consultation is completed. Empty fields may be
     * filled in, prescriptions and notes only grow; a recorded value is never replaced.
     */
    public ConsultationDTO.Response updateClinicalRecord(UUID consultationId, String userId, boolean admin,
                                                         ConsultationDTO.ClinicalUpdate update) {
        boolean doctorFields = hasDoctorFields(update);
        boolean patientFields = update.getPatientRating() != null || update.getPatientFeedback() != null;
        if (!doctorFields && !patientFields) {
            throw new InvalidRequestException("Nothing to update");
        }
        if (update.getPatientRating() != null && (update.getPatientRating() < 1 || update.getPatientRating() > 5)) {
            throw new InvalidRequestException("patientRating must be between 1 and 5");
        }

        TransitionResult result = lifecycle.amend(consultationId, c -> {
            if (c.getStatus() != ConsultationStatus.COMPLETED) {
                throw new InvalidTransitionException("Clinical record can only be written once consultation "
                    + c.getId() + " is completed (status " + c.getStatus() + ")");
            }
            if (doctorFields && !admin && !userId.equals(c.getDoctorId())) {
                throw new ForbiddenOperationException("Only the consultation's doctor may record clinical findings");
            }
            if (patientFields && !userId.equals(c.getPatientId())) {
                throw new ForbiddenOperationException("Only the patient may rate the consultation");
            }
            requireUnset("diagnosis", c.getDiagnosis(), update.getDiagnosis());
            requireUnset("treatmentPlan", c.getTreatmentPlan(), update.getTreatmentPlan());
            requireUnset("vitals", c.getVitals(), update.getVitals());
            requireUnset("followUpRequired", c.getFollowUpRequired(), update.getFollowUpRequired());
            requireUnset("followUpDate", c.getFollowUpDate(), update.getFollowUpDate());
            requireUnset("followUpInstructions", c.getFollowUpInstructions(), update.getFollowUpInstructions());
            requireUnset("patientRating", c.getPatientRating(), update.getPatientRating());
            requireUnset("patientFeedback", c.getPatientFeedback(), update.getPatientFeedback());

            applyClinicalUpdate(c, update);
        });
        log.info("Clinical record of consultation {} updated by {}", consultationId, userId);
        return mapToResponse(result.getConsultation(), result.getWarnings(), doctorFields || admin);
    }

    /**
     * Invites a nurse or observer. Only the consultation's doctor or an admin may do so.
     */
    public ParticipantDTO.Response inviteParticipant(UUID consultationId, ParticipantDTO.InviteRequest request,
                                                     String userId, boolean admin) {
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new InvalidRequestException("userId is required");
        }
        if (request.getRole() != ParticipantRole.NURSE && request.getRole() != ParticipantRole.OBSERVER) {
            throw new InvalidRequestException("Only NURSE or OBSERVER participants can be invited");
        }
        Consultation consultation = lifecycle.require(consultationId);
        if (!admin && !userId.equals(consultation.getDoctorId())) {
            throw new ForbiddenOperationException("Only the consultation's doctor or an admin may invite participants");
        }
        if (consultation.getStatus().isTerminal()) {
            throw new InvalidTransitionException("Consultation " + consultationId + " is " + consultation.getStatus());
        }
        ConsultationParticipant row = store.inviteParticipant(consultationId, request.getUserId(), request.getRole());
        if (row.getRole() != request.getRole()) {
            throw new AlreadyExistsException("User " + request.getUserId() + " is already invited as " + row.getRole());
        }
        log.info("User {} invited to consultation {} as {}", request.getUserId(), consultationId, request.getRole());
        return mapStored(row);
    }

    public List<ParticipantDTO.Response> getParticipants(UUID consultationId, String userId, boolean admin) {
        Consultation consultation = lifecycle.require(consultationId);
        requireParty(consultation, userId, admin);
        Optional<Room> live = registry.findByConsultation(consultationId);
        if (live.isPresent()) {
            return live.get().participants().stream()
                .map(this::mapLive)
                .collect(Collectors.toList());
        }
        return store.findParticipants(consultationId).stream()
            .map(this::mapStored)
            .collect(Collectors.toList());
    }

    public ParticipantDTO.Summary getParticipantSummary(UUID consultationId, String participantId,
                                                        String userId, boolean admin) {
        Consultation consultation = lifecycle.require(consultationId);
        requireParty(consultation, userId, admin);
        Optional<Room> live = registry.findByConsultation(consultationId);
        if (live.isPresent()) {
            ParticipantSummary summary = tracker.getSummary(live.get().getRoomId(), participantId);
            return ParticipantDTO.Summary.builder()
                .userId(summary.getUserId())
                .role(summary.getRole())
                .status(summary.getStatus())
                .joinedAt(summary.getJoinedAt())
                .leftAt(summary.getLeftAt())
                .durationSeconds(summary.getDurationSeconds())
                .mediaTimeline(summary.getMediaTimeline())
                .connectionHistory(summary.getConnectionHistory())
                .build();
        }
        ConsultationParticipant row = store.findParticipants(consultationId).stream()
            .filter(p -> p.getUserId().equals(participantId))
            .findFirst()
            .orElseThrow(() -> new NotJoinedException("User " + participantId
                + " never took part in consultation " + consultationId));
        return ParticipantDTO.Summary.builder()
            .userId(row.getUserId())
            .role(row.getRole())
            .status(row.getStatus())
            .joinedAt(row.getJoinedAt())
            .leftAt(row.getLeftAt())
            .durationSeconds(row.getDurationSeconds())
            .mediaTimeline(List.of())
            .connectionHistory(List.of())
            .build();
    }

    private void invite(UUID consultationId, String userId, ParticipantRole role) {
        writer.submit("participant:" + consultationId + ":" + userId,
            () -> store.inviteParticipant(consultationId, userId, role));
    }

    private static void requireParty(Consultation consultation, String userId, boolean admin) {
        if (admin || userId.equals(consultation.getDoctorId()) || userId.equals(consultation.getPatientId())) {
            return;
        }
        throw new ForbiddenOperationException("User " + userId + " is not a party to consultation " + consultation.getId());
    }

    private static void requireUnset(String field, Object current, Object incoming) {
        if (incoming == null || current == null) {
            return;
        }
        if (current instanceof String && ((String) current).isBlank()) {
            return;
        }
        if (!current.equals(incoming)) {
            throw new AlreadyExistsException(field + " is already recorded and cannot be changed");
        }
    }

    private static boolean hasDoctorFields(ConsultationDTO.ClinicalUpdate update) {
        return update.getDiagnosis() != null
            || update.getTreatmentPlan() != null
            || (update.getPrescriptions() != null && !update.getPrescriptions().isEmpty())
            || update.getVitals() != null
            || update.getFollowUpRequired() != null
            || update.getFollowUpDate() != null
            || update.getFollowUpInstructions() != null
            || update.getDoctorPrivateNotes() != null
            || update.getDoctorSharedNotes() != null;
    }

    private static void applyClinicalUpdate(Consultation c, ConsultationDTO.ClinicalUpdate update) {
        if (update.getDiagnosis() != null) {
            c.setDiagnosis(update.getDiagnosis());
        }
        if (update.getTreatmentPlan() != null) {
            c.setTreatmentPlan(update.getTreatmentPlan());
        }
        if (update.getPrescriptions() != null) {
            update.getPrescriptions().forEach(p -> c.getPrescriptions().add(Consultation.Prescription.builder()
                .medication(p.getMedication())
                .dosage(p.getDosage())
                .frequency(p.getFrequency())
                .duration(p.getDuration())
                .instructions(p.getInstructions())
                .build()));
        }
        if (update.getVitals() != null) {
            ConsultationDTO.Vitals v = update.getVitals();
            c.setVitals(new Consultation.Vitals(v.getHeartRate(), v.getSystolic(), v.getDiastolic(),
                v.getTemperature(), v.getOxygenSaturation(), v.getWeight(), v.getHeight()));
        }
        if (update.getFollowUpRequired() != null) {
            c.setFollowUpRequired(update.getFollowUpRequired());
        }
        if (update.getFollowUpDate() != null) {
            c.setFollowUpDate(update.getFollowUpDate());
        }
        if (update.getFollowUpInstructions() != null) {
            c.setFollowUpInstructions(update.getFollowUpInstructions());
        }
        c.setDoctorPrivateNotes(appendNote(c.getDoctorPrivateNotes(), update.getDoctorPrivateNotes()));
        c.setDoctorSharedNotes(appendNote(c.getDoctorSharedNotes(), update.getDoctorSharedNotes()));
        if (update.getPatientRating() != null) {
            c.setPatientRating(update.getPatientRating());
        }
        if (update.getPatientFeedback() != null) {
            c.setPatientFeedback(update.getPatientFeedback());
        }
    }

    private static String appendNote(String existing, String addition) {
        if (addition == null || addition.isBlank()) {
            return existing;
        }
        if (existing == null || existing.isBlank()) {
            return addition;
        }
        return existing + "\n\n" + addition;
    }

    private String randomString(String alphabet, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }

    private ParticipantDTO.Response mapLive(ParticipantSnapshot snapshot) {
        return ParticipantDTO.Response.builder()
            .userId(snapshot.getUserId())
            .role(snapshot.getRole())
            .status(snapshot.getStatus())
            .joinedAt(snapshot.getJoinedAt())
            .leftAt(snapshot.getLeftAt())
            .mediaState(snapshot.getMediaState())
            .quality(snapshot.getQuality())
            .disconnections(snapshot.getDisconnections())
            .live(true)
            .build();
    }

    private ParticipantDTO.Response mapStored(ConsultationParticipant row) {
        return ParticipantDTO.Response.builder()
            .userId(row.getUserId())
            .role(row.getRole())
            .status(row.getStatus())
            .joinedAt(row.getJoinedAt())
            .leftAt(row.getLeftAt())
            .durationSeconds(row.getDurationSeconds())
            .disconnections(row.getDisconnectionCount())
            .live(false)
            .build();
    }

    static ConsultationDTO.Response mapToResponse(Consultation c, List<ErrorCode> warnings, boolean includePrivateNotes) {
        return ConsultationDTO.Response.builder()
            .id(c.getId())
            .consultationNumber(c.getConsultationNumber())
            .patientId(c.getPatientId())
            .doctorId(c.getDoctorId())
            .appointmentId(c.getAppointmentId())
            .type(c.getType())
            .status(c.getStatus())
            .priority(c.getPriority())
            .scheduledStartTime(c.getScheduledStartTime())
            .actualStartTime(c.getActualStartTime())
            .actualEndTime(c.getActualEndTime())
            .durationMinutes(c.getDurationMinutes())
            .durationSeconds(c.getDurationSeconds())
            .roomId(c.getRoomId())
            .transportMode(c.getTransportMode())
            .reasonForVisit(c.getReasonForVisit())
            .chiefComplaint(c.getChiefComplaint())
            .patientNotes(c.getPatientNotes())
            .recorded(c.isRecorded())
            .diagnosis(c.getDiagnosis())
            .treatmentPlan(c.getTreatmentPlan())
            .prescriptions(c.getPrescriptions() == null ? List.of() : c.getPrescriptions().stream()
                .map(p -> ConsultationDTO.Prescription.builder()
                    .medication(p.getMedication())
                    .dosage(p.getDosage())
                    .frequency(p.getFrequency())
                    .duration(p.getDuration())
                    .instructions(p.getInstructions())
                    .build())
                .collect(Collectors.toList()))
            .vitals(c.getVitals() == null ? null : ConsultationDTO.Vitals.builder()
                .heartRate(c.getVitals().getHeartRate())
                .systolic(c.getVitals().getSystolic())
                .diastolic(c.getVitals().getDiastolic())
                .temperature(c.getVitals().getTemperature())
                .oxygenSaturation(c.getVitals().getOxygenSaturation())
                .weight(c.getVitals().getWeight())
                .height(c.getVitals().getHeight())
                .build())
            .followUpRequired(c.getFollowUpRequired())
            .followUpDate(c.getFollowUpDate())
            .followUpInstructions(c.getFollowUpInstructions())
            .doctorSharedNotes(c.getDoctorSharedNotes())
            .doctorPrivateNotes(includePrivateNotes ? c.getDoctorPrivateNotes() : null)
            .patientRating(c.getPatientRating())
            .patientFeedback(c.getPatientFeedback())
            .patientJoinedAt(c.getPatientJoinedAt())
            .doctorJoinedAt(c.getDoctorJoinedAt())
            .cancellationReason(c.getCancellationReason())
            .cancelledBy(c.getCancelledBy())
            .cancelledAt(c.getCancelledAt())
            .createdAt(c.getCreatedAt())
            .warnings(warnings)
            .build();
    }
}
