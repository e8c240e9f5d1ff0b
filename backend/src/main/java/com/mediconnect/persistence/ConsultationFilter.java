package com.mediconnect.persistence;

import com.mediconnect.entity.ConsultationStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Optional criteria for listing consultations; null fields do not constrain the result.
 */
@Value
@Builder
public class ConsultationFilter {
    String patientId;
    String doctorId;
    ConsultationStatus status;
    Instant from;
    Instant to;
}
