package com.mediconnect.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import com.mediconnect.entity.Consultation;
import com.mediconnect.entity.ConsultationStatus;
import com.mediconnect.entity.ParticipantRole;
import com.mediconnect.exception.ConsultationNotFoundException;
import com.mediconnect.exception.ErrorCode;
import com.mediconnect.exception.ForbiddenOperationException;
import com.mediconnect.exception.InvalidRequestException;
import com.mediconnect.exception.InvalidTransitionException;
import com.mediconnect.persistence.PersistenceWriter;
import com.mediconnect.room.RoomPolicy;
import com.mediconnect.support.InMemoryConsultationStore;
import com.mediconnect.support.MutableClock;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConsultationLifecycle Tests")
class ConsultationLifecycleTest {

    private static final Instant SCHEDULED_AT = Instant.parse("2026-03-02T14:00:00Z");

    @Mock
    private ApplicationEventPublisher events;

    private MutableClock clock;
    private InMemoryConsultationStore store;
    private ConsultationLifecycle lifecycle;
    private UUID consultationId;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(SCHEDULED_AT);
        store = new InMemoryConsultationStore();
        PersistenceWriter writer = new PersistenceWriter(Runnable::run, clock);
        lifecycle = new ConsultationLifecycle(store, writer, events, RoomPolicy.DEFAULTS, clock);
        consultationId = UUID.randomUUID();
        lifecycle.register(scheduledConsultation(consultationId));
    }

    private static Consultation scheduledConsultation(UUID id) {
        Consultation consultation = Consultation.builder()
            .consultationNumber("CON-TEST000001")
            .patientId("pat-1")
            .doctorId("doc-1")
            .type(Consultation.ConsultationType.VIDEO)
            .priority(Consultation.ConsultationPriority.ROUTINE)
            .status(ConsultationStatus.SCHEDULED)
            .scheduledStartTime(SCHEDULED_AT)
            .roomId("room-" + id.toString().substring(0, 16))
            .build();
        consultation.setId(id);
        consultation.setCreatedAt(SCHEDULED_AT.minus(Duration.ofDays(1)));
        return consultation;
    }

    private static <T> List<T> runConcurrently(int threads, Callable<T> action) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return action.call();
                }));
            }
            start.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get());
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should write a registered consultation to the store")
    void shouldPersistOnRegister() {
        assertThat(store.stored(consultationId)).isNotNull();
        assertThat(store.stored(consultationId).getStatus()).isEqualTo(ConsultationStatus.SCHEDULED);
        assertThat(lifecycle.findByRoom(store.stored(consultationId).getRoomId()))
            .map(Consultation::getId)
            .contains(consultationId);
    }

    @Test
    @DisplayName("Should fail for an unknown consultation")
    void shouldFailForUnknownConsultation() {
        assertThatThrownBy(() -> lifecycle.start(UUID.randomUUID(), "doc-1", false))
            .isInstanceOf(ConsultationNotFoundException.class);
    }

    @Nested
    @DisplayName("onParticipantJoined")
    class JoinTests {

        @Test
        @DisplayName("Should move to WAITING when the patient arrives first")
        void shouldWaitForDoctor() {
            // Act
            TransitionResult result = lifecycle.onParticipantJoined(consultationId, "pat-1", ParticipantRole.PATIENT);

            // Assert
            assertThat(result.statusChanged()).isTrue();
            assertThat(result.getConsultation().getStatus()).isEqualTo(ConsultationStatus.WAITING);
            assertThat(result.getConsultation().getPatientJoinedAt()).isEqualTo(SCHEDULED_AT);
            assertThat(store.stored(consultationId).getStatus()).isEqualTo(ConsultationStatus.WAITING);
        }

        @Test
        @DisplayName("Should start the consultation when the doctor joins a waiting room")
        void shouldStartWhenDoctorJoins() {
            // Arrange
            lifecycle.onParticipantJoined(consultationId, "pat-1", ParticipantRole.PATIENT);
            clock.advance(Duration.ofMinutes(3));

            // Act
            TransitionResult result = lifecycle.onParticipantJoined(consultationId, "doc-1", ParticipantRole.DOCTOR);

            // Assert
            assertThat(result.getPreviousStatus()).isEqualTo(ConsultationStatus.WAITING);
            assertThat(result.getConsultation().getStatus()).isEqualTo(ConsultationStatus.IN_PROGRESS);
            assertThat(result.getConsultation().getActualStartTime()).isEqualTo(SCHEDULED_AT.plus(Duration.ofMinutes(3)));
        }

        @Test
        @DisplayName("Should go straight to IN_PROGRESS when the doctor arrives first")
        void shouldSkipWaiting() {
            // Act
            TransitionResult result = lifecycle.onParticipantJoined(consultationId, "doc-1", ParticipantRole.DOCTOR);

            // Assert
            assertThat(result.getPreviousStatus()).isEqualTo(ConsultationStatus.SCHEDULED);
            assertThat(result.getConsultation().getStatus()).isEqualTo(ConsultationStatus.IN_PROGRESS);
            assertThat(result.getConsultation().getDoctorJoinedAt()).isNotNull();
        }

        @Test
        @DisplayName("Should treat a doctor rejoin as a no-op")
        void shouldIgnoreDoctorRejoin() {
            // Arrange
            TransitionResult first = lifecycle.onParticipantJoined(consultationId, "doc-1", ParticipantRole.DOCTOR);
            clock.advance(Duration.ofMinutes(1));

            // Act
            TransitionResult second = lifecycle.onParticipantJoined(consultationId, "doc-1", ParticipantRole.DOCTOR);

            // Assert
            assertThat(second.isApplied()).isFalse();
            assertThat(second.getConsultation().getVersion()).isEqualTo(first.getConsultation().getVersion());
            assertThat(second.getConsultation().getActualStartTime()).isEqualTo(SCHEDULED_AT);
        }

        @Test
        @DisplayName("Should apply concurrent doctor joins exactly once")
        void shouldApplyConcurrentDoctorJoinsOnce() throws Exception {
            // Act
            List<TransitionResult> results = runConcurrently(8,
                () -> lifecycle.onParticipantJoined(consultationId, "doc-1", ParticipantRole.DOCTOR));

            // Assert
            assertThat(results).filteredOn(TransitionResult::statusChanged).hasSize(1);
            assertThat(results).allSatisfy(r ->
                assertThat(r.getConsultation().getStatus()).isEqualTo(ConsultationStatus.IN_PROGRESS));
            assertThat(results).extracting(r -> r.getConsultation().getActualStartTime()).containsOnly(SCHEDULED_AT);
        }
    }

    @Nested
    @DisplayName("Other writers")
    class ExternalWriteTests {

        @Test
        @DisplayName("Should not overwrite a cancellation made directly in the store")
        void shouldKeepExternalCancellation() {
            // Arrange
            store.modify(consultationId, c -> {
                c.setStatus(ConsultationStatus.CANCELLED);
                c.setCancellationReason("Cancelled by the clinic");
                c.setCancelledBy("admin-1");
            });

            // Act
            TransitionResult result = lifecycle.onParticipantJoined(consultationId, "pat-1", ParticipantRole.PATIENT);

            // Assert
            assertThat(result.isApplied()).isFalse();
            assertThat(result.getConsultation().getStatus()).isEqualTo(ConsultationStatus.CANCELLED);
            assertThat(store.stored(consultationId).getStatus()).isEqualTo(ConsultationStatus.CANCELLED);
            assertThat(store.stored(consultationId).getPatientJoinedAt()).isNull();
            assertThat(lifecycle.require(consultationId).getStatus()).isEqualTo(ConsultationStatus.CANCELLED);
        }

        @Test
        @DisplayName("Should ignore a doctor joining a consultation closed elsewhere")
        void shouldIgnoreDoctorJoinAfterExternalCancel() {
            // Arrange
            store.modify(consultationId, c -> c.setStatus(ConsultationStatus.CANCELLED));

            // Act
            TransitionResult result = lifecycle.onParticipantJoined(consultationId, "doc-1", ParticipantRole.DOCTOR);

            // Assert
            assertThat(result.isApplied()).isFalse();
            assertThat(store.stored(consultationId).getStatus()).isEqualTo(ConsultationStatus.CANCELLED);
            assertThat(store.stored(consultationId).getDoctorJoinedAt()).isNull();
            assertThat(store.stored(consultationId).getActualStartTime()).isNull();
        }

        @Test
        @DisplayName("Should see a start written by another instance")
        void shouldSeeExternalStart() {
            // Arrange
            store.modify(consultationId, c -> {
                c.setStatus(ConsultationStatus.IN_PROGRESS);
                c.setActualStartTime(SCHEDULED_AT.minusSeconds(30));
            });

            // Act
            TransitionResult result = lifecycle.onParticipantJoined(consultationId, "doc-1", ParticipantRole.DOCTOR);

            // Assert
            assertThat(result.getPreviousStatus()).isEqualTo(ConsultationStatus.IN_PROGRESS);
            assertThat(result.getConsultation().getActualStartTime()).isEqualTo(SCHEDULED_AT.minusSeconds(30));
            assertThat(store.stored(consultationId).getActualStartTime()).isEqualTo(SCHEDULED_AT.minusSeconds(30));
        }

        @Test
        @DisplayName("Should drop a buffered write once the stored row has moved on")
        void shouldDropStaleBufferedWrite() {
            // Arrange
            store.setAvailable(false);
            lifecycle.onParticipantJoined(consultationId, "pat-1", ParticipantRole.PATIENT);
            store.setAvailable(true);
            store.modify(consultationId, c -> c.setStatus(ConsultationStatus.CANCELLED));

            // Act
            Consultation current = lifecycle.require(consultationId);

            // Assert
            assertThat(current.getStatus()).isEqualTo(ConsultationStatus.CANCELLED);
            assertThat(store.stored(consultationId).getStatus()).isEqualTo(ConsultationStatus.CANCELLED);
            assertThat(lifecycle.isPersistencePending(consultationId)).isFalse();
            assertThat(lifecycle.trackedCount()).isZero();
        }

        @Test
        @DisplayName("Should retry against the stored row when another writer gets in between")
        void shouldRetryAfterConflict() {
            // Arrange
            InMemoryConsultationStore racing = new InMemoryConsultationStore() {
                private boolean raced;

                @Override
                public synchronized Consultation updateConsultationStatus(Consultation consultation) {
                    if (!raced) {
                        raced = true;
                        modify(consultation.getId(), row -> row.setStatus(ConsultationStatus.CANCELLED));
                    }
                    return super.updateConsultationStatus(consultation);
                }
            };
            ConsultationLifecycle racy = new ConsultationLifecycle(racing,
                new PersistenceWriter(Runnable::run, clock), events, RoomPolicy.DEFAULTS, clock);
            UUID id = UUID.randomUUID();
            racy.register(scheduledConsultation(id));

            // Act
            TransitionResult result = racy.onParticipantJoined(id, "pat-1", ParticipantRole.PATIENT);

            // Assert
            assertThat(result.isApplied()).isFalse();
            assertThat(result.getConsultation().getStatus()).isEqualTo(ConsultationStatus.CANCELLED);
            assertThat(racing.stored(id).getStatus()).isEqualTo(ConsultationStatus.CANCELLED);
            assertThat(racing.stored(id).getPatientJoinedAt()).isNull();
            assertThat(racy.isPersistencePending(id)).isFalse();
            assertThat(racy.trackedCount()).isZero();
        }

        @Test
        @DisplayName("Should version every write")
        void shouldBumpVersionOnWrite() {
            // Arrange
            Long registered = store.stored(consultationId).getVersion();

            // Act
            TransitionResult result = lifecycle.onParticipantJoined(consultationId, "pat-1", ParticipantRole.PATIENT);

            // Assert
            assertThat(registered).isZero();
            assertThat(result.getConsultation().getVersion()).isEqualTo(1L);
            assertThat(store.stored(consultationId).getVersion()).isEqualTo(1L);
        }
    }

    @Nested
    @DisplayName("Memory")
    class MemoryTests {

        @Test
        @DisplayName("Should not keep a consultation in memory after a written transition")
        void shouldReleaseAfterNonTerminalTransition() {
            // Act
            lifecycle.onParticipantJoined(consultationId, "pat-1", ParticipantRole.PATIENT);

            // Assert
            assertThat(lifecycle.trackedCount()).isZero();
            assertThat(lifecycle.require(consultationId).getStatus()).isEqualTo(ConsultationStatus.WAITING);
        }

        @Test
        @DisplayName("Should not keep a consultation in memory after a rejected transition")
        void shouldReleaseAfterRejection() {
            // Act
            assertThatThrownBy(() -> lifecycle.end(consultationId, "doc-1", false))
                .isInstanceOf(InvalidTransitionException.class);

            // Assert
            assertThat(lifecycle.trackedCount()).isZero();
        }

        @Test
        @DisplayName("Should not keep an unknown consultation in memory")
        void shouldReleaseUnknownConsultation() {
            // Act
            assertThatThrownBy(() -> lifecycle.start(UUID.randomUUID(), "doc-1", false))
                .isInstanceOf(ConsultationNotFoundException.class);

            // Assert
            assertThat(lifecycle.trackedCount()).isZero();
        }
    }

    @Nested
    @DisplayName("start / end")
    class StartEndTests {

        @Test
        @DisplayName("Should reject a start by someone other than the doctor")
        void shouldRejectStartByPatient() {
            assertThatThrownBy(() -> lifecycle.start(consultationId, "pat-1", false))
                .isInstanceOf(ForbiddenOperationException.class);
        }

        @Test
        @DisplayName("Should let an admin start without a doctor join")
        void shouldLetAdminStart() {
            // Act
            TransitionResult result = lifecycle.start(consultationId, null, true);

            // Assert
            assertThat(result.getConsultation().getStatus()).isEqualTo(ConsultationStatus.IN_PROGRESS);
            assertThat(result.getConsultation().getDoctorJoinedAt()).isNull();
        }

        @Test
        @DisplayName("Should only end a consultation that is in progress")
        void shouldRejectEndBeforeStart() {
            assertThatThrownBy(() -> lifecycle.end(consultationId, "doc-1", false))
                .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("Should record the duration and read it back after completion")
        void shouldRecordDuration() {
            // Arrange
            lifecycle.start(consultationId, "doc-1", false);
            clock.advance(Duration.ofSeconds(150));

            // Act
            TransitionResult result = lifecycle.end(consultationId, "doc-1", false);
            Consultation reread = lifecycle.require(consultationId);

            // Assert
            assertThat(result.getConsultation().getStatus()).isEqualTo(ConsultationStatus.COMPLETED);
            assertThat(result.getConsultation().getDurationSeconds()).isEqualTo(150L);
            assertThat(result.getConsultation().getDurationMinutes()).isEqualTo(2);
            assertThat(reread.getStatus()).isEqualTo(ConsultationStatus.COMPLETED);
            assertThat(reread.getDurationSeconds()).isEqualTo(150L);
            assertThat(reread.getActualEndTime()).isEqualTo(SCHEDULED_AT.plusSeconds(150));
            assertThat(lifecycle.trackedCount()).isZero();
        }

        @Test
        @DisplayName("Should announce the terminal status once")
        void shouldPublishTerminatedEvent() {
            // Arrange
            lifecycle.start(consultationId, "doc-1", false);

            // Act
            lifecycle.end(consultationId, "doc-1", false);

            // Assert
            ArgumentCaptor<ConsultationTerminatedEvent> captor = ArgumentCaptor.forClass(ConsultationTerminatedEvent.class);
            verify(events, times(1)).publishEvent(captor.capture());
            assertThat(captor.getValue().getConsultationId()).isEqualTo(consultationId);
            assertThat(captor.getValue().getStatus()).isEqualTo(ConsultationStatus.COMPLETED);
        }
    }

    @Nested
    @DisplayName("cancel")
    class CancelTests {

        @Test
        @DisplayName("Should require a reason")
        void shouldRequireReason() {
            assertThatThrownBy(() -> lifecycle.cancel(consultationId, " ", "pat-1"))
                .isInstanceOf(InvalidRequestException.class);
        }

        @Test
        @DisplayName("Should record who cancelled and why")
        void shouldCancel() {
            // Act
            TransitionResult result = lifecycle.cancel(consultationId, "Feeling better", "pat-1");

            // Assert
            Consultation cancelled = result.getConsultation();
            assertThat(cancelled.getStatus()).isEqualTo(ConsultationStatus.CANCELLED);
            assertThat(cancelled.getCancellationReason()).isEqualTo("Feeling better");
            assertThat(cancelled.getCancelledBy()).isEqualTo("pat-1");
            assertThat(cancelled.getCancelledAt()).isEqualTo(SCHEDULED_AT);
            assertThat(cancelled.getDurationSeconds()).isNull();
        }

        @Test
        @DisplayName("Should close the running interval when an active consultation is cancelled")
        void shouldRecordDurationOnCancelInProgress() {
            // Arrange
            lifecycle.start(consultationId, "doc-1", false);
            clock.advance(Duration.ofSeconds(75));

            // Act
            TransitionResult result = lifecycle.cancel(consultationId, "Connection problems", "doc-1");

            // Assert
            assertThat(result.getConsultation().getDurationSeconds()).isEqualTo(75L);
            assertThat(result.getConsultation().getDurationMinutes()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should let only one of two concurrent cancels succeed")
        void shouldCancelOnce() throws Exception {
            // Arrange
            AtomicInteger rejected = new AtomicInteger();

            // Act
            List<Boolean> outcomes = runConcurrently(2, () -> {
                try {
                    return lifecycle.cancel(consultationId, "duplicate click", "pat-1").statusChanged();
                } catch (InvalidTransitionException e) {
                    rejected.incrementAndGet();
                    return false;
                }
            });

            // Assert
            assertThat(outcomes).containsOnlyOnce(true);
            assertThat(rejected.get()).isEqualTo(1);
            verify(events, times(1)).publishEvent(any(ConsultationTerminatedEvent.class));
        }

        @Test
        @DisplayName("Should reject cancelling a completed consultation")
        void shouldRejectCancelAfterCompletion() {
            // Arrange
            lifecycle.start(consultationId, "doc-1", false);
            lifecycle.end(consultationId, "doc-1", false);

            // Act & Assert
            assertThatThrownBy(() -> lifecycle.cancel(consultationId, "too late", "pat-1"))
                .isInstanceOf(InvalidTransitionException.class);
        }
    }

    @Nested
    @DisplayName("markNoShow")
    class NoShowTests {

        @Test
        @DisplayName("Should not mark a consultation before it is overdue")
        void shouldWaitUntilOverdue() {
            // Arrange
            clock.advance(Duration.ofMinutes(10));

            // Act & Assert
            assertThatThrownBy(() -> lifecycle.markNoShow(consultationId))
                .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("Should mark an overdue consultation nobody joined")
        void shouldMarkNoShow() {
            // Arrange
            clock.advance(Duration.ofMinutes(15));

            // Act
            TransitionResult result = lifecycle.markNoShow(consultationId);

            // Assert
            assertThat(result.getConsultation().getStatus()).isEqualTo(ConsultationStatus.NO_SHOW);
            assertThat(store.stored(consultationId).getStatus()).isEqualTo(ConsultationStatus.NO_SHOW);
        }

        @Test
        @DisplayName("Should not mark a consultation someone joined")
        void shouldNotMarkWhenPatientWaiting() {
            // Arrange
            lifecycle.onParticipantJoined(consultationId, "pat-1", ParticipantRole.PATIENT);
            clock.advance(Duration.ofHours(1));

            // Act & Assert
            assertThatThrownBy(() -> lifecycle.markNoShow(consultationId))
                .isInstanceOf(InvalidTransitionException.class);
        }
    }

    @Nested
    @DisplayName("Degraded persistence")
    class DegradedPersistenceTests {

        @Test
        @DisplayName("Should apply the transition in memory and warn when the store is down")
        void shouldWarnWhenStoreDown() {
            // Arrange
            store.setAvailable(false);

            // Act
            TransitionResult result = lifecycle.onParticipantJoined(consultationId, "doc-1", ParticipantRole.DOCTOR);

            // Assert
            assertThat(result.getConsultation().getStatus()).isEqualTo(ConsultationStatus.IN_PROGRESS);
            assertThat(result.getWarnings()).containsExactly(ErrorCode.PERSISTENCE_DEGRADED);
            assertThat(result.isPersistenceDegraded()).isTrue();
            assertThat(lifecycle.isPersistencePending(consultationId)).isTrue();
            assertThat(store.stored(consultationId).getStatus()).isEqualTo(ConsultationStatus.SCHEDULED);
        }

        @Test
        @DisplayName("Should write the buffered state on the next read once the store recovers")
        void shouldReconcileOnRead() {
            // Arrange
            store.setAvailable(false);
            lifecycle.onParticipantJoined(consultationId, "doc-1", ParticipantRole.DOCTOR);
            store.setAvailable(true);

            // Act
            Consultation current = lifecycle.require(consultationId);

            // Assert
            assertThat(current.getStatus()).isEqualTo(ConsultationStatus.IN_PROGRESS);
            assertThat(store.stored(consultationId).getStatus()).isEqualTo(ConsultationStatus.IN_PROGRESS);
            assertThat(lifecycle.isPersistencePending(consultationId)).isFalse();
        }

        @Test
        @DisplayName("Should keep a terminal consultation in memory until it is written")
        void shouldHoldTerminalStateUntilWritten() {
            // Arrange
            lifecycle.start(consultationId, "doc-1", false);
            store.setAvailable(false);

            // Act
            lifecycle.end(consultationId, "doc-1", false);

            // Assert
            assertThat(lifecycle.trackedCount()).isEqualTo(1);
            assertThat(lifecycle.require(consultationId).getStatus()).isEqualTo(ConsultationStatus.COMPLETED);
            store.setAvailable(true);
            assertThat(lifecycle.require(consultationId).getStatus()).isEqualTo(ConsultationStatus.COMPLETED);
            assertThat(lifecycle.trackedCount()).isZero();
            assertThat(store.stored(consultationId).getStatus()).isEqualTo(ConsultationStatus.COMPLETED);
        }
    }
}
