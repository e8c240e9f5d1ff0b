package com.mediconnect.config;

import com.mediconnect.room.RoomPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Time source, room policy and the worker pools behind live rooms.
 */
@Configuration
@EnableScheduling
@Slf4j
public class ConsultationCoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RoomPolicy roomPolicy(
            @Value("${mediconnect.rooms.empty-grace-seconds:120}") long emptyGraceSeconds,
            @Value("${mediconnect.rooms.reconnect-grace-seconds:120}") long reconnectGraceSeconds,
            @Value("${mediconnect.rooms.idle-timeout-seconds:1800}") long idleTimeoutSeconds,
            @Value("${mediconnect.consultations.no-show-after-minutes:15}") long noShowAfterMinutes) {

        RoomPolicy policy = RoomPolicy.builder()
            .emptyRoomGrace(Duration.ofSeconds(emptyGraceSeconds))
            .reconnectGrace(Duration.ofSeconds(reconnectGraceSeconds))
            .idleTimeout(Duration.ofSeconds(idleTimeoutSeconds))
            .noShowAfter(Duration.ofMinutes(noShowAfterMinutes))
            .build();
        log.info("Room policy: {}", policy);
        return policy;
    }

    @Bean(name = "relayExecutor", destroyMethod = "shutdown")
    public ExecutorService relayExecutor(
            @Value("${mediconnect.relay.threads:0}") int threads) {
        int size = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
        return Executors.newFixedThreadPool(size, named("room-relay-"));
    }

    @Bean(name = "persistenceExecutor", destroyMethod = "shutdown")
    public ExecutorService persistenceExecutor() {
        return Executors.newSingleThreadExecutor(named("consultation-persistence-"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
