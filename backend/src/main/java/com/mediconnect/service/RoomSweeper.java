package com.mediconnect.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class RoomSweeper {

    private final ConsultationRoomService roomService;

    @Scheduled(fixedDelayString = "${mediconnect.rooms.sweep-interval-ms:30000}")
    public void closeInactiveRooms() {
        try {
            roomService.sweepRooms();
        } catch (RuntimeException e) {
            log.error("Room sweep failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${mediconnect.consultations.no-show-check-interval-ms:60000}")
    public void markNoShows() {
        try {
            roomService.detectNoShows();
        } catch (RuntimeException e) {
            log.error("No-show check failed: {}", e.getMessage(), e);
        }
    }
}
