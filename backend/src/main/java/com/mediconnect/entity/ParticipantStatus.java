package com.mediconnect.entity;

public enum ParticipantStatus {
    INVITED,
    JOINED,
    LEFT,
    DISCONNECTED
}
