package com.mediconnect.entity;

public enum ParticipantRole {
    DOCTOR,
    PATIENT,
    NURSE,
    OBSERVER
}
