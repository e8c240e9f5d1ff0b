package com.mediconnect.room;

public enum ConnectionQuality {
    POOR,
    FAIR,
    GOOD,
    EXCELLENT
}
