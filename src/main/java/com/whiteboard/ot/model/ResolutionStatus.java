package com.whiteboard.ot.model;

public enum ResolutionStatus {
    RESOLVED,
    PENDING_MANUAL,
    ABANDONED,
    FAILED
}
