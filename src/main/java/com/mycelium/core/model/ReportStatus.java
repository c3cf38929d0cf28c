package com.mycelium.core.model;

public enum ReportStatus {
    SUCCESS,
    FAILED
}
