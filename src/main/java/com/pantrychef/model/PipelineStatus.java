package com.pantrychef.model;

public enum PipelineStatus {
    DONE,
    RATE_LIMITED,
    FAILED
}
