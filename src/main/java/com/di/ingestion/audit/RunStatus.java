package com.di.ingestion.audit;

public enum RunStatus {
    SUCCESS,
    FAILED
}
