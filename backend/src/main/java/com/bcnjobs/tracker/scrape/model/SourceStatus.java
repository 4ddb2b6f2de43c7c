package com.bcnjobs.tracker.scrape.model;

public enum SourceStatus {
    SUCCESS,
    FAILED,
    SKIPPED
}
