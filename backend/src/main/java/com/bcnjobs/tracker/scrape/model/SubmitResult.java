package com.bcnjobs.tracker.scrape.model;

public enum SubmitResult {
    INSERTED,
    DUPLICATE
}
