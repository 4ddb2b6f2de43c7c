package com.bcnjobs.tracker.scrape.model;

public enum WorkType {
    REMOTE,
    HYBRID,
    ON_SITE
}
