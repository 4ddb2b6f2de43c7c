package com.bcnjobs.tracker.scrape.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveScrapeRunException extends RuntimeException {
    public ActiveScrapeRunException(String message) {
        super(message);
    }
}
