package com.bcnjobs.tracker.scrape.service;

import com.bcnjobs.tracker.scrape.model.CompanyEntry;
import com.bcnjobs.tracker.scrape.model.JobRecord;
import com.bcnjobs.tracker.scrape.model.SourceFamily;
import com.bcnjobs.tracker.scrape.model.SourceFetchResult;
import com.bcnjobs.tracker.scrape.model.SourceRunResult;
import com.bcnjobs.tracker.scrape.model.SourceStatus;
import com.bcnjobs.tracker.scrape.model.SubmitResult;
import com.bcnjobs.tracker.scrape.persistence.JobRecordRepository;
import com.bcnjobs.tracker.scrape.source.SourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one registry entry through its adapter and submits every candidate to the store.
 */
@Service
public class SourceScrapeService {
    private static final Logger log = LoggerFactory.getLogger(SourceScrapeService.class);

    private final SourceAdapterRegistry adapters;
    private final JobRecordRepository repository;

    public SourceScrapeService(SourceAdapterRegistry adapters, JobRecordRepository repository) {
        this.adapters = adapters;
        this.repository = repository;
    }

    /**
     * Reason the entry cannot be scraped at all, or null when it can.
     */
    public String skipReason(CompanyEntry company) {
        SourceFamily family = company.sourceFamily();
        if (family == null) {
            return "source family not configured";
        }
        if (family == SourceFamily.MANUAL) {
            return "manual source";
        }
        if (family.requiresIdentifier() && !company.hasSourceIdentifier()) {
            return "source identifier not configured";
        }
        if (adapters.find(family) == null) {
            return "no adapter for " + family;
        }
        return null;
    }

    public SourceRunResult scrape(CompanyEntry company) {
        String skipReason = skipReason(company);
        if (skipReason != null) {
            log.info("Skipping {}: {}", company.id(), skipReason);
            return SourceRunResult.skipped(company, skipReason);
        }
        SourceAdapter adapter = adapters.find(company.sourceFamily());
        SourceFetchResult fetch = adapter.fetch(company);
        if (fetch.status() != SourceStatus.SUCCESS) {
            if (fetch.status() == SourceStatus.SKIPPED) {
                log.info("Skipping {}: {}", company.id(), fetch.message());
            }
            return new SourceRunResult(
                company.id(),
                company.sourceFamily(),
                fetch.status(),
                fetch.scannedCount(),
                0,
                0,
                0,
                fetch.errors(),
                fetch.message()
            );
        }

        int newCount = 0;
        int duplicateCount = 0;
        for (JobRecord record : fetch.records()) {
            if (repository.submit(record) == SubmitResult.INSERTED) {
                newCount++;
                log.info("New job: {} at {}", record.title(), company.displayName());
            } else {
                duplicateCount++;
            }
        }
        return new SourceRunResult(
            company.id(),
            company.sourceFamily(),
            SourceStatus.SUCCESS,
            fetch.scannedCount(),
            fetch.records().size(),
            newCount,
            duplicateCount,
            fetch.errors(),
            fetch.message()
        );
    }
}
