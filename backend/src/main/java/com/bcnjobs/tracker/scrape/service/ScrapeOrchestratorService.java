package com.bcnjobs.tracker.scrape.service;

import com.bcnjobs.tracker.config.TrackerProperties;
import com.bcnjobs.tracker.scrape.model.CompanyEntry;
import com.bcnjobs.tracker.scrape.model.ScrapeRunSummary;
import com.bcnjobs.tracker.scrape.model.SourceRunResult;
import com.bcnjobs.tracker.scrape.model.SourceStatus;
import com.bcnjobs.tracker.scrape.registry.CompanyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs every registry entry once. With {@code tracker.source-concurrency=1} sources run in registry
 * order with {@code tracker.source-delay-ms} between invocations; otherwise they share the bounded
 * scrape pool. A failing source never stops the others.
 */
@Service
public class ScrapeOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestratorService.class);

    private final CompanyRegistry registry;
    private final SourceScrapeService sourceScrapeService;
    private final ExecutorService scrapeExecutor;
    private final TrackerProperties properties;
    private final Clock clock;
    private final AtomicReference<Instant> activeRunStartedAt = new AtomicReference<>();

    public ScrapeOrchestratorService(
        CompanyRegistry registry,
        SourceScrapeService sourceScrapeService,
        @Qualifier("scrapeExecutor") ExecutorService scrapeExecutor,
        TrackerProperties properties,
        Clock clock
    ) {
        this.registry = registry;
        this.sourceScrapeService = sourceScrapeService;
        this.scrapeExecutor = scrapeExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isRunActive() {
        return activeRunStartedAt.get() != null;
    }

    /**
     * @throws ActiveScrapeRunException when another run is still in progress in this process
     */
    public ScrapeRunSummary run() {
        Instant startedAt = clock.instant();
        if (!activeRunStartedAt.compareAndSet(null, startedAt)) {
            throw new ActiveScrapeRunException("Active scrape run in progress (startedAt=" + activeRunStartedAt.get() + ")");
        }
        try {
            return runStarted(startedAt);
        } finally {
            activeRunStartedAt.set(null);
        }
    }

    private ScrapeRunSummary runStarted(Instant startedAt) {
        List<CompanyEntry> companies = registry.companies();
        Instant deadline = startedAt.plusSeconds(properties.getRun().getMaxDurationSeconds());
        log.info("Scrape run started for {} configured sources", companies.size());

        List<SourceRunResult> results = properties.getSourceConcurrency() <= 1
            ? runSequential(companies, deadline)
            : runConcurrent(companies, deadline);

        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        int totalNew = 0;
        for (SourceRunResult result : results) {
            switch (result.status()) {
                case SUCCESS -> succeeded++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
            totalNew += result.newCount();
        }
        int configured = companies.size();
        boolean highFailureRate = configured > 0
            && failed > properties.getFailureRateWarningThreshold() * configured;

        log.info("Companies scraped: {}/{}", configured - failed, configured);
        log.info("Total new jobs found: {}", totalNew);
        if (highFailureRate) {
            log.warn(
                "High failure rate: {} of {} sources failed (threshold {})",
                failed,
                configured,
                properties.getFailureRateWarningThreshold()
            );
        }
        return new ScrapeRunSummary(
            startedAt,
            clock.instant(),
            configured,
            configured - skipped,
            succeeded,
            failed,
            skipped,
            totalNew,
            highFailureRate,
            results
        );
    }

    private List<SourceRunResult> runSequential(List<CompanyEntry> companies, Instant deadline) {
        List<SourceRunResult> results = new ArrayList<>(companies.size());
        boolean invokedAny = false;
        boolean stopped = false;
        for (CompanyEntry company : companies) {
            if (stopped || clock.instant().isAfter(deadline)) {
                results.add(SourceRunResult.failed(company, errorMap("run_deadline_exceeded"), "run_deadline_exceeded"));
                continue;
            }
            if (sourceScrapeService.skipReason(company) != null) {
                results.add(scrapeSafely(company));
                continue;
            }
            if (invokedAny && !pauseBetweenSources()) {
                stopped = true;
                results.add(SourceRunResult.failed(company, errorMap("run_interrupted"), "run_interrupted"));
                continue;
            }
            invokedAny = true;
            results.add(scrapeSafely(company));
        }
        return results;
    }

    private List<SourceRunResult> runConcurrent(List<CompanyEntry> companies, Instant deadline) {
        List<CompletableFuture<SourceRunResult>> futures = new ArrayList<>(companies.size());
        for (CompanyEntry company : companies) {
            futures.add(CompletableFuture.supplyAsync(() -> scrapeSafely(company), scrapeExecutor));
        }
        List<SourceRunResult> results = new ArrayList<>(companies.size());
        for (int i = 0; i < futures.size(); i++) {
            CompanyEntry company = companies.get(i);
            CompletableFuture<SourceRunResult> future = futures.get(i);
            long remainingMs = Math.max(0, Duration.between(clock.instant(), deadline).toMillis());
            try {
                results.add(future.get(remainingMs, TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Source {} did not finish before the run deadline", company.id());
                results.add(SourceRunResult.failed(company, errorMap("run_deadline_exceeded"), "run_deadline_exceeded"));
            } catch (ExecutionException e) {
                log.warn("Source {} failed", company.id(), e.getCause());
                results.add(SourceRunResult.failed(company, errorMap("source_exception"), describe(e.getCause())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                results.add(SourceRunResult.failed(company, errorMap("run_interrupted"), "run_interrupted"));
            }
        }
        return results;
    }

    private SourceRunResult scrapeSafely(CompanyEntry company) {
        try {
            return sourceScrapeService.scrape(company);
        } catch (RuntimeException e) {
            log.warn("Source {} ({}) failed", company.id(), company.sourceFamily(), e);
            return SourceRunResult.failed(company, errorMap("source_exception"), describe(e));
        }
    }

    private boolean pauseBetweenSources() {
        int delayMs = properties.getSourceDelayMs();
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scrape run interrupted between sources");
            return false;
        }
    }

    private Map<String, Integer> errorMap(String key) {
        Map<String, Integer> errors = new LinkedHashMap<>();
        errors.put(key, 1);
        return errors;
    }

    private String describe(Throwable error) {
        if (error == null) {
            return "source_exception";
        }
        return error.getMessage() == null
            ? error.getClass().getSimpleName()
            : error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
