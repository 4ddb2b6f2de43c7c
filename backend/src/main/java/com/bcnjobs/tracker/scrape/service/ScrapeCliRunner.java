package com.bcnjobs.tracker.scrape.service;

import com.bcnjobs.tracker.config.TrackerProperties;
import com.bcnjobs.tracker.scrape.model.ScrapeRunSummary;
import com.bcnjobs.tracker.scrape.model.SourceRunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final TrackerProperties properties;
    private final ScrapeOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        TrackerProperties properties,
        ScrapeOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        ScrapeRunSummary summary = orchestratorService.run();
        for (SourceRunResult source : summary.sources()) {
            log.info(
                "Summary {} [{}]: status={}, scanned={}, matched={}, new={}, duplicates={}, errors={}",
                source.companyId(),
                source.sourceFamily(),
                source.status(),
                source.scannedCount(),
                source.matchedCount(),
                source.newCount(),
                source.duplicateCount(),
                source.errors()
            );
        }
        log.info(
            "Scrape run finished: succeeded={}, failed={}, skipped={}, new={}",
            summary.succeededCount(),
            summary.failedCount(),
            summary.skippedCount(),
            summary.totalNew()
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
