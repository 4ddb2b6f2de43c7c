package com.bcnjobs.tracker.scrape.api;

import com.bcnjobs.tracker.scrape.model.ScrapeRunSummary;
import com.bcnjobs.tracker.scrape.service.ScrapeOrchestratorService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scrape")
public class ScrapeController {
    private final ScrapeOrchestratorService orchestratorService;

    public ScrapeController(ScrapeOrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/run")
    public ScrapeRunSummary run() {
        return orchestratorService.run();
    }
}
