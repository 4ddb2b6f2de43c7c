package com.bcnjobs.tracker.scrape.api;

import com.bcnjobs.tracker.scrape.model.CompanyEntry;
import com.bcnjobs.tracker.scrape.model.JobRecord;
import com.bcnjobs.tracker.scrape.model.JobRecordView;
import com.bcnjobs.tracker.scrape.persistence.JobRecordRepository;
import com.bcnjobs.tracker.scrape.registry.CompanyRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class JobsController {
    private static final Duration DEFAULT_RECENT_WINDOW = Duration.ofDays(7);

    private final JobRecordRepository repository;
    private final CompanyRegistry registry;
    private final Clock clock;

    public JobsController(JobRecordRepository repository, CompanyRegistry registry, Clock clock) {
        this.repository = repository;
        this.registry = registry;
        this.clock = clock;
    }

    @GetMapping("/jobs/recent")
    public List<JobRecordView> recent(@RequestParam(name = "since", required = false) String since) {
        Instant sinceInstant = since == null || since.isBlank()
            ? clock.instant().minus(DEFAULT_RECENT_WINDOW)
            : parseInstant(since);
        return toViews(repository.queryRecent(sinceInstant));
    }

    @GetMapping("/jobs/dashboard")
    public List<JobRecordView> dashboard() {
        return toViews(repository.queryTargetLocation());
    }

    @GetMapping("/jobs/{identityKey}")
    public JobRecordView job(@PathVariable("identityKey") String identityKey) {
        JobRecord record = repository.findByIdentityKey(identityKey);
        if (record == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown job " + identityKey);
        }
        return JobRecordView.of(record, registry.findById(record.companyId()));
    }

    @GetMapping("/companies")
    public List<CompanyEntry> companies() {
        return registry.companies();
    }

    private List<JobRecordView> toViews(List<JobRecord> records) {
        Map<String, CompanyEntry> companies = registry.companies().stream()
            .collect(Collectors.toMap(CompanyEntry::id, Function.identity(), (first, second) -> first));
        return records.stream()
            .map(record -> JobRecordView.of(record, companies.get(record.companyId())))
            .toList();
    }

    private Instant parseInstant(String raw) {
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ResponseStatusException(BAD_REQUEST, "since must be an ISO-8601 instant");
        }
    }
}
