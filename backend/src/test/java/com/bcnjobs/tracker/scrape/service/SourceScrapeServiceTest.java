package com.bcnjobs.tracker.scrape.service;

import com.bcnjobs.tracker.scrape.model.CompanyEntry;
import com.bcnjobs.tracker.scrape.model.JobRecord;
import com.bcnjobs.tracker.scrape.model.RawPosting;
import com.bcnjobs.tracker.scrape.model.SourceFamily;
import com.bcnjobs.tracker.scrape.model.SourceFetchResult;
import com.bcnjobs.tracker.scrape.model.SourceRunResult;
import com.bcnjobs.tracker.scrape.model.SourceStatus;
import com.bcnjobs.tracker.scrape.model.SubmitResult;
import com.bcnjobs.tracker.scrape.persistence.JobRecordRepository;
import com.bcnjobs.tracker.scrape.source.JobRecordFactory;
import com.bcnjobs.tracker.scrape.source.SourceAdapter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SourceScrapeServiceTest {

    @Mock
    private SourceAdapterRegistry adapters;
    @Mock
    private JobRecordRepository repository;
    @Mock
    private SourceAdapter adapter;

    @Test
    void countsNewAndDuplicateSubmissions() {
        CompanyEntry company = company("typeform", SourceFamily.GREENHOUSE, "typeform");
        JobRecord fresh = record("https://boards.greenhouse.io/typeform/jobs/1");
        JobRecord seen = record("https://boards.greenhouse.io/typeform/jobs/2");
        when(adapters.find(SourceFamily.GREENHOUSE)).thenReturn(adapter);
        when(adapter.fetch(company)).thenReturn(SourceFetchResult.success(List.of(fresh, seen), 14, Map.of("greenhouse_detail_http_500", 1)));
        when(repository.submit(fresh)).thenReturn(SubmitResult.INSERTED);
        when(repository.submit(seen)).thenReturn(SubmitResult.DUPLICATE);

        SourceRunResult result = new SourceScrapeService(adapters, repository).scrape(company);

        assertEquals(SourceStatus.SUCCESS, result.status());
        assertEquals(14, result.scannedCount());
        assertEquals(2, result.matchedCount());
        assertEquals(1, result.newCount());
        assertEquals(1, result.duplicateCount());
        assertEquals(Map.of("greenhouse_detail_http_500", 1), result.errors());
    }

    @Test
    void failedFetchSubmitsNothing() {
        CompanyEntry company = company("typeform", SourceFamily.LEVER, "typeform");
        when(adapters.find(SourceFamily.LEVER)).thenReturn(adapter);
        when(adapter.fetch(company)).thenReturn(SourceFetchResult.failed(Map.of("lever_http_404", 1), "lever_http_404"));

        SourceRunResult result = new SourceScrapeService(adapters, repository).scrape(company);

        assertEquals(SourceStatus.FAILED, result.status());
        assertEquals("lever_http_404", result.message());
        verify(repository, never()).submit(any());
    }

    @Test
    void skipsManualAndUnconfiguredEntriesWithoutCallingAdapters() {
        SourceScrapeService service = new SourceScrapeService(adapters, repository);

        assertEquals("manual source", service.skipReason(company("glovo", SourceFamily.MANUAL, null)));
        assertEquals("source family not configured", service.skipReason(company("initech", null, "x")));
        assertEquals("source identifier not configured", service.skipReason(company("acme", SourceFamily.ASHBY, " ")));
        assertEquals(SourceStatus.SKIPPED, service.scrape(company("glovo", SourceFamily.MANUAL, null)).status());
        verifyNoInteractions(adapters, repository);
    }

    @Test
    void amazonNeedsNoIdentifier() {
        when(adapters.find(SourceFamily.AMAZON)).thenReturn(adapter);

        assertNull(new SourceScrapeService(adapters, repository).skipReason(company("amazon", SourceFamily.AMAZON, null)));
    }

    private CompanyEntry company(String id, SourceFamily family, String identifier) {
        return new CompanyEntry(id, id, family, identifier, false, null, null);
    }

    private JobRecord record(String url) {
        return JobRecordFactory.toCandidate(new RawPosting("typeform", "Data Scientist", url, "Barcelona", null, null, ""), false);
    }
}
