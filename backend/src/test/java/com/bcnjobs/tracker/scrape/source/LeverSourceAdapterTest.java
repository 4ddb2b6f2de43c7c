package com.bcnjobs.tracker.scrape.source;

import com.bcnjobs.tracker.config.TrackerProperties;
import com.bcnjobs.tracker.scrape.http.PoliteHttpClient;
import com.bcnjobs.tracker.scrape.model.JobRecord;
import com.bcnjobs.tracker.scrape.model.SourceFamily;
import com.bcnjobs.tracker.scrape.model.SourceFetchResult;
import com.bcnjobs.tracker.scrape.model.SourceStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;

import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.company;
import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.failure;
import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.ok;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeverSourceAdapterTest {
    private static final String FEED_URL = "https://api.lever.co/v0/postings/wallapop?mode=json";

    @Mock
    private PoliteHttpClient httpClient;

    @Test
    void mapsPostingFields() {
        String payload = """
            [
              {
                "id": "abc-123",
                "text": "Machine Learning Engineer",
                "hostedUrl": "https://jobs.lever.co/wallapop/abc-123",
                "applyUrl": "https://jobs.lever.co/wallapop/abc-123/apply",
                "createdAt": 1767225600000,
                "categories": { "location": "Barcelona", "team": "AI", "commitment": "Full-time" },
                "descriptionPlain": "Build ranking models. Relocation package provided."
              },
              {
                "id": "def-456",
                "text": "Customer Care Agent",
                "hostedUrl": "https://jobs.lever.co/wallapop/def-456",
                "categories": { "location": "Barcelona" },
                "descriptionPlain": "Help customers."
              }
            ]
            """;
        when(httpClient.get(eq(FEED_URL), anyString())).thenReturn(ok(FEED_URL, payload));
        LeverSourceAdapter adapter = new LeverSourceAdapter(httpClient, new ObjectMapper(), new TrackerProperties());

        SourceFetchResult result = adapter.fetch(company("wallapop", SourceFamily.LEVER, "wallapop"));

        assertThat(result.status()).isEqualTo(SourceStatus.SUCCESS);
        assertThat(result.scannedCount()).isEqualTo(2);
        assertThat(result.records()).hasSize(1);
        JobRecord record = result.records().get(0);
        assertThat(record.url()).isEqualTo("https://jobs.lever.co/wallapop/abc-123");
        assertThat(record.department()).isEqualTo("AI");
        assertThat(record.postedDate()).isEqualTo(LocalDate.of(2026, 1, 1));
        assertThat(record.mentionsRelocation()).isTrue();
        assertThat(record.mentionsVisaSupport()).isFalse();
        assertThat(record.coreRole()).isTrue();
    }

    @Test
    void timeoutFailsWithAdapterErrorKey() {
        when(httpClient.get(eq(FEED_URL), anyString())).thenReturn(failure(FEED_URL, "timeout"));
        LeverSourceAdapter adapter = new LeverSourceAdapter(httpClient, new ObjectMapper(), new TrackerProperties());

        SourceFetchResult result = adapter.fetch(company("wallapop", SourceFamily.LEVER, "wallapop"));

        assertThat(result.status()).isEqualTo(SourceStatus.FAILED);
        assertThat(result.message()).isEqualTo("lever_timeout");
    }
}
