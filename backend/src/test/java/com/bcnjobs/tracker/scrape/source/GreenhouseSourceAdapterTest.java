package com.bcnjobs.tracker.scrape.source;

import com.bcnjobs.tracker.config.TrackerProperties;
import com.bcnjobs.tracker.scrape.http.PoliteHttpClient;
import com.bcnjobs.tracker.scrape.model.JobRecord;
import com.bcnjobs.tracker.scrape.model.SourceFamily;
import com.bcnjobs.tracker.scrape.model.SourceFetchResult;
import com.bcnjobs.tracker.scrape.model.SourceStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;

import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.company;
import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.fixture;
import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.ok;
import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.status;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GreenhouseSourceAdapterTest {
    private static final String FEED_URL = "https://boards-api.greenhouse.io/v1/boards/acme/jobs?content=true";

    @Mock
    private PoliteHttpClient httpClient;

    private GreenhouseSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new GreenhouseSourceAdapter(httpClient, new ObjectMapper(), new TrackerProperties());
    }

    @Test
    void keepsOnlyLocalEnglishDataRoles() {
        when(httpClient.get(eq(FEED_URL), anyString())).thenReturn(ok(FEED_URL, fixture("greenhouse-jobs.json")));

        SourceFetchResult result = adapter.fetch(company("acme", SourceFamily.GREENHOUSE, "acme"));

        assertThat(result.status()).isEqualTo(SourceStatus.SUCCESS);
        assertThat(result.scannedCount()).isEqualTo(4);
        assertThat(result.records()).hasSize(1);
        JobRecord record = result.records().get(0);
        assertThat(record.companyId()).isEqualTo("acme");
        assertThat(record.title()).isEqualTo("Senior Data Scientist");
        assertThat(record.url()).isEqualTo("https://boards.greenhouse.io/acme/jobs/4012001?gh_src=abc");
        assertThat(record.location()).isEqualTo("Barcelona, Spain");
        assertThat(record.department()).isEqualTo("Data");
        assertThat(record.postedDate()).isEqualTo(LocalDate.of(2026, 2, 1));
        assertThat(record.description()).isEqualTo("Join our team. We offer visa sponsorship.");
        assertThat(record.mentionsVisaSupport()).isTrue();
    }

    @Test
    void httpErrorFailsTheSource() {
        when(httpClient.get(eq(FEED_URL), anyString())).thenReturn(status(FEED_URL, 404));

        SourceFetchResult result = adapter.fetch(company("acme", SourceFamily.GREENHOUSE, "acme"));

        assertThat(result.status()).isEqualTo(SourceStatus.FAILED);
        assertThat(result.records()).isEmpty();
        assertThat(result.errors()).containsEntry("greenhouse_http_404", 1);
    }

    @Test
    void malformedPayloadFailsTheSource() {
        when(httpClient.get(eq(FEED_URL), anyString())).thenReturn(ok(FEED_URL, "{not json"));

        SourceFetchResult result = adapter.fetch(company("acme", SourceFamily.GREENHOUSE, "acme"));

        assertThat(result.status()).isEqualTo(SourceStatus.FAILED);
        assertThat(result.errors()).containsKey("greenhouse_parse_error");
    }

    @Test
    void missingBoardTokenIsSkipped() {
        SourceFetchResult result = adapter.fetch(company("acme", SourceFamily.GREENHOUSE, " "));

        assertThat(result.status()).isEqualTo(SourceStatus.SKIPPED);
        verifyNoInteractions(httpClient);
    }
}
