package com.bcnjobs.tracker.scrape.source;

import com.bcnjobs.tracker.config.TrackerProperties;
import com.bcnjobs.tracker.scrape.http.PoliteHttpClient;
import com.bcnjobs.tracker.scrape.model.JobRecord;
import com.bcnjobs.tracker.scrape.model.SourceFamily;
import com.bcnjobs.tracker.scrape.model.SourceFetchResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;

import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.company;
import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.ok;
import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.status;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SmartRecruitersSourceAdapterTest {
    private static final String LIST_URL = "https://api.smartrecruiters.com/v1/companies/Adevinta/postings?offset=0&limit=100";
    private static final String DETAIL_URL = "https://api.smartrecruiters.com/v1/companies/Adevinta/postings/744000";

    @Mock
    private PoliteHttpClient httpClient;

    @Test
    void mergesJobAdSectionsIntoDescription() {
        String list = """
            {
              "offset": 0, "limit": 100, "totalFound": 1,
              "content": [
                {
                  "id": "744000",
                  "name": "Data Engineer",
                  "releasedDate": "2026-01-20T08:00:00.000Z",
                  "location": { "city": "Barcelona", "country": "es", "remote": false },
                  "department": { "id": "1", "label": "Data" }
                }
              ]
            }
            """;
        String detail = """
            { "jobAd": { "sections": {
                "jobDescription": { "title": "Job Description", "text": "<p>Build pipelines.</p>" },
                "qualifications": { "title": "Qualifications", "text": "<p>Spark and SQL.</p>" }
            } } }
            """;
        when(httpClient.get(eq(LIST_URL), anyString())).thenReturn(ok(LIST_URL, list));
        when(httpClient.get(eq(DETAIL_URL), anyString())).thenReturn(ok(DETAIL_URL, detail));
        SmartRecruitersSourceAdapter adapter =
            new SmartRecruitersSourceAdapter(httpClient, new ObjectMapper(), new TrackerProperties());

        SourceFetchResult result = adapter.fetch(company("adevinta", SourceFamily.SMARTRECRUITERS, "Adevinta"));

        assertThat(result.records()).hasSize(1);
        JobRecord record = result.records().get(0);
        assertThat(record.url()).isEqualTo("https://jobs.smartrecruiters.com/Adevinta/744000");
        assertThat(record.location()).isEqualTo("Barcelona, es");
        assertThat(record.department()).isEqualTo("Data");
        assertThat(record.postedDate()).isEqualTo(LocalDate.of(2026, 1, 20));
        assertThat(record.description()).isEqualTo("Build pipelines. Spark and SQL.");
    }

    @Test
    void failedDetailKeepsListedPosting() {
        String list = """
            { "totalFound": 1, "content": [ { "id": "744000", "name": "Data Engineer",
              "location": { "city": "Barcelona", "country": "es" } } ] }
            """;
        when(httpClient.get(eq(LIST_URL), anyString())).thenReturn(ok(LIST_URL, list));
        when(httpClient.get(eq(DETAIL_URL), anyString())).thenReturn(status(DETAIL_URL, 503));
        SmartRecruitersSourceAdapter adapter =
            new SmartRecruitersSourceAdapter(httpClient, new ObjectMapper(), new TrackerProperties());

        SourceFetchResult result = adapter.fetch(company("adevinta", SourceFamily.SMARTRECRUITERS, "Adevinta"));

        assertThat(result.records()).hasSize(1);
        assertThat(result.records().get(0).description()).isEmpty();
        assertThat(result.errors()).containsEntry("smartrecruiters_detail_http_503", 1);
    }

    @Test
    void locationFromDescriptionAloneStillForwards() {
        String list = """
            { "totalFound": 1, "content": [ { "id": "744000", "name": "Machine Learning Engineer",
              "location": { "city": "Madrid", "country": "es" } } ] }
            """;
        String detail = """
            { "jobAd": { "sections": {
                "jobDescription": { "text": "<p>This role is remote within Spain.</p>" }
            } } }
            """;
        when(httpClient.get(eq(LIST_URL), anyString())).thenReturn(ok(LIST_URL, list));
        when(httpClient.get(eq(DETAIL_URL), anyString())).thenReturn(ok(DETAIL_URL, detail));
        SmartRecruitersSourceAdapter adapter =
            new SmartRecruitersSourceAdapter(httpClient, new ObjectMapper(), new TrackerProperties());

        SourceFetchResult result = adapter.fetch(company("adevinta", SourceFamily.SMARTRECRUITERS, "Adevinta"));

        assertThat(result.records()).hasSize(1);
        assertThat(result.records().get(0).location()).isEqualTo("Madrid, es");
        assertThat(result.records().get(0).description()).isEqualTo("This role is remote within Spain.");
    }
}
