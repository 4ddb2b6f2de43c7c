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

import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.company;
import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.ok;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkableSourceAdapterTest {
    private static final String LIST_URL = "https://apply.workable.com/api/v3/accounts/acme/jobs";

    @Mock
    private PoliteHttpClient httpClient;

    @Test
    void followsPageTokenAndSkipsDetailForPostingsThatCannotMatch() {
        String firstPage = """
            {
              "total": 2,
              "results": [
                {
                  "shortcode": "ABC123",
                  "title": "Data Scientist",
                  "department": ["Data"],
                  "location": { "city": "Barcelona", "region": "Catalonia", "country": "Spain" },
                  "workplace": "hybrid",
                  "published": "2026-01-28T00:00:00.000Z"
                }
              ],
              "nextPage": "tok2"
            }
            """;
        String secondPage = """
            {
              "results": [
                {
                  "shortcode": "DEF456",
                  "title": "Office Manager",
                  "location": { "city": "London", "country": "United Kingdom" },
                  "workplace": "on_site"
                }
              ]
            }
            """;
        String detail = """
            { "description": "<p>Build forecasting models.</p>", "requirements": "<ul><li>Python</li></ul>",
              "benefits": "<p>Visa sponsorship available.</p>" }
            """;
        when(httpClient.postJson(eq(LIST_URL), eq("{}"), anyString())).thenReturn(ok(LIST_URL, firstPage));
        when(httpClient.postJson(eq(LIST_URL), eq("{\"token\":\"tok2\"}"), anyString())).thenReturn(ok(LIST_URL, secondPage));
        when(httpClient.postJson(eq(LIST_URL + "/ABC123"), eq("{}"), anyString())).thenReturn(ok(LIST_URL + "/ABC123", detail));
        WorkableSourceAdapter adapter = new WorkableSourceAdapter(httpClient, new ObjectMapper(), new TrackerProperties());

        SourceFetchResult result = adapter.fetch(company("acme", SourceFamily.WORKABLE, "acme"));

        assertThat(result.status()).isEqualTo(SourceStatus.SUCCESS);
        assertThat(result.scannedCount()).isEqualTo(2);
        assertThat(result.records()).hasSize(1);
        assertThat(result.errors()).doesNotContainKey("workable_page_cap_reached");
        JobRecord record = result.records().get(0);
        assertThat(record.url()).isEqualTo("https://apply.workable.com/acme/j/ABC123/");
        assertThat(record.location()).isEqualTo("Barcelona, Catalonia, Spain (Hybrid)");
        assertThat(record.department()).isEqualTo("Data");
        assertThat(record.description()).isEqualTo("Build forecasting models. Python Visa sponsorship available.");
        assertThat(record.mentionsVisaSupport()).isTrue();
        verify(httpClient, never()).postJson(eq(LIST_URL + "/DEF456"), anyString(), anyString());
    }

    @Test
    void fetchesDetailForRoleMatchListedElsewhere() {
        String page = """
            { "results": [ { "shortcode": "MAD1", "title": "Data Scientist",
              "location": { "city": "Madrid", "country": "Spain" } } ] }
            """;
        String detail = """
            { "description": "<p>Fully remote anywhere in Spain.</p>" }
            """;
        when(httpClient.postJson(eq(LIST_URL), eq("{}"), anyString())).thenReturn(ok(LIST_URL, page));
        when(httpClient.postJson(eq(LIST_URL + "/MAD1"), eq("{}"), anyString())).thenReturn(ok(LIST_URL + "/MAD1", detail));
        WorkableSourceAdapter adapter = new WorkableSourceAdapter(httpClient, new ObjectMapper(), new TrackerProperties());

        SourceFetchResult result = adapter.fetch(company("acme", SourceFamily.WORKABLE, "acme"));

        assertThat(result.records()).hasSize(1);
        assertThat(result.records().get(0).description()).isEqualTo("Fully remote anywhere in Spain.");
        assertThat(result.records().get(0).targetLocation()).isTrue();
    }

    @Test
    void flagsPageCap() {
        TrackerProperties properties = new TrackerProperties();
        properties.getLimits().setMaxPages(1);
        String page = """
            { "results": [ { "shortcode": "X1", "title": "Office Manager", "location": { "city": "Paris" } } ],
              "nextPage": "more" }
            """;
        when(httpClient.postJson(eq(LIST_URL), eq("{}"), anyString())).thenReturn(ok(LIST_URL, page));
        WorkableSourceAdapter adapter = new WorkableSourceAdapter(httpClient, new ObjectMapper(), properties);

        SourceFetchResult result = adapter.fetch(company("acme", SourceFamily.WORKABLE, "acme"));

        assertThat(result.status()).isEqualTo(SourceStatus.SUCCESS);
        assertThat(result.errors()).containsEntry("workable_page_cap_reached", 1);
    }
}
