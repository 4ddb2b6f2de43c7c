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
import java.util.List;

import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.company;
import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.failure;
import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.fixture;
import static com.bcnjobs.tracker.scrape.source.SourceAdapterTestSupport.ok;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SuccessFactorsSourceAdapterTest {
    private static final String BASE = "https://jobs.sap.com";
    private static final String SEARCH_URL = BASE + "/search/?q=data&locationsearch=Barcelona&locale=en_US";
    private static final String DETAIL_URL = BASE + "/job/Barcelona-Senior-Data-Scientist/1234501/";

    @Mock
    private PoliteHttpClient httpClient;

    private SuccessFactorsSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        TrackerProperties properties = new TrackerProperties();
        properties.getSuccessfactors().setSearchTerms(List.of("data"));
        adapter = new SuccessFactorsSourceAdapter(httpClient, new ObjectMapper(), properties);
    }

    @Test
    void parsesSearchRowsAndFetchesDetailForMatchingTitles() {
        when(httpClient.get(eq(SEARCH_URL), anyString())).thenReturn(ok(SEARCH_URL, fixture("successfactors-search.html")));
        when(httpClient.get(eq(DETAIL_URL), anyString())).thenReturn(ok(DETAIL_URL, """
            <html><body><div class="jobDisplay"><span class="jobdescription">
            Shape the analytics platform. Relocation support offered.
            </span></div></body></html>
            """));

        SourceFetchResult result = adapter.fetch(company("sap", SourceFamily.SUCCESSFACTORS, BASE + "/"));

        assertThat(result.status()).isEqualTo(SourceStatus.SUCCESS);
        assertThat(result.scannedCount()).isEqualTo(2);
        assertThat(result.records()).hasSize(1);
        JobRecord record = result.records().get(0);
        assertThat(record.title()).isEqualTo("Senior Data Scientist");
        assertThat(record.url()).isEqualTo(DETAIL_URL);
        assertThat(record.location()).isEqualTo("Barcelona, ES");
        assertThat(record.postedDate()).isEqualTo(LocalDate.of(2026, 1, 13));
        assertThat(record.description()).isEqualTo("Shape the analytics platform. Relocation support offered.");
        assertThat(record.mentionsRelocation()).isTrue();
        verify(httpClient, never()).get(eq(BASE + "/job/Barcelona-Sales-Executive/1234502/"), anyString());
    }

    @Test
    void fallsBackToJobLinksWhenResultTableIsMissing() {
        String html = """
            <div class="job-result">
              <a href="/job/Barcelona-Data-Analyst/998877/">Data Analyst</a>
              <span class="job-location">Barcelona</span>
              <span class="posted-date">2 Feb 2026</span>
            </div>
            <a href="/content/about">About us</a>
            """;

        List<SuccessFactorsSourceAdapter.SearchRow> rows = adapter.parseSearchResults(html, BASE);

        assertThat(rows).containsExactly(new SuccessFactorsSourceAdapter.SearchRow(
            "Data Analyst",
            BASE + "/job/Barcelona-Data-Analyst/998877/",
            "Barcelona",
            "2 Feb 2026"
        ));
    }

    @Test
    void rowWithoutLocationIsClassifiedInSearchedCityButStoredWithoutOne() {
        String detailUrl = BASE + "/job/Data-Engineer/556677/";
        when(httpClient.get(eq(SEARCH_URL), anyString())).thenReturn(ok(SEARCH_URL, """
            <table><tbody>
              <tr class="data-row">
                <td><a class="jobTitle-link" href="/job/Data-Engineer/556677/">Data Engineer</a></td>
                <td><span class="jobDate">3 Mar 2026</span></td>
              </tr>
            </tbody></table>
            """));
        when(httpClient.get(eq(detailUrl), anyString())).thenReturn(ok(detailUrl, """
            <html><body><div class="jobdescription">Build batch pipelines for the finance team.</div></body></html>
            """));

        SourceFetchResult result = adapter.fetch(company("sap", SourceFamily.SUCCESSFACTORS, BASE));

        assertThat(result.records()).hasSize(1);
        JobRecord record = result.records().get(0);
        assertThat(record.location()).isNull();
        assertThat(record.targetLocation()).isTrue();
        assertThat(record.description()).isEqualTo("Build batch pipelines for the finance team.");
    }

    @Test
    void failsWhenEverySearchFails() {
        when(httpClient.get(eq(SEARCH_URL), anyString())).thenReturn(failure(SEARCH_URL, "io_error"));

        SourceFetchResult result = adapter.fetch(company("sap", SourceFamily.SUCCESSFACTORS, BASE));

        assertThat(result.status()).isEqualTo(SourceStatus.FAILED);
        assertThat(result.message()).isEqualTo("successfactors_all_searches_failed");
        assertThat(result.errors()).containsEntry("successfactors_io_error", 1);
    }
}
