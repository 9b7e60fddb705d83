package com.example.search.source.adapter.sample;

import com.example.search.aggregation.exception.DocumentNotFoundException;
import com.example.search.source.adapter.sample.SampleSourceAdapter.SampleDocument;
import com.example.search.source.model.AccessLevel;
import com.example.search.source.model.RecentUpdate;
import com.example.search.source.model.SearchResult;
import com.example.search.source.model.SourceId;
import com.example.search.source.model.UpdateType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SampleSourceAdapter")
class SampleSourceAdapterTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private final SampleSourceAdapter adapter = new SampleSourceAdapter(SourceId.NOTION, List.of(
            new SampleDocument("p1", "Budget Review", "Monthly budget notes", "Budget body.",
                    "https://example.com/p1", "Ops", Duration.ofHours(3), AccessLevel.EDITOR, UpdateType.MODIFIED),
            new SampleDocument("p2", "Onboarding", "New hire checklist", "Checklist body.",
                    "https://example.com/p2", "Platform", Duration.ofDays(10), AccessLevel.VIEWER, UpdateType.CREATED)
    ), clock);

    @Test
    @DisplayName("Should match the query case-insensitively and return composite ids")
    void search() {
        StepVerifier.create(adapter.search("BUDGET", 10))
                .assertNext(results -> {
                    assertThat(results).extracting(SearchResult::id).containsExactly("notion:p1");
                    assertThat(results.get(0).source()).isEqualTo(SourceId.NOTION);
                    assertThat(results.get(0).lastModified()).isEqualTo("2024-03-10T09:00:00Z");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should honor maxResults")
    void searchLimit() {
        StepVerifier.create(adapter.search("", 1))
                .assertNext(results -> assertThat(results).hasSize(1))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should only list documents modified inside the window")
    void recentUpdates() {
        StepVerifier.create(adapter.getRecentUpdates(7))
                .assertNext(updates -> assertThat(updates).extracting(RecentUpdate::id).containsExactly("notion:p1"))
                .verifyComplete();
        StepVerifier.create(adapter.getRecentUpdates(30))
                .assertNext(updates -> assertThat(updates).hasSize(2))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should return full content for a known id and not-found otherwise")
    void getDocument() {
        StepVerifier.create(adapter.getDocument("p2"))
                .assertNext(doc -> {
                    assertThat(doc.id()).isEqualTo("notion:p2");
                    assertThat(doc.content()).isEqualTo("Checklist body.");
                })
                .verifyComplete();
        StepVerifier.create(adapter.getDocument("nope"))
                .expectError(DocumentNotFoundException.class)
                .verify();
    }

    @Test
    @DisplayName("Every source should ship fixtures")
    void fixturesForAllSources() {
        for (SourceId source : SourceId.values()) {
            assertThat(SampleDocuments.forSource(source)).isNotEmpty();
        }
    }
}
