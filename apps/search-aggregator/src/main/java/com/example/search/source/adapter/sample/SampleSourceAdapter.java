package com.example.search.source.adapter.sample;

import com.example.search.aggregation.exception.DocumentNotFoundException;
import com.example.search.source.adapter.SourceAdapter;
import com.example.search.source.model.AccessLevel;
import com.example.search.source.model.CompositeDocumentId;
import com.example.search.source.model.DocumentContent;
import com.example.search.source.model.RecentUpdate;
import com.example.search.source.model.SearchResult;
import com.example.search.source.model.SourceId;
import com.example.search.source.model.UpdateType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * In-process fixture adapter used when a source has no live integration configured.
 * Holds no caller state, so one instance per source is shared by all callers.
 */
@Slf4j
public class SampleSourceAdapter implements SourceAdapter {

    private final SourceId source;
    private final List<SampleDocument> documents;
    private final Clock clock;

    public SampleSourceAdapter(@NonNull SourceId source, @NonNull List<SampleDocument> documents, @NonNull Clock clock) {
        this.source = source;
        this.documents = List.copyOf(documents);
        this.clock = clock;
    }

    @Override
    @NonNull
    public SourceId source() {
        return source;
    }

    @Override
    @NonNull
    public Mono<List<SearchResult>> search(@NonNull String query, int maxResults) {
        return Mono.fromSupplier(() -> {
            String needle = query.trim().toLowerCase(Locale.ROOT);
            List<SearchResult> results = documents.stream()
                    .filter(doc -> needle.isEmpty() || doc.matches(needle))
                    .limit(Math.max(0, maxResults))
                    .map(this::toSearchResult)
                    .toList();
            log.debug("Sample {} search for '{}' matched {} documents", source, query, results.size());
            return results;
        });
    }

    @Override
    @NonNull
    public Mono<DocumentContent> getDocument(@NonNull String nativeId) {
        return Mono.defer(() -> documents.stream()
                .filter(doc -> doc.nativeId().equals(nativeId))
                .findFirst()
                .map(doc -> Mono.just(toDocumentContent(doc)))
                .orElseGet(() -> Mono.error(new DocumentNotFoundException(
                        source, CompositeDocumentId.format(source, nativeId)))));
    }

    @Override
    @NonNull
    public Mono<List<RecentUpdate>> getRecentUpdates(int days) {
        return Mono.fromSupplier(() -> {
            Instant cutoff = clock.instant().minus(Duration.ofDays(days));
            return documents.stream()
                    .filter(doc -> modifiedAt(doc).isAfter(cutoff))
                    .map(this::toRecentUpdate)
                    .toList();
        });
    }

    private Instant modifiedAt(SampleDocument doc) {
        return clock.instant().minus(doc.age());
    }

    private SearchResult toSearchResult(SampleDocument doc) {
        return SearchResult.builder()
                .id(CompositeDocumentId.format(source, doc.nativeId()))
                .title(doc.title())
                .snippet(doc.summary())
                .url(doc.url())
                .source(source)
                .lastModified(modifiedAt(doc).toString())
                .author(doc.author())
                .accessLevel(doc.accessLevel())
                .build();
    }

    private RecentUpdate toRecentUpdate(SampleDocument doc) {
        return RecentUpdate.builder()
                .id(CompositeDocumentId.format(source, doc.nativeId()))
                .title(doc.title())
                .snippet(doc.summary())
                .url(doc.url())
                .source(source)
                .lastModified(modifiedAt(doc).toString())
                .author(doc.author())
                .updateType(doc.updateType())
                .build();
    }

    private DocumentContent toDocumentContent(SampleDocument doc) {
        return DocumentContent.builder()
                .id(CompositeDocumentId.format(source, doc.nativeId()))
                .title(doc.title())
                .content(doc.body())
                .source(source)
                .url(doc.url())
                .lastModified(modifiedAt(doc).toString())
                .author(doc.author())
                .build();
    }

    /**
     * A fixture document. {@code age} is how long before "now" it was last modified.
     */
    public record SampleDocument(
            String nativeId,
            String title,
            String summary,
            String body,
            String url,
            String author,
            Duration age,
            AccessLevel accessLevel,
            UpdateType updateType
    ) {
        boolean matches(String needle) {
            return title.toLowerCase(Locale.ROOT).contains(needle)
                    || summary.toLowerCase(Locale.ROOT).contains(needle)
                    || body.toLowerCase(Locale.ROOT).contains(needle);
        }
    }
}
