package com.example.search.aggregation.controller;

import com.example.search.aggregation.dto.SummarizeRequest;
import com.example.search.aggregation.service.SearchAggregator;
import com.example.search.common.util.StringSanitizer;
import com.example.search.identity.model.IdentityContext;
import com.example.search.source.model.DocumentContent;
import com.example.search.source.model.RecentUpdate;
import com.example.search.source.model.SearchResult;
import com.example.search.source.model.SourceId;
import com.example.search.source.model.SummaryResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * HTTP surface of the aggregator. The identity comes from gateway headers, see
 * {@link com.example.search.identity.resolver.IdentityContextArgumentResolver}.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/1.0.0")
@RequiredArgsConstructor
public class WorkplaceSearchController {

    private final SearchAggregator searchAggregator;

    @GetMapping("/search")
    public Mono<List<SearchResult>> search(
            IdentityContext identity,
            @RequestParam("query") @NotBlank String query,
            @RequestParam(value = "sources", required = false) List<String> sources,
            @RequestParam(value = "maxResults", defaultValue = "10") @Min(1) @Max(100) int maxResults) {

        log.debug("GET /search - caller: {}, sources: {}, maxResults: {}",
                StringSanitizer.forLog(identity.callerId()), sources, maxResults);
        return Mono.fromCallable(() -> toSourceIds(sources))
                .flatMap(ids -> searchAggregator.search(query, ids, maxResults, identity));
    }

    @GetMapping("/documents/{documentId}")
    public Mono<DocumentContent> getDocument(
            IdentityContext identity,
            @PathVariable("documentId") String documentId) {

        log.debug("GET /documents/{} - caller: {}",
                StringSanitizer.forLog(documentId), StringSanitizer.forLog(identity.callerId()));
        return searchAggregator.getDocument(documentId, identity);
    }

    @GetMapping("/updates")
    public Mono<List<RecentUpdate>> getRecentUpdates(
            IdentityContext identity,
            @RequestParam(value = "sources", required = false) List<String> sources,
            @RequestParam(value = "days", defaultValue = "7") @Min(1) @Max(30) int days,
            @RequestParam(value = "maxResults", defaultValue = "20") @Min(1) @Max(100) int maxResults) {

        log.debug("GET /updates - caller: {}, sources: {}, days: {}, maxResults: {}",
                StringSanitizer.forLog(identity.callerId()), sources, days, maxResults);
        return Mono.fromCallable(() -> toSourceIds(sources))
                .flatMap(ids -> searchAggregator.getRecentUpdates(ids, days, maxResults, identity));
    }

    @PostMapping("/summaries")
    public Mono<SummaryResult> summarize(
            IdentityContext identity,
            @Valid @RequestBody SummarizeRequest request) {

        log.debug("POST /summaries - caller: {}, documents: {}",
                StringSanitizer.forLog(identity.callerId()), request.documentIds().size());
        return searchAggregator.summarize(request.documentIds(), request.effectiveMaxLength(), identity);
    }

    private static List<SourceId> toSourceIds(List<String> sources) {
        if (sources == null) {
            return List.of();
        }
        return sources.stream()
                .map(String::trim)
                .filter(key -> !key.isEmpty())
                .map(SourceId::fromKey)
                .toList();
    }
}
