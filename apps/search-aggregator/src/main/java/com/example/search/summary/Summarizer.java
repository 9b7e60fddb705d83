package com.example.search.summary;

import com.example.search.source.model.DocumentContent;
import com.example.search.source.model.SummaryResult;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Produces a summary from already-fetched documents.
 */
public interface Summarizer {

    /**
     * @param documents fetched documents, in request order; may be empty
     * @param maxLength upper bound on the summary text length in characters
     */
    @NonNull
    Mono<SummaryResult> summarize(@NonNull List<DocumentContent> documents, int maxLength);
}
