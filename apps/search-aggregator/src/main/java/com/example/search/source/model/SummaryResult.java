package com.example.search.source.model;

import java.util.List;

/**
 * Synthesized summary over the documents that could be fetched.
 *
 * @param sourceDocuments documents that contributed, in request order
 */
public record SummaryResult(
        String summary,
        List<String> keyPoints,
        List<SourceDocument> sourceDocuments
) {
    public SummaryResult {
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
        sourceDocuments = sourceDocuments == null ? List.of() : List.copyOf(sourceDocuments);
    }
}
