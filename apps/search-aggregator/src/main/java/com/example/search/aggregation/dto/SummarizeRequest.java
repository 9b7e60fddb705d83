package com.example.search.aggregation.dto;

import com.example.search.aggregation.service.SearchAggregator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Body of {@code POST /api/1.0.0/summaries}.
 *
 * @param maxLength defaults to {@value #DEFAULT_MAX_LENGTH} when omitted
 */
public record SummarizeRequest(
        @NotEmpty @Size(max = SearchAggregator.MAX_SUMMARY_DOCUMENTS) List<@NotBlank String> documentIds,
        @Min(1) @Max(10_000) Integer maxLength
) {
    public static final int DEFAULT_MAX_LENGTH = 500;

    public int effectiveMaxLength() {
        return maxLength == null ? DEFAULT_MAX_LENGTH : maxLength;
    }
}
