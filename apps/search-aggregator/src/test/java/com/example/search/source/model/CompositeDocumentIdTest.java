package com.example.search.source.model;

import com.example.search.aggregation.exception.MalformedInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CompositeDocumentId")
class CompositeDocumentIdTest {

    @Test
    @DisplayName("Should split on the first colon only")
    void firstColonSplits() {
        CompositeDocumentId id = CompositeDocumentId.parse("slack:C024BE91L:1712345678.000200");

        assertThat(id.source()).isEqualTo(SourceId.SLACK);
        assertThat(id.nativeId()).isEqualTo("C024BE91L:1712345678.000200");
        assertThat(id.toString()).isEqualTo("slack:C024BE91L:1712345678.000200");
    }

    @Test
    @DisplayName("Should accept an upper-case source prefix")
    void caseInsensitivePrefix() {
        assertThat(CompositeDocumentId.parse("GDRIVE:abc").source()).isEqualTo(SourceId.GDRIVE);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"abc", ":abc", "gdrive:", "dropbox:abc"})
    @DisplayName("Should reject malformed ids")
    void malformed(String value) {
        assertThatThrownBy(() -> CompositeDocumentId.parse(value))
                .isInstanceOf(MalformedInputException.class);
    }
}
