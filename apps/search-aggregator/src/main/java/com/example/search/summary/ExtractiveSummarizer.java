package com.example.search.summary;

import com.example.search.source.model.DocumentContent;
import com.example.search.source.model.SourceDocument;
import com.example.search.source.model.SummaryResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default summarizer: joins the document texts and cuts them to the requested length.
 * Key points are the leading sentence of each document.
 */
@Slf4j
@Component
public class ExtractiveSummarizer implements Summarizer {

    static final int MAX_KEY_POINTS = 3;

    private static final Pattern FIRST_SENTENCE = Pattern.compile("^(.+?[.!?])(\\s|$)", Pattern.DOTALL);
    private static final Pattern MARKUP_PREFIX = Pattern.compile("^[#>*\\-\\s]+");
    private static final int MAX_KEY_POINT_LENGTH = 160;

    @Override
    @NonNull
    public Mono<SummaryResult> summarize(@NonNull List<DocumentContent> documents, int maxLength) {
        return Mono.fromCallable(() -> {
            String combined = String.join(" ", documents.stream()
                    .map(DocumentContent::content)
                    .filter(content -> content != null && !content.isBlank())
                    .map(String::trim)
                    .toList());
            String summary = combined.length() > maxLength
                    ? combined.substring(0, Math.max(0, maxLength))
                    : combined;

            List<String> keyPoints = new ArrayList<>();
            for (DocumentContent document : documents) {
                if (keyPoints.size() == MAX_KEY_POINTS) {
                    break;
                }
                String point = leadingSentence(document.content());
                if (!point.isEmpty()) {
                    keyPoints.add(point);
                }
            }

            log.debug("Summarized {} documents into {} characters", documents.size(), summary.length());
            return new SummaryResult(
                    summary,
                    keyPoints,
                    documents.stream().map(SourceDocument::from).toList());
        });
    }

    static String leadingSentence(String content) {
        if (content == null) {
            return "";
        }
        String firstLine = content.strip().lines()
                .map(line -> MARKUP_PREFIX.matcher(line).replaceFirst(""))
                .filter(line -> !line.isBlank())
                .findFirst()
                .orElse("");
        Matcher matcher = FIRST_SENTENCE.matcher(firstLine);
        String sentence = matcher.find() ? matcher.group(1) : firstLine;
        sentence = sentence.trim();
        return sentence.length() > MAX_KEY_POINT_LENGTH
                ? sentence.substring(0, MAX_KEY_POINT_LENGTH)
                : sentence;
    }
}
