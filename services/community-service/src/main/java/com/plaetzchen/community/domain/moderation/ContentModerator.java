package com.plaetzchen.community.domain.moderation;

import com.plaetzchen.community.config.ModerationProperties;
import com.plaetzchen.observability.MetricFactory;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rule-based screening of member content.
 *
 * <p>Each matching rule adds to a confidence score:
 *
 * <ul>
 *   <li>banned word: +0.8 per word
 *   <li>phone number (10+ digits): +0.5
 *   <li>word repetition (top word above 30% of more than 10 words): +0.4
 *   <li>URL: +0.3
 *   <li>one character repeated 5+ times: +0.3
 *   <li>run of 5+ capitals: +0.2
 *   <li>longer than {@code maxContentLength}: +0.1
 * </ul>
 *
 * Content scoring above {@code flagThreshold} is flagged; above {@code reviewThreshold} it needs
 * review. Thresholds and the word list come from {@link ModerationProperties}.
 */
@Component
public class ContentModerator {

    private static final Logger log = LoggerFactory.getLogger(ContentModerator.class);

    static final String METRIC_FLAGGED = "community.moderation.flagged";

    private static final Pattern URL = Pattern.compile("\\b(?:https?://|www\\.)\\S+");
    private static final Pattern PHONE = Pattern.compile("\\b\\d{10,}\\b");
    private static final Pattern CAPS = Pattern.compile("[A-Z]{5,}");
    private static final Pattern REPEATED_CHAR = Pattern.compile("(.)\\1{4,}");
    private static final Pattern WORDS = Pattern.compile("\\s+");

    private final ModerationProperties properties;
    private final MetricFactory metrics;

    public ContentModerator(ModerationProperties properties, MetricFactory metrics) {
        this.properties = properties;
        this.metrics = metrics;
    }

    public ModerationResult analyze(String content) {
        if (!properties.enabled() || content == null || content.isBlank()) {
            return ModerationResult.clean();
        }
        double score = 0.0;
        List<String> reasons = new ArrayList<>();

        String lower = content.toLowerCase(Locale.ROOT);
        boolean bannedWordFound = false;
        for (String word : properties.bannedWords()) {
            if (!word.isBlank() && lower.contains(word.toLowerCase(Locale.ROOT))) {
                score += 0.8;
                bannedWordFound = true;
            }
        }
        if (bannedWordFound) {
            reasons.add("Inappropriate language detected");
        }
        if (URL.matcher(content).find()) {
            score += 0.3;
            reasons.add("Contains URL");
        }
        if (PHONE.matcher(content).find()) {
            score += 0.5;
            reasons.add("Contains phone number");
        }
        if (CAPS.matcher(content).find()) {
            score += 0.2;
            reasons.add("Excessive caps");
        }
        if (REPEATED_CHAR.matcher(content).find()) {
            score += 0.3;
            reasons.add("Suspicious pattern detected");
        }
        if (content.length() > properties.maxContentLength()) {
            score += 0.1;
            reasons.add("Content too long");
        }
        if (hasExcessiveRepetition(lower)) {
            score += 0.4;
            reasons.add("Excessive word repetition");
        }

        double confidence = Math.min(1.0, Math.round(score * 100.0) / 100.0);
        boolean flagged = confidence > properties.flagThreshold();
        ModerationResult result =
                new ModerationResult(
                        flagged, confidence, reasons, confidence > properties.reviewThreshold());
        if (flagged) {
            metrics.increment(METRIC_FLAGGED, "Content flagged by moderation");
            log.warn("Content flagged (confidence {}): {}", confidence, result.summary());
        }
        return result;
    }

    private static boolean hasExcessiveRepetition(String lowerContent) {
        List<String> words =
                Arrays.stream(WORDS.split(lowerContent.strip()))
                        .filter(w -> !w.isEmpty())
                        .toList();
        if (words.size() <= 10) {
            return false;
        }
        Map<String, Long> frequencies =
                words.stream().collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        long top = Collections.max(frequencies.values());
        return top > words.size() * 0.3;
    }
}
