package com.plaetzchen.community.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Content moderation toggles and thresholds, bound from {@code plaetzchen.moderation.*}.
 *
 * @param enabled whether content is analyzed at all (default true)
 * @param flagThreshold confidence above which content is flagged (default 0.7)
 * @param reviewThreshold confidence above which content needs review (default 0.3)
 * @param bannedWords words matched case-insensitively
 * @param maxContentLength length above which content scores as too long (default 2000)
 */
@ConfigurationProperties(prefix = "plaetzchen.moderation")
@Validated
public record ModerationProperties(
        Boolean enabled,
        @DecimalMin("0.0") @DecimalMax("1.0") Double flagThreshold,
        @DecimalMin("0.0") @DecimalMax("1.0") Double reviewThreshold,
        List<String> bannedWords,
        int maxContentLength) {

    public ModerationProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (flagThreshold == null) {
            flagThreshold = 0.7;
        }
        if (reviewThreshold == null) {
            reviewThreshold = 0.3;
        }
        bannedWords = bannedWords == null ? List.of("Fotze", "Hurensohn") : List.copyOf(bannedWords);
        if (maxContentLength <= 0) {
            maxContentLength = 2000;
        }
    }

    /** Defaults for every setting. */
    public static ModerationProperties defaults() {
        return new ModerationProperties(null, null, null, null, 0);
    }
}
