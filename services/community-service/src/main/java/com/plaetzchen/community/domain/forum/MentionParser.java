package com.plaetzchen.community.domain.forum;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code @DisplayName} mentions from post content.
 *
 * <p>A mention starts with {@code @} at the start of the text or after a non-word character (so
 * email addresses do not count) and takes the following 2-20 letters, digits, dots, dashes or
 * underscores. Trailing dots are dropped so a sentence can end with a mention.
 */
public final class MentionParser {

    private static final Pattern MENTION =
            Pattern.compile("(?<![\\w@])@([\\p{L}\\p{N}_.\\-]{2,20})");

    private MentionParser() {
        // utility class
    }

    /** Distinct mentioned display names in order of first appearance. */
    public static Set<String> parse(String content) {
        Set<String> names = new LinkedHashSet<>();
        if (content == null) {
            return names;
        }
        Matcher matcher = MENTION.matcher(content);
        while (matcher.find()) {
            String name = matcher.group(1);
            while (name.endsWith(".")) {
                name = name.substring(0, name.length() - 1);
            }
            if (name.length() >= 2) {
                names.add(name);
            }
        }
        return names;
    }
}
