package com.plaetzchen.community.domain.listing;

import java.text.Normalizer;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * URL slugs for listings: lower-case ASCII words joined by dashes. Umlauts are transliterated
 * (ä → ae, ß → ss) before accents are stripped.
 */
public final class SlugGenerator {

    static final int MAX_BASE_LENGTH = 140;

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern SUFFIX = Pattern.compile("-[0-9]+");

    private SlugGenerator() {
        // utility class
    }

    public static String slugify(String title) {
        String text = title == null ? "" : title.toLowerCase(Locale.ROOT);
        text = text.replace("ä", "ae").replace("ö", "oe").replace("ü", "ue").replace("ß", "ss");
        text = DIACRITICS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
        text = NON_ALNUM.matcher(text).replaceAll("-");
        text = trimDashes(text);
        if (text.length() > MAX_BASE_LENGTH) {
            text = trimDashes(text.substring(0, MAX_BASE_LENGTH));
        }
        return text.isEmpty() ? "service" : text;
    }

    /** First of {@code base}, {@code base-2}, {@code base-3}, ... that is not taken. */
    public static String unique(String title, Predicate<String> taken) {
        String base = slugify(title);
        String candidate = base;
        int suffix = 2;
        while (taken.test(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }

    /** True when {@code slug} is {@code title}'s base slug or that base with a numeric suffix. */
    public static boolean matches(String slug, String title) {
        String base = slugify(title);
        if (slug == null || !slug.startsWith(base)) {
            return false;
        }
        String rest = slug.substring(base.length());
        return rest.isEmpty() || SUFFIX.matcher(rest).matches();
    }

    private static String trimDashes(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '-') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '-') {
            end--;
        }
        return text.substring(start, end);
    }
}
