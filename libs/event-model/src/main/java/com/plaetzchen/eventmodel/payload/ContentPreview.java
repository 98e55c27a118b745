package com.plaetzchen.eventmodel.payload;

import java.util.regex.Pattern;

/**
 * Plain-text previews of member content for notifications.
 */
public final class ContentPreview {

    public static final int MAX_LENGTH = 200;

    private static final Pattern TAGS = Pattern.compile("<.*?>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ContentPreview() {
        // utility class
    }

    /**
     * Strips HTML tags, collapses whitespace and cuts to {@value #MAX_LENGTH} characters.
     */
    public static String of(String content) {
        if (content == null) {
            return "";
        }
        String text = TAGS.matcher(content).replaceAll("");
        text = WHITESPACE.matcher(text).replaceAll(" ").strip();
        return text.length() > MAX_LENGTH ? text.substring(0, MAX_LENGTH) : text;
    }
}
