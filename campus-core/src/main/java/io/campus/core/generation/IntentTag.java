package io.campus.core.generation;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an {@code [intent: label]} tag off a model answer.
 */
public record IntentTag(String answer, String intent) {
    private static final Pattern TAG = Pattern.compile("\\[\\s*intent\\s*:\\s*([\\p{L}_\\- ]*?)\\s*]", Pattern.CASE_INSENSITIVE);

    public static IntentTag parse(String raw) {
        String text = raw == null ? "" : raw;
        Matcher matcher = TAG.matcher(text);
        String intent = null;
        while (matcher.find()) {
            String label = matcher.group(1).trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
            if (!label.isEmpty()) {
                intent = label;
            }
        }
        String cleaned = TAG.matcher(text).replaceAll("").trim();
        return new IntentTag(cleaned, intent);
    }
}
