package com.contentcuration.curator.service.transcript;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a caption-cue stream (WebVTT style) into one bounded line of prose.
 *
 * <p>Header, timing and metadata lines are dropped, the remaining cue text is joined, and a token
 * equal to the previously kept token is dropped. Only immediately adjacent repeats collapse;
 * repeated phrases and non-adjacent repeats are kept as they are.
 */
public final class TranscriptNormalizer {

    public static final String TRUNCATION_MARKER = "...";

    private static final String HEADER_PREFIX = "WEBVTT";
    private static final String TIMING_DELIMITER = "-->";
    private static final List<String> METADATA_LABELS = List.of("Kind:", "Language:");

    private TranscriptNormalizer() {
    }

    /**
     * @param lines    raw caption lines, possibly null
     * @param maxChars character budget before the truncation marker is appended
     * @return normalized text, never null
     */
    public static String normalize(List<String> lines, int maxChars) {
        if (maxChars < 0) {
            throw new IllegalArgumentException("maxChars must not be negative: " + maxChars);
        }
        if (lines == null || lines.isEmpty()) {
            return "";
        }

        List<String> cueText = new ArrayList<>();
        for (String raw : lines) {
            if (raw == null) {
                continue;
            }
            String line = raw.strip();
            if (isSkippable(line)) {
                continue;
            }
            cueText.add(line);
        }

        String cleaned = collapseAdjacentRepeats(String.join(" ", cueText));

        if (cleaned.length() > maxChars) {
            return cleaned.substring(0, maxChars) + TRUNCATION_MARKER;
        }
        return cleaned;
    }

    /**
     * Convenience overload for a whole caption file held in memory.
     */
    public static String normalize(String captionText, int maxChars) {
        if (captionText == null || captionText.isEmpty()) {
            return normalize(List.of(), maxChars);
        }
        return normalize(captionText.lines().toList(), maxChars);
    }

    private static boolean isSkippable(String line) {
        if (line.isEmpty() || line.startsWith(HEADER_PREFIX) || line.contains(TIMING_DELIMITER)) {
            return true;
        }
        for (String label : METADATA_LABELS) {
            if (line.startsWith(label)) {
                return true;
            }
        }
        return false;
    }

    private static String collapseAdjacentRepeats(String text) {
        String[] tokens = text.trim().split("\\s+");
        StringBuilder kept = new StringBuilder(text.length());
        String previous = null;
        for (String token : tokens) {
            if (token.isEmpty() || token.equals(previous)) {
                continue;
            }
            if (kept.length() > 0) {
                kept.append(' ');
            }
            kept.append(token);
            previous = token;
        }
        return kept.toString();
    }
}
