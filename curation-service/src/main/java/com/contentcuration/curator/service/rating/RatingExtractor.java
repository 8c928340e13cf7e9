package com.contentcuration.curator.service.rating;

import com.contentcuration.curator.dto.RatingResult;
import com.contentcuration.curator.entity.Rating;
import com.contentcuration.curator.exception.RatingParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a rating and its reasoning out of free-form rating-tool output.
 *
 * <p>The rating comes from the first {@link RatingPattern} in precedence order that matches.
 * Reasoning comes from the region after {@code Explanation:} up to the next section label or
 * the end of the text, with bullet markers removed and lines joined into prose. Without an
 * explanation the parenthesized tier description is used, then a fixed placeholder.
 * Output matching no rating pattern fails with {@link RatingParseException}; there is no
 * default rating.
 */
public class RatingExtractor {

    public static final String NO_EXPLANATION = "No explanation provided";

    private static final Pattern EXPLANATION_START = Pattern.compile("Explanation:");
    private static final Pattern SECTION_LABEL = Pattern.compile(
            "(?m)^\\s*(?:CONTENT SCORE|LABELS|RATING|ONE-SENTENCE-SUMMARY):");
    private static final Pattern TIER_DESCRIPTION = Pattern.compile("[SABCD]\\s+Tier:\\s*\\(([^)]+)\\)");
    private static final Pattern BULLET = Pattern.compile("^[-*•]\\s+");

    private final int maxReasoningChars;

    public RatingExtractor(int maxReasoningChars) {
        if (maxReasoningChars <= 0) {
            throw new IllegalArgumentException("maxReasoningChars must be positive: " + maxReasoningChars);
        }
        this.maxReasoningChars = maxReasoningChars;
    }

    public RatingResult extract(String output) {
        if (output == null || output.isBlank()) {
            throw new RatingParseException(output);
        }

        Rating rating = findRating(output)
                .orElseThrow(() -> new RatingParseException(output));

        String reasoning = findExplanation(output)
                .or(() -> findTierDescription(output))
                .orElse(NO_EXPLANATION);

        return new RatingResult(rating, truncate(reasoning));
    }

    private Optional<Rating> findRating(String output) {
        for (RatingPattern pattern : RatingPattern.PRECEDENCE) {
            Optional<Rating> rating = pattern.find(output);
            if (rating.isPresent()) {
                return rating;
            }
        }
        return Optional.empty();
    }

    private Optional<String> findExplanation(String output) {
        Matcher start = EXPLANATION_START.matcher(output);
        if (!start.find()) {
            return Optional.empty();
        }
        String tail = output.substring(start.end());
        Matcher end = SECTION_LABEL.matcher(tail);
        String region = end.find() ? tail.substring(0, end.start()) : tail;

        List<String> lines = new ArrayList<>();
        for (String line : region.split("\\R")) {
            String cleaned = BULLET.matcher(line.strip()).replaceFirst("").strip();
            if (!cleaned.isEmpty()) {
                lines.add(cleaned);
            }
        }
        if (lines.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join(" ", lines));
    }

    private Optional<String> findTierDescription(String output) {
        Matcher matcher = TIER_DESCRIPTION.matcher(output);
        if (matcher.find()) {
            String description = matcher.group(1).strip();
            return description.isEmpty() ? Optional.empty() : Optional.of(description);
        }
        return Optional.empty();
    }

    private String truncate(String reasoning) {
        if (reasoning.length() <= maxReasoningChars) {
            return reasoning;
        }
        return reasoning.substring(0, maxReasoningChars);
    }
}
