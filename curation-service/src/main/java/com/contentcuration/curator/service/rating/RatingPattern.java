package com.contentcuration.curator.service.rating;

import com.contentcuration.curator.entity.Rating;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognized ways a rating tool states its verdict, in precedence order.
 *
 * <ol>
 *   <li>PRIMARY: a tier letter followed by a tier label, e.g. {@code B Tier:}</li>
 *   <li>FALLBACK: an explicit label followed by the letter, e.g. {@code RATING: A}</li>
 * </ol>
 */
public enum RatingPattern {
    PRIMARY(Pattern.compile("([SABCD])\\s+Tier:")),
    FALLBACK(Pattern.compile("RATING:\\s*([SABCD])\\b"));

    /** Precedence used by the extractor; the first pattern that matches anywhere wins. */
    public static final List<RatingPattern> PRECEDENCE = List.of(PRIMARY, FALLBACK);

    private final Pattern pattern;

    RatingPattern(Pattern pattern) {
        this.pattern = pattern;
    }

    public Optional<Rating> find(String text) {
        Matcher matcher = pattern.matcher(text);
        if (matcher.find()) {
            return Optional.of(Rating.fromLetter(matcher.group(1)));
        }
        return Optional.empty();
    }
}
