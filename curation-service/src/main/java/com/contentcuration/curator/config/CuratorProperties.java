package com.contentcuration.curator.config;

import com.contentcuration.curator.exception.CuratorConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the curation pipeline, bound once at startup and injected where needed.
 *
 * <p>{@link #validateConfiguration()} runs after binding, so a bad value stops the context
 * before any fetch, rating or digest step runs.
 */
@Configuration
@ConfigurationProperties(prefix = "curator")
@Data
public class CuratorProperties {

    private Vault vault = new Vault();

    private Fetch fetch = new Fetch();

    private Rating rating = new Rating();

    private DigestSettings digest = new DigestSettings();

    @Data
    public static class Vault {
        /** Root of the Obsidian vault */
        private String path;

        /** Folder inside the vault receiving digests */
        private String readingListFolder = "Reading List";

        public Path readingListPath() {
            return Path.of(path).resolve(readingListFolder);
        }
    }

    @Data
    public static class Fetch {
        /** Lookback window in days for a fetch pass */
        private int daysBack = 7;

        /** Max items per source and pass */
        private int maxItems = 20;

        private int maxTranscriptChars = 15000;

        private int maxDescriptionChars = 2000;

        private Duration timeout = Duration.ofSeconds(120);

        /** Video fetch executable */
        private String command = "yt-dlp";

        private String subtitleLanguage = "en";
    }

    @Data
    public static class Rating {
        /** Rating tool executable */
        private String command = "fabric";

        private String pattern = "rate_content";

        private String model;

        private Duration timeout = Duration.ofSeconds(60);

        /** Pause between successive rating calls */
        private Duration delay = Duration.ofSeconds(2);

        private int batchSize = 10;

        /** Description characters sent to the rating tool */
        private int descriptionChars = 500;

        private int reasoningMaxChars = 500;
    }

    @Data
    public static class DigestSettings {
        /** Trailing window in days */
        private int days = 7;

        private String filePrefix = "Curated Digest";
    }

    @PostConstruct
    public void validateConfiguration() {
        List<String> problems = new ArrayList<>();

        if (vault.getPath() == null || vault.getPath().isBlank()) {
            problems.add("curator.vault.path is required");
        }
        if (vault.getReadingListFolder() == null || vault.getReadingListFolder().isBlank()) {
            problems.add("curator.vault.reading-list-folder must not be blank");
        }
        requirePositive(problems, "curator.fetch.days-back", fetch.getDaysBack());
        requirePositive(problems, "curator.fetch.max-items", fetch.getMaxItems());
        requirePositive(problems, "curator.fetch.max-transcript-chars", fetch.getMaxTranscriptChars());
        requirePositive(problems, "curator.fetch.max-description-chars", fetch.getMaxDescriptionChars());
        requirePositive(problems, "curator.fetch.timeout", fetch.getTimeout());
        requireText(problems, "curator.fetch.command", fetch.getCommand());
        requireText(problems, "curator.fetch.subtitle-language", fetch.getSubtitleLanguage());

        requireText(problems, "curator.rating.command", rating.getCommand());
        requireText(problems, "curator.rating.pattern", rating.getPattern());
        requirePositive(problems, "curator.rating.timeout", rating.getTimeout());
        if (rating.getDelay() == null || rating.getDelay().isNegative()) {
            problems.add("curator.rating.delay must be zero or positive");
        }
        requirePositive(problems, "curator.rating.batch-size", rating.getBatchSize());
        requirePositive(problems, "curator.rating.description-chars", rating.getDescriptionChars());
        requirePositive(problems, "curator.rating.reasoning-max-chars", rating.getReasoningMaxChars());

        requirePositive(problems, "curator.digest.days", digest.getDays());
        requireText(problems, "curator.digest.file-prefix", digest.getFilePrefix());

        if (!problems.isEmpty()) {
            throw new CuratorConfigurationException("Invalid curator configuration: " + String.join("; ", problems));
        }
    }

    private static void requirePositive(List<String> problems, String key, int value) {
        if (value <= 0) {
            problems.add(key + " must be positive but was " + value);
        }
    }

    private static void requirePositive(List<String> problems, String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            problems.add(key + " must be a positive duration");
        }
    }

    private static void requireText(List<String> problems, String key, String value) {
        if (value == null || value.isBlank()) {
            problems.add(key + " must not be blank");
        }
    }
}
