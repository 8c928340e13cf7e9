package com.contentcuration.curator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Sources declared in application.yml, inserted on startup when missing.
 */
@Configuration
@ConfigurationProperties(prefix = "curator.seed")
@Data
public class SourceSeedConfig {

    /**
     * Enable/disable seeding of configured sources
     */
    private boolean enabled = true;

    private List<SourceEntry> sources = new ArrayList<>();

    @Data
    public static class SourceEntry {
        /**
         * Display name, unique across sources
         */
        private String name;

        /**
         * Channel or feed URL
         */
        private String url;

        /**
         * youtube | podcast | rss
         */
        private String type = "youtube";

        private boolean enabled = true;
    }
}
