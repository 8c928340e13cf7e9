package com.contentcuration.curator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Content curation service.
 *
 * <ul>
 *   <li>fetches new items from configured channels and feeds, deduplicated by URL</li>
 *   <li>rates unrated items through an external rating tool</li>
 *   <li>publishes S/A-tier items as a markdown digest into an Obsidian vault</li>
 * </ul>
 */
@SpringBootApplication
public class CuratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CuratorApplication.class, args);
    }
}
