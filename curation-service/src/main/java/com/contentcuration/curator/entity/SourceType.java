package com.contentcuration.curator.entity;

/**
 * Kinds of content sources the curator can monitor.
 *
 * - VIDEO_CHANNEL: video channel listing fetched through yt-dlp
 * - PODCAST: podcast feed (no fetcher registered yet)
 * - FEED: RSS/Atom feed parsing (Rome library)
 */
public enum SourceType {
    VIDEO_CHANNEL("youtube"),
    PODCAST("podcast"),
    FEED("rss");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SourceType fromValue(String value) {
        for (SourceType type : SourceType.values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + value);
    }
}
