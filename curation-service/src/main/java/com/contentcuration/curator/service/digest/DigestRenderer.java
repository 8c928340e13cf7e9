package com.contentcuration.curator.service.digest;

import com.contentcuration.curator.entity.ContentItem;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Turns an ordered selection into the digest artifact body.
 */
public interface DigestRenderer {

    /**
     * @param items       selection in digest order
     * @param sourceNames source id to display name
     * @param date        digest date shown in the heading
     */
    String render(List<ContentItem> items, Map<Long, String> sourceNames, LocalDate date);
}
