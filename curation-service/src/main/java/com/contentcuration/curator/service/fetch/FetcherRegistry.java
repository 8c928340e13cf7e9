package com.contentcuration.curator.service.fetch;

import com.contentcuration.curator.entity.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One fetcher per source variant. Variants without a fetcher resolve to empty.
 */
@Component
@Slf4j
public class FetcherRegistry {

    private final Map<SourceType, ContentFetcher> fetchers = new EnumMap<>(SourceType.class);

    public FetcherRegistry(List<ContentFetcher> available) {
        for (ContentFetcher fetcher : available) {
            ContentFetcher previous = fetchers.put(fetcher.supportedType(), fetcher);
            if (previous != null) {
                throw new IllegalStateException("Two fetchers registered for " + fetcher.supportedType()
                        + ": " + previous.getClass().getSimpleName() + ", " + fetcher.getClass().getSimpleName());
            }
        }
        log.debug("Registered fetchers for {}", fetchers.keySet());
    }

    public Optional<ContentFetcher> fetcherFor(SourceType type) {
        return Optional.ofNullable(fetchers.get(type));
    }
}
