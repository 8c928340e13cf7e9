package com.contentcuration.curator.service.fetch;

import com.contentcuration.curator.entity.SourceType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FetcherRegistryTest {

    @Test
    void resolvesRegisteredVariantsOnly() {
        ContentFetcher feed = mock(ContentFetcher.class);
        when(feed.supportedType()).thenReturn(SourceType.FEED);

        FetcherRegistry registry = new FetcherRegistry(List.of(feed));

        assertThat(registry.fetcherFor(SourceType.FEED)).containsSame(feed);
        assertThat(registry.fetcherFor(SourceType.PODCAST)).isEmpty();
    }

    @Test
    void rejectsTwoFetchersForOneVariant() {
        ContentFetcher first = mock(ContentFetcher.class);
        ContentFetcher second = mock(ContentFetcher.class);
        when(first.supportedType()).thenReturn(SourceType.FEED);
        when(second.supportedType()).thenReturn(SourceType.FEED);

        assertThatThrownBy(() -> new FetcherRegistry(List.of(first, second)))
                .isInstanceOf(IllegalStateException.class);
    }
}
