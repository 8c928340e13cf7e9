package com.contentcuration.curator.cli;

import com.contentcuration.curator.config.CuratorProperties;
import com.contentcuration.curator.dto.CollectionReport;
import com.contentcuration.curator.dto.CurationStatsDTO;
import com.contentcuration.curator.dto.DigestReport;
import com.contentcuration.curator.dto.RatingReport;
import com.contentcuration.curator.dto.SourceDTO;
import com.contentcuration.curator.entity.Rating;
import com.contentcuration.curator.entity.SourceType;
import com.contentcuration.curator.exception.SourceNotFoundException;
import com.contentcuration.curator.service.CollectionService;
import com.contentcuration.curator.service.CurationStatsService;
import com.contentcuration.curator.service.SourceService;
import com.contentcuration.curator.service.digest.DigestAssembler;
import com.contentcuration.curator.service.rating.RatingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CuratorCommandRunnerTest {

    @Mock
    private CollectionService collectionService;

    @Mock
    private RatingService ratingService;

    @Mock
    private DigestAssembler digestAssembler;

    @Mock
    private CurationStatsService statsService;

    @Mock
    private SourceService sourceService;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private CuratorCommandRunner runner;

    @BeforeEach
    void setUp() {
        CuratorProperties properties = new CuratorProperties();
        runner = new CuratorCommandRunner(collectionService, ratingService, digestAssembler, statsService,
                sourceService, properties, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("No command prints usage")
    void printsUsage() {
        runner.run(new DefaultApplicationArguments());

        assertThat(output()).contains("Usage: curator <command>");
        verifyNoInteractions(collectionService, ratingService, digestAssembler);
    }

    @Test
    @DisplayName("Unknown command prints usage")
    void unknownCommand() {
        runner.run(new DefaultApplicationArguments("publish"));

        assertThat(output()).contains("Unknown command: publish").contains("Usage:");
    }

    @Test
    @DisplayName("fetch --type dispatches by source type")
    void fetchByType() {
        when(collectionService.collectByType(SourceType.FEED)).thenReturn(new CollectionReport(List.of()));

        runner.run(new DefaultApplicationArguments("fetch", "--type=rss"));

        verify(collectionService).collectByType(SourceType.FEED);
        assertThat(output()).contains("Total: 0 new items, 0 duplicates skipped");
    }

    @Test
    @DisplayName("fetch --all fetches every enabled source")
    void fetchAll() {
        when(collectionService.collectAll()).thenReturn(new CollectionReport(List.of()));

        runner.run(new DefaultApplicationArguments("fetch", "--all"));

        verify(collectionService).collectAll();
    }

    @Test
    @DisplayName("Unknown source is reported without aborting")
    void fetchUnknownSource() {
        when(collectionService.collectSource("Nobody")).thenThrow(SourceNotFoundException.byName("Nobody"));

        runner.run(new DefaultApplicationArguments("fetch", "Nobody"));

        assertThat(output()).contains("Error: Source not found: Nobody");
    }

    @Test
    @DisplayName("rate uses the configured batch size unless --limit is given")
    void rateLimit() {
        when(ratingService.rateUnrated(anyInt())).thenReturn(new RatingReport(List.of()));

        runner.run(new DefaultApplicationArguments("rate"));
        runner.run(new DefaultApplicationArguments("rate", "--limit=3"));

        verify(ratingService).rateUnrated(10);
        verify(ratingService).rateUnrated(3);
    }

    @Test
    @DisplayName("A malformed option is reported with usage")
    void malformedLimit() {
        runner.run(new DefaultApplicationArguments("rate", "--limit=many"));

        assertThat(output()).contains("--limit must be a number").contains("Usage:");
        verifyNoInteractions(ratingService);
    }

    @Test
    @DisplayName("digest reports the published artifact")
    void digest() {
        when(digestAssembler.assemble(7)).thenReturn(Optional.of(
                new DigestReport(4L, Path.of("vault", "Curated Digest 2024-01-15.md"), 3, 1, 2)));

        runner.run(new DefaultApplicationArguments("digest"));

        assertThat(output()).contains("Curated Digest 2024-01-15.md")
                .contains("Published 3 items (1 S-tier, 2 A-tier)");
    }

    @Test
    @DisplayName("digest with nothing selected says so")
    void emptyDigest() {
        when(digestAssembler.assemble(3)).thenReturn(Optional.empty());

        runner.run(new DefaultApplicationArguments("digest", "--days=3"));

        assertThat(output()).contains("No A/S-tier content to publish");
    }

    @Test
    @DisplayName("stats and sources print their tables")
    void statsAndSources() {
        Map<Rating, Long> byRating = new EnumMap<>(Rating.class);
        byRating.put(Rating.A, 2L);
        when(statsService.getStats()).thenReturn(CurationStatsDTO.builder()
                .totalItems(5L).ratedItems(2L).byRating(byRating).unpublishedTopTier(2L).build());
        when(sourceService.listSources()).thenReturn(List.of(SourceDTO.builder()
                .id(1L).name("Fireship").type(SourceType.VIDEO_CHANNEL)
                .url("https://www.youtube.com/@Fireship").enabled(false).build()));

        runner.run(new DefaultApplicationArguments("stats"));
        runner.run(new DefaultApplicationArguments("sources"));

        assertThat(output())
                .contains("Total items:           5")
                .contains("  A: 2")
                .contains("[youtube ] Fireship")
                .contains("Status: disabled, Last fetch: never");
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
