package com.contentcuration.curator.cli;

import com.contentcuration.curator.config.CuratorProperties;
import com.contentcuration.curator.dto.CollectionReport;
import com.contentcuration.curator.dto.CurationStatsDTO;
import com.contentcuration.curator.dto.DigestReport;
import com.contentcuration.curator.dto.FetchOutcome;
import com.contentcuration.curator.dto.RatingReport;
import com.contentcuration.curator.dto.SourceDTO;
import com.contentcuration.curator.entity.SourceType;
import com.contentcuration.curator.exception.CuratorException;
import com.contentcuration.curator.service.CollectionService;
import com.contentcuration.curator.service.CurationStatsService;
import com.contentcuration.curator.service.SourceService;
import com.contentcuration.curator.service.digest.DigestAssembler;
import com.contentcuration.curator.service.rating.RatingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Command surface of the curator: {@code fetch}, {@code rate}, {@code digest}, {@code stats}
 * and {@code sources}. One command per invocation.
 */
@Component
@Slf4j
public class CuratorCommandRunner implements ApplicationRunner {

    static final String USAGE = String.join("\n",
            "Usage: curator <command> [options]",
            "",
            "Commands:",
            "  fetch <source-name>                 Fetch one source by name",
            "  fetch --all                         Fetch all enabled sources",
            "  fetch --type=<youtube|podcast|rss>  Fetch enabled sources of one type",
            "  rate [--limit=N]                    Rate up to N unrated items",
            "  digest [--days=N]                   Publish S/A-tier items of the last N days",
            "  stats                               Show item statistics",
            "  sources                             List configured sources");

    private static final DateTimeFormatter LAST_FETCH = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final String RULE = "=".repeat(40);

    private final CollectionService collectionService;
    private final RatingService ratingService;
    private final DigestAssembler digestAssembler;
    private final CurationStatsService statsService;
    private final SourceService sourceService;
    private final CuratorProperties properties;
    private final PrintStream out;

    @Autowired
    public CuratorCommandRunner(CollectionService collectionService,
                                RatingService ratingService,
                                DigestAssembler digestAssembler,
                                CurationStatsService statsService,
                                SourceService sourceService,
                                CuratorProperties properties) {
        this(collectionService, ratingService, digestAssembler, statsService, sourceService, properties, System.out);
    }

    CuratorCommandRunner(CollectionService collectionService,
                         RatingService ratingService,
                         DigestAssembler digestAssembler,
                         CurationStatsService statsService,
                         SourceService sourceService,
                         CuratorProperties properties,
                         PrintStream out) {
        this.collectionService = collectionService;
        this.ratingService = ratingService;
        this.digestAssembler = digestAssembler;
        this.statsService = statsService;
        this.sourceService = sourceService;
        this.properties = properties;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            out.println(USAGE);
            return;
        }

        String command = positional.get(0);
        try {
            switch (command) {
                case "fetch" -> fetch(args, positional);
                case "rate" -> rate(args);
                case "digest" -> digest(args);
                case "stats" -> stats();
                case "sources" -> sources();
                default -> {
                    out.println("Unknown command: " + command);
                    out.println(USAGE);
                }
            }
        } catch (CuratorException e) {
            log.error("Command '{}' failed [{}]: {}", command, e.getErrorCode(), e.getMessage());
            out.println("Error: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid arguments for '{}': {}", command, e.getMessage());
            out.println("Error: " + e.getMessage());
            out.println(USAGE);
        }
    }

    private void fetch(ApplicationArguments args, List<String> positional) {
        CollectionReport report;
        if (positional.size() > 1) {
            report = collectionService.collectSource(positional.get(1));
        } else if (args.containsOption("all")) {
            report = collectionService.collectAll();
        } else if (args.containsOption("type")) {
            SourceType type = SourceType.fromValue(singleValue(args, "type"));
            report = collectionService.collectByType(type);
        } else {
            out.println("Specify a source name, --all, or --type");
            return;
        }

        for (FetchOutcome outcome : report.outcomes()) {
            switch (outcome.status()) {
                case COMPLETED -> out.printf("  %s: %d new, %d skipped (duplicates)%n",
                        outcome.sourceName(), outcome.newCount(), outcome.skippedCount());
                case NOT_SUPPORTED -> out.printf("  %s: not supported yet%n", outcome.sourceName());
                case TIMED_OUT -> out.printf("  %s: timed out (%s)%n", outcome.sourceName(), outcome.errorMessage());
                case FAILED -> out.printf("  %s: failed (%s)%n", outcome.sourceName(), outcome.errorMessage());
            }
        }
        out.printf("%nTotal: %d new items, %d duplicates skipped%n", report.totalNew(), report.totalSkipped());
    }

    private void rate(ApplicationArguments args) {
        int limit = intOption(args, "limit", properties.getRating().getBatchSize());
        RatingReport report = ratingService.rateUnrated(limit);
        if (report.outcomes().isEmpty()) {
            out.println("No unrated items to process");
            return;
        }
        for (RatingReport.ItemOutcome outcome : report.outcomes()) {
            if (outcome.succeeded()) {
                out.printf("  [%s] %s%n", outcome.result().rating(), outcome.title());
            } else {
                out.printf("  [!] %s: %s%n", outcome.title(), outcome.errorMessage());
            }
        }
        out.printf("%nRated %d item(s), %d failed%n", report.ratedCount(), report.failedCount());
    }

    private void digest(ApplicationArguments args) {
        int days = intOption(args, "days", properties.getDigest().getDays());
        Optional<DigestReport> report = digestAssembler.assemble(days);
        if (report.isEmpty()) {
            out.println("No A/S-tier content to publish");
            return;
        }
        DigestReport digest = report.get();
        out.println("Digest written to: " + digest.path());
        out.printf("Published %d items (%d S-tier, %d A-tier)%n",
                digest.itemCount(), digest.sTierCount(), digest.aTierCount());
    }

    private void stats() {
        CurationStatsDTO stats = statsService.getStats();
        out.println("Content Curation Statistics");
        out.println(RULE);
        out.printf("Total items:           %d%n", stats.getTotalItems());
        out.printf("Rated items:           %d%n", stats.getRatedItems());
        out.printf("Unpublished A/S-tier:  %d%n", stats.getUnpublishedTopTier());
        if (!stats.getByRating().isEmpty()) {
            out.println();
            out.println("By rating:");
            stats.getByRating().forEach((rating, count) -> out.printf("  %s: %d%n", rating, count));
        }
    }

    private void sources() {
        out.println("Configured Sources");
        out.println(RULE);
        for (SourceDTO source : sourceService.listSources()) {
            String status = Boolean.TRUE.equals(source.getEnabled()) ? "enabled" : "disabled";
            String lastFetch = source.getLastFetchAt() != null ? source.getLastFetchAt().format(LAST_FETCH) : "never";
            out.printf("[%-8s] %s%n", source.getType().getValue(), source.getName());
            out.printf("           URL: %s%n", source.getUrl());
            out.printf("           Status: %s, Last fetch: %s%n%n", status, lastFetch);
        }
    }

    private static String singleValue(ApplicationArguments args, String option) {
        List<String> values = args.getOptionValues(option);
        if (values == null || values.size() != 1 || values.get(0).isBlank()) {
            throw new IllegalArgumentException("--" + option + " needs exactly one value");
        }
        return values.get(0);
    }

    private static int intOption(ApplicationArguments args, String option, int defaultValue) {
        if (!args.containsOption(option)) {
            return defaultValue;
        }
        String raw = singleValue(args, option);
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + option + " must be a number: " + raw);
        }
        if (value <= 0) {
            throw new IllegalArgumentException("--" + option + " must be positive: " + value);
        }
        return value;
    }
}
