package com.contentcuration.curator.service.fetch;

import com.contentcuration.curator.config.CuratorProperties;
import com.contentcuration.curator.dto.FetchRequest;
import com.contentcuration.curator.dto.FetchedItem;
import com.contentcuration.curator.entity.Source;
import com.contentcuration.curator.entity.SourceType;
import com.contentcuration.curator.exception.CollaboratorException;
import com.contentcuration.curator.service.process.ExternalCommandRunner;
import com.contentcuration.curator.service.process.ExternalCommandRunner.CommandResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Fetches recent uploads of a video channel with yt-dlp.
 *
 * <p>yt-dlp writes one {@code <id>.info.json} per video and, when captions exist, an
 * {@code <id>.<lang>.vtt} file into a scratch directory; both are read back and the directory is
 * removed. A non-zero exit still yields whatever files were written.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class YtDlpChannelFetcher implements ContentFetcher {

    private static final String COLLABORATOR = "yt-dlp";
    private static final DateTimeFormatter YT_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final String WATCH_URL = "https://www.youtube.com/watch?v=";

    private final ExternalCommandRunner commandRunner;
    private final ObjectMapper objectMapper;
    private final CuratorProperties properties;
    private final Clock clock;

    @Override
    public SourceType supportedType() {
        return SourceType.VIDEO_CHANNEL;
    }

    @Override
    public List<FetchedItem> fetch(Source source, FetchRequest request) {
        Path workDir = createWorkDir();
        try {
            String dateAfter = LocalDate.now(clock).minusDays(request.daysBack()).format(YT_DATE);
            String language = properties.getFetch().getSubtitleLanguage();

            List<String> command = List.of(
                    properties.getFetch().getCommand(),
                    "--skip-download",
                    "--write-info-json",
                    "--write-auto-sub",
                    "--sub-lang", language,
                    "--sub-format", "vtt",
                    "--dateafter", dateAfter,
                    "--playlist-end", String.valueOf(request.maxItems()),
                    "--ignore-errors",
                    "-o", workDir.resolve("%(id)s.%(ext)s").toString(),
                    source.getUrl());

            log.info("Running yt-dlp for {} ({})", source.getName(), source.getUrl());
            CommandResult result = commandRunner.run(COLLABORATOR, command, null, workDir, request.timeout());
            if (!result.succeeded()) {
                log.warn("yt-dlp exited with {} for {}; parsing partial results", result.exitCode(), source.getName());
            }

            List<FetchedItem> items = readOutputDirectory(workDir, language);
            log.info("Parsed {} video(s) for {}", items.size(), source.getName());
            return items.size() > request.maxItems() ? items.subList(0, request.maxItems()) : items;
        } finally {
            deleteRecursively(workDir);
        }
    }

    List<FetchedItem> readOutputDirectory(Path dir, String language) {
        List<Path> infoFiles;
        try (Stream<Path> files = Files.list(dir)) {
            infoFiles = files
                    .filter(p -> p.getFileName().toString().endsWith(".info.json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new CollaboratorException("Cannot read yt-dlp output in " + dir, e);
        }

        List<FetchedItem> items = new ArrayList<>();
        for (Path infoFile : infoFiles) {
            String fileName = infoFile.getFileName().toString();
            if (fileName.contains("[UC") && fileName.contains("Videos")) {
                log.debug("Skipping playlist file: {}", fileName);
                continue;
            }
            try {
                FetchedItem item = parseVideoInfo(infoFile, language);
                if (item != null) {
                    items.add(item);
                }
            } catch (IOException e) {
                log.warn("Error parsing {}: {}", fileName, e.getMessage());
            }
        }
        items.sort(Comparator.comparing(FetchedItem::uploadedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return items;
    }

    private FetchedItem parseVideoInfo(Path infoFile, String language) throws IOException {
        JsonNode data = objectMapper.readTree(infoFile.toFile());

        if ("playlist".equals(data.path("_type").asText())) {
            return null;
        }
        String videoId = data.path("id").asText("");
        if (videoId.isBlank()) {
            return null;
        }

        List<String> captionLines = readCaptions(infoFile.resolveSibling(videoId + "." + language + ".vtt"));

        String url = data.path("webpage_url").asText("");
        if (url.isBlank()) {
            url = WATCH_URL + videoId;
        }

        Integer durationSeconds = data.hasNonNull("duration") ? data.get("duration").asInt() : null;

        return new FetchedItem(
                data.path("title").asText("Unknown Title"),
                url,
                data.path("description").asText(""),
                captionLines,
                parseUploadDate(data.path("upload_date").asText(null)),
                durationSeconds);
    }

    /**
     * Invalid UTF-8 in a caption file is replaced, not fatal; an unreadable file only costs the
     * transcript.
     */
    private List<String> readCaptions(Path vtt) {
        if (!Files.exists(vtt)) {
            return List.of();
        }
        try {
            return new String(Files.readAllBytes(vtt), StandardCharsets.UTF_8).lines().toList();
        } catch (IOException e) {
            log.warn("Cannot read captions {}: {}", vtt.getFileName(), e.getMessage());
            return List.of();
        }
    }

    private LocalDateTime parseUploadDate(String uploadDate) {
        if (uploadDate == null || uploadDate.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(uploadDate, YT_DATE).atStartOfDay();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable upload_date: {}", uploadDate);
            return null;
        }
    }

    private Path createWorkDir() {
        try {
            return Files.createTempDirectory("curator-ytdlp-");
        } catch (IOException e) {
            throw new CollaboratorException("Cannot create scratch directory for yt-dlp", e);
        }
    }

    private void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up yt-dlp scratch directory {}: {}", dir, e.getMessage());
        }
    }
}
