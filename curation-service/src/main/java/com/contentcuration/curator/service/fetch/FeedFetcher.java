package com.contentcuration.curator.service.fetch;

import com.contentcuration.curator.dto.FetchRequest;
import com.contentcuration.curator.dto.FetchedItem;
import com.contentcuration.curator.entity.Source;
import com.contentcuration.curator.entity.SourceType;
import com.contentcuration.curator.exception.CollaboratorException;
import com.contentcuration.curator.exception.CollaboratorTimeoutException;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * RSS/Atom sources through Rome.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeedFetcher implements ContentFetcher {

    private static final String COLLABORATOR = "feed";

    private final Clock clock;

    @Override
    public SourceType supportedType() {
        return SourceType.FEED;
    }

    @Override
    public List<FetchedItem> fetch(Source source, FetchRequest request) {
        log.info("Fetching feed from: {}", source.getUrl());
        try (InputStream in = open(source.getUrl(), request)) {
            SyndFeed feed = new SyndFeedInput().build(new XmlReader(in));
            log.info("Found {} entries in feed: {}", feed.getEntries().size(), source.getName());
            return toItems(feed.getEntries(), request);
        } catch (SocketTimeoutException e) {
            throw new CollaboratorTimeoutException(COLLABORATOR, request.timeout());
        } catch (IOException | FeedException | IllegalArgumentException e) {
            throw new CollaboratorException("Error fetching feed " + source.getUrl() + ": " + e.getMessage(), e);
        }
    }

    List<FetchedItem> toItems(List<SyndEntry> entries, FetchRequest request) {
        LocalDateTime since = LocalDateTime.now(clock).minusDays(request.daysBack());
        List<FetchedItem> items = new ArrayList<>();
        for (SyndEntry entry : entries) {
            if (items.size() >= request.maxItems()) {
                break;
            }
            if (entry.getLink() == null || entry.getLink().isBlank()) {
                log.debug("Skipping feed entry without link: {}", entry.getTitle());
                continue;
            }
            LocalDateTime published = publishedDate(entry);
            if (published != null && published.isBefore(since)) {
                continue;
            }
            items.add(new FetchedItem(
                    entry.getTitle() != null ? entry.getTitle().strip() : "Untitled",
                    entry.getLink().strip(),
                    plainText(entry.getDescription()),
                    List.of(),
                    published,
                    null));
        }
        return items;
    }

    private InputStream open(String url, FetchRequest request) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) URI.create(url).toURL().openConnection();
        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, request.timeout().toMillis());
        connection.setRequestProperty("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml, */*");
        connection.setConnectTimeout(timeoutMillis);
        connection.setReadTimeout(timeoutMillis);
        connection.setInstanceFollowRedirects(true);
        return connection.getInputStream();
    }

    private LocalDateTime publishedDate(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date != null ? LocalDateTime.ofInstant(date.toInstant(), clock.getZone()) : null;
    }

    private String plainText(SyndContent content) {
        if (content == null || content.getValue() == null) {
            return null;
        }
        String text = content.getValue().replaceAll("<[^>]+>", " ").replaceAll("\\s+", " ").trim();
        return text.isEmpty() ? null : text;
    }
}
