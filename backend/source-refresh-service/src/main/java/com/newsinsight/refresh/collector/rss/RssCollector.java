package com.newsinsight.refresh.collector.rss;

import com.newsinsight.refresh.collector.ProgressListener;
import com.newsinsight.refresh.collector.RawArticle;
import com.newsinsight.refresh.collector.SourceCollector;
import com.newsinsight.refresh.collector.SourceSnapshot;
import com.newsinsight.refresh.collector.StatusResult;
import com.newsinsight.refresh.config.RefreshProperties;
import com.newsinsight.refresh.exception.CollectorException;
import com.rometools.rome.feed.synd.SyndCategory;
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
import java.net.URI;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * RSS/Atom feed collector (Rome).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RssCollector implements SourceCollector {

    public static final String TYPE = "rss";

    private final RefreshProperties refreshProperties;

    @Override
    public String getType() {
        return TYPE;
    }

    /**
     * 피드를 조회하고 엔트리마다 취소 여부를 확인하며 변환
     */
    @Override
    public List<RawArticle> collect(SourceSnapshot source, ProgressListener progress, BooleanSupplier isCancelled) {
        if (!source.hasUrl()) {
            log.warn("RSS source '{}' has no URL configured, skipping", source.name());
            return List.of();
        }

        log.info("Fetching RSS feed for '{}' from {}", source.name(), source.url());
        SyndFeed feed = fetchFeed(source);
        List<SyndEntry> entries = feed.getEntries();
        int total = entries.size();
        List<RawArticle> articles = new ArrayList<>(total);

        for (int i = 0; i < total; i++) {
            if (isCancelled.getAsBoolean()) {
                log.info("RSS collection for '{}' cancelled after {}/{} entries", source.name(), i, total);
                break;
            }
            try {
                RawArticle article = toArticle(entries.get(i), source);
                if (article != null) {
                    articles.add(article);
                }
            } catch (RuntimeException e) {
                log.warn("Skipping malformed entry in feed '{}': {}", source.name(), e.getMessage());
            }
            progress.onProgress(i + 1, total);
        }

        log.info("Collected {} entries from RSS feed '{}'", articles.size(), source.name());
        return articles;
    }

    @Override
    public StatusResult checkStatus(SourceSnapshot source) {
        if (!source.hasUrl()) {
            return StatusResult.failure(source, "Source URL is not configured", null);
        }

        HttpURLConnection connection = null;
        try {
            connection = openConnection(source.url());
            int statusCode = connection.getResponseCode();
            if (statusCode < 200 || statusCode >= 300) {
                log.warn("RSS source '{}' status check failed: HTTP {}", source.name(), statusCode);
                return StatusResult.failure(source, "HTTP status " + statusCode, null);
            }
            try (InputStream body = connection.getInputStream(); XmlReader reader = new XmlReader(body)) {
                SyndFeed feed = new SyndFeedInput().build(reader);
                log.info("RSS source '{}' is reachable ({} entries)", source.name(), feed.getEntries().size());
                return StatusResult.ok(source, "Feed reachable (" + feed.getEntries().size() + " entries)");
            }
        } catch (FeedException | IllegalArgumentException e) {
            log.warn("RSS source '{}' returned an unparseable feed: {}", source.name(), e.getMessage());
            return StatusResult.failure(source, "Feed could not be parsed", e.getMessage());
        } catch (IOException e) {
            log.warn("RSS source '{}' could not be reached: {}", source.name(), e.getMessage());
            return StatusResult.failure(source, "Feed could not be fetched", e.getMessage());
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private SyndFeed fetchFeed(SourceSnapshot source) {
        HttpURLConnection connection = null;
        try {
            connection = openConnection(source.url());
            int statusCode = connection.getResponseCode();
            if (statusCode < 200 || statusCode >= 300) {
                throw CollectorException.httpStatus(source.name(), source.url(), statusCode);
            }
            try (InputStream body = connection.getInputStream(); XmlReader reader = new XmlReader(body)) {
                return new SyndFeedInput().build(reader);
            }
        } catch (FeedException | IllegalArgumentException e) {
            throw CollectorException.unparseable(source.name(), source.url(), e);
        } catch (IOException e) {
            throw new CollectorException(source.name(), "Failed to fetch feed " + source.url() + ": " + e.getMessage(), e);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private HttpURLConnection openConnection(String url) throws IOException {
        RefreshProperties.Http http = refreshProperties.getHttp();
        HttpURLConnection connection = (HttpURLConnection) URI.create(url).toURL().openConnection();
        // User-Agent를 설정하여 봇 차단 우회
        connection.setRequestProperty("User-Agent", http.getUserAgent());
        connection.setRequestProperty("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml, */*");
        connection.setConnectTimeout(http.getConnectTimeoutMs());
        connection.setReadTimeout(http.getReadTimeoutMs());
        connection.setInstanceFollowRedirects(true);
        return connection;
    }

    private RawArticle toArticle(SyndEntry entry, SourceSnapshot source) {
        String title = normalizeText(entry.getTitle());
        String link = entry.getLink();
        if (title.isEmpty() && (link == null || link.isBlank())) {
            log.debug("Skipping entry without title and link in '{}'", source.name());
            return null;
        }

        String summary = entry.getDescription() != null ? normalizeText(entry.getDescription().getValue()) : "";
        String content = entry.getContents().stream()
                .map(SyndContent::getValue)
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .map(RssCollector::normalizeText)
                .orElse(summary);

        Date pubDate = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        LocalDateTime publishTime = pubDate != null
                ? LocalDateTime.ofInstant(pubDate.toInstant(), ZoneId.systemDefault())
                : null;

        Map<String, Object> attributes = new HashMap<>();
        attributes.put("adapter", TYPE);
        if (entry.getAuthor() != null && !entry.getAuthor().isBlank()) {
            attributes.put("author", entry.getAuthor());
        }
        List<String> tags = entry.getCategories().stream()
                .map(SyndCategory::getName)
                .filter(name -> name != null && !name.isBlank())
                .toList();
        if (!tags.isEmpty()) {
            attributes.put("tags", tags);
        }

        return RawArticle.builder()
                .title(title)
                .link(link)
                .summary(summary)
                .content(content)
                .publishTime(publishTime)
                .sourceName(source.name())
                .category(source.category())
                .attributes(attributes)
                .build();
    }

    /**
     * 공백을 정리하여 텍스트를 정규화
     */
    private static String normalizeText(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }
}
