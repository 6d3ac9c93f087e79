package com.newsinsight.refresh.collector.web;

import com.newsinsight.refresh.collector.ProgressListener;
import com.newsinsight.refresh.collector.RawArticle;
import com.newsinsight.refresh.collector.SourceCollector;
import com.newsinsight.refresh.collector.SourceSnapshot;
import com.newsinsight.refresh.collector.StatusResult;
import com.newsinsight.refresh.exception.CollectorException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * HTML 목록 페이지 수집기 (WebClient + Jsoup).
 *
 * customConfig keys:
 * <ul>
 *   <li>pageUrlTemplate - URL with a {@code {page}} placeholder, defaults to the source URL</li>
 *   <li>maxPages - pages to walk, default 1</li>
 *   <li>itemSelector, titleSelector, linkSelector, summarySelector - CSS selectors</li>
 * </ul>
 * Without an itemSelector the whole page becomes a single article.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebPageCollector implements SourceCollector {

    public static final String TYPE = "web";

    static final String PAGE_PLACEHOLDER = "{page}";
    static final int MIN_PAGE_TEXT_LENGTH = 100;

    private final WebClient webClient;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public List<RawArticle> collect(SourceSnapshot source, ProgressListener progress, BooleanSupplier isCancelled) {
        if (!source.hasUrl()) {
            log.warn("Web source '{}' has no URL configured, skipping", source.name());
            return List.of();
        }

        String template = source.configString("pageUrlTemplate", source.url());
        int maxPages = Math.max(1, source.configInt("maxPages", 1));
        if (!template.contains(PAGE_PLACEHOLDER)) {
            maxPages = 1;
        }

        List<RawArticle> articles = new ArrayList<>();
        for (int page = 1; page <= maxPages; page++) {
            if (isCancelled.getAsBoolean()) {
                log.info("Web collection for '{}' cancelled before page {}", source.name(), page);
                break;
            }
            String pageUrl = template.replace(PAGE_PLACEHOLDER, String.valueOf(page));
            Document doc = fetchDocument(source, pageUrl);
            List<RawArticle> pageArticles = extractArticles(doc, source, pageUrl);
            articles.addAll(pageArticles);
            progress.onProgress(page, maxPages);

            if (pageArticles.isEmpty() && page > 1) {
                log.debug("Page {} of '{}' had no items, stopping pagination", page, source.name());
                break;
            }
        }

        log.info("Scraped {} items from web source '{}'", articles.size(), source.name());
        return articles;
    }

    @Override
    public StatusResult checkStatus(SourceSnapshot source) {
        if (!source.hasUrl()) {
            return StatusResult.failure(source, "Source URL is not configured", null);
        }

        try {
            ResponseEntity<String> response = webClient.get()
                    .uri(source.url())
                    .retrieve()
                    .toEntity(String.class)
                    .block();

            if (response == null || response.getBody() == null || response.getBody().isBlank()) {
                return StatusResult.failure(source, "Empty response", null);
            }
            return StatusResult.ok(source, "Page reachable (HTTP " + response.getStatusCode().value() + ")");
        } catch (WebClientResponseException e) {
            log.warn("Web source '{}' status check failed: HTTP {}", source.name(), e.getStatusCode().value());
            return StatusResult.failure(source, "HTTP status " + e.getStatusCode().value(), e.getStatusText());
        } catch (RuntimeException e) {
            log.warn("Web source '{}' could not be reached: {}", source.name(), e.getMessage());
            return StatusResult.failure(source, "Page could not be fetched", e.getMessage());
        }
    }

    private Document fetchDocument(SourceSnapshot source, String pageUrl) {
        String html;
        try {
            html = webClient.get()
                    .uri(pageUrl)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientResponseException e) {
            throw CollectorException.httpStatus(source.name(), pageUrl, e.getStatusCode().value());
        } catch (RuntimeException e) {
            throw new CollectorException(source.name(), "Failed to fetch " + pageUrl + ": " + e.getMessage(), e);
        }

        if (html == null || html.isBlank()) {
            log.warn("Empty response from: {}", pageUrl);
            return Jsoup.parse("", pageUrl);
        }
        return Jsoup.parse(html, pageUrl);
    }

    List<RawArticle> extractArticles(Document doc, SourceSnapshot source, String pageUrl) {
        String itemSelector = source.configString("itemSelector", null);
        if (itemSelector == null) {
            RawArticle whole = wholePage(doc, source, pageUrl);
            return whole == null ? List.of() : List.of(whole);
        }

        Elements items;
        try {
            items = doc.select(itemSelector);
        } catch (RuntimeException e) {
            throw new CollectorException(source.name(), "Invalid item selector '" + itemSelector + "': " + e.getMessage(), e);
        }

        String titleSelector = source.configString("titleSelector", null);
        String linkSelector = source.configString("linkSelector", "a[href]");
        String summarySelector = source.configString("summarySelector", null);

        List<RawArticle> articles = new ArrayList<>(items.size());
        for (Element item : items) {
            String title = normalizeText(titleSelector != null ? item.select(titleSelector).text() : item.text());
            Element anchor = item.selectFirst(linkSelector);
            String link = anchor != null ? anchor.absUrl("href") : null;
            if (title.isEmpty() && (link == null || link.isEmpty())) {
                continue;
            }
            String summary = summarySelector != null ? normalizeText(item.select(summarySelector).text()) : "";

            articles.add(RawArticle.builder()
                    .title(title)
                    .link(link)
                    .summary(summary)
                    .sourceName(source.name())
                    .category(source.category())
                    .attributes(Map.of("adapter", TYPE, "scrape_method", "jsoup", "page_url", pageUrl))
                    .build());
        }
        return articles;
    }

    private RawArticle wholePage(Document doc, SourceSnapshot source, String pageUrl) {
        doc.select("script, style, nav, footer, aside").remove();
        String content = normalizeText(doc.body() != null ? doc.body().text() : "");
        if (content.length() < MIN_PAGE_TEXT_LENGTH) {
            log.debug("Skipping page with too short content: {}", pageUrl);
            return null;
        }

        String title = doc.title();
        if (title == null || title.isBlank()) {
            title = source.name();
        }

        return RawArticle.builder()
                .title(title)
                .link(pageUrl)
                .content(content)
                .sourceName(source.name())
                .category(source.category())
                .attributes(Map.of("adapter", TYPE, "scrape_method", "jsoup"))
                .build();
    }

    private static String normalizeText(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }
}
