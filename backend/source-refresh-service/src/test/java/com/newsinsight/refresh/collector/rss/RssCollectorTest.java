package com.newsinsight.refresh.collector.rss;

import com.newsinsight.refresh.collector.FixtureServer;
import com.newsinsight.refresh.collector.RawArticle;
import com.newsinsight.refresh.collector.SourceSnapshot;
import com.newsinsight.refresh.collector.StatusResult;
import com.newsinsight.refresh.config.RefreshProperties;
import com.newsinsight.refresh.exception.CollectorException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RssCollector 단위 테스트 (로컬 HTTP 서버 사용)
 */
class RssCollectorTest {

    private static final String FEED = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0">
              <channel>
                <title>Example News</title>
                <link>https://news.example.com</link>
                <description>Example feed</description>
                <item>
                  <title>  First   headline </title>
                  <link>https://news.example.com/1</link>
                  <description>First summary</description>
                  <category>politics</category>
                  <pubDate>Mon, 06 May 2024 10:00:00 GMT</pubDate>
                </item>
                <item>
                  <title>Second headline</title>
                  <link>https://news.example.com/2</link>
                  <description>Second summary</description>
                </item>
                <item>
                  <title>Third headline</title>
                  <link>https://news.example.com/3</link>
                </item>
              </channel>
            </rss>
            """;

    private FixtureServer server;
    private RssCollector collector;

    @BeforeEach
    void setUp() throws Exception {
        server = new FixtureServer()
                .serve("/feed.xml", 200, "application/rss+xml", FEED)
                .serve("/missing.xml", 404, "text/plain", "not found")
                .serve("/broken.xml", 200, "text/html", "<html><body>not a feed</body></html>");
        RefreshProperties properties = new RefreshProperties();
        properties.getHttp().setConnectTimeoutMs(2000);
        properties.getHttp().setReadTimeoutMs(2000);
        collector = new RssCollector(properties);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("피드 항목을 RawArticle로 변환하고 진행률을 보고")
    void collectsEntries() {
        // given
        SourceSnapshot source = source(server.url("/feed.xml"));
        List<int[]> progress = new ArrayList<>();

        // when
        List<RawArticle> articles = collector.collect(source,
                (done, total) -> progress.add(new int[]{done, total}), () -> false);

        // then
        assertThat(articles).hasSize(3);
        RawArticle first = articles.get(0);
        assertThat(first.getTitle()).isEqualTo("First headline");
        assertThat(first.getLink()).isEqualTo("https://news.example.com/1");
        assertThat(first.getSummary()).isEqualTo("First summary");
        assertThat(first.getPublishTime()).isNotNull();
        assertThat(first.getSourceName()).isEqualTo("example");
        assertThat(first.getAttributes()).containsEntry("adapter", "rss");
        assertThat(progress).extracting(step -> step[0]).containsExactly(1, 2, 3);
        assertThat(progress).allSatisfy(step -> assertThat(step[1]).isEqualTo(3));
    }

    @Test
    @DisplayName("취소 신호를 받으면 지금까지 모은 항목만 반환")
    void stopsWhenCancelled() {
        // given
        AtomicInteger polls = new AtomicInteger();

        // when: cancelled from the second poll on
        List<RawArticle> articles = collector.collect(source(server.url("/feed.xml")),
                (done, total) -> { }, () -> polls.incrementAndGet() > 1);

        // then
        assertThat(articles).extracting(RawArticle::getTitle).containsExactly("First headline");
    }

    @Test
    @DisplayName("2xx 이외의 응답은 CollectorException")
    void httpErrorThrows() {
        assertThatThrownBy(() -> collector.collect(source(server.url("/missing.xml")), (d, t) -> { }, () -> false))
                .isInstanceOf(CollectorException.class)
                .hasMessageContaining("HTTP 404");
    }

    @Test
    @DisplayName("URL이 없으면 빈 결과")
    void missingUrlYieldsNothing() {
        assertThat(collector.collect(source(null), (d, t) -> { }, () -> false)).isEmpty();
    }

    @Test
    @DisplayName("상태 점검: 정상 피드는 성공")
    void statusOk() {
        StatusResult result = collector.checkStatus(source(server.url("/feed.xml")));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).contains("3 entries");
    }

    @Test
    @DisplayName("상태 점검: 404, 파싱 실패, URL 없음은 실패")
    void statusFailures() {
        StatusResult notFound = collector.checkStatus(source(server.url("/missing.xml")));
        assertThat(notFound.isSuccess()).isFalse();
        assertThat(notFound.getMessage()).isEqualTo("HTTP status 404");

        StatusResult broken = collector.checkStatus(source(server.url("/broken.xml")));
        assertThat(broken.isSuccess()).isFalse();
        assertThat(broken.getMessage()).isEqualTo("Feed could not be parsed");

        StatusResult noUrl = collector.checkStatus(source(null));
        assertThat(noUrl.isSuccess()).isFalse();
        assertThat(noUrl.getMessage()).isEqualTo("Source URL is not configured");
    }

    private static SourceSnapshot source(String url) {
        return SourceSnapshot.of(1L, "example", RssCollector.TYPE, url);
    }
}
