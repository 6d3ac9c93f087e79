package com.newsinsight.refresh.service;

import com.newsinsight.refresh.collector.RawArticle;
import com.newsinsight.refresh.entity.CollectedArticle;
import com.newsinsight.refresh.entity.NewsSource;
import com.newsinsight.refresh.repository.CollectedArticleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 갱신 라운드가 전달한 기사 배치 저장.
 * 콘텐츠 해시로 이미 저장된 기사와 배치 내 중복을 건너뛴다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleIntakeService {

    private final CollectedArticleRepository collectedArticleRepository;
    private final SourceService sourceService;

    /**
     * 중복 제거를 위한 SHA-256 콘텐츠 해시 계산
     */
    public String computeContentHash(String url, String title, String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update((url != null ? url : "").getBytes(StandardCharsets.UTF_8));
            digest.update((title != null ? title : "").getBytes(StandardCharsets.UTF_8));
            digest.update((content != null ? content : "").getBytes(StandardCharsets.UTF_8));

            byte[] hash = digest.digest();
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * 배치를 저장하고 소스의 마지막 갱신 시각을 기록
     *
     * @return number of newly stored articles
     */
    @Transactional
    public int storeBatch(String sourceName, List<RawArticle> articles) {
        Long sourceId = sourceService.findByName(sourceName)
                .map(NewsSource::getId)
                .orElse(null);

        int stored = 0;
        if (articles != null && !articles.isEmpty()) {
            List<CollectedArticle> fresh = new ArrayList<>(articles.size());
            Set<String> seen = new HashSet<>();
            for (RawArticle article : articles) {
                String body = article.getContent() != null ? article.getContent() : article.getSummary();
                String hash = computeContentHash(article.getLink(), article.getTitle(), body);
                if (!seen.add(hash) || collectedArticleRepository.existsByContentHash(hash)) {
                    continue;
                }
                fresh.add(CollectedArticle.builder()
                        .sourceId(sourceId)
                        .sourceName(sourceName)
                        .title(article.getTitle())
                        .link(article.getLink())
                        .summary(article.getSummary())
                        .content(article.getContent())
                        .category(article.getCategory())
                        .publishedAt(article.getPublishTime())
                        .contentHash(hash)
                        .build());
            }
            collectedArticleRepository.saveAll(fresh);
            stored = fresh.size();
            log.info("Stored {} new of {} articles from '{}'", stored, articles.size(), sourceName);
        }

        if (sourceId != null) {
            sourceService.markRefreshed(sourceName, LocalDateTime.now());
        }
        return stored;
    }
}
