package com.newsinsight.refresh.service;

import com.newsinsight.refresh.config.RefreshProperties;
import com.newsinsight.refresh.entity.NewsSource;
import com.newsinsight.refresh.mapper.EntityMapper;
import com.newsinsight.refresh.repository.NewsSourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;

/**
 * Seeds the news_sources table from {@code refresh.sources.defaults} on startup.
 * Only runs if the table is empty.
 *
 * Profiles:
 * - default: Runs automatically
 * - no-seed: Skip seeding
 */
@Component
@Profile("!no-seed")
@RequiredArgsConstructor
@Slf4j
public class SourceSeeder implements ApplicationRunner {

    private final NewsSourceRepository newsSourceRepository;
    private final RefreshProperties refreshProperties;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        RefreshProperties.Sources config = refreshProperties.getSources();
        if (!config.isSeedEnabled()) {
            log.info("News source seeding is disabled via configuration.");
            return;
        }
        if (newsSourceRepository.count() > 0) {
            log.info("News sources already present, skipping seeding.");
            return;
        }

        List<RefreshProperties.SourceEntry> entries = config.getDefaults();
        int created = 0;
        int skipped = 0;
        for (RefreshProperties.SourceEntry entry : entries) {
            if (entry.getName() == null || entry.getName().isBlank()
                    || newsSourceRepository.existsByName(entry.getName())) {
                skipped++;
                continue;
            }
            newsSourceRepository.save(toEntity(entry));
            created++;
        }

        log.info("Seeded news sources. created={}, skipped={}, totalDesired={}", created, skipped, entries.size());
    }

    private NewsSource toEntity(RefreshProperties.SourceEntry entry) {
        NewsSource.NewsSourceBuilder builder = NewsSource.builder()
                .name(entry.getName().trim())
                .type(EntityMapper.normalizeType(entry.getType()))
                .url(entry.getUrl())
                .enabled(entry.isEnabled())
                .customConfig(entry.getCustomConfig() != null ? new HashMap<>(entry.getCustomConfig()) : new HashMap<>())
                .userAdded(false);
        if (entry.getCategory() != null && !entry.getCategory().isBlank()) {
            builder.category(entry.getCategory());
        }
        return builder.build();
    }
}
