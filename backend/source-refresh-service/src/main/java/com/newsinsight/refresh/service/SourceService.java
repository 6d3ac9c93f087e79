package com.newsinsight.refresh.service;

import com.newsinsight.refresh.collector.SourceSnapshot;
import com.newsinsight.refresh.dto.NewsSourceCreateRequest;
import com.newsinsight.refresh.dto.NewsSourceUpdateRequest;
import com.newsinsight.refresh.entity.NewsSource;
import com.newsinsight.refresh.exception.DuplicateSourceException;
import com.newsinsight.refresh.exception.SourceNotFoundException;
import com.newsinsight.refresh.mapper.EntityMapper;
import com.newsinsight.refresh.repository.NewsSourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 뉴스 소스 관리.
 * 라운드에는 엔티티 대신 {@link SourceSnapshot} 복사본을 넘긴다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourceService {

    private final NewsSourceRepository newsSourceRepository;
    private final EntityMapper entityMapper;

    /**
     * 모든 소스 목록 조회
     */
    @Transactional(readOnly = true)
    public List<NewsSource> findAll() {
        return newsSourceRepository.findAll();
    }

    @Transactional(readOnly = true)
    public Page<NewsSource> findAll(Pageable pageable) {
        return newsSourceRepository.findAll(pageable);
    }

    @Transactional(readOnly = true)
    public Optional<NewsSource> findById(Long id) {
        return newsSourceRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public Optional<NewsSource> findByName(String name) {
        return newsSourceRepository.findByName(name);
    }

    /**
     * 활성화된 소스 목록 조회 (ID 순)
     */
    @Transactional(readOnly = true)
    public List<NewsSource> findEnabledSources() {
        return newsSourceRepository.findByEnabledTrueOrderByIdAsc();
    }

    /**
     * 소스 생성. 이름이 중복되면 {@link DuplicateSourceException}
     */
    @Transactional
    public NewsSource create(NewsSourceCreateRequest request) {
        NewsSource source = entityMapper.toEntity(request);
        if (newsSourceRepository.existsByName(source.getName())) {
            throw new DuplicateSourceException(source.getName());
        }
        NewsSource saved = newsSourceRepository.save(source);
        log.info("Created news source: id={}, name={}, type={}", saved.getId(), saved.getName(), saved.getType());
        return saved;
    }

    @Transactional
    public NewsSource update(Long id, NewsSourceUpdateRequest request) {
        NewsSource source = newsSourceRepository.findById(id)
                .orElseThrow(() -> new SourceNotFoundException(id));

        String newName = request.name() != null ? request.name().trim() : null;
        if (newName != null && !newName.isEmpty() && !newName.equals(source.getName())
                && newsSourceRepository.existsByName(newName)) {
            throw new DuplicateSourceException(newName);
        }

        entityMapper.updateEntity(source, request);
        NewsSource saved = newsSourceRepository.save(source);
        log.info("Updated news source: id={}, name={}", saved.getId(), saved.getName());
        return saved;
    }

    /**
     * 활성/비활성 전환
     */
    @Transactional
    public NewsSource setEnabled(Long id, boolean enabled) {
        NewsSource source = newsSourceRepository.findById(id)
                .orElseThrow(() -> new SourceNotFoundException(id));
        source.setEnabled(enabled);
        NewsSource saved = newsSourceRepository.save(source);
        log.info("News source {} {}", saved.getName(), enabled ? "enabled" : "disabled");
        return saved;
    }

    // 삭제 결과를 boolean으로 반환
    @Transactional
    public boolean delete(Long id) {
        if (!newsSourceRepository.existsById(id)) {
            return false;
        }
        newsSourceRepository.deleteById(id);
        log.info("Deleted news source: id={}", id);
        return true;
    }

    /**
     * 라운드용 스냅샷: 활성화된 소스 전체
     */
    @Transactional(readOnly = true)
    public List<SourceSnapshot> snapshotEnabled() {
        return newsSourceRepository.findByEnabledTrueOrderByIdAsc().stream()
                .map(NewsSource::toSnapshot)
                .toList();
    }

    /**
     * 라운드용 스냅샷: 지정한 ID의 소스 (비활성 포함, 필터링은 오케스트레이터가 한다)
     */
    @Transactional(readOnly = true)
    public List<SourceSnapshot> snapshotsFor(Collection<Long> ids) {
        return newsSourceRepository.findByIdIn(ids).stream()
                .sorted(Comparator.comparing(NewsSource::getId))
                .map(NewsSource::toSnapshot)
                .toList();
    }

    /**
     * 마지막 갱신 시각 기록
     */
    @Transactional
    public void markRefreshed(String sourceName, LocalDateTime refreshedAt) {
        int updated = newsSourceRepository.updateLastRefreshed(sourceName, refreshedAt);
        if (updated == 0) {
            log.debug("No stored source named '{}' to mark refreshed", sourceName);
        }
    }

    @Transactional(readOnly = true)
    public long countAll() {
        return newsSourceRepository.count();
    }

    @Transactional(readOnly = true)
    public long countEnabled() {
        return newsSourceRepository.countByEnabledTrue();
    }
}
