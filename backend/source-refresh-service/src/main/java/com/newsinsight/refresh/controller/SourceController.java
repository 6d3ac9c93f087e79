package com.newsinsight.refresh.controller;

import com.newsinsight.refresh.dto.NewsSourceCreateRequest;
import com.newsinsight.refresh.dto.NewsSourceDTO;
import com.newsinsight.refresh.dto.NewsSourceUpdateRequest;
import com.newsinsight.refresh.entity.NewsSource;
import com.newsinsight.refresh.mapper.EntityMapper;
import com.newsinsight.refresh.service.SourceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/sources")
@RequiredArgsConstructor
public class SourceController {

    private final SourceService sourceService;
    private final EntityMapper entityMapper;

    /**
     * GET /api/v1/sources - 모든 뉴스 소스 목록 조회 (페이징/정렬 지원)
     */
    @GetMapping
    public ResponseEntity<Page<NewsSourceDTO>> listSources(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(defaultValue = "id") String sortBy,
            @RequestParam(defaultValue = "ASC") String sortDirection) {

        Sort.Direction direction = Sort.Direction.fromString(sortDirection);
        Pageable pageable = PageRequest.of(page, size, Sort.by(direction, sortBy));

        Page<NewsSourceDTO> sources = sourceService.findAll(pageable).map(entityMapper::toDTO);
        return ResponseEntity.ok(sources);
    }

    /**
     * GET /api/v1/sources/enabled - 활성 소스 목록 조회
     */
    @GetMapping("/enabled")
    public ResponseEntity<List<NewsSourceDTO>> listEnabledSources() {
        List<NewsSourceDTO> sources = sourceService.findEnabledSources().stream()
                .map(entityMapper::toDTO)
                .toList();
        return ResponseEntity.ok(sources);
    }

    /**
     * GET /api/v1/sources/{id} - ID로 뉴스 소스 조회
     */
    @GetMapping("/{id}")
    public ResponseEntity<NewsSourceDTO> getSource(@PathVariable Long id) {
        return sourceService.findById(id)
                .map(entityMapper::toDTO)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/sources - 새로운 뉴스 소스 등록
     */
    @PostMapping
    public ResponseEntity<NewsSourceDTO> createSource(@Valid @RequestBody NewsSourceCreateRequest request) {
        NewsSource saved = sourceService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(entityMapper.toDTO(saved));
    }

    /**
     * PUT /api/v1/sources/{id} - 뉴스 소스 수정
     */
    @PutMapping("/{id}")
    public ResponseEntity<NewsSourceDTO> updateSource(
            @PathVariable Long id,
            @Valid @RequestBody NewsSourceUpdateRequest request) {
        NewsSource updated = sourceService.update(id, request);
        return ResponseEntity.ok(entityMapper.toDTO(updated));
    }

    /**
     * DELETE /api/v1/sources/{id} - 뉴스 소스 삭제
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteSource(@PathVariable Long id) {
        boolean deleted = sourceService.delete(id);
        return deleted ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    /**
     * POST /api/v1/sources/{id}/activate - 뉴스 소스 활성화
     */
    @PostMapping("/{id}/activate")
    public ResponseEntity<NewsSourceDTO> activateSource(@PathVariable Long id) {
        return ResponseEntity.ok(entityMapper.toDTO(sourceService.setEnabled(id, true)));
    }

    /**
     * POST /api/v1/sources/{id}/deactivate - 뉴스 소스 비활성화
     */
    @PostMapping("/{id}/deactivate")
    public ResponseEntity<NewsSourceDTO> deactivateSource(@PathVariable Long id) {
        return ResponseEntity.ok(entityMapper.toDTO(sourceService.setEnabled(id, false)));
    }
}
