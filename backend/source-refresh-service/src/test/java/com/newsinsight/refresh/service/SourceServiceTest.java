package com.newsinsight.refresh.service;

import com.newsinsight.refresh.collector.SourceSnapshot;
import com.newsinsight.refresh.dto.NewsSourceCreateRequest;
import com.newsinsight.refresh.dto.NewsSourceUpdateRequest;
import com.newsinsight.refresh.entity.NewsSource;
import com.newsinsight.refresh.entity.SourceStatus;
import com.newsinsight.refresh.exception.DuplicateSourceException;
import com.newsinsight.refresh.exception.SourceNotFoundException;
import com.newsinsight.refresh.mapper.EntityMapper;
import com.newsinsight.refresh.repository.NewsSourceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * SourceService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class SourceServiceTest {

    @Mock
    private NewsSourceRepository newsSourceRepository;

    @Spy
    private EntityMapper entityMapper = new EntityMapper();

    @InjectMocks
    private SourceService sourceService;

    private NewsSource testSource;

    @BeforeEach
    void setUp() {
        testSource = NewsSource.builder()
                .id(1L)
                .name("연합뉴스")
                .type("rss")
                .url("https://www.yna.co.kr/rss/news.xml")
                .build();
    }

    @Test
    @DisplayName("소스 생성 - 타입 정규화 후 저장")
    void createSource() {
        // given
        NewsSourceCreateRequest request = new NewsSourceCreateRequest(
                " 한겨레 ", "RSS", "https://www.hani.co.kr/rss/", null, null, Map.of("maxItems", 20), null);
        when(newsSourceRepository.existsByName("한겨레")).thenReturn(false);
        when(newsSourceRepository.save(any(NewsSource.class))).thenAnswer(inv -> inv.getArgument(0));

        // when
        NewsSource result = sourceService.create(request);

        // then
        assertThat(result.getName()).isEqualTo("한겨레");
        assertThat(result.getType()).isEqualTo("rss");
        assertThat(result.getEnabled()).isTrue();
        assertThat(result.getUserAdded()).isTrue();
        assertThat(result.getStatus()).isEqualTo(SourceStatus.UNCHECKED);
        assertThat(result.getCustomConfig()).containsEntry("maxItems", 20);
    }

    @Test
    @DisplayName("소스 생성 - 이름 중복 시 DuplicateSourceException")
    void createDuplicate() {
        // given
        NewsSourceCreateRequest request = new NewsSourceCreateRequest(
                "연합뉴스", "rss", "https://example.com/rss", null, true, null, null);
        when(newsSourceRepository.existsByName("연합뉴스")).thenReturn(true);

        // when & then
        assertThatThrownBy(() -> sourceService.create(request))
                .isInstanceOf(DuplicateSourceException.class);
        verify(newsSourceRepository, never()).save(any());
    }

    @Test
    @DisplayName("소스 수정 - 없는 ID면 SourceNotFoundException")
    void updateMissing() {
        // given
        when(newsSourceRepository.findById(99L)).thenReturn(Optional.empty());
        NewsSourceUpdateRequest request = new NewsSourceUpdateRequest("새 이름", null, null, null, null, null, null);

        // when & then
        assertThatThrownBy(() -> sourceService.update(99L, request))
                .isInstanceOf(SourceNotFoundException.class);
    }

    @Test
    @DisplayName("소스 수정 - null 필드는 유지")
    void updatePartially() {
        // given
        when(newsSourceRepository.findById(1L)).thenReturn(Optional.of(testSource));
        when(newsSourceRepository.save(any(NewsSource.class))).thenAnswer(inv -> inv.getArgument(0));
        NewsSourceUpdateRequest request = new NewsSourceUpdateRequest(null, null, null, "politics", false, null, null);

        // when
        NewsSource result = sourceService.update(1L, request);

        // then
        assertThat(result.getName()).isEqualTo("연합뉴스");
        assertThat(result.getUrl()).isEqualTo("https://www.yna.co.kr/rss/news.xml");
        assertThat(result.getCategory()).isEqualTo("politics");
        assertThat(result.getEnabled()).isFalse();
    }

    @Test
    @DisplayName("소스 수정 - 다른 소스의 이름으로 바꾸면 DuplicateSourceException")
    void updateToTakenName() {
        // given
        when(newsSourceRepository.findById(1L)).thenReturn(Optional.of(testSource));
        when(newsSourceRepository.existsByName("BBC News")).thenReturn(true);
        NewsSourceUpdateRequest request = new NewsSourceUpdateRequest("BBC News", null, null, null, null, null, null);

        // when & then
        assertThatThrownBy(() -> sourceService.update(1L, request))
                .isInstanceOf(DuplicateSourceException.class);
    }

    @Test
    @DisplayName("활성화 상태 변경")
    void setEnabled() {
        // given
        when(newsSourceRepository.findById(1L)).thenReturn(Optional.of(testSource));
        when(newsSourceRepository.save(testSource)).thenReturn(testSource);

        // when
        NewsSource result = sourceService.setEnabled(1L, false);

        // then
        assertThat(result.getEnabled()).isFalse();
        verify(newsSourceRepository, times(1)).save(testSource);
    }

    @Test
    @DisplayName("소스 삭제 - 존재 여부에 따라 결과 반환")
    void deleteSource() {
        // given
        when(newsSourceRepository.existsById(1L)).thenReturn(true);
        when(newsSourceRepository.existsById(2L)).thenReturn(false);

        // when & then
        assertThat(sourceService.delete(1L)).isTrue();
        assertThat(sourceService.delete(2L)).isFalse();
        verify(newsSourceRepository, times(1)).deleteById(1L);
        verify(newsSourceRepository, never()).deleteById(2L);
    }

    @Test
    @DisplayName("활성 소스 스냅샷은 엔티티 값을 복사한다")
    void snapshotEnabled() {
        // given
        testSource.setConsecutiveErrorCount(2);
        testSource.setStatus(SourceStatus.ERROR);
        when(newsSourceRepository.findByEnabledTrueOrderByIdAsc()).thenReturn(List.of(testSource));

        // when
        List<SourceSnapshot> result = sourceService.snapshotEnabled();

        // then
        assertThat(result).hasSize(1);
        SourceSnapshot snapshot = result.get(0);
        assertThat(snapshot.id()).isEqualTo(1L);
        assertThat(snapshot.name()).isEqualTo("연합뉴스");
        assertThat(snapshot.consecutiveErrorCount()).isEqualTo(2);

        testSource.setConsecutiveErrorCount(7);
        assertThat(snapshot.consecutiveErrorCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("ID 지정 스냅샷은 ID 순으로 정렬")
    void snapshotsForIds() {
        // given
        NewsSource other = NewsSource.builder().id(5L).name("BBC News").type("rss").build();
        when(newsSourceRepository.findByIdIn(List.of(5L, 1L))).thenReturn(List.of(other, testSource));

        // when
        List<SourceSnapshot> result = sourceService.snapshotsFor(List.of(5L, 1L));

        // then
        assertThat(result).extracting(SourceSnapshot::id).containsExactly(1L, 5L);
    }
}
