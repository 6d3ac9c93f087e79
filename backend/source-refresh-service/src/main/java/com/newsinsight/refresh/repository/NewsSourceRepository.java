package com.newsinsight.refresh.repository;

import com.newsinsight.refresh.entity.NewsSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface NewsSourceRepository extends JpaRepository<NewsSource, Long> {

    List<NewsSource> findByEnabledTrueOrderByIdAsc();

    List<NewsSource> findByIdIn(Collection<Long> ids);

    Optional<NewsSource> findByName(String name);

    boolean existsByName(String name);

    long countByEnabledTrue();

    @Modifying(clearAutomatically = true)
    @Query("UPDATE NewsSource s SET s.lastRefreshedAt = :refreshedAt WHERE s.name = :name")
    int updateLastRefreshed(@Param("name") String name, @Param("refreshedAt") LocalDateTime refreshedAt);
}
