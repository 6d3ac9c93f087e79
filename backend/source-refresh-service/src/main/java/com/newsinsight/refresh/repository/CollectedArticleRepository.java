package com.newsinsight.refresh.repository;

import com.newsinsight.refresh.entity.CollectedArticle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CollectedArticleRepository extends JpaRepository<CollectedArticle, Long> {

    boolean existsByContentHash(String contentHash);

}
