package com.contentcuration.curator.repository;

import com.contentcuration.curator.entity.ContentItem;
import com.contentcuration.curator.entity.Rating;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public interface ContentItemRepository extends JpaRepository<ContentItem, Long> {

    boolean existsByUrl(String url);

    List<ContentItem> findByRatingIsNullOrderByFetchedAtDesc(Pageable pageable);

    /**
     * Unpublished items in the given tiers; window and ordering are applied by the caller.
     */
    List<ContentItem> findByPublishedAndRatingIn(Boolean published, Collection<Rating> ratings);

    long countByDigestId(Long digestId);

    long countByRatingIsNotNull();

    long countByPublishedAndRatingIn(Boolean published, Collection<Rating> ratings);

    @Query("SELECT c.rating, COUNT(c) FROM ContentItem c WHERE c.rating IS NOT NULL GROUP BY c.rating")
    List<Object[]> countGroupedByRating();

    /**
     * Publication step: links still-unpublished items to a digest.
     *
     * @return number of rows actually marked
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ContentItem c SET c.published = :published, c.digestId = :digestId " +
           "WHERE c.id IN :ids AND c.published = :unpublished AND c.rating IS NOT NULL")
    int markPublished(@Param("ids") Collection<Long> ids,
                      @Param("digestId") Long digestId,
                      @Param("published") Boolean published,
                      @Param("unpublished") Boolean unpublished);
}
