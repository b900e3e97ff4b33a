package com.flamingo.ai.distillate.domain.repository;

import com.flamingo.ai.distillate.domain.entity.Item;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/** Repository for Item entities. */
@Repository
public interface ItemRepository extends JpaRepository<Item, String> {

  /** Finds items awaiting distillation, oldest first. */
  List<Item> findByProcessedFalseOrderByInsertionSequenceAsc();

  /** Finds processed items not yet folded into a report, most recent first. */
  List<Item> findByProcessedTrueAndSynthesizedFalseOrderByInsertionSequenceDesc();

  /** Finds the newest processed item of a source published at or after the given instant. */
  Optional<Item> findFirstBySourceAndProcessedTrueAndPublishedAtGreaterThanEqualOrderByInsertionSequenceDesc(
      String source, LocalDateTime publishedSince);

  long countByProcessedFalse();

  long countByProcessedTrueAndSynthesizedFalse();

  /** Highest insertion sequence assigned so far, 0 for an empty store. */
  @Query("SELECT COALESCE(MAX(i.insertionSequence), 0) FROM Item i")
  long findMaxInsertionSequence();
}
