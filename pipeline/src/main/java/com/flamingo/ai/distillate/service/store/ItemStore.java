package com.flamingo.ai.distillate.service.store;

import com.flamingo.ai.distillate.domain.entity.Item;
import com.flamingo.ai.distillate.domain.entity.Report;
import com.flamingo.ai.distillate.domain.repository.ItemRepository;
import com.flamingo.ai.distillate.domain.repository.ReportRepository;
import com.flamingo.ai.distillate.exception.ItemNotFoundException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transactional access to items and reports for the three stages.
 *
 * <p>Every mutating operation is its own transaction; {@link #commitReport} is the only one that
 * spans several rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ItemStore {

  private final ItemRepository itemRepository;
  private final ReportRepository reportRepository;
  private final Clock clock;

  @Transactional(readOnly = true)
  public boolean exists(String id) {
    return itemRepository.existsById(id);
  }

  /**
   * Inserts a new item, assigning its insertion sequence and ingestion time.
   *
   * @throws DataIntegrityViolationException if the id is already stored
   */
  @Transactional
  public Item insert(Item item) {
    item.setInsertionSequence(itemRepository.findMaxInsertionSequence() + 1);
    if (item.getIngestedAt() == null) {
      item.setIngestedAt(LocalDateTime.now(clock));
    }
    if (item.getPublishedAt() == null) {
      item.setPublishedAt(item.getIngestedAt());
    }
    Item saved;
    try {
      saved = itemRepository.saveAndFlush(item);
    } catch (DataAccessException e) {
      if (isKeyCollision(e)) {
        throw new DataIntegrityViolationException("Item " + item.getId() + " already stored", e);
      }
      throw e;
    }
    log.debug("Inserted item {} (sequence {})", saved.getId(), saved.getInsertionSequence());
    return saved;
  }

  /** SQLite reports a duplicate primary key as a generic JDBC error; find it in the cause chain. */
  private static boolean isKeyCollision(Throwable failure) {
    for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
      if (cause instanceof SQLiteException) {
        SQLiteErrorCode code = ((SQLiteException) cause).getResultCode();
        return code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY
            || code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE;
      }
    }
    return false;
  }

  /** Items awaiting distillation in insertion order. */
  @Transactional(readOnly = true)
  public List<Item> findUnprocessed() {
    return itemRepository.findByProcessedFalseOrderByInsertionSequenceAsc();
  }

  @Transactional
  public Item markDistilled(String id, String category, String summary) {
    Item item = itemRepository.findById(id).orElseThrow(() -> new ItemNotFoundException(id));
    item.markDistilled(category, summary);
    return itemRepository.save(item);
  }

  @Transactional
  public Item markProcessedWithoutContent(String id) {
    Item item = itemRepository.findById(id).orElseThrow(() -> new ItemNotFoundException(id));
    item.markProcessedWithoutContent();
    return itemRepository.save(item);
  }

  /** Processed items not yet in a report, most recent first. */
  @Transactional(readOnly = true)
  public List<Item> findUnsynthesized() {
    return itemRepository.findByProcessedTrueAndSynthesizedFalseOrderByInsertionSequenceDesc();
  }

  /** Newest processed item of the source published at or after {@code since}. */
  @Transactional(readOnly = true)
  public Optional<Item> findLatestLiveBriefing(String source, LocalDateTime since) {
    return itemRepository
        .findFirstBySourceAndProcessedTrueAndPublishedAtGreaterThanEqualOrderByInsertionSequenceDesc(
            source, since);
  }

  /**
   * Inserts the report and flags every batch item as synthesized, all or nothing.
   *
   * @throws ItemNotFoundException if a batch item disappeared; nothing is written
   */
  @Transactional
  public Report commitReport(Report report, Collection<String> itemIds) {
    Report saved = reportRepository.save(report);
    for (String id : itemIds) {
      Item item = itemRepository.findById(id).orElseThrow(() -> new ItemNotFoundException(id));
      item.markSynthesized();
      itemRepository.save(item);
    }
    reportRepository.flush();
    log.info("Committed report {} covering {} item(s)", saved.getId(), itemIds.size());
    return saved;
  }
}
