package com.flamingo.ai.distillate.service.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.distillate.SqliteIntegrationTestSupport;
import com.flamingo.ai.distillate.domain.entity.Item;
import com.flamingo.ai.distillate.domain.entity.Report;
import com.flamingo.ai.distillate.domain.repository.ItemRepository;
import com.flamingo.ai.distillate.domain.repository.ReportRepository;
import com.flamingo.ai.distillate.exception.ItemNotFoundException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;

class ItemStoreIntegrationTest extends SqliteIntegrationTestSupport {

  private static final String BRIEF = "The AI Daily Brief";

  @Autowired private ItemStore itemStore;
  @Autowired private ItemRepository itemRepository;
  @Autowired private ReportRepository reportRepository;

  @BeforeEach
  void setUp() {
    clearStore();
  }

  private static Item.ItemBuilder item(String id) {
    return Item.builder().id(id).source("News").title("Title " + id).url("https://x/" + id);
  }

  private static LocalDateTime now() {
    return LocalDateTime.now(ZoneOffset.UTC);
  }

  @Test
  @DisplayName("should assign strictly increasing insertion sequences")
  void shouldAssignIncreasingSequence() {
    Item first = itemStore.insert(item("a").build());
    Item second = itemStore.insert(item("b").build());

    assertThat(second.getInsertionSequence()).isGreaterThan(first.getInsertionSequence());
    assertThat(first.getIngestedAt()).isNotNull();
    assertThat(first.getPublishedAt()).isEqualTo(first.getIngestedAt());
  }

  @Test
  @DisplayName("should reject a second insert of the same id and keep the stored row")
  void shouldRejectDuplicateId() {
    itemStore.insert(item("dup").title("Original").build());

    assertThatThrownBy(() -> itemStore.insert(item("dup").title("Replacement").build()))
        .isInstanceOf(DataIntegrityViolationException.class);
    assertThat(itemRepository.findById("dup")).get().extracting(Item::getTitle).isEqualTo("Original");
    assertThat(itemRepository.count()).isEqualTo(1);
  }

  @Test
  @DisplayName("should return unprocessed items in insertion order and unsynthesized newest first")
  void shouldOrderQueries() {
    itemStore.insert(item("a").build());
    itemStore.insert(item("b").build());
    itemStore.insert(item("c").build());
    itemStore.markDistilled("a", "Finance", "Sum a");
    itemStore.markProcessedWithoutContent("c");

    assertThat(itemStore.findUnprocessed()).extracting(Item::getId).containsExactly("b");
    assertThat(itemStore.findUnsynthesized()).extracting(Item::getId).containsExactly("c", "a");
  }

  @Test
  @DisplayName("should find the live briefing only inside the freshness window")
  void shouldApplyLiveBriefingWindow() {
    LocalDateTime since = now().minusHours(24);
    itemStore.insert(item("stale").source(BRIEF).publishedAt(now().minusHours(25)).build());
    itemStore.markDistilled("stale", "AI", "s");

    assertThat(itemStore.findLatestLiveBriefing(BRIEF, since)).isEmpty();

    itemStore.insert(item("fresh").source(BRIEF).publishedAt(now().minusHours(23)).build());
    assertThat(itemStore.findLatestLiveBriefing(BRIEF, since)).as("unprocessed").isEmpty();

    itemStore.markDistilled("fresh", "AI", "s");
    assertThat(itemStore.findLatestLiveBriefing(BRIEF, since)).get().extracting(Item::getId).isEqualTo("fresh");
  }

  @Test
  @DisplayName("should never select a live briefing without a publication time")
  void shouldSkipLiveBriefing_whenPublishedAtMissing() {
    itemStore.insert(item("undated").source(BRIEF).build());
    itemStore.markDistilled("undated", "AI", "s");
    jdbcTemplate.update("UPDATE items SET published_at = NULL WHERE id = 'undated'");

    assertThat(itemStore.findLatestLiveBriefing(BRIEF, now().minusHours(24))).isEmpty();
  }

  @Test
  @DisplayName("should write the report and the flags together")
  void shouldCommitReportAndFlags() {
    itemStore.insert(item("a").build());
    itemStore.markDistilled("a", "Finance", "Sum");

    Report saved =
        itemStore.commitReport(
            Report.builder().generatedAt(now()).whatsNew("* new").audioPath("a.mp3").build(),
            List.of("a"));

    assertThat(saved.getId()).isNotNull();
    assertThat(itemRepository.findById("a")).get().extracting(Item::isSynthesized).isEqualTo(true);
  }

  @Test
  @DisplayName("should roll back the report when a batch item is missing")
  void shouldRollBack_whenBatchItemMissing() {
    itemStore.insert(item("a").build());
    itemStore.markDistilled("a", "Finance", "Sum");

    assertThatThrownBy(
            () ->
                itemStore.commitReport(
                    Report.builder().generatedAt(now()).build(), List.of("a", "missing")))
        .isInstanceOf(ItemNotFoundException.class);

    assertThat(reportRepository.count()).isZero();
    assertThat(itemRepository.findById("a")).get().extracting(Item::isSynthesized).isEqualTo(false);
  }

  @Test
  @DisplayName("should refuse to flag an unprocessed item as synthesized")
  void shouldRollBack_whenBatchItemUnprocessed() {
    itemStore.insert(item("raw").build());

    assertThatThrownBy(
            () -> itemStore.commitReport(Report.builder().generatedAt(now()).build(), List.of("raw")))
        .isInstanceOf(IllegalStateException.class);
    assertThat(reportRepository.count()).isZero();
  }
}
