package com.flamingo.ai.distillate.service.ingestion;

import com.flamingo.ai.distillate.config.PipelineConfig;
import com.flamingo.ai.distillate.domain.entity.Item;
import com.flamingo.ai.distillate.domain.enums.SourceKind;
import com.flamingo.ai.distillate.exception.ContentExtractionException;
import com.flamingo.ai.distillate.exception.FetchException;
import com.flamingo.ai.distillate.service.fetch.Fetcher;
import com.flamingo.ai.distillate.service.store.ItemStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Ingestion stage: visits every registered source and stores the entries not seen before.
 *
 * <p>A failing entry or source is logged and counted, never propagated; only an unavailable store
 * aborts the run. Candidates of one source
 * are persisted oldest first so that the insertion sequence follows recency.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionCollector {

  static final String VIDEO_ID_PREFIX = "video:";

  private final SourceRegistry sourceRegistry;
  private final Fetcher fetcher;
  private final FeedParser feedParser;
  private final ArticleTextExtractor articleTextExtractor;
  private final VideoChannelScraper videoChannelScraper;
  private final TranscriptClient transcriptClient;
  private final ItemStore itemStore;
  private final Validator validator;
  private final PipelineConfig pipelineConfig;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  @Timed(value = "ingestion.run", description = "Time to visit all sources")
  public IngestionResult collect() {
    Tally tally = new Tally();
    List<SourceDescriptor> sources = sourceRegistry.sources();
    log.info("Ingestion started for {} source(s)", sources.size());

    for (int i = 0; i < sources.size(); i++) {
      if (i > 0 && !pause()) {
        log.warn("Ingestion interrupted after {} source(s)", tally.sourcesVisited);
        break;
      }
      SourceDescriptor source = sources.get(i);
      tally.sourcesVisited++;
      try {
        List<Item> candidates =
            source.kind() == SourceKind.VIDEO_CHANNEL
                ? videoCandidates(source, tally)
                : feedCandidates(source, tally);
        persist(source, candidates, tally);
      } catch (DataAccessException e) {
        log.error("Item store unavailable while collecting '{}'", source.name());
        throw e;
      } catch (RuntimeException e) {
        tally.sourcesFailed++;
        meterRegistry.counter("ingestion.sources.failure").increment();
        log.error("Source '{}' skipped: {}", source.name(), e.getMessage());
      }
    }

    IngestionResult result = tally.toResult();
    log.info(
        "Ingestion finished: {} inserted, {} duplicate(s), {} rejected, {} failed entr(ies),"
            + " {}/{} source(s) failed",
        result.itemsInserted(),
        result.duplicatesSkipped(),
        result.entriesRejected(),
        result.entriesFailed(),
        result.sourcesFailed(),
        result.sourcesVisited());
    return result;
  }

  private List<Item> feedCandidates(SourceDescriptor source, Tally tally) {
    String document = fetcher.fetch(source.endpoint());
    List<FeedEntry> entries = feedParser.parse(source.name(), document, maxEntries());
    List<Item> candidates = new ArrayList<>();

    for (FeedEntry entry : entries) {
      String id = entry.id() != null ? entry.id() : entry.link();
      try {
        if (id != null && itemStore.exists(id)) {
          tally.duplicates++;
          continue;
        }
        Item item =
            Item.builder()
                .id(id)
                .source(source.name())
                .title(entry.title())
                .url(entry.link())
                .rawText(entry.summary())
                .summary(entry.summary())
                .audioPath(entry.audioUrl())
                .publishedAt(entry.publishedAt() != null ? entry.publishedAt() : now())
                .build();
        if (!isValid(source, item, tally)) {
          continue;
        }
        if (item.getAudioPath() == null && source.fullText()) {
          replaceWithArticleText(item);
        }
        candidates.add(item);
      } catch (DataAccessException e) {
        throw e;
      } catch (RuntimeException e) {
        entryFailed(source, id, e, tally);
      }
    }
    return candidates;
  }

  private void replaceWithArticleText(Item item) {
    try {
      String text = articleTextExtractor.extract(fetcher.fetch(item.getUrl()));
      if (!text.isBlank()) {
        item.setRawText(text);
      }
    } catch (FetchException | ContentExtractionException e) {
      log.warn("Keeping feed summary for {}: {}", item.getUrl(), e.getMessage());
    }
  }

  private List<Item> videoCandidates(SourceDescriptor source, Tally tally) {
    List<String> videoIds = videoChannelScraper.listVideoIds(source.endpoint(), maxEntries());
    List<Item> candidates = new ArrayList<>();

    for (String videoId : videoIds) {
      String id = VIDEO_ID_PREFIX + videoId;
      try {
        if (itemStore.exists(id)) {
          tally.duplicates++;
          continue;
        }
        String watchPage = videoChannelScraper.fetchWatchPage(videoId);
        VideoMetadata metadata = videoChannelScraper.metadataOf(videoId, watchPage);
        String rawText =
            String.join(" ", transcriptClient.fetchSegments(videoId, watchPage)).strip();
        Item item =
            Item.builder()
                .id(id)
                .source(source.name())
                .title(metadata.title())
                .url(metadata.url())
                .rawText(rawText)
                .summary(prefix(rawText))
                .publishedAt(metadata.publishedAt() != null ? metadata.publishedAt() : now())
                .build();
        if (isValid(source, item, tally)) {
          candidates.add(item);
        }
      } catch (DataAccessException e) {
        throw e;
      } catch (RuntimeException e) {
        entryFailed(source, id, e, tally);
      }
    }
    return candidates;
  }

  private void persist(SourceDescriptor source, List<Item> candidates, Tally tally) {
    Collections.reverse(candidates);
    candidates.sort(Comparator.comparing(Item::getPublishedAt));

    for (Item item : candidates) {
      if (itemStore.exists(item.getId())) {
        tally.duplicates++;
        continue;
      }
      try {
        itemStore.insert(item);
        tally.inserted++;
        meterRegistry.counter("ingestion.items.inserted").increment();
        log.info("New item from '{}': {}", source.name(), item.getTitle());
      } catch (DataIntegrityViolationException e) {
        tally.duplicates++;
        log.info("Item {} already present, skipping", item.getId());
      } catch (DataAccessException e) {
        throw e;
      } catch (RuntimeException e) {
        entryFailed(source, item.getId(), e, tally);
      }
    }
  }

  private boolean isValid(SourceDescriptor source, Item item, Tally tally) {
    Set<ConstraintViolation<Item>> violations = validator.validate(item);
    if (violations.isEmpty()) {
      return true;
    }
    tally.rejected++;
    meterRegistry.counter("ingestion.entries.rejected").increment();
    log.warn(
        "Rejected entry {} from '{}': {}",
        item.getId(),
        source.name(),
        violations.stream()
            .map(v -> v.getPropertyPath() + " " + v.getMessage())
            .sorted()
            .collect(Collectors.joining(", ")));
    return false;
  }

  private void entryFailed(SourceDescriptor source, String id, RuntimeException e, Tally tally) {
    tally.failed++;
    meterRegistry.counter("ingestion.entries.failure").increment();
    log.warn("Entry {} from '{}' skipped: {}", id, source.name(), e.getMessage());
  }

  private String prefix(String rawText) {
    int limit = pipelineConfig.getIngestion().getSummaryPrefixChars();
    return rawText.length() > limit ? rawText.substring(0, limit) + "..." : rawText;
  }

  private int maxEntries() {
    return pipelineConfig.getIngestion().getMaxEntriesPerSource();
  }

  private LocalDateTime now() {
    return LocalDateTime.now(clock);
  }

  /** Returns false when interrupted. */
  private boolean pause() {
    Duration delay = pipelineConfig.getIngestion().getSourceDelay();
    if (delay == null || delay.isZero() || delay.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(delay.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static final class Tally {
    private int sourcesVisited;
    private int sourcesFailed;
    private int inserted;
    private int duplicates;
    private int rejected;
    private int failed;

    IngestionResult toResult() {
      return new IngestionResult(
          sourcesVisited, sourcesFailed, inserted, duplicates, rejected, failed);
    }
  }
}
