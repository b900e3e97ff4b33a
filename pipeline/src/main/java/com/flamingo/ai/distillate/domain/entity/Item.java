package com.flamingo.ai.distillate.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.validation.constraints.NotBlank;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

/**
 * One ingested content unit: a feed article or a video transcript.
 *
 * <p>The identifier is assigned by the collector, so the entity reports itself as new until it has
 * been persisted or loaded. Saving a new item with an existing id therefore fails on the primary
 * key instead of overwriting the stored row.
 */
@Entity
@Table(name = "items")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Item implements Persistable<String> {

  @Id
  @NotBlank
  private String id;

  @NotBlank
  @Column(nullable = false)
  private String source;

  @NotBlank
  @Column(nullable = false)
  private String title;

  @NotBlank
  @Column(nullable = false)
  private String url;

  @Column(columnDefinition = "TEXT")
  private String rawText;

  @Column(columnDefinition = "TEXT")
  private String summary;

  /** Set only by a successful distillation. */
  private String category;

  /** Native audio enclosure shipped by the source, if any. */
  private String audioPath;

  private LocalDateTime publishedAt;

  @Column(updatable = false)
  private LocalDateTime ingestedAt;

  @Column(nullable = false)
  @Builder.Default
  private boolean processed = false;

  @Column(nullable = false)
  @Builder.Default
  private boolean synthesized = false;

  /** Store-assigned recency order, independent of {@link #publishedAt}. */
  @Column(updatable = false)
  private Long insertionSequence;

  @Transient @Builder.Default private boolean newEntity = true;

  @PrePersist
  protected void onCreate() {
    if (ingestedAt == null) {
      ingestedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
  }

  @PostPersist
  @PostLoad
  protected void markStored() {
    newEntity = false;
  }

  @Override
  public boolean isNew() {
    return newEntity;
  }

  /** True when there is no text to distill. */
  public boolean hasBlankText() {
    return rawText == null || rawText.isBlank();
  }

  /** Records a successful distillation. */
  public void markDistilled(String category, String summary) {
    this.category = category;
    this.summary = summary;
    this.processed = true;
  }

  /** Marks an item with no extractable text as processed without assigning a category. */
  public void markProcessedWithoutContent() {
    this.processed = true;
  }

  /** Marks the item as folded into a report. */
  public void markSynthesized() {
    if (!processed) {
      throw new IllegalStateException("Item " + id + " cannot be synthesized before it is processed");
    }
    this.synthesized = true;
  }
}
