package com.flamingo.ai.distillate.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** One synthesized executive edition. Reports are append-only and never updated. */
@Entity
@Table(name = "reports")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Report {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, updatable = false)
  private LocalDateTime generatedAt;

  @Column(columnDefinition = "TEXT", updatable = false)
  private String whatsNew;

  /** Per-topic coverage of the live-briefing source. */
  @Column(columnDefinition = "TEXT", updatable = false)
  private String featureBriefSummary;

  @Column(columnDefinition = "TEXT", updatable = false)
  private String keyTakeaways;

  @Column(updatable = false)
  private String audioPath;
}
