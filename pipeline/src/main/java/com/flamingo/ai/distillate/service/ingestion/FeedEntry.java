package com.flamingo.ai.distillate.service.ingestion;

import java.time.LocalDateTime;

/**
 * One entry of a parsed feed document.
 *
 * @param id feed-provided identifier, null when the feed has none
 * @param title entry title
 * @param link entry page URL
 * @param summary feed blurb, possibly HTML
 * @param publishedAt declared publication time in UTC, null when absent or unparseable
 * @param audioUrl URL of an audio enclosure, null when there is none
 */
public record FeedEntry(
    String id,
    String title,
    String link,
    String summary,
    LocalDateTime publishedAt,
    String audioUrl) {}
