package com.flamingo.ai.distillate.service.ingestion;

import java.time.LocalDateTime;

/**
 * Watch-page facts about one video.
 *
 * @param videoId platform id
 * @param title page title, or {@code "Video <id>"} when the page carries none
 * @param url watch-page URL
 * @param publishedAt publication time in UTC, null when the page does not declare it
 */
public record VideoMetadata(String videoId, String title, String url, LocalDateTime publishedAt) {}
