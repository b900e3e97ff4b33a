package com.flamingo.ai.distillate.service.ingestion;

import com.flamingo.ai.distillate.domain.enums.SourceKind;

/**
 * One configured content source.
 *
 * @param name registry name, stored as {@code Item.source}
 * @param endpoint feed URL or channel listing URL
 * @param kind how the endpoint is read
 * @param fullText whether article pages are fetched to replace the feed blurb
 */
public record SourceDescriptor(String name, String endpoint, SourceKind kind, boolean fullText) {}
