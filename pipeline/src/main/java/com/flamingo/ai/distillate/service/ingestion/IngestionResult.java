package com.flamingo.ai.distillate.service.ingestion;

/** Outcome of one collection pass over the source registry. */
public record IngestionResult(
    int sourcesVisited,
    int sourcesFailed,
    int itemsInserted,
    int duplicatesSkipped,
    int entriesRejected, // failed bean validation
    int entriesFailed // network or parse failure of a single entry
    ) {}
