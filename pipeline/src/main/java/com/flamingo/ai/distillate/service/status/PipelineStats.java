package com.flamingo.ai.distillate.service.status;

import java.time.LocalDateTime;

/** Operator view of the store's backlog. */
public record PipelineStats(
    long totalItems,
    long awaitingDistillation,
    long awaitingSynthesis,
    long totalReports,
    LocalDateTime latestReportAt // null before the first report
    ) {}
