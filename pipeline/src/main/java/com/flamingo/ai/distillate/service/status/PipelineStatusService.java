package com.flamingo.ai.distillate.service.status;

import com.flamingo.ai.distillate.domain.entity.Report;
import com.flamingo.ai.distillate.domain.repository.ItemRepository;
import com.flamingo.ai.distillate.domain.repository.ReportRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Collects and logs store statistics for operators. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineStatusService {

  private final ItemRepository itemRepository;
  private final ReportRepository reportRepository;

  @Transactional(readOnly = true)
  public PipelineStats collect() {
    return new PipelineStats(
        itemRepository.count(),
        itemRepository.countByProcessedFalse(),
        itemRepository.countByProcessedTrueAndSynthesizedFalse(),
        reportRepository.count(),
        reportRepository
            .findFirstByOrderByGeneratedAtDescIdDesc()
            .map(Report::getGeneratedAt)
            .orElse(null));
  }

  public PipelineStats report() {
    PipelineStats stats = collect();
    log.info(
        "Items: {} total, {} awaiting distillation, {} awaiting synthesis",
        stats.totalItems(),
        stats.awaitingDistillation(),
        stats.awaitingSynthesis());
    log.info(
        "Reports: {} total, latest {}",
        stats.totalReports(),
        stats.latestReportAt() != null ? stats.latestReportAt() : "never");
    return stats;
  }
}
