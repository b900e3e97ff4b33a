package com.flamingo.ai.distillate.service.status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.flamingo.ai.distillate.domain.entity.Report;
import com.flamingo.ai.distillate.domain.repository.ItemRepository;
import com.flamingo.ai.distillate.domain.repository.ReportRepository;
import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PipelineStatusServiceTest {

  @Mock private ItemRepository itemRepository;
  @Mock private ReportRepository reportRepository;

  @InjectMocks private PipelineStatusService pipelineStatusService;

  @Test
  @DisplayName("should collect backlog counts and the latest report time")
  void shouldCollectStats() {
    LocalDateTime generatedAt = LocalDateTime.of(2025, 6, 10, 7, 30);
    when(itemRepository.count()).thenReturn(12L);
    when(itemRepository.countByProcessedFalse()).thenReturn(3L);
    when(itemRepository.countByProcessedTrueAndSynthesizedFalse()).thenReturn(4L);
    when(reportRepository.count()).thenReturn(2L);
    when(reportRepository.findFirstByOrderByGeneratedAtDescIdDesc())
        .thenReturn(Optional.of(Report.builder().generatedAt(generatedAt).build()));

    PipelineStats stats = pipelineStatusService.report();

    assertThat(stats.totalItems()).isEqualTo(12);
    assertThat(stats.awaitingDistillation()).isEqualTo(3);
    assertThat(stats.awaitingSynthesis()).isEqualTo(4);
    assertThat(stats.totalReports()).isEqualTo(2);
    assertThat(stats.latestReportAt()).isEqualTo(generatedAt);
  }

  @Test
  @DisplayName("should report no latest time when no report exists")
  void shouldReportNoLatest_whenStoreEmpty() {
    when(reportRepository.findFirstByOrderByGeneratedAtDescIdDesc()).thenReturn(Optional.empty());

    PipelineStats stats = pipelineStatusService.collect();

    assertThat(stats.totalItems()).isZero();
    assertThat(stats.latestReportAt()).isNull();
  }
}
