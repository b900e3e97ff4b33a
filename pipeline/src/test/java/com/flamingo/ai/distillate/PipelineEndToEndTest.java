package com.flamingo.ai.distillate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.distillate.agent.BriefingScriptAgent;
import com.flamingo.ai.distillate.agent.ExecutiveReportAgent;
import com.flamingo.ai.distillate.agent.ItemDistillationAgent;
import com.flamingo.ai.distillate.agent.dto.ExecutiveReportDraft;
import com.flamingo.ai.distillate.agent.dto.ItemDistillation;
import com.flamingo.ai.distillate.domain.entity.Item;
import com.flamingo.ai.distillate.domain.entity.Report;
import com.flamingo.ai.distillate.domain.repository.ItemRepository;
import com.flamingo.ai.distillate.domain.repository.ReportRepository;
import com.flamingo.ai.distillate.exception.SpeechSynthesisException;
import com.flamingo.ai.distillate.service.distillation.DistillationResult;
import com.flamingo.ai.distillate.service.distillation.DistillationWorker;
import com.flamingo.ai.distillate.service.store.ItemStore;
import com.flamingo.ai.distillate.service.synthesis.SpeechSynthesisClient;
import com.flamingo.ai.distillate.service.synthesis.SynthesisResult;
import com.flamingo.ai.distillate.service.synthesis.SynthesisWorker;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

class PipelineEndToEndTest extends SqliteIntegrationTestSupport {

  private static final String BRIEF = "The AI Daily Brief";

  @MockitoBean private ItemDistillationAgent itemDistillationAgent;
  @MockitoBean private ExecutiveReportAgent executiveReportAgent;
  @MockitoBean private BriefingScriptAgent briefingScriptAgent;
  @MockitoBean private SpeechSynthesisClient speechSynthesisClient;

  @Autowired private ItemStore itemStore;
  @Autowired private ItemRepository itemRepository;
  @Autowired private ReportRepository reportRepository;
  @Autowired private DistillationWorker distillationWorker;
  @Autowired private SynthesisWorker synthesisWorker;
  @Autowired private MeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    clearStore();
    when(itemDistillationAgent.distill(anyString(), anyString()))
        .thenReturn(new ItemDistillation("Finance", "Sum A"));
    when(executiveReportAgent.synthesize(eq(BRIEF), anyString()))
        .thenReturn(new ExecutiveReportDraft("* new", "* brief", "* takeaway"));
    when(briefingScriptAgent.writeScript(anyString(), anyInt(), anyString()))
        .thenReturn("Welcome to the daily update.");
    when(speechSynthesisClient.synthesize(anyString())).thenReturn(new byte[] {1, 2, 3});
  }

  private void seed(String id, String source, String rawText) {
    itemStore.insert(
        Item.builder()
            .id(id)
            .source(source)
            .title("Title " + id)
            .url("https://example.com/" + id)
            .rawText(rawText)
            .build());
  }

  private Item load(String id) {
    return itemRepository.findById(id).orElseThrow();
  }

  @Test
  @DisplayName("should distill, then synthesize every processed item into one report")
  void shouldRunDistillationThenSynthesis() {
    seed("A", "News", "x");
    seed("B", "News", "");
    seed("C", "Other", "old");
    itemStore.markDistilled("C", "Retail", "Sum C");
    jdbcTemplate.update("UPDATE items SET synthesized = 1 WHERE id = 'C'");

    DistillationResult distillation = distillationWorker.run();

    assertThat(distillation.distilled()).isEqualTo(1);
    assertThat(distillation.emptied()).isEqualTo(1);
    assertThat(load("A").getCategory()).isEqualTo("Finance");
    assertThat(load("A").getSummary()).isEqualTo("Sum A");
    assertThat(load("B").isProcessed()).isTrue();
    assertThat(load("B").getCategory()).isNull();

    SynthesisResult synthesis = synthesisWorker.run();

    assertThat(synthesis.status()).isEqualTo(SynthesisResult.Status.CREATED);
    assertThat(synthesis.batchSize()).isEqualTo(2);
    assertThat(load("A").isSynthesized()).isTrue();
    assertThat(load("B").isSynthesized()).isTrue();
    assertThat(reportRepository.count()).isEqualTo(1);

    Report report = reportRepository.findFirstByOrderByGeneratedAtDescIdDesc().orElseThrow();
    assertThat(report.getWhatsNew()).isEqualTo("* new");
    assertThat(report.getFeatureBriefSummary()).isEqualTo("* brief");
    assertThat(Files.exists(Path.of(report.getAudioPath()))).isTrue();
    assertThat(meterRegistry.find("distillation.run").timer()).isNotNull();
    assertThat(meterRegistry.find("synthesis.run").tag("application", "ai-distillate").timer())
        .isNotNull();
  }

  @Test
  @DisplayName("should leave the store untouched when speech synthesis fails")
  void shouldRollBack_whenSpeechFails() {
    seed("A", "News", "x");
    itemStore.markDistilled("A", "Finance", "Sum A");
    when(speechSynthesisClient.synthesize(anyString()))
        .thenThrow(new SpeechSynthesisException("service down"));

    SynthesisResult result = synthesisWorker.run();

    assertThat(result.isFailure()).isTrue();
    assertThat(reportRepository.count()).isZero();
    assertThat(load("A").isSynthesized()).isFalse();
  }

  @Test
  @DisplayName("should re-include a fresh live briefing that was already synthesized")
  void shouldReincludeFreshLiveBriefing() {
    itemStore.insert(
        Item.builder()
            .id("video:abc")
            .source(BRIEF)
            .title("Morning episode")
            .url("https://example.com/abc")
            .rawText("transcript")
            .publishedAt(LocalDateTime.now(ZoneOffset.UTC).minusHours(2))
            .build());
    itemStore.markDistilled("video:abc", "AI", "Brief summary");
    jdbcTemplate.update("UPDATE items SET synthesized = 1 WHERE id = 'video:abc'");

    SynthesisResult result = synthesisWorker.run();

    assertThat(result.status()).isEqualTo(SynthesisResult.Status.CREATED);
    assertThat(result.batchSize()).isEqualTo(1);
    assertThat(reportRepository.count()).isEqualTo(1);
    assertThat(load("video:abc").isSynthesized()).isTrue();

    ArgumentCaptor<String> corpus = ArgumentCaptor.forClass(String.class);
    verify(executiveReportAgent).synthesize(eq(BRIEF), corpus.capture());
    assertThat(corpus.getValue())
        .contains("Source: " + BRIEF)
        .contains("Title: Morning episode")
        .contains("Brief summary");
  }

  @Test
  @DisplayName("should do nothing when the only candidate is a stale live briefing")
  void shouldNoOp_whenLiveBriefingStale() {
    itemStore.insert(
        Item.builder()
            .id("video:old")
            .source(BRIEF)
            .title("Old episode")
            .url("https://example.com/old")
            .rawText("transcript")
            .publishedAt(LocalDateTime.now(ZoneOffset.UTC).minusHours(30))
            .build());
    itemStore.markDistilled("video:old", "AI", "Old summary");
    jdbcTemplate.update("UPDATE items SET synthesized = 1 WHERE id = 'video:old'");

    SynthesisResult result = synthesisWorker.run();

    assertThat(result.status()).isEqualTo(SynthesisResult.Status.NO_OP);
    assertThat(reportRepository.count()).isZero();
    verify(speechSynthesisClient, never()).synthesize(anyString());
  }
}
