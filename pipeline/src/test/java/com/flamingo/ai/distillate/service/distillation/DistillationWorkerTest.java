package com.flamingo.ai.distillate.service.distillation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.distillate.agent.dto.ItemDistillation;
import com.flamingo.ai.distillate.domain.entity.Item;
import com.flamingo.ai.distillate.exception.LlmServiceException;
import com.flamingo.ai.distillate.service.guard.RunGuard;
import com.flamingo.ai.distillate.service.store.ItemStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class DistillationWorkerTest {

  @TempDir Path tempDir;

  @Mock private ItemStore itemStore;
  @Mock private DistillationService distillationService;

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private Path token;
  private DistillationWorker worker;

  @BeforeEach
  void setUp() {
    token = tempDir.resolve("distillation.lock");
    worker =
        new DistillationWorker(
            new RunGuard(token, 1000, pid -> pid == 2000), itemStore, distillationService, meterRegistry);
  }

  private static Item item(String id, String rawText) {
    return Item.builder().id(id).source("S").title("Title " + id).url("u").rawText(rawText).build();
  }

  @Test
  @DisplayName("should distill items with text and release the guard")
  void shouldDistillPendingItems() {
    when(itemStore.findUnprocessed()).thenReturn(List.of(item("a", "Text A")));
    when(distillationService.distill("Title a", "Text A"))
        .thenReturn(new ItemDistillation("Finance", "Summary A."));

    DistillationResult result = worker.run();

    assertThat(result.distilled()).isEqualTo(1);
    verify(itemStore).markDistilled("a", "Finance", "Summary A.");
    assertThat(token).doesNotExist();
  }

  @Test
  @DisplayName("should mark empty items processed without calling the model")
  void shouldSkipModel_whenTextBlank() {
    when(itemStore.findUnprocessed()).thenReturn(List.of(item("empty", "  "), item("null", null)));

    DistillationResult result = worker.run();

    assertThat(result.emptied()).isEqualTo(2);
    assertThat(result.failed()).isZero();
    verify(itemStore).markProcessedWithoutContent("empty");
    verify(itemStore).markProcessedWithoutContent("null");
    verifyNoInteractions(distillationService);
  }

  @Test
  @DisplayName("should leave a failing item unprocessed and continue")
  void shouldContinue_whenItemFails() {
    when(itemStore.findUnprocessed()).thenReturn(List.of(item("bad", "Text"), item("good", "Text")));
    when(distillationService.distill("Title bad", "Text"))
        .thenThrow(new LlmServiceException("exhausted"));
    when(distillationService.distill("Title good", "Text"))
        .thenReturn(new ItemDistillation("Healthcare", "Fine."));

    DistillationResult result = worker.run();

    assertThat(result.failed()).isEqualTo(1);
    assertThat(result.distilled()).isEqualTo(1);
    verify(itemStore, never()).markDistilled(eq("bad"), anyString(), anyString());
    assertThat(meterRegistry.counter("distillation.items.failure").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should exit without touching items while another run holds the guard")
  void shouldExit_whenGuardHeld() throws Exception {
    Files.writeString(token, "2000");

    DistillationResult result = worker.run();

    assertThat(result.guardAcquired()).isFalse();
    assertThat(result.isFailure()).isFalse();
    verifyNoInteractions(itemStore, distillationService);
    assertThat(token).exists();
  }

  @Test
  @DisplayName("should report a store failure and release the guard")
  void shouldFail_whenStoreUnavailable() {
    when(itemStore.findUnprocessed()).thenThrow(new DataAccessResourceFailureException("locked"));

    DistillationResult result = worker.run();

    assertThat(result.isFailure()).isTrue();
    assertThat(token).doesNotExist();
  }
}
