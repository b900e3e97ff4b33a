package com.flamingo.ai.distillate.config;

import com.flamingo.ai.distillate.domain.enums.SourceKind;
import com.flamingo.ai.distillate.service.retry.RetryPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion, distillation and synthesis stages. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineConfig {

  private Ingestion ingestion = new Ingestion();
  private Fetch fetch = new Fetch();
  private Distillation distillation = new Distillation();
  private Synthesis synthesis = new Synthesis();
  private Speech speech = new Speech();
  private List<Source> sources = new ArrayList<>();

  @Getter
  @Setter
  public static class Ingestion {
    private int maxEntriesPerSource = 5;

    /** Length of the raw-text prefix used as the initial summary of transcripts. */
    private int summaryPrefixChars = 500;

    /** Pause between two sources of one collection pass. */
    private Duration sourceDelay = Duration.ofSeconds(1);
  }

  @Getter
  @Setter
  public static class Fetch {
    private String userAgent =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko)"
            + " Chrome/124.0.0.0 Safari/537.36";
    private Duration timeout = Duration.ofSeconds(15);
    private int maxInMemoryBytes = 8 * 1024 * 1024;
    private Retry retry = new Retry(5, Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(10));
  }

  @Getter
  @Setter
  public static class Distillation {
    private String guardFile = "distillation.lock";
    private int maxInputChars = 24_000;
    private Retry retry = Retry.languageModelDefaults();
  }

  @Getter
  @Setter
  public static class Synthesis {
    /** Registry name of the source whose newest edition is always part of the next report. */
    private String liveBriefingSource = "The AI Daily Brief";

    private Duration liveBriefingWindow = Duration.ofHours(24);
    private String showName = "AI Distillate";
    private int scriptTargetWords = 450;

    /** Cap on the raw text contributed by one item to the script corpus. */
    private int maxCorpusEntryChars = 8_000;

    private String audioDir = "audio";
    private Retry retry = Retry.languageModelDefaults();
  }

  @Getter
  @Setter
  public static class Speech {
    private String baseUrl = "https://api.openai.com/v1";
    private String apiKey;
    private String model = "tts-1";
    private String voice = "nova";
    private Duration timeout = Duration.ofSeconds(120);
    private Retry retry = new Retry(3, Duration.ofSeconds(2), Duration.ofSeconds(2), Duration.ofSeconds(20));
  }

  /** One entry of the source registry. */
  @Getter
  @Setter
  public static class Source {
    private String name;
    private String endpoint;
    private SourceKind kind = SourceKind.FEED;

    /** False for feeds whose body already is the content, e.g. paper abstracts. */
    private boolean fullText = true;
  }

  /** Bindable form of a {@link RetryPolicy}. */
  @Getter
  @Setter
  public static class Retry {
    private int maxAttempts;
    private Duration baseDelay;
    private Duration minDelay;
    private Duration maxDelay;

    public Retry() {
      this(1, Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }

    public Retry(int maxAttempts, Duration baseDelay, Duration minDelay, Duration maxDelay) {
      this.maxAttempts = maxAttempts;
      this.baseDelay = baseDelay;
      this.minDelay = minDelay;
      this.maxDelay = maxDelay;
    }

    static Retry languageModelDefaults() {
      return new Retry(6, Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(65));
    }

    public RetryPolicy toPolicy() {
      return new RetryPolicy(maxAttempts, baseDelay, minDelay, maxDelay);
    }
  }
}
