package com.flamingo.ai.distillate.service.ingestion;

import com.flamingo.ai.distillate.config.PipelineConfig;
import com.flamingo.ai.distillate.domain.enums.SourceKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Ordered, immutable list of the sources visited by the ingestion collector. */
public final class SourceRegistry {

  private final List<SourceDescriptor> sources;

  public SourceRegistry(List<SourceDescriptor> sources) {
    Set<String> names = new HashSet<>();
    for (SourceDescriptor source : sources) {
      if (source.name() == null || source.name().isBlank()) {
        throw new IllegalArgumentException("Source name must not be blank");
      }
      if (source.endpoint() == null || source.endpoint().isBlank()) {
        throw new IllegalArgumentException("Source '" + source.name() + "' has no endpoint");
      }
      if (source.kind() == null) {
        throw new IllegalArgumentException("Source '" + source.name() + "' has no kind");
      }
      if (!names.add(source.name())) {
        throw new IllegalArgumentException("Duplicate source name: " + source.name());
      }
    }
    this.sources = List.copyOf(sources);
  }

  /** Builds the registry from the {@code pipeline.sources} configuration list. */
  public static SourceRegistry fromConfig(List<PipelineConfig.Source> configured) {
    List<SourceDescriptor> descriptors = new ArrayList<>(configured.size());
    for (PipelineConfig.Source source : configured) {
      descriptors.add(
          new SourceDescriptor(
              source.getName() != null ? source.getName().trim() : null,
              source.getEndpoint() != null ? source.getEndpoint().trim() : null,
              source.getKind() != null ? source.getKind() : SourceKind.FEED,
              source.isFullText()));
    }
    return new SourceRegistry(descriptors);
  }

  public List<SourceDescriptor> sources() {
    return sources;
  }

  public Optional<SourceDescriptor> find(String name) {
    return sources.stream().filter(s -> s.name().equals(name)).findFirst();
  }

  public int size() {
    return sources.size();
  }
}
