package com.flamingo.ai.distillate.service.synthesis;

import com.flamingo.ai.distillate.domain.entity.Item;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Items folded into one report, without duplicate ids. */
public record SynthesisBatch(List<Item> items) {

  public SynthesisBatch {
    items = List.copyOf(items);
  }

  /**
   * Unions the unsynthesized backlog with the current live-briefing edition. Backlog order is kept;
   * the live briefing is appended unless it is already part of the backlog.
   */
  public static SynthesisBatch of(List<Item> unsynthesized, Optional<Item> liveBriefing) {
    List<Item> union = new ArrayList<>(unsynthesized.size() + 1);
    Set<String> ids = new LinkedHashSet<>();
    for (Item item : unsynthesized) {
      if (ids.add(item.getId())) {
        union.add(item);
      }
    }
    liveBriefing.filter(item -> ids.add(item.getId())).ifPresent(union::add);
    return new SynthesisBatch(union);
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public int size() {
    return items.size();
  }

  public List<String> ids() {
    return items.stream().map(Item::getId).toList();
  }
}
