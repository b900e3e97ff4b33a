package com.flamingo.ai.distillate.domain.enums;

/** Kind of a registered content source. */
public enum SourceKind {
  /** RSS or Atom feed. */
  FEED,

  /** Video platform channel whose transcripts are ingested. */
  VIDEO_CHANNEL
}
