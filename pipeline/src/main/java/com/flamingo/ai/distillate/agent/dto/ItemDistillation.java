package com.flamingo.ai.distillate.agent.dto;

/** Structured output from ItemDistillationAgent. */
public record ItemDistillation(
    String category, // industry or use case, e.g. "Healthcare"
    String summary // three-sentence condensed summary
    ) {}
