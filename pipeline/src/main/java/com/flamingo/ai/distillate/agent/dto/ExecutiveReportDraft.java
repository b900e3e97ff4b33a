package com.flamingo.ai.distillate.agent.dto;

/**
 * Structured output from ExecutiveReportAgent. Every section is a markdown bulleted list using
 * asterisks, one bullet per line.
 */
public record ExecutiveReportDraft(
    String whatsNew, String featureBriefSummary, String keyTakeaways) {}
