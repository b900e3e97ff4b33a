package com.flamingo.ai.distillate.service.synthesis;

/** Outcome of one synthesis pass. */
public record SynthesisResult(Status status, Long reportId, int batchSize, String failureReason) {

  public enum Status {
    NO_OP,
    CREATED,
    FAILED
  }

  static SynthesisResult noOp() {
    return new SynthesisResult(Status.NO_OP, null, 0, null);
  }

  static SynthesisResult created(Long reportId, int batchSize) {
    return new SynthesisResult(Status.CREATED, reportId, batchSize, null);
  }

  static SynthesisResult failed(int batchSize, String reason) {
    return new SynthesisResult(Status.FAILED, null, batchSize, reason);
  }

  public boolean isFailure() {
    return status == Status.FAILED;
  }
}
