package io.taskline.model;

public enum JobStatus {
  PENDING(0),
  PROCESSING(1),
  COMPLETED(2),
  FAILED(3),
  CANCELLED(4);

  private final int code;

  JobStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  public static JobStatus fromCode(int code) {
    for (JobStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status code: " + code);
  }
}
