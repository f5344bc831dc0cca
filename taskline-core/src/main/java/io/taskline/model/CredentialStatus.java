package io.taskline.model;

public enum CredentialStatus {
  ACTIVE(0),
  EXPIRING(1),
  REVOKED(2);

  private final int code;

  CredentialStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static CredentialStatus fromCode(int code) {
    for (CredentialStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown credential status code: " + code);
  }
}
