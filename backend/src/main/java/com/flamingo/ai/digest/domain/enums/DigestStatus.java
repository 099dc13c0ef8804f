package com.flamingo.ai.digest.domain.enums;

/** Publication status of a window digest. */
public enum DigestStatus {
  POSTED,
  ERROR
}
