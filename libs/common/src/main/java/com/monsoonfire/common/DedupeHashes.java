/*
 * Where: common utilities
 * What: Derives stable record identities from dedupe keys
 * Why: Every create-if-absent write in the pipeline keys its row by the same sha256 hex digest
 */
package com.monsoonfire.common;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;

public final class DedupeHashes {

  private static final int SUPPORT_CODE_LENGTH = 8;

  private DedupeHashes() {}

  public static String sha256Hex(String value) {
    if (value == null) {
      throw new IllegalArgumentException("value is required");
    }
    return Hashing.sha256().hashString(value, StandardCharsets.UTF_8).toString();
  }

  /** Short, user-quotable code for a dedupe key (first 8 hex characters of its digest). */
  public static String supportCode(String dedupeKey) {
    return sha256Hex(dedupeKey).substring(0, SUPPORT_CODE_LENGTH);
  }
}
