package com.flamingo.ai.digest.domain.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Stable fingerprint of message text used for strict duplicate detection: lowercased, links
 * removed, whitespace collapsed, then SHA-256 in hex. Text that normalizes to nothing has an empty
 * hash and never matches.
 */
public final class CanonicalHash {

  private static final Pattern URL = Pattern.compile("https?://\\S+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private CanonicalHash() {}

  public static String of(String text) {
    String normalized = normalize(text);
    if (normalized.isEmpty()) {
      return "";
    }
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  static String normalize(String text) {
    if (text == null) {
      return "";
    }
    String lower = text.toLowerCase(Locale.ROOT);
    String withoutLinks = URL.matcher(lower).replaceAll(" ");
    return WHITESPACE.matcher(withoutLinks).replaceAll(" ").trim();
  }
}
