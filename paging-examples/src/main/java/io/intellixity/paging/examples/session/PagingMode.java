package io.intellixity.paging.examples.session;

import java.util.Locale;

public enum PagingMode {
  OFFSET,
  KEYSET;

  public static PagingMode parse(String s) {
    if (s == null || s.isBlank()) return OFFSET;
    try {
      return valueOf(s.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown paging mode: " + s + " (expected offset or keyset)", e);
    }
  }
}
