package com.companyintel.profiles.pipeline.util;

import java.util.Locale;

public final class ReasonCodes {
  public static final String MISSING_INDEX_HTML = "MISSING_INDEX_HTML";
  public static final String UNREADABLE_FILE = "UNREADABLE_FILE";
  public static final String INSUFFICIENT_TEXT = "INSUFFICIENT_TEXT";
  public static final String EMPTY_SHORT_DESCRIPTION = "EMPTY_SHORT_DESCRIPTION";
  public static final String UNKNOWN_INDUSTRY = "UNKNOWN_INDUSTRY";
  public static final String EMPTY_SECTOR = "EMPTY_SECTOR";
  public static final String PROCESSING_EXCEPTION = "PROCESSING_EXCEPTION";

  public static final String PROBE_TIMEOUT = "timeout";
  public static final String PROBE_IO_ERROR = "io_error";
  public static final String PROBE_INVALID_URL = "invalid_url";
  public static final String PROBE_INTERRUPTED = "interrupted";
  public static final String PROBE_HTTP_ERROR = "http_error";

  private ReasonCodes() {}

  public static boolean isRejection(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case EMPTY_SHORT_DESCRIPTION, UNKNOWN_INDUSTRY, EMPTY_SECTOR -> true;
      default -> false;
    };
  }

  public static String fromProbeError(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return null;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return PROBE_TIMEOUT;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return "dns_failure";
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return "tls_failure";
      }
      return PROBE_IO_ERROR;
    }
    return code;
  }
}
