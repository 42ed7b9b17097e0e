package com.followertracker.crawl.util;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;

public final class ReasonCodeClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String IO_ERROR = "IO_ERROR";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String HTTP_400 = "HTTP_400";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String ACCOUNT_SUSPENDED = "ACCOUNT_SUSPENDED";
  public static final String ACCOUNT_NOT_FOUND = "ACCOUNT_NOT_FOUND";
  public static final String PARSING_FAILED = "PARSING_FAILED";
  public static final String BODY_TOO_LARGE = "BODY_TOO_LARGE";
  public static final String RETRIES_EXHAUSTED = "RETRIES_EXHAUSTED";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String UNKNOWN = "UNKNOWN";

  // Twitter API error codes carried in the JSON error body.
  private static final int API_USER_NOT_FOUND = 50;
  private static final int API_USER_SUSPENDED = 63;

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 400) {
      return HTTP_400;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    return UNKNOWN;
  }

  public static String fromApiErrorCode(int apiErrorCode) {
    if (apiErrorCode == API_USER_SUSPENDED) {
      return ACCOUNT_SUSPENDED;
    }
    if (apiErrorCode == API_USER_NOT_FOUND) {
      return ACCOUNT_NOT_FOUND;
    }
    return UNKNOWN;
  }

  /**
   * Maps a transport failure to a reason code by exception type, walking the cause chain.
   */
  public static String fromIoFailure(IOException failure) {
    Throwable current = failure;
    while (current != null) {
      if (current instanceof HttpTimeoutException) {
        return TIMEOUT;
      }
      if (current instanceof UnknownHostException) {
        return DNS_FAILURE;
      }
      if (current instanceof SSLException) {
        return TLS_FAILURE;
      }
      current = current.getCause();
    }
    return IO_ERROR;
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, IO_ERROR, DNS_FAILURE, TLS_FAILURE, HTTP_5XX, PARSING_FAILED, BODY_TOO_LARGE -> true;
      default -> false;
    };
  }

  public static boolean isNotFound(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case HTTP_404, ACCOUNT_SUSPENDED, ACCOUNT_NOT_FOUND -> true;
      default -> false;
    };
  }
}
