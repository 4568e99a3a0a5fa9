package com.flamingo.ai.specshard.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INVALID_SHARD_ID = "SHARD_001";
  public static final String SHARDING_FAILED = "SHARD_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String MALFORMED_REQUEST = "VALIDATION_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, when safe to expose. */
  private final String details;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
