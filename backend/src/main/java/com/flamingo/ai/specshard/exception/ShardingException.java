package com.flamingo.ai.specshard.exception;

/** Exception thrown when a specification cannot be sharded. */
public class ShardingException extends RuntimeException {

  private final String userMessage;

  public ShardingException(String message) {
    super(message);
    this.userMessage = message;
  }

  public ShardingException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Failed to shard specification";
  }

  public ShardingException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
