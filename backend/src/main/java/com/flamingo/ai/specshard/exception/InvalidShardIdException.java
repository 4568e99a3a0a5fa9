package com.flamingo.ai.specshard.exception;

/** Exception thrown when a shard id is unusable in structural scans or file names. */
public class InvalidShardIdException extends RuntimeException {

  private final Object shardId;

  public InvalidShardIdException(Object shardId, String message) {
    super("Invalid shard ID: " + message);
    this.shardId = shardId;
  }

  public Object getShardId() {
    return shardId;
  }
}
