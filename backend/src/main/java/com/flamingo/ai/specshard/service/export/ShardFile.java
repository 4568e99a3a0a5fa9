package com.flamingo.ai.specshard.service.export;

/**
 * One exported file.
 *
 * @param fileName sanitized file name, no directory part
 * @param content file body
 */
public record ShardFile(String fileName, String content) {}
