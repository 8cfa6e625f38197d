package com.aiadvent.codegraph.index;

import com.aiadvent.codegraph.parser.model.Language;

/** Source file found on disk, already decoded and hashed. */
public record DiscoveredFile(
    String relativePath, Language language, String content, String contentHash, long sizeBytes) {}
