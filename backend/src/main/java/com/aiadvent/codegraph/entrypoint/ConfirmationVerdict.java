package com.aiadvent.codegraph.entrypoint;

public record ConfirmationVerdict(
    Long candidateId,
    boolean confirmed,
    String name,
    String description,
    double confidence,
    String reasoning) {}
