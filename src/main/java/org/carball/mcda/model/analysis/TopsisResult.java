package org.carball.mcda.model.analysis;

public record TopsisResult(
    String alternativeId,
    String name,
    double score,
    int rank,
    double distanceToIdeal,
    double distanceToNegativeIdeal
) {}
