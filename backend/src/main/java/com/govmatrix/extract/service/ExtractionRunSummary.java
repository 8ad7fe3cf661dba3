package com.govmatrix.extract.service;

import com.govmatrix.extract.http.ClientStats;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ExtractionRunSummary(
    String slug,
    String organizationId,
    String organizationName,
    ExtractionStatus status,
    Instant startedAt,
    Instant finishedAt,
    int delegatesCollected,
    int proposalsCollected,
    int matrixRecords,
    List<String> incompleteProposalIds,
    Map<String, String> files,
    String message,
    ClientStats clientStats
) {
    public ExtractionRunSummary {
        incompleteProposalIds = incompleteProposalIds == null ? List.of() : List.copyOf(incompleteProposalIds);
        files = files == null ? Map.of() : Map.copyOf(files);
    }
}
