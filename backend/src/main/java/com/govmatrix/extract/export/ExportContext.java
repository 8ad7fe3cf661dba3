package com.govmatrix.extract.export;

import com.govmatrix.extract.http.ClientStats;
import com.govmatrix.extract.model.Organization;

import java.time.Instant;

public record ExportContext(
    String slug,
    String organizationName,
    Instant startedAt,
    ClientStats clientStats,
    int voteBatchSize,
    int voteMaxPages,
    Organization organization
) {
}
