package com.govmatrix.extract.model;

public record VoteStat(
    String type,
    String votesCount,
    int votersCount,
    double percent
) {
}
