package com.govmatrix.extract.checkpoint;

public record VoteCursorEntry(
    String afterCursor,
    long timestamp
) {
}
