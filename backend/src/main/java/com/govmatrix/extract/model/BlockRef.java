package com.govmatrix.extract.model;

public record BlockRef(
    String timestamp,
    Long number
) {
    public static final BlockRef EMPTY = new BlockRef(null, null);
}
