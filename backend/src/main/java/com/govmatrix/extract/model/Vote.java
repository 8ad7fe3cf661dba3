package com.govmatrix.extract.model;

import com.govmatrix.extract.util.AddressUtils;

public record Vote(
    String id,
    String voterAddress,
    String voterName,
    String rawType,
    String amount,
    String reason,
    BlockRef block,
    String txHash
) {
    public Vote {
        voterAddress = AddressUtils.normalize(voterAddress);
        block = block == null ? BlockRef.EMPTY : block;
    }

    public String identity() {
        if (id != null && !id.isBlank()) {
            return id;
        }
        return voterAddress + ":" + (txHash == null ? "" : txHash);
    }
}
