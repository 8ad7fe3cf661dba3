package com.govmatrix.extract.model;

import java.util.Locale;

public enum ProposalStatus {
    PENDING,
    ACTIVE,
    SUCCEEDED,
    DEFEATED,
    EXECUTED,
    CANCELED,
    QUEUED,
    EXPIRED,
    UNKNOWN;

    public static ProposalStatus fromApi(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        if (value.equals("CANCELLED")) {
            return CANCELED;
        }
        for (ProposalStatus status : values()) {
            if (status.name().equals(value)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
