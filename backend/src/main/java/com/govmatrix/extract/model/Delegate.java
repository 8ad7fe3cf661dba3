package com.govmatrix.extract.model;

import com.govmatrix.extract.util.AddressUtils;

public record Delegate(
    String address,
    String name,
    String ens,
    double votingPower,
    int delegatorsCount,
    String statement,
    String statementSummary,
    boolean seekingDelegation
) {
    public Delegate {
        address = AddressUtils.normalize(address);
        votingPower = Double.isFinite(votingPower) ? Math.max(0.0, votingPower) : 0.0;
        delegatorsCount = Math.max(0, delegatorsCount);
    }

    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return AddressUtils.shorten(address);
    }

    public boolean hasStatement() {
        return statement != null && !statement.isBlank();
    }

    public boolean hasVotingPower() {
        return votingPower > 0;
    }
}
