package com.govmatrix.extract.model;

import java.util.Map;

public record DelegateAggregate(
    Delegate delegate,
    int totalProposals,
    int votesCast,
    Map<VoteOutcome, Integer> tallies,
    double participationRate
) {
    public DelegateAggregate {
        tallies = Map.copyOf(tallies);
    }

    public int tally(VoteOutcome outcome) {
        return tallies.getOrDefault(outcome, 0);
    }
}
