package com.govmatrix.extract.model;

import java.util.Map;

public record ProposalAggregate(
    Proposal proposal,
    int eligibleDelegates,
    int uniqueVoters,
    int votesFetched,
    Integer expectedVoters,
    Map<VoteOutcome, Integer> tallies,
    double participationRate,
    boolean votesComplete
) {
    public ProposalAggregate {
        tallies = Map.copyOf(tallies);
    }

    public int tally(VoteOutcome outcome) {
        return tallies.getOrDefault(outcome, 0);
    }
}
