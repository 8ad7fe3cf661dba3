package com.govmatrix.extract.model;

import java.util.List;

public record ProposalVotes(
    String proposalId,
    List<Vote> votes,
    boolean complete,
    String failureReason
) {
    public ProposalVotes {
        votes = votes == null ? List.of() : List.copyOf(votes);
    }

    public static ProposalVotes complete(String proposalId, List<Vote> votes) {
        return new ProposalVotes(proposalId, votes, true, null);
    }
}
