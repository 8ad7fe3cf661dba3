package com.govmatrix.extract.model;

import java.util.List;

public record MatrixStatistics(
    int totalRecords,
    int uniqueDelegates,
    int uniqueProposals,
    int totalVotesFetched,
    int uniqueVoters,
    int proposalsWithVotes,
    int activeDelegates,
    double overallParticipationRate,
    List<String> incompleteProposalIds
) {
    public MatrixStatistics {
        incompleteProposalIds = incompleteProposalIds == null ? List.of() : List.copyOf(incompleteProposalIds);
    }
}
