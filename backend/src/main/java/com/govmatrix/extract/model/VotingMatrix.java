package com.govmatrix.extract.model;

import java.util.List;

public record VotingMatrix(
    List<VotingMatrixRecord> records,
    List<DelegateAggregate> delegateAggregates,
    List<ProposalAggregate> proposalAggregates,
    MatrixStatistics statistics
) {
    public VotingMatrix {
        records = List.copyOf(records);
        delegateAggregates = List.copyOf(delegateAggregates);
        proposalAggregates = List.copyOf(proposalAggregates);
    }
}
