package com.govmatrix.extract.model;

public record VotingMatrixRecord(
    Delegate delegate,
    Proposal proposal,
    VoteOutcome vote,
    String votingAmount,
    String rawVoteType,
    String voteReason,
    String voteTimestamp,
    Long voteBlockNumber,
    String voteTxHash
) {
    public static VotingMatrixRecord didNotVote(Delegate delegate, Proposal proposal) {
        return new VotingMatrixRecord(delegate, proposal, VoteOutcome.DID_NOT_VOTE, "0", "", "", "", null, "");
    }

    public boolean participated() {
        return vote.isParticipation();
    }
}
