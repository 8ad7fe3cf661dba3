package com.govmatrix.extract.model;

import java.util.List;

public record Proposal(
    String id,
    String onchainId,
    String title,
    String description,
    String proposerAddress,
    ProposalStatus status,
    BlockRef start,
    BlockRef end,
    String quorum,
    List<VoteStat> voteStats
) {
    public Proposal {
        status = status == null ? ProposalStatus.UNKNOWN : status;
        start = start == null ? BlockRef.EMPTY : start;
        end = end == null ? BlockRef.EMPTY : end;
        voteStats = voteStats == null ? List.of() : List.copyOf(voteStats);
    }

    public String displayTitle() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        return "Proposal " + id;
    }

    /**
     * Sum of reported voter counts across outcomes, or null when the service reported no stats.
     * Only a hint for pagination; the cursor decides when the vote set is exhausted.
     */
    public Integer expectedVoterCount() {
        if (voteStats.isEmpty()) {
            return null;
        }
        int total = 0;
        for (VoteStat stat : voteStats) {
            total += Math.max(0, stat.votersCount());
        }
        return total;
    }
}
