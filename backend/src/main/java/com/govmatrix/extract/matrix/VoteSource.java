package com.govmatrix.extract.matrix;

import com.govmatrix.extract.model.Proposal;
import com.govmatrix.extract.model.ProposalVotes;

/**
 * Supplies every vote cast on a proposal, fetched or cached. Failures are reported through
 * {@link ProposalVotes#complete()} rather than thrown.
 */
@FunctionalInterface
public interface VoteSource {
    ProposalVotes votesFor(Proposal proposal);
}
