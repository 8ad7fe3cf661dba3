package com.govmatrix.extract.checkpoint;

import com.govmatrix.extract.model.Delegate;
import com.govmatrix.extract.model.Proposal;
import com.govmatrix.extract.model.Vote;

import java.util.List;
import java.util.function.UnaryOperator;

public record CheckpointUpdate(
    String section,
    UnaryOperator<CheckpointState> change
) {

    public static CheckpointUpdate organization(String organizationId) {
        return new CheckpointUpdate("organization", state -> state.withOrganizationId(organizationId));
    }

    public static CheckpointUpdate delegatesInProgress(List<Delegate> delegates, String cursor) {
        return new CheckpointUpdate("delegates", state -> state.withDelegates(delegates, cursor, false));
    }

    public static CheckpointUpdate delegatesComplete(List<Delegate> delegates) {
        return new CheckpointUpdate("delegates", state -> state.withDelegates(delegates, null, true));
    }

    public static CheckpointUpdate proposals(List<Proposal> proposals, boolean complete) {
        return new CheckpointUpdate("proposals", state -> state.withProposals(proposals, complete));
    }

    public static CheckpointUpdate votes(String proposalId, List<Vote> votes, boolean complete) {
        return new CheckpointUpdate("votes:" + proposalId, state -> state.withVotes(proposalId, votes, complete));
    }

    CheckpointState applyTo(CheckpointState state) {
        return change.apply(state);
    }
}
