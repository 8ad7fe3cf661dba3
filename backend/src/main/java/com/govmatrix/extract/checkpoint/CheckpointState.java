package com.govmatrix.extract.checkpoint;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.govmatrix.extract.model.Delegate;
import com.govmatrix.extract.model.Proposal;
import com.govmatrix.extract.model.Vote;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Durable snapshot of top-level pagination for one organization. A collection is complete only when
 * its flag is set; a persisted cursor always means incomplete.
 */
public record CheckpointState(
    String organizationId,
    List<Delegate> delegates,
    String delegateCursor,
    boolean delegatesComplete,
    List<Proposal> proposals,
    boolean proposalsComplete,
    Map<String, List<Vote>> votesCache,
    Set<String> completedVoteProposals,
    Instant updatedAt
) {
    public CheckpointState {
        delegates = delegates == null ? List.of() : List.copyOf(delegates);
        proposals = proposals == null ? List.of() : List.copyOf(proposals);
        votesCache = votesCache == null ? Map.of() : copyVotes(votesCache);
        completedVoteProposals = completedVoteProposals == null ? Set.of() : Set.copyOf(completedVoteProposals);
        if (delegateCursor != null) {
            delegatesComplete = false;
        }
    }

    public static CheckpointState empty() {
        return new CheckpointState(null, List.of(), null, false, List.of(), false, Map.of(), Set.of(), null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return delegates.isEmpty() && proposals.isEmpty() && votesCache.isEmpty() && delegateCursor == null;
    }

    public boolean hasCompleteVotes(String proposalId) {
        return completedVoteProposals.contains(proposalId);
    }

    public List<Vote> cachedVotes(String proposalId) {
        return votesCache.getOrDefault(proposalId, List.of());
    }

    public CheckpointState withOrganizationId(String value) {
        return new CheckpointState(value, delegates, delegateCursor, delegatesComplete, proposals,
            proposalsComplete, votesCache, completedVoteProposals, updatedAt);
    }

    public CheckpointState withDelegates(List<Delegate> items, String cursor, boolean complete) {
        return new CheckpointState(organizationId, items, cursor, complete && cursor == null, proposals,
            proposalsComplete, votesCache, completedVoteProposals, updatedAt);
    }

    public CheckpointState withProposals(List<Proposal> items, boolean complete) {
        return new CheckpointState(organizationId, delegates, delegateCursor, delegatesComplete, items,
            complete, votesCache, completedVoteProposals, updatedAt);
    }

    public CheckpointState withVotes(String proposalId, List<Vote> votes, boolean complete) {
        Map<String, List<Vote>> cache = new LinkedHashMap<>(votesCache);
        cache.put(proposalId, votes == null ? List.of() : votes);
        Set<String> completed = new LinkedHashSet<>(completedVoteProposals);
        if (complete) {
            completed.add(proposalId);
        } else {
            completed.remove(proposalId);
        }
        return new CheckpointState(organizationId, delegates, delegateCursor, delegatesComplete, proposals,
            proposalsComplete, cache, completed, updatedAt);
    }

    CheckpointState touchedAt(Instant instant) {
        return new CheckpointState(organizationId, delegates, delegateCursor, delegatesComplete, proposals,
            proposalsComplete, votesCache, completedVoteProposals, instant);
    }

    private static Map<String, List<Vote>> copyVotes(Map<String, List<Vote>> source) {
        Map<String, List<Vote>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null) {
                copy.put(key, value == null ? List.of() : List.copyOf(value));
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
