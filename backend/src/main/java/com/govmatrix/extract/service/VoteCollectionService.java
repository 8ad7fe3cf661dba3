package com.govmatrix.extract.service;

import com.govmatrix.config.ExtractorProperties;
import com.govmatrix.extract.checkpoint.CheckpointState;
import com.govmatrix.extract.checkpoint.CheckpointStore;
import com.govmatrix.extract.checkpoint.CheckpointUpdate;
import com.govmatrix.extract.graphql.GovernanceGraphQlApi;
import com.govmatrix.extract.matrix.VoteSource;
import com.govmatrix.extract.model.Proposal;
import com.govmatrix.extract.model.ProposalVotes;
import com.govmatrix.extract.model.Vote;
import com.govmatrix.extract.pagination.CursorPaginator;
import com.govmatrix.extract.pagination.PaginationOutcome;
import com.govmatrix.extract.pagination.PaginationPolicy;
import com.govmatrix.extract.pagination.PaginationResult;
import com.govmatrix.extract.pagination.ResumePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class VoteCollectionService {
    private static final Logger log = LoggerFactory.getLogger(VoteCollectionService.class);

    private final GovernanceGraphQlApi api;
    private final CursorPaginator paginator;
    private final ExtractorProperties properties;

    public VoteCollectionService(GovernanceGraphQlApi api, CursorPaginator paginator, ExtractorProperties properties) {
        this.api = api;
        this.paginator = paginator;
        this.properties = properties;
    }

    public VoteSource sourceFor(CheckpointStore store, boolean forceRefresh) {
        return proposal -> collect(proposal, store, forceRefresh);
    }

    public ProposalVotes collect(Proposal proposal, CheckpointStore store, boolean forceRefresh) {
        String proposalId = proposal.id();
        CheckpointState state = store.current();
        if (!forceRefresh && state.hasCompleteVotes(proposalId)) {
            List<Vote> cached = state.cachedVotes(proposalId);
            log.debug("Using {} cached votes for proposal {}", cached.size(), proposalId);
            return ProposalVotes.complete(proposalId, cached);
        }

        ResumePoint<Vote> resume;
        if (forceRefresh) {
            store.clearVoteCursor(proposalId);
            resume = ResumePoint.fresh();
        } else {
            resume = new ResumePoint<>(state.cachedVotes(proposalId), store.loadVoteCursor(proposalId));
        }

        ExtractorProperties.Pagination pagination = properties.getPagination();
        PaginationPolicy policy = PaginationPolicy.of(pagination.getVoteBatchSize(), pagination.getVoteMaxConsecutiveFailures())
            .withMaxPages(pagination.getVoteMaxPages())
            .withExpectedTotal(proposal.expectedVoterCount())
            .withBatchShrink(pagination.getVoteBatchShrinkEvery(), pagination.getMinVoteBatchSize())
            .withBackoff(pagination.getBackoffInitialMs(), pagination.getBackoffMultiplier(), pagination.getBackoffMaxMs());
        PaginationResult<Vote> result = paginator.paginate(
            "votes " + proposalId,
            (cursor, limit) -> api.votesPage(proposalId, cursor, limit),
            Vote::identity,
            policy,
            resume,
            (items, cursor) -> {
                // votes before cursor: a crash in between re-fetches one page instead of losing it
                store.save(CheckpointUpdate.votes(proposalId, items, false));
                store.saveVoteCursor(proposalId, cursor);
            }
        );

        if (result.outcome() == PaginationOutcome.INTERRUPTED) {
            throw new ExtractionAbortedException("interrupted while fetching votes for proposal " + proposalId);
        }
        if (result.isComplete()) {
            store.save(CheckpointUpdate.votes(proposalId, result.items(), true));
            store.clearVoteCursor(proposalId);
            Integer expected = proposal.expectedVoterCount();
            if (expected != null && result.items().size() < expected) {
                log.info("Proposal {}: {} votes fetched, {} reported", proposalId, result.items().size(), expected);
            }
            return ProposalVotes.complete(proposalId, result.items());
        }
        CollectionResult<Vote> partial = CollectionResult.from(result);
        return new ProposalVotes(proposalId, result.items(), false, partial.failureReason());
    }
}
