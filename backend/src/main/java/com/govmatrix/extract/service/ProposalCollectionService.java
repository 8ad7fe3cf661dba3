package com.govmatrix.extract.service;

import com.govmatrix.config.ExtractorProperties;
import com.govmatrix.extract.checkpoint.CheckpointState;
import com.govmatrix.extract.checkpoint.CheckpointStore;
import com.govmatrix.extract.checkpoint.CheckpointUpdate;
import com.govmatrix.extract.graphql.GovernanceGraphQlApi;
import com.govmatrix.extract.model.Organization;
import com.govmatrix.extract.model.Proposal;
import com.govmatrix.extract.pagination.CursorPaginator;
import com.govmatrix.extract.pagination.PaginationPolicy;
import com.govmatrix.extract.pagination.PaginationResult;
import com.govmatrix.extract.pagination.ResumePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ProposalCollectionService {
    private static final Logger log = LoggerFactory.getLogger(ProposalCollectionService.class);

    private final GovernanceGraphQlApi api;
    private final CursorPaginator paginator;
    private final ExtractorProperties properties;

    public ProposalCollectionService(GovernanceGraphQlApi api, CursorPaginator paginator, ExtractorProperties properties) {
        this.api = api;
        this.paginator = paginator;
        this.properties = properties;
    }

    public CollectionResult<Proposal> collect(Organization organization, String governorId, CheckpointStore store) {
        CheckpointState state = store.current();
        int required = requiredCachedCount(organization, governorId);
        if (state.proposalsComplete() && state.proposals().size() >= required) {
            log.info("Using {} cached proposals for {}", state.proposals().size(), organization.id());
            return CollectionResult.cached(state.proposals());
        }
        if (!state.proposals().isEmpty()) {
            log.info(
                "Cached proposals for {} not reusable ({} cached, complete={}, need {}); refetching",
                organization.id(),
                state.proposals().size(),
                state.proposalsComplete(),
                required
            );
        }

        ExtractorProperties.Pagination pagination = properties.getPagination();
        PaginationPolicy policy = PaginationPolicy.of(pagination.getProposalBatchSize(), pagination.getEntityMaxConsecutiveFailures())
            .withMaxPages(pagination.getProposalMaxPages())
            .withBackoff(pagination.getBackoffInitialMs(), pagination.getBackoffMultiplier(), pagination.getBackoffMaxMs());
        PaginationResult<Proposal> result = paginator.paginate(
            "proposals",
            (cursor, limit) -> api.proposalsPage(organization.id(), governorId, cursor, limit),
            Proposal::id,
            policy,
            ResumePoint.fresh(),
            (items, cursor) -> store.save(CheckpointUpdate.proposals(items, false))
        );

        store.save(CheckpointUpdate.proposals(result.items(), result.isComplete()));
        return CollectionResult.from(result);
    }

    private int requiredCachedCount(Organization organization, String governorId) {
        int minimum = properties.getCheckpoint().getMinCachedProposals();
        // The declared count spans every governor, so it cannot bound a governor-filtered list.
        if (governorId != null || organization.proposalsCount() == null) {
            return minimum;
        }
        return Math.max(minimum, organization.proposalsCount());
    }
}
