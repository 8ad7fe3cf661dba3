package com.govmatrix.extract.service;

import com.govmatrix.config.ExtractorProperties;
import com.govmatrix.extract.checkpoint.CheckpointState;
import com.govmatrix.extract.checkpoint.CheckpointStore;
import com.govmatrix.extract.checkpoint.CheckpointUpdate;
import com.govmatrix.extract.graphql.GovernanceGraphQlApi;
import com.govmatrix.extract.model.Delegate;
import com.govmatrix.extract.model.Organization;
import com.govmatrix.extract.pagination.CursorPaginator;
import com.govmatrix.extract.pagination.PaginationPolicy;
import com.govmatrix.extract.pagination.PaginationResult;
import com.govmatrix.extract.pagination.ResumePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DelegateCollectionService {
    private static final Logger log = LoggerFactory.getLogger(DelegateCollectionService.class);

    private final GovernanceGraphQlApi api;
    private final CursorPaginator paginator;
    private final ExtractorProperties properties;

    public DelegateCollectionService(GovernanceGraphQlApi api, CursorPaginator paginator, ExtractorProperties properties) {
        this.api = api;
        this.paginator = paginator;
        this.properties = properties;
    }

    public CollectionResult<Delegate> collect(Organization organization, CheckpointStore store) {
        CheckpointState state = store.current();
        if (state.delegatesComplete() && !state.delegates().isEmpty()) {
            log.info("Using {} cached delegates for {}", state.delegates().size(), organization.id());
            return CollectionResult.cached(state.delegates());
        }

        ExtractorProperties.Pagination pagination = properties.getPagination();
        PaginationPolicy policy = PaginationPolicy.of(pagination.getDelegateBatchSize(), pagination.getEntityMaxConsecutiveFailures())
            .withBackoff(pagination.getBackoffInitialMs(), pagination.getBackoffMultiplier(), pagination.getBackoffMaxMs());
        PaginationResult<Delegate> result = paginator.paginate(
            "delegates",
            (cursor, limit) -> api.delegatesPage(organization.id(), cursor, limit),
            Delegate::address,
            policy,
            new ResumePoint<>(state.delegates(), state.delegateCursor()),
            (items, cursor) -> store.save(CheckpointUpdate.delegatesInProgress(items, cursor))
        );

        if (result.isComplete()) {
            store.save(CheckpointUpdate.delegatesComplete(result.items()));
        }
        return CollectionResult.from(result);
    }
}
