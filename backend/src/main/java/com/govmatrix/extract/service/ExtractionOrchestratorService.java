package com.govmatrix.extract.service;

import com.govmatrix.config.ExtractorProperties;
import com.govmatrix.extract.checkpoint.CheckpointState;
import com.govmatrix.extract.checkpoint.CheckpointStore;
import com.govmatrix.extract.checkpoint.CheckpointStoreFactory;
import com.govmatrix.extract.checkpoint.CheckpointUpdate;
import com.govmatrix.extract.export.ExportContext;
import com.govmatrix.extract.export.ExportResult;
import com.govmatrix.extract.export.MatrixExporter;
import com.govmatrix.extract.http.RateLimitedGraphQlClient;
import com.govmatrix.extract.matrix.VotingMatrixBuilder;
import com.govmatrix.extract.model.Delegate;
import com.govmatrix.extract.model.Organization;
import com.govmatrix.extract.model.Proposal;
import com.govmatrix.extract.model.VotingMatrix;
import com.govmatrix.extract.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class ExtractionOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ExtractionOrchestratorService.class);

    private final OrganizationLookupService lookupService;
    private final DelegateCollectionService delegateService;
    private final ProposalCollectionService proposalService;
    private final VoteCollectionService voteService;
    private final VotingMatrixBuilder matrixBuilder;
    private final MatrixExporter exporter;
    private final CheckpointStoreFactory checkpointStoreFactory;
    private final RateLimitedGraphQlClient client;
    private final ExtractorProperties properties;
    private final ExecutorService extractionRunExecutor;
    private final Ticker ticker;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicReference<String> activeSlug = new AtomicReference<>();
    private final AtomicReference<ExtractionRunSummary> latest = new AtomicReference<>();

    public ExtractionOrchestratorService(
        OrganizationLookupService lookupService,
        DelegateCollectionService delegateService,
        ProposalCollectionService proposalService,
        VoteCollectionService voteService,
        VotingMatrixBuilder matrixBuilder,
        MatrixExporter exporter,
        CheckpointStoreFactory checkpointStoreFactory,
        RateLimitedGraphQlClient client,
        ExtractorProperties properties,
        @Qualifier("extractionRunExecutor") ExecutorService extractionRunExecutor,
        Ticker ticker
    ) {
        this.lookupService = lookupService;
        this.delegateService = delegateService;
        this.proposalService = proposalService;
        this.voteService = voteService;
        this.matrixBuilder = matrixBuilder;
        this.exporter = exporter;
        this.checkpointStoreFactory = checkpointStoreFactory;
        this.client = client;
        this.properties = properties;
        this.extractionRunExecutor = extractionRunExecutor;
        this.ticker = ticker;
    }

    public ExtractionRunSummary run(ExtractionRequest request) {
        String slug = validate(request);
        acquire(slug);
        try {
            return execute(request, slug);
        } finally {
            release();
        }
    }

    public String startAsync(ExtractionRequest request) {
        String slug = validate(request);
        acquire(slug);
        try {
            extractionRunExecutor.submit(() -> {
                try {
                    execute(request, slug);
                } finally {
                    release();
                }
            });
        } catch (RejectedExecutionException e) {
            release();
            throw e;
        }
        return slug;
    }

    public Optional<ExtractionRunSummary> latestSummary() {
        return Optional.ofNullable(latest.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    private ExtractionRunSummary execute(ExtractionRequest request, String slug) {
        Instant startedAt = now();
        CheckpointStore store = checkpointStoreFactory.forOrganization(slug);
        Organization organization = null;
        List<Delegate> delegates = List.of();
        List<Proposal> proposals = List.of();
        VotingMatrix matrix = null;
        Map<String, String> files = new LinkedHashMap<>();
        ExtractionStatus status;
        String message;

        try {
            Optional<Organization> found = lookupService.resolve(slug, request.normalizedAliases());
            if (found.isEmpty()) {
                log.warn("Organization {} not found (aliases {})", slug, request.normalizedAliases());
                return finish(new ExtractionRunSummary(slug, null, request.name(), ExtractionStatus.NOT_FOUND, startedAt, now(),
                    0, 0, 0, List.of(), files, "organization not found", client.stats()));
            }
            organization = found.get();
            prepareCheckpoint(store, organization);

            CollectionResult<Delegate> delegateResult = delegateService.collect(organization, store);
            delegates = delegateResult.items();
            requireComplete("delegates", delegateResult, request);
            if (delegates.isEmpty()) {
                throw new ExtractionAbortedException("no delegates found for " + organization.id());
            }
            log.info("Delegates: {} ({})", delegates.size(), delegateResult.fromCache() ? "cached" : delegateResult.pagesFetched() + " pages");

            CollectionResult<Proposal> proposalResult = proposalService.collect(organization, request.normalizedGovernorId(), store);
            proposals = proposalResult.items();
            requireComplete("proposals", proposalResult, request);
            log.info("Proposals: {} ({})", proposals.size(), proposalResult.fromCache() ? "cached" : proposalResult.pagesFetched() + " pages");

            matrix = matrixBuilder.build(proposals, delegates, voteService.sourceFor(store, request.isForceRefreshVotes()));
            checkInterrupted();

            ExportResult export = exporter.export(
                new ExportContext(
                    slug,
                    displayName(request, organization),
                    startedAt,
                    client.stats(),
                    properties.getPagination().getVoteBatchSize(),
                    properties.getPagination().getVoteMaxPages(),
                    organization
                ),
                matrix
            );
            export.files().forEach((kind, path) -> files.put(kind, path.toString()));

            boolean partial = !delegateResult.complete()
                || !proposalResult.complete()
                || !matrix.statistics().incompleteProposalIds().isEmpty()
                || export.hasErrors();
            status = partial ? ExtractionStatus.PARTIAL : ExtractionStatus.COMPLETED;
            message = partial ? partialMessage(delegateResult, proposalResult, matrix, export) : "ok";
            if (status == ExtractionStatus.COMPLETED && properties.getCheckpoint().isClearOnSuccess()) {
                store.clear();
            }
            if (partial) {
                log.warn("Extraction {} finished with partial data: {}", slug, message);
            } else {
                log.info("Extraction {} completed: {} records", slug, matrix.statistics().totalRecords());
            }
        } catch (ExtractionAbortedException e) {
            log.error("Extraction {} aborted: {}", slug, e.getMessage());
            status = ExtractionStatus.ABORTED;
            message = e.getMessage();
            emergencyExport(slug, store, delegates, proposals, files);
        } catch (RuntimeException e) {
            log.error("Extraction {} failed", slug, e);
            status = ExtractionStatus.FAILED;
            message = "exception=" + e.getClass().getSimpleName() + ": " + e.getMessage();
            emergencyExport(slug, store, delegates, proposals, files);
        }

        return finish(new ExtractionRunSummary(
            slug,
            organization == null ? null : organization.id(),
            organization == null ? request.name() : displayName(request, organization),
            status,
            startedAt,
            now(),
            delegates.size(),
            proposals.size(),
            matrix == null ? 0 : matrix.records().size(),
            matrix == null ? List.of() : matrix.statistics().incompleteProposalIds(),
            files,
            message,
            client.stats()
        ));
    }

    private void prepareCheckpoint(CheckpointStore store, Organization organization) {
        CheckpointState state = store.load();
        if (state.organizationId() != null && !state.organizationId().equals(organization.id())) {
            log.warn("Checkpoint belongs to organization {}, not {}; discarding it", state.organizationId(), organization.id());
            store.clear();
        }
        store.save(CheckpointUpdate.organization(organization.id()));
    }

    private void requireComplete(String kind, CollectionResult<?> result, ExtractionRequest request) {
        checkInterrupted();
        if (result.complete()) {
            return;
        }
        if (!request.isAllowPartial()) {
            throw new ExtractionAbortedException(kind + " incomplete after " + result.items().size() + " items: " + result.failureReason());
        }
        log.warn("Continuing with {} partial {}: {}", result.items().size(), kind, result.failureReason());
    }

    private void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ExtractionAbortedException("extraction interrupted");
        }
    }

    private void emergencyExport(
        String slug,
        CheckpointStore store,
        List<Delegate> delegates,
        List<Proposal> proposals,
        Map<String, String> files
    ) {
        List<Delegate> delegateSnapshot = delegates;
        List<Proposal> proposalSnapshot = proposals;
        if (delegateSnapshot.isEmpty() || proposalSnapshot.isEmpty()) {
            CheckpointState state = store.current();
            delegateSnapshot = delegateSnapshot.isEmpty() ? state.delegates() : delegateSnapshot;
            proposalSnapshot = proposalSnapshot.isEmpty() ? state.proposals() : proposalSnapshot;
        }
        ExportResult result = exporter.emergencyExport(slug, delegateSnapshot, proposalSnapshot);
        for (Map.Entry<String, Path> entry : result.files().entrySet()) {
            files.put(entry.getKey(), entry.getValue().toString());
        }
    }

    private String partialMessage(
        CollectionResult<Delegate> delegates,
        CollectionResult<Proposal> proposals,
        VotingMatrix matrix,
        ExportResult export
    ) {
        StringBuilder message = new StringBuilder();
        if (!delegates.complete()) {
            message.append("delegates: ").append(delegates.failureReason()).append("; ");
        }
        if (!proposals.complete()) {
            message.append("proposals: ").append(proposals.failureReason()).append("; ");
        }
        if (!matrix.statistics().incompleteProposalIds().isEmpty()) {
            message.append("incomplete votes for ").append(matrix.statistics().incompleteProposalIds().size()).append(" proposals; ");
        }
        if (export.hasErrors()) {
            message.append("export errors: ").append(export.errors()).append("; ");
        }
        return message.toString().trim();
    }

    private String displayName(ExtractionRequest request, Organization organization) {
        if (request.name() != null && !request.name().isBlank()) {
            return request.name();
        }
        return organization.name();
    }

    private ExtractionRunSummary finish(ExtractionRunSummary summary) {
        latest.set(summary);
        return summary;
    }

    private String validate(ExtractionRequest request) {
        if (request == null || request.normalizedSlug().isEmpty()) {
            throw new IllegalArgumentException("slug is required");
        }
        return request.normalizedSlug();
    }

    private void acquire(String slug) {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveExtractionRunException("Active extraction run in progress (slug=" + activeSlug.get() + ")");
        }
        activeSlug.set(slug);
    }

    private void release() {
        activeSlug.set(null);
        running.set(false);
    }

    private Instant now() {
        return Instant.ofEpochMilli(ticker.nowMillis());
    }
}
