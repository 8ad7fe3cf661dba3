package com.govmatrix.extract.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.govmatrix.config.ExtractorProperties;
import com.govmatrix.extract.model.Delegate;
import com.govmatrix.extract.model.DelegateAggregate;
import com.govmatrix.extract.model.MatrixStatistics;
import com.govmatrix.extract.model.Organization;
import com.govmatrix.extract.model.Proposal;
import com.govmatrix.extract.model.ProposalAggregate;
import com.govmatrix.extract.model.VoteStat;
import com.govmatrix.extract.model.VoteOutcome;
import com.govmatrix.extract.model.VotingMatrix;
import com.govmatrix.extract.model.VotingMatrixRecord;
import com.govmatrix.extract.util.AddressUtils;
import com.govmatrix.extract.util.Ticker;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class CsvMatrixExporter implements MatrixExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvMatrixExporter.class);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.ROOT);
    private static final List<VoteOutcome> TALLIED = List.of(
        VoteOutcome.FOR,
        VoteOutcome.AGAINST,
        VoteOutcome.ABSTAIN,
        VoteOutcome.VOTED,
        VoteOutcome.UNKNOWN
    );

    private static final List<String> STAT_TYPES = List.of("for", "against", "abstain");

    private static final String[] MATRIX_HEADER = {
        "delegate_address", "delegate_name", "delegate_ens", "delegate_votes_count", "delegate_delegators_count",
        "has_statement", "seeking_delegation", "is_active_delegate", "proposal_id", "proposal_onchain_id",
        "proposal_title", "proposal_status", "proposal_start_timestamp", "proposal_end_timestamp",
        "proposal_start_block", "proposal_end_block", "dao_name", "vote", "voting_amount", "vote_type_raw",
        "vote_reason", "vote_timestamp", "vote_block_number", "vote_tx_hash", "participated"
    };

    private final ExtractorProperties properties;
    private final ObjectMapper objectMapper;
    private final Ticker ticker;

    public CsvMatrixExporter(ExtractorProperties properties, ObjectMapper objectMapper, Ticker ticker) {
        this.properties = properties;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.ticker = ticker;
    }

    @Override
    public ExportResult export(ExportContext context, VotingMatrix matrix) {
        String prefix = AddressUtils.slugForFiles(context.slug());
        String timestamp = fileTimestamp();
        Map<String, Path> files = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        Path directory = outputDirectory();

        writeSafely("voting_matrix", directory.resolve(prefix + "_voting_matrix_" + timestamp + ".csv"), files, errors,
            path -> writeMatrix(path, context, matrix));
        writeSafely("delegate_summary", directory.resolve(prefix + "_delegate_summary_" + timestamp + ".csv"), files, errors,
            path -> writeDelegateSummary(path, matrix.delegateAggregates()));
        writeSafely("proposal_analysis", directory.resolve(prefix + "_proposal_analysis_" + timestamp + ".csv"), files, errors,
            path -> writeProposalAnalysis(path, matrix.proposalAggregates()));
        writeSafely("proposal_details", directory.resolve(prefix + "_proposal_details_" + timestamp + ".csv"), files, errors,
            path -> writeProposalDetails(path, matrix.proposalAggregates()));
        List<Map<String, Object>> statements = statements(context, matrix.delegateAggregates());
        if (!statements.isEmpty()) {
            writeSafely("delegate_statements", directory.resolve(prefix + "_delegate_statements_" + timestamp + ".json"), files, errors,
                path -> objectMapper.writeValue(path.toFile(), statements));
        }
        if (context.organization() != null) {
            writeSafely("organization_info", directory.resolve(prefix + "_organization_info_" + timestamp + ".csv"), files, errors,
                path -> writeOrganizationInfo(path, context.organization(), timestamp));
        }
        writeSafely("performance_report", directory.resolve(prefix + "_performance_report_" + timestamp + ".json"), files, errors,
            path -> objectMapper.writeValue(path.toFile(), performanceReport(context, matrix.statistics(), timestamp)));

        log.info("Exported {} files for {} to {}", files.size(), context.slug(), directory);
        return new ExportResult(files, errors);
    }

    @Override
    public ExportResult emergencyExport(String slug, List<Delegate> delegates, List<Proposal> proposals) {
        String prefix = AddressUtils.slugForFiles(slug);
        String timestamp = fileTimestamp();
        Map<String, Path> files = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        Path directory = outputDirectory();
        if (delegates != null && !delegates.isEmpty()) {
            writeSafely("emergency_delegates", directory.resolve(prefix + "_emergency_delegates_" + timestamp + ".csv"), files, errors,
                path -> writeDelegates(path, delegates));
        }
        if (proposals != null && !proposals.isEmpty()) {
            writeSafely("emergency_proposals", directory.resolve(prefix + "_emergency_proposals_" + timestamp + ".csv"), files, errors,
                path -> writeProposals(path, proposals));
        }
        if (!files.isEmpty()) {
            log.warn("Emergency export for {} wrote {}", slug, files.values());
        }
        return new ExportResult(files, errors);
    }

    private void writeMatrix(Path path, ExportContext context, VotingMatrix matrix) throws IOException {
        try (CSVPrinter printer = printer(path, MATRIX_HEADER)) {
            for (VotingMatrixRecord record : matrix.records()) {
                Delegate delegate = record.delegate();
                Proposal proposal = record.proposal();
                printer.printRecord(
                    delegate.address(),
                    delegate.displayName(),
                    nullToEmpty(delegate.ens()),
                    delegate.votingPower(),
                    delegate.delegatorsCount(),
                    delegate.hasStatement(),
                    delegate.seekingDelegation(),
                    delegate.hasVotingPower(),
                    proposal.id(),
                    nullToEmpty(proposal.onchainId()),
                    proposal.displayTitle(),
                    proposal.status().name().toLowerCase(Locale.ROOT),
                    nullToEmpty(proposal.start().timestamp()),
                    nullToEmpty(proposal.end().timestamp()),
                    proposal.start().number() == null ? "" : proposal.start().number(),
                    proposal.end().number() == null ? "" : proposal.end().number(),
                    nullToEmpty(context.organizationName()),
                    record.vote().label(),
                    record.votingAmount(),
                    record.rawVoteType(),
                    record.voteReason(),
                    record.voteTimestamp(),
                    record.voteBlockNumber() == null ? "" : record.voteBlockNumber(),
                    record.voteTxHash(),
                    record.participated()
                );
            }
        }
    }

    private void writeDelegateSummary(Path path, List<DelegateAggregate> aggregates) throws IOException {
        List<String> header = new ArrayList<>(List.of(
            "delegate_address", "delegate_name", "delegate_ens", "votes_cast", "total_proposals", "delegate_power",
            "delegators_count", "has_statement", "seeking_delegation", "is_active_delegate", "participation_rate"
        ));
        TALLIED.forEach(outcome -> header.add(tallyColumn(outcome)));
        try (CSVPrinter printer = printer(path, header.toArray(String[]::new))) {
            for (DelegateAggregate aggregate : aggregates) {
                Delegate delegate = aggregate.delegate();
                List<Object> row = new ArrayList<>(List.of(
                    delegate.address(),
                    delegate.displayName(),
                    nullToEmpty(delegate.ens()),
                    aggregate.votesCast(),
                    aggregate.totalProposals(),
                    delegate.votingPower(),
                    delegate.delegatorsCount(),
                    delegate.hasStatement(),
                    delegate.seekingDelegation(),
                    delegate.hasVotingPower(),
                    twoDecimals(aggregate.participationRate())
                ));
                TALLIED.forEach(outcome -> row.add(aggregate.tally(outcome)));
                printer.printRecord(row);
            }
        }
    }

    private void writeProposalAnalysis(Path path, List<ProposalAggregate> aggregates) throws IOException {
        List<String> header = new ArrayList<>(List.of(
            "proposal_id", "proposal_title", "proposal_status", "actual_votes", "total_delegates", "votes_fetched",
            "expected_voters", "votes_complete", "start_time", "end_time", "participation_rate"
        ));
        TALLIED.forEach(outcome -> header.add(tallyColumn(outcome)));
        try (CSVPrinter printer = printer(path, header.toArray(String[]::new))) {
            for (ProposalAggregate aggregate : aggregates) {
                Proposal proposal = aggregate.proposal();
                List<Object> row = new ArrayList<>(List.of(
                    proposal.id(),
                    proposal.displayTitle(),
                    proposal.status().name().toLowerCase(Locale.ROOT),
                    aggregate.uniqueVoters(),
                    aggregate.eligibleDelegates(),
                    aggregate.votesFetched(),
                    aggregate.expectedVoters() == null ? "" : aggregate.expectedVoters(),
                    aggregate.votesComplete(),
                    nullToEmpty(proposal.start().timestamp()),
                    nullToEmpty(proposal.end().timestamp()),
                    twoDecimals(aggregate.participationRate())
                ));
                TALLIED.forEach(outcome -> row.add(aggregate.tally(outcome)));
                printer.printRecord(row);
            }
        }
    }

    private void writeProposalDetails(Path path, List<ProposalAggregate> aggregates) throws IOException {
        List<String> header = new ArrayList<>(List.of(
            "proposal_id", "onchain_id", "title", "description", "status", "proposer_address",
            "start_timestamp", "start_block", "end_timestamp", "end_block", "quorum"
        ));
        for (String type : STAT_TYPES) {
            header.add(type + "_votes_count");
            header.add(type + "_voters_count");
            header.add(type + "_percent");
        }
        try (CSVPrinter printer = printer(path, header.toArray(String[]::new))) {
            for (ProposalAggregate aggregate : aggregates) {
                Proposal proposal = aggregate.proposal();
                List<Object> row = new ArrayList<>(List.of(
                    proposal.id(),
                    nullToEmpty(proposal.onchainId()),
                    proposal.displayTitle(),
                    nullToEmpty(proposal.description()),
                    proposal.status().name().toLowerCase(Locale.ROOT),
                    nullToEmpty(proposal.proposerAddress()),
                    nullToEmpty(proposal.start().timestamp()),
                    proposal.start().number() == null ? "" : proposal.start().number(),
                    nullToEmpty(proposal.end().timestamp()),
                    proposal.end().number() == null ? "" : proposal.end().number(),
                    nullToEmpty(proposal.quorum())
                ));
                for (String type : STAT_TYPES) {
                    VoteStat stat = statFor(proposal, type);
                    row.add(stat == null ? "" : nullToEmpty(stat.votesCount()));
                    row.add(stat == null ? "" : stat.votersCount());
                    row.add(stat == null ? "" : twoDecimals(stat.percent()));
                }
                printer.printRecord(row);
            }
        }
    }

    private List<Map<String, Object>> statements(ExportContext context, List<DelegateAggregate> aggregates) {
        String organizationId = context.organization() == null ? null : context.organization().id();
        List<Map<String, Object>> statements = new ArrayList<>();
        for (DelegateAggregate aggregate : aggregates) {
            Delegate delegate = aggregate.delegate();
            boolean hasSummary = delegate.statementSummary() != null && !delegate.statementSummary().isBlank();
            if (!delegate.hasStatement() && !hasSummary) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("address", delegate.address());
            entry.put("name", delegate.name());
            entry.put("ens", delegate.ens());
            entry.put("organization_id", organizationId);
            entry.put("statement", delegate.statement());
            entry.put("statement_summary", delegate.statementSummary());
            entry.put("is_seeking_delegation", delegate.seekingDelegation());
            statements.add(entry);
        }
        return statements;
    }

    private void writeOrganizationInfo(Path path, Organization organization, String timestamp) throws IOException {
        try (CSVPrinter printer = printer(path, "organization_id", "slug", "name", "governor_ids", "chain_ids",
            "proposals_count", "delegates_count", "delegates_votes_count", "token_owners_count",
            "has_active_proposals", "analysis_timestamp")) {
            printer.printRecord(
                organization.id(),
                nullToEmpty(organization.slug()),
                nullToEmpty(organization.name()),
                String.join(";", organization.governorIds()),
                String.join(";", organization.chainIds()),
                organization.proposalsCount() == null ? "" : organization.proposalsCount(),
                organization.delegatesCount() == null ? "" : organization.delegatesCount(),
                nullToEmpty(organization.delegatesVotesCount()),
                organization.tokenOwnersCount() == null ? "" : organization.tokenOwnersCount(),
                organization.hasActiveProposals(),
                timestamp
            );
        }
    }

    private void writeDelegates(Path path, List<Delegate> delegates) throws IOException {
        try (CSVPrinter printer = printer(path, "address", "name", "ens", "votes_count", "delegators_count",
            "has_statement", "seeking_delegation")) {
            for (Delegate delegate : delegates) {
                printer.printRecord(
                    delegate.address(),
                    nullToEmpty(delegate.name()),
                    nullToEmpty(delegate.ens()),
                    delegate.votingPower(),
                    delegate.delegatorsCount(),
                    delegate.hasStatement(),
                    delegate.seekingDelegation()
                );
            }
        }
    }

    private void writeProposals(Path path, List<Proposal> proposals) throws IOException {
        try (CSVPrinter printer = printer(path, "id", "onchain_id", "title", "status", "proposer",
            "start_timestamp", "end_timestamp", "quorum")) {
            for (Proposal proposal : proposals) {
                printer.printRecord(
                    proposal.id(),
                    nullToEmpty(proposal.onchainId()),
                    proposal.displayTitle(),
                    proposal.status().name().toLowerCase(Locale.ROOT),
                    nullToEmpty(proposal.proposerAddress()),
                    nullToEmpty(proposal.start().timestamp()),
                    nullToEmpty(proposal.end().timestamp()),
                    nullToEmpty(proposal.quorum())
                );
            }
        }
    }

    private Map<String, Object> performanceReport(ExportContext context, MatrixStatistics statistics, String timestamp) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("dao_name", context.organizationName());
        metadata.put("dao_slug", context.slug());
        metadata.put("analysis_timestamp", timestamp);
        metadata.put("started_at", context.startedAt() == null ? null : context.startedAt().toString());
        if (context.startedAt() != null) {
            Duration elapsed = Duration.between(context.startedAt(), Instant.ofEpochMilli(ticker.nowMillis()));
            metadata.put("session_time_seconds", Math.max(0, elapsed.toSeconds()));
        }
        metadata.put("vote_batch_size", context.voteBatchSize());
        metadata.put("max_vote_pages", context.voteMaxPages());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("total_records", statistics.totalRecords());
        data.put("unique_delegates", statistics.uniqueDelegates());
        data.put("unique_proposals", statistics.uniqueProposals());
        data.put("total_votes_extracted", statistics.totalVotesFetched());
        data.put("unique_voters", statistics.uniqueVoters());
        data.put("proposals_with_votes", statistics.proposalsWithVotes());
        data.put("overall_participation_rate", round2(statistics.overallParticipationRate()));
        data.put("active_delegates_count", statistics.activeDelegates());
        data.put("incomplete_proposals", statistics.incompleteProposalIds());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("extraction_metadata", metadata);
        report.put("data_statistics", data);
        if (context.clientStats() != null) {
            Map<String, Object> client = new LinkedHashMap<>();
            client.put("total_requests", context.clientStats().totalRequests());
            client.put("successful_requests", context.clientStats().successfulRequests());
            client.put("failed_requests", context.clientStats().failedRequests());
            client.put("rate_limited_requests", context.clientStats().rateLimitedRequests());
            client.put("success_rate", round2(context.clientStats().successRate()));
            client.put("current_delay_ms", context.clientStats().currentDelayMs());
            report.put("client_stats", client);
        }
        return report;
    }

    private CSVPrinter printer(Path path, String... header) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(header)
            .setRecordSeparator("\n")
            .build();
        return new CSVPrinter(writer, format);
    }

    private void writeSafely(String kind, Path path, Map<String, Path> files, List<String> errors, FileWriterAction action) {
        try {
            action.write(path);
            files.put(kind, path);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write {} to {}: {}", kind, path, e.getMessage());
            errors.add(kind + ": " + e.getMessage());
        }
    }

    private Path outputDirectory() {
        return Path.of(properties.getOutput().getDirectory());
    }

    private String fileTimestamp() {
        return FILE_TIMESTAMP.format(Instant.ofEpochMilli(ticker.nowMillis()).atZone(ZoneId.systemDefault()));
    }

    private static VoteStat statFor(Proposal proposal, String type) {
        for (VoteStat stat : proposal.voteStats()) {
            if (stat.type() != null && stat.type().equalsIgnoreCase(type)) {
                return stat;
            }
        }
        return null;
    }

    private static String tallyColumn(VoteOutcome outcome) {
        return "votes_" + outcome.label().toLowerCase(Locale.ROOT);
    }

    static String twoDecimals(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @FunctionalInterface
    private interface FileWriterAction {
        void write(Path path) throws IOException;
    }
}
