package com.govmatrix.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "extractor")
public class ExtractorProperties {
    private static final String DEFAULT_USER_AGENT = "gov-matrix/0.1 (+contact)";
    private static final String DEFAULT_ENDPOINT = "https://api.tally.xyz/query";

    private Api api = new Api();
    private RateLimit rateLimit = new RateLimit();
    private Pagination pagination = new Pagination();
    private Checkpoint checkpoint = new Checkpoint();
    private AliasLookup aliasLookup = new AliasLookup();
    private Output output = new Output();
    private Cli cli = new Cli();

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(Checkpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    public AliasLookup getAliasLookup() {
        return aliasLookup;
    }

    public void setAliasLookup(AliasLookup aliasLookup) {
        this.aliasLookup = aliasLookup;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Api {
        private String endpoint = DEFAULT_ENDPOINT;
        private String key = "";
        private String userAgent;
        private int requestTimeoutSeconds = 30;

        public String getEndpoint() {
            return endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getKey() {
            return key == null ? "" : key.trim();
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class RateLimit {
        private long minDelayMs = 600;
        private long maxDelayMs = 2000;
        private double relaxFactor = 0.98;
        private double tightenFactor = 1.5;
        private int maxAttempts = 3;
        private long retryBaseDelayMs = 2000;
        private long retryMaxDelayMs = 5000;

        public long getMinDelayMs() {
            return Math.max(0, minDelayMs);
        }

        public void setMinDelayMs(long minDelayMs) {
            this.minDelayMs = Math.max(0, minDelayMs);
        }

        public long getMaxDelayMs() {
            return Math.max(getMinDelayMs(), maxDelayMs);
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getRelaxFactor() {
            return relaxFactor <= 0 || relaxFactor > 1 ? 1.0 : relaxFactor;
        }

        public void setRelaxFactor(double relaxFactor) {
            this.relaxFactor = relaxFactor;
        }

        public double getTightenFactor() {
            return Math.max(1.0, tightenFactor);
        }

        public void setTightenFactor(double tightenFactor) {
            this.tightenFactor = tightenFactor;
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public long getRetryMaxDelayMs() {
            return Math.max(getRetryBaseDelayMs(), retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(long retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
        }
    }

    public static class Pagination {
        private int delegateBatchSize = 200;
        private int proposalBatchSize = 100;
        private int voteBatchSize = 5000;
        private int entityMaxConsecutiveFailures = 15;
        private int voteMaxConsecutiveFailures = 50;
        private int proposalMaxPages = 100;
        private int voteMaxPages = 100_000;
        private long backoffInitialMs = 2000;
        private double backoffMultiplier = 1.7;
        private long backoffMaxMs = 5000;
        private int voteBatchShrinkEvery = 5;
        private int minVoteBatchSize = 100;

        public int getDelegateBatchSize() {
            return Math.max(1, delegateBatchSize);
        }

        public void setDelegateBatchSize(int delegateBatchSize) {
            this.delegateBatchSize = Math.max(1, delegateBatchSize);
        }

        public int getProposalBatchSize() {
            return Math.max(1, proposalBatchSize);
        }

        public void setProposalBatchSize(int proposalBatchSize) {
            this.proposalBatchSize = Math.max(1, proposalBatchSize);
        }

        public int getVoteBatchSize() {
            return Math.max(1, voteBatchSize);
        }

        public void setVoteBatchSize(int voteBatchSize) {
            this.voteBatchSize = Math.max(1, voteBatchSize);
        }

        public int getEntityMaxConsecutiveFailures() {
            return Math.max(1, entityMaxConsecutiveFailures);
        }

        public void setEntityMaxConsecutiveFailures(int entityMaxConsecutiveFailures) {
            this.entityMaxConsecutiveFailures = Math.max(1, entityMaxConsecutiveFailures);
        }

        public int getVoteMaxConsecutiveFailures() {
            return Math.max(1, voteMaxConsecutiveFailures);
        }

        public void setVoteMaxConsecutiveFailures(int voteMaxConsecutiveFailures) {
            this.voteMaxConsecutiveFailures = Math.max(1, voteMaxConsecutiveFailures);
        }

        public int getProposalMaxPages() {
            return Math.max(1, proposalMaxPages);
        }

        public void setProposalMaxPages(int proposalMaxPages) {
            this.proposalMaxPages = Math.max(1, proposalMaxPages);
        }

        public int getVoteMaxPages() {
            return Math.max(1, voteMaxPages);
        }

        public void setVoteMaxPages(int voteMaxPages) {
            this.voteMaxPages = Math.max(1, voteMaxPages);
        }

        public long getBackoffInitialMs() {
            return Math.max(0, backoffInitialMs);
        }

        public void setBackoffInitialMs(long backoffInitialMs) {
            this.backoffInitialMs = Math.max(0, backoffInitialMs);
        }

        public double getBackoffMultiplier() {
            return Math.max(1.0, backoffMultiplier);
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public long getBackoffMaxMs() {
            return Math.max(getBackoffInitialMs(), backoffMaxMs);
        }

        public void setBackoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
        }

        public int getVoteBatchShrinkEvery() {
            return Math.max(0, voteBatchShrinkEvery);
        }

        public void setVoteBatchShrinkEvery(int voteBatchShrinkEvery) {
            this.voteBatchShrinkEvery = Math.max(0, voteBatchShrinkEvery);
        }

        public int getMinVoteBatchSize() {
            return Math.max(1, minVoteBatchSize);
        }

        public void setMinVoteBatchSize(int minVoteBatchSize) {
            this.minVoteBatchSize = Math.max(1, minVoteBatchSize);
        }
    }

    public static class Checkpoint {
        private String directory = "checkpoints";
        private int minCachedProposals = 1;
        private boolean clearOnSuccess = true;

        public String getDirectory() {
            return directory == null || directory.isBlank() ? "checkpoints" : directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public int getMinCachedProposals() {
            return Math.max(1, minCachedProposals);
        }

        public void setMinCachedProposals(int minCachedProposals) {
            this.minCachedProposals = Math.max(1, minCachedProposals);
        }

        public boolean isClearOnSuccess() {
            return clearOnSuccess;
        }

        public void setClearOnSuccess(boolean clearOnSuccess) {
            this.clearOnSuccess = clearOnSuccess;
        }
    }

    public static class AliasLookup {
        private int concurrency = 3;

        public int getConcurrency() {
            return Math.min(3, Math.max(1, concurrency));
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }

    public static class Output {
        private String directory = "output";

        public String getDirectory() {
            return directory == null || directory.isBlank() ? "output" : directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Cli {
        private boolean run;
        private String slug = "";
        private String name = "";
        private List<String> aliases = new ArrayList<>();
        private String governorId = "";
        private boolean forceRefreshVotes;
        private boolean allowPartial;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSlug() {
            return slug;
        }

        public void setSlug(String slug) {
            this.slug = slug;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getAliases() {
            return aliases;
        }

        public void setAliases(List<String> aliases) {
            this.aliases = aliases == null ? new ArrayList<>() : aliases;
        }

        public String getGovernorId() {
            return governorId;
        }

        public void setGovernorId(String governorId) {
            this.governorId = governorId;
        }

        public boolean isForceRefreshVotes() {
            return forceRefreshVotes;
        }

        public void setForceRefreshVotes(boolean forceRefreshVotes) {
            this.forceRefreshVotes = forceRefreshVotes;
        }

        public boolean isAllowPartial() {
            return allowPartial;
        }

        public void setAllowPartial(boolean allowPartial) {
            this.allowPartial = allowPartial;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
