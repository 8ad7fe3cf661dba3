package com.govmatrix.extract.service;

import com.govmatrix.config.ExtractorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class ExtractionCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ExtractionCliRunner.class);

    private final ExtractorProperties properties;
    private final ExtractionOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public ExtractionCliRunner(
        ExtractorProperties properties,
        ExtractionOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        ExtractorProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        ExtractionRequest request = new ExtractionRequest(
            cli.getSlug(),
            cli.getName(),
            cli.getAliases(),
            cli.getGovernorId(),
            cli.isForceRefreshVotes(),
            cli.isAllowPartial()
        );
        ExtractionRunSummary summary = orchestratorService.run(request);
        log.info(
            "Extraction {} finished with status {}: delegates={}, proposals={}, records={}, incompleteProposals={}, files={}",
            summary.slug(),
            summary.status(),
            summary.delegatesCollected(),
            summary.proposalsCollected(),
            summary.matrixRecords(),
            summary.incompleteProposalIds().size(),
            summary.files().values()
        );
        log.info(
            "Client stats: requests={}, succeeded={}, failed={}, rateLimited={}, delayMs={}",
            summary.clientStats().totalRequests(),
            summary.clientStats().successfulRequests(),
            summary.clientStats().failedRequests(),
            summary.clientStats().rateLimitedRequests(),
            summary.clientStats().currentDelayMs()
        );

        if (cli.isExitAfterRun()) {
            int code = exitCode(summary.status());
            int exitCode = SpringApplication.exit(applicationContext, () -> code);
            System.exit(exitCode);
        }
    }

    static int exitCode(ExtractionStatus status) {
        return switch (status) {
            case COMPLETED, PARTIAL -> 0;
            case NOT_FOUND -> 2;
            case ABORTED, FAILED -> 1;
        };
    }
}
