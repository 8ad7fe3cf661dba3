package com.govmatrix.extract.api;

import com.govmatrix.extract.http.ClientStats;
import com.govmatrix.extract.http.RateLimitedGraphQlClient;
import com.govmatrix.extract.service.ExtractionOrchestratorService;
import com.govmatrix.extract.service.ExtractionRequest;
import com.govmatrix.extract.service.ExtractionRunSummary;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class ExtractionController {
    private final ExtractionOrchestratorService orchestratorService;
    private final RateLimitedGraphQlClient client;

    public ExtractionController(ExtractionOrchestratorService orchestratorService, RateLimitedGraphQlClient client) {
        this.orchestratorService = orchestratorService;
        this.client = client;
    }

    @PostMapping("/extractions")
    public ResponseEntity<Map<String, String>> startExtraction(@RequestBody ExtractionRequest request) {
        String slug = orchestratorService.startAsync(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(Map.of("slug", slug, "status", "ACCEPTED"));
    }

    @GetMapping("/extractions/latest")
    public ResponseEntity<ExtractionRunSummary> latestExtraction() {
        return orchestratorService.latestSummary()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/client/stats")
    public ClientStats clientStats() {
        return client.stats();
    }
}
