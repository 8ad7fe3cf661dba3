package com.govmatrix.extract.service;

import com.govmatrix.extract.graphql.GovernanceGraphQlApi;
import com.govmatrix.extract.graphql.GovernanceGraphQlApi.OrganizationLookupException;
import com.govmatrix.extract.model.Organization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

@Service
public class OrganizationLookupService {
    private static final Logger log = LoggerFactory.getLogger(OrganizationLookupService.class);

    private final GovernanceGraphQlApi api;
    private final ExecutorService aliasLookupExecutor;

    public OrganizationLookupService(
        GovernanceGraphQlApi api,
        @Qualifier("aliasLookupExecutor") ExecutorService aliasLookupExecutor
    ) {
        this.api = api;
        this.aliasLookupExecutor = aliasLookupExecutor;
    }

    /**
     * Resolves the slug, falling back to alias lookups when the slug is unknown or its organization
     * has no governors. Aliases are looked up in parallel; the first one in order with governors wins.
     */
    public Optional<Organization> resolve(String slug, List<String> aliases) {
        Organization direct = null;
        OrganizationLookupException directError = null;
        try {
            direct = api.findOrganization(slug).orElse(null);
        } catch (OrganizationLookupException e) {
            directError = e;
            log.warn("Lookup of {} failed: {}", slug, e.getMessage());
        }
        if (direct != null && direct.hasGovernors()) {
            log.info("Resolved organization {} ({}) with {} governors", direct.name(), direct.id(), direct.governorIds().size());
            return Optional.of(direct);
        }

        List<String> candidates = candidates(slug, aliases);
        log.info("Organization {} {}; trying aliases {}", slug, direct == null ? "not found" : "has no governors", candidates);
        List<CompletableFuture<Optional<Organization>>> lookups = new ArrayList<>();
        for (String candidate : candidates) {
            lookups.add(CompletableFuture.supplyAsync(() -> lookUp(candidate), aliasLookupExecutor));
        }
        for (int i = 0; i < lookups.size(); i++) {
            Optional<Organization> found;
            try {
                found = lookups.get(i).join();
            } catch (CompletionException e) {
                log.warn("Alias lookup of {} failed", candidates.get(i), e.getCause());
                continue;
            }
            if (found.isPresent() && found.get().hasGovernors()) {
                Organization organization = found.get();
                log.info("Resolved {} through alias {} ({})", slug, candidates.get(i), organization.id());
                lookups.forEach(lookup -> lookup.cancel(false));
                return found;
            }
        }
        if (direct != null) {
            log.warn("No alias of {} has governors; using organization {} without governors", slug, direct.id());
            return Optional.of(direct);
        }
        if (directError != null) {
            throw directError;
        }
        return Optional.empty();
    }

    static List<String> candidates(String slug, List<String> aliases) {
        Set<String> candidates = new LinkedHashSet<>();
        if (aliases != null) {
            aliases.stream()
                .filter(alias -> alias != null && !alias.isBlank())
                .map(String::trim)
                .forEach(candidates::add);
        }
        candidates.add(slug + "-dao");
        candidates.add(slug + "dao");
        candidates.add(slug + "_dao");
        candidates.remove(slug);
        return new ArrayList<>(candidates);
    }

    private Optional<Organization> lookUp(String candidate) {
        try {
            return api.findOrganization(candidate);
        } catch (OrganizationLookupException e) {
            log.debug("Alias lookup of {} failed: {}", candidate, e.getMessage());
            return Optional.empty();
        }
    }
}
