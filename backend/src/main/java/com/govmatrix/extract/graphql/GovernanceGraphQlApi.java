package com.govmatrix.extract.graphql;

import com.fasterxml.jackson.databind.JsonNode;
import com.govmatrix.extract.http.FetchError;
import com.govmatrix.extract.http.GraphQlResult;
import com.govmatrix.extract.http.RateLimitedGraphQlClient;
import com.govmatrix.extract.model.Delegate;
import com.govmatrix.extract.model.Organization;
import com.govmatrix.extract.model.Proposal;
import com.govmatrix.extract.model.Vote;
import com.govmatrix.extract.pagination.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Service
public class GovernanceGraphQlApi {
    private static final Logger log = LoggerFactory.getLogger(GovernanceGraphQlApi.class);

    private final RateLimitedGraphQlClient client;

    public GovernanceGraphQlApi(RateLimitedGraphQlClient client) {
        this.client = client;
    }

    /**
     * Looks an organization up by slug. An empty optional means the service answered and has no such
     * organization; a transport or API failure is reported as {@link OrganizationLookupException}.
     */
    public Optional<Organization> findOrganization(String slug) {
        Map<String, Object> variables = Map.of("input", Map.of("slug", slug));
        GraphQlResult result = client.send(GovernanceQueries.ORGANIZATION, variables);
        if (!result.isSuccessful()) {
            throw new OrganizationLookupException(slug, result.error());
        }
        return Optional.ofNullable(GovernancePayloadMapper.toOrganization(result.data().path("organization")));
    }

    public Page<Delegate> delegatesPage(String organizationId, String afterCursor, int limit) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("filters", Map.of("organizationId", organizationId));
        input.put("page", page(afterCursor, limit));
        input.put("sort", Map.of("sortBy", "id", "isDescending", false));
        return fetchPage(GovernanceQueries.DELEGATES, input, "delegates", GovernancePayloadMapper::toDelegate);
    }

    public Page<Proposal> proposalsPage(String organizationId, String governorId, String afterCursor, int limit) {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("organizationId", organizationId);
        filters.put("includeArchived", true);
        if (governorId != null && !governorId.isBlank()) {
            filters.put("governorId", governorId);
        }
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("filters", filters);
        input.put("page", page(afterCursor, limit));
        input.put("sort", Map.of("sortBy", "id", "isDescending", true));
        return fetchPage(GovernanceQueries.PROPOSALS, input, "proposals", GovernancePayloadMapper::toProposal);
    }

    public Page<Vote> votesPage(String proposalId, String afterCursor, int limit) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("filters", Map.of("proposalId", proposalId));
        input.put("page", page(afterCursor, limit));
        input.put("sort", Map.of("sortBy", "id", "isDescending", false));
        return fetchPage(GovernanceQueries.VOTES, input, "votes", GovernancePayloadMapper::toVote);
    }

    private <T> Page<T> fetchPage(
        String query,
        Map<String, Object> input,
        String root,
        Function<JsonNode, T> mapper
    ) {
        GraphQlResult result = client.send(query, Map.of("input", input));
        if (!result.isSuccessful()) {
            return Page.failed(result.error());
        }
        JsonNode connection = result.data().path(root);
        List<T> items = new ArrayList<>();
        int rejected = 0;
        for (JsonNode node : connection.path("nodes")) {
            T item = mapper.apply(node);
            if (item == null) {
                rejected++;
            } else {
                items.add(item);
            }
        }
        if (rejected > 0) {
            log.debug("Dropped {} {} nodes without identity", rejected, root);
        }
        String lastCursor = GovernancePayloadMapper.text(connection.path("pageInfo"), "lastCursor");
        return Page.of(items, lastCursor);
    }

    private Map<String, Object> page(String afterCursor, int limit) {
        Map<String, Object> page = new LinkedHashMap<>();
        page.put("limit", limit);
        if (afterCursor != null && !afterCursor.isBlank()) {
            page.put("afterCursor", afterCursor);
        }
        return page;
    }

    public static class OrganizationLookupException extends RuntimeException {
        private final transient FetchError error;

        public OrganizationLookupException(String slug, FetchError error) {
            super("organization lookup failed for slug=" + slug + ": " + (error == null ? "unknown" : error.describe()));
            this.error = error;
        }

        public FetchError error() {
            return error;
        }
    }
}
