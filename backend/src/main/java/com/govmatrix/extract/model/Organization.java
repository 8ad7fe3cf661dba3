package com.govmatrix.extract.model;

import java.util.List;

public record Organization(
    String id,
    String slug,
    String name,
    List<String> governorIds,
    List<String> chainIds,
    Integer proposalsCount,
    Integer delegatesCount,
    String delegatesVotesCount,
    Integer tokenOwnersCount,
    boolean hasActiveProposals
) {
    public Organization {
        governorIds = governorIds == null ? List.of() : List.copyOf(governorIds);
        chainIds = chainIds == null ? List.of() : List.copyOf(chainIds);
    }

    public boolean hasGovernors() {
        return !governorIds.isEmpty();
    }
}
