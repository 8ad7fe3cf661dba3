package com.govmatrix.extract.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record ExtractionRequest(
    String slug,
    String name,
    List<String> aliases,
    String governorId,
    Boolean forceRefreshVotes,
    Boolean allowPartial
) {
    public String normalizedSlug() {
        return slug == null ? "" : slug.trim().toLowerCase(Locale.ROOT);
    }

    public List<String> normalizedAliases() {
        if (aliases == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String alias : aliases) {
            if (alias == null || alias.isBlank()) {
                continue;
            }
            unique.add(alias.trim().toLowerCase(Locale.ROOT));
        }
        unique.remove(normalizedSlug());
        return new ArrayList<>(unique);
    }

    public String normalizedGovernorId() {
        return governorId == null || governorId.isBlank() ? null : governorId.trim();
    }

    public boolean isForceRefreshVotes() {
        return Boolean.TRUE.equals(forceRefreshVotes);
    }

    public boolean isAllowPartial() {
        return Boolean.TRUE.equals(allowPartial);
    }
}
