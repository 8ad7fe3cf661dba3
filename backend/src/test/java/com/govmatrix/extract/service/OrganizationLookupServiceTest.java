package com.govmatrix.extract.service;

import com.govmatrix.extract.graphql.GovernanceGraphQlApi;
import com.govmatrix.extract.graphql.GovernanceGraphQlApi.OrganizationLookupException;
import com.govmatrix.extract.http.FetchError;
import com.govmatrix.extract.http.FetchErrorType;
import com.govmatrix.extract.model.Organization;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrganizationLookupServiceTest {

    @Mock
    private GovernanceGraphQlApi api;

    private final ExecutorService executor = Executors.newFixedThreadPool(3);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void directHitWithGovernorsSkipsAliases() {
        when(api.findOrganization("uniswap")).thenReturn(Optional.of(organization("1", "uniswap", true)));

        Optional<Organization> found = new OrganizationLookupService(api, executor).resolve("uniswap", List.of("uni"));

        assertThat(found).map(Organization::id).contains("1");
        verify(api, never()).findOrganization("uni");
    }

    @Test
    void firstAliasInOrderWithGovernorsWins() {
        when(api.findOrganization("ens")).thenReturn(Optional.empty());
        lenient().when(api.findOrganization("ens-old")).thenReturn(Optional.of(organization("2", "ens-old", false)));
        lenient().when(api.findOrganization("ensdao")).thenReturn(Optional.of(organization("3", "ensdao", true)));
        lenient().when(api.findOrganization("ens-dao")).thenReturn(Optional.of(organization("4", "ens-dao", true)));
        lenient().when(api.findOrganization("ens_dao")).thenReturn(Optional.empty());

        Optional<Organization> found = new OrganizationLookupService(api, executor).resolve("ens", List.of("ens-old", "ensdao"));

        assertThat(found).map(Organization::id).contains("3");
    }

    @Test
    void failingAliasLookupsAreSkipped() {
        when(api.findOrganization("gitcoin")).thenReturn(Optional.empty());
        lenient().when(api.findOrganization("gitcoin-dao"))
            .thenThrow(new OrganizationLookupException("gitcoin-dao", FetchError.of(FetchErrorType.TIMEOUT, "slow")));
        lenient().when(api.findOrganization("gitcoindao")).thenReturn(Optional.of(organization("5", "gitcoindao", true)));
        lenient().when(api.findOrganization("gitcoin_dao")).thenReturn(Optional.empty());

        Optional<Organization> found = new OrganizationLookupService(api, executor).resolve("gitcoin", List.of());

        assertThat(found).map(Organization::id).contains("5");
    }

    @Test
    void nothingFoundIsEmpty() {
        when(api.findOrganization(anyString())).thenReturn(Optional.empty());

        assertThat(new OrganizationLookupService(api, executor).resolve("nope", List.of())).isEmpty();
    }

    @Test
    void directFailureSurfacesWhenNoAliasResolves() {
        when(api.findOrganization(anyString())).thenReturn(Optional.empty());
        when(api.findOrganization("down"))
            .thenThrow(new OrganizationLookupException("down", FetchError.of(FetchErrorType.SERVER_ERROR, "503")));

        assertThatThrownBy(() -> new OrganizationLookupService(api, executor).resolve("down", List.of()))
            .isInstanceOf(OrganizationLookupException.class);
    }

    @Test
    void organizationWithoutGovernorsIsLastResort() {
        when(api.findOrganization(anyString())).thenReturn(Optional.empty());
        when(api.findOrganization("tiny")).thenReturn(Optional.of(organization("6", "tiny", false)));

        assertThat(new OrganizationLookupService(api, executor).resolve("tiny", List.of())).map(Organization::id).contains("6");
    }

    @Test
    void candidatesIncludeConventionalSuffixesWithoutDuplicates() {
        assertThat(OrganizationLookupService.candidates("aave", List.of("aave-dao", " aave ", "aavegov")))
            .containsExactly("aave-dao", "aavegov", "aavedao", "aave_dao");
    }

    private static Organization organization(String id, String slug, boolean governors) {
        return new Organization(id, slug, slug.toUpperCase(), governors ? List.of("eip155:1:0x" + id) : List.of(),
            List.of(), 3, 10, null, null, false);
    }
}
