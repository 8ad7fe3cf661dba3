package com.govmatrix.extract.graphql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govmatrix.extract.model.Delegate;
import com.govmatrix.extract.model.Organization;
import com.govmatrix.extract.model.Proposal;
import com.govmatrix.extract.model.ProposalStatus;
import com.govmatrix.extract.model.Vote;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GovernancePayloadMapperTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void mapsDelegateWithNormalizedAddressAndDefaults() throws Exception {
        JsonNode node = objectMapper.readTree("""
            {"account": {"address": "0xABCdef", "name": "", "ens": "alice.eth"},
             "votesCount": "12500000000000000000", "delegatorsCount": 3,
             "statement": {"statement": "I vote", "isSeekingDelegation": true}}
            """);

        Delegate delegate = GovernancePayloadMapper.toDelegate(node);

        assertThat(delegate.address()).isEqualTo("0xabcdef");
        assertThat(delegate.name()).isNull();
        assertThat(delegate.displayName()).isEqualTo("0xabcdef");
        assertThat(delegate.ens()).isEqualTo("alice.eth");
        assertThat(delegate.votingPower()).isEqualTo(1.25e19);
        assertThat(delegate.delegatorsCount()).isEqualTo(3);
        assertThat(delegate.hasStatement()).isTrue();
        assertThat(delegate.seekingDelegation()).isTrue();
    }

    @Test
    void delegateWithoutAddressIsRejected() throws Exception {
        assertThat(GovernancePayloadMapper.toDelegate(objectMapper.readTree("{\"account\": null}"))).isNull();
    }

    @Test
    void malformedNumbersFallBackToZero() throws Exception {
        JsonNode node = objectMapper.readTree("""
            {"account": {"address": "0x1"}, "votesCount": "n/a", "delegatorsCount": "-4"}
            """);

        Delegate delegate = GovernancePayloadMapper.toDelegate(node);

        assertThat(delegate.votingPower()).isZero();
        assertThat(delegate.delegatorsCount()).isZero();
    }

    @Test
    void countsBeyondIntRangeAreClamped() throws Exception {
        Delegate delegate = GovernancePayloadMapper.toDelegate(objectMapper.readTree("""
            {"account": {"address": "0x1"}, "delegatorsCount": "4294967297"}
            """));
        Proposal proposal = GovernancePayloadMapper.toProposal(objectMapper.readTree("""
            {"id": "1", "voteStats": [{"type": "for", "votesCount": "1", "votersCount": 9000000000}]}
            """));

        assertThat(delegate.delegatorsCount()).isEqualTo(Integer.MAX_VALUE);
        assertThat(proposal.voteStats().get(0).votersCount()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void mapsProposalWithStatsAndBlocks() throws Exception {
        JsonNode node = objectMapper.readTree("""
            {"id": "123", "onchainId": "7", "status": "cancelled",
             "metadata": {"title": "Raise fee", "description": "..."},
             "proposer": {"address": "0xPROP"},
             "start": {"timestamp": "2024-01-01T00:00:00Z", "number": "100"},
             "end": {"number": 200},
             "voteStats": [
               {"type": "for", "votesCount": "10", "votersCount": 4, "percent": 80.0},
               {"type": "against", "votesCount": "1", "votersCount": "2", "percent": "20"}
             ]}
            """);

        Proposal proposal = GovernancePayloadMapper.toProposal(node);

        assertThat(proposal.id()).isEqualTo("123");
        assertThat(proposal.status()).isEqualTo(ProposalStatus.CANCELED);
        assertThat(proposal.title()).isEqualTo("Raise fee");
        assertThat(proposal.proposerAddress()).isEqualTo("0xprop");
        assertThat(proposal.start().number()).isEqualTo(100L);
        assertThat(proposal.end().timestamp()).isNull();
        assertThat(proposal.end().number()).isEqualTo(200L);
        assertThat(proposal.expectedVoterCount()).isEqualTo(6);
    }

    @Test
    void proposalWithoutStatsHasNoExpectedCount() throws Exception {
        Proposal proposal = GovernancePayloadMapper.toProposal(objectMapper.readTree("{\"id\": \"9\"}"));

        assertThat(proposal.expectedVoterCount()).isNull();
        assertThat(proposal.displayTitle()).isEqualTo("Proposal 9");
        assertThat(proposal.status()).isEqualTo(ProposalStatus.UNKNOWN);
    }

    @Test
    void mapsVoteAndItsIdentity() throws Exception {
        JsonNode node = objectMapper.readTree("""
            {"type": "for", "amount": "500", "reason": null, "txHash": "0xtx",
             "voter": {"address": "0xVoter", "name": "bob"},
             "block": {"timestamp": "2024-02-02T00:00:00Z", "number": 42}}
            """);

        Vote vote = GovernancePayloadMapper.toVote(node);

        assertThat(vote.voterAddress()).isEqualTo("0xvoter");
        assertThat(vote.reason()).isNull();
        assertThat(vote.block().number()).isEqualTo(42L);
        assertThat(vote.identity()).isEqualTo("0xvoter:0xtx");
    }

    @Test
    void mapsOrganization() throws Exception {
        JsonNode node = objectMapper.readTree("""
            {"id": "2206072050315953936", "slug": "arbitrum", "name": "Arbitrum",
             "governorIds": ["eip155:42161:0xf07"], "chainIds": ["eip155:42161"],
             "proposalsCount": 55, "delegatesCount": "1000", "hasActiveProposals": true}
            """);

        Organization organization = GovernancePayloadMapper.toOrganization(node);

        assertThat(organization.hasGovernors()).isTrue();
        assertThat(organization.proposalsCount()).isEqualTo(55);
        assertThat(organization.delegatesCount()).isEqualTo(1000);
        assertThat(organization.tokenOwnersCount()).isNull();
        assertThat(GovernancePayloadMapper.toOrganization(objectMapper.readTree("null"))).isNull();
    }
}
