package com.govmatrix.extract.graphql;

final class GovernanceQueries {

    static final String ORGANIZATION = """
        query GetOrganization($input: OrganizationInput!) {
            organization(input: $input) {
                id
                slug
                name
                chainIds
                governorIds
                proposalsCount
                delegatesCount
                delegatesVotesCount
                tokenOwnersCount
                hasActiveProposals
            }
        }
        """;

    static final String DELEGATES = """
        query GetDelegates($input: DelegatesInput!) {
            delegates(input: $input) {
                nodes {
                    ... on Delegate {
                        id
                        account { address name ens }
                        votesCount
                        delegatorsCount
                        statement { statement statementSummary isSeekingDelegation }
                    }
                }
                pageInfo { firstCursor lastCursor count }
            }
        }
        """;

    static final String PROPOSALS = """
        query GetProposals($input: ProposalsInput!) {
            proposals(input: $input) {
                nodes {
                    ... on Proposal {
                        id
                        onchainId
                        metadata { title description }
                        proposer { address name }
                        status
                        start {
                            ... on Block { timestamp number }
                            ... on BlocklessTimestamp { timestamp }
                        }
                        end {
                            ... on Block { timestamp number }
                            ... on BlocklessTimestamp { timestamp }
                        }
                        voteStats { type votesCount votersCount percent }
                        quorum
                    }
                }
                pageInfo { firstCursor lastCursor count }
            }
        }
        """;

    static final String VOTES = """
        query GetVotes($input: VotesInput!) {
            votes(input: $input) {
                nodes {
                    ... on OnchainVote {
                        id
                        type
                        amount
                        reason
                        voter { address name ens }
                        block { timestamp number }
                        txHash
                    }
                }
                pageInfo { firstCursor lastCursor count }
            }
        }
        """;

    private GovernanceQueries() {}
}
