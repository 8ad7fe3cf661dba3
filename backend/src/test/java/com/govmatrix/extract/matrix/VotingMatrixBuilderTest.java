package com.govmatrix.extract.matrix;

import com.govmatrix.extract.model.BlockRef;
import com.govmatrix.extract.model.Delegate;
import com.govmatrix.extract.model.DelegateAggregate;
import com.govmatrix.extract.model.Proposal;
import com.govmatrix.extract.model.ProposalAggregate;
import com.govmatrix.extract.model.ProposalStatus;
import com.govmatrix.extract.model.ProposalVotes;
import com.govmatrix.extract.model.Vote;
import com.govmatrix.extract.model.VoteOutcome;
import com.govmatrix.extract.model.VotingMatrix;
import com.govmatrix.extract.model.VotingMatrixRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VotingMatrixBuilderTest {
    private final VotingMatrixBuilder builder = new VotingMatrixBuilder(new VoteNormalizer());

    @Test
    void noVotesYieldsFullCrossJoinOfDidNotVote() {
        List<Proposal> proposals = List.of(proposal("p1"), proposal("p2"), proposal("p3"));
        List<Delegate> delegates = List.of(delegate("0x1", 10), delegate("0x2", 20));

        VotingMatrix matrix = builder.build(proposals, delegates, p -> ProposalVotes.complete(p.id(), List.of()));

        assertThat(matrix.records()).hasSize(6);
        assertThat(matrix.records()).allSatisfy(record -> {
            assertThat(record.vote()).isEqualTo(VoteOutcome.DID_NOT_VOTE);
            assertThat(record.votingAmount()).isEqualTo("0");
            assertThat(record.voteTxHash()).isEmpty();
            assertThat(record.participated()).isFalse();
        });
        assertThat(matrix.statistics().overallParticipationRate()).isZero();
        assertThat(matrix.statistics().proposalsWithVotes()).isZero();
    }

    @Test
    void singleVoteIsPlacedOnItsDelegateOnly() {
        Delegate x = delegate("0xAAA", 5);
        List<Delegate> delegates = List.of(x, delegate("0xbbb", 1), delegate("0xccc", 0));
        Vote vote = new Vote("v1", "0xaaa", "x", "For", "500", "looks good", new BlockRef("2024-05-01T00:00:00Z", 99L), "0xtx");

        VotingMatrix matrix = builder.build(List.of(proposal("p1")), delegates, p -> ProposalVotes.complete(p.id(), List.of(vote)));

        VotingMatrixRecord voted = matrix.records().stream()
            .filter(record -> record.delegate().address().equals("0xaaa"))
            .findFirst()
            .orElseThrow();
        assertThat(voted.vote()).isEqualTo(VoteOutcome.FOR);
        assertThat(voted.votingAmount()).isEqualTo("500");
        assertThat(voted.voteBlockNumber()).isEqualTo(99L);
        assertThat(matrix.records())
            .filteredOn(record -> !record.delegate().address().equals("0xaaa"))
            .hasSize(2)
            .allSatisfy(record -> assertThat(record.vote()).isEqualTo(VoteOutcome.DID_NOT_VOTE));

        ProposalAggregate aggregate = matrix.proposalAggregates().get(0);
        assertThat(aggregate.uniqueVoters()).isEqualTo(1);
        assertThat(aggregate.eligibleDelegates()).isEqualTo(3);
        assertThat(aggregate.participationRate()).isEqualTo(33.33);
        assertThat(aggregate.tally(VoteOutcome.FOR)).isEqualTo(1);
        assertThat(matrix.statistics().activeDelegates()).isEqualTo(2);
    }

    @Test
    void laterVoteFromSameVoterReplacesEarlierOne() {
        Vote first = new Vote("v1", "0x1", null, "against", "1", null, BlockRef.EMPTY, "0xa");
        Vote second = new Vote("v2", "0x1", null, "for", "1", null, BlockRef.EMPTY, "0xb");

        VotingMatrix matrix = builder.build(
            List.of(proposal("p1")),
            List.of(delegate("0x1", 1)),
            p -> ProposalVotes.complete(p.id(), List.of(first, second))
        );

        assertThat(matrix.records().get(0).vote()).isEqualTo(VoteOutcome.FOR);
        assertThat(matrix.records().get(0).voteTxHash()).isEqualTo("0xb");
    }

    @Test
    void incompleteProposalIsFlaggedWithoutAffectingOthers() {
        Vote vote = new Vote("v1", "0x1", null, "for", "1", null, BlockRef.EMPTY, "0xa");
        Map<String, ProposalVotes> votes = Map.of(
            "p1", new ProposalVotes("p1", List.of(vote), false, "failed:fetch_failed"),
            "p2", ProposalVotes.complete("p2", List.of(vote))
        );

        VotingMatrix matrix = builder.build(
            List.of(proposal("p1"), proposal("p2")),
            List.of(delegate("0x1", 1), delegate("0x2", 1)),
            p -> votes.get(p.id())
        );

        assertThat(matrix.records()).hasSize(4);
        assertThat(matrix.statistics().incompleteProposalIds()).containsExactly("p1");
        assertThat(matrix.proposalAggregates())
            .allSatisfy(aggregate -> assertThat(aggregate.uniqueVoters()).isEqualTo(1));
        assertThat(matrix.proposalAggregates())
            .filteredOn(aggregate -> aggregate.proposal().id().equals("p1"))
            .allSatisfy(aggregate -> assertThat(aggregate.votesComplete()).isFalse());
    }

    @Test
    void aggregatesAreSortedAndCountNonDelegateVotes() {
        Vote delegateVote = new Vote("v1", "0x2", null, "against", "0", null, BlockRef.EMPTY, "0xa");
        Vote outsiderVote = new Vote("v2", "0xoutsider", null, "for", "7", null, BlockRef.EMPTY, "0xb");

        VotingMatrix matrix = builder.build(
            List.of(proposal("p1"), proposal("p2")),
            List.of(delegate("0x1", 1), delegate("0x2", 50)),
            p -> p.id().equals("p2")
                ? ProposalVotes.complete(p.id(), List.of(delegateVote, outsiderVote))
                : ProposalVotes.complete(p.id(), List.of())
        );

        assertThat(matrix.delegateAggregates()).extracting(a -> a.delegate().address()).containsExactly("0x2", "0x1");
        DelegateAggregate top = matrix.delegateAggregates().get(0);
        assertThat(top.votesCast()).isEqualTo(1);
        assertThat(top.participationRate()).isEqualTo(50.0);
        assertThat(top.tally(VoteOutcome.AGAINST)).isEqualTo(1);
        assertThat(matrix.proposalAggregates()).extracting(a -> a.proposal().id()).containsExactly("p2", "p1");
        assertThat(matrix.proposalAggregates().get(0).votesFetched()).isEqualTo(2);
        assertThat(matrix.statistics().totalVotesFetched()).isEqualTo(2);
        assertThat(matrix.statistics().uniqueVoters()).isEqualTo(1);
        assertThat(matrix.statistics().overallParticipationRate()).isEqualTo(25.0);
    }

    @Test
    void matrixListsAreUnmodifiable() {
        VotingMatrix matrix = builder.build(List.of(proposal("p1")), List.of(delegate("0x1", 1)),
            p -> ProposalVotes.complete(p.id(), List.of()));

        assertThatThrownBy(() -> matrix.records().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void initialCapacityDoesNotOverflow() {
        assertThat(VotingMatrixBuilder.initialCapacity(3, 4)).isEqualTo(12);
        assertThat(VotingMatrixBuilder.initialCapacity(100_000, 100_000)).isEqualTo(Integer.MAX_VALUE - 8);
        assertThat(VotingMatrixBuilder.initialCapacity(0, Integer.MAX_VALUE)).isZero();
    }

    private static Delegate delegate(String address, double power) {
        return new Delegate(address, null, null, power, 0, null, null, false);
    }

    private static Proposal proposal(String id) {
        return new Proposal(id, null, "Proposal " + id, null, null, ProposalStatus.ACTIVE, null, null, null, List.of());
    }
}
