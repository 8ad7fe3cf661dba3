package com.govmatrix.extract.matrix;

import com.govmatrix.extract.model.Delegate;
import com.govmatrix.extract.model.DelegateAggregate;
import com.govmatrix.extract.model.MatrixStatistics;
import com.govmatrix.extract.model.Proposal;
import com.govmatrix.extract.model.ProposalAggregate;
import com.govmatrix.extract.model.ProposalVotes;
import com.govmatrix.extract.model.Vote;
import com.govmatrix.extract.model.VoteOutcome;
import com.govmatrix.extract.model.VotingMatrix;
import com.govmatrix.extract.model.VotingMatrixRecord;
import com.govmatrix.extract.util.AddressUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cross-joins delegates with proposals. Every (delegate, proposal) pair yields exactly one record;
 * pairs without a vote are {@link VoteOutcome#DID_NOT_VOTE}.
 */
@Component
public class VotingMatrixBuilder {
    private static final Logger log = LoggerFactory.getLogger(VotingMatrixBuilder.class);

    private final VoteNormalizer normalizer;

    public VotingMatrixBuilder(VoteNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public VotingMatrix build(List<Proposal> proposals, List<Delegate> delegates, VoteSource voteSource) {
        List<VotingMatrixRecord> records = new ArrayList<>(initialCapacity(proposals.size(), delegates.size()));
        List<ProposalAggregate> proposalAggregates = new ArrayList<>();
        Map<String, DelegateTally> delegateTallies = new LinkedHashMap<>();
        for (Delegate delegate : delegates) {
            delegateTallies.putIfAbsent(delegate.address(), new DelegateTally(delegate));
        }

        int totalVotesFetched = 0;
        int proposalsWithVotes = 0;
        int participatedRecords = 0;
        Set<String> voters = new HashSet<>();
        List<String> incomplete = new ArrayList<>();

        int index = 0;
        for (Proposal proposal : proposals) {
            index++;
            ProposalVotes proposalVotes = voteSource.votesFor(proposal);
            if (!proposalVotes.complete()) {
                incomplete.add(proposal.id());
                log.warn(
                    "Votes for proposal {} are incomplete ({}); building rows from {} fetched votes",
                    proposal.id(),
                    proposalVotes.failureReason(),
                    proposalVotes.votes().size()
                );
            }
            Map<String, Vote> voteByVoter = new HashMap<>();
            for (Vote vote : proposalVotes.votes()) {
                String address = AddressUtils.normalize(vote.voterAddress());
                if (address != null) {
                    voteByVoter.put(address, vote);
                }
            }
            totalVotesFetched += proposalVotes.votes().size();

            Map<VoteOutcome, Integer> tallies = new EnumMap<>(VoteOutcome.class);
            int delegateVoters = 0;
            for (Delegate delegate : delegates) {
                Vote vote = voteByVoter.get(delegate.address());
                VotingMatrixRecord record = vote == null
                    ? VotingMatrixRecord.didNotVote(delegate, proposal)
                    : toRecord(delegate, proposal, vote);
                records.add(record);
                tallies.merge(record.vote(), 1, Integer::sum);
                delegateTallies.get(delegate.address()).add(record);
                if (record.participated()) {
                    delegateVoters++;
                    participatedRecords++;
                    voters.add(delegate.address());
                }
            }
            if (delegateVoters > 0) {
                proposalsWithVotes++;
            }
            proposalAggregates.add(new ProposalAggregate(
                proposal,
                delegates.size(),
                delegateVoters,
                proposalVotes.votes().size(),
                proposal.expectedVoterCount(),
                tallies,
                percent(delegateVoters, delegates.size()),
                proposalVotes.complete()
            ));
            log.info(
                "Proposal {}/{} {}: {} votes fetched, {}/{} delegates voted",
                index,
                proposals.size(),
                proposal.id(),
                proposalVotes.votes().size(),
                delegateVoters,
                delegates.size()
            );
        }

        List<DelegateAggregate> delegateAggregates = new ArrayList<>();
        for (DelegateTally tally : delegateTallies.values()) {
            delegateAggregates.add(tally.toAggregate(proposals.size()));
        }
        delegateAggregates.sort(Comparator.comparingDouble((DelegateAggregate a) -> a.delegate().votingPower()).reversed());
        proposalAggregates.sort(Comparator.comparingInt(ProposalAggregate::uniqueVoters).reversed());

        int activeDelegates = (int) delegateTallies.values().stream()
            .filter(tally -> tally.delegate.hasVotingPower())
            .count();
        MatrixStatistics statistics = new MatrixStatistics(
            records.size(),
            delegateTallies.size(),
            proposals.size(),
            totalVotesFetched,
            voters.size(),
            proposalsWithVotes,
            activeDelegates,
            percent(participatedRecords, records.size()),
            incomplete
        );
        log.info(
            "Voting matrix built: {} records, {} votes fetched, {} proposals with delegate votes, {} incomplete",
            records.size(),
            totalVotesFetched,
            proposalsWithVotes,
            incomplete.size()
        );
        return new VotingMatrix(records, delegateAggregates, proposalAggregates, statistics);
    }

    private VotingMatrixRecord toRecord(Delegate delegate, Proposal proposal, Vote vote) {
        return new VotingMatrixRecord(
            delegate,
            proposal,
            normalizer.normalize(vote),
            vote.amount() == null ? "0" : vote.amount(),
            vote.rawType() == null ? "" : vote.rawType(),
            vote.reason() == null ? "" : vote.reason(),
            vote.block().timestamp() == null ? "" : vote.block().timestamp(),
            vote.block().number(),
            vote.txHash() == null ? "" : vote.txHash()
        );
    }

    static double percent(int part, int whole) {
        if (whole <= 0) {
            return 0.0;
        }
        return Math.round(part * 10000.0 / whole) / 100.0;
    }

    // a cross join too large for one array still fails, but on add rather than on an overflowed pre-size
    static int initialCapacity(int proposals, int delegates) {
        return (int) Math.min(Integer.MAX_VALUE - 8, (long) proposals * delegates);
    }

    private static final class DelegateTally {
        private final Delegate delegate;
        private final Map<VoteOutcome, Integer> tallies = new EnumMap<>(VoteOutcome.class);
        private int votesCast;

        private DelegateTally(Delegate delegate) {
            this.delegate = delegate;
        }

        private void add(VotingMatrixRecord record) {
            tallies.merge(record.vote(), 1, Integer::sum);
            if (record.participated()) {
                votesCast++;
            }
        }

        private DelegateAggregate toAggregate(int totalProposals) {
            return new DelegateAggregate(delegate, totalProposals, votesCast, tallies, percent(votesCast, totalProposals));
        }
    }
}
