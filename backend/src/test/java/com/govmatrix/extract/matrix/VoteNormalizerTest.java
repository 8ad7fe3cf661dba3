package com.govmatrix.extract.matrix;

import com.govmatrix.extract.model.BlockRef;
import com.govmatrix.extract.model.Vote;
import com.govmatrix.extract.model.VoteOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class VoteNormalizerTest {
    private final VoteNormalizer normalizer = new VoteNormalizer();

    @Test
    void explicitForTypeWinsOverZeroAmount() {
        assertThat(normalizer.normalize(vote("FOR", "0", "", ""))).isEqualTo(VoteOutcome.FOR);
    }

    @Test
    void unrecognizedTypeWithPositiveAmountIsFor() {
        assertThat(normalizer.normalize(vote("weird", "12.5", null, null))).isEqualTo(VoteOutcome.FOR);
    }

    @Test
    void transactionHashAloneMeansVoted() {
        assertThat(normalizer.normalize(vote("weird", "0", "", "0xabc"))).isEqualTo(VoteOutcome.VOTED);
    }

    @Test
    void nothingToGoOnIsUnknown() {
        assertThat(normalizer.normalize(vote(null, null, null, null))).isEqualTo(VoteOutcome.UNKNOWN);
        assertThat(normalizer.normalize(null)).isEqualTo(VoteOutcome.UNKNOWN);
    }

    @ParameterizedTest
    @CsvSource({
        "yes, FOR",
        "' In_Favor ', FOR",
        "infavor, FOR",
        "1, FOR",
        "nay, AGAINST",
        "false, AGAINST",
        "0, AGAINST",
        "abstention, ABSTAIN",
        "2, ABSTAIN"
    })
    void synonymsAreMatchedCaseInsensitively(String type, VoteOutcome expected) {
        assertThat(normalizer.normalize(vote(type, "0", "", ""))).isEqualTo(expected);
    }

    @Test
    void reasonKeywordsMatchWordStarts() {
        assertThat(normalizer.normalize(vote("", "0", "I strongly oppose this", ""))).isEqualTo(VoteOutcome.AGAINST);
        assertThat(normalizer.normalize(vote("", "0", "Staying neutral here", ""))).isEqualTo(VoteOutcome.ABSTAIN);
        // "information" and "nothing" must not trigger "for" or "no"
        assertThat(normalizer.normalize(vote("", "0", "information nothing", "0xtx"))).isEqualTo(VoteOutcome.VOTED);
    }

    @ParameterizedTest
    @CsvSource({
        "'Supporting this proposal, no concerns', FOR",
        "I am supportive of this, FOR",
        "Favourable terms, FOR",
        "Approved by the committee, FOR",
        "Opposed to this change, AGAINST",
        "Rejecting the budget, AGAINST",
        "Disagreeing with the scope, AGAINST",
        "Abstaining this round, ABSTAIN",
        "I know nothing, VOTED"
    })
    void reasonKeywordsMatchInflectedForms(String reason, VoteOutcome expected) {
        assertThat(normalizer.normalize(vote("", "0", reason, "0xtx"))).isEqualTo(expected);
    }

    @Test
    void malformedAmountIsIgnored() {
        assertThat(normalizer.normalize(vote("", "lots", "", "0xtx"))).isEqualTo(VoteOutcome.VOTED);
        assertThat(VoteNormalizer.isPositive("-3")).isFalse();
        assertThat(VoteNormalizer.isPositive("1000000000000000000000")).isTrue();
    }

    private static Vote vote(String type, String amount, String reason, String txHash) {
        return new Vote("v", "0xvoter", null, type, amount, reason, BlockRef.EMPTY, txHash);
    }
}
