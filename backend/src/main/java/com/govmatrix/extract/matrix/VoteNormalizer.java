package com.govmatrix.extract.matrix;

import com.govmatrix.extract.model.Vote;
import com.govmatrix.extract.model.VoteOutcome;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps the raw vote payload to a closed outcome set. Rules are tried in order: raw type synonym,
 * positive amount, reason keywords, presence of a transaction hash.
 */
@Component
public class VoteNormalizer {
    private static final Map<String, VoteOutcome> TYPE_SYNONYMS = Map.ofEntries(
        Map.entry("for", VoteOutcome.FOR),
        Map.entry("yes", VoteOutcome.FOR),
        Map.entry("support", VoteOutcome.FOR),
        Map.entry("approve", VoteOutcome.FOR),
        Map.entry("in_favor", VoteOutcome.FOR),
        Map.entry("infavor", VoteOutcome.FOR),
        Map.entry("aye", VoteOutcome.FOR),
        Map.entry("1", VoteOutcome.FOR),
        Map.entry("true", VoteOutcome.FOR),
        Map.entry("against", VoteOutcome.AGAINST),
        Map.entry("no", VoteOutcome.AGAINST),
        Map.entry("oppose", VoteOutcome.AGAINST),
        Map.entry("nay", VoteOutcome.AGAINST),
        Map.entry("0", VoteOutcome.AGAINST),
        Map.entry("false", VoteOutcome.AGAINST),
        Map.entry("abstain", VoteOutcome.ABSTAIN),
        Map.entry("abstention", VoteOutcome.ABSTAIN),
        Map.entry("present", VoteOutcome.ABSTAIN),
        Map.entry("2", VoteOutcome.ABSTAIN)
    );

    // stems match inflected forms ("supporting", "opposed"); short words stay whole
    private static final Pattern FOR_WORDS = keywords(
        stems("support", "favo", "approv", "agree"), whole("yes", "for"));
    private static final Pattern AGAINST_WORDS = keywords(
        stems("against", "oppos", "disagree", "reject"), whole("no"));
    private static final Pattern ABSTAIN_WORDS = keywords(
        stems("abstain", "abstention", "neutral", "present"), whole());

    public VoteOutcome normalize(Vote vote) {
        if (vote == null) {
            return VoteOutcome.UNKNOWN;
        }
        String type = vote.rawType() == null ? "" : vote.rawType().trim().toLowerCase(Locale.ROOT);
        VoteOutcome byType = TYPE_SYNONYMS.get(type);
        if (byType != null) {
            return byType;
        }
        if (isPositive(vote.amount())) {
            return VoteOutcome.FOR;
        }
        String reason = vote.reason() == null ? "" : vote.reason().toLowerCase(Locale.ROOT);
        if (!reason.isBlank()) {
            if (FOR_WORDS.matcher(reason).find()) {
                return VoteOutcome.FOR;
            }
            if (AGAINST_WORDS.matcher(reason).find()) {
                return VoteOutcome.AGAINST;
            }
            if (ABSTAIN_WORDS.matcher(reason).find()) {
                return VoteOutcome.ABSTAIN;
            }
        }
        if (vote.txHash() != null && !vote.txHash().isBlank()) {
            return VoteOutcome.VOTED;
        }
        return VoteOutcome.UNKNOWN;
    }

    static boolean isPositive(String amount) {
        if (amount == null || amount.isBlank()) {
            return false;
        }
        try {
            return new BigDecimal(amount.trim()).signum() > 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String stems(String... stems) {
        return "\\b(?:" + String.join("|", stems) + ")";
    }

    private static String whole(String... words) {
        return words.length == 0 ? "" : "|\\b(?:" + String.join("|", words) + ")\\b";
    }

    private static Pattern keywords(String stems, String whole) {
        return Pattern.compile(stems + whole);
    }
}
