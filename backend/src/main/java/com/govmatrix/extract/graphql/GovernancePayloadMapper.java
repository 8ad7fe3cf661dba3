package com.govmatrix.extract.graphql;

import com.fasterxml.jackson.databind.JsonNode;
import com.govmatrix.extract.model.BlockRef;
import com.govmatrix.extract.model.Delegate;
import com.govmatrix.extract.model.Organization;
import com.govmatrix.extract.model.Proposal;
import com.govmatrix.extract.model.ProposalStatus;
import com.govmatrix.extract.model.Vote;
import com.govmatrix.extract.model.VoteStat;
import com.govmatrix.extract.util.AddressUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns GraphQL JSON nodes into model records. Missing, null or malformed fields fall back to the
 * defaults declared here and nowhere else; records lacking their identity are rejected (null).
 */
public final class GovernancePayloadMapper {

    private GovernancePayloadMapper() {}

    public static Organization toOrganization(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || text(node, "id") == null) {
            return null;
        }
        return new Organization(
            text(node, "id"),
            text(node, "slug"),
            text(node, "name"),
            textList(node.path("governorIds")),
            textList(node.path("chainIds")),
            integerOrNull(node.path("proposalsCount")),
            integerOrNull(node.path("delegatesCount")),
            text(node, "delegatesVotesCount"),
            integerOrNull(node.path("tokenOwnersCount")),
            node.path("hasActiveProposals").asBoolean(false)
        );
    }

    public static Delegate toDelegate(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode account = node.path("account");
        String address = AddressUtils.normalize(text(account, "address"));
        if (address == null) {
            return null;
        }
        JsonNode statement = node.path("statement");
        return new Delegate(
            address,
            text(account, "name"),
            text(account, "ens"),
            parseDouble(node.path("votesCount")),
            count(node.path("delegatorsCount")),
            text(statement, "statement"),
            text(statement, "statementSummary"),
            statement.path("isSeekingDelegation").asBoolean(false)
        );
    }

    public static Proposal toProposal(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String id = text(node, "id");
        if (id == null) {
            return null;
        }
        JsonNode metadata = node.path("metadata");
        List<VoteStat> stats = new ArrayList<>();
        for (JsonNode stat : node.path("voteStats")) {
            if (!stat.isObject()) {
                continue;
            }
            stats.add(new VoteStat(
                text(stat, "type"),
                text(stat, "votesCount"),
                count(stat.path("votersCount")),
                parseDouble(stat.path("percent"))
            ));
        }
        return new Proposal(
            id,
            text(node, "onchainId"),
            text(metadata, "title"),
            text(metadata, "description"),
            AddressUtils.normalize(text(node.path("proposer"), "address")),
            ProposalStatus.fromApi(text(node, "status")),
            toBlock(node.path("start")),
            toBlock(node.path("end")),
            text(node, "quorum"),
            stats
        );
    }

    public static Vote toVote(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode voter = node.path("voter");
        String address = AddressUtils.normalize(text(voter, "address"));
        if (address == null) {
            return null;
        }
        return new Vote(
            text(node, "id"),
            address,
            text(voter, "name"),
            text(node, "type"),
            text(node, "amount"),
            text(node, "reason"),
            toBlock(node.path("block")),
            text(node, "txHash")
        );
    }

    static BlockRef toBlock(JsonNode node) {
        if (node == null || !node.isObject()) {
            return BlockRef.EMPTY;
        }
        JsonNode number = node.path("number");
        Long blockNumber = number.isNumber() || number.isTextual() ? parseLongOrNull(number) : null;
        return new BlockRef(text(node, "timestamp"), blockNumber);
    }

    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.isValueNode() ? value.asText() : value.toString();
        return text.isBlank() ? null : text;
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                if (item.isValueNode() && !item.asText().isBlank()) {
                    values.add(item.asText());
                }
            }
        }
        return values;
    }

    private static Integer integerOrNull(JsonNode node) {
        Long value = parseLongOrNull(node);
        return value == null ? null : (int) Math.min(Integer.MAX_VALUE, value);
    }

    private static double parseDouble(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return 0.0;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            double value = Double.parseDouble(node.asText().trim());
            return Double.isFinite(value) ? value : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static int count(JsonNode node) {
        Long value = parseLongOrNull(node);
        return value == null ? 0 : (int) Math.min(Integer.MAX_VALUE, Math.max(0L, value));
    }

    private static Long parseLongOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        try {
            return Long.parseLong(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
