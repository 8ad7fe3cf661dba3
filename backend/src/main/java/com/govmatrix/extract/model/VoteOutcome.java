package com.govmatrix.extract.model;

public enum VoteOutcome {
    FOR("For"),
    AGAINST("Against"),
    ABSTAIN("Abstain"),
    VOTED("Voted"),
    UNKNOWN("Unknown"),
    DID_NOT_VOTE("Did Not Vote");

    private final String label;

    VoteOutcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isParticipation() {
        return this != DID_NOT_VOTE;
    }
}
