package com.cypherscan.core.model;

public enum VoteDecision {
    CONFIRMED, REJECTED, UNCERTAIN
}
