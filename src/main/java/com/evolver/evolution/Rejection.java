package com.evolver.evolution;

public record Rejection(String proposalId, RejectionReason reason, String detail) {
}
