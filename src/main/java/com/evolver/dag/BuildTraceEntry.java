package com.evolver.dag;

/**
 * One piece of build evidence: rule {@code ruleId} injected or constrained {@code nodeId}.
 *
 * @param nodeId    affected node
 * @param action    action of the affected node
 * @param ruleId    rule responsible
 * @param kind      injection or constraint
 * @param rationale why the rule touched the node
 */
public record BuildTraceEntry(
        String nodeId,
        String action,
        String ruleId,
        TraceKind kind,
        String rationale
) {
}
