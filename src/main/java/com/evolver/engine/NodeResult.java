package com.evolver.engine;

import com.evolver.capability.FailureKind;
import com.evolver.dag.NodeStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Final state of one node after a run.
 *
 * @param nodeId         node id
 * @param action         action name
 * @param status         terminal status
 * @param failureKind    failure signature, FAILED nodes only
 * @param failureSubject missing key or expected predecessor, when the capability reported one
 * @param expectedValue  value the missing key should have held, when reported
 * @param reason         failure or skip reason
 * @param durationMillis capability-reported duration, 0 unless SUCCEEDED
 * @param payload        observation payload, SUCCEEDED nodes only
 */
public record NodeResult(
        String nodeId,
        String action,
        NodeStatus status,
        FailureKind failureKind,
        String failureSubject,
        Object expectedValue,
        String reason,
        long durationMillis,
        Map<String, Object> payload
) {
    public NodeResult {
        // Values may be null, e.g. an extracted field the page did not have
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static NodeResult succeeded(String nodeId, String action, long durationMillis, Map<String, Object> payload) {
        return new NodeResult(nodeId, action, NodeStatus.SUCCEEDED, null, null, null, null, durationMillis, payload);
    }

    public static NodeResult failed(String nodeId, String action, FailureKind kind, String subject,
                                    Object expected, String reason) {
        return new NodeResult(nodeId, action, NodeStatus.FAILED, kind, subject, expected, reason, 0, Map.of());
    }

    public static NodeResult skipped(String nodeId, String action, String reason) {
        return new NodeResult(nodeId, action, NodeStatus.SKIPPED, null, null, null, reason, 0, Map.of());
    }

    public Optional<FailureKind> failure() {
        return Optional.ofNullable(failureKind);
    }

    public Optional<String> subject() {
        return Optional.ofNullable(failureSubject);
    }

    public Optional<Object> expected() {
        return Optional.ofNullable(expectedValue);
    }

    public boolean succeeded() {
        return status == NodeStatus.SUCCEEDED;
    }
}
