package com.evolver.engine;

import com.evolver.dag.ActionDAG;
import com.evolver.dag.BuildTrace;
import com.evolver.dag.Goal;
import com.evolver.dag.NodeStatus;
import com.evolver.state.WorldState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything reflection and metrics need to know about one run.
 *
 * @param taskId              task id
 * @param goal                goal that was planned
 * @param versionId           world model version the DAG was built from
 * @param initialState        state the run started from
 * @param dag                 executed graph
 * @param trace               build trace of the graph
 * @param results             per-node results in node order
 * @param events              transitions in the order they happened
 * @param status              overall status
 * @param totalDurationMillis sum of capability-reported node durations
 */
public record ExecutionReport(
        String taskId,
        Goal goal,
        String versionId,
        WorldState initialState,
        ActionDAG dag,
        BuildTrace trace,
        Map<String, NodeResult> results,
        List<ExecutionEvent> events,
        ExecutionStatus status,
        long totalDurationMillis
) {
    public ExecutionReport {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        events = List.copyOf(events);
    }

    /**
     * SUCCESS iff every node succeeded, PARTIAL if at least one did, FAILURE otherwise.
     * An empty graph counts as SUCCESS.
     */
    public static ExecutionStatus statusOf(Collection<NodeResult> results) {
        long succeeded = results.stream().filter(NodeResult::succeeded).count();
        if (succeeded == results.size()) {
            return ExecutionStatus.SUCCESS;
        }
        return succeeded > 0 ? ExecutionStatus.PARTIAL : ExecutionStatus.FAILURE;
    }

    public NodeResult result(String nodeId) {
        NodeResult result = results.get(nodeId);
        if (result == null) {
            throw new IllegalArgumentException("No result for node " + nodeId);
        }
        return result;
    }

    public List<NodeResult> resultsWith(NodeStatus nodeStatus) {
        List<NodeResult> matching = new ArrayList<>();
        for (NodeResult result : results.values()) {
            if (result.status() == nodeStatus) {
                matching.add(result);
            }
        }
        return matching;
    }

    /**
     * Nodes the engine actually started (succeeded or failed, not skipped).
     */
    public int executedCount() {
        return (int) results.values().stream().filter(r -> r.status() != NodeStatus.SKIPPED).count();
    }

    public int succeededCount() {
        return resultsWith(NodeStatus.SUCCEEDED).size();
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}
