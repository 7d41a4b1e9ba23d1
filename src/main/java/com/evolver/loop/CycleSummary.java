package com.evolver.loop;

import com.evolver.evolution.BudgetStatus;
import com.evolver.evolution.Rejection;

import java.util.List;

/**
 * What one evolution step did.
 *
 * @param cycle            cycle number, starting at 1
 * @param versionBefore    current version when the step started
 * @param versionAfter     current version when it ended
 * @param reportsAnalyzed  execution reports reflected on
 * @param successRate      fraction of those reports that succeeded
 * @param planningFailures tasks that could not be planned
 * @param proposalIds      proposals produced by reflection
 * @param committedIds     proposals committed, in commit order
 * @param rejections       proposals the controller turned down
 * @param budget           budget after the step
 */
public record CycleSummary(
        int cycle,
        String versionBefore,
        String versionAfter,
        int reportsAnalyzed,
        double successRate,
        int planningFailures,
        List<String> proposalIds,
        List<String> committedIds,
        List<Rejection> rejections,
        BudgetStatus budget
) {
    public CycleSummary {
        proposalIds = List.copyOf(proposalIds);
        committedIds = List.copyOf(committedIds);
        rejections = List.copyOf(rejections);
    }

    public boolean changedModel() {
        return !versionBefore.equals(versionAfter);
    }
}
