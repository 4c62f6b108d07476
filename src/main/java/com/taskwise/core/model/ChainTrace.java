package com.taskwise.core.model;

import java.util.List;
import java.util.Map;

/**
 * Execution view of a single task.
 *
 * @param root           full name of the traced task
 * @param ancestors      transitive hard dependencies, declaration order
 * @param descendants    transitive hard dependents, declaration order
 * @param executionOrder ancestors plus root in a valid run order
 * @param layers         groups that may run in parallel; every task's hard
 *                       dependencies sit in strictly earlier layers
 * @param postTasks      {@code depends_post} targets of the root
 * @param waitForTasks   {@code wait_for} sources of the root
 * @param details        definitions of every task in {@code executionOrder}
 */
public record ChainTrace(
    String root,
    List<String> ancestors,
    List<String> descendants,
    List<String> executionOrder,
    List<List<String>> layers,
    List<String> postTasks,
    List<String> waitForTasks,
    Map<String, TaskDefinition> details
) {
    public int totalSteps() {
        return executionOrder.size();
    }
}
