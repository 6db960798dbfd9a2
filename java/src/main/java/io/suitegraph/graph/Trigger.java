package io.suitegraph.graph;

import io.suitegraph.ast.ExprNode;
import io.suitegraph.ast.TaskRef;

/**
 * The full condition under which a task occurrence is triggered, before it is split into edges.
 *
 * @param recurrence the recurrence the condition applies to
 * @param successor the triggered task occurrence
 * @param condition the boolean condition over predecessor outputs
 * @param suicide true for a suicide trigger
 */
public record Trigger(String recurrence, TaskRef successor, ExprNode condition, boolean suicide) {}
