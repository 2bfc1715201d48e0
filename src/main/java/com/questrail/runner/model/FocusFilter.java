package com.questrail.runner.model;

import java.util.ArrayList;
import java.util.List;

/**
 * FocusFilter
 * -----------------------------------------------------------------------------
 * Applies {@link Modifier#ONLY} narrowing to a scope's children.
 *
 * <p>At every level: if any child is marked {@code ONLY} or contains such a
 * node, the children without one are excluded. Excluded nodes are not run, not
 * counted and not reported.</p>
 */
public final class FocusFilter
{
    private FocusFilter() {}

    /**
     * Children of {@code scope} that take part in the run, in declaration order.
     */
    public static List<SuiteNode> select(DescribeNode scope)
    {
        List<SuiteNode> children = scope.children();
        boolean focused = children.stream().anyMatch(FocusFilter::containsOnly);
        if (!focused) {
            return List.copyOf(children);
        }
        return children.stream().filter(FocusFilter::containsOnly).toList();
    }

    /**
     * Every test under {@code scope} that takes part in the run, depth first in
     * declaration order. Skip modifiers are ignored here.
     */
    public static List<TestNode> selectedTests(DescribeNode scope)
    {
        List<TestNode> tests = new ArrayList<>();
        collect(scope, tests);
        return tests;
    }

    /**
     * True if {@code node} is marked {@code ONLY} or has such a descendant.
     */
    public static boolean containsOnly(SuiteNode node)
    {
        if (node.modifier() == Modifier.ONLY) {
            return true;
        }
        if (node instanceof DescribeNode describe) {
            return describe.children().stream().anyMatch(FocusFilter::containsOnly);
        }
        return false;
    }

    private static void collect(DescribeNode scope, List<TestNode> into)
    {
        for (SuiteNode child : select(scope)) {
            if (child instanceof TestNode test) {
                into.add(test);
            } else if (child instanceof DescribeNode describe) {
                collect(describe, into);
            }
        }
    }
}
