package com.questrail.runner.internal.exec;

import com.questrail.runner.api.HookFailureException;
import com.questrail.runner.model.DescribeNode;
import com.questrail.runner.model.SuiteNode;

import java.util.List;
import java.util.Objects;

/**
 * ScopeFrame
 * -----------------------------------------------------------------------------
 * Traversal position inside one open describe scope: one "queue" of the
 * scheduler's queue stack.
 *
 * <p>A frame advances through its {@link Stage}s strictly in order. Each call
 * into the scheduler loop performs at most one unit of work for the top frame,
 * so cancellation is observed between any two units.</p>
 */
final class ScopeFrame
{
    enum Stage
    {
        /** beforeDescribe not yet published. */
        ENTER,
        BEFORE_HOOKS,
        CHILDREN,
        AFTER_HOOKS,
        /** afterDescribe pending; the frame is popped next. */
        EXIT
    }

    private final DescribeNode scope;
    private final List<SuiteNode> children;
    private final long startNanos;

    private Stage stage = Stage.ENTER;
    private int nextChild;
    private int nextHook;
    private HookFailureException beforeFailure;

    ScopeFrame(DescribeNode scope, List<SuiteNode> children, long startNanos)
    {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.children = List.copyOf(children);
        this.startNanos = startNanos;
    }

    DescribeNode scope()
    {
        return scope;
    }

    Stage stage()
    {
        return stage;
    }

    long startNanos()
    {
        return startNanos;
    }

    void advanceTo(Stage next)
    {
        if (next.ordinal() <= stage.ordinal()) {
            throw new IllegalStateException("Scope " + scope + " cannot move from " + stage + " to " + next);
        }
        stage = next;
        nextHook = 0;
    }

    boolean hasNextChild()
    {
        return nextChild < children.size();
    }

    SuiteNode takeNextChild()
    {
        return children.get(nextChild++);
    }

    /** Children not yet visited; all of them if the scope has not reached its children. */
    List<SuiteNode> remainingChildren()
    {
        return children.subList(nextChild, children.size());
    }

    void skipRemainingChildren()
    {
        nextChild = children.size();
    }

    int nextHook()
    {
        return nextHook;
    }

    void hookDone()
    {
        nextHook++;
    }

    HookFailureException beforeFailure()
    {
        return beforeFailure;
    }

    void failBefore(HookFailureException failure)
    {
        this.beforeFailure = Objects.requireNonNull(failure, "failure");
    }

    /** True once beforeDescribe has been published for this frame. */
    boolean entered()
    {
        return stage != Stage.ENTER;
    }
}
