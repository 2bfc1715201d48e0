package com.questrail.runner.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DescribeNode
 * =============================================================================
 * One {@code describe} scope: its ordered children plus four ordered hook lists.
 *
 * <h2>Ownership</h2>
 * A node is owned by its parent (or is the implicit root) and is discarded as a
 * whole when the runner is reset. Children and hooks are appended only while the
 * tree is being registered; the runner rejects registration during a run, so the
 * lists are stable for the whole traversal.
 */
public final class DescribeNode implements SuiteNode
{
    private final String title;
    private final Modifier modifier;
    private final String filePath;
    private final DescribeNode parent;

    private final List<SuiteNode> children = new ArrayList<>();
    private final Map<HookKind, List<Hook>> hooks = new EnumMap<>(HookKind.class);

    private DescribeNode(String title, Modifier modifier, String filePath, DescribeNode parent)
    {
        this.title = Objects.requireNonNull(title, "title");
        this.modifier = Objects.requireNonNull(modifier, "modifier");
        this.filePath = filePath;
        this.parent = parent;
        for (HookKind kind : HookKind.values()) {
            hooks.put(kind, new ArrayList<>());
        }
    }

    /** The implicit scope that collects top-level describes, tests and hooks. */
    public static DescribeNode root()
    {
        return new DescribeNode("", Modifier.NONE, null, null);
    }

    /**
     * Creates a nested describe and appends it to this scope's children.
     */
    public DescribeNode addDescribe(String title, Modifier modifier, String filePath)
    {
        DescribeNode child = new DescribeNode(title, modifier, filePath, this);
        children.add(child);
        return child;
    }

    /**
     * Appends a test to this scope's children.
     */
    public TestNode addTest(TestNode.Definition definition)
    {
        TestNode test = new TestNode(definition, this);
        children.add(test);
        return test;
    }

    public void addHook(Hook hook)
    {
        Objects.requireNonNull(hook, "hook");
        hooks.get(hook.kind()).add(hook);
    }

    public List<SuiteNode> children()
    {
        return Collections.unmodifiableList(children);
    }

    public List<Hook> hooks(HookKind kind)
    {
        return Collections.unmodifiableList(hooks.get(kind));
    }

    public boolean isRoot()
    {
        return parent == null;
    }

    public Optional<DescribeNode> parent()
    {
        return Optional.ofNullable(parent);
    }

    @Override
    public String title()
    {
        return title;
    }

    @Override
    public Modifier modifier()
    {
        return modifier;
    }

    @Override
    public Optional<String> filePath()
    {
        return Optional.ofNullable(filePath);
    }

    @Override
    public List<String> describeChain()
    {
        return parent == null ? List.of() : parent.scopeChain();
    }

    /**
     * Titles from the outermost describe down to and including this one.
     */
    public List<String> scopeChain()
    {
        if (parent == null) {
            return List.of();
        }
        List<String> chain = new ArrayList<>(parent.scopeChain());
        chain.add(title);
        return List.copyOf(chain);
    }

    @Override
    public String toString()
    {
        return isRoot() ? "DescribeNode[root]" : "DescribeNode[" + String.join(" > ", scopeChain()) + "]";
    }
}
