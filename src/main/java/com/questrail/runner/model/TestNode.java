package com.questrail.runner.model;

import com.questrail.runner.api.Callback;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One {@code it} block. Immutable once registered; owned by its parent scope.
 */
public final class TestNode implements SuiteNode
{
    /**
     * Registration data for a test.
     *
     * @param timeout per-test override of the body timeout, or {@code null}
     * @param filePath source path active at registration, or {@code null}
     */
    public record Definition(String title,
                             Callback callback,
                             Duration timeout,
                             Modifier modifier,
                             String filePath)
    {
        public Definition {
            Objects.requireNonNull(title, "title");
            Objects.requireNonNull(callback, "callback");
            Objects.requireNonNull(modifier, "modifier");
        }
    }

    private final Definition definition;
    private final DescribeNode parent;

    TestNode(Definition definition, DescribeNode parent)
    {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.parent = Objects.requireNonNull(parent, "parent");
    }

    @Override
    public String title()
    {
        return definition.title();
    }

    public Callback callback()
    {
        return definition.callback();
    }

    public Optional<Duration> timeoutOverride()
    {
        return Optional.ofNullable(definition.timeout());
    }

    @Override
    public Modifier modifier()
    {
        return definition.modifier();
    }

    @Override
    public Optional<String> filePath()
    {
        return Optional.ofNullable(definition.filePath());
    }

    public DescribeNode parent()
    {
        return parent;
    }

    @Override
    public List<String> describeChain()
    {
        return parent.scopeChain();
    }

    @Override
    public String toString()
    {
        return "TestNode[" + String.join(" > ", describeChain()) + " :: " + title() + "]";
    }
}
