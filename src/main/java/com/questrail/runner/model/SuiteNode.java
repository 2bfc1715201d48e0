package com.questrail.runner.model;

import java.util.List;
import java.util.Optional;

/**
 * SuiteNode
 * -----------------------------------------------------------------------------
 * A child of a describe scope: either a nested {@link DescribeNode} or a
 * {@link TestNode}. Children keep their declaration order, and tests and
 * describes are interleaved exactly as registered.
 */
public sealed interface SuiteNode permits DescribeNode, TestNode
{
    String title();

    Modifier modifier();

    /** Absolute source path active when the node was registered, if any. */
    Optional<String> filePath();

    /**
     * Titles of the enclosing describe blocks, outermost first. The implicit
     * root scope contributes no title.
     */
    List<String> describeChain();
}
