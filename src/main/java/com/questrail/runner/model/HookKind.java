package com.questrail.runner.model;

/**
 * Role of a hook within its describe scope.
 */
public enum HookKind
{
    /** Once, before the first child of the scope. */
    BEFORE("before"),
    /** Before every test in the scope or any nested scope. */
    BEFORE_EACH("beforeEach"),
    /** Once, after the last child of the scope. */
    AFTER("after"),
    /** After every test in the scope or any nested scope. */
    AFTER_EACH("afterEach");

    private final String id;

    HookKind(String id)
    {
        this.id = id;
    }

    /** Registration name, also used as the configuration key suffix. */
    public String id()
    {
        return id;
    }

    /** Human readable label, e.g. {@code "beforeEach" hook}. */
    public String label()
    {
        return '"' + id + "\" hook";
    }
}
