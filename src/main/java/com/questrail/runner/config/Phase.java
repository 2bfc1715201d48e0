package com.questrail.runner.config;

import com.questrail.runner.model.HookKind;

/**
 * Unit of work a timeout can be configured for.
 */
public enum Phase
{
    IT("it"),
    BEFORE("before"),
    BEFORE_EACH("beforeEach"),
    AFTER("after"),
    AFTER_EACH("afterEach");

    private final String id;

    Phase(String id)
    {
        this.id = id;
    }

    public String id()
    {
        return id;
    }

    public static Phase of(HookKind kind)
    {
        return switch (kind) {
            case BEFORE -> BEFORE;
            case BEFORE_EACH -> BEFORE_EACH;
            case AFTER -> AFTER;
            case AFTER_EACH -> AFTER_EACH;
        };
    }
}
