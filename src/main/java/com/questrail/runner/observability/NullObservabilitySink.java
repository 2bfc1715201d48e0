package com.questrail.runner.observability;

/**
 * No-op implementation of RunnerObservabilitySink.
 */
public final class NullObservabilitySink implements RunnerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onRunStarted(RunStartedEvent event) {}

    @Override
    public void onRunFinished(RunFinishedEvent event) {}

    @Override
    public void onHookFailure(HookFailureEvent event) {}

    @Override
    public void onLateSettlement(LateSettlementEvent event) {}

    @Override
    public void onError(RunnerErrorEvent event) {}
}
