package com.questrail.runner.observability;

/**
 * Main interface for receiving runner observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface RunnerObservabilitySink {
    /**
     * Called when a run begins, before the first unit of work.
     * @param event the run details
     */
    void onRunStarted(RunStartedEvent event);

    /**
     * Called when a run completes or has been cancelled.
     * @param event the final results
     */
    void onRunFinished(RunFinishedEvent event);

    /**
     * Called when any hook fails or times out.
     * @param event the hook failure
     */
    void onHookFailure(HookFailureEvent event);

    /**
     * Called when a unit settles after a timeout or cancellation decided its outcome.
     * @param event the ignored settlement
     */
    void onLateSettlement(LateSettlementEvent event);

    /**
     * Called when an error aborts a run (for example a throwing event listener).
     * @param event the error event
     */
    void onError(RunnerErrorEvent event);
}
