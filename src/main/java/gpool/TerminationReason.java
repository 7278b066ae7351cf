package gpool;

enum TerminationReason {
    /**
     * The reason why a worker is terminated by sitting idle longer than `idleTimeoutNanos`.
     */
    IDLE_TIMEOUT,
    /**
     * The reason why a worker is terminated by an exception thrown from the task it was running.
     */
    TASK_FAILURE
}
