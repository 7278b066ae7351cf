package gpool;

/**
 * Status of a worker. Every transition is made with a compare-and-set
 * whose expected value is the exact prior status.
 *
 * <pre>
 * (new) -> IDLE -> IN_USE -> IDLE -> ...
 *            |
 *            +--> DYING -> DEAD
 * </pre>
 */
enum WorkerStatus {
    /**
     * Waiting for a task, either linked in the free list or just allocated.
     */
    IDLE,
    /**
     * Claimed by a submitter, or running a task.
     */
    IN_USE,
    /**
     * The idle timer fired and the worker's loop has returned.
     * It may still be linked in the free list until a claimer pops it.
     */
    DYING,
    /**
     * Discarded by a claimer that popped a dying worker. Terminal.
     */
    DEAD
}
