package gpool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * A pool of reusable worker threads.
 *
 * <p>{@link #submit(Runnable)} hands a task to an idle worker, or to a new one when no worker is idle,
 * and returns without waiting for the task to finish. A worker that finishes its task puts itself back
 * to the pool. A worker that stays idle longer than {@link #idleTimeout()} terminates by itself.
 *
 * <p>The pool has no upper bound on the number of workers and no shutdown. Workers are daemon threads
 * by default, so idle workers never keep the JVM alive.
 */
public final class GPool implements Executor {

    private static final Logger LOGGER = LoggerFactory.getLogger(GPool.class);

    private final AtomicLong numAllocatedWorkers = new AtomicLong(0);
    private final AtomicInteger numLiveWorkers = new AtomicInteger(0);
    private final Lock freeListLock = new ReentrantLock();

    // Guarded by `freeListLock`.
    @Nullable
    private Worker head;
    @Nullable
    private Worker tail;
    private int count;

    private final long idleTimeoutNanos;
    private final String threadNamePrefix;
    private final boolean daemon;

    GPool(long idleTimeoutNanos, String threadNamePrefix, boolean daemon) {
        this.idleTimeoutNanos = idleTimeoutNanos;
        this.threadNamePrefix = threadNamePrefix;
        this.daemon = daemon;
    }

    public static GPoolBuilder builder() {
        return new GPoolBuilder();
    }

    /**
     * Creates a pool whose workers terminate after being idle for {@code idleTimeout}.
     */
    public static GPool create(Duration idleTimeout) {
        return builder().idleTimeout(idleTimeout).build();
    }

    public Duration idleTimeout() {
        return Duration.ofNanos(idleTimeoutNanos);
    }

    /**
     * Returns the number of workers in the free list.
     * A worker whose idle timer already fired is counted until a submitter discards it.
     */
    public int freeWorkersSize() {
        freeListLock.lock();
        try {
            return count;
        } finally {
            freeListLock.unlock();
        }
    }

    /**
     * Returns total amount of workers allocated since this pool was created.
     */
    public long allocatedWorkersSize() {
        return numAllocatedWorkers.get();
    }

    /**
     * Returns total amount of workers whose thread has not terminated yet.
     */
    public int liveWorkersSize() {
        return numLiveWorkers.get();
    }

    @Override
    public void execute(@Nonnull Runnable task) {
        submit(task);
    }

    /**
     * Hands {@code task} to a worker. This method returns as soon as the worker received the task,
     * not when the task is done. An exception thrown by the task terminates the worker that ran it
     * and is not reported to the caller.
     */
    public void submit(@Nonnull Runnable task) {
        requireNonNull(task, "task");

        Worker worker;
        while (true) {
            worker = claim();
            if (worker.status.compareAndSet(WorkerStatus.IDLE, WorkerStatus.IN_USE)) {
                break;
            }

            // The idle timer of this worker fired first. Discard it and claim another one.
            if (worker.status.compareAndSet(WorkerStatus.DYING, WorkerStatus.DEAD)) {
                LOGGER.debug("Discard {} because it is idle timeout", worker.workerName());
            }
        }

        // The worker puts itself back to the free list when the task is done,
        // so we don't need to release it here.
        worker.handOff(task);
    }

    /**
     * Takes the first worker out of the free list, or allocates a new one if the list is empty.
     * The returned worker is not linked and its status is not changed.
     */
    Worker claim() {
        final Worker worker;
        freeListLock.lock();
        try {
            worker = head;
            if (worker != null) {
                head = worker.next;
                if (worker == tail) {
                    tail = null;
                }
                count--;
                worker.next = null;
            }
        } finally {
            freeListLock.unlock();
        }

        return worker != null ? worker : alloc();
    }

    /**
     * Appends {@code worker} to the free list and marks it as idle.
     * Only the worker itself calls this, after its task is done.
     */
    void release(Worker worker) {
        worker.next = null;
        freeListLock.lock();
        try {
            if (tail == null) {
                head = worker;
            } else {
                tail.next = worker;
            }
            tail = worker;
            count++;
            worker.status.set(WorkerStatus.IDLE);
        } finally {
            freeListLock.unlock();
        }
    }

    private Worker alloc() {
        final long ordinal = numAllocatedWorkers.incrementAndGet();
        final Worker worker = new Worker(String.format("%s-%d", threadNamePrefix, ordinal));
        numLiveWorkers.incrementAndGet();
        worker.start();
        return worker;
    }

    final class Worker extends AbstractWorker {

        final AtomicReference<WorkerStatus> status = new AtomicReference<>(WorkerStatus.IDLE);

        private final SynchronousQueue<Runnable> channel = new SynchronousQueue<>();

        // Touched under `freeListLock`, or by whoever holds this worker while it is not linked.
        @Nullable
        Worker next;

        Worker(String threadName) {
            super(threadName, daemon);
        }

        WorkerStatus status() {
            return status.get();
        }

        /**
         * Blocks until this worker takes {@code task}. The caller must have changed the status
         * of this worker from {@link WorkerStatus#IDLE} to {@link WorkerStatus#IN_USE}.
         */
        void handOff(Runnable task) {
            boolean interrupted = false;
            try {
                while (true) {
                    try {
                        channel.put(task);
                        return;
                    } catch (InterruptedException e) {
                        // The task has to be delivered anyway. Keep the interrupt for the caller.
                        interrupted = true;
                    }
                }
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }

        @Override
        void go() {
            LOGGER.debug("Started a new worker: {}", threadName);
            try {
                while (true) {
                    final Runnable task;
                    try {
                        task = channel.poll(idleTimeoutNanos, TimeUnit.NANOSECONDS);
                    } catch (InterruptedException cause) {
                        LOGGER.warn("Unexpected interrupt is occurred on {}", workerName());
                        continue;
                    }

                    if (task == null) {
                        // A submitter may have taken this worker out of the free list at the same time.
                        // Then the status is IN_USE and the task is on its way.
                        if (status.compareAndSet(WorkerStatus.IDLE, WorkerStatus.DYING)) {
                            setTerminationReason(TerminationReason.IDLE_TIMEOUT);
                            LOGGER.debug("{} is idle timeout", workerName());
                            break;
                        }
                        continue;
                    }

                    try {
                        LOGGER.debug("{} is executed by {}", task, workerName());
                        task.run();
                    } catch (Throwable cause) {
                        setTerminationReason(TerminationReason.TASK_FAILURE);
                        throw cause;
                    }

                    release(this);
                }
            } finally {
                numLiveWorkers.decrementAndGet();
                LOGGER.debug("{} has been terminated, reason: {}", workerName(), terminationReason());
            }
        }
    }
}
