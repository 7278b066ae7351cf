package gpool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.concurrent.atomic.AtomicBoolean;

abstract class AbstractWorker {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractWorker.class);

    private final AtomicBoolean started = new AtomicBoolean(false);

    final Thread thread;
    final String threadName;

    @Nullable
    private volatile TerminationReason terminationReason;

    AbstractWorker(String threadName, boolean daemon) {
        this.thread = new Thread(this::go, threadName);
        this.thread.setDaemon(daemon);
        this.thread.setUncaughtExceptionHandler(
                (t, cause) -> LOGGER.warn("{} is terminated by an exception from a task", t.getName(), cause));
        this.threadName = threadName;
    }

    String workerName() {
        return threadName;
    }

    void start() {
        if (started.compareAndSet(false, true)) {
            thread.start();
        }
    }

    boolean isAlive() {
        return thread.isAlive();
    }

    void setTerminationReason(TerminationReason reason) {
        this.terminationReason = reason;
    }

    @Nullable
    TerminationReason terminationReason() {
        return terminationReason;
    }

    void join() throws InterruptedException {
        thread.join();
    }

    abstract void go();
}
