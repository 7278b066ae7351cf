package gpool;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerTest {

    @Test
    public void newWorkerIsIdleAndNotLinked() {
        final GPool pool = GPool.create(Duration.ofSeconds(10));

        final GPool.Worker worker = pool.claim();

        assertThat(worker.status()).isEqualTo(WorkerStatus.IDLE);
        assertThat(worker.next).isNull();
        assertThat(worker.isAlive()).isTrue();
        assertThat(pool.freeWorkersSize()).isZero();
        assertThat(pool.allocatedWorkersSize()).isEqualTo(1);
    }

    @Test
    public void onlyOneClaimWins() {
        final GPool pool = GPool.create(Duration.ofSeconds(10));
        final GPool.Worker worker = pool.claim();

        assertThat(worker.status.compareAndSet(WorkerStatus.IDLE, WorkerStatus.IN_USE)).isTrue();
        assertThat(worker.status.compareAndSet(WorkerStatus.IDLE, WorkerStatus.IN_USE)).isFalse();
        // The idle timer loses against a claimer.
        assertThat(worker.status.compareAndSet(WorkerStatus.IDLE, WorkerStatus.DYING)).isFalse();
        assertThat(worker.status()).isEqualTo(WorkerStatus.IN_USE);
    }

    @Test
    public void releasedWorkersAreClaimedInOrder() throws Exception {
        final GPool pool = GPool.create(Duration.ofSeconds(10));
        final GPool.Worker first = pool.claim();
        final GPool.Worker second = pool.claim();
        first.status.set(WorkerStatus.IN_USE);
        second.status.set(WorkerStatus.IN_USE);

        pool.release(first);
        pool.release(second);

        assertThat(pool.freeWorkersSize()).isEqualTo(2);
        assertThat(first.status()).isEqualTo(WorkerStatus.IDLE);
        assertThat(first.next).isSameAs(second);

        assertThat(pool.claim()).isSameAs(first);
        assertThat(first.next).isNull();
        assertThat(pool.claim()).isSameAs(second);
        assertThat(pool.freeWorkersSize()).isZero();

        // The list works again after it became empty.
        pool.release(second);
        assertThat(pool.claim()).isSameAs(second);
        assertThat(pool.allocatedWorkersSize()).isEqualTo(2);
    }

    @Test
    public void releasesItselfAfterTask() throws Exception {
        final GPool pool = GPool.create(Duration.ofSeconds(10));
        final GPool.Worker worker = pool.claim();
        assertThat(worker.status.compareAndSet(WorkerStatus.IDLE, WorkerStatus.IN_USE)).isTrue();

        final CountDownLatch running = new CountDownLatch(1);
        final CountDownLatch finish = new CountDownLatch(1);
        worker.handOff(() -> {
            running.countDown();
            try {
                finish.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(worker.status()).isEqualTo(WorkerStatus.IN_USE);
        assertThat(pool.freeWorkersSize()).isZero();

        finish.countDown();
        final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (pool.freeWorkersSize() == 0 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }

        assertThat(pool.freeWorkersSize()).isEqualTo(1);
        assertThat(worker.status()).isEqualTo(WorkerStatus.IDLE);
        assertThat(pool.claim()).isSameAs(worker);
    }

    @Test
    public void idleWorkerTerminatesItself() throws Exception {
        final GPool pool = GPool.create(Duration.ofMillis(20));
        final GPool.Worker worker = pool.claim();

        worker.join();

        assertThat(worker.status()).isEqualTo(WorkerStatus.DYING);
        assertThat(worker.terminationReason()).isEqualTo(TerminationReason.IDLE_TIMEOUT);
        assertThat(pool.liveWorkersSize()).isZero();
    }
}
