package in.livebid.room;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serialization point of one room.
 *
 * SINGLE-WRITER PER ROOM:
 * Tasks run one at a time, in enqueue order, on a shared dispatcher pool. At most one dispatcher
 * thread drains a given mailbox at any moment, so room state needs no locking. Different rooms
 * drain in parallel.
 *
 * CAPACITY:
 * Client-originated work ({@link #offer}) counts against a bounded capacity and is refused when
 * the room is saturated. Internal work ({@link #enqueueSystem}: detach, timer firing, eviction)
 * is always admitted so it can never be lost to backpressure. Both kinds share one FIFO.
 */
final class RoomMailbox {
    private static final Logger log = LoggerFactory.getLogger(RoomMailbox.class);

    // Tasks run per dispatch before yielding the thread to other rooms
    private static final int THROUGHPUT = 64;

    private final String name;
    private final Executor dispatcher;
    private final int capacity;

    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger bounded = new AtomicInteger();
    private final AtomicBoolean scheduled = new AtomicBoolean();
    private volatile boolean closed;

    RoomMailbox(String name, Executor dispatcher, int capacity) {
        this.name = name;
        this.dispatcher = dispatcher;
        this.capacity = capacity;
    }

    /**
     * Enqueue client-originated work.
     *
     * @return false if the mailbox is closed or full
     */
    boolean offer(Runnable task) {
        if (closed) {
            return false;
        }
        if (bounded.incrementAndGet() > capacity) {
            bounded.decrementAndGet();
            log.warn("[{}] Mailbox full ({} queued), refusing task", name, capacity);
            return false;
        }
        queue.add(() -> {
            bounded.decrementAndGet();
            task.run();
        });
        schedule();
        return true;
    }

    /**
     * Enqueue internal work, bypassing the capacity bound.
     *
     * @return false if the mailbox is closed
     */
    boolean enqueueSystem(Runnable task) {
        if (closed) {
            return false;
        }
        queue.add(task);
        schedule();
        return true;
    }

    /**
     * Refuse further work. Tasks already queued still run.
     */
    void close() {
        closed = true;
    }

    boolean isClosed() {
        return closed;
    }

    int pendingClientTasks() {
        return bounded.get();
    }

    private void schedule() {
        if (queue.isEmpty() || !scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            dispatcher.execute(this::drain);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            log.warn("[{}] Dispatcher rejected mailbox drain: {}", name, e.toString());
        }
    }

    private void drain() {
        try {
            for (int i = 0; i < THROUGHPUT; i++) {
                Runnable task = queue.poll();
                if (task == null) {
                    break;
                }
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("[{}] Room task failed", name, e);
                }
            }
        } finally {
            scheduled.set(false);
            // Producers that lost the CAS while we were draining rely on this re-check
            schedule();
        }
    }
}
