package com.ascherbakoff.ordmap.util;

import static org.junit.jupiter.api.Assertions.fail;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;

public class BasicTest {
    private static final Logger LOG = System.getLogger(BasicTest.class.getName());

    protected boolean waitForCondition(BooleanSupplier cond, long timeout) {
        long ts = System.currentTimeMillis() + timeout;
        while(System.currentTimeMillis() < ts) {
            try {
                if (cond.getAsBoolean())
                    return true;

                Thread.sleep(50);
            } catch (InterruptedException e) {
                fail("Failed to wait for condition");
            }
        }

        return false;
    }

    /**
     * Starts the task in the given number of threads at the same moment and waits for all of them.
     *
     * @param threadsCnt Thread count.
     * @param task Task, accepts a thread index.
     * @throws InterruptedException If interrupted while waiting.
     */
    protected void runConcurrently(int threadsCnt, IntConsumer task) throws InterruptedException {
        Thread[] threads = new Thread[threadsCnt];

        CyclicBarrier startBar = new CyclicBarrier(threadsCnt, () -> LOG.log(Level.INFO, "Starting {0} threads", threadsCnt));

        AtomicReference<Throwable> firstErr = new AtomicReference<>();

        for (int i = 0; i < threads.length; i++) {
            int finalI = i;
            threads[i] = new Thread(new Runnable() {
                @Override
                public void run() {
                    try {
                        startBar.await();

                        task.accept(finalI);
                    } catch (Throwable e) {
                        firstErr.compareAndSet(null, e);
                    }
                }
            });
            threads[i].start();
        }

        for (Thread thread : threads) {
            thread.join();
        }

        if (firstErr.get() != null) {
            LOG.log(Level.ERROR, "Task failed", firstErr.get());

            fail("Task failed", firstErr.get());
        }
    }
}
