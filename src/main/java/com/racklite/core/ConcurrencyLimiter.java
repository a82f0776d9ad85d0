package com.racklite.core;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import io.vertx.core.Vertx;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;

import java.util.Iterator;

import java.util.Queue;

import java.util.function.Supplier;

/**
 * Bounded async task runner.

 * At most maxConcurrent submitted tasks run at once; the rest wait in a FIFO
 * queue and start as running tasks complete. Tasks are Future suppliers, so a
 * "running" task holds a permit until its Future completes, not a thread.

 * Used twice: hosts per scan are drained lazily from the subnet iterator, ports
 * per host are submitted up front.

 * Queued tasks are started through runOnContext so long queues of tasks
 * that complete synchronously do not grow the stack.
 */
public class ConcurrencyLimiter
{

    private static final Logger logger = LoggerFactory.getLogger(ConcurrencyLimiter.class);

    private final Vertx vertx;

    private final int maxConcurrent;

    private final Queue<Runnable> waiting = new ArrayDeque<>();

    private int running;

    private int peakRunning;

    /**
     * Constructs a limiter.
     *
     * @param vertx Vert.x instance used to start queued tasks
     * @param maxConcurrent Maximum number of tasks in flight (values below 1 become 1)
     */
    public ConcurrencyLimiter(Vertx vertx, int maxConcurrent)
    {
        this.vertx = vertx;

        this.maxConcurrent = Math.max(1, maxConcurrent);
    }

    /**
     * Submits a task. It starts immediately if a permit is free, otherwise when one is released.
     *
     * @param task Supplier of the task's Future; exceptions thrown by the supplier fail the result
     * @param <T> Result type
     * @return Future completing with the task's outcome
     */
    public <T> Future<T> submit(Supplier<Future<T>> task)
    {
        var promise = Promise.<T>promise();

        Runnable start = () -> run(task, promise);

        var startNow = false;

        synchronized (this)
        {
            if (running < maxConcurrent)
            {
                running++;

                peakRunning = Math.max(peakRunning, running);

                startNow = true;
            }
            else
            {
                waiting.add(start);
            }
        }

        if (startNow)
        {
            start.run();
        }

        return promise.future();
    }

    /**
     * Runs tasks pulled one at a time from an iterator. The iterator is only advanced when a
     * permit is free, so the queue never holds more than maxConcurrent tasks however long the
     * iterator is. Failed tasks do not stop the run.
     *
     * @param tasks Lazily produced tasks; hasNext() returning false ends the run
     * @return Future completing once the iterator is exhausted and every pulled task has finished
     */
    public Future<Void> drain(Iterator<Supplier<Future<Void>>> tasks)
    {
        var feeder = new Feeder(tasks);

        for (var i = 0; i < maxConcurrent; i++)
        {
            feeder.pull();
        }

        return feeder.done.future();
    }

    private <T> void run(Supplier<Future<T>> task, Promise<T> promise)
    {
        Future<T> future;

        try
        {
            future = task.get();
        }
        catch (Exception exception)
        {
            logger.debug("Limited task failed to start: {}", exception.getMessage());

            future = Future.failedFuture(exception);
        }

        if (future == null)
        {
            future = Future.failedFuture(new IllegalStateException("Limited task returned no future"));
        }

        future.onComplete(result ->
        {
            release();

            promise.handle(result);
        });
    }

    private void release()
    {
        Runnable next;

        synchronized (this)
        {
            next = waiting.poll();

            if (next == null)
            {
                running--;
            }
            else
            {
                peakRunning = Math.max(peakRunning, running);
            }
        }

        if (next != null)
        {
            vertx.runOnContext(v -> next.run());
        }
    }

    /**
     * Highest number of tasks observed in flight at once.
     *
     * @return peak concurrency
     */
    public synchronized int peakRunning()
    {
        return peakRunning;
    }

    public synchronized int waitingCount()
    {
        return waiting.size();
    }

    /**
     * Pulls the next task when one finishes; completion is scheduled through runOnContext
     * so tasks that complete synchronously do not recurse.
     */
    private final class Feeder
    {

        private final Iterator<Supplier<Future<Void>>> tasks;

        private final Promise<Void> done = Promise.promise();

        private int outstanding;

        private boolean exhausted;

        private Feeder(Iterator<Supplier<Future<Void>>> tasks)
        {
            this.tasks = tasks;
        }

        private void pull()
        {
            Supplier<Future<Void>> task = null;

            var finished = false;

            synchronized (this)
            {
                if (exhausted)
                {
                    return;
                }

                if (tasks.hasNext())
                {
                    task = tasks.next();

                    outstanding++;
                }
                else
                {
                    exhausted = true;

                    finished = outstanding == 0;
                }
            }

            if (task == null)
            {
                if (finished)
                {
                    done.tryComplete();
                }

                return;
            }

            submit(task).onComplete(result ->
            {
                boolean last;

                synchronized (this)
                {
                    outstanding--;

                    last = exhausted && outstanding == 0;
                }

                if (last)
                {
                    done.tryComplete();
                }
                else
                {
                    vertx.runOnContext(v -> pull());
                }
            });
        }
    }
}
