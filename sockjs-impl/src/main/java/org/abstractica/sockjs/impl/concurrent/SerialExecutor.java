package org.abstractica.sockjs.impl.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * A mailbox that runs submitted tasks one at a time, in submission order,
 * on a shared executor.
 *
 * <p>Tasks submitted to the same SerialExecutor never overlap, so state
 * touched only from its tasks needs no locking. Different SerialExecutors
 * sharing one pool run in parallel.</p>
 *
 * <p>A task that throws is logged and does not stop the mailbox.</p>
 */
public final class SerialExecutor implements Executor
{
    private static final Logger LOG = LoggerFactory.getLogger(SerialExecutor.class);

    private final Executor executor;
    private final String name;
    private final Queue<Runnable> tasks;
    private boolean draining;

    /**
     * Creates a mailbox on the given executor.
     *
     * @param executor the executor that runs the drain loop
     * @param name     mailbox name used in log messages
     */
    public SerialExecutor(Executor executor, String name)
    {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.name = Objects.requireNonNull(name, "name");
        this.tasks = new ArrayDeque<>();
        this.draining = false;
    }

    /**
     * Enqueues a task.
     *
     * @param task the task to run
     * @throws RejectedExecutionException if the underlying executor rejects the drain loop
     */
    @Override
    public void execute(Runnable task)
    {
        Objects.requireNonNull(task, "task");

        synchronized (tasks)
        {
            tasks.add(task);
            if (draining)
            {
                return;
            }
            draining = true;
        }

        try
        {
            executor.execute(this::drain);
        }
        catch (RejectedExecutionException e)
        {
            synchronized (tasks)
            {
                tasks.remove(task);
                draining = false;
            }
            throw e;
        }
    }

    /**
     * Returns the number of tasks waiting to run.
     *
     * @return pending task count
     */
    public int pendingTasks()
    {
        synchronized (tasks)
        {
            return tasks.size();
        }
    }

    private void drain()
    {
        while (true)
        {
            Runnable next;
            synchronized (tasks)
            {
                next = tasks.poll();
                if (next == null)
                {
                    draining = false;
                    return;
                }
            }

            try
            {
                next.run();
            }
            catch (Exception e)
            {
                LOG.error("Task failed in mailbox {}", name, e);
            }
        }
    }

    @Override
    public String toString()
    {
        return "SerialExecutor[" + name + "]";
    }
}
