package org.abstractica.sockjs.impl.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SerialExecutor}.
 */
class SerialExecutorTest
{
    private ExecutorService pool;

    @BeforeEach
    void setUp()
    {
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown()
    {
        pool.shutdownNow();
    }

    @Test
    void execute_runsTasksInSubmissionOrder() throws Exception
    {
        SerialExecutor mailbox = new SerialExecutor(pool, "test");
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch done = new CountDownLatch(1);

        for (int i = 0; i < 1000; i++)
        {
            int n = i;
            mailbox.execute(() -> seen.add(n));
        }
        mailbox.execute(done::countDown);

        assertTrue(done.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 1000; i++)
        {
            assertEquals(i, seen.get(i));
        }
    }

    @Test
    void execute_neverRunsTwoTasksAtOnce() throws Exception
    {
        SerialExecutor mailbox = new SerialExecutor(pool, "test");
        AtomicInteger active = new AtomicInteger();
        AtomicInteger overlaps = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(200);

        for (int i = 0; i < 200; i++)
        {
            pool.execute(() -> mailbox.execute(() ->
            {
                if (active.incrementAndGet() > 1)
                {
                    overlaps.incrementAndGet();
                }
                active.decrementAndGet();
                done.countDown();
            }));
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(0, overlaps.get());
    }

    @Test
    void execute_reentrantSubmission_runsAfterCurrentTask()
    {
        SerialExecutor mailbox = new SerialExecutor(Runnable::run, "test");
        List<String> seen = new ArrayList<>();

        mailbox.execute(() ->
        {
            mailbox.execute(() -> seen.add("inner"));
            seen.add("outer");
        });

        assertEquals(List.of("outer", "inner"), seen);
    }

    @Test
    void execute_failingTask_doesNotStopMailbox()
    {
        SerialExecutor mailbox = new SerialExecutor(Runnable::run, "test");
        List<String> seen = new ArrayList<>();

        mailbox.execute(() ->
        {
            throw new IllegalStateException("boom");
        });
        mailbox.execute(() -> seen.add("after"));

        assertEquals(List.of("after"), seen);
        assertEquals(0, mailbox.pendingTasks());
    }

    @Test
    void execute_rejectedByExecutor_propagatesAndRecovers()
    {
        ExecutorService dead = Executors.newSingleThreadExecutor();
        dead.shutdown();
        SerialExecutor mailbox = new SerialExecutor(dead, "test");

        assertThrows(RejectedExecutionException.class, () -> mailbox.execute(() -> {}));
        assertEquals(0, mailbox.pendingTasks());
        assertThrows(RejectedExecutionException.class, () -> mailbox.execute(() -> {}));
    }
}
