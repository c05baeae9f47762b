/*
 * Copyright 2021 The gRPC Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.conduit.testing;

import com.google.common.base.Ticker;
import com.google.common.util.concurrent.AbstractFuture;
import io.conduit.Deadline;

import javax.annotation.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A manipulated clock that exports a {@link Deadline.Ticker}, a Guava {@link Ticker} and a
 * {@link ScheduledExecutorService}. Time only moves through {@link #forwardTime} and
 * {@link #forwardNanos}; due tasks run on the thread that moves it.
 * 可手动控制的时钟，提供 Ticker 和 ScheduledExecutorService，时间只在调用 forwardTime 时前进，
 * 到期的任务在调用线程上执行
 */
public final class FakeClock {

    private final ScheduledExecutorService scheduledExecutorService = new ScheduledExecutorImpl();

    private final Deadline.Ticker deadlineTicker = new Deadline.Ticker() {
        @Override
        public long nanoTime() {
            return currentTimeNanos();
        }
    };

    private final Ticker ticker = new Ticker() {
        @Override
        public long read() {
            return currentTimeNanos();
        }
    };

    @GuardedBy("this")
    private final PriorityQueue<ScheduledTask> tasks = new PriorityQueue<>();

    @GuardedBy("this")
    private long currentTimeNanos;

    @GuardedBy("this")
    private long sequence;

    /**
     * Executor driven by this clock. {@code shutdown} is accepted and ignored.
     */
    public ScheduledExecutorService getScheduledExecutorService() {
        return scheduledExecutorService;
    }

    public Deadline.Ticker getDeadlineTicker() {
        return deadlineTicker;
    }

    public Ticker getTicker() {
        return ticker;
    }

    public synchronized long currentTimeNanos() {
        return currentTimeNanos;
    }

    /**
     * Moves the clock forward and runs the tasks that became due.
     * 时间前进，并执行到期的任务
     *
     * @return the number of tasks run
     */
    public int forwardTime(long value, TimeUnit unit) {
        return forwardNanos(unit.toNanos(value));
    }

    public int forwardNanos(long nanos) {
        checkArgument(nanos >= 0, "time can only move forward");
        synchronized (this) {
            currentTimeNanos += nanos;
        }
        return runDueTasks();
    }

    /**
     * Runs every task whose due time is not after the current time, including tasks scheduled
     * by those tasks with no delay.
     * 执行所有已经到期的任务
     *
     * @return the number of tasks run
     */
    public int runDueTasks() {
        int count = 0;
        while (true) {
            ScheduledTask task;
            synchronized (this) {
                task = tasks.peek();
                if (task == null || task.dueTimeNanos > currentTimeNanos) {
                    break;
                }
                tasks.poll();
            }
            task.runTask();
            count++;
        }
        return count;
    }

    /**
     * Number of scheduled tasks not yet run or cancelled.
     * 还未执行且未取消的任务数量
     */
    public synchronized int numPendingTasks() {
        return tasks.size();
    }

    /**
     * Pending tasks ordered by due time.
     */
    public synchronized List<ScheduledFuture<?>> getPendingTasks() {
        List<ScheduledTask> sorted = new ArrayList<>(tasks);
        Collections.sort(sorted);
        return new ArrayList<ScheduledFuture<?>>(sorted);
    }

    private synchronized ScheduledTask add(ScheduledTask task) {
        tasks.add(task);
        return task;
    }

    private synchronized void remove(ScheduledTask task) {
        tasks.remove(task);
    }

    private final class ScheduledTask extends AbstractFuture<Object> implements ScheduledFuture<Object> {
        private final Runnable command;
        private final long periodNanos;
        private final long seq;
        private long dueTimeNanos;

        ScheduledTask(Runnable command, long dueTimeNanos, long periodNanos, long seq) {
            this.command = command;
            this.dueTimeNanos = dueTimeNanos;
            this.periodNanos = periodNanos;
            this.seq = seq;
        }

        void runTask() {
            if (isDone()) {
                return;
            }
            command.run();
            if (periodNanos > 0) {
                synchronized (FakeClock.this) {
                    dueTimeNanos += periodNanos;
                    tasks.add(this);
                }
            } else {
                set(null);
            }
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            remove(this);
            return super.cancel(mayInterruptIfRunning);
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(dueTimeNanos - currentTimeNanos(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            ScheduledTask that = (ScheduledTask) other;
            if (dueTimeNanos != that.dueTimeNanos) {
                return dueTimeNanos < that.dueTimeNanos ? -1 : 1;
            }
            return Long.compare(seq, that.seq);
        }

        @Override
        public String toString() {
            return "[due=" + dueTimeNanos + ", task=" + command + "]";
        }
    }

    private final class ScheduledExecutorImpl implements ScheduledExecutorService {

        private ScheduledTask newTask(Runnable command, long delayNanos, long periodNanos) {
            synchronized (FakeClock.this) {
                return add(new ScheduledTask(command, currentTimeNanos + delayNanos, periodNanos, sequence++));
            }
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            return newTask(command, unit.toNanos(delay), 0);
        }

        @Override
        public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
            throw new UnsupportedOperationException();
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period,
                                                      TimeUnit unit) {
            checkArgument(period > 0, "period must be positive");
            return newTask(command, unit.toNanos(initialDelay), unit.toNanos(period));
        }

        @Override
        public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay, long delay,
                                                         TimeUnit unit) {
            // 任务在调用线程上同步执行，两种方式没有区别
            return scheduleAtFixedRate(command, initialDelay, delay, unit);
        }

        @Override
        public void execute(Runnable command) {
            // Runs the task on the next runDueTasks()
            schedule(command, 0, TimeUnit.NANOSECONDS);
        }

        @Override
        public void shutdown() {
        }

        @Override
        public List<Runnable> shutdownNow() {
            throw new UnsupportedOperationException();
        }

        @Override
        public boolean isShutdown() {
            return false;
        }

        @Override
        public boolean isTerminated() {
            return false;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            throw new UnsupportedOperationException();
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
            throw new UnsupportedOperationException();
        }

        @Override
        public <T> Future<T> submit(Runnable task, T result) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Future<?> submit(Runnable task) {
            throw new UnsupportedOperationException();
        }

        @Override
        public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks) {
            throw new UnsupportedOperationException();
        }

        @Override
        public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks, long timeout,
                                             TimeUnit unit) {
            throw new UnsupportedOperationException();
        }

        @Override
        public <T> T invokeAny(Collection<? extends Callable<T>> tasks)
                throws ExecutionException {
            throw new UnsupportedOperationException();
        }

        @Override
        public <T> T invokeAny(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
                throws ExecutionException, TimeoutException {
            throw new UnsupportedOperationException();
        }
    }
}
