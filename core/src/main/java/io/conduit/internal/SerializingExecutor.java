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

package io.conduit.internal;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Executor ensuring that all {@link Runnable} tasks submitted are executed in order
 * using the provided {@link Executor}, and serially such that no two will ever be
 * running at the same time.
 * 保证提交的任务按顺序串行执行，同一时间只有一个任务在执行
 */
public final class SerializingExecutor implements Executor, Runnable {

    private static final Logger log = Logger.getLogger(SerializingExecutor.class.getName());

    private static final int STOPPED = 0;
    private static final int RUNNING = -1;

    private static final AtomicIntegerFieldUpdater<SerializingExecutor> RUN_STATE_UPDATER =
            AtomicIntegerFieldUpdater.newUpdater(SerializingExecutor.class, "runState");

    /**
     * Underlying executor that all submitted Runnable objects are run on.
     * 底层执行任务的线程池
     */
    private Executor executor;

    /**
     * A list of Runnables to be run in order.
     * 按顺序执行的任务队列
     */
    private final Queue<Runnable> runQueue = new ConcurrentLinkedQueue<>();

    private volatile int runState = STOPPED;

    /**
     * Creates a SerializingExecutor, running tasks using {@code executor}.
     *
     * @param executor Executor in which tasks should be run. Must not be null.
     */
    public SerializingExecutor(Executor executor) {
        this.executor = checkNotNull(executor, "'executor' must not be null.");
    }

    /**
     * Only call this from this SerializingExecutor Runnable, so that the executor is immediately
     * visible to this SerializingExecutor executor.
     * 替换底层的线程池，只能在任务中调用
     */
    public void setExecutor(Executor executor) {
        checkNotNull(executor, "'executor' must not be null.");
        this.executor = executor;
    }

    /**
     * Runs the given runnable strictly after all Runnables that were submitted
     * before it, and using the {@code executor} passed to the constructor.
     * 在之前提交的任务执行完成后执行指定的任务
     */
    @Override
    public void execute(Runnable r) {
        runQueue.add(checkNotNull(r, "'r' must not be null."));
        schedule(r);
    }

    private void schedule(Runnable removable) {
        if (RUN_STATE_UPDATER.compareAndSet(this, STOPPED, RUNNING)) {
            boolean success = false;
            try {
                executor.execute(this);
                success = true;
            } finally {
                // It is possible that at this point that there are still tasks in
                // the queue, it would be nice to keep trying but the error may not
                // be recoverable.  So we update our state and propagate so that if
                // our caller deems it recoverable we won't be stuck.
                if (!success) {
                    if (removable != null) {
                        // This case can only be reached if 'this' was not currently running, and we failed to
                        // reschedule.  The item should still be in the queue for removal.
                        // ConcurrentLinkedQueue claims that null elements are not allowed, but seems to not
                        // throw if the item to remove is null.  If removable is present in the queue twice,
                        // the wrong one may be removed.  It doesn't seem possible for this case to exist today.
                        // This is important to run in case of RejectedExecutionException, so that future calls
                        // to execute don't succeed and accidentally run a previous runnable.
                        runQueue.remove(removable);
                    }
                    RUN_STATE_UPDATER.set(this, STOPPED);
                }
            }
        }
    }

    @Override
    public void run() {
        Runnable r;
        try {
            Executor oldExecutor = executor;
            while (oldExecutor == executor && (r = runQueue.poll()) != null) {
                try {
                    r.run();
                } catch (RuntimeException e) {
                    // Log it and keep going.
                    // 记录异常并继续执行
                    log.log(Level.SEVERE, "Exception while executing runnable " + r, e);
                }
            }
        } finally {
            RUN_STATE_UPDATER.set(this, STOPPED);
        }
        if (!runQueue.isEmpty()) {
            // we didn't enqueue anything but someone else did.
            schedule(null);
        }
    }
}
