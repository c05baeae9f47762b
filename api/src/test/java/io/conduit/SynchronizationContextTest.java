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

package io.conduit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SynchronizationContextTest {

    private final List<Throwable> uncaught = new ArrayList<>();
    private final SynchronizationContext syncContext = new SynchronizationContext(
            new Thread.UncaughtExceptionHandler() {
                @Override
                public void uncaughtException(Thread t, Throwable e) {
                    uncaught.add(e);
                }
            });
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    @Test
    void nestedTasksRunAfterCurrentTask() {
        final List<String> order = new ArrayList<>();
        syncContext.execute(new Runnable() {
            @Override
            public void run() {
                order.add("outer start");
                syncContext.execute(new Runnable() {
                    @Override
                    public void run() {
                        order.add("inner");
                    }
                });
                order.add("outer end");
            }
        });

        assertEquals(3, order.size());
        assertEquals("outer start", order.get(0));
        assertEquals("outer end", order.get(1));
        assertEquals("inner", order.get(2));
    }

    @Test
    void executeLaterWaitsForDrain() {
        final List<String> order = new ArrayList<>();
        syncContext.executeLater(new Runnable() {
            @Override
            public void run() {
                order.add("later");
            }
        });
        assertTrue(order.isEmpty());

        syncContext.drain();
        assertEquals(1, order.size());
    }

    @Test
    void failingTaskGoesToHandlerAndQueueContinues() {
        final List<String> order = new ArrayList<>();
        syncContext.executeLater(new Runnable() {
            @Override
            public void run() {
                throw new IllegalStateException("boom");
            }
        });
        syncContext.execute(new Runnable() {
            @Override
            public void run() {
                order.add("after");
            }
        });

        assertEquals(1, uncaught.size());
        assertEquals("boom", uncaught.get(0).getMessage());
        assertEquals(1, order.size());
    }

    @Test
    void throwIfNotInContext() {
        assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() {
                syncContext.throwIfNotInThisSynchronizationContext();
            }
        });
        syncContext.execute(new Runnable() {
            @Override
            public void run() {
                syncContext.throwIfNotInThisSynchronizationContext();
            }
        });
        assertTrue(uncaught.isEmpty());
    }

    @Test
    void scheduledTaskRunsInContextAndCanBeCancelled() throws Exception {
        final CountDownLatch ran = new CountDownLatch(1);
        SynchronizationContext.ScheduledHandle handle = syncContext.schedule(new Runnable() {
            @Override
            public void run() {
                syncContext.throwIfNotInThisSynchronizationContext();
                ran.countDown();
            }
        }, 10, TimeUnit.MILLISECONDS, timer);
        assertTrue(ran.await(5, TimeUnit.SECONDS));
        assertFalse(handle.isPending());

        final List<String> cancelledRuns = new ArrayList<>();
        SynchronizationContext.ScheduledHandle cancelled = syncContext.schedule(new Runnable() {
            @Override
            public void run() {
                cancelledRuns.add("ran");
            }
        }, 1, TimeUnit.HOURS, timer);
        assertTrue(cancelled.isPending());
        cancelled.cancel();
        assertFalse(cancelled.isPending());
        assertTrue(cancelledRuns.isEmpty());
        assertTrue(uncaught.isEmpty());
    }
}
