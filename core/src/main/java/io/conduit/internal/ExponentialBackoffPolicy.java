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

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import java.util.Random;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Retry Policy for Transport reconnection.  Initial parameters from
 * https://github.com/grpc/grpc/blob/master/doc/connection-backoff.md
 * 指数退避的重试策略
 *
 * <p>The delay grows by {@code multiplier} after every attempt up to {@code maxBackoff}, each
 * value spread by {@code jitter} in both directions.
 * 每次重试后延迟乘以 multiplier，直到 maxBackoff，每个值会按 jitter 上下浮动
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {

    public static final class Provider implements BackoffPolicy.Provider {

        private long initialBackoffNanos = TimeUnit.SECONDS.toNanos(1);
        private long maxBackoffNanos = TimeUnit.MINUTES.toNanos(2);
        private double multiplier = 1.6;
        private double jitter = .2;

        @CanIgnoreReturnValue
        public Provider setInitialBackoffNanos(long initialBackoffNanos) {
            checkArgument(initialBackoffNanos > 0, "initialBackoffNanos must be positive");
            this.initialBackoffNanos = initialBackoffNanos;
            return this;
        }

        @CanIgnoreReturnValue
        public Provider setMaxBackoffNanos(long maxBackoffNanos) {
            checkArgument(maxBackoffNanos > 0, "maxBackoffNanos must be positive");
            this.maxBackoffNanos = maxBackoffNanos;
            return this;
        }

        @CanIgnoreReturnValue
        public Provider setMultiplier(double multiplier) {
            checkArgument(multiplier >= 1, "multiplier must be at least 1");
            this.multiplier = multiplier;
            return this;
        }

        @CanIgnoreReturnValue
        public Provider setJitter(double jitter) {
            checkArgument(jitter >= 0 && jitter < 1, "jitter must be in [0, 1)");
            this.jitter = jitter;
            return this;
        }

        public long getMaxBackoffNanos() {
            return maxBackoffNanos;
        }

        @Override
        public BackoffPolicy get() {
            return new ExponentialBackoffPolicy(new Random(), initialBackoffNanos, maxBackoffNanos,
                    multiplier, jitter);
        }
    }

    private final Random random;
    private final long maxBackoffNanos;
    private final double multiplier;
    private final double jitter;

    private long nextBackoffNanos;

    @VisibleForTesting
    ExponentialBackoffPolicy(Random random, long initialBackoffNanos, long maxBackoffNanos,
                             double multiplier, double jitter) {
        this.random = random;
        this.nextBackoffNanos = initialBackoffNanos;
        this.maxBackoffNanos = maxBackoffNanos;
        this.multiplier = multiplier;
        this.jitter = jitter;
    }

    @Override
    public long nextBackoffNanos() {
        long currentBackoffNanos = nextBackoffNanos;
        nextBackoffNanos = Math.min((long) (currentBackoffNanos * multiplier), maxBackoffNanos);
        return currentBackoffNanos
                + uniformRandom(-jitter * currentBackoffNanos, jitter * currentBackoffNanos);
    }

    private long uniformRandom(double low, double high) {
        checkArgument(high >= low);
        double mag = high - low;
        return (long) (random.nextDouble() * mag + low);
    }
}
