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

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An absolute point in time, generally for tracking when a call should be considered to have timed
 * out. Relative to a {@link Ticker}, so deadlines created by different tickers are not comparable.
 * 截止时间，用于判断调用是否超时，基于 Ticker 计算，不同 Ticker 创建的截止时间不可比较
 */
@Immutable
public final class Deadline implements Comparable<Deadline> {

    private static final SystemTicker SYSTEM_TICKER = new SystemTicker();

    // 限制偏移量，避免与 nanoTime 相加时溢出
    private static final long MAX_OFFSET = TimeUnit.DAYS.toNanos(100 * 365);
    private static final long MIN_OFFSET = -MAX_OFFSET;

    private final Ticker ticker;
    private final long deadlineNanos;
    private volatile boolean expired;

    /**
     * Returns the ticker backed by {@link System#nanoTime}.
     */
    public static Ticker getSystemTicker() {
        return SYSTEM_TICKER;
    }

    /**
     * Create a deadline that will expire at the specified offset based on the system ticker.
     * 创建基于系统时间的截止时间
     *
     * @param duration A non-negative duration.
     * @param units    The time unit for the duration.
     * @return A new deadline.
     */
    public static Deadline after(long duration, TimeUnit units) {
        return after(duration, units, SYSTEM_TICKER);
    }

    /**
     * Create a deadline that will expire at the specified offset based on the given {@link Ticker}.
     * 使用指定的 Ticker 创建截止时间
     */
    public static Deadline after(long duration, TimeUnit units, Ticker ticker) {
        checkNotNull(units, "units");
        return new Deadline(ticker, units.toNanos(duration), true);
    }

    private Deadline(Ticker ticker, long offset, boolean baseInstantAlreadyExpired) {
        this(ticker, ticker.nanoTime(), offset, baseInstantAlreadyExpired);
    }

    private Deadline(Ticker ticker, long baseInstant, long offset,
                     boolean baseInstantAlreadyExpired) {
        this.ticker = checkNotNull(ticker, "ticker");
        // Clamp to range [MIN_OFFSET, MAX_OFFSET]
        offset = Math.min(MAX_OFFSET, Math.max(MIN_OFFSET, offset));
        deadlineNanos = baseInstant + offset;
        expired = baseInstantAlreadyExpired && offset <= 0;
    }

    /**
     * Has this deadline expired.
     * 是否已经过期
     */
    public boolean isExpired() {
        if (!expired) {
            if (deadlineNanos - ticker.nanoTime() <= 0) {
                expired = true;
            } else {
                return false;
            }
        }
        return true;
    }

    /**
     * Is {@code this} deadline before another.
     */
    public boolean isBefore(Deadline other) {
        checkTicker(other);
        return this.deadlineNanos - other.deadlineNanos < 0;
    }

    /**
     * Return the minimum deadline of {@code this} or an other deadline.
     * 返回两个截止时间中较早的一个
     */
    public Deadline minimum(Deadline other) {
        checkTicker(other);
        return isBefore(other) ? this : other;
    }

    /**
     * Create a new deadline that is offset from {@code this}.
     */
    public Deadline offset(long offset, TimeUnit units) {
        if (offset == 0) {
            return this;
        }
        return new Deadline(ticker, deadlineNanos, units.toNanos(offset), isExpired());
    }

    /**
     * How much time is remaining in the specified time unit. Internal units are maintained as
     * nanoseconds and conversions are subject to the constraints documented for
     * {@link TimeUnit#convert}. If there is no time remaining, the returned duration is how
     * long ago the deadline expired.
     * 剩余时间，过期后返回负数
     */
    public long timeRemaining(TimeUnit unit) {
        final long nowNanos = ticker.nanoTime();
        if (!expired && deadlineNanos - nowNanos <= 0) {
            expired = true;
        }
        return unit.convert(deadlineNanos - nowNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Schedule a task to be run when the deadline expires.
     * 在截止时间到达时执行任务
     *
     * @param task      to run on expiration
     * @param scheduler used to execute the task
     * @return {@link ScheduledFuture} which can be used to cancel execution of the task
     */
    public ScheduledFuture<?> runOnExpiration(Runnable task, ScheduledExecutorService scheduler) {
        checkNotNull(task, "task");
        checkNotNull(scheduler, "scheduler");
        return scheduler.schedule(task, deadlineNanos - ticker.nanoTime(), TimeUnit.NANOSECONDS);
    }

    @Override
    public String toString() {
        long remainingNanos = timeRemaining(TimeUnit.NANOSECONDS);
        long seconds = Math.abs(remainingNanos) / TimeUnit.SECONDS.toNanos(1);
        long nanos = Math.abs(remainingNanos) % TimeUnit.SECONDS.toNanos(1);

        StringBuilder buf = new StringBuilder();
        if (remainingNanos < 0) {
            buf.append('-');
        }
        buf.append(seconds);
        if (nanos > 0) {
            buf.append(String.format(".%09d", nanos));
        }
        buf.append("s from now");
        if (ticker != SYSTEM_TICKER) {
            buf.append(" (ticker=").append(ticker).append(")");
        }
        return buf.toString();
    }

    @Override
    public int compareTo(Deadline that) {
        checkTicker(that);
        long diff = this.deadlineNanos - that.deadlineNanos;
        if (diff < 0) {
            return -1;
        } else if (diff > 0) {
            return 1;
        }
        return 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(ticker, deadlineNanos);
    }

    @Override
    public boolean equals(final Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof Deadline)) {
            return false;
        }
        final Deadline other = (Deadline) o;
        if (this.ticker != other.ticker) {
            return false;
        }
        return this.deadlineNanos == other.deadlineNanos;
    }

    private void checkTicker(Deadline other) {
        checkArgument(ticker == other.ticker,
                "Tickers (%s and %s) don't match. Custom Ticker should only be used in tests!",
                ticker, other.ticker);
    }

    /**
     * Time source representing nanoseconds since fixed but arbitrary point in time.
     * 纳秒级的时间源
     *
     * <p>In general implementations should be thread-safe, unless it's implemented and used in a
     * localized environment (like unit tests) where you are sure the usages are synchronized.
     */
    public abstract static class Ticker {
        /**
         * Returns the number of nanoseconds since this source's epoch.
         */
        public abstract long nanoTime();
    }

    private static class SystemTicker extends Ticker {
        @Override
        public long nanoTime() {
            return System.nanoTime();
        }
    }
}
