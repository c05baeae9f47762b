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

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.conduit.CompressorRegistry;
import io.conduit.DecompressorRegistry;
import io.conduit.ManagedChannel;

import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The base class for channel builders.
 * Channel 构建器的基类
 *
 * @param <T> The concrete type of this builder.
 */
public abstract class AbstractChannelBuilder<T extends AbstractChannelBuilder<T>> {

    private static final DecompressorRegistry DEFAULT_DECOMPRESSOR_REGISTRY = DecompressorRegistry.getDefaultInstance();

    private static final CompressorRegistry DEFAULT_COMPRESSOR_REGISTRY = CompressorRegistry.getDefaultInstance();

    @Nullable
    Executor executor;

    @Nullable
    ScheduledExecutorService scheduledExecutorService;

    @Nullable
    String userAgent;

    @Nullable
    String authorityOverride;

    DecompressorRegistry decompressorRegistry = DEFAULT_DECOMPRESSOR_REGISTRY;

    CompressorRegistry compressorRegistry = DEFAULT_COMPRESSOR_REGISTRY;

    List<String> compressionPreference = ImmutableList.of();

    int maxInboundMessageSize = GrpcUtil.DEFAULT_MAX_MESSAGE_SIZE;

    @SuppressWarnings("unchecked")
    private T thisT() {
        return (T) this;
    }

    /**
     * 使用直接执行器执行回调
     */
    @CanIgnoreReturnValue
    public final T directExecutor() {
        return executor(MoreExecutors.directExecutor());
    }

    /**
     * Provides a custom executor for listener callbacks. The channel does not take ownership of the
     * given executor.
     * 设置执行回调的线程池，Channel 不负责关闭
     */
    @CanIgnoreReturnValue
    public final T executor(Executor executor) {
        this.executor = checkNotNull(executor, "executor");
        return thisT();
    }

    /**
     * Provides the scheduler for deadlines and reconnect backoff. The channel does not take
     * ownership of the given scheduler.
     * 设置用于超时和重连退避的调度器，Channel 不负责关闭
     */
    @CanIgnoreReturnValue
    public final T scheduledExecutorService(ScheduledExecutorService scheduledExecutorService) {
        this.scheduledExecutorService = checkNotNull(scheduledExecutorService, "scheduledExecutorService");
        return thisT();
    }

    @CanIgnoreReturnValue
    public final T decompressorRegistry(DecompressorRegistry registry) {
        this.decompressorRegistry = registry != null ? registry : DEFAULT_DECOMPRESSOR_REGISTRY;
        return thisT();
    }

    @CanIgnoreReturnValue
    public final T compressorRegistry(CompressorRegistry registry) {
        this.compressorRegistry = registry != null ? registry : DEFAULT_COMPRESSOR_REGISTRY;
        return thisT();
    }

    /**
     * Ordered encodings this channel would like to use for requests, when the server supports them.
     * 请求使用的编码偏好，按顺序协商
     */
    @CanIgnoreReturnValue
    public final T compressionPreference(List<String> encodings) {
        this.compressionPreference = ImmutableList.copyOf(encodings);
        return thisT();
    }

    @CanIgnoreReturnValue
    public final T userAgent(@Nullable String userAgent) {
        this.userAgent = userAgent;
        return thisT();
    }

    /**
     * Overrides the authority sent as {@code :authority} on every call.
     */
    @CanIgnoreReturnValue
    public final T overrideAuthority(String authority) {
        this.authorityOverride = checkNotNull(authority, "authority");
        return thisT();
    }

    @CanIgnoreReturnValue
    public T maxInboundMessageSize(int max) {
        checkArgument(max >= 0, "negative max");
        maxInboundMessageSize = max;
        return thisT();
    }

    /**
     * 构建压缩协商
     */
    protected final CompressionNegotiator buildCompressionNegotiator() {
        return new CompressionNegotiator(compressionPreference, compressorRegistry, decompressorRegistry);
    }

    /**
     * Returns a new cached pool owned by the channel, or {@code null} when an executor was
     * configured.
     * 没有设置线程池时，创建由 Channel 持有的线程池
     */
    @Nullable
    protected final ExecutorService newOwnedExecutorIfAbsent(String name) {
        if (executor != null) {
            return null;
        }
        return Executors.newCachedThreadPool(GrpcUtil.getThreadFactory(name + "-%d", true));
    }

    /**
     * Returns a new single-threaded scheduler owned by the channel, or {@code null} when one was
     * configured.
     */
    @Nullable
    protected final ScheduledExecutorService newOwnedSchedulerIfAbsent(String name) {
        if (scheduledExecutorService != null) {
            return null;
        }
        return Executors.newSingleThreadScheduledExecutor(GrpcUtil.getThreadFactory(name + "-timer-%d", true));
    }

    @Nullable
    protected final Executor getExecutor() {
        return executor;
    }

    @Nullable
    protected final ScheduledExecutorService getScheduledExecutorService() {
        return scheduledExecutorService;
    }

    @Nullable
    protected final String getUserAgent() {
        return userAgent;
    }

    @Nullable
    protected final String getAuthorityOverride() {
        return authorityOverride;
    }

    protected final CompressorRegistry getCompressorRegistry() {
        return compressorRegistry;
    }

    protected final DecompressorRegistry getDecompressorRegistry() {
        return decompressorRegistry;
    }

    protected final List<String> getCompressionPreference() {
        return compressionPreference;
    }

    protected final int getMaxInboundMessageSize() {
        return maxInboundMessageSize;
    }

    /**
     * Builds a channel using the given parameters.
     */
    public abstract ManagedChannel build();
}
