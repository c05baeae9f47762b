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

import com.google.common.base.MoreObjects;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The collection of runtime options for a new RPC call.
 * 一次调用的运行时配置
 *
 * <p>A field that is not set is {@code null}. Instances are immutable, every {@code withXxx} method
 * returns a modified copy.
 * 未设置的字段为 null，实例不可变，withXxx 方法返回修改后的副本
 */
@Immutable
@CheckReturnValue
public final class CallOptions {

    /**
     * A blank {@code CallOptions} that all fields are not set.
     */
    public static final CallOptions DEFAULT = new CallOptions();

    @Nullable
    private Deadline deadline;

    @Nullable
    private Executor executor;

    @Nullable
    private String authority;

    @Nullable
    private String compressorName;

    @Nullable
    private Integer maxInboundMessageSize;

    @Nullable
    private Integer maxOutboundMessageSize;

    private CallOptions() {
    }

    /**
     * Copy constructor.
     */
    private CallOptions(CallOptions other) {
        deadline = other.deadline;
        executor = other.executor;
        authority = other.authority;
        compressorName = other.compressorName;
        maxInboundMessageSize = other.maxInboundMessageSize;
        maxOutboundMessageSize = other.maxOutboundMessageSize;
    }

    /**
     * Override the HTTP/2 authority the channel claims to be connecting to. The authority is also
     * the input of route matching.
     * 覆盖调用的 authority，也用于路由匹配
     */
    public CallOptions withAuthority(@Nullable String authority) {
        CallOptions newOptions = new CallOptions(this);
        newOptions.authority = authority;
        return newOptions;
    }

    /**
     * Sets the compression to use for the call. The compressor must be a valid name registered in
     * the {@link CompressorRegistry}. Setting it overrides the negotiated compression.
     * 指定压缩方式，会覆盖协商的结果
     */
    public CallOptions withCompression(@Nullable String compressorName) {
        CallOptions newOptions = new CallOptions(this);
        newOptions.compressorName = compressorName;
        return newOptions;
    }

    /**
     * Returns a new {@code CallOptions} with the given absolute deadline.
     * 使用指定的截止时间
     *
     * @param deadline the deadline or {@code null} for unsetting the deadline.
     */
    public CallOptions withDeadline(@Nullable Deadline deadline) {
        CallOptions newOptions = new CallOptions(this);
        newOptions.deadline = deadline;
        return newOptions;
    }

    /**
     * Returns a new {@code CallOptions} with a deadline that is after the given {@code duration}
     * from now.
     */
    public CallOptions withDeadlineAfter(long duration, TimeUnit unit) {
        return withDeadline(Deadline.after(duration, unit));
    }

    /**
     * Returns the deadline or {@code null} if the deadline is not set.
     */
    @Nullable
    public Deadline getDeadline() {
        return deadline;
    }

    /**
     * Returns a new {@code CallOptions} with {@code executor} to be used instead of the default
     * executor specified with the channel.
     * 使用指定的执行器代替 Channel 的默认执行器
     */
    public CallOptions withExecutor(@Nullable Executor executor) {
        CallOptions newOptions = new CallOptions(this);
        newOptions.executor = executor;
        return newOptions;
    }

    /**
     * Sets the maximum allowed message size acceptable from the remote peer. If unset, this will
     * default to the value set on the channel.
     * 接收消息的最大字节数
     */
    public CallOptions withMaxInboundMessageSize(int maxSize) {
        checkArgument(maxSize >= 0, "invalid maxsize %s", maxSize);
        CallOptions newOptions = new CallOptions(this);
        newOptions.maxInboundMessageSize = maxSize;
        return newOptions;
    }

    /**
     * Sets the maximum allowed message size acceptable sent to the remote peer.
     * 发送消息的最大字节数
     */
    public CallOptions withMaxOutboundMessageSize(int maxSize) {
        checkArgument(maxSize >= 0, "invalid maxsize %s", maxSize);
        CallOptions newOptions = new CallOptions(this);
        newOptions.maxOutboundMessageSize = maxSize;
        return newOptions;
    }

    @Nullable
    public String getAuthority() {
        return authority;
    }

    @Nullable
    public String getCompressor() {
        return compressorName;
    }

    @Nullable
    public Executor getExecutor() {
        return executor;
    }

    @Nullable
    public Integer getMaxInboundMessageSize() {
        return maxInboundMessageSize;
    }

    @Nullable
    public Integer getMaxOutboundMessageSize() {
        return maxOutboundMessageSize;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("deadline", deadline)
                .add("authority", authority)
                .add("executor", executor != null ? executor.getClass() : null)
                .add("compressorName", compressorName)
                .add("maxInboundMessageSize", maxInboundMessageSize)
                .add("maxOutboundMessageSize", maxOutboundMessageSize)
                .toString();
    }
}
