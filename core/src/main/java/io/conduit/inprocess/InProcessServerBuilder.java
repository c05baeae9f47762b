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

package io.conduit.inprocess;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.conduit.CompressorRegistry;
import io.conduit.DecompressorRegistry;
import io.conduit.HandlerRegistry;
import io.conduit.ServerServiceDefinition;
import io.conduit.internal.CompressionNegotiator;
import io.conduit.internal.GrpcUtil;
import io.conduit.internal.ServerCallDispatcher;
import io.conduit.util.MutableHandlerRegistry;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Builder for a server that services in-process requests. Clients identify the in-process server
 * by its name.
 * 用于构建进程内 Server 的构建器，客户端通过名称访问
 *
 * <p>The server is intended to be fully-featured, high performance, and useful in testing.
 *
 * <p>Example:
 * <pre>{@code
 * String uniqueName = InProcessServerBuilder.generateName();
 * InProcessServer server = InProcessServerBuilder.forName(uniqueName)
 *     .directExecutor()
 *     .addService(serviceDefinition)
 *     .build().start();
 * ManagedChannel channel = InProcessChannelBuilder.forName(uniqueName)
 *     .directExecutor()
 *     .build();
 * }</pre>
 */
public final class InProcessServerBuilder {

    private final String name;
    private final MutableHandlerRegistry registry = new MutableHandlerRegistry();
    private HandlerRegistry fallbackRegistry = new MutableHandlerRegistry();
    private Executor executor;
    private ScheduledExecutorService deadlineExecutor;
    private boolean ignoreDeadlines;
    private CompressorRegistry compressorRegistry = CompressorRegistry.getDefaultInstance();
    private DecompressorRegistry decompressorRegistry = DecompressorRegistry.getDefaultInstance();
    private List<String> compressionPreference = ImmutableList.of();
    private int maxInboundMessageSize = GrpcUtil.DEFAULT_MAX_MESSAGE_SIZE;

    private InProcessServerBuilder(String name) {
        this.name = checkNotNull(name, "name");
    }

    /**
     * Create a server builder that will bind with the given name.
     * 使用指定的名称创建 Server 构建器
     *
     * @param name the identity of the server for clients to connect to
     */
    public static InProcessServerBuilder forName(String name) {
        return new InProcessServerBuilder(name);
    }

    /**
     * Generates a new server name that is unique each time.
     * 生成唯一的 Server 名称
     */
    public static String generateName() {
        return UUID.randomUUID().toString();
    }

    @CanIgnoreReturnValue
    public InProcessServerBuilder addService(ServerServiceDefinition service) {
        registry.addService(checkNotNull(service, "service"));
        return this;
    }

    /**
     * Sets a registry consulted for methods not found in the added services.
     * 设置回退的方法注册器
     */
    @CanIgnoreReturnValue
    public InProcessServerBuilder fallbackHandlerRegistry(HandlerRegistry fallbackRegistry) {
        this.fallbackRegistry = fallbackRegistry != null ? fallbackRegistry : new MutableHandlerRegistry();
        return this;
    }

    /**
     * Runs handlers on the given executor. The server does not take ownership of the executor.
     */
    @CanIgnoreReturnValue
    public InProcessServerBuilder executor(Executor executor) {
        this.executor = checkNotNull(executor, "executor");
        return this;
    }

    @CanIgnoreReturnValue
    public InProcessServerBuilder directExecutor() {
        return executor(MoreExecutors.directExecutor());
    }

    /**
     * Schedules the cancellation of calls that carry a client deadline on the given scheduler. The
     * server does not take ownership of the scheduler.
     * 设置用于取消超时调用的调度器
     */
    @CanIgnoreReturnValue
    public InProcessServerBuilder deadlineExecutor(ScheduledExecutorService deadlineExecutor) {
        this.deadlineExecutor = checkNotNull(deadlineExecutor, "deadlineExecutor");
        return this;
    }

    /**
     * Leaves deadline enforcement to the clients.
     * 不在服务端处理客户端的超时时间
     */
    @CanIgnoreReturnValue
    public InProcessServerBuilder ignoreDeadlines() {
        this.ignoreDeadlines = true;
        return this;
    }

    @CanIgnoreReturnValue
    public InProcessServerBuilder compressorRegistry(CompressorRegistry registry) {
        this.compressorRegistry = checkNotNull(registry, "registry");
        return this;
    }

    @CanIgnoreReturnValue
    public InProcessServerBuilder decompressorRegistry(DecompressorRegistry registry) {
        this.decompressorRegistry = checkNotNull(registry, "registry");
        return this;
    }

    /**
     * Ordered encodings the server would like to use for responses, when the client supports them.
     * 响应使用的编码偏好
     */
    @CanIgnoreReturnValue
    public InProcessServerBuilder compressionPreference(List<String> encodings) {
        this.compressionPreference = ImmutableList.copyOf(encodings);
        return this;
    }

    @CanIgnoreReturnValue
    public InProcessServerBuilder maxInboundMessageSize(int bytes) {
        checkArgument(bytes >= 0, "bytes must be >= 0");
        this.maxInboundMessageSize = bytes;
        return this;
    }

    /**
     * 构建 Server，需要调用 start 之后才能被访问
     */
    public InProcessServer build() {
        ExecutorService ownedExecutor = null;
        Executor effectiveExecutor = executor;
        if (effectiveExecutor == null) {
            ownedExecutor = Executors.newCachedThreadPool(GrpcUtil.getThreadFactory("conduit-inprocess-server-%d", true));
            effectiveExecutor = ownedExecutor;
        }
        ScheduledExecutorService ownedScheduler = null;
        ScheduledExecutorService effectiveScheduler = null;
        if (!ignoreDeadlines) {
            effectiveScheduler = deadlineExecutor;
            if (effectiveScheduler == null) {
                ownedScheduler = Executors.newSingleThreadScheduledExecutor(
                        GrpcUtil.getThreadFactory("conduit-inprocess-server-timer-%d", true));
                effectiveScheduler = ownedScheduler;
            }
        }
        CompressionNegotiator negotiator =
                new CompressionNegotiator(compressionPreference, compressorRegistry, decompressorRegistry);
        ServerCallDispatcher dispatcher = new ServerCallDispatcher(registry, fallbackRegistry, effectiveExecutor,
                effectiveScheduler, negotiator, maxInboundMessageSize);
        return new InProcessServer(name, effectiveExecutor, ownedExecutor, ownedScheduler, dispatcher);
    }
}
