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

import com.google.common.base.MoreObjects;
import io.conduit.Status;
import io.conduit.internal.ServerCallDispatcher;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkState;

/**
 * A server reachable by name from channels in the same JVM.
 * 同一个 JVM 中可以通过名称访问的 Server
 */
@ThreadSafe
public final class InProcessServer {

    private static final Logger log = Logger.getLogger(InProcessServer.class.getName());

    /**
     * 监听的 Server 集合
     */
    private static final ConcurrentMap<String, InProcessServer> registry = new ConcurrentHashMap<>();

    /**
     * 通过名称查找 Server
     */
    @Nullable
    static InProcessServer findServer(String name) {
        return registry.get(name);
    }

    private final String name;
    private final Executor executor;
    @Nullable
    private final ExecutorService ownedExecutor;
    @Nullable
    private final ScheduledExecutorService ownedScheduler;
    private final ServerCallDispatcher dispatcher;
    private final CountDownLatch terminatedLatch = new CountDownLatch(1);

    @GuardedBy("this")
    private boolean started;
    @GuardedBy("this")
    private boolean shutdown;
    @GuardedBy("this")
    private boolean terminated;
    @GuardedBy("this")
    private final Set<InProcessTransport> transports = new HashSet<>();

    InProcessServer(String name,
                    Executor executor,
                    @Nullable ExecutorService ownedExecutor,
                    @Nullable ScheduledExecutorService ownedScheduler,
                    ServerCallDispatcher dispatcher) {
        this.name = name;
        this.executor = executor;
        this.ownedExecutor = ownedExecutor;
        this.ownedScheduler = ownedScheduler;
        this.dispatcher = dispatcher;
    }

    /**
     * Makes the server reachable by its name.
     * 启动 Server，之后 Channel 可以通过名称连接
     *
     * @throws IOException if another server is already registered under the same name
     */
    public InProcessServer start() throws IOException {
        synchronized (this) {
            checkState(!started, "Already started");
            checkState(!shutdown, "Shutting down");
            started = true;
        }
        // Must be last, as channels can start connecting after this point.
        if (registry.putIfAbsent(name, this) != null) {
            throw new IOException("name already registered: " + name);
        }
        log.log(Level.FINE, "In-process server {0} started", name);
        return this;
    }

    /**
     * 获取监听的地址
     */
    public SocketAddress getListenSocketAddress() {
        return new InProcessSocketAddress(name);
    }

    public String getName() {
        return name;
    }

    /**
     * Stops accepting connections. Connections shut down gracefully, their in-flight calls finish.
     * 停止接收新连接，已有的连接有序关闭，进行中的调用会继续完成
     */
    public InProcessServer shutdown() {
        List<InProcessTransport> toShutdown = markShutdown();
        for (InProcessTransport transport : toShutdown) {
            transport.shutdown(Status.UNAVAILABLE.withDescription("InProcessTransport shutdown by the server-side"));
        }
        return this;
    }

    /**
     * Stops accepting connections and cancels every in-flight call with {@code UNAVAILABLE}.
     * 停止接收新连接并以 UNAVAILABLE 取消所有进行中的调用
     */
    public InProcessServer shutdownNow() {
        markShutdown();
        List<InProcessTransport> toShutdown;
        synchronized (this) {
            toShutdown = new ArrayList<>(transports);
        }
        for (InProcessTransport transport : toShutdown) {
            transport.shutdownNow(Status.UNAVAILABLE.withDescription("InProcessServer shutdownNow invoked"));
        }
        return this;
    }

    private List<InProcessTransport> markShutdown() {
        // 从集合中移除当前 Server
        registry.remove(name, this);
        synchronized (this) {
            if (shutdown) {
                return new ArrayList<>();
            }
            shutdown = true;
            maybeTerminate();
            return new ArrayList<>(transports);
        }
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }

    public synchronized boolean isTerminated() {
        return terminated;
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminatedLatch.await(timeout, unit);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", name).toString();
    }

    /**
     * 注册新的 Transport，Server 已经关闭时返回 false
     */
    synchronized boolean register(InProcessTransport transport) {
        if (shutdown) {
            return false;
        }
        transports.add(transport);
        return true;
    }

    synchronized void transportTerminated(InProcessTransport transport) {
        transports.remove(transport);
        maybeTerminate();
    }

    @GuardedBy("this")
    private void maybeTerminate() {
        if (terminated || !shutdown || !transports.isEmpty()) {
            return;
        }
        terminated = true;
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
        if (ownedScheduler != null) {
            ownedScheduler.shutdown();
        }
        terminatedLatch.countDown();
        log.log(Level.FINE, "In-process server {0} terminated", name);
    }

    Executor getExecutor() {
        return executor;
    }

    ServerCallDispatcher getDispatcher() {
        return dispatcher;
    }
}
