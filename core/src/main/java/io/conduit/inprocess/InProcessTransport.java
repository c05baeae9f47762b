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
import io.conduit.CallOptions;
import io.conduit.Metadata;
import io.conduit.MethodDescriptor;
import io.conduit.Status;
import io.conduit.internal.AdvertisedEncodings;
import io.conduit.internal.ClientStream;
import io.conduit.internal.ClientStreamListener;
import io.conduit.internal.ClientTransport;
import io.conduit.internal.FailingClientStream;
import io.conduit.internal.GrpcUtil;
import io.conduit.internal.SerializingExecutor;
import io.conduit.internal.ServerStream;
import io.conduit.internal.ServerStreamListener;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;
import static io.conduit.internal.GrpcUtil.AUTHORITY_KEY;
import static io.conduit.internal.GrpcUtil.USER_AGENT_KEY;

/**
 * A connection to an {@link InProcessServer} in the same JVM. Each stream pairs a client half and a
 * server half; frames written on one side are delivered to the other side's listener, in order,
 * on that side's executor.
 * 连接同一个 JVM 中 InProcessServer 的 Transport，每个流由客户端和服务端两部分组成，一端写入的帧按顺序在另一端的执行器中传递给监听器
 *
 * <p>Listener callbacks are never invoked while holding this transport's lock.
 * 持有 Transport 的锁时不会调用监听器
 */
@ThreadSafe
final class InProcessTransport implements ClientTransport {

    private static final Logger log = Logger.getLogger(InProcessTransport.class.getName());

    private final String name;
    private final String authority;
    private final String userAgent;
    private final Executor clientExecutor;
    private final boolean includeCauseWithStatus;
    private final AdvertisedEncodings advertisedEncodings = new AdvertisedEncodings();

    private volatile InProcessServer server;
    private volatile ClientTransport.Listener clientTransportListener;

    @GuardedBy("this")
    private boolean shutdown;
    @GuardedBy("this")
    private boolean terminated;
    @GuardedBy("this")
    private Status shutdownStatus;
    @GuardedBy("this")
    private final Set<InProcessStream> streams = new HashSet<>();

    InProcessTransport(String name,
                       String authority,
                       @Nullable String userAgent,
                       Executor clientExecutor,
                       boolean includeCauseWithStatus) {
        this.name = checkNotNull(name, "name");
        this.authority = checkNotNull(authority, "authority");
        this.userAgent = GrpcUtil.getUserAgent("inprocess", userAgent);
        this.clientExecutor = checkNotNull(clientExecutor, "clientExecutor");
        this.includeCauseWithStatus = includeCauseWithStatus;
    }

    /**
     * 开始 ClientTransport，根据名称查找 Server 并注册
     *
     * @param listener non-{@code null} listener of transport events
     */
    @CheckReturnValue
    @Override
    public synchronized Runnable start(ClientTransport.Listener listener) {
        this.clientTransportListener = checkNotNull(listener, "listener");

        InProcessServer found = InProcessServer.findServer(name);
        if (found != null && found.register(this)) {
            server = found;
            return new Runnable() {
                @Override
                public void run() {
                    clientTransportListener.transportReady();
                }
            };
        }

        // Server 不存在或者已经关闭，返回关闭 Transport 的任务
        shutdownStatus = Status.UNAVAILABLE.withDescription("Could not find server: " + name);
        final Status localShutdownStatus = shutdownStatus;
        return new Runnable() {
            @Override
            public void run() {
                notifyShutdown(localShutdownStatus);
                notifyTerminated();
            }
        };
    }

    /**
     * 创建新的流
     */
    @Override
    public ClientStream newStream(MethodDescriptor<?, ?> method, Metadata headers, CallOptions callOptions) {
        synchronized (this) {
            if (shutdownStatus != null) {
                return new FailingClientStream(shutdownStatus);
            }
        }
        headers.discardAll(USER_AGENT_KEY);
        headers.put(USER_AGENT_KEY, userAgent);
        String streamAuthority = headers.get(AUTHORITY_KEY);
        return new InProcessStream(headers, streamAuthority != null ? streamAuthority : authority).clientStream;
    }

    /**
     * 有序关闭，已经存在的流继续，新的流会失败
     */
    @Override
    public void shutdown(Status reason) {
        notifyShutdown(reason);
        boolean terminate;
        synchronized (this) {
            terminate = streams.isEmpty();
        }
        if (terminate) {
            notifyTerminated();
        }
    }

    /**
     * 立即关闭，取消所有的流
     */
    @Override
    public void shutdownNow(Status reason) {
        checkNotNull(reason, "reason");
        shutdown(reason);
        List<InProcessStream> streamsCopy;
        synchronized (this) {
            if (terminated) {
                return;
            }
            streamsCopy = new ArrayList<>(streams);
        }
        // 遍历所有的流并取消
        for (InProcessStream stream : streamsCopy) {
            stream.clientStream.cancel(reason);
        }
    }

    @Override
    public AdvertisedEncodings getAdvertisedEncodings() {
        return advertisedEncodings;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("hash", Integer.toHexString(System.identityHashCode(this)))
                .toString();
    }

    private void notifyShutdown(Status s) {
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            if (shutdownStatus == null) {
                shutdownStatus = s;
            }
        }
        log.log(Level.FINE, "{0} shutdown: {1}", new Object[]{this, s});
        clientTransportListener.transportShutdown(s);
    }

    private void notifyTerminated() {
        synchronized (this) {
            if (terminated) {
                return;
            }
            terminated = true;
        }
        InProcessServer current = server;
        if (current != null) {
            current.transportTerminated(this);
        }
        clientTransportListener.transportTerminated();
    }

    /**
     * 为了使进程内传输的行为与其他传输相同，在客户端和服务端之间传递状态时默认不包含原因
     */
    private static Status cleanStatus(Status status, boolean includeCauseWithStatus) {
        Status clientStatus = Status.fromCodeValue(status.getCode().value()).withDescription(status.getDescription());
        if (includeCauseWithStatus && status.getCause() != null) {
            clientStatus = clientStatus.withCause(status.getCause());
        }
        return clientStatus;
    }

    private final class InProcessStream {
        private final InProcessClientStream clientStream = new InProcessClientStream();
        private final InProcessServerStream serverStream = new InProcessServerStream();
        private final Metadata headers;
        private final String authority;
        // 客户端监听器的回调在客户端执行器中串行执行
        private final SerializingExecutor toClient = new SerializingExecutor(clientExecutor);
        // 服务端监听器的回调在服务端执行器中串行执行
        private final SerializingExecutor toServer;

        private volatile ClientStreamListener clientListener;
        private volatile ServerStreamListener serverListener;

        @GuardedBy("this")
        private boolean closed;
        @GuardedBy("this")
        private boolean halfClosed;

        private InProcessStream(Metadata headers, String authority) {
            this.headers = headers;
            this.authority = authority;
            this.toServer = new SerializingExecutor(server.getExecutor());
        }

        private synchronized boolean markClosed() {
            if (closed) {
                return false;
            }
            closed = true;
            return true;
        }

        private synchronized boolean isClosed() {
            return closed;
        }

        // Can be called multiple times due to races on both client and server closing at same time.
        // 关闭流，可能多次调用，因为客户端和服务端可能会同时关闭
        private void streamClosed() {
            boolean terminate;
            synchronized (InProcessTransport.this) {
                boolean justRemovedAnElement = streams.remove(this);
                terminate = justRemovedAnElement && streams.isEmpty() && shutdown;
            }
            if (terminate) {
                notifyTerminated();
            }
        }

        private void notifyServer(final ServerEvent event) {
            toServer.execute(new Runnable() {
                @Override
                public void run() {
                    ServerStreamListener listener = serverListener;
                    if (listener != null) {
                        event.deliver(listener);
                    }
                }
            });
        }

        private void notifyClient(final ClientEvent event) {
            toClient.execute(new Runnable() {
                @Override
                public void run() {
                    ClientStreamListener listener = clientListener;
                    if (listener != null) {
                        event.deliver(listener);
                    }
                }
            });
        }

        /**
         * 进程内客户端流的实现
         */
        private final class InProcessClientStream implements ClientStream {

            /**
             * 开始一个流，通知 Server 流创建事件
             */
            @Override
            public void start(ClientStreamListener listener) {
                clientListener = checkNotNull(listener, "listener");
                Status failure;
                synchronized (InProcessTransport.this) {
                    failure = terminated ? shutdownStatus : null;
                    if (failure == null) {
                        streams.add(InProcessStream.this);
                    }
                }
                if (failure != null) {
                    markClosed();
                    listener.closed(failure, null);
                    return;
                }
                server.getDispatcher().streamCreated(serverStream, headers);
            }

            @Override
            public void writeData(final byte[] data) {
                if (isClosed()) {
                    return;
                }
                notifyServer(new ServerEvent() {
                    @Override
                    public void deliver(ServerStreamListener listener) {
                        listener.dataRead(data);
                    }
                });
            }

            /**
             * 流半关闭
             */
            @Override
            public void halfClose() {
                synchronized (InProcessStream.this) {
                    if (closed || halfClosed) {
                        return;
                    }
                    halfClosed = true;
                }
                notifyServer(new ServerEvent() {
                    @Override
                    public void deliver(ServerStreamListener listener) {
                        listener.halfClosed();
                    }
                });
            }

            /**
             * 客户端取消流，通知两端的监听器
             *
             * @param reason must be non-OK
             */
            @Override
            public void cancel(final Status reason) {
                if (!markClosed()) {
                    return;
                }
                final Status serverStatus = cleanStatus(reason, includeCauseWithStatus);
                notifyServer(new ServerEvent() {
                    @Override
                    public void deliver(ServerStreamListener listener) {
                        listener.closed(serverStatus);
                    }
                });
                notifyClient(new ClientEvent() {
                    @Override
                    public void deliver(ClientStreamListener listener) {
                        listener.closed(reason, null);
                    }
                });
                streamClosed();
            }
        }

        /**
         * 进程内服务端流的实现
         */
        private final class InProcessServerStream implements ServerStream {

            @Override
            public void setListener(ServerStreamListener listener) {
                serverListener = checkNotNull(listener, "listener");
            }

            @Override
            public void writeHeaders(final Metadata headers) {
                if (isClosed()) {
                    return;
                }
                notifyClient(new ClientEvent() {
                    @Override
                    public void deliver(ClientStreamListener listener) {
                        listener.headersRead(headers);
                    }
                });
            }

            @Override
            public void writeData(final byte[] data) {
                if (isClosed()) {
                    return;
                }
                notifyClient(new ClientEvent() {
                    @Override
                    public void deliver(ClientStreamListener listener) {
                        listener.dataRead(data);
                    }
                });
            }

            /**
             * Server 端正常关闭流，trailers 中包含状态
             */
            @Override
            public void close(final Metadata trailers) {
                if (!markClosed()) {
                    return;
                }
                notifyClient(new ClientEvent() {
                    @Override
                    public void deliver(ClientStreamListener listener) {
                        listener.closed(Status.OK, trailers);
                    }
                });
                notifyServer(new ServerEvent() {
                    @Override
                    public void deliver(ServerStreamListener listener) {
                        listener.closed(Status.OK);
                    }
                });
                streamClosed();
            }

            /**
             * server 端取消流，通常是超时或内部错误的情况下，这个方法可能在任意线程内被多次调用
             */
            @Override
            public void cancel(final Status status) {
                if (!markClosed()) {
                    return;
                }
                final Status clientStatus = cleanStatus(status, includeCauseWithStatus);
                notifyClient(new ClientEvent() {
                    @Override
                    public void deliver(ClientStreamListener listener) {
                        listener.closed(clientStatus, null);
                    }
                });
                notifyServer(new ServerEvent() {
                    @Override
                    public void deliver(ServerStreamListener listener) {
                        listener.closed(status);
                    }
                });
                streamClosed();
            }

            @Override
            public String getAuthority() {
                return authority;
            }
        }
    }

    private interface ClientEvent {
        void deliver(ClientStreamListener listener);
    }

    private interface ServerEvent {
        void deliver(ServerStreamListener listener);
    }
}
