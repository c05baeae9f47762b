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

package io.conduit.xds;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.conduit.CallOptions;
import io.conduit.Channel;
import io.conduit.ClientCall;
import io.conduit.MethodDescriptor;
import io.conduit.Status;
import io.conduit.SynchronizationContext;
import io.conduit.SynchronizationContext.ScheduledHandle;
import io.conduit.internal.BackoffPolicy;
import io.conduit.internal.ExponentialBackoffPolicy;
import io.conduit.stub.ClientCalls;
import io.conduit.stub.StreamObserver;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Aggregated discovery over one long-lived bidirectional stream to a control plane. All state is
 * confined to the {@link SynchronizationContext} and watchers are called from it.
 * 通过一个长连接的双向流从控制面获取资源，所有状态都在 SynchronizationContext 中修改，监听器也在其中回调
 *
 * <p>Per resource type the client tracks the subscribed names, the last accepted version and the
 * nonce of the last response. An ACK or NACK answers one response and carries that response's
 * nonce. Every new stream starts with one request per subscribed type carrying the last accepted
 * version and an empty nonce.
 */
public final class AdsDiscoveryClient implements EndpointDiscovery {

    private static final Logger logger = Logger.getLogger(AdsDiscoveryClient.class.getName());

    static final String SERVICE_NAME = "envoy.service.discovery.v3.AggregatedDiscoveryService";

    /**
     * The aggregated discovery method, with the JSON envelope marshallers.
     */
    public static final MethodDescriptor<DiscoveryRequest, DiscoveryResponse> STREAM_AGGREGATED_RESOURCES =
            MethodDescriptor.<DiscoveryRequest, DiscoveryResponse>newBuilder()
                    .setType(MethodDescriptor.MethodType.BIDI_STREAMING)
                    .setFullMethodName(MethodDescriptor.generateFullMethodName(SERVICE_NAME, "StreamAggregatedResources"))
                    .setRequestMarshaller(JsonDiscoveryMarshaller.REQUEST)
                    .setResponseMarshaller(JsonDiscoveryMarshaller.RESPONSE)
                    .build();

    private final Channel channel;
    private final Node node;
    private final SynchronizationContext syncContext;
    private final ScheduledExecutorService timeService;
    private final BackoffPolicy.Provider backoffPolicyProvider;

    // 以下字段只在 syncContext 中访问
    private final Map<String, Subscription<?>> subscriptions = new LinkedHashMap<>();
    @Nullable
    private AdsStream adsStream;
    @Nullable
    private BackoffPolicy retryBackoffPolicy;
    @Nullable
    private ScheduledHandle rpcRetryTimer;
    private boolean shutdown;

    public AdsDiscoveryClient(Channel channel,
                              Node node,
                              SynchronizationContext syncContext,
                              ScheduledExecutorService timeService,
                              BackoffPolicy.Provider backoffPolicyProvider) {
        this.channel = checkNotNull(channel, "channel");
        this.node = checkNotNull(node, "node");
        this.syncContext = checkNotNull(syncContext, "syncContext");
        this.timeService = checkNotNull(timeService, "timeService");
        this.backoffPolicyProvider = checkNotNull(backoffPolicyProvider, "backoffPolicyProvider");
    }

    /**
     * Stream retry backoff: 1s initial, 30s ceiling, multiplier 2 and 20% jitter.
     * 重建流的退避策略
     */
    public static BackoffPolicy.Provider defaultBackoffPolicyProvider() {
        return new ExponentialBackoffPolicy.Provider()
                .setInitialBackoffNanos(TimeUnit.SECONDS.toNanos(1))
                .setMaxBackoffNanos(TimeUnit.SECONDS.toNanos(30))
                .setMultiplier(2.0)
                .setJitter(.2);
    }

    @Override
    public <T> void subscribe(final ResourceType<T> type,
                              Collection<String> names,
                              final ResourceWatcher<T> watcher) {
        checkNotNull(type, "type");
        checkNotNull(watcher, "watcher");
        final ImmutableList<String> resourceNames = ImmutableList.copyOf(names);
        syncContext.execute(new Runnable() {
            @Override
            public void run() {
                if (shutdown) {
                    return;
                }
                @SuppressWarnings("unchecked")
                Subscription<T> subscription = (Subscription<T>) subscriptions.get(type.typeUrl());
                if (subscription == null) {
                    subscription = new Subscription<>(type);
                    subscriptions.put(type.typeUrl(), subscription);
                }
                subscription.resourceNames = resourceNames;
                subscription.watchers.add(watcher);
                logger.log(Level.FINE, "Subscribed to {0} {1}", new Object[]{type, resourceNames});
                if (adsStream != null) {
                    adsStream.sendRequest(subscription, subscription.nonce, null);
                } else if (rpcRetryTimer == null) {
                    startRpcStream();
                }
            }
        });
    }

    @Override
    public void ack(final ResourceType<?> type,
                    final String version,
                    final String nonce,
                    final boolean accepted,
                    @Nullable final String detail) {
        syncContext.execute(new Runnable() {
            @Override
            public void run() {
                Subscription<?> subscription = subscriptions.get(type.typeUrl());
                if (shutdown || subscription == null) {
                    return;
                }
                Status errorDetail = null;
                if (accepted) {
                    subscription.acceptedVersion = version;
                } else {
                    errorDetail = Status.INVALID_ARGUMENT.withDescription(detail);
                    logger.log(Level.WARNING, "Rejecting {0} version {1}: {2}", new Object[]{type, version, detail});
                }
                if (adsStream != null) {
                    adsStream.sendRequest(subscription, nonce, errorDetail);
                }
            }
        });
    }

    @Override
    public void shutdown() {
        syncContext.execute(new Runnable() {
            @Override
            public void run() {
                if (shutdown) {
                    return;
                }
                shutdown = true;
                logger.log(Level.FINE, "Shutting down discovery client");
                if (adsStream != null) {
                    adsStream.close(Status.CANCELLED.withDescription("Discovery client shutdown"));
                    adsStream = null;
                }
                if (rpcRetryTimer != null) {
                    rpcRetryTimer.cancel();
                    rpcRetryTimer = null;
                }
            }
        });
    }

    /**
     * The last accepted version of the given type, or the empty string.
     */
    @VisibleForTesting
    String acceptedVersion(ResourceType<?> type) {
        syncContext.throwIfNotInThisSynchronizationContext();
        Subscription<?> subscription = subscriptions.get(type.typeUrl());
        return subscription == null ? "" : subscription.acceptedVersion;
    }

    /**
     * 创建新的流，并为每个已订阅的类型发送初始请求
     */
    private void startRpcStream() {
        syncContext.throwIfNotInThisSynchronizationContext();
        adsStream = new AdsStream();
        logger.log(Level.FINE, "Starting discovery stream {0}", adsStream);
        adsStream.start();
        for (Subscription<?> subscription : subscriptions.values()) {
            subscription.nonce = "";
            adsStream.sendRequest(subscription, "", null);
        }
    }

    private void handleStreamClosed(AdsStream stream, Status status) {
        syncContext.throwIfNotInThisSynchronizationContext();
        if (stream != adsStream) {
            return;
        }
        adsStream = null;
        Status error = status.isOk()
                ? Status.UNAVAILABLE.withDescription("Discovery stream closed by server")
                : status;
        logger.log(Level.FINE, "Discovery stream closed: {0}", error);
        for (Subscription<?> subscription : subscriptions.values()) {
            subscription.notifyError(error);
        }
        if (shutdown) {
            return;
        }
        // 流上收到过响应时重置退避，并立即重建
        if (stream.responseReceived || retryBackoffPolicy == null) {
            retryBackoffPolicy = backoffPolicyProvider.get();
        }
        if (stream.responseReceived) {
            startRpcStream();
            return;
        }
        long delayNanos = retryBackoffPolicy.nextBackoffNanos();
        logger.log(Level.FINE, "Retrying discovery stream in {0} ns", delayNanos);
        rpcRetryTimer = syncContext.schedule(new RpcRetryTask(), delayNanos, TimeUnit.NANOSECONDS, timeService);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("channel", channel).add("node", node.getId()).toString();
    }

    private final class RpcRetryTask implements Runnable {
        @Override
        public void run() {
            rpcRetryTimer = null;
            if (!shutdown) {
                startRpcStream();
            }
        }
    }

    /**
     * Subscription state of one resource type.
     * 单个资源类型的订阅状态
     */
    private static final class Subscription<T> {
        final ResourceType<T> type;
        final List<ResourceWatcher<T>> watchers = new ArrayList<>();
        ImmutableList<String> resourceNames = ImmutableList.of();
        String acceptedVersion = "";
        String nonce = "";

        Subscription(ResourceType<T> type) {
            this.type = type;
        }

        /**
         * Decodes the full snapshot and hands it to the watchers.
         *
         * @return the reason the snapshot could not be decoded, or {@code null}
         */
        @Nullable
        String handleResponse(DiscoveryResponse response) {
            nonce = response.getNonce();
            List<T> resources = new ArrayList<>(response.getResources().size());
            for (DiscoveryResponse.Resource resource : response.getResources()) {
                if (!type.typeUrl().equals(resource.getTypeUrl())) {
                    return "unexpected resource type " + resource.getTypeUrl();
                }
                try {
                    resources.add(type.decode(resource.getValue()));
                } catch (ResourceInvalidException e) {
                    return "invalid " + type + " resource: " + e.getMessage();
                }
            }
            for (ResourceWatcher<T> watcher : new ArrayList<>(watchers)) {
                watcher.onUpdate(response.getVersionInfo(), response.getNonce(), resources);
            }
            return null;
        }

        void notifyError(Status error) {
            for (ResourceWatcher<T> watcher : new ArrayList<>(watchers)) {
                watcher.onError(error);
            }
        }
    }

    /**
     * One discovery stream. Callbacks are reposted into the synchronization context.
     * 一次发现流，回调都转到 syncContext 中执行
     */
    private final class AdsStream {
        private final ClientCall<DiscoveryRequest, DiscoveryResponse> call;
        private StreamObserver<DiscoveryRequest> requestObserver;
        private boolean responseReceived;
        private boolean closed;

        AdsStream() {
            this.call = channel.newCall(STREAM_AGGREGATED_RESOURCES, CallOptions.DEFAULT);
        }

        void start() {
            requestObserver = ClientCalls.asyncBidiStreamingCall(call, new StreamObserver<DiscoveryResponse>() {
                @Override
                public void onNext(final DiscoveryResponse response) {
                    syncContext.execute(new Runnable() {
                        @Override
                        public void run() {
                            handleResponse(response);
                        }
                    });
                }

                @Override
                public void onError(final Throwable t) {
                    syncContext.execute(new Runnable() {
                        @Override
                        public void run() {
                            handleStreamClosed(AdsStream.this, Status.fromThrowable(t));
                        }
                    });
                }

                @Override
                public void onCompleted() {
                    syncContext.execute(new Runnable() {
                        @Override
                        public void run() {
                            handleStreamClosed(AdsStream.this, Status.OK);
                        }
                    });
                }
            });
        }

        private void handleResponse(DiscoveryResponse response) {
            if (closed) {
                return;
            }
            responseReceived = true;
            Subscription<?> subscription = subscriptions.get(response.getTypeUrl());
            if (subscription == null) {
                logger.log(Level.FINE, "Ignoring response for unsubscribed type {0}", response.getTypeUrl());
                return;
            }
            logger.log(Level.FINE, "Received {0}", response);
            String error = subscription.handleResponse(response);
            if (error != null) {
                logger.log(Level.WARNING, "Rejecting {0} version {1}: {2}",
                        new Object[]{response.getTypeUrl(), response.getVersionInfo(), error});
                Status errorDetail = Status.INVALID_ARGUMENT.withDescription(error);
                sendRequest(subscription, response.getNonce(), errorDetail);
                subscription.notifyError(errorDetail);
            }
        }

        /**
         * 发送请求，携带最后接受的版本和所应答响应的 nonce，NACK 时附带错误详情
         */
        void sendRequest(Subscription<?> subscription, String nonce, @Nullable Status errorDetail) {
            if (closed) {
                return;
            }
            DiscoveryRequest request = new DiscoveryRequest(subscription.type.typeUrl(), node,
                    subscription.resourceNames, subscription.acceptedVersion, nonce, errorDetail);
            logger.log(Level.FINE, "Sending {0}", request);
            requestObserver.onNext(request);
        }

        void close(Status status) {
            if (closed) {
                return;
            }
            closed = true;
            call.cancel(status.getDescription(), status.getCause());
        }
    }
}
