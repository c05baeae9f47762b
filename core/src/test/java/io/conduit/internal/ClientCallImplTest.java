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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import io.conduit.CallOptions;
import io.conduit.ClientCall;
import io.conduit.CompressorRegistry;
import io.conduit.Deadline;
import io.conduit.DecompressorRegistry;
import io.conduit.ManagedChannel;
import io.conduit.Metadata;
import io.conduit.MethodDescriptor;
import io.conduit.ServerCall;
import io.conduit.ServerCallHandler;
import io.conduit.ServerServiceDefinition;
import io.conduit.Status;
import io.conduit.inprocess.InProcessChannelBuilder;
import io.conduit.inprocess.InProcessServer;
import io.conduit.inprocess.InProcessServerBuilder;
import io.conduit.testing.FakeClock;
import io.conduit.testing.StringMarshaller;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Drives client calls end to end over the in-process transport with direct executors.
 */
class ClientCallImplTest {

    private static final String SERVICE = "test.Echo";

    private static final MethodDescriptor<String, String> UNARY = method(MethodDescriptor.MethodType.UNARY, "Upper");

    private static final MethodDescriptor<String, String> HANG = method(MethodDescriptor.MethodType.UNARY, "Hang");

    private static final MethodDescriptor<String, String> FAIL = method(MethodDescriptor.MethodType.UNARY, "Fail");

    private static final MethodDescriptor<String, String> MISSING = method(MethodDescriptor.MethodType.UNARY, "Missing");

    private static final MethodDescriptor<String, String> REPEAT = method(MethodDescriptor.MethodType.UNARY, "Repeat");

    private final FakeClock fakeClock = new FakeClock();
    private final AtomicInteger serverCancellations = new AtomicInteger();
    // 服务端收到的每个请求的 grpc-encoding
    private final List<String> requestEncodings = new ArrayList<>();
    private final String serverName = InProcessServerBuilder.generateName();
    private InProcessServer server;
    private ManagedChannel channel;

    @BeforeEach
    void setUp() throws IOException {
        server = InProcessServerBuilder.forName(serverName)
                .directExecutor()
                .ignoreDeadlines()
                .addService(service())
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(serverName)
                .directExecutor()
                .scheduledExecutorService(fakeClock.getScheduledExecutorService())
                .build();
    }

    private ServerServiceDefinition service() {
        return ServerServiceDefinition.builder(SERVICE)
                .addMethod(UNARY, new ServerCallHandler<String, String>() {
                    @Override
                    public ServerCall.Listener<String> startCall(final ServerCall<String, String> call, Metadata headers) {
                        call.request(1);
                        return new ServerCall.Listener<String>() {
                            @Override
                            public void onMessage(String message) {
                                call.sendHeaders(new Metadata());
                                call.sendMessage(message.toUpperCase());
                                Metadata trailers = new Metadata();
                                trailers.put("x-echo", "done");
                                call.close(Status.OK, trailers);
                            }
                        };
                    }
                })
                .addMethod(HANG, new ServerCallHandler<String, String>() {
                    @Override
                    public ServerCall.Listener<String> startCall(ServerCall<String, String> call, Metadata headers) {
                        call.request(1);
                        return new ServerCall.Listener<String>() {
                            @Override
                            public void onCancel() {
                                serverCancellations.incrementAndGet();
                            }
                        };
                    }
                })
                .addMethod(FAIL, new ServerCallHandler<String, String>() {
                    @Override
                    public ServerCall.Listener<String> startCall(ServerCall<String, String> call, Metadata headers) {
                        call.close(Status.NOT_FOUND.withDescription("no such thing"), new Metadata());
                        return new ServerCall.Listener<String>() {
                        };
                    }
                })
                .addMethod(REPEAT, new ServerCallHandler<String, String>() {
                    @Override
                    public ServerCall.Listener<String> startCall(final ServerCall<String, String> call, Metadata headers) {
                        requestEncodings.add(headers.get(GrpcUtil.MESSAGE_ENCODING_KEY));
                        call.request(1);
                        return new ServerCall.Listener<String>() {
                            @Override
                            public void onMessage(String message) {
                                call.sendHeaders(new Metadata());
                                call.sendMessage(Strings.repeat(message, 1000));
                                call.close(Status.OK, new Metadata());
                            }
                        };
                    }
                })
                .build();
    }

    @AfterEach
    void tearDown() {
        channel.shutdownNow();
        server.shutdownNow();
    }

    @Test
    void unaryCallDeliversMessageAndTrailers() {
        RecordingListener listener = new RecordingListener();
        ClientCall<String, String> call = channel.newCall(UNARY, CallOptions.DEFAULT);
        call.start(listener, new Metadata());
        call.request(1);
        call.sendMessage("hello");
        call.halfClose();

        assertEquals(1, listener.closes.size());
        assertTrue(listener.closes.get(0).isOk());
        assertEquals(1, listener.messages.size());
        assertEquals("HELLO", listener.messages.get(0));
        assertEquals("done", listener.trailers.get("x-echo"));
    }

    @Test
    void cancelBeforeAnyResponseClosesOnceWithCancelled() {
        RecordingListener listener = new RecordingListener();
        ClientCall<String, String> call = channel.newCall(HANG, CallOptions.DEFAULT);
        call.start(listener, new Metadata());
        call.request(1);
        call.sendMessage("anyone there?");
        call.halfClose();

        call.cancel("caller gave up", null);
        call.cancel("again", null);

        assertEquals(1, listener.closes.size());
        assertEquals(Status.Code.CANCELLED, listener.closes.get(0).getCode());
        assertEquals("caller gave up", listener.closes.get(0).getDescription());
        assertTrue(listener.messages.isEmpty());
        assertEquals(1, serverCancellations.get());
    }

    @Test
    void cancelBeforeStartClosesOnStart() {
        RecordingListener listener = new RecordingListener();
        ClientCall<String, String> call = channel.newCall(UNARY, CallOptions.DEFAULT);
        call.cancel("not needed", null);
        call.start(listener, new Metadata());

        assertEquals(1, listener.closes.size());
        assertEquals(Status.Code.CANCELLED, listener.closes.get(0).getCode());
    }

    @Test
    void deadlineExpiryFailsCall() {
        RecordingListener listener = new RecordingListener();
        CallOptions options = CallOptions.DEFAULT
                .withDeadline(Deadline.after(1, TimeUnit.SECONDS, fakeClock.getDeadlineTicker()));
        ClientCall<String, String> call = channel.newCall(HANG, options);
        call.start(listener, new Metadata());
        call.request(1);
        call.sendMessage("slow");
        call.halfClose();

        fakeClock.forwardTime(999, TimeUnit.MILLISECONDS);
        assertTrue(listener.closes.isEmpty());

        fakeClock.forwardTime(1, TimeUnit.MILLISECONDS);
        assertEquals(1, listener.closes.size());
        assertEquals(Status.Code.DEADLINE_EXCEEDED, listener.closes.get(0).getCode());
        assertEquals(1, serverCancellations.get());
    }

    @Test
    void serverStatusReachesClient() {
        RecordingListener listener = new RecordingListener();
        ClientCall<String, String> call = channel.newCall(FAIL, CallOptions.DEFAULT);
        call.start(listener, new Metadata());
        call.request(1);
        call.sendMessage("x");
        call.halfClose();

        assertEquals(1, listener.closes.size());
        assertEquals(Status.Code.NOT_FOUND, listener.closes.get(0).getCode());
        assertEquals("no such thing", listener.closes.get(0).getDescription());
    }

    @Test
    void unknownMethodIsUnimplemented() {
        RecordingListener listener = new RecordingListener();
        ClientCall<String, String> call = channel.newCall(MISSING, CallOptions.DEFAULT);
        call.start(listener, new Metadata());
        call.request(1);
        call.sendMessage("x");
        call.halfClose();

        assertEquals(1, listener.closes.size());
        assertEquals(Status.Code.UNIMPLEMENTED, listener.closes.get(0).getCode());
    }

    @Test
    void missingServerIsUnavailable() {
        ManagedChannel orphan = InProcessChannelBuilder.forName(InProcessServerBuilder.generateName())
                .directExecutor()
                .scheduledExecutorService(fakeClock.getScheduledExecutorService())
                .build();
        try {
            RecordingListener listener = new RecordingListener();
            ClientCall<String, String> call = orphan.newCall(UNARY, CallOptions.DEFAULT);
            call.start(listener, new Metadata());
            call.request(1);
            call.sendMessage("x");
            call.halfClose();

            assertEquals(1, listener.closes.size());
            assertEquals(Status.Code.UNAVAILABLE, listener.closes.get(0).getCode());
        } finally {
            orphan.shutdownNow();
        }
    }

    @Test
    void serverShutdownMidCallClosesOnceWithUnavailable() {
        RecordingListener listener = new RecordingListener();
        ClientCall<String, String> call = channel.newCall(HANG, CallOptions.DEFAULT);
        call.start(listener, new Metadata());
        call.request(1);
        call.sendMessage("waiting");
        call.halfClose();
        assertTrue(listener.closes.isEmpty());

        server.shutdownNow();
        call.cancel("after the fact", null);

        assertEquals(1, listener.closes.size());
        assertEquals(Status.Code.UNAVAILABLE, listener.closes.get(0).getCode());
    }

    @Test
    void gzipIsUsedOnceTheConnectionLearnedThePeerAcceptsIt() throws IOException {
        String name = InProcessServerBuilder.generateName();
        InProcessServer gzipServer = InProcessServerBuilder.forName(name)
                .directExecutor()
                .compressionPreference(ImmutableList.of("gzip"))
                .addService(service())
                .build()
                .start();
        ManagedChannel gzipChannel = InProcessChannelBuilder.forName(name)
                .directExecutor()
                .compressionPreference(ImmutableList.of("gzip"))
                .build();
        try {
            List<String> responses = new ArrayList<>();
            List<String> responseEncodings = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                RecordingListener listener = unary(gzipChannel, CallOptions.DEFAULT, "abcd");
                assertTrue(listener.closes.get(0).isOk());
                responses.addAll(listener.messages);
                responseEncodings.add(listener.headers.get(GrpcUtil.MESSAGE_ENCODING_KEY));
            }

            // 第一个请求时还不知道对端支持的编码，只能不压缩
            assertEquals(Arrays.asList(null, "gzip", "gzip"), requestEncodings);
            assertEquals(ImmutableList.of("gzip", "gzip", "gzip"), responseEncodings);
            for (String response : responses) {
                assertEquals(4000, response.length());
            }
        } finally {
            gzipChannel.shutdownNow();
            gzipServer.shutdownNow();
        }
    }

    @Test
    void callOptionCompressionAppliesToFirstCall() {
        RecordingListener listener = unary(channel, CallOptions.DEFAULT.withCompression("gzip"), "xyz");

        assertTrue(listener.closes.get(0).isOk());
        assertEquals(ImmutableList.of("gzip"), requestEncodings);
        assertEquals(Strings.repeat("xyz", 1000), listener.messages.get(0));
        // 服务端没有配置压缩偏好，响应不压缩
        assertEquals("identity", listener.headers.get(GrpcUtil.MESSAGE_ENCODING_KEY));
    }

    @Test
    void unaryCompletingWithoutResponseFailsInternal() {
        ScriptedTransport transport = new ScriptedTransport();
        RecordingListener listener = new RecordingListener();
        ClientCall<String, String> call = scriptedCall(transport);
        call.start(listener, new Metadata());
        call.request(2);

        transport.stream.listener.headersRead(new Metadata());
        transport.stream.listener.closed(Status.OK, GrpcUtil.statusToTrailers(Status.OK, new Metadata()));

        assertEquals(1, listener.closes.size());
        assertEquals(Status.Code.INTERNAL, listener.closes.get(0).getCode());
        assertEquals("No value received for unary call", listener.closes.get(0).getDescription());
        assertTrue(listener.messages.isEmpty());
    }

    @Test
    void secondUnaryResponseFailsCallAfterFirstIsDelivered() {
        ScriptedTransport transport = new ScriptedTransport();
        RecordingListener listener = new RecordingListener();
        ClientCall<String, String> call = scriptedCall(transport);
        call.start(listener, new Metadata());
        call.request(2);

        transport.stream.listener.headersRead(new Metadata());
        transport.stream.listener.dataRead(frame("r0"));
        transport.stream.listener.dataRead(frame("r1"));
        transport.stream.listener.closed(Status.OK, GrpcUtil.statusToTrailers(Status.OK, new Metadata()));

        assertEquals(ImmutableList.of("r0"), listener.messages);
        assertEquals(1, listener.closes.size());
        assertEquals(Status.Code.INTERNAL, listener.closes.get(0).getCode());
        assertEquals("More than one value received for unary call", listener.closes.get(0).getDescription());
        assertEquals(Status.Code.INTERNAL, transport.stream.cancelReason.getCode());
    }

    @Test
    void unknownResponseEncodingIsUnimplemented() {
        ScriptedTransport transport = new ScriptedTransport();
        RecordingListener listener = new RecordingListener();
        ClientCall<String, String> call = scriptedCall(transport);
        call.start(listener, new Metadata());
        call.request(2);

        Metadata headers = new Metadata();
        headers.put(GrpcUtil.MESSAGE_ENCODING_KEY, "br");
        transport.stream.listener.headersRead(headers);

        assertEquals(1, listener.closes.size());
        assertEquals(Status.Code.UNIMPLEMENTED, listener.closes.get(0).getCode());
        assertEquals("Can't find decompressor for br", listener.closes.get(0).getDescription());
        assertNull(listener.headers);
        assertEquals(Status.Code.UNIMPLEMENTED, transport.stream.cancelReason.getCode());
    }

    private static RecordingListener unary(ManagedChannel target, CallOptions options, String request) {
        RecordingListener listener = new RecordingListener();
        ClientCall<String, String> call = target.newCall(REPEAT, options);
        call.start(listener, new Metadata());
        call.request(1);
        call.sendMessage(request);
        call.halfClose();
        assertEquals(1, listener.closes.size());
        return listener;
    }

    private ClientCall<String, String> scriptedCall(final ScriptedTransport transport) {
        return new ClientCallImpl<>(UNARY,
                MoreExecutors.directExecutor(),
                CallOptions.DEFAULT,
                "scripted",
                new ClientCallImpl.ClientTransportProvider() {
                    @Override
                    public ClientTransport get(MethodDescriptor<?, ?> method, CallOptions callOptions, Metadata headers) {
                        return transport;
                    }
                },
                fakeClock.getScheduledExecutorService(),
                new CompressionNegotiator(ImmutableList.<String>of(),
                        CompressorRegistry.getDefaultInstance(), DecompressorRegistry.getDefaultInstance()),
                Integer.MAX_VALUE);
    }

    private static byte[] frame(String message) {
        final List<byte[]> frames = new ArrayList<>();
        MessageFramer framer = new MessageFramer(new MessageFramer.Sink() {
            @Override
            public void deliverFrame(byte[] frame) {
                frames.add(frame);
            }
        });
        framer.writePayload(StringMarshaller.INSTANCE.stream(message));
        framer.flush();
        assertEquals(1, frames.size());
        return frames.get(0);
    }

    private static MethodDescriptor<String, String> method(MethodDescriptor.MethodType type, String name) {
        return MethodDescriptor.<String, String>newBuilder()
                .setType(type)
                .setFullMethodName(MethodDescriptor.generateFullMethodName(SERVICE, name))
                .setRequestMarshaller(StringMarshaller.INSTANCE)
                .setResponseMarshaller(StringMarshaller.INSTANCE)
                .build();
    }

    private static final class RecordingListener extends ClientCall.Listener<String> {
        final List<String> messages = new ArrayList<>();
        final List<Status> closes = new ArrayList<>();
        Metadata headers;
        Metadata trailers;

        @Override
        public void onHeaders(Metadata headers) {
            this.headers = headers;
        }

        @Override
        public void onMessage(String message) {
            messages.add(message);
        }

        @Override
        public void onClose(Status status, Metadata trailers) {
            closes.add(status);
            this.trailers = trailers;
        }
    }

    /**
     * A transport whose single stream is driven by the test.
     */
    private static final class ScriptedTransport implements ClientTransport {
        final ScriptedStream stream = new ScriptedStream();
        private final AdvertisedEncodings advertisedEncodings = new AdvertisedEncodings();

        @Override
        public Runnable start(Listener listener) {
            throw new UnsupportedOperationException();
        }

        @Override
        public ClientStream newStream(MethodDescriptor<?, ?> method, Metadata headers, CallOptions callOptions) {
            return stream;
        }

        @Override
        public void shutdown(Status reason) {
        }

        @Override
        public void shutdownNow(Status reason) {
        }

        @Override
        public AdvertisedEncodings getAdvertisedEncodings() {
            return advertisedEncodings;
        }
    }

    private static final class ScriptedStream implements ClientStream {
        ClientStreamListener listener;
        Status cancelReason;

        @Override
        public void start(ClientStreamListener listener) {
            this.listener = listener;
        }

        @Override
        public void writeData(byte[] data) {
        }

        @Override
        public void halfClose() {
        }

        @Override
        public void cancel(Status reason) {
            cancelReason = reason;
        }
    }
}
