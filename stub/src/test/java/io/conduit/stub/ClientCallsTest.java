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

package io.conduit.stub;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import io.conduit.CallOptions;
import io.conduit.ManagedChannel;
import io.conduit.MethodDescriptor;
import io.conduit.ServerServiceDefinition;
import io.conduit.Status;
import io.conduit.StatusRuntimeException;
import io.conduit.inprocess.InProcessChannelBuilder;
import io.conduit.inprocess.InProcessServer;
import io.conduit.inprocess.InProcessServerBuilder;
import io.conduit.testing.StringMarshaller;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClientCallsTest {

    private static final String SERVICE = "test.Letters";

    private static final MethodDescriptor<String, String> UPPER =
            method(MethodDescriptor.MethodType.UNARY, "Upper");
    private static final MethodDescriptor<String, String> SPELL =
            method(MethodDescriptor.MethodType.SERVER_STREAMING, "Spell");
    private static final MethodDescriptor<String, String> JOIN =
            method(MethodDescriptor.MethodType.CLIENT_STREAMING, "Join");
    private static final MethodDescriptor<String, String> ECHO =
            method(MethodDescriptor.MethodType.BIDI_STREAMING, "Echo");
    private static final MethodDescriptor<String, String> HANG =
            method(MethodDescriptor.MethodType.SERVER_STREAMING, "Hang");
    private static final MethodDescriptor<String, String> STALL =
            method(MethodDescriptor.MethodType.UNARY, "Stall");

    private final AtomicInteger serverCancellations = new AtomicInteger();
    private final String serverName = InProcessServerBuilder.generateName();
    private InProcessServer server;
    private ManagedChannel channel;

    @BeforeEach
    void setUp() throws IOException {
        ServerServiceDefinition service = ServerServiceDefinition.builder(SERVICE)
                .addMethod(UPPER, ServerCalls.asyncUnaryCall(new ServerCalls.UnaryMethod<String, String>() {
                    @Override
                    public void invoke(String request, StreamObserver<String> responseObserver) {
                        if (request.isEmpty()) {
                            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription("empty").asRuntimeException());
                            return;
                        }
                        responseObserver.onNext(request.toUpperCase());
                        responseObserver.onCompleted();
                    }
                }))
                .addMethod(SPELL, ServerCalls.asyncServerStreamingCall(new ServerCalls.ServerStreamingMethod<String, String>() {
                    @Override
                    public void invoke(String request, StreamObserver<String> responseObserver) {
                        for (char c : request.toCharArray()) {
                            responseObserver.onNext(String.valueOf(c));
                        }
                        responseObserver.onCompleted();
                    }
                }))
                .addMethod(JOIN, ServerCalls.asyncClientStreamingCall(new ServerCalls.ClientStreamingMethod<String, String>() {
                    @Override
                    public StreamObserver<String> invoke(final StreamObserver<String> responseObserver) {
                        return new StreamObserver<String>() {
                            private final StringBuilder joined = new StringBuilder();

                            @Override
                            public void onNext(String value) {
                                joined.append(value);
                            }

                            @Override
                            public void onError(Throwable t) {
                            }

                            @Override
                            public void onCompleted() {
                                responseObserver.onNext(joined.toString());
                                responseObserver.onCompleted();
                            }
                        };
                    }
                }))
                .addMethod(ECHO, ServerCalls.asyncBidiStreamingCall(new ServerCalls.BidiStreamingMethod<String, String>() {
                    @Override
                    public StreamObserver<String> invoke(final StreamObserver<String> responseObserver) {
                        return new StreamObserver<String>() {
                            @Override
                            public void onNext(String value) {
                                responseObserver.onNext(value);
                            }

                            @Override
                            public void onError(Throwable t) {
                            }

                            @Override
                            public void onCompleted() {
                                responseObserver.onCompleted();
                            }
                        };
                    }
                }))
                .addMethod(HANG, ServerCalls.asyncServerStreamingCall(new ServerCalls.ServerStreamingMethod<String, String>() {
                    @Override
                    public void invoke(String request, StreamObserver<String> responseObserver) {
                        ((ServerCallStreamObserver<String>) responseObserver).setOnCancelHandler(new Runnable() {
                            @Override
                            public void run() {
                                serverCancellations.incrementAndGet();
                            }
                        });
                        responseObserver.onNext("first");
                    }
                }))
                .addMethod(STALL, ServerCalls.asyncUnaryCall(new ServerCalls.UnaryMethod<String, String>() {
                    @Override
                    public void invoke(String request, StreamObserver<String> responseObserver) {
                        ((ServerCallStreamObserver<String>) responseObserver).setOnCancelHandler(new Runnable() {
                            @Override
                            public void run() {
                                serverCancellations.incrementAndGet();
                            }
                        });
                    }
                }))
                .build();
        server = InProcessServerBuilder.forName(serverName)
                .directExecutor()
                .addService(service)
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(serverName).directExecutor().build();
    }

    @AfterEach
    void tearDown() {
        channel.shutdownNow();
        server.shutdownNow();
    }

    @Test
    void blockingUnaryReturnsResponse() {
        assertEquals("ABC", ClientCalls.blockingUnaryCall(channel, UPPER, CallOptions.DEFAULT, "abc"));
    }

    @Test
    void blockingUnaryThrowsServerStatus() {
        StatusRuntimeException e = assertThrows(StatusRuntimeException.class, new Executable() {
            @Override
            public void execute() {
                ClientCalls.blockingUnaryCall(channel, UPPER, CallOptions.DEFAULT, "");
            }
        });
        assertEquals(Status.Code.INVALID_ARGUMENT, e.getStatus().getCode());
        assertEquals("empty", e.getStatus().getDescription());
    }

    @Test
    void serverStreamingIteratorYieldsInOrderThenEnds() {
        final ResponseIterator<String> responses =
                ClientCalls.blockingServerStreamingCall(channel, SPELL, CallOptions.DEFAULT, "abc");
        List<String> received = new ArrayList<>();
        while (responses.hasNext()) {
            received.add(responses.next());
        }

        assertEquals(ImmutableList.of("a", "b", "c"), received);
        // 迭代器只能遍历一次
        assertFalse(responses.hasNext());
        assertThrows(NoSuchElementException.class, new Executable() {
            @Override
            public void execute() {
                responses.next();
            }
        });
    }

    @Test
    void closingIteratorCancelsCall() throws Exception {
        ResponseIterator<String> responses =
                ClientCalls.blockingServerStreamingCall(channel, HANG, CallOptions.DEFAULT, "x");
        assertEquals("first", responses.next());

        responses.close();

        assertFalse(responses.hasNext());
        assertEquals(1, serverCancellations.get());
    }

    @Test
    void blockingClientStreamingSendsEveryRequest() {
        String joined = ClientCalls.blockingClientStreamingCall(channel, JOIN, CallOptions.DEFAULT,
                ImmutableList.of("x", "y", "z").iterator());
        assertEquals("xyz", joined);
    }

    @Test
    void futureUnaryCompletesWithResponse() throws Exception {
        ListenableFuture<String> future =
                ClientCalls.futureUnaryCall(channel.newCall(UPPER, CallOptions.DEFAULT), "hi");
        assertTrue(future.isDone());
        assertEquals("HI", future.get());
    }

    @Test
    void futureUnaryFailsWithStatus() {
        final ListenableFuture<String> future =
                ClientCalls.futureUnaryCall(channel.newCall(UPPER, CallOptions.DEFAULT), "");
        ExecutionException e = assertThrows(ExecutionException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                future.get();
            }
        });
        assertEquals(Status.Code.INVALID_ARGUMENT, Status.fromThrowable(e.getCause()).getCode());
    }

    @Test
    void bidiStreamingEchoesEachMessage() {
        RecordingObserver responses = new RecordingObserver();
        StreamObserver<String> requests = ClientCalls.asyncBidiStreamingCall(
                channel.newCall(ECHO, CallOptions.DEFAULT), responses);
        requests.onNext("one");
        requests.onNext("two");
        requests.onCompleted();

        assertEquals(ImmutableList.of("one", "two"), responses.values);
        assertTrue(responses.completed);
        assertEquals(null, responses.error);
    }

    @Test
    void asyncUnaryReportsErrorToObserver() {
        RecordingObserver responses = new RecordingObserver();
        ClientCalls.asyncUnaryCall(channel.newCall(UPPER, CallOptions.DEFAULT), "", responses);

        assertTrue(responses.values.isEmpty());
        assertFalse(responses.completed);
        assertEquals(Status.Code.INVALID_ARGUMENT, Status.fromThrowable(responses.error).getCode());
    }

    @Test
    void interruptedBlockingCallIsCancelledAndKeepsInterruptFlag() {
        Thread.currentThread().interrupt();
        try {
            StatusRuntimeException e = assertThrows(StatusRuntimeException.class, new Executable() {
                @Override
                public void execute() {
                    ClientCalls.blockingUnaryCall(channel, STALL, CallOptions.DEFAULT, "x");
                }
            });
            assertEquals(Status.Code.CANCELLED, e.getStatus().getCode());
            assertEquals("Thread interrupted", e.getStatus().getDescription());
            assertTrue(Thread.currentThread().isInterrupted());
            assertEquals(1, serverCancellations.get());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void requestObserverRejectsMessagesAfterCompletion() {
        RecordingObserver responses = new RecordingObserver();
        final StreamObserver<String> requests = ClientCalls.asyncClientStreamingCall(
                channel.newCall(JOIN, CallOptions.DEFAULT), responses);
        requests.onNext("a");
        requests.onCompleted();

        assertEquals(ImmutableList.of("a"), responses.values);
        assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() {
                requests.onNext("late");
            }
        });
    }

    private static MethodDescriptor<String, String> method(MethodDescriptor.MethodType type, String name) {
        return MethodDescriptor.<String, String>newBuilder()
                .setType(type)
                .setFullMethodName(MethodDescriptor.generateFullMethodName(SERVICE, name))
                .setRequestMarshaller(StringMarshaller.INSTANCE)
                .setResponseMarshaller(StringMarshaller.INSTANCE)
                .build();
    }

    private static final class RecordingObserver implements StreamObserver<String> {
        final List<String> values = new ArrayList<>();
        Throwable error;
        boolean completed;

        @Override
        public void onNext(String value) {
            values.add(value);
        }

        @Override
        public void onError(Throwable t) {
            error = t;
        }

        @Override
        public void onCompleted() {
            completed = true;
        }
    }
}
