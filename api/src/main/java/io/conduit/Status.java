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
import com.google.common.base.Objects;
import com.google.common.base.Throwables;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Defines the status of an operation by providing a standard {@link Code} in conjunction with an
 * optional descriptive message and opaque detail bytes. Every call terminates with exactly one
 * {@code Status}.
 * 调用的终止状态，包含状态码、可选的描述信息和不透明的详情字节，每个调用都只会有一个终止状态
 *
 * <p>Instances are immutable; the {@code withXxx} methods return new instances.
 */
@Immutable
@CheckReturnValue
public final class Status {

    /**
     * The set of canonical status codes. Numeric values are part of the wire contract.
     * 标准的状态码，数值是协议的一部分
     */
    public enum Code {
        OK(0),
        CANCELLED(1),
        UNKNOWN(2),
        INVALID_ARGUMENT(3),
        DEADLINE_EXCEEDED(4),
        NOT_FOUND(5),
        ALREADY_EXISTS(6),
        PERMISSION_DENIED(7),
        RESOURCE_EXHAUSTED(8),
        FAILED_PRECONDITION(9),
        ABORTED(10),
        OUT_OF_RANGE(11),
        UNIMPLEMENTED(12),
        INTERNAL(13),
        UNAVAILABLE(14),
        DATA_LOSS(15),
        UNAUTHENTICATED(16);

        private final int value;

        Code(int value) {
            this.value = value;
        }

        /**
         * The numerical value of the code.
         * 状态码的数值
         */
        public int value() {
            return value;
        }

        /**
         * Returns a {@link Status} object corresponding to this status code.
         */
        public Status toStatus() {
            return STATUS_LIST.get(value);
        }
    }

    // Create the canonical list of Status instances indexed by their code values.
    // 根据状态码的值创建标准的状态集合
    private static final List<Status> STATUS_LIST = buildStatusList();

    private static List<Status> buildStatusList() {
        TreeMap<Integer, Status> canonicalizer = new TreeMap<>();
        for (Code code : Code.values()) {
            Status replaced = canonicalizer.put(code.value(), new Status(code, null, null, null));
            if (replaced != null) {
                throw new IllegalStateException("Code value duplication between "
                        + replaced.getCode().name() + " & " + code.name());
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(canonicalizer.values()));
    }

    public static final Status OK = Code.OK.toStatus();
    public static final Status CANCELLED = Code.CANCELLED.toStatus();
    public static final Status UNKNOWN = Code.UNKNOWN.toStatus();
    public static final Status INVALID_ARGUMENT = Code.INVALID_ARGUMENT.toStatus();
    public static final Status DEADLINE_EXCEEDED = Code.DEADLINE_EXCEEDED.toStatus();
    public static final Status NOT_FOUND = Code.NOT_FOUND.toStatus();
    public static final Status ALREADY_EXISTS = Code.ALREADY_EXISTS.toStatus();
    public static final Status PERMISSION_DENIED = Code.PERMISSION_DENIED.toStatus();
    public static final Status RESOURCE_EXHAUSTED = Code.RESOURCE_EXHAUSTED.toStatus();
    public static final Status FAILED_PRECONDITION = Code.FAILED_PRECONDITION.toStatus();
    public static final Status ABORTED = Code.ABORTED.toStatus();
    public static final Status OUT_OF_RANGE = Code.OUT_OF_RANGE.toStatus();
    public static final Status UNIMPLEMENTED = Code.UNIMPLEMENTED.toStatus();
    public static final Status INTERNAL = Code.INTERNAL.toStatus();
    public static final Status UNAVAILABLE = Code.UNAVAILABLE.toStatus();
    public static final Status DATA_LOSS = Code.DATA_LOSS.toStatus();
    public static final Status UNAUTHENTICATED = Code.UNAUTHENTICATED.toStatus();

    /**
     * Return a {@link Status} given a canonical error {@link Code} value. Unknown values map to
     * {@link #UNKNOWN} with a description naming the value.
     * 根据状态码的数值返回状态，未知的数值会转为 UNKNOWN
     */
    public static Status fromCodeValue(int codeValue) {
        if (codeValue < 0 || codeValue >= STATUS_LIST.size()) {
            return UNKNOWN.withDescription("Unknown code " + codeValue);
        }
        return STATUS_LIST.get(codeValue);
    }

    /**
     * Convert a {@link Code} into a {@link Status}.
     */
    public static Status fromCode(Code code) {
        return code.toStatus();
    }

    /**
     * Extract an error {@link Status} from the causal chain of a {@link Throwable}.
     * If no status can be found, a status is created with {@link Code#UNKNOWN} as its code and
     * {@code t} as its cause.
     * 从异常链中获取状态，如果没有则返回以异常为原因的 UNKNOWN 状态
     */
    public static Status fromThrowable(Throwable t) {
        for (Throwable cause : Throwables.getCausalChain(checkNotNull(t, "t"))) {
            if (cause instanceof StatusException) {
                return ((StatusException) cause).getStatus();
            } else if (cause instanceof StatusRuntimeException) {
                return ((StatusRuntimeException) cause).getStatus();
            }
        }
        return UNKNOWN.withCause(t);
    }

    /**
     * Extract the trailers carried by a status exception in the causal chain, if any.
     * 从异常链中获取 trailers
     */
    @Nullable
    public static Metadata trailersFromThrowable(Throwable t) {
        for (Throwable cause : Throwables.getCausalChain(checkNotNull(t, "t"))) {
            if (cause instanceof StatusException) {
                return ((StatusException) cause).getTrailers();
            } else if (cause instanceof StatusRuntimeException) {
                return ((StatusRuntimeException) cause).getTrailers();
            }
        }
        return null;
    }

    private final Code code;
    private final String description;
    private final Throwable cause;
    private final byte[] details;

    private Status(Code code, @Nullable String description, @Nullable Throwable cause,
                   @Nullable byte[] details) {
        this.code = checkNotNull(code, "code");
        this.description = description;
        this.cause = cause;
        this.details = details;
    }

    /**
     * Create a derived instance of {@link Status} with the given cause.
     * However, the cause is not transmitted from server to client.
     * 使用指定的原因创建新的状态，原因不会被传输给对端
     */
    public Status withCause(Throwable cause) {
        if (Objects.equal(this.cause, cause)) {
            return this;
        }
        return new Status(this.code, this.description, cause, this.details);
    }

    /**
     * Create a derived instance of {@link Status} with the given description.
     * 使用指定的描述创建新的状态
     */
    public Status withDescription(String description) {
        if (Objects.equal(this.description, description)) {
            return this;
        }
        return new Status(this.code, description, this.cause, this.details);
    }

    /**
     * Create a derived instance of {@link Status} augmenting the current description with
     * additional detail.
     * 在现有描述的基础上追加信息
     */
    public Status augmentDescription(String additionalDetail) {
        if (additionalDetail == null) {
            return this;
        } else if (this.description == null) {
            return new Status(this.code, additionalDetail, this.cause, this.details);
        } else {
            return new Status(this.code, this.description + "\n" + additionalDetail, this.cause,
                    this.details);
        }
    }

    /**
     * Create a derived instance carrying opaque structured detail bytes.
     * 携带结构化详情字节的状态
     */
    public Status withDetails(@Nullable byte[] details) {
        return new Status(this.code, this.description, this.cause,
                details == null ? null : details.clone());
    }

    /**
     * The canonical status code.
     */
    public Code getCode() {
        return code;
    }

    /**
     * A description of this status for human consumption.
     */
    @Nullable
    public String getDescription() {
        return description;
    }

    /**
     * The underlying cause of an error.
     */
    @Nullable
    public Throwable getCause() {
        return cause;
    }

    /**
     * Opaque detail bytes, or {@code null} when the status carries none.
     */
    @Nullable
    public byte[] getDetails() {
        return details == null ? null : details.clone();
    }

    /**
     * Is this status OK, i.e., not an error.
     */
    public boolean isOk() {
        return Code.OK == code;
    }

    /**
     * Convert this {@link Status} to a {@link RuntimeException}.
     */
    public StatusRuntimeException asRuntimeException() {
        return new StatusRuntimeException(this);
    }

    /**
     * Same as {@link #asRuntimeException()} but includes the provided trailers.
     */
    public StatusRuntimeException asRuntimeException(@Nullable Metadata trailers) {
        return new StatusRuntimeException(this, trailers);
    }

    /**
     * Convert this {@link Status} to an {@link Exception}.
     */
    public StatusException asException() {
        return new StatusException(this);
    }

    /**
     * Same as {@link #asException()} but includes the provided trailers.
     */
    public StatusException asException(@Nullable Metadata trailers) {
        return new StatusException(this, trailers);
    }

    static String formatThrowableMessage(Status status) {
        if (status.description == null) {
            return status.code.toString();
        } else {
            return status.code + ": " + status.description;
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("code", code.name())
                .add("description", description)
                .add("cause", cause != null ? Throwables.getStackTraceAsString(cause) : cause)
                .add("details", details != null ? details.length + " bytes" : null)
                .toString();
    }

    /**
     * Equality on Statuses is not well defined. Instead, do comparison based on their Code with
     * {@link #getCode}. The description and cause of the Status are unlikely to be stable, and
     * additional fields may be added to Status in the future.
     */
    @Override
    public boolean equals(Object obj) {
        return super.equals(obj);
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }
}
