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

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.TimeUnit;

/**
 * A {@link Channel} that provides lifecycle management.
 * 提供生命周期管理的 Channel
 */
@ThreadSafe
public abstract class ManagedChannel extends Channel {

    /**
     * Initiates an orderly shutdown in which preexisting calls continue but new calls are
     * immediately cancelled.
     * 有序关闭，已经存在的调用继续，新的调用会被取消
     *
     * @return this
     */
    public abstract ManagedChannel shutdown();

    /**
     * Returns whether the channel is shutdown. Shutdown channels immediately cancel any new calls,
     * but may still have some calls being processed.
     * 是否已经关闭
     */
    public abstract boolean isShutdown();

    /**
     * Returns whether the channel is terminated. Terminated channels have no running calls and
     * relevant resources released (like TCP connections).
     * 是否已经终止，终止的 Channel 没有运行中的调用，相关资源已经释放
     */
    public abstract boolean isTerminated();

    /**
     * Initiates a forceful shutdown in which preexisting and new calls are cancelled. Although
     * forceful, the shutdown process is still not instantaneous; {@link #isTerminated()} will likely
     * return {@code false} immediately after this method returns.
     * 强制关闭，已有的和新的调用都会被取消
     *
     * @return this
     */
    public abstract ManagedChannel shutdownNow();

    /**
     * Waits for the channel to become terminated, giving up if the timeout is reached.
     * 等待 Channel 终止，超时则放弃
     *
     * @return whether the channel is terminated, as would be done by {@link #isTerminated()}.
     */
    public abstract boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;
}
