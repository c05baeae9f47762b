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

import io.conduit.Metadata;
import io.conduit.Status;
import io.conduit.StatusException;

import javax.annotation.concurrent.ThreadSafe;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Resolves calls to clusters against the current {@link RouteTable}. The table is replaced as a
 * whole, so a resolution never sees a partially applied update.
 * 根据当前路由表将调用解析到集群，路由表整体替换
 */
@ThreadSafe
public final class Router {

    private static final Logger logger = Logger.getLogger(Router.class.getName());

    private volatile RouteTable table = RouteTable.EMPTY;

    /**
     * Returns the cluster the call is routed to.
     * 返回调用路由到的集群
     *
     * @param fullMethodName the method's full name, {@code service/method}
     * @throws StatusException with {@code UNAVAILABLE} if no route matches
     */
    public String resolve(String authority, String fullMethodName, Metadata headers) throws StatusException {
        String path = "/" + fullMethodName;
        String cluster = table.resolve(authority, path, headers);
        if (cluster == null) {
            throw Status.UNAVAILABLE
                    .withDescription("no route for " + authority + path)
                    .asException();
        }
        return cluster;
    }

    /**
     * Replaces the route table.
     */
    public void update(RouteTable newTable) {
        this.table = checkNotNull(newTable, "newTable");
        logger.log(Level.FINE, "Route table updated: {0}", newTable);
    }

    public RouteTable current() {
        return table;
    }
}
