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

import com.google.common.collect.ImmutableList;
import io.conduit.Metadata;
import io.conduit.Status;
import io.conduit.StatusException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouterTest {

    private static final ImmutableList<HeaderMatcher> NO_HEADERS = ImmutableList.of();

    @Test
    void firstMatchingRouteWins() {
        RouteTable table = new RouteTable(ImmutableList.of(
                new Route(new RouteMatch(null, "/pkg.Orders/", NO_HEADERS), "orders"),
                new Route(new RouteMatch(null, "/pkg.", NO_HEADERS), "pkg"),
                new Route(RouteMatch.any(), "default")));

        assertEquals("orders", table.resolve("svc", "/pkg.Orders/Get", new Metadata()));
        assertEquals("pkg", table.resolve("svc", "/pkg.Users/Get", new Metadata()));
        assertEquals("default", table.resolve("svc", "/other.Thing/Do", new Metadata()));
    }

    @Test
    void noMatchResolvesToNull() {
        RouteTable table = new RouteTable(ImmutableList.of(
                new Route(new RouteMatch(null, "/pkg.Orders/", NO_HEADERS), "orders")));

        assertNull(table.resolve("svc", "/pkg.Users/Get", new Metadata()));
        assertNull(RouteTable.EMPTY.resolve("svc", "/pkg.Users/Get", new Metadata()));
    }

    @Test
    void authorityPatterns() {
        RouteTable table = new RouteTable(ImmutableList.of(
                new Route(new RouteMatch("api.example.com", "", NO_HEADERS), "exact"),
                new Route(new RouteMatch("*.example.com", "", NO_HEADERS), "wildcard"),
                new Route(new RouteMatch("*", "", NO_HEADERS), "any")));

        assertEquals("exact", table.resolve("API.example.com", "/s/m", new Metadata()));
        assertEquals("wildcard", table.resolve("web.example.com", "/s/m", new Metadata()));
        // 通配符不匹配后缀本身
        assertEquals("any", table.resolve("example.com", "/s/m", new Metadata()));
        assertEquals("any", table.resolve("other.org", "/s/m", new Metadata()));
    }

    @Test
    void headerMatchers() {
        RouteTable table = new RouteTable(ImmutableList.of(
                new Route(new RouteMatch(null, "", ImmutableList.of(HeaderMatcher.exact("x-tier", "gold", false))), "gold"),
                new Route(new RouteMatch(null, "", ImmutableList.of(HeaderMatcher.prefix("x-tier", "sil", false))), "silver"),
                new Route(new RouteMatch(null, "", ImmutableList.of(HeaderMatcher.present("x-debug", false))), "debug"),
                new Route(new RouteMatch(null, "", ImmutableList.of(HeaderMatcher.present("x-internal", true))), "public")));

        Metadata gold = new Metadata();
        gold.put("x-tier", "gold");
        assertEquals("gold", table.resolve("svc", "/s/m", gold));

        Metadata silver = new Metadata();
        silver.put("x-tier", "silver");
        assertEquals("silver", table.resolve("svc", "/s/m", silver));

        Metadata debug = new Metadata();
        debug.put("x-debug", "1");
        assertEquals("debug", table.resolve("svc", "/s/m", debug));

        assertEquals("public", table.resolve("svc", "/s/m", new Metadata()));

        Metadata internal = new Metadata();
        internal.put("x-internal", "yes");
        assertNull(table.resolve("svc", "/s/m", internal));
    }

    @Test
    void repeatedHeaderValuesAreJoined() {
        HeaderMatcher matcher = HeaderMatcher.exact("x-list", "a,b", false);
        Metadata headers = new Metadata();
        headers.put("x-list", "a");
        headers.put("x-list", "b");

        assertTrue(matcher.matches(headers));
    }

    @Test
    void routerFailsUnavailableWithoutRoute() throws StatusException {
        final Router router = new Router();
        assertSame(RouteTable.EMPTY, router.current());

        StatusException e = assertThrows(StatusException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                router.resolve("svc", "pkg.Orders/Get", new Metadata());
            }
        });
        assertEquals(Status.Code.UNAVAILABLE, e.getStatus().getCode());

        router.update(new RouteTable(ImmutableList.of(
                new Route(new RouteMatch(null, "/pkg.Orders/", NO_HEADERS), "orders"))));
        assertEquals("orders", router.resolve("svc", "pkg.Orders/Get", new Metadata()));
    }
}
