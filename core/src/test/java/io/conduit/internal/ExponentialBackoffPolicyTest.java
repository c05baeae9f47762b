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

import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExponentialBackoffPolicyTest {

    @Test
    void growsByMultiplierUpToMaximum() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(new Random(),
                TimeUnit.SECONDS.toNanos(1), TimeUnit.SECONDS.toNanos(30), 2.0, 0);

        assertEquals(TimeUnit.SECONDS.toNanos(1), policy.nextBackoffNanos());
        assertEquals(TimeUnit.SECONDS.toNanos(2), policy.nextBackoffNanos());
        assertEquals(TimeUnit.SECONDS.toNanos(4), policy.nextBackoffNanos());
        assertEquals(TimeUnit.SECONDS.toNanos(8), policy.nextBackoffNanos());
        assertEquals(TimeUnit.SECONDS.toNanos(16), policy.nextBackoffNanos());
        assertEquals(TimeUnit.SECONDS.toNanos(30), policy.nextBackoffNanos());
        assertEquals(TimeUnit.SECONDS.toNanos(30), policy.nextBackoffNanos());
    }

    @Test
    void jitterStaysWithinBounds() {
        BackoffPolicy policy = new ExponentialBackoffPolicy.Provider().get();
        long initial = TimeUnit.SECONDS.toNanos(1);
        long first = policy.nextBackoffNanos();
        assertTrue(first >= initial * 0.8 && first <= initial * 1.2, "first backoff " + first);
        long second = policy.nextBackoffNanos();
        assertTrue(second >= initial * 1.6 * 0.8 && second <= initial * 1.6 * 1.2, "second backoff " + second);
    }

    @Test
    void providerCreatesIndependentSequences() {
        ExponentialBackoffPolicy.Provider provider = new ExponentialBackoffPolicy.Provider().setJitter(0);
        BackoffPolicy first = provider.get();
        first.nextBackoffNanos();
        first.nextBackoffNanos();

        assertEquals(TimeUnit.SECONDS.toNanos(1), provider.get().nextBackoffNanos());
    }
}
