package io.github.goodees.patterns.collection;

/*-
 * #%L
 * patterns
 * %%
 * Copyright (C) 2018 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import org.junit.Test;

import static org.junit.Assert.*;

public class ForwardingKeyedStoreTest {

    static class Services implements ForwardingKeyedStore<Object> {
        private final Registry<Object> services = new Registry<>();

        @Override
        public KeyedStore<Object> delegate() {
            return services;
        }

        <T> T lookup(String name, Class<T> type) {
            return type.cast(get(name));
        }
    }

    @Test
    public void host_exposes_store_operations() {
        Services services = new Services();
        services.set("clock", "system").set("answer", 42);

        assertEquals(Integer.valueOf(42), services.lookup("answer", Integer.class));
        assertTrue(services.has("clock"));
        assertEquals(2, services.size());
        assertEquals(2, services.services.size());
    }

    @Test
    public void chaining_returns_the_host() {
        Services services = new Services();
        assertSame(services, services.set("a", 1));
        assertSame(services, services.remove("a"));
        assertSame(services, services.clear());
    }

    @Test
    public void host_state_lives_in_delegate() {
        Services services = new Services();
        services.set("a", 1);
        services.services.remove("a");
        assertFalse(services.has("a"));
        assertTrue(services.isEmpty());
        assertEquals("default", services.get("a", "default"));
    }

    @Test
    public void take_removes_from_delegate() {
        Services services = new Services();
        services.set("a", 1);
        assertEquals(1, services.take("a"));
        assertFalse(services.services.has("a"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void all_is_read_only() {
        Services services = new Services();
        services.set("a", 1);
        services.all().clear();
    }
}
