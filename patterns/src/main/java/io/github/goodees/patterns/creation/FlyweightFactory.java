package io.github.goodees.patterns.creation;

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

import java.util.Collections;
import java.util.Map;

/**
 * The Flyweight Factory pattern. Instead of constructing a fresh object for every request, the factory hands out
 * a shared instance for all requests with equal identifier and context.
 * <p>For any pair of value-equal {@code (identifier, context)} arguments, acquire returns the very same instance
 * (reference equality) until the instance is explicitly evicted from the factory.</p>
 *
 * @param <V> type of produced values
 * @see CachingFlyweightFactory
 */
public interface FlyweightFactory<V> {
    /**
     * Obtain the shared instance for an identifier and context, constructing it on first request.
     *
     * @param identifier the kind of object to produce
     * @param context    named parameters of the construction. Null is treated as empty context
     * @return shared instance
     * @throws ConstructionException or any other runtime exception the construction failed with. Failure is never
     *                               cached, subsequent call will attempt the construction again.
     */
    V acquire(String identifier, Map<String, ?> context);

    default V acquire(String identifier) {
        return acquire(identifier, Collections.emptyMap());
    }
}
