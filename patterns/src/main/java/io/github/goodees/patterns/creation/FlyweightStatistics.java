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

import org.immutables.value.Value;

/**
 * Point-in-time statistics of a {@link CachingFlyweightFactory}.
 */
@Value.Immutable
@Value.Style(get = "get*", jdkOnly = true, visibility = Value.Style.ImplementationVisibility.PACKAGE)
public interface FlyweightStatistics {
    /**
     * @return number of acquisitions answered with already existing instance
     */
    long getHits();

    /**
     * @return number of acquisitions that invoked the producer
     */
    long getMisses();

    /**
     * @return number of producer invocations that failed
     */
    long getFailures();

    /**
     * @return number of cached instances
     */
    int getSize();

    @Value.Derived
    default double getHitRatio() {
        long requests = getHits() + getMisses();
        return requests == 0 ? 0.0 : (double) getHits() / requests;
    }

    static FlyweightStatistics of(long hits, long misses, long failures, int size) {
        return ImmutableFlyweightStatistics.builder()
                .hits(hits)
                .misses(misses)
                .failures(failures)
                .size(size)
                .build();
    }
}
