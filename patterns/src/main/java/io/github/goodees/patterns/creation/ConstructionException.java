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

import java.util.Collection;

/**
 * Exception signalling that a {@link Producer} could not construct a value. The flyweight factory never wraps it,
 * callers of {@link FlyweightFactory#acquire(String, java.util.Map)} receive the very instance the producer threw.
 */
public class ConstructionException extends RuntimeException {
    private final Fault fault;
    private final String identifier;

    public enum Fault {
        UNKNOWN_IDENTIFIER, INVALID_CONTEXT, NULL_PRODUCT, PRODUCER_FAILED
    }

    protected ConstructionException(Fault fault, String identifier, String message, Throwable cause) {
        super(message, cause);
        this.fault = fault;
        this.identifier = identifier;
    }

    public Fault getFault() {
        return fault;
    }

    /**
     * @return identifier the construction was requested for
     */
    public String getIdentifier() {
        return identifier;
    }

    public static ConstructionException unknownIdentifier(String identifier, Collection<String> known) {
        return new ConstructionException(Fault.UNKNOWN_IDENTIFIER, identifier,
                "No producer known for identifier " + identifier + ". Known identifiers: " + known, null);
    }

    public static ConstructionException invalidContext(String identifier, String reason) {
        return new ConstructionException(Fault.INVALID_CONTEXT, identifier,
                "Invalid context for " + identifier + ": " + reason, null);
    }

    public static ConstructionException nullProduct(String identifier) {
        return new ConstructionException(Fault.NULL_PRODUCT, identifier,
                "Producer returned null for identifier " + identifier, null);
    }

    public static ConstructionException failed(String identifier, Throwable cause) {
        return new ConstructionException(Fault.PRODUCER_FAILED, identifier,
                "Construction of " + identifier + " failed. " + cause.getMessage(), cause);
    }
}
