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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Derives the key as compact JSON array {@code [identifier, context]}, e. g.
 * {@code ["Foo",{"a":"one","b":["java.lang.Integer",2]}]}.
 * <h2>Canonical form</h2>
 * Equal contexts (as by {@link Map#equals(Object)}) yield equal keys, and values of different types never share
 * a representation:
 * <ul>
 * <li>Strings, booleans and null are written as plain JSON values</li>
 * <li>Every other value is written as pair {@code [tag, payload]}. Collections and optionals are tagged by their
 * kind, {@code @map}, {@code @set}, {@code @list}, {@code @array} and {@code @optional}, so that equal collections of
 * different implementation share the key. Anything else is tagged with its class name, {@code 'a'} and {@code "a"},
 * or {@code 1} and {@code 1L} yield different keys</li>
 * <li>Entries of the context are ordered by key. Entries of nested maps and elements of sets are ordered by their
 * written form. Lists and arrays keep their order</li>
 * <li>Other objects are written by the mapper with properties ordered by name. Sets within them are ordered
 * as well. {@code java.time} values are written as ISO-8601 strings</li>
 * </ul>
 * Since the identifier is written as JSON string, no identifier and context can produce the key of other pair.
 * Values the mapper cannot write, e. g. objects without properties, are rejected.
 */
public class CanonicalKeyDerivation implements KeyDerivation {
    static final String MAP = "@map";
    static final String SET = "@set";
    static final String LIST = "@list";
    static final String ARRAY = "@array";
    static final String OPTIONAL = "@optional";

    private static final Comparator<JsonNode> WRITTEN_FORM = Comparator.comparing(JsonNode::toString);

    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public CanonicalKeyDerivation() {
        this(createMapper());
    }

    /**
     * Derive keys with customized mapper, e. g. one with serializers for context values. The mapper is copied, and
     * ordering of map entries and set elements is applied to the copy.
     *
     * @param mapper the mapper to write values with
     */
    public CanonicalKeyDerivation(ObjectMapper mapper) {
        ObjectMapper canonical = mapper.copy();
        canonical.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        canonical.registerModule(new SimpleModule("canonical-sets").addSerializer(new SortedSetSerializer(canonical)));
        this.mapper = canonical;
        this.writer = canonical.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .addModules(new Jdk8Module(), new JavaTimeModule())
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    @Override
    public String deriveKey(String identifier, Map<String, ?> context) {
        ArrayNode key = nodes.arrayNode();
        key.add(identifier);
        ObjectNode entries = key.addObject();
        try {
            for (Map.Entry<String, ?> entry : new TreeMap<>(context).entrySet()) {
                entries.set(entry.getKey(), canonical(entry.getValue()));
            }
            return writer.writeValueAsString(key);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Context of " + identifier + " cannot be converted to a key. "
                    + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Context of " + identifier + " cannot be converted to a key. "
                    + e.getMessage(), e);
        }
    }

    private JsonNode canonical(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof String) {
            return TextNode.valueOf((String) value);
        }
        if (value instanceof Boolean) {
            return BooleanNode.valueOf((Boolean) value);
        }
        if (value instanceof Map) {
            List<JsonNode> entries = new ArrayList<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                entries.add(nodes.arrayNode().add(canonical(entry.getKey())).add(canonical(entry.getValue())));
            }
            return tagged(MAP, sorted(entries));
        }
        if (value instanceof Set) {
            return tagged(SET, sorted(elements(((Set<?>) value).iterator())));
        }
        if (value instanceof List) {
            return tagged(LIST, elements(((List<?>) value).iterator()));
        }
        if (value instanceof Collection) {
            return tagged(value.getClass().getName(), elements(((Collection<?>) value).iterator()));
        }
        if (value.getClass().isArray()) {
            List<JsonNode> elements = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) {
                elements.add(canonical(Array.get(value, i)));
            }
            return tagged(ARRAY, elements);
        }
        if (value instanceof Optional) {
            return nodes.arrayNode().add(OPTIONAL).add(canonical(((Optional<?>) value).orElse(null)));
        }
        Class<?> type = value instanceof Enum ? ((Enum<?>) value).getDeclaringClass() : value.getClass();
        JsonNode payload = mapper.valueToTree(value);
        return nodes.arrayNode().add(type.getName()).add(orderedProperties(payload));
    }

    private List<JsonNode> elements(Iterator<?> values) {
        List<JsonNode> elements = new ArrayList<>();
        values.forEachRemaining(v -> elements.add(canonical(v)));
        return elements;
    }

    private static List<JsonNode> sorted(List<JsonNode> elements) {
        elements.sort(WRITTEN_FORM);
        return elements;
    }

    private ArrayNode tagged(String tag, List<JsonNode> elements) {
        ArrayNode result = nodes.arrayNode().add(tag);
        result.addArray().addAll(elements);
        return result;
    }

    // mapper might not order properties of beans by itself
    private JsonNode orderedProperties(JsonNode node) {
        if (node.isObject()) {
            ObjectNode result = nodes.objectNode();
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            names.sort(Comparator.naturalOrder());
            for (String name : names) {
                result.set(name, orderedProperties(node.get(name)));
            }
            return result;
        }
        if (node.isArray()) {
            ArrayNode result = nodes.arrayNode();
            for (JsonNode element : node) {
                result.add(orderedProperties(element));
            }
            return result;
        }
        return node;
    }

    /**
     * Writes elements of sets nested in other objects in order of their written form.
     */
    static class SortedSetSerializer extends StdSerializer<Set<?>> {
        private final ObjectMapper mapper;

        SortedSetSerializer(ObjectMapper mapper) {
            super(Set.class, false);
            this.mapper = mapper;
        }

        @Override
        public void serialize(Set<?> value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            List<JsonNode> elements = new ArrayList<>();
            for (Object element : value) {
                JsonNode node = element == null ? NullNode.getInstance() : mapper.valueToTree(element);
                elements.add(node);
            }
            elements.sort(WRITTEN_FORM);
            gen.writeStartArray();
            for (JsonNode element : elements) {
                provider.defaultSerializeValue(element, gen);
            }
            gen.writeEndArray();
        }
    }
}
