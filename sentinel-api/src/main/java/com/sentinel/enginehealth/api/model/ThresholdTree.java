/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Nested threshold configuration: either a {@link Leaf} value or a {@link Node}
 * mapping keys to subtrees.
 *
 * <p>Leaves never hold {@code null}; numbers are normalized to {@link Double} so that
 * {@code 20} and {@code 20.0} compare equal. Lists are leaves and are always
 * replaced wholesale by a merge.
 *
 * <pre>
 * ThresholdTree.Node tree = ThresholdTree.fromMap(Map.of(
 *     "oilPressure", Map.of("warning", Map.of("min", 20))));
 * tree.numberAt("oilPressure.warning.min"); // OptionalDouble[20.0]
 * </pre>
 */
public sealed interface ThresholdTree permits ThresholdTree.Leaf, ThresholdTree.Node {

    /**
     * Plain Java form: {@code Map}, {@code List}, {@code Double}, {@code Boolean} or {@code String}.
     */
    Object toPlain();

    record Leaf(Object value) implements ThresholdTree {

        public Leaf {
            value = normalize(Objects.requireNonNull(value, "leaf value must not be null"));
        }

        @Override
        public Object toPlain() {
            return value;
        }

        public OptionalDouble asNumber() {
            return value instanceof Double d ? OptionalDouble.of(d) : OptionalDouble.empty();
        }
    }

    record Node(Map<String, ThresholdTree> children) implements ThresholdTree {

        private static final Node EMPTY = new Node(Map.of());

        public Node {
            Objects.requireNonNull(children, "children");
            Map<String, ThresholdTree> copy = new LinkedHashMap<>();
            children.forEach((key, child) -> copy.put(
                    Objects.requireNonNull(key, "key"),
                    Objects.requireNonNull(child, "child of " + key)));
            children = Collections.unmodifiableMap(copy);
        }

        public static Node empty() {
            return EMPTY;
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }

        public Optional<ThresholdTree> child(String key) {
            return Optional.ofNullable(children.get(key));
        }

        /**
         * Looks up a subtree by dotted path, e.g. {@code "oilPressure.critical.min"}.
         */
        public Optional<ThresholdTree> find(String dottedPath) {
            ThresholdTree current = this;
            for (String segment : dottedPath.split("\\.")) {
                if (!(current instanceof Node node)) {
                    return Optional.empty();
                }
                current = node.children.get(segment);
                if (current == null) {
                    return Optional.empty();
                }
            }
            return Optional.of(current);
        }

        public OptionalDouble numberAt(String dottedPath) {
            return find(dottedPath)
                    .filter(Leaf.class::isInstance)
                    .map(t -> ((Leaf) t).asNumber())
                    .orElse(OptionalDouble.empty());
        }

        @Override
        public Map<String, Object> toPlain() {
            Map<String, Object> plain = new LinkedHashMap<>();
            children.forEach((key, child) -> plain.put(key, child.toPlain()));
            return plain;
        }
    }

    /**
     * Builds a tree from plain nested maps. Entries whose value is {@code null}
     * (or a NaN number) are dropped, since they never carry a threshold.
     */
    static Node fromMap(Map<String, ?> source) {
        if (source == null) {
            return Node.empty();
        }
        Map<String, ThresholdTree> children = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            ThresholdTree child = fromValue(value);
            if (child != null) {
                children.put(key, child);
            }
        });
        return new Node(children);
    }

    @SuppressWarnings("unchecked")
    private static ThresholdTree fromValue(Object value) {
        if (value == null || (value instanceof Double d && d.isNaN())) {
            return null;
        }
        if (value instanceof ThresholdTree tree) {
            return tree;
        }
        if (value instanceof Map<?, ?> map) {
            return fromMap((Map<String, ?>) map);
        }
        return new Leaf(value);
    }

    private static Object normalize(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(element == null ? null : normalize(element));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, v == null ? null : normalize(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Boolean || value instanceof String) {
            return value;
        }
        throw new IllegalArgumentException("Unsupported threshold value type: " + value.getClass().getName());
    }
}
