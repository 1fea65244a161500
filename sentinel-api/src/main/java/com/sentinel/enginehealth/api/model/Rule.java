/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An anomaly rule: conditions plus the timing and severity that turn them into alerts.
 *
 * <p>Rules are replaced whole during profile resolution, never field-merged.
 * A {@link RuleType#TIP_MAP_DELTA} rule carries its configuration in
 * {@link #tipMapDelta()}; a {@link RuleType#GENERIC} rule carries none and needs
 * at least one condition.
 */
public record Rule(
        String id,
        String name,
        String description,
        String category,
        Severity severity,
        boolean enabled,
        LogicOperator logic,
        List<Condition> conditions,
        List<Condition> requireWhen,
        List<Condition> ignoreWhen,
        double triggerPersistenceSec,
        double clearPersistenceSec,
        double startDelaySec,
        double stopDelaySec,
        Double windowSec,
        RuleType type,
        TipMapDeltaConfig tipMapDelta) {

    public static final String DEFAULT_CATEGORY = "custom";

    public Rule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule id is required");
        }
        name = name == null || name.isBlank() ? id : name;
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
        severity = severity == null ? Severity.WARNING : severity;
        logic = logic == null ? LogicOperator.AND : logic;
        type = type == null ? RuleType.GENERIC : type;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        requireWhen = requireWhen == null ? List.of() : List.copyOf(requireWhen);
        ignoreWhen = ignoreWhen == null ? List.of() : List.copyOf(ignoreWhen);

        requireNonNegative("triggerPersistenceSec", triggerPersistenceSec);
        requireNonNegative("clearPersistenceSec", clearPersistenceSec);
        requireNonNegative("startDelaySec", startDelaySec);
        requireNonNegative("stopDelaySec", stopDelaySec);
        if (windowSec != null && !(windowSec > 0)) {
            throw new IllegalArgumentException("windowSec must be positive when set");
        }

        switch (type) {
            case GENERIC -> {
                if (conditions.isEmpty()) {
                    throw new IllegalArgumentException("Generic rule requires at least one condition");
                }
                if (tipMapDelta != null) {
                    throw new IllegalArgumentException("Generic rule cannot carry tip_map_delta config");
                }
            }
            case TIP_MAP_DELTA -> Objects.requireNonNull(tipMapDelta, "tip_map_delta rule requires config");
        }
    }

    private static void requireNonNegative(String field, double value) {
        if (Double.isNaN(value) || value < 0) {
            throw new IllegalArgumentException(field + " must be >= 0");
        }
    }

    public boolean hasWindow() {
        return windowSec != null;
    }

    /**
     * Every parameter name this rule reads, including gates and the load gate.
     */
    public Set<String> referencedParameters() {
        Set<String> params = new LinkedHashSet<>();
        conditions.forEach(c -> params.add(c.param()));
        requireWhen.forEach(c -> params.add(c.param()));
        ignoreWhen.forEach(c -> params.add(c.param()));
        if (tipMapDelta != null) {
            params.add(tipMapDelta.tipParam());
            params.add(tipMapDelta.mapParam());
            params.add(tipMapDelta.loadGate().condition().param());
        }
        return params;
    }

    /**
     * Plain nested-map form for consumers that serialize to their own transport format.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("name", name);
        if (description != null) {
            map.put("description", description);
        }
        map.put("category", category);
        map.put("severity", severity.name().toLowerCase(Locale.ROOT));
        map.put("enabled", enabled);
        map.put("logic", logic.name());
        map.put("conditions", conditionMaps(conditions));
        map.put("requireWhen", conditionMaps(requireWhen));
        map.put("ignoreWhen", conditionMaps(ignoreWhen));
        map.put("triggerPersistenceSec", triggerPersistenceSec);
        map.put("clearPersistenceSec", clearPersistenceSec);
        map.put("startDelaySec", startDelaySec);
        map.put("stopDelaySec", stopDelaySec);
        if (windowSec != null) {
            map.put("windowSec", windowSec);
        }
        map.put("type", type.key());
        if (tipMapDelta != null) {
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("tipParam", tipMapDelta.tipParam());
            config.put("mapParam", tipMapDelta.mapParam());
            config.put("fullLoadMapPsi", tipMapDelta.fullLoadMapPsi());
            config.put("noLoadMapPsi", tipMapDelta.noLoadMapPsi());
            if (tipMapDelta.loadLimitPct() != null) {
                config.put("loadLimitPct", tipMapDelta.loadLimitPct());
            }
            config.put("deltaIdealPsi", tipMapDelta.deltaIdealPsi());
            config.put("deltaHighPsi", tipMapDelta.deltaHighPsi());
            config.put("deltaLowPsi", tipMapDelta.deltaLowPsi());
            Map<String, Object> gate = conditionMap(tipMapDelta.loadGate().condition());
            gate.put("debounceSec", tipMapDelta.loadGate().debounceSec());
            config.put("loadGate", gate);
            map.put("config", config);
        }
        return map;
    }

    private static List<Map<String, Object>> conditionMaps(List<Condition> conditions) {
        List<Map<String, Object>> maps = new ArrayList<>(conditions.size());
        conditions.forEach(c -> maps.add(conditionMap(c)));
        return maps;
    }

    private static Map<String, Object> conditionMap(Condition condition) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("param", condition.param());
        map.put("operator", condition.operator().symbol());
        map.put("value", condition.value());
        return map;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(id);
        builder.name = name;
        builder.description = description;
        builder.category = category;
        builder.severity = severity;
        builder.enabled = enabled;
        builder.logic = logic;
        builder.conditions = new ArrayList<>(conditions);
        builder.requireWhen = new ArrayList<>(requireWhen);
        builder.ignoreWhen = new ArrayList<>(ignoreWhen);
        builder.triggerPersistenceSec = triggerPersistenceSec;
        builder.clearPersistenceSec = clearPersistenceSec;
        builder.startDelaySec = startDelaySec;
        builder.stopDelaySec = stopDelaySec;
        builder.windowSec = windowSec;
        builder.type = type;
        builder.tipMapDelta = tipMapDelta;
        return builder;
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String description;
        private String category;
        private Severity severity = Severity.WARNING;
        private boolean enabled = true;
        private LogicOperator logic = LogicOperator.AND;
        private List<Condition> conditions = new ArrayList<>();
        private List<Condition> requireWhen = new ArrayList<>();
        private List<Condition> ignoreWhen = new ArrayList<>();
        private double triggerPersistenceSec;
        private double clearPersistenceSec;
        private double startDelaySec;
        private double stopDelaySec;
        private Double windowSec;
        private RuleType type = RuleType.GENERIC;
        private TipMapDeltaConfig tipMapDelta;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder logic(LogicOperator logic) {
            this.logic = logic;
            return this;
        }

        public Builder condition(Condition condition) {
            this.conditions.add(condition);
            return this;
        }

        public Builder condition(String param, String operator, double value) {
            return condition(Condition.of(param, operator, value));
        }

        public Builder conditions(List<Condition> conditions) {
            this.conditions = new ArrayList<>(conditions);
            return this;
        }

        public Builder requireWhen(Condition condition) {
            this.requireWhen.add(condition);
            return this;
        }

        public Builder requireWhen(List<Condition> conditions) {
            this.requireWhen = new ArrayList<>(conditions);
            return this;
        }

        public Builder ignoreWhen(Condition condition) {
            this.ignoreWhen.add(condition);
            return this;
        }

        public Builder ignoreWhen(List<Condition> conditions) {
            this.ignoreWhen = new ArrayList<>(conditions);
            return this;
        }

        public Builder triggerPersistenceSec(double seconds) {
            this.triggerPersistenceSec = seconds;
            return this;
        }

        public Builder clearPersistenceSec(double seconds) {
            this.clearPersistenceSec = seconds;
            return this;
        }

        public Builder startDelaySec(double seconds) {
            this.startDelaySec = seconds;
            return this;
        }

        public Builder stopDelaySec(double seconds) {
            this.stopDelaySec = seconds;
            return this;
        }

        public Builder windowSec(Double seconds) {
            this.windowSec = seconds;
            return this;
        }

        public Builder tipMapDelta(TipMapDeltaConfig config) {
            this.type = RuleType.TIP_MAP_DELTA;
            this.tipMapDelta = config;
            return this;
        }

        public Builder type(RuleType type) {
            this.type = type;
            return this;
        }

        public Rule build() {
            return new Rule(id, name, description, category, severity, enabled, logic,
                    conditions, requireWhen, ignoreWhen,
                    triggerPersistenceSec, clearPersistenceSec, startDelaySec, stopDelaySec,
                    windowSec, type, tipMapDelta);
        }
    }
}
