/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.compiler.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.enginehealth.api.exceptions.MalformedRuleException;
import com.sentinel.enginehealth.api.exceptions.ProfileStoreException;
import com.sentinel.enginehealth.api.model.Condition;
import com.sentinel.enginehealth.api.model.LoadGate;
import com.sentinel.enginehealth.api.model.LogicOperator;
import com.sentinel.enginehealth.api.model.Profile;
import com.sentinel.enginehealth.api.model.ProfileMetadata;
import com.sentinel.enginehealth.api.model.Rule;
import com.sentinel.enginehealth.api.model.RuleType;
import com.sentinel.enginehealth.api.model.Severity;
import com.sentinel.enginehealth.api.model.ThresholdTree;
import com.sentinel.enginehealth.api.model.TipMapDeltaConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses profile JSON documents with Jackson.
 *
 * <p>Document shape:
 * <pre>
 * {
 *   "profileId": "family-x",
 *   "name": "Family X",
 *   "parent": "global-defaults",
 *   "thresholds": { "oilPressure": { "critical": { "min": 10 } } },
 *   "anomalyRules": [
 *     { "id": "low-oil", "severity": "critical", "logic": "AND",
 *       "conditions": [ { "param": "OILP_press", "operator": "<", "value": 10 } ],
 *       "requireWhen": [ { "param": "EngineStable", "operator": "==", "value": 1 } ],
 *       "triggerPersistenceSec": 2, "clearPersistenceSec": 1 }
 *   ]
 * }
 * </pre>
 * A rule that cannot be parsed is skipped and reported in {@link ParseResult#skippedRules()};
 * a document that cannot be parsed at all raises {@link ProfileStoreException}.
 */
public class ProfileDocumentParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ProfileDocumentParser() {
        this(new ObjectMapper());
    }

    public ProfileDocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public record ParseResult(Profile profile, List<MalformedRuleException> skippedRules) {

        public ParseResult {
            skippedRules = List.copyOf(skippedRules);
        }
    }

    public ParseResult parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProfileStoreException("Invalid profile JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public ParseResult parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ProfileStoreException("Profile document must be a JSON object");
        }
        String id = text(root, "profileId", text(root, "id", null));
        if (id == null || id.isBlank()) {
            throw new ProfileStoreException("Profile document has no profileId");
        }

        ThresholdTree.Node thresholds = ThresholdTree.Node.empty();
        JsonNode thresholdNode = root.get("thresholds");
        if (thresholdNode != null && thresholdNode.isObject()) {
            thresholds = ThresholdTree.fromMap(objectMapper.convertValue(thresholdNode, MAP_TYPE));
        }

        List<Rule> rules = new ArrayList<>();
        List<MalformedRuleException> skipped = new ArrayList<>();
        JsonNode rulesNode = root.has("anomalyRules") ? root.get("anomalyRules") : root.get("rules");
        if (rulesNode != null && rulesNode.isArray()) {
            int index = 0;
            for (JsonNode ruleNode : rulesNode) {
                try {
                    rules.add(parseRule(ruleNode));
                } catch (MalformedRuleException e) {
                    skipped.add(e);
                } catch (IllegalArgumentException | NullPointerException e) {
                    skipped.add(new MalformedRuleException(ruleId(ruleNode, index), e.getMessage(), e));
                }
                index++;
            }
        }

        ProfileMetadata metadata = new ProfileMetadata(
                text(root, "engineFamily", null),
                text(root, "fuelType", null),
                text(root, "application", null),
                text(root, "version", null),
                text(root, "status", null));
        Profile profile = new Profile(id, text(root, "name", id), emptyToNull(text(root, "parent",
                text(root, "parentId", null))), text(root, "description", null), metadata, thresholds, rules);
        return new ParseResult(profile, skipped);
    }

    /**
     * Parses one rule object.
     *
     * @throws MalformedRuleException when a field is missing or has the wrong shape
     */
    public Rule parseRule(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MalformedRuleException("?", "rule must be a JSON object");
        }
        String id = text(node, "id", null);
        if (id == null || id.isBlank()) {
            throw new MalformedRuleException("?", "rule has no id");
        }
        try {
            Rule.Builder builder = Rule.builder(id)
                    .name(text(node, "name", id))
                    .description(text(node, "description", null))
                    .category(text(node, "category", null))
                    .severity(Severity.fromString(text(node, "severity", "warning")))
                    .enabled(!node.has("enabled") || node.get("enabled").asBoolean(true))
                    .logic(LogicOperator.valueOf(text(node, "logic", "AND").toUpperCase(Locale.ROOT)))
                    .conditions(conditions(id, node.get("conditions")))
                    .requireWhen(conditions(id, node.get("requireWhen")))
                    .ignoreWhen(conditions(id, node.get("ignoreWhen")))
                    .triggerPersistenceSec(number(node, "triggerPersistenceSec", 0))
                    .clearPersistenceSec(number(node, "clearPersistenceSec", 0))
                    .startDelaySec(number(node, "startDelaySec", 0))
                    .stopDelaySec(number(node, "stopDelaySec", 0));
            JsonNode window = node.get("windowSec");
            if (window != null && !window.isNull()) {
                builder.windowSec(requireNumber(id, "windowSec", window));
            }

            RuleType type = RuleType.fromKey(text(node, "type", null));
            switch (type) {
                case GENERIC -> builder.type(RuleType.GENERIC);
                case TIP_MAP_DELTA -> builder.tipMapDelta(tipMapDelta(id, node.get("config")));
            }
            return builder.build();
        } catch (MalformedRuleException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MalformedRuleException(id, e.getMessage(), e);
        }
    }

    private TipMapDeltaConfig tipMapDelta(String ruleId, JsonNode config) {
        if (config == null || !config.isObject()) {
            throw new MalformedRuleException(ruleId, "tip_map_delta rule requires a config object");
        }
        JsonNode gate = config.get("loadGate");
        if (gate == null || !gate.isObject()) {
            throw new MalformedRuleException(ruleId, "tip_map_delta config requires a loadGate");
        }
        JsonNode loadLimit = config.get("loadLimitPct");
        return new TipMapDeltaConfig(
                text(config, "tipParam", null),
                text(config, "mapParam", null),
                requireNumber(ruleId, "fullLoadMapPsi", config.get("fullLoadMapPsi")),
                requireNumber(ruleId, "noLoadMapPsi", config.get("noLoadMapPsi")),
                loadLimit == null || loadLimit.isNull() ? null : requireNumber(ruleId, "loadLimitPct", loadLimit),
                requireNumber(ruleId, "deltaIdealPsi", config.get("deltaIdealPsi")),
                requireNumber(ruleId, "deltaHighPsi", config.get("deltaHighPsi")),
                requireNumber(ruleId, "deltaLowPsi", config.get("deltaLowPsi")),
                new LoadGate(condition(ruleId, gate), number(gate, "debounceSec", 0)));
    }

    private List<Condition> conditions(String ruleId, JsonNode array) {
        List<Condition> conditions = new ArrayList<>();
        if (array == null || array.isNull()) {
            return conditions;
        }
        if (!array.isArray()) {
            throw new MalformedRuleException(ruleId, "conditions must be an array");
        }
        for (JsonNode node : array) {
            conditions.add(condition(ruleId, node));
        }
        return conditions;
    }

    private Condition condition(String ruleId, JsonNode node) {
        String param = text(node, "param", null);
        if (param == null || param.isBlank()) {
            throw new MalformedRuleException(ruleId, "condition has no param");
        }
        return Condition.of(param, text(node, "operator", null), requireNumber(ruleId, "value", node.get("value")));
    }

    private static double requireNumber(String ruleId, String field, JsonNode node) {
        if (node == null || !node.isNumber()) {
            throw new MalformedRuleException(ruleId, field + " must be a number");
        }
        return node.asDouble();
    }

    private static double number(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asDouble(fallback);
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String ruleId(JsonNode node, int index) {
        String id = node == null ? null : text(node, "id", null);
        return id != null ? id : "rule[" + index + "]";
    }
}
