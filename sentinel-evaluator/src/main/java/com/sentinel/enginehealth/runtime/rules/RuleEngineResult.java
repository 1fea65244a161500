package com.sentinel.enginehealth.runtime.rules;

import com.sentinel.enginehealth.api.model.AlertEvent;
import com.sentinel.enginehealth.api.model.Rule;
import com.sentinel.enginehealth.api.model.SignalQualityNote;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Alerts of one rule-engine run, ordered by onset, plus the rules that could not run.
 *
 * @param alerts         alert events ordered by onset time
 * @param evaluatedRules rules that were evaluated, by id
 * @param notes          one {@code MALFORMED_RULE} note per skipped rule
 */
public record RuleEngineResult(List<AlertEvent> alerts, Map<String, Rule> evaluatedRules,
                               List<SignalQualityNote> notes) {

    public RuleEngineResult {
        alerts = List.copyOf(alerts);
        evaluatedRules = Map.copyOf(evaluatedRules);
        notes = List.copyOf(notes);
    }

    public Optional<Rule> rule(String ruleId) {
        return Optional.ofNullable(evaluatedRules.get(ruleId));
    }
}
