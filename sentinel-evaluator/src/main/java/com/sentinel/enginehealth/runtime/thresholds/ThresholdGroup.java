/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.thresholds;

import com.sentinel.enginehealth.api.model.Recording;

import java.util.List;
import java.util.Optional;

/**
 * Threshold sections of a profile that are checked directly against a recording channel.
 *
 * <p>Each group knows the threshold key it reads, the channel names it accepts (first
 * present wins), its display unit and label, and whether it is only checked while the
 * engine is running.
 */
public enum ThresholdGroup {
    BATTERY("battery", "battery", "voltage", "V", "Battery Voltage", false,
            List.of("Vbat", "battery_voltage", "VBAT", "vbat")),
    COOLANT_TEMP("coolantTemp", "coolant", "thermal", "°F", "Coolant Temperature", true,
            List.of("ECT", "coolant_temp", "engine_coolant_temp", "ect")),
    OIL_PRESSURE("oilPressure", "oil_pressure", "pressure", "psi", "Oil Pressure", false,
            List.of("OILP_press", "oil_pressure", "OIL_PRESS", "oilp_press")),
    RPM("rpm", "rpm", "fault", "RPM", "RPM", true,
            List.of("rpm", "RPM", "engine_speed", "ENGINE_SPEED")),
    FUEL_TRIM("fuelTrim", "fuel_cl", "fuel", "%", "Fuel Trim", true,
            List.of("CL_BM1", "closed_loop_fuel", "CL_FUEL_TRIM", "cl_bm1")),
    KNOCK("knock", "knock", "knock", "°", "Knock Retard", true,
            List.of("KNK_retard", "knock_retard", "KNOCK_RETARD", "knk_retard"));

    private final String thresholdKey;
    private final String idPrefix;
    private final String category;
    private final String unit;
    private final String label;
    private final boolean runningOnly;
    private final List<String> channelAliases;

    ThresholdGroup(String thresholdKey, String idPrefix, String category, String unit, String label,
                   boolean runningOnly, List<String> channelAliases) {
        this.thresholdKey = thresholdKey;
        this.idPrefix = idPrefix;
        this.category = category;
        this.unit = unit;
        this.label = label;
        this.runningOnly = runningOnly;
        this.channelAliases = channelAliases;
    }

    public String thresholdKey() {
        return thresholdKey;
    }

    public String idPrefix() {
        return idPrefix;
    }

    public String category() {
        return category;
    }

    public String unit() {
        return unit;
    }

    public String label() {
        return label;
    }

    public boolean runningOnly() {
        return runningOnly;
    }

    public List<String> channelAliases() {
        return channelAliases;
    }

    /**
     * Words used in alert names for a low and a high breach.
     */
    String lowWord() {
        return this == FUEL_TRIM ? "Rich" : "Low";
    }

    String highWord() {
        return this == FUEL_TRIM ? "Lean" : "High";
    }

    public Optional<String> resolveChannel(Recording recording) {
        return channelAliases.stream().filter(recording::hasChannel).findFirst();
    }
}
