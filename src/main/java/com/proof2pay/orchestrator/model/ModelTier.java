package com.proof2pay.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Cost/quality level of the reasoning model an agent runs on. Prices are USD per million tokens.
 */
public enum ModelTier {
    OPUS(15.0, 75.0),
    SONNET(3.0, 15.0),
    HAIKU(0.25, 1.25);

    private final double inputPricePerMillion;
    private final double outputPricePerMillion;

    ModelTier(double inputPricePerMillion, double outputPricePerMillion) {
        this.inputPricePerMillion = inputPricePerMillion;
        this.outputPricePerMillion = outputPricePerMillion;
    }

    public double getInputPricePerMillion() {
        return inputPricePerMillion;
    }

    public double getOutputPricePerMillion() {
        return outputPricePerMillion;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ModelTier fromValue(String value) {
        return parse(value).orElse(SONNET);
    }

    public static Optional<ModelTier> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (ModelTier tier : values()) {
            if (tier.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
