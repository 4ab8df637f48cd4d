package com.phillippitts.labreasoning.service.model;

/**
 * Per-call generation options.
 *
 * @param temperature sampling temperature
 * @param jsonMode    ask the provider to constrain the reply to a JSON object
 */
public record ModelCallOptions(double temperature, boolean jsonMode) {

    public static ModelCallOptions text(double temperature) {
        return new ModelCallOptions(temperature, false);
    }

    public static ModelCallOptions json(double temperature) {
        return new ModelCallOptions(temperature, true);
    }
}
