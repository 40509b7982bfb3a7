package com.tenacy.labpulse.domain;

import lombok.Value;

@Value
public class ProbableCause {
    String cause;
    double probability;
    String description;

    public ProbableCause(String cause, double probability, String description) {
        if (probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("Probability must be within [0, 1]: " + probability);
        }
        this.cause = cause;
        this.probability = probability;
        this.description = description;
    }
}
