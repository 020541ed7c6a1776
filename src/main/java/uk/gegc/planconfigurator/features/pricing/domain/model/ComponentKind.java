package uk.gegc.planconfigurator.features.pricing.domain.model;

import java.util.Arrays;

public enum ComponentKind {
    RECURRING("recurring"),
    ONE_TIME("one_time");

    private final String wireValue;

    ComponentKind(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static ComponentKind fromWire(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireValue.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown component kind: " + value));
    }
}
