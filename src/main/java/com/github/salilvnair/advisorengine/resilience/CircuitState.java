package com.github.salilvnair.advisorengine.resilience;

import java.util.Locale;

public enum CircuitState {
    CLOSED,
    HALF_OPEN,
    OPEN;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
