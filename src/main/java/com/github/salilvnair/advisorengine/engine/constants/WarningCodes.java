package com.github.salilvnair.advisorengine.engine.constants;

import lombok.experimental.UtilityClass;

@UtilityClass
public class WarningCodes {
    public static final String RETRIEVAL_DEGRADED = "retrieval_degraded";
}
