package com.github.salilvnair.advisorengine.llm.model;

import java.util.Locale;

public enum ProviderKind {
    ANTHROPIC,
    OLLAMA,
    STUB;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
