package com.github.salilvnair.advisorengine.refusal;

public record RefusalVerdict(boolean refusal, String matchedPattern) {

    private static final RefusalVerdict NONE = new RefusalVerdict(false, null);

    public static RefusalVerdict none() {
        return NONE;
    }

    public static RefusalVerdict matched(String matchedText) {
        return new RefusalVerdict(true, matchedText);
    }
}
