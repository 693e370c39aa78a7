package com.github.salilvnair.advisorengine.prompt;

import lombok.experimental.UtilityClass;

@UtilityClass
public class PromptTemplates {
    public static final String ROOT = "advisorengine/prompts/";
    public static final String SYSTEM = ROOT + "system.txt";
    public static final String FEW_SHOT = ROOT + "few-shot.txt";
    public static final String CONDENSED_SYSTEM = ROOT + "condensed-system.txt";
    public static final String USER = ROOT + "user.txt";
    public static final String CONDENSED_USER = ROOT + "condensed-user.txt";
}
