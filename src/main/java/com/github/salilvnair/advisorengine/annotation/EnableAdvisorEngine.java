package com.github.salilvnair.advisorengine.annotation;

import com.github.salilvnair.advisorengine.config.AdvisorEngineAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(AdvisorEngineAutoConfiguration.class)
public @interface EnableAdvisorEngine {
}
