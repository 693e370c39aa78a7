package com.github.salilvnair.advisorengine.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.context.annotation.ComponentScan;

@AutoConfiguration
@AutoConfigurationPackage(basePackages = "com.github.salilvnair.advisorengine")
@ComponentScan(basePackages = "com.github.salilvnair.advisorengine")
public class AdvisorEngineAutoConfiguration {
}
