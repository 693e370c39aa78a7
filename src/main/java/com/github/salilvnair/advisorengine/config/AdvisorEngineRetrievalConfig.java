package com.github.salilvnair.advisorengine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "advisorengine.retrieval")
@Getter
@Setter
public class AdvisorEngineRetrievalConfig {

    private boolean enabled = true;
    private String endpointUrl = "http://localhost:8000/search";
    private String collection = "reference_passages";
    private int topK = 5;
    private int connectTimeoutMs = 2000;
    private int readTimeoutMs = 10000;
    private ResilienceProperties.Retry retry = new ResilienceProperties.Retry();
    private ResilienceProperties.Circuit circuit = new ResilienceProperties.Circuit();
}
