package com.github.salilvnair.advisorengine.engine.core;

import com.github.salilvnair.advisorengine.engine.ConsultationResult;
import com.github.salilvnair.advisorengine.model.ConsultationRequest;

public interface ConsultationEngine {
    ConsultationResult run(ConsultationRequest request);
}
