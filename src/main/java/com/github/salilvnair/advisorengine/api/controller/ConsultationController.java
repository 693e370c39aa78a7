package com.github.salilvnair.advisorengine.api.controller;

import com.github.salilvnair.advisorengine.api.dto.ConsultationResponse;
import com.github.salilvnair.advisorengine.engine.ConsultationResult;
import com.github.salilvnair.advisorengine.engine.core.ConsultationEngine;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineErrorCode;
import com.github.salilvnair.advisorengine.engine.exception.AdvisorEngineException;
import com.github.salilvnair.advisorengine.model.ConsultationRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/consultation")
@RequiredArgsConstructor
public class ConsultationController {

    private final ConsultationEngine engine;

    @PostMapping
    public ConsultationResponse consult(@RequestBody ConsultationRequest request) {
        if (request == null || isBlank(request.title()) || isBlank(request.description())) {
            throw new AdvisorEngineException(
                    AdvisorEngineErrorCode.INVALID_REQUEST,
                    "Both title and description are required");
        }

        ConsultationResult result = engine.run(request);

        ConsultationResponse res = new ConsultationResponse();
        res.setBrief(result.brief());
        res.setOutcome(result.outcome().name());
        res.setPolicyViolation(result.isPolicyViolation());
        res.setProvider(result.provider());
        res.setModel(result.model());
        return res;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
