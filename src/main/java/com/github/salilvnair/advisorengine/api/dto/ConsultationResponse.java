package com.github.salilvnair.advisorengine.api.dto;

import com.github.salilvnair.advisorengine.model.AdvisoryBrief;
import lombok.Data;

@Data
public class ConsultationResponse {

    private AdvisoryBrief brief;
    private String outcome;
    private boolean policyViolation;
    private String provider;
    private String model;
}
