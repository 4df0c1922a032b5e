package com.example.Attrition.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class RiskSummary {
    int high;
    int moderate;
    int low;
    int insufficientData;
}
