package com.example.Attrition.ingestion;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(staticName = "of")
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldViolation {
    String field;
    ViolationCode code;
    String message;
    String value; // offending input, null when missing
}
