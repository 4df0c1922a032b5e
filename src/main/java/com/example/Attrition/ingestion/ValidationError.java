package com.example.Attrition.ingestion;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.List;

/**
 * A problem found while validating an upload. Row errors exclude the row from the
 * valid output; employee errors are advisory and leave the employee's rows in place.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationError {

    public enum Scope { ROW, EMPLOYEE }

    Scope scope;
    Integer row;
    String employeeId;
    List<FieldViolation> errors;

    public static ValidationError row(int row, List<FieldViolation> errors) {
        return new ValidationError(Scope.ROW, row, null, List.copyOf(errors));
    }

    public static ValidationError employee(String employeeId, FieldViolation error) {
        return new ValidationError(Scope.EMPLOYEE, null, employeeId, List.of(error));
    }

    public boolean hasCode(ViolationCode code) {
        return errors.stream().anyMatch(e -> e.getCode() == code);
    }
}
