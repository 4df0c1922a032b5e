package com.example.Attrition.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class EmployeeNotFoundException extends CustomException {
    private final String employeeId;

    public EmployeeNotFoundException(String employeeId) {
        super("Employee not found: " + employeeId, HttpStatus.NOT_FOUND);
        this.employeeId = employeeId;
    }
}
