package com.example.Attrition.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Document("attendance_records")
@CompoundIndex(name = "org_employee_date", def = "{'organizationId': 1, 'employeeId': 1, 'date': 1}", unique = true)
public class AttendanceRecord {
    @Id
    @JsonIgnore
    private String id;
    @JsonIgnore
    private String organizationId;
    private String employeeId;
    private String employeeName;
    private LocalDate date;
    private AttendanceStatus status;
    private Instant informedTime; // leave statuses only
    private String department;
    private String managerEmail;
}
