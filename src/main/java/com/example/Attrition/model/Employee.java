package com.example.Attrition.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "employees")
@CompoundIndex(name = "org_employee", def = "{'organizationId': 1, 'employeeId': 1}", unique = true)
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@ToString
public class Employee {
    @Id
    private String id;
    private String organizationId;
    private String employeeId;
    private String name;
    private String email;
    private String department;
    private String managerEmail;
}
