package com.example.Attrition.repository;

import com.example.Attrition.model.Employee;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface EmployeeRepository extends MongoRepository<Employee, String> {
    Optional<Employee> findByOrganizationIdAndEmployeeId(String organizationId, String employeeId);

    List<Employee> findByOrganizationIdOrderByEmployeeIdAsc(String organizationId);
}
