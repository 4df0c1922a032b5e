package com.example.Attrition.store;

import com.example.Attrition.model.AttendanceRecord;
import com.example.Attrition.model.Employee;
import com.example.Attrition.repository.AttendanceRecordRepository;
import com.example.Attrition.repository.EmployeeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class MongoAttendanceStore implements AttendanceStore {

    private final AttendanceRecordRepository recordRepository;
    private final EmployeeRepository employeeRepository;
    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Employee> findEmployee(String organizationId, String employeeId) {
        return employeeRepository.findByOrganizationIdAndEmployeeId(organizationId, employeeId);
    }

    @Override
    public List<Employee> findEmployees(String organizationId) {
        return employeeRepository.findByOrganizationIdOrderByEmployeeIdAsc(organizationId);
    }

    @Override
    public List<AttendanceRecord> findRecords(String organizationId, String employeeId, LocalDate from, LocalDate to) {
        return recordRepository.findWindow(organizationId, employeeId, from, to, Sort.by(Sort.Direction.ASC, "date"));
    }

    @Override
    public List<AttendanceRecord> searchRecords(String organizationId, String employeeId, LocalDate from, LocalDate to) {
        Criteria criteria = Criteria.where("organizationId").is(organizationId);
        if (employeeId != null) {
            criteria = criteria.and("employeeId").is(employeeId);
        }
        if (from != null || to != null) {
            Criteria date = criteria.and("date");
            if (from != null) date = date.gte(from);
            if (to != null) date.lte(to);
        }
        Query query = Query.query(criteria).with(Sort.by(Sort.Direction.DESC, "date"));
        return mongoTemplate.find(query, AttendanceRecord.class);
    }

    @Override
    public int upsertRecords(String organizationId, List<AttendanceRecord> records) {
        Map<String, AttendanceRecord> latestByEmployee = new LinkedHashMap<>();
        for (AttendanceRecord record : records) {
            record.setOrganizationId(organizationId);
            recordRepository.findByOrganizationIdAndEmployeeIdAndDate(organizationId, record.getEmployeeId(), record.getDate())
                    .ifPresent(existing -> record.setId(existing.getId()));
            latestByEmployee.put(record.getEmployeeId(), record);
        }
        recordRepository.saveAll(records);

        latestByEmployee.values().forEach(record -> {
            Employee employee = employeeRepository.findByOrganizationIdAndEmployeeId(organizationId, record.getEmployeeId())
                    .orElseGet(() -> Employee.builder()
                            .organizationId(organizationId)
                            .employeeId(record.getEmployeeId())
                            .build());
            employee.setName(record.getEmployeeName());
            employee.setDepartment(record.getDepartment());
            employee.setManagerEmail(record.getManagerEmail());
            employeeRepository.save(employee);
        });

        log.info("Upserted {} attendance record(s) for {} employee(s) in organization {}",
                records.size(), latestByEmployee.size(), organizationId);
        return records.size();
    }
}
