package com.example.Attrition.controller;

import com.example.Attrition.dto.UploadResponse;
import com.example.Attrition.model.AttendanceRecord;
import com.example.Attrition.service.AttendanceUploadService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/attendance")
@CrossOrigin(origins = "${attrition.frontend-url}", allowCredentials = "true")
@RequiredArgsConstructor
public class AttendanceController {

    public static final String ORGANIZATION_HEADER = "X-Organization-Id";

    private final AttendanceUploadService uploadService;

    @PostMapping("/upload")
    public ResponseEntity<UploadResponse> upload(@RequestHeader(ORGANIZATION_HEADER) String organizationId,
                                                 @RequestParam(value = "file", required = false) MultipartFile file) throws IOException {
        return ResponseEntity.ok(uploadService.upload(organizationId, file));
    }

    @GetMapping
    public ResponseEntity<Map<String, List<AttendanceRecord>>> getAttendance(
            @RequestHeader(ORGANIZATION_HEADER) String organizationId,
            @RequestParam(required = false) String employeeId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return ResponseEntity.ok(Map.of("attendance",
                uploadService.search(organizationId, employeeId, startDate, endDate)));
    }
}
