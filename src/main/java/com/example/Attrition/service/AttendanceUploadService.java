package com.example.Attrition.service;

import com.example.Attrition.dto.UploadResponse;
import com.example.Attrition.exception.CustomException;
import com.example.Attrition.ingestion.AttendanceFileParser;
import com.example.Attrition.ingestion.FileError;
import com.example.Attrition.ingestion.ParseResult;
import com.example.Attrition.model.AttendanceRecord;
import com.example.Attrition.store.AttendanceStore;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceUploadService {

    private final AttendanceFileParser fileParser;
    private final AttendanceStore attendanceStore;

    /**
     * Raised when the whole file is refused before any row was validated.
     */
    @Getter
    public static class FileRejectedException extends CustomException {
        private final FileError fileError;

        public FileRejectedException(FileError fileError) {
            super(fileError.getMessage(), HttpStatus.BAD_REQUEST);
            this.fileError = fileError;
        }
    }

    public UploadResponse upload(String organizationId, MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new CustomException("No file uploaded", HttpStatus.BAD_REQUEST);
        }
        return upload(organizationId, file.getBytes(), file.getOriginalFilename());
    }

    public UploadResponse upload(String organizationId, byte[] content, String filename) {
        ParseResult result = fileParser.parse(content, filename);
        if (result.isRejected()) {
            throw new FileRejectedException(result.getFileError());
        }

        List<AttendanceRecord> records = result.getValidRecords();
        int processed = records.isEmpty() ? 0 : attendanceStore.upsertRecords(organizationId, records);
        log.info("Upload '{}' for organization {}: {} processed, {} rejected row(s)",
                filename, organizationId, processed, result.getInvalidRecords());

        return UploadResponse.builder()
                .message(result.isValid()
                        ? "Attendance data uploaded successfully"
                        : "Attendance data uploaded with validation errors")
                .processed(processed)
                .invalidRecords(result.getInvalidRecords())
                .errors(result.getErrors().isEmpty() ? null : result.getErrors())
                .records(records)
                .build();
    }

    public List<AttendanceRecord> search(String organizationId, String employeeId, LocalDate startDate, LocalDate endDate) {
        return attendanceStore.searchRecords(organizationId, employeeId, startDate, endDate);
    }
}
