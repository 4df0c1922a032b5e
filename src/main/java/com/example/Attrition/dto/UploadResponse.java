package com.example.Attrition.dto;

import com.example.Attrition.ingestion.ValidationError;
import com.example.Attrition.model.AttendanceRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadResponse {
    private String message;
    private int processed;
    private int invalidRecords;
    private List<ValidationError> errors; // omitted when the upload was clean
    private List<AttendanceRecord> records;
}
