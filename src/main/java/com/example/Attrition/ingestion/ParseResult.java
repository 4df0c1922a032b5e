package com.example.Attrition.ingestion;

import com.example.Attrition.model.AttendanceRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of parsing one upload. Exactly one of three shapes:
 * <ul>
 *     <li>rejected: {@code fileError} set, no records, no errors</li>
 *     <li>partial: some row or employee errors alongside the valid records</li>
 *     <li>clean: no errors at all, {@code valid} is true</li>
 * </ul>
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParseResult {
    boolean valid;
    @Singular
    List<AttendanceRecord> validRecords;
    int invalidRecords;
    @Singular
    List<ValidationError> errors;
    FileError fileError;

    public static ParseResult rejected(FileError fileError) {
        return ParseResult.builder()
                .valid(false)
                .fileError(fileError)
                .build();
    }

    public boolean isRejected() {
        return fileError != null;
    }
}
