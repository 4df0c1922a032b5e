package com.example.Attrition.ingestion;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.List;

/**
 * Whole-file failure: nothing in the upload was validated row by row.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class FileError {
    FileErrorCode code;
    String message;
    List<String> missingColumns;

    public static FileError unsupportedFormat(String extension) {
        return new FileError(FileErrorCode.UNSUPPORTED_FORMAT,
                "Unsupported file format '" + extension + "'. Only CSV and Excel files are allowed.", List.of());
    }

    public static FileError unreadable(String detail) {
        return new FileError(FileErrorCode.UNREADABLE, "File could not be parsed: " + detail, List.of());
    }

    public static FileError emptyFile() {
        return new FileError(FileErrorCode.EMPTY_FILE, "File is empty", List.of());
    }

    public static FileError missingColumns(List<String> missing) {
        return new FileError(FileErrorCode.MISSING_COLUMNS,
                "Missing required columns: " + String.join(", ", missing), List.copyOf(missing));
    }
}
