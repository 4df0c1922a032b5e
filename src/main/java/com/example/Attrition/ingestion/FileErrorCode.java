package com.example.Attrition.ingestion;

public enum FileErrorCode {
    UNSUPPORTED_FORMAT,
    UNREADABLE,
    EMPTY_FILE,
    MISSING_COLUMNS
}
