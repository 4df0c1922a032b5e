package com.example.Attrition.ingestion;

public enum ViolationCode {
    REQUIRED,
    TOO_LONG,
    INVALID_FORMAT,
    WEEKEND_DATE,
    INVALID_STATUS,
    INFORMED_AFTER_LEAVE,
    INFORMED_OUTSIDE_WINDOW,
    INVALID_EMAIL,
    DUPLICATE,
    VOLUME_OUT_OF_RANGE
}
