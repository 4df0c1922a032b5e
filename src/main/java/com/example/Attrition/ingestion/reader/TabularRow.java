package com.example.Attrition.ingestion.reader;

import lombok.Value;

import java.util.Map;

@Value
public class TabularRow {
    int rowNumber; // 1-based, header is row 1
    Map<String, String> values;

    public String get(String column) {
        String value = values.get(column);
        return value == null ? null : value.trim();
    }
}
