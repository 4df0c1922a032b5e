package com.example.Attrition.ingestion.reader;

import lombok.Value;

import java.util.List;

@Value
public class TabularData {
    List<String> header;
    List<TabularRow> rows;

    public static TabularData empty() {
        return new TabularData(List.of(), List.of());
    }
}
