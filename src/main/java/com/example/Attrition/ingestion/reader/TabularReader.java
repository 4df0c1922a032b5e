package com.example.Attrition.ingestion.reader;

import java.io.IOException;
import java.util.Set;

/**
 * Turns an uploaded file into header-keyed rows. One implementation per file family,
 * selected by extension.
 */
public interface TabularReader {

    Set<String> extensions();

    TabularData read(byte[] content) throws IOException;
}
