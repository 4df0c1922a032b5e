package com.example.Attrition.ingestion;

import com.example.Attrition.ingestion.reader.TabularData;
import com.example.Attrition.ingestion.reader.TabularReader;
import com.example.Attrition.model.AttendanceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entry point of the upload pipeline: picks a reader by file extension, checks the
 * header, validates every row and finally checks the per-employee volume.
 */
@Slf4j
@Service
public class AttendanceFileParser {

    private final Map<String, TabularReader> readersByExtension = new HashMap<>();
    private final AttendanceRowValidator rowValidator;
    private final int minDaysPerEmployee;
    private final int maxDaysPerEmployee;

    public AttendanceFileParser(List<TabularReader> readers,
                                AttendanceRowValidator rowValidator,
                                @Value("${attrition.ingestion.min-days:55}") int minDaysPerEmployee,
                                @Value("${attrition.ingestion.max-days:70}") int maxDaysPerEmployee) {
        readers.forEach(reader -> reader.extensions().forEach(ext -> readersByExtension.put(ext, reader)));
        this.rowValidator = rowValidator;
        this.minDaysPerEmployee = minDaysPerEmployee;
        this.maxDaysPerEmployee = maxDaysPerEmployee;
    }

    public ParseResult parse(byte[] content, String filename) {
        String extension = extensionOf(filename);
        TabularReader reader = AttendanceRules.SUPPORTED_EXTENSIONS.contains(extension)
                ? readersByExtension.get(extension)
                : null;
        if (reader == null) {
            log.warn("Rejected upload '{}': unsupported format", filename);
            return ParseResult.rejected(FileError.unsupportedFormat(extension));
        }

        TabularData data;
        try {
            data = reader.read(content);
        } catch (IOException e) {
            log.warn("Rejected upload '{}': {}", filename, e.getMessage());
            return ParseResult.rejected(FileError.unreadable(e.getMessage()));
        }

        if (data.getRows().isEmpty()) {
            return ParseResult.rejected(FileError.emptyFile());
        }

        List<String> missing = AttendanceRules.REQUIRED_COLUMNS.stream()
                .filter(column -> !data.getHeader().contains(column))
                .toList();
        if (!missing.isEmpty()) {
            log.warn("Rejected upload '{}': missing columns {}", filename, missing);
            return ParseResult.rejected(FileError.missingColumns(missing));
        }

        AttendanceRowValidator.Outcome outcome = rowValidator.validate(data.getRows());

        ParseResult.ParseResultBuilder result = ParseResult.builder()
                .validRecords(outcome.getValidRecords())
                .invalidRecords(outcome.getRowErrors().size())
                .errors(outcome.getRowErrors());

        // advisory only: out-of-range employees keep their rows
        List<ValidationError> volumeErrors = checkVolume(outcome.getValidRecords());
        result.errors(volumeErrors);

        boolean valid = outcome.getRowErrors().isEmpty() && volumeErrors.isEmpty();
        log.info("Parsed '{}': {} rows, {} valid, {} rejected, {} volume warning(s)",
                filename, data.getRows().size(), outcome.getValidRecords().size(),
                outcome.getRowErrors().size(), volumeErrors.size());

        return result.valid(valid).build();
    }

    List<ValidationError> checkVolume(List<AttendanceRecord> records) {
        Map<String, Integer> daysByEmployee = new LinkedHashMap<>();
        records.forEach(record -> daysByEmployee.merge(record.getEmployeeId(), 1, Integer::sum));

        return daysByEmployee.entrySet().stream()
                .filter(entry -> entry.getValue() < minDaysPerEmployee || entry.getValue() > maxDaysPerEmployee)
                .map(entry -> ValidationError.employee(entry.getKey(), FieldViolation.of(
                        AttendanceRules.EMPLOYEE_ID,
                        ViolationCode.VOLUME_OUT_OF_RANGE,
                        "Employee must have approximately 63 working days of data (3 months, 5-day week). Found "
                                + entry.getValue() + " days.",
                        String.valueOf(entry.getValue()))))
                .toList();
    }

    private static String extensionOf(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
