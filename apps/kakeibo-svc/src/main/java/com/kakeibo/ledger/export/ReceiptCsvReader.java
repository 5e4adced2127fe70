package com.kakeibo.ledger.export;

import com.kakeibo.ledger.model.RawReceipt;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

/**
 * Reads uploaded CSV into raw receipts. The header row decides the column mapping; an
 * {@code id} column is ignored and {@code description} may be omitted. Values are left
 * unvalidated so the normal insert path can report bad rows individually.
 */
@Component
public class ReceiptCsvReader {

    private static final Set<String> REQUIRED_COLUMNS = Set.of("date", "category", "amount");

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();

    public List<RawReceipt> read(Reader reader) {
        try (CSVParser parser = new CSVParser(reader, FORMAT)) {
            List<String> headers = parser.getHeaderNames();
            for (String column : REQUIRED_COLUMNS) {
                if (!headers.contains(column)) {
                    throw new InvalidCsvException("CSV header is missing required column: " + column);
                }
            }
            boolean hasDescription = headers.contains("description");
            List<RawReceipt> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                rows.add(new RawReceipt(
                        value(record, "date"),
                        value(record, "category"),
                        hasDescription ? value(record, "description") : null,
                        value(record, "amount")
                ));
            }
            return rows;
        } catch (InvalidCsvException ex) {
            throw ex;
        } catch (IOException | UncheckedIOException ex) {
            throw new InvalidCsvException("Malformed CSV document", ex);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            throw new InvalidCsvException("Malformed CSV document: " + ex.getMessage(), ex);
        }
    }

    private String value(CSVRecord record, String column) {
        return record.isSet(column) ? record.get(column) : null;
    }
}
