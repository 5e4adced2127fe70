package com.kakeibo.ledger.export;

import com.kakeibo.ledger.model.LedgerSnapshot;
import com.kakeibo.ledger.model.Receipt;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

/**
 * Renders a snapshot as an RFC 4180 document: a header row followed by one row per receipt
 * in snapshot order. Fields holding a comma, quote or line break are quoted.
 */
@Component
public class ReceiptCsvWriter {

    public static final String[] HEADERS = {"id", "date", "category", "description", "amount"};

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(HEADERS)
            .build();

    public String toCsv(LedgerSnapshot snapshot) {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, FORMAT)) {
            for (Receipt receipt : snapshot.receipts()) {
                printer.printRecord(
                        receipt.id(),
                        receipt.date(),
                        receipt.category(),
                        receipt.description(),
                        receipt.amount()
                );
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to render receipts as CSV", ex);
        }
        return out.toString();
    }
}
