package com.kakeibo.ledger.controller;

import com.kakeibo.ledger.config.KakeiboProperties;
import com.kakeibo.ledger.controller.dto.InsertReceiptsResponseDto;
import com.kakeibo.ledger.controller.dto.InsertReceiptsResponseDto.RejectionDto;
import com.kakeibo.ledger.controller.dto.ReceiptResponseDto;
import com.kakeibo.ledger.controller.dto.ReceiptsListResponseDto;
import com.kakeibo.ledger.export.ReceiptCsvReader;
import com.kakeibo.ledger.export.ReceiptCsvWriter;
import com.kakeibo.ledger.model.LedgerSnapshot;
import com.kakeibo.ledger.model.RawReceipt;
import com.kakeibo.ledger.model.ReceiptFilter;
import com.kakeibo.ledger.model.ReceiptListing;
import com.kakeibo.ledger.service.ReceiptQueryService;
import com.kakeibo.ledger.service.ReceiptService;
import com.kakeibo.ledger.service.ReceiptValidator;
import com.kakeibo.ledger.web.RequestContextHolder;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
public class ReceiptsController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final ReceiptService receiptService;
    private final ReceiptQueryService receiptQueryService;
    private final ReceiptCsvWriter receiptCsvWriter;
    private final ReceiptCsvReader receiptCsvReader;
    private final KakeiboProperties properties;
    private final Clock clock;

    public ReceiptsController(
            ReceiptService receiptService,
            ReceiptQueryService receiptQueryService,
            ReceiptCsvWriter receiptCsvWriter,
            ReceiptCsvReader receiptCsvReader,
            KakeiboProperties properties,
            Clock clock
    ) {
        this.receiptService = receiptService;
        this.receiptQueryService = receiptQueryService;
        this.receiptCsvWriter = receiptCsvWriter;
        this.receiptCsvReader = receiptCsvReader;
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping("/")
    public ResponseEntity<Void> root() {
        return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT)
                .location(URI.create("/entries"))
                .build();
    }

    @PostMapping({"/entries", "/"})
    public ResponseEntity<InsertReceiptsResponseDto> createEntries(@RequestBody List<Object> request) {
        List<RawReceipt> raws = new ArrayList<>(request.size());
        for (Object item : request) {
            raws.add(toRaw(item));
        }
        return insert(raws);
    }

    @PostMapping(path = "/entries/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<InsertReceiptsResponseDto> uploadEntries(@RequestPart("file") MultipartFile file) throws IOException {
        List<RawReceipt> raws;
        CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try (Reader reader = new InputStreamReader(file.getInputStream(), utf8)) {
            raws = receiptCsvReader.read(reader);
        }
        return insert(raws);
    }

    @GetMapping("/entries")
    public ResponseEntity<ReceiptsListResponseDto> listEntries(
            @RequestParam(value = "date_from", required = false) String dateFrom,
            @RequestParam(value = "date_to", required = false) String dateTo,
            @RequestParam(value = "category", required = false) String category
    ) {
        ReceiptFilter filter = resolveFilter(dateFrom, dateTo, category);
        ReceiptListing listing = receiptQueryService.list(receiptService.snapshot(), filter);
        var response = new ReceiptsListResponseDto(
                listing.total(),
                listing.totalAmount(),
                listing.categories(),
                listing.receipts().stream().map(ReceiptResponseDto::from).toList(),
                traceId()
        );
        return ResponseEntity.ok(response);
    }

    @GetMapping("/entries/{id}")
    public ResponseEntity<ReceiptResponseDto> getEntry(@PathVariable("id") long id) {
        return ResponseEntity.ok(ReceiptResponseDto.from(receiptService.findById(id)));
    }

    @GetMapping("/entries/export")
    public ResponseEntity<String> exportEntries(
            @RequestParam(value = "date_from", required = false) String dateFrom,
            @RequestParam(value = "date_to", required = false) String dateTo,
            @RequestParam(value = "category", required = false) String category
    ) {
        ReceiptFilter filter = resolveFilter(dateFrom, dateTo, category);
        LedgerSnapshot snapshot = receiptQueryService.filter(receiptService.snapshot(), filter);
        String csv = receiptCsvWriter.toCsv(snapshot);
        var export = properties.export();
        String filename = export.filenamePrefix() + "_" + LocalDateTime.now(clock).format(export.timestampFormatter()) + ".csv";
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(filename).build().toString())
                .body(csv);
    }

    private ResponseEntity<InsertReceiptsResponseDto> insert(List<RawReceipt> raws) {
        ReceiptService.InsertResult result = receiptService.insertMany(raws);
        List<RejectionDto> rejected = result.rejected().stream()
                .map(rejection -> new RejectionDto(
                        rejection.index(),
                        rejection.error().code().name(),
                        rejection.error().field(),
                        rejection.error().rawValue(),
                        rejection.error().message()))
                .toList();
        var response = new InsertReceiptsResponseDto(
                result.hasRejections() ? "partial" : "success",
                result.inserted().size(),
                result.inserted().stream().map(ReceiptResponseDto::from).toList(),
                rejected,
                traceId()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Each array element is converted on its own so a badly typed field becomes a per-item
     * rejection. Elements that are not JSON objects map to {@code null}.
     */
    private static RawReceipt toRaw(Object item) {
        if (!(item instanceof Map<?, ?> fields)) {
            return null;
        }
        Object description = fields.get("description");
        return new RawReceipt(
                fields.get("date"),
                fields.get("category"),
                description == null ? null : String.valueOf(description),
                fields.get("amount")
        );
    }

    private static ReceiptFilter resolveFilter(String dateFrom, String dateTo, String category) {
        return ReceiptFilter.of(parseDate(dateFrom, "date_from"), parseDate(dateTo, "date_to"), category);
    }

    private static LocalDate parseDate(String value, String param) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value, ReceiptValidator.ISO_DATE);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(param + " must be in YYYY-MM-DD format");
        }
    }

    private static String traceId() {
        return RequestContextHolder.traceId().orElse(null);
    }
}
