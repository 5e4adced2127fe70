package com.kakeibo.ledger.service;

import com.kakeibo.ledger.model.RawReceipt;
import java.util.List;

/**
 * Fixed demo data inserted by the seed operation.
 */
public final class SampleReceipts {

    private static final List<RawReceipt> RECEIPTS = List.of(
            new RawReceipt("2023-01-15", "食費", "スーパーマーケット", "3500"),
            new RawReceipt("2023-01-20", "交通費", "電車", "1200"),
            new RawReceipt("2023-01-25", "食費", "レストラン", "4800"),
            new RawReceipt("2023-02-05", "日用品", "ドラッグストア", "2600"),
            new RawReceipt("2023-02-10", "交際費", "飲み会", "5000"),
            new RawReceipt("2023-02-15", "食費", "コンビニ", "800"),
            new RawReceipt("2023-03-01", "光熱費", "電気代", "7200"),
            new RawReceipt("2023-03-10", "通信費", "携帯電話", "8000"),
            new RawReceipt("2023-03-15", "食費", "スーパーマーケット", "4200")
    );

    private SampleReceipts() {
    }

    public static List<RawReceipt> all() {
        return RECEIPTS;
    }
}
