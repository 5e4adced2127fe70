package com.kakeibo.ledger;

import com.kakeibo.ledger.config.KakeiboProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(KakeiboProperties.class)
public class KakeiboLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(KakeiboLedgerApplication.class, args);
    }
}
