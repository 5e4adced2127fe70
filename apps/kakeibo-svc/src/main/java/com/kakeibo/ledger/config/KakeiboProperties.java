package com.kakeibo.ledger.config;

import java.time.format.DateTimeFormatter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "kakeibo")
public record KakeiboProperties(
        Export export,
        Sample sample
) {

    @ConstructorBinding
    public KakeiboProperties {
        if (export == null) {
            export = new Export(null, null);
        }
        if (sample == null) {
            sample = new Sample(null);
        }
    }

    public record Export(String filenamePrefix, String timestampPattern) {
        public Export {
            if (filenamePrefix == null || filenamePrefix.isBlank()) {
                filenamePrefix = "entries";
            }
            if (timestampPattern == null || timestampPattern.isBlank()) {
                timestampPattern = "yyyyMMddHHmmss";
            }
            if (!filenamePrefix.matches("[A-Za-z0-9_-]+")) {
                throw new IllegalArgumentException("filenamePrefix must contain only letters, digits, '_' or '-'");
            }
            // fail at startup rather than on the first export
            DateTimeFormatter.ofPattern(timestampPattern);
        }

        public DateTimeFormatter timestampFormatter() {
            return DateTimeFormatter.ofPattern(timestampPattern);
        }
    }

    public record Sample(Boolean seedOnStartup) {
        public boolean seedOnStartupFlag() {
            return seedOnStartup != null && seedOnStartup;
        }
    }
}
