package com.kakeibo.ledger.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final KakeiboProperties props;

    public StartupDiagnostics(KakeiboProperties props) {
        this.props = props;
    }

    @PostConstruct
    void logConfig() {
        var export = props.export();
        log.info("Export config: filenamePrefix='{}', timestampPattern='{}'",
                export.filenamePrefix(), export.timestampPattern());
        log.info("Sample config: seedOnStartup={}", props.sample().seedOnStartupFlag());
    }
}
