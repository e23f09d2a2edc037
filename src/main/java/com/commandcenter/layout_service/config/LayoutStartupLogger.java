package com.commandcenter.layout_service.config;

import com.commandcenter.layout_service.engine.LayoutSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Logs the effective layout settings once at startup, so a canvas that looks wrong can be
 * matched against the gaps and boxes the service is actually using.
 */
@Slf4j
@Component
public class LayoutStartupLogger implements ApplicationRunner {

    private final LayoutSettings settings;

    public LayoutStartupLogger(LayoutSettings settings) {
        this.settings = settings;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Layout: rankGap={}, nodeGap={}, defaultBox={}x{}, kinds={}",
                settings.rankGap(), settings.nodeGap(),
                settings.defaultDimensions().width(), settings.defaultDimensions().height(),
                settings.dimensions());
        log.info("Layout: cyclePolicy={}, crossingSweeps={}, maxNodes={}, maxEdges={}",
                settings.cyclePolicy(), settings.crossingSweeps(), settings.maxNodes(), settings.maxEdges());
    }
}
