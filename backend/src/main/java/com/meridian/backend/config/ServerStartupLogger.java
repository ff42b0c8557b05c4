package com.meridian.backend.config;

import com.meridian.backend.service.model.ModelAdapter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final Environment environment;
    private final SchedulerProperties schedulerProperties;
    private final MarketDataProperties marketDataProperties;
    private final ModelAdapter modelAdapter;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String contextPath = environment.getProperty("server.servlet.context-path", "");
        log.info("🚀 Signal engine listening on http://localhost:{}{}/api/pipeline", port, contextPath);
        log.info("Pipeline: scheduler={} interval={} timeframe={} symbols={} model={} autoExecute={}",
                schedulerProperties.isEnabled() ? "on" : "off",
                schedulerProperties.getTickInterval(),
                marketDataProperties.getTimeframe(),
                schedulerProperties.getSymbols(),
                modelAdapter.modelVersion(),
                schedulerProperties.isAutoExecute());
        if (schedulerProperties.isAutoExecute() && schedulerProperties.isEnabled()) {
            log.warn("⚠️ Auto-execute is on: emitted signals open positions via the execution port");
        }
    }
}
