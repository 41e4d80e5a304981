package com.tradedesk.session;

import com.tradedesk.config.EngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Connects the broker session once the application has started and asks for the first
 * position and account snapshots.
 *
 * <p>Non-fatal: on failure the engine stays up with the session DISCONNECTED; commands fail
 * with BROKER_UNAVAILABLE until {@code POST /api/session/connect} succeeds.
 */
@Component
public class StartupConnectRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(StartupConnectRunner.class);

    private final SessionGuard sessionGuard;
    private final EngineProperties engineProperties;

    public StartupConnectRunner(SessionGuard sessionGuard, EngineProperties engineProperties) {
        this.sessionGuard = sessionGuard;
        this.engineProperties = engineProperties;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (!engineProperties.getSession().isConnectOnStartup()) {
            log.info("Startup: connect-on-startup disabled, broker session left disconnected");
            return;
        }
        try {
            sessionGuard.connect();
            sessionGuard.requestSnapshots();
            log.info("Startup: broker session connected ({} mode)", engineProperties.getBroker().getMode());
        } catch (Exception e) {
            log.error("Startup: broker session connect failed: {}. Engine running disconnected.", e.getMessage());
        }
    }
}
