package com.tradedesk.config;

import com.tradedesk.domain.enums.ForeignOrderPolicy;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings bound from the {@code tradedesk.*} prefix in application.properties.
 *
 * <p>Defaults here are the values the engine runs with when a key is absent.
 */
@ConfigurationProperties(prefix = "tradedesk")
@Getter
@Setter
public class EngineProperties {

    private Session session = new Session();
    private Ledger ledger = new Ledger();
    private Reconciler reconciler = new Reconciler();
    private Broker broker = new Broker();

    @Getter
    @Setter
    public static class Session {

        /** Upper bound on every broker call (submit, cancel, modify, connect, snapshot). */
        private Duration callTimeout = Duration.ofSeconds(5);

        /** Bounded wait for the per-order command lock. */
        private Duration commandLockTimeout = Duration.ofSeconds(10);

        /** Connect the broker session when the application starts. */
        private boolean connectOnStartup = true;

        /** Milliseconds between session health cross-checks. */
        private long healthCheckInterval = 30000;
    }

    @Getter
    @Setter
    public static class Ledger {

        /** Applied when a list call passes no limit or a limit of zero or less. */
        private int defaultListLimit = 100;

        /** Applied to audit log reads without a positive limit. */
        private int defaultAuditLimit = 1000;
    }

    @Getter
    @Setter
    public static class Reconciler {

        /** How long the consumer blocks on the channel before retrying buffered events. */
        private Duration pollInterval = Duration.ofMillis(200);

        /** How long an event for an unbound broker order id is kept before it is dropped. */
        private Duration unknownOrderWait = Duration.ofSeconds(5);

        private ForeignOrderPolicy foreignOrderPolicy = ForeignOrderPolicy.IGNORE;
    }

    @Getter
    @Setter
    public static class Broker {

        /** Only PAPER ships with the engine; a live session is supplied as its own BrokerSession bean. */
        private String mode = "PAPER";

        private String account = "DU000000";
        private String exchange = "SMART";
        private String commissionCurrency = "USD";

        private Paper paper = new Paper();
    }

    @Getter
    @Setter
    public static class Paper {

        /** Mark used for any symbol without an explicit entry in {@link #marks}. */
        private BigDecimal defaultMark = new BigDecimal("100.00");

        /** Per-symbol marks, e.g. {@code tradedesk.broker.paper.marks.AAPL=190.20}. */
        private Map<String, BigDecimal> marks = new HashMap<>();

        /** Flat commission charged per execution. */
        private BigDecimal commissionPerFill = new BigDecimal("1.00");

        /** Executions per market order. Values above 1 split the fill into partials. */
        private int fillSlices = 1;
    }
}
