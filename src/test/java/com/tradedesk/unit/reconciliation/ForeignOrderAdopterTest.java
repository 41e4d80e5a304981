package com.tradedesk.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.tradedesk.broker.BrokerEvent;
import com.tradedesk.broker.BrokerEventType;
import com.tradedesk.config.EngineProperties;
import com.tradedesk.domain.enums.AssetClass;
import com.tradedesk.domain.enums.ForeignOrderPolicy;
import com.tradedesk.domain.enums.OptionRight;
import com.tradedesk.domain.enums.OrderOrigin;
import com.tradedesk.domain.enums.OrderStatus;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.model.OptionInstrument;
import com.tradedesk.domain.model.Order;
import com.tradedesk.event.EventPublisherHelper;
import com.tradedesk.exception.ValidationException;
import com.tradedesk.ledger.OrderLedger;
import com.tradedesk.oms.OrderIdRegistry;
import com.tradedesk.reconciliation.ForeignOrderAdopter;
import com.tradedesk.repository.AccountValueRepository;
import com.tradedesk.repository.AuditLogRepository;
import com.tradedesk.repository.FillRepository;
import com.tradedesk.repository.OrderRepository;
import com.tradedesk.repository.PositionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ForeignOrderAdopterTest {

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private EngineProperties engineProperties;
    private OrderLedger orderLedger;
    private OrderIdRegistry orderIdRegistry;
    private ForeignOrderAdopter adopter;

    @BeforeEach
    void setUp() {
        engineProperties = new EngineProperties();
        engineProperties.getReconciler().setForeignOrderPolicy(ForeignOrderPolicy.ADOPT);
        orderLedger = new OrderLedger(
                new OrderRepository(),
                new FillRepository(),
                new PositionRepository(),
                new AccountValueRepository(),
                new AuditLogRepository(),
                engineProperties,
                Clock.fixed(Instant.parse("2026-03-02T14:30:00Z"), ZoneOffset.UTC));
        orderIdRegistry = new OrderIdRegistry(orderLedger);
        adopter = new ForeignOrderAdopter(orderLedger, orderIdRegistry, eventPublisherHelper, engineProperties);
    }

    private static BrokerEvent.BrokerEventBuilder openOrder(long brokerOrderId) {
        return BrokerEvent.builder()
                .type(BrokerEventType.OPEN_ORDER)
                .brokerOrderId(brokerOrderId)
                .symbol("AAPL")
                .secType("STK")
                .side("SELL")
                .quantity(50)
                .orderType("LMT")
                .price(new BigDecimal("195.00"))
                .tif("GTC")
                .status("Submitted");
    }

    @Test
    @DisplayName("ADOPT stores the order with a fresh id and binds it")
    void adoptsStockOrder() {
        Optional<Long> adopted = adopter.handle(openOrder(5001L).build(), 0);

        assertThat(adopted).isPresent();
        long orderId = adopted.get();
        assertThat(orderIdRegistry.resolve(5001L)).contains(orderId);

        Order order = orderLedger.getOrder(orderId).orElseThrow();
        assertThat(order.getOrigin()).isEqualTo(OrderOrigin.ADOPTED);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.ACKED);
        assertThat(order.getOrderType()).isEqualTo(OrderType.LMT);
        assertThat(order.getPrice()).isEqualByComparingTo("195.00");
        verify(eventPublisherHelper).publishOrderAdopted(eq(adopter), any(Order.class));
    }

    @Test
    @DisplayName("A partly filled foreign option order is adopted as PARTIALLY_FILLED")
    void adoptsPartlyFilledOption() {
        BrokerEvent event = openOrder(5002L)
                .symbol("SPY")
                .secType("OPT")
                .expiry("20261218")
                .strike(new BigDecimal("500"))
                .right("C")
                .quantity(4)
                .filledQuantity(1)
                .avgCost(new BigDecimal("11.80"))
                .build();

        long orderId = adopter.handle(event, 0).orElseThrow();

        Order order = orderLedger.getOrder(orderId).orElseThrow();
        assertThat(order.getAssetClass()).isEqualTo(AssetClass.OPT);
        assertThat(order.getInstrument())
                .isEqualTo(new OptionInstrument("SPY", "20261218", new BigDecimal("500"), OptionRight.C));
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        assertThat(order.getFilledQty()).isEqualTo(1);
        assertThat(order.getAvgPrice()).isEqualByComparingTo("11.80");
        assertThat(order.getMessage()).isEqualTo("Adopted from broker with 1 filled");
    }

    @Test
    @DisplayName("Fills about to be replayed are not seeded a second time")
    void replayedFillsAreNotSeeded() {
        BrokerEvent event = openOrder(5005L).quantity(10).filledQuantity(5).avgCost(new BigDecimal("410.00")).build();

        long orderId = adopter.handle(event, 5).orElseThrow();

        Order order = orderLedger.getOrder(orderId).orElseThrow();
        assertThat(order.getFilledQty()).isZero();
        assertThat(order.getAvgPrice()).isNull();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.ACKED);
    }

    @Test
    @DisplayName("Fills reported without an average price cannot be adopted")
    void rejectsFillsWithoutAveragePrice() {
        BrokerEvent event = openOrder(5006L).quantity(10).filledQuantity(4).build();

        assertThatThrownBy(() -> adopter.handle(event, 0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("without an average price");

        assertThat(orderIdRegistry.resolve(5006L)).isEmpty();
        assertThat(orderLedger.listOrders(null)).isEmpty();
    }

    @Test
    @DisplayName("IGNORE leaves the ledger and registry untouched")
    void ignores() {
        engineProperties.getReconciler().setForeignOrderPolicy(ForeignOrderPolicy.IGNORE);

        assertThat(adopter.handle(openOrder(5003L).build(), 0)).isEmpty();

        assertThat(orderIdRegistry.resolve(5003L)).isEmpty();
        assertThat(orderLedger.listOrders(null)).isEmpty();
        verifyNoInteractions(eventPublisherHelper);
    }

    @Test
    @DisplayName("An open order without a usable side cannot be adopted")
    void rejectsIncompleteEvent() {
        assertThatThrownBy(() -> adopter.handle(openOrder(5004L).side("SSHORT").build(), 0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("side");

        assertThat(orderIdRegistry.resolve(5004L)).isEmpty();
    }
}
