package com.tradedesk.broker;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One message from the broker session to the reconciler.
 *
 * <p>The broker's callbacks are flattened into this single shape; which fields are set
 * depends on {@link #type}:
 * <ul>
 *   <li>ACK: brokerOrderId</li>
 *   <li>PARTIAL_FILL / FILL: brokerOrderId, execId, quantity (this execution), price, time,
 *       plus the contract fields (account, exchange, conId) when known</li>
 *   <li>STATUS: brokerOrderId, status (broker text), message</li>
 *   <li>REJECT / ERROR / CANCEL_REJECT: brokerOrderId, errorCode, message</li>
 *   <li>COMMISSION: brokerOrderId, execId, commission, currency, realizedPnl</li>
 *   <li>OPEN_ORDER: brokerOrderId, contract fields, side, quantity, orderType, price, tif,
 *       filledQuantity, status</li>
 *   <li>POSITION_SNAPSHOT: account, contract fields, position, avgCost</li>
 *   <li>ACCOUNT_VALUE_SNAPSHOT: account, tag, currency, value</li>
 *   <li>CONNECTION_LOST / CONNECTION_RESTORED: message</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class BrokerEvent {

    BrokerEventType type;
    Long brokerOrderId;

    // order status and errors
    String status;
    Integer errorCode;
    String message;

    // executions
    String execId;
    Integer quantity;
    BigDecimal price;
    String time;

    // commission reports
    BigDecimal commission;
    String currency;
    BigDecimal realizedPnl;

    // contract
    String account;
    String symbol;
    String secType;
    String exchange;
    Long conId;
    String expiry;
    BigDecimal strike;
    String right;

    // open orders
    String side;
    String orderType;
    String tif;
    Integer filledQuantity;

    // snapshots
    BigDecimal position;
    BigDecimal avgCost;
    String tag;
    String value;

    /** When the broker produced the event. Snapshots use it as their as-of time. */
    Instant occurredAt;
}
