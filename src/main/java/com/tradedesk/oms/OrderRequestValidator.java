package com.tradedesk.oms;

import com.tradedesk.domain.enums.OptionRight;
import com.tradedesk.domain.enums.OrderSide;
import com.tradedesk.domain.enums.OrderType;
import com.tradedesk.domain.enums.TimeInForce;
import com.tradedesk.domain.model.Instrument;
import com.tradedesk.domain.model.OptionInstrument;
import com.tradedesk.domain.model.StockInstrument;
import com.tradedesk.exception.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Checks a client order request and turns it into typed values.
 *
 * <p>All field problems are collected and reported together in one
 * {@link ValidationException}, keyed by field name. Nothing is allocated, stored or sent
 * before validation passes.
 */
@Component
public class OrderRequestValidator {

    private static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    public ValidatedOrderRequest validateStock(OrderRequest request) {
        Map<String, Object> errors = new LinkedHashMap<>();
        Common common = validateCommon(request, errors);
        throwIfInvalid("Invalid stock order", errors);
        return common.toRequest(new StockInstrument(request.getSymbol().trim()));
    }

    public ValidatedOrderRequest validateOption(OrderRequest request) {
        Map<String, Object> errors = new LinkedHashMap<>();
        Common common = validateCommon(request, errors);

        String expiry = request.getExpiry();
        if (expiry == null || expiry.isBlank()) {
            errors.put("expiry", "expiry is required for options");
        } else if (!isValidExpiry(expiry.trim())) {
            errors.put("expiry", "expiry must be a date in YYYYMMDD form");
        }

        if (request.getStrike() == null) {
            errors.put("strike", "strike is required for options");
        } else if (request.getStrike().signum() <= 0) {
            errors.put("strike", "strike must be positive");
        }

        OptionRight right = null;
        if (request.getRight() == null || request.getRight().isBlank()) {
            errors.put("right", "right is required for options");
        } else {
            right = parse(request.getRight(), "right", OptionRight::valueOf, OptionRight.values(), errors);
        }

        throwIfInvalid("Invalid option order", errors);
        return common.toRequest(
                new OptionInstrument(request.getSymbol().trim(), expiry.trim(), request.getStrike(), right));
    }

    /**
     * Validates a modification against field-level rules only. Rules that depend on the
     * order's current state are checked by {@link OrderStateMachine#checkModifiable}.
     */
    public void validateModification(OrderModification modification) {
        Map<String, Object> errors = new LinkedHashMap<>();
        if (modification == null || modification.isEmpty()) {
            throw new ValidationException("At least one of quantity, order_type, price or tif must be given");
        }
        if (modification.getQuantity() != null && modification.getQuantity() <= 0) {
            errors.put("quantity", "quantity must be positive");
        }
        if (modification.getPrice() != null && modification.getPrice().signum() <= 0) {
            errors.put("price", "price must be positive");
        }
        throwIfInvalid("Invalid modification", errors);
    }

    /** Parses text modification fields; null means no change. */
    public OrderModification parseModification(Integer quantity, String orderType, BigDecimal price, String tif) {
        Map<String, Object> errors = new LinkedHashMap<>();
        OrderType type = orderType == null
                ? null
                : parse(orderType, "order_type", OrderType::valueOf, OrderType.values(), errors);
        TimeInForce timeInForce = tif == null
                ? null
                : parse(tif, "tif", TimeInForce::valueOf, TimeInForce.values(), errors);
        throwIfInvalid("Invalid modification", errors);

        OrderModification modification = OrderModification.builder()
                .quantity(quantity)
                .orderType(type)
                .price(price)
                .tif(timeInForce)
                .build();
        validateModification(modification);
        return modification;
    }

    private Common validateCommon(OrderRequest request, Map<String, Object> errors) {
        if (request == null) {
            throw new ValidationException("Order request is required");
        }
        if (request.getSymbol() == null || request.getSymbol().isBlank()) {
            errors.put("symbol", "symbol must not be empty");
        }

        OrderSide side = null;
        if (request.getSide() == null) {
            errors.put("side", "side is required");
        } else {
            side = parse(request.getSide(), "side", OrderSide::valueOf, OrderSide.values(), errors);
        }

        if (request.getQuantity() == null || request.getQuantity() <= 0) {
            errors.put("quantity", "quantity must be a positive integer");
        }

        OrderType orderType = null;
        if (request.getOrderType() == null) {
            errors.put("order_type", "order_type is required");
        } else {
            orderType = parse(request.getOrderType(), "order_type", OrderType::valueOf, OrderType.values(), errors);
        }

        BigDecimal price = request.getPrice();
        if (orderType != null && orderType.requiresPrice()) {
            if (price == null) {
                errors.put("price", "price is required for " + orderType + " orders");
            } else if (price.signum() <= 0) {
                errors.put("price", "price must be positive");
            }
        } else if (orderType == OrderType.MKT) {
            price = null;
        }

        TimeInForce tif = TimeInForce.DAY;
        if (request.getTif() != null) {
            tif = parse(request.getTif(), "tif", TimeInForce::valueOf, TimeInForce.values(), errors);
        }

        int quantity = request.getQuantity() != null ? request.getQuantity() : 0;
        return new Common(side, quantity, orderType, price, tif);
    }

    private static boolean isValidExpiry(String expiry) {
        if (expiry.length() != 8) {
            return false;
        }
        try {
            LocalDate.parse(expiry, EXPIRY_FORMAT);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static <E extends Enum<E>> E parse(
            String value, String field, Function<String, E> parser, E[] allowed, Map<String, Object> errors) {
        try {
            return parser.apply(value.trim());
        } catch (IllegalArgumentException e) {
            errors.put(field, field + " must be one of " + Arrays.toString(allowed) + ", got '" + value + "'");
            return null;
        }
    }

    private static void throwIfInvalid(String message, Map<String, Object> errors) {
        if (!errors.isEmpty()) {
            throw new ValidationException(message + ": " + String.join("; ", errors.keySet()), errors);
        }
    }

    private record Common(OrderSide side, int quantity, OrderType orderType, BigDecimal price, TimeInForce tif) {

        ValidatedOrderRequest toRequest(Instrument instrument) {
            return new ValidatedOrderRequest(instrument, side, quantity, orderType, price, tif);
        }
    }
}
