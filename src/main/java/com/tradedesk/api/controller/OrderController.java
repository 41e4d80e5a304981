package com.tradedesk.api.controller;

import com.tradedesk.api.dto.request.ModifyOrderRequest;
import com.tradedesk.api.dto.request.PlaceOptionOrderRequest;
import com.tradedesk.api.dto.request.PlaceStockOrderRequest;
import com.tradedesk.api.dto.response.OrderCommandResponse;
import com.tradedesk.api.dto.response.OrderRecord;
import com.tradedesk.api.dto.response.PlaceOrderResponse;
import com.tradedesk.mapper.OrderCommandMapper;
import com.tradedesk.mapper.OrderRecordMapper;
import com.tradedesk.oms.OrderCommandResult;
import com.tradedesk.oms.OrderCommandService;
import com.tradedesk.oms.OrderModification;
import com.tradedesk.oms.OrderRequestValidator;
import com.tradedesk.oms.PlaceOrderResult;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for order placement, queries, modification and cancellation.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/orders/stock -- place a stock order</li>
 *   <li>POST /api/orders/option -- place an option order</li>
 *   <li>GET /api/orders?limit= -- newest orders first</li>
 *   <li>GET /api/orders/{orderId} -- one order</li>
 *   <li>PATCH /api/orders/{orderId} -- modify a working order</li>
 *   <li>DELETE /api/orders/{orderId} -- request cancellation</li>
 * </ul>
 *
 * <p>Cancel and modify answer 200 with ok=false when the order's state refuses the command;
 * broker and session failures surface through the GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final OrderCommandService orderCommandService;
    private final OrderRequestValidator orderRequestValidator;
    private final OrderCommandMapper orderCommandMapper;
    private final OrderRecordMapper orderRecordMapper;

    public OrderController(
            OrderCommandService orderCommandService,
            OrderRequestValidator orderRequestValidator,
            OrderCommandMapper orderCommandMapper,
            OrderRecordMapper orderRecordMapper) {
        this.orderCommandService = orderCommandService;
        this.orderRequestValidator = orderRequestValidator;
        this.orderCommandMapper = orderCommandMapper;
        this.orderRecordMapper = orderRecordMapper;
    }

    @PostMapping("/stock")
    public ResponseEntity<PlaceOrderResponse> placeStockOrder(@Valid @RequestBody PlaceStockOrderRequest request) {
        log.info(
                "Stock order request: {} {} {} x{} @ {}",
                request.getSide(),
                request.getOrderType(),
                request.getSymbol(),
                request.getQuantity(),
                request.getPrice());
        PlaceOrderResult result = orderCommandService.placeStockOrder(orderCommandMapper.toOrderRequest(request));
        return ResponseEntity.ok(orderCommandMapper.toResponse(result));
    }

    @PostMapping("/option")
    public ResponseEntity<PlaceOrderResponse> placeOptionOrder(@Valid @RequestBody PlaceOptionOrderRequest request) {
        log.info(
                "Option order request: {} {} {} {} {} {} x{} @ {}",
                request.getSide(),
                request.getOrderType(),
                request.getSymbol(),
                request.getExpiry(),
                request.getStrike(),
                request.getRight(),
                request.getQuantity(),
                request.getPrice());
        PlaceOrderResult result = orderCommandService.placeOptionOrder(orderCommandMapper.toOrderRequest(request));
        return ResponseEntity.ok(orderCommandMapper.toResponse(result));
    }

    @GetMapping
    public ResponseEntity<List<OrderRecord>> listOrders(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(orderRecordMapper.toOrderRecords(orderCommandService.listOrders(limit)));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderRecord> getOrder(@PathVariable long orderId) {
        return ResponseEntity.ok(orderRecordMapper.toRecord(orderCommandService.getOrder(orderId)));
    }

    @PatchMapping("/{orderId}")
    public ResponseEntity<OrderCommandResponse> modifyOrder(
            @PathVariable long orderId, @RequestBody ModifyOrderRequest request) {
        OrderModification modification = orderRequestValidator.parseModification(
                request.getQuantity(), request.getOrderType(), request.getPrice(), request.getTif());
        log.info("Modify request for order {}: {}", orderId, modification);
        OrderCommandResult result = orderCommandService.modify(orderId, modification);
        return ResponseEntity.ok(orderCommandMapper.toResponse(result));
    }

    @DeleteMapping("/{orderId}")
    public ResponseEntity<OrderCommandResponse> cancelOrder(@PathVariable long orderId) {
        log.info("Cancel request for order {}", orderId);
        OrderCommandResult result = orderCommandService.cancel(orderId);
        return ResponseEntity.ok(orderCommandMapper.toResponse(result));
    }
}
