package com.tradedesk.api.controller;

import com.tradedesk.api.dto.response.FillRecord;
import com.tradedesk.mapper.OrderRecordMapper;
import com.tradedesk.oms.OrderCommandService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/fills?orderId=&limit= -- executions, newest first, optionally for one order.
 */
@RestController
@RequestMapping("/api/fills")
public class FillController {

    private final OrderCommandService orderCommandService;
    private final OrderRecordMapper orderRecordMapper;

    public FillController(OrderCommandService orderCommandService, OrderRecordMapper orderRecordMapper) {
        this.orderCommandService = orderCommandService;
        this.orderRecordMapper = orderRecordMapper;
    }

    @GetMapping
    public ResponseEntity<List<FillRecord>> listFills(
            @RequestParam(required = false) Long orderId, @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(orderRecordMapper.toFillRecords(orderCommandService.listFills(orderId, limit)));
    }
}
