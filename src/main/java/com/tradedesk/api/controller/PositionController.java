package com.tradedesk.api.controller;

import com.tradedesk.api.dto.response.AccountValueRecord;
import com.tradedesk.api.dto.response.PositionRecord;
import com.tradedesk.mapper.OrderRecordMapper;
import com.tradedesk.oms.OrderCommandService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only views of positions and account values as last reconciled.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/positions -- net position per contract</li>
 *   <li>GET /api/account-values -- latest value per account, tag and currency</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class PositionController {

    private final OrderCommandService orderCommandService;
    private final OrderRecordMapper orderRecordMapper;

    public PositionController(OrderCommandService orderCommandService, OrderRecordMapper orderRecordMapper) {
        this.orderCommandService = orderCommandService;
        this.orderRecordMapper = orderRecordMapper;
    }

    @GetMapping("/positions")
    public ResponseEntity<List<PositionRecord>> getPositions() {
        return ResponseEntity.ok(orderRecordMapper.toPositionRecords(orderCommandService.getPositions()));
    }

    @GetMapping("/account-values")
    public ResponseEntity<List<AccountValueRecord>> getAccountValues() {
        return ResponseEntity.ok(orderRecordMapper.toAccountValueRecords(orderCommandService.getAccountValues()));
    }
}
