package com.tradedesk.api.controller;

import com.tradedesk.api.dto.response.AuditEntryRecord;
import com.tradedesk.mapper.OrderRecordMapper;
import com.tradedesk.oms.OrderCommandService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/audit?sinceSeq=&limit= -- ledger audit entries after sinceSeq, oldest first.
 * Clients tail the log by passing the last seq they saw.
 */
@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final OrderCommandService orderCommandService;
    private final OrderRecordMapper orderRecordMapper;

    public AuditController(OrderCommandService orderCommandService, OrderRecordMapper orderRecordMapper) {
        this.orderCommandService = orderCommandService;
        this.orderRecordMapper = orderRecordMapper;
    }

    @GetMapping
    public ResponseEntity<List<AuditEntryRecord>> listAuditEntries(
            @RequestParam(required = false) Long sinceSeq, @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(
                orderRecordMapper.toAuditEntryRecords(orderCommandService.listAuditEntries(sinceSeq, limit)));
    }
}
