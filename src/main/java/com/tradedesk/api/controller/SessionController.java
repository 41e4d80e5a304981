package com.tradedesk.api.controller;

import com.tradedesk.api.dto.response.SessionHealthResponse;
import com.tradedesk.mapper.OrderCommandMapper;
import com.tradedesk.session.SessionGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Broker session health and control.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/session/health -- state, last transition, timeout count, queued calls</li>
 *   <li>POST /api/session/connect -- connect (no-op when already connected)</li>
 *   <li>POST /api/session/disconnect -- disconnect after in-flight calls drain</li>
 *   <li>POST /api/session/snapshots -- ask the broker for fresh positions, account values
 *       and open orders</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/session")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionGuard sessionGuard;
    private final OrderCommandMapper orderCommandMapper;

    public SessionController(SessionGuard sessionGuard, OrderCommandMapper orderCommandMapper) {
        this.sessionGuard = sessionGuard;
        this.orderCommandMapper = orderCommandMapper;
    }

    @GetMapping("/health")
    public ResponseEntity<SessionHealthResponse> getHealth() {
        return ResponseEntity.ok(orderCommandMapper.toResponse(sessionGuard.health()));
    }

    @PostMapping("/connect")
    public ResponseEntity<SessionHealthResponse> connect() {
        log.info("Manual broker session connect requested");
        sessionGuard.connect();
        return ResponseEntity.ok(orderCommandMapper.toResponse(sessionGuard.health()));
    }

    @PostMapping("/disconnect")
    public ResponseEntity<SessionHealthResponse> disconnect() {
        log.info("Manual broker session disconnect requested");
        sessionGuard.disconnect();
        return ResponseEntity.ok(orderCommandMapper.toResponse(sessionGuard.health()));
    }

    @PostMapping("/snapshots")
    public ResponseEntity<SessionHealthResponse> requestSnapshots() {
        log.info("Broker snapshot refresh requested");
        sessionGuard.requestSnapshots();
        return ResponseEntity.ok(orderCommandMapper.toResponse(sessionGuard.health()));
    }
}
