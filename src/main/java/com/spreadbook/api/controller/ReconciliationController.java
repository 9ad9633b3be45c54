package com.spreadbook.api.controller;

import com.spreadbook.api.dto.request.ReconcileRequest;
import com.spreadbook.api.dto.request.SpreadPreviewRequest;
import com.spreadbook.domain.model.PortfolioSnapshot;
import com.spreadbook.domain.model.ReconciliationResult;
import com.spreadbook.domain.model.SpreadOrder;
import com.spreadbook.domain.model.TransactionBatch;
import com.spreadbook.mapper.ReconcileRequestMapper;
import com.spreadbook.reconciliation.TransactionReconciliationService;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for importing brokerage transactions.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/reconciliation/runs -- reconcile transactions into the position store</li>
 *   <li>POST /api/reconciliation/spreads/preview -- pair transactions without touching the store</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationController.class);

    private final TransactionReconciliationService transactionReconciliationService;
    private final ReconcileRequestMapper reconcileRequestMapper;

    public ReconciliationController(
            TransactionReconciliationService transactionReconciliationService,
            ReconcileRequestMapper reconcileRequestMapper) {
        this.transactionReconciliationService = transactionReconciliationService;
        this.reconcileRequestMapper = reconcileRequestMapper;
    }

    @PostMapping("/runs")
    public ResponseEntity<ReconciliationResult> reconcile(@Valid @RequestBody ReconcileRequest request) {
        TransactionBatch batch = reconcileRequestMapper.toBatch(request.getSources());
        PortfolioSnapshot snapshot =
                request.getPortfolio() != null ? reconcileRequestMapper.toSnapshot(request.getPortfolio()) : null;
        log.info(
                "Reconciliation requested: mode={}, {} sources",
                request.getMode(),
                request.getSources() != null ? request.getSources().size() : 0);

        ReconciliationResult result = transactionReconciliationService.reconcile(batch, snapshot, request.getMode());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/spreads/preview")
    public ResponseEntity<List<SpreadOrder>> previewSpreads(@Valid @RequestBody SpreadPreviewRequest request) {
        TransactionBatch batch = reconcileRequestMapper.toBatch(request.getSources());
        return ResponseEntity.ok(transactionReconciliationService.previewSpreads(batch));
    }
}
