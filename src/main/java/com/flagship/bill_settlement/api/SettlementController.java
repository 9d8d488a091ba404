package com.flagship.bill_settlement.api;

import com.flagship.bill_settlement.allocation.Allocation;
import com.flagship.bill_settlement.api.dto.ScannedSettlementRequest;
import com.flagship.bill_settlement.api.dto.SettlementRequest;
import com.flagship.bill_settlement.api.dto.SettlementResponse;
import com.flagship.bill_settlement.receipt.Receipt;
import com.flagship.bill_settlement.settlement.SettlementOutcome;
import com.flagship.bill_settlement.settlement.SettlementSummaryRenderer;
import com.flagship.bill_settlement.trace.ReasoningTraceRenderer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for settlement runs.
 *
 * Both endpoints return 200 with the verdict in the body, including when the
 * verdict is invalid; input errors map to 400 and unreconcilable receipts to 422
 * via {@link com.flagship.bill_settlement.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/settlements")
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    private final SettlementService settlementService;
    private final SettlementRequestMapper requestMapper;
    private final ScannedReceiptMapper scannedReceiptMapper;
    private final SettlementSummaryRenderer summaryRenderer;
    private final ReasoningTraceRenderer traceRenderer;

    /**
     * Settles a structured receipt.
     */
    @PostMapping
    public ResponseEntity<SettlementResponse> settle(@Valid @RequestBody SettlementRequest request) {
        log.info("Received settlement request: receiptId={}", request.getReceipt().getId());

        Receipt receipt = requestMapper.toReceipt(request.getReceipt());
        Allocation allocation = requestMapper.toAllocation(request.getAllocation(), receipt.getCurrency());

        return ResponseEntity.ok(respond(settlementService.settle(receipt, allocation, "settle")));
    }

    /**
     * Settles a receipt given in the scanner's output shape.
     */
    @PostMapping("/scanned")
    public ResponseEntity<SettlementResponse> settleScanned(@Valid @RequestBody ScannedSettlementRequest request) {
        log.info("Received scanned settlement request: items={}", request.getReceipt().getItems().size());

        Receipt receipt = scannedReceiptMapper.toReceipt(request.getReceipt());
        Allocation allocation = requestMapper.toAllocation(request.getAllocation(), receipt.getCurrency());

        return ResponseEntity.ok(respond(settlementService.settle(receipt, allocation, "settle_scanned")));
    }

    private SettlementResponse respond(SettlementOutcome outcome) {
        return SettlementResponse.from(
            outcome,
            summaryRenderer.render(outcome.getSettlement()),
            traceRenderer.render(outcome.getTrace()));
    }
}
