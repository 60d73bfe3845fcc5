package com.vaultledger.api.controller;

import com.vaultledger.api.dto.InboundTransferRequest;
import com.vaultledger.ledger.LedgerTransactionService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * POST /custody/inbound: the custody service reports value that arrived outside a deposit. Always rejected.
 */
@RestController
@RequestMapping("/api/v1/custody")
@RequiredArgsConstructor
public class CustodyCallbackController {

    private final LedgerTransactionService ledgerTransactionService;

    @PostMapping("/inbound")
    public Mono<Void> inbound(@RequestBody InboundTransferRequest request) {
        return Mono.fromRunnable(() -> ledgerTransactionService.rejectDirectTransfer(
                request.sender(), request.assetId(), request.amount()));
    }
}
