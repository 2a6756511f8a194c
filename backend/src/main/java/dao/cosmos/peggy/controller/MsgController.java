package dao.cosmos.peggy.controller;

import dao.cosmos.peggy.model.AssetMapping;
import dao.cosmos.peggy.model.BatchConfirm;
import dao.cosmos.peggy.model.LogicCallConfirm;
import dao.cosmos.peggy.model.MsgBatchExecuted;
import dao.cosmos.peggy.model.MsgCancelSendToEth;
import dao.cosmos.peggy.model.MsgConfirmBatch;
import dao.cosmos.peggy.model.MsgConfirmLogicCall;
import dao.cosmos.peggy.model.MsgLogicCallExecuted;
import dao.cosmos.peggy.model.MsgRequestBatch;
import dao.cosmos.peggy.model.MsgSendToEth;
import dao.cosmos.peggy.model.MsgSetAssetMapping;
import dao.cosmos.peggy.model.MsgSetEthAddress;
import dao.cosmos.peggy.model.MsgSubmitLogicCall;
import dao.cosmos.peggy.model.MsgValsetConfirm;
import dao.cosmos.peggy.model.MsgValsetRequest;
import dao.cosmos.peggy.model.OutgoingLogicCall;
import dao.cosmos.peggy.model.OutgoingTransferTx;
import dao.cosmos.peggy.model.OutgoingTxBatch;
import dao.cosmos.peggy.model.Valset;
import dao.cosmos.peggy.model.ValsetConfirm;
import dao.cosmos.peggy.service.BridgeMsgService;
import dao.cosmos.peggy.service.StateManager;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Transaction surface. Each message runs as one atomic state transition in
 * the current block.
 */
@Slf4j
@RestController
@RequestMapping("/api/peggy/msgs")
public class MsgController {

    private final BridgeMsgService msgService;
    private final StateManager stateManager;

    public MsgController(BridgeMsgService msgService, StateManager stateManager) {
        this.msgService = msgService;
        this.stateManager = stateManager;
    }

    @PostMapping("/set-eth-address")
    public ResponseEntity<Void> setEthAddress(@Valid @RequestBody MsgSetEthAddress msg) {
        stateManager.deliverTx(ctx -> {
            msgService.setEthAddress(ctx, msg);
            return null;
        });
        return ResponseEntity.ok().build();
    }

    @PostMapping("/valset-request")
    public Valset requestValset(@Valid @RequestBody MsgValsetRequest msg) {
        return stateManager.deliverTx(ctx -> msgService.requestValset(ctx, msg));
    }

    @PostMapping("/send-to-eth")
    public Map<String, Long> sendToEth(@Valid @RequestBody MsgSendToEth msg) {
        long id = stateManager.deliverTx(ctx -> msgService.sendToEth(ctx, msg));
        log.info("Queued outgoing transfer: id={}, sender={}", id, msg.getSender());
        return Map.of("id", id);
    }

    @PostMapping("/cancel-send-to-eth")
    public OutgoingTransferTx cancelSendToEth(@Valid @RequestBody MsgCancelSendToEth msg) {
        return stateManager.deliverTx(ctx -> msgService.cancelSendToEth(ctx, msg));
    }

    @PostMapping("/request-batch")
    public ResponseEntity<OutgoingTxBatch> requestBatch(@Valid @RequestBody MsgRequestBatch msg) {
        Optional<OutgoingTxBatch> batch = stateManager.deliverTx(ctx -> msgService.requestBatch(ctx, msg));
        return batch.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/valset-confirm")
    public ValsetConfirm confirmValset(@Valid @RequestBody MsgValsetConfirm msg) {
        return stateManager.deliverTx(ctx -> msgService.confirmValset(ctx, msg));
    }

    @PostMapping("/confirm-batch")
    public BatchConfirm confirmBatch(@Valid @RequestBody MsgConfirmBatch msg) {
        return stateManager.deliverTx(ctx -> msgService.confirmBatch(ctx, msg));
    }

    @PostMapping("/confirm-logic-call")
    public LogicCallConfirm confirmLogicCall(@Valid @RequestBody MsgConfirmLogicCall msg) {
        return stateManager.deliverTx(ctx -> msgService.confirmLogicCall(ctx, msg));
    }

    @PostMapping("/submit-logic-call")
    public OutgoingLogicCall submitLogicCall(@Valid @RequestBody MsgSubmitLogicCall msg) {
        return stateManager.deliverTx(ctx -> msgService.submitLogicCall(ctx, msg));
    }

    @PostMapping("/set-asset-mapping")
    public AssetMapping setAssetMapping(@Valid @RequestBody MsgSetAssetMapping msg) {
        return stateManager.deliverTx(ctx -> msgService.setAssetMapping(ctx, msg));
    }

    @PostMapping("/batch-executed")
    public OutgoingTxBatch batchExecuted(@Valid @RequestBody MsgBatchExecuted msg) {
        return stateManager.deliverTx(ctx -> msgService.batchExecuted(ctx, msg));
    }

    @PostMapping("/logic-call-executed")
    public OutgoingLogicCall logicCallExecuted(@Valid @RequestBody MsgLogicCallExecuted msg) {
        return stateManager.deliverTx(ctx -> msgService.logicCallExecuted(ctx, msg));
    }
}
