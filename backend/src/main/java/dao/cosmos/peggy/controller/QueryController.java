package dao.cosmos.peggy.controller;

import dao.cosmos.peggy.model.AssetMapping;
import dao.cosmos.peggy.model.BatchConfirm;
import dao.cosmos.peggy.model.LogicCallConfirm;
import dao.cosmos.peggy.model.OutgoingLogicCall;
import dao.cosmos.peggy.model.OutgoingTxBatch;
import dao.cosmos.peggy.model.PendingSendToEth;
import dao.cosmos.peggy.model.Valset;
import dao.cosmos.peggy.model.ValsetConfirm;
import dao.cosmos.peggy.service.QueryService;
import dao.cosmos.peggy.service.StateManager;
import dao.cosmos.peggy.util.AddressUtil;
import dao.cosmos.peggy.util.ParseUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Query surface polled by orchestrators (pending work) and relayers
 * (collected confirmations).
 *
 * Parameters arrive as strings and are parsed here; a malformed value is a
 * 400. A lookup that finds nothing is 204 for single results and an empty
 * array for lists.
 */
@RestController
@RequestMapping("/api/peggy/query")
public class QueryController {

    private final QueryService queryService;
    private final StateManager stateManager;

    public QueryController(QueryService queryService, StateManager stateManager) {
        this.queryService = queryService;
        this.stateManager = stateManager;
    }

    // ---------------------------------------------------------------------
    // valsets
    // ---------------------------------------------------------------------

    @GetMapping("/valset/current")
    public ResponseEntity<Valset> currentValset() {
        return single(stateManager.query(queryService::currentValset));
    }

    @GetMapping("/valset/{nonce}")
    public ResponseEntity<Valset> valsetRequest(@PathVariable String nonce) {
        long n = ParseUtil.parseNonce(nonce, "nonce");
        return single(stateManager.query(ctx -> queryService.valsetRequest(ctx, n)));
    }

    @GetMapping("/valsets/last")
    public List<Valset> lastValsetRequests(@RequestParam(required = false) String limit) {
        int l = parseLimit(limit);
        return stateManager.query(ctx -> queryService.lastValsetRequests(ctx, l));
    }

    @GetMapping("/valsets/pending/{orchestrator}")
    public ResponseEntity<Valset> lastPendingValsetRequest(@PathVariable String orchestrator) {
        String orch = AddressUtil.requireCosmosAddress(orchestrator, "orchestrator");
        return single(stateManager.query(ctx -> queryService.lastPendingValsetRequest(ctx, orch)));
    }

    @GetMapping("/valset-confirm/{nonce}/{orchestrator}")
    public ResponseEntity<ValsetConfirm> valsetConfirm(@PathVariable String nonce, @PathVariable String orchestrator) {
        long n = ParseUtil.parseNonce(nonce, "nonce");
        String orch = AddressUtil.requireCosmosAddress(orchestrator, "orchestrator");
        return single(stateManager.query(ctx -> queryService.valsetConfirm(ctx, n, orch)));
    }

    @GetMapping("/valset-confirms/{nonce}")
    public List<ValsetConfirm> allValsetConfirms(@PathVariable String nonce) {
        long n = ParseUtil.parseNonce(nonce, "nonce");
        return stateManager.query(ctx -> queryService.allValsetConfirms(ctx, n));
    }

    // ---------------------------------------------------------------------
    // batches
    // ---------------------------------------------------------------------

    @GetMapping("/batches/last")
    public List<OutgoingTxBatch> lastBatchesRequest(@RequestParam(required = false) String limit,
                                                    @RequestParam(required = false) String contract) {
        int l = parseLimit(limit);
        String c = optionalContract(contract);
        return stateManager.query(ctx -> queryService.lastBatchesRequest(ctx, l, c));
    }

    @GetMapping("/batch/{nonce}/{contract}")
    public ResponseEntity<OutgoingTxBatch> batch(@PathVariable String nonce, @PathVariable String contract) {
        long n = ParseUtil.parseNonce(nonce, "nonce");
        String c = AddressUtil.requireEthAddress(contract, "contract");
        return single(stateManager.query(ctx -> queryService.batch(ctx, n, c)));
    }

    @GetMapping("/batches/pending/{orchestrator}")
    public ResponseEntity<OutgoingTxBatch> lastPendingBatchRequest(@PathVariable String orchestrator,
                                                                   @RequestParam(required = false) String contract) {
        String orch = AddressUtil.requireCosmosAddress(orchestrator, "orchestrator");
        String c = optionalContract(contract);
        return single(stateManager.query(ctx -> queryService.lastPendingBatchRequest(ctx, orch, c)));
    }

    @GetMapping("/batch-confirms/{nonce}/{contract}")
    public List<BatchConfirm> allBatchConfirms(@PathVariable String nonce, @PathVariable String contract) {
        long n = ParseUtil.parseNonce(nonce, "nonce");
        String c = AddressUtil.requireEthAddress(contract, "contract");
        return stateManager.query(ctx -> queryService.allBatchConfirms(ctx, n, c));
    }

    // ---------------------------------------------------------------------
    // logic calls
    // ---------------------------------------------------------------------

    @GetMapping("/logic-calls/last")
    public List<OutgoingLogicCall> lastLogicCallRequests(@RequestParam(required = false) String limit) {
        int l = parseLimit(limit);
        return stateManager.query(ctx -> queryService.lastLogicCallRequests(ctx, l));
    }

    @GetMapping("/logic-call/{invalidationId}/{nonce}")
    public ResponseEntity<OutgoingLogicCall> logicCall(@PathVariable String invalidationId, @PathVariable String nonce) {
        byte[] id = ParseUtil.parseInvalidationId(invalidationId, "invalidationId");
        long n = ParseUtil.parseNonce(nonce, "nonce");
        return single(stateManager.query(ctx -> queryService.logicCall(ctx, id, n)));
    }

    @GetMapping("/logic-calls/pending/{orchestrator}")
    public ResponseEntity<OutgoingLogicCall> lastPendingLogicCallRequest(@PathVariable String orchestrator) {
        String orch = AddressUtil.requireCosmosAddress(orchestrator, "orchestrator");
        return single(stateManager.query(ctx -> queryService.lastPendingLogicCallRequest(ctx, orch)));
    }

    @GetMapping("/logic-call-confirms/{invalidationId}/{nonce}")
    public List<LogicCallConfirm> allLogicCallConfirms(@PathVariable String invalidationId, @PathVariable String nonce) {
        byte[] id = ParseUtil.parseInvalidationId(invalidationId, "invalidationId");
        long n = ParseUtil.parseNonce(nonce, "nonce");
        return stateManager.query(ctx -> queryService.allLogicCallConfirms(ctx, id, n));
    }

    // ---------------------------------------------------------------------
    // transfers and assets
    // ---------------------------------------------------------------------

    @GetMapping("/pending-send-to-eth/{sender}")
    public PendingSendToEth pendingSendToEth(@PathVariable String sender) {
        String s = AddressUtil.requireCosmosAddress(sender, "sender");
        return stateManager.query(ctx -> queryService.pendingSendToEth(ctx, s));
    }

    @GetMapping("/erc20-to-denom/{contract}")
    public ResponseEntity<AssetMapping> erc20ToDenom(@PathVariable String contract) {
        String c = AddressUtil.requireEthAddress(contract, "contract");
        return single(stateManager.query(ctx -> queryService.erc20ToDenom(ctx, c)));
    }

    @GetMapping("/denom-to-erc20/{denom}")
    public ResponseEntity<AssetMapping> denomToErc20(@PathVariable String denom) {
        return single(stateManager.query(ctx -> queryService.denomToErc20(ctx, denom)));
    }

    private int parseLimit(String limit) {
        if (limit == null || limit.isBlank()) {
            return queryService.defaultLimit();
        }
        return (int) Math.min(Integer.MAX_VALUE, ParseUtil.parseNonce(limit, "limit"));
    }

    private static String optionalContract(String contract) {
        return contract == null || contract.isBlank() ? null : AddressUtil.requireEthAddress(contract, "contract");
    }

    private static <T> ResponseEntity<T> single(Optional<T> value) {
        return value.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
    }
}
