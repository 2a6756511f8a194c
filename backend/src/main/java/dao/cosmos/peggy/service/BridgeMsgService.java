package dao.cosmos.peggy.service;

import dao.cosmos.peggy.config.PeggyProperties;
import dao.cosmos.peggy.exception.InvalidRequestException;
import dao.cosmos.peggy.exception.PreconditionFailedException;
import dao.cosmos.peggy.model.AssetMapping;
import dao.cosmos.peggy.model.BatchConfirm;
import dao.cosmos.peggy.model.Erc20Token;
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
import dao.cosmos.peggy.model.TokenAmount;
import dao.cosmos.peggy.model.Valset;
import dao.cosmos.peggy.model.ValsetConfirm;
import dao.cosmos.peggy.repository.BatchConfirmStore;
import dao.cosmos.peggy.repository.LogicCallConfirmStore;
import dao.cosmos.peggy.repository.StoreContext;
import dao.cosmos.peggy.repository.ValsetConfirmStore;
import dao.cosmos.peggy.util.AddressUtil;
import dao.cosmos.peggy.util.HexUtil;
import dao.cosmos.peggy.util.ParseUtil;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Handlers for the bridge's transaction messages.
 *
 * Each handler checks input format first ({@link InvalidRequestException}),
 * then state preconditions ({@link PreconditionFailedException}), and only
 * then writes. Callers run a handler inside a store branch so that a failure
 * half way leaves no trace; see {@link StateManager#deliverTx}.
 */
@Service
public class BridgeMsgService {

    private static final Pattern DENOM = Pattern.compile("^[a-zA-Z][a-zA-Z0-9/:._-]{2,127}$");

    private final StakingKeeper stakingKeeper;
    private final ValidatorRegistryService registry;
    private final ValsetService valsetService;
    private final OutgoingPoolService poolService;
    private final BatchService batchService;
    private final LogicCallService logicCallService;
    private final AssetMappingService assetMapping;
    private final ValsetConfirmStore valsetConfirms;
    private final BatchConfirmStore batchConfirms;
    private final LogicCallConfirmStore logicCallConfirms;
    private final PeggyProperties props;

    public BridgeMsgService(StakingKeeper stakingKeeper,
                            ValidatorRegistryService registry,
                            ValsetService valsetService,
                            OutgoingPoolService poolService,
                            BatchService batchService,
                            LogicCallService logicCallService,
                            AssetMappingService assetMapping,
                            ValsetConfirmStore valsetConfirms,
                            BatchConfirmStore batchConfirms,
                            LogicCallConfirmStore logicCallConfirms,
                            PeggyProperties props) {
        this.stakingKeeper = stakingKeeper;
        this.registry = registry;
        this.valsetService = valsetService;
        this.poolService = poolService;
        this.batchService = batchService;
        this.logicCallService = logicCallService;
        this.assetMapping = assetMapping;
        this.valsetConfirms = valsetConfirms;
        this.batchConfirms = batchConfirms;
        this.logicCallConfirms = logicCallConfirms;
        this.props = props;
    }

    public void setEthAddress(StoreContext ctx, MsgSetEthAddress msg) {
        String validator = AddressUtil.requireCosmosAddress(msg.getValidator(), "validator");
        String ethAddress = AddressUtil.requireEthAddress(msg.getEthAddress(), "ethAddress");

        boolean bonded = stakingKeeper.getBondedValidators(ctx).stream()
                .anyMatch(vp -> vp.validator().equals(validator));
        if (!bonded) {
            throw new PreconditionFailedException("Not a bonded validator: " + validator);
        }
        registry.setEthAddress(ctx, validator, ethAddress);
    }

    public Valset requestValset(StoreContext ctx, MsgValsetRequest msg) {
        AddressUtil.requireCosmosAddress(msg.getRequester(), "requester");
        return valsetService.setValsetRequest(ctx);
    }

    public long sendToEth(StoreContext ctx, MsgSendToEth msg) {
        String sender = AddressUtil.requireCosmosAddress(msg.getSender(), "sender");
        String dest = AddressUtil.requireEthAddress(msg.getEthDest(), "ethDest");
        String contract = AddressUtil.requireEthAddress(msg.getTokenContract(), "tokenContract");
        BigInteger amount = ParseUtil.parseAmount(msg.getAmount(), "amount");
        BigInteger fee = ParseUtil.parseAmount(msg.getBridgeFee(), "bridgeFee");
        if (amount.signum() == 0) {
            throw new InvalidRequestException("amount must be positive");
        }

        return poolService.addToOutgoingPool(ctx, sender, dest,
                new Erc20Token(contract, amount), new Erc20Token(contract, fee));
    }

    public OutgoingTransferTx cancelSendToEth(StoreContext ctx, MsgCancelSendToEth msg) {
        String sender = AddressUtil.requireCosmosAddress(msg.getSender(), "sender");
        long id = ParseUtil.requireNonNegative(msg.getTransactionId(), "transactionId");
        return poolService.cancelSendToEth(ctx, id, sender);
    }

    public Optional<OutgoingTxBatch> requestBatch(StoreContext ctx, MsgRequestBatch msg) {
        AddressUtil.requireCosmosAddress(msg.getRequester(), "requester");
        String contract = AddressUtil.requireEthAddress(msg.getTokenContract(), "tokenContract");
        int maxSize = msg.getMaxSize() != null ? msg.getMaxSize() : props.getBatch().getMaxSize();
        return batchService.buildOutgoingTxBatch(ctx, contract, maxSize);
    }

    public ValsetConfirm confirmValset(StoreContext ctx, MsgValsetConfirm msg) {
        long nonce = ParseUtil.requireNonNegative(msg.getNonce(), "nonce");
        String orchestrator = AddressUtil.requireCosmosAddress(msg.getOrchestrator(), "orchestrator");
        String ethAddress = AddressUtil.requireEthAddress(msg.getEthAddress(), "ethAddress");
        ParseUtil.parseNonEmptyHex(msg.getSignature(), "signature");

        if (valsetService.getValset(ctx, nonce).isEmpty()) {
            throw new PreconditionFailedException("Couldn't find valset " + nonce);
        }

        ValsetConfirm confirm = new ValsetConfirm(nonce, orchestrator, ethAddress, msg.getSignature());
        valsetConfirms.setConfirm(ctx, confirm);
        return confirm;
    }

    public BatchConfirm confirmBatch(StoreContext ctx, MsgConfirmBatch msg) {
        long nonce = ParseUtil.requireNonNegative(msg.getNonce(), "nonce");
        String contract = AddressUtil.requireEthAddress(msg.getTokenContract(), "tokenContract");
        String ethSigner = AddressUtil.requireEthAddress(msg.getEthSigner(), "ethSigner");
        String orchestrator = AddressUtil.requireCosmosAddress(msg.getOrchestrator(), "orchestrator");
        ParseUtil.parseNonEmptyHex(msg.getSignature(), "signature");

        if (batchService.getOutgoingTxBatch(ctx, nonce, contract).isEmpty()) {
            throw new PreconditionFailedException("Couldn't find batch " + nonce + " for " + contract);
        }

        BatchConfirm confirm = new BatchConfirm(nonce, contract, ethSigner, orchestrator, msg.getSignature());
        batchConfirms.setConfirm(ctx, confirm);
        return confirm;
    }

    public LogicCallConfirm confirmLogicCall(StoreContext ctx, MsgConfirmLogicCall msg) {
        byte[] invalidationId = ParseUtil.parseInvalidationId(msg.getInvalidationId(), "invalidationId");
        long invalidationNonce = ParseUtil.requireNonNegative(msg.getInvalidationNonce(), "invalidationNonce");
        String ethSigner = AddressUtil.requireEthAddress(msg.getEthSigner(), "ethSigner");
        String orchestrator = AddressUtil.requireCosmosAddress(msg.getOrchestrator(), "orchestrator");
        ParseUtil.parseNonEmptyHex(msg.getSignature(), "signature");

        if (logicCallService.getOutgoingLogicCall(ctx, invalidationId, invalidationNonce).isEmpty()) {
            throw new PreconditionFailedException("Couldn't find logic call "
                    + HexUtil.toHex0x(invalidationId) + "/" + invalidationNonce);
        }

        LogicCallConfirm confirm = new LogicCallConfirm(invalidationId, invalidationNonce,
                ethSigner, orchestrator, msg.getSignature());
        logicCallConfirms.setConfirm(ctx, confirm);
        return confirm;
    }

    /**
     * Accepts a logic call only if its invalidation nonce is above every nonce
     * accepted so far for the same invalidation id.
     */
    public OutgoingLogicCall submitLogicCall(StoreContext ctx, MsgSubmitLogicCall msg) {
        String logicContract = AddressUtil.requireEthAddress(msg.getLogicContractAddress(), "logicContractAddress");
        byte[] payload = ParseUtil.parseHex(msg.getPayload() == null ? "" : msg.getPayload(), "payload");
        long timeout = ParseUtil.requireNonNegative(msg.getTimeout(), "timeout");
        byte[] invalidationId = ParseUtil.parseInvalidationId(msg.getInvalidationId(), "invalidationId");
        long invalidationNonce = ParseUtil.requireNonNegative(msg.getInvalidationNonce(), "invalidationNonce");
        List<Erc20Token> transfers = toTokens(msg.getTransfers(), "transfers");
        List<Erc20Token> fees = toTokens(msg.getFees(), "fees");

        long last = logicCallService.getLastInvalidationNonce(ctx, invalidationId);
        if (invalidationNonce <= last) {
            throw new PreconditionFailedException("Invalidation nonce " + invalidationNonce
                    + " must be greater than " + last + " for " + HexUtil.toHex0x(invalidationId));
        }

        OutgoingLogicCall call = new OutgoingLogicCall(transfers, fees, logicContract, payload,
                timeout, invalidationId, invalidationNonce);
        logicCallService.setOutgoingLogicCall(ctx, call);
        logicCallService.setLastInvalidationNonce(ctx, invalidationId, invalidationNonce);
        return call;
    }

    public AssetMapping setAssetMapping(StoreContext ctx, MsgSetAssetMapping msg) {
        if (msg.getDenom() == null || !DENOM.matcher(msg.getDenom()).matches()) {
            throw new InvalidRequestException("Invalid denom: " + msg.getDenom());
        }
        String erc20 = AddressUtil.requireEthAddress(msg.getErc20(), "erc20");
        return assetMapping.setMapping(ctx, msg.getDenom(), erc20, msg.isCosmosOriginated());
    }

    public OutgoingTxBatch batchExecuted(StoreContext ctx, MsgBatchExecuted msg) {
        String contract = AddressUtil.requireEthAddress(msg.getTokenContract(), "tokenContract");
        long nonce = ParseUtil.requireNonNegative(msg.getBatchNonce(), "batchNonce");
        return batchService.outgoingTxBatchExecuted(ctx, contract, nonce);
    }

    public OutgoingLogicCall logicCallExecuted(StoreContext ctx, MsgLogicCallExecuted msg) {
        byte[] invalidationId = ParseUtil.parseInvalidationId(msg.getInvalidationId(), "invalidationId");
        long invalidationNonce = ParseUtil.requireNonNegative(msg.getInvalidationNonce(), "invalidationNonce");
        return logicCallService.outgoingLogicCallExecuted(ctx, invalidationId, invalidationNonce);
    }

    private static List<Erc20Token> toTokens(List<TokenAmount> amounts, String field) {
        List<Erc20Token> res = new ArrayList<>();
        if (amounts == null) return res;
        for (TokenAmount t : amounts) {
            if (t == null) {
                throw new InvalidRequestException(field + " contains a null entry");
            }
            res.add(new Erc20Token(
                    AddressUtil.requireEthAddress(t.getContract(), field + ".contract"),
                    ParseUtil.parseAmount(t.getAmount(), field + ".amount")));
        }
        return res;
    }
}
