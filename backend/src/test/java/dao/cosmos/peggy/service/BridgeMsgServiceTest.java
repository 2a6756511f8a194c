package dao.cosmos.peggy.service;

import dao.cosmos.peggy.BridgeFixture;
import dao.cosmos.peggy.exception.InsufficientFundsException;
import dao.cosmos.peggy.exception.InvalidRequestException;
import dao.cosmos.peggy.exception.PreconditionFailedException;
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
import dao.cosmos.peggy.model.OutgoingTxBatch;
import dao.cosmos.peggy.model.TokenAmount;
import dao.cosmos.peggy.model.Valset;
import dao.cosmos.peggy.repository.StoreContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static dao.cosmos.peggy.BridgeFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class BridgeMsgServiceTest {

    private BridgeFixture f;
    private StoreContext ctx;

    @BeforeEach
    void setUp() {
        f = new BridgeFixture();
        ctx = f.ctx(50L);
        f.staking.setValidatorPower(VALIDATORS[0], 100L);
    }

    @Test
    @DisplayName("Test bonded validator can register an Ethereum address")
    void setEthAddress() {
        f.msgService.setEthAddress(ctx, setEthAddress(VALIDATORS[0], ETH_ADDRESSES[0]));

        assertEquals(ETH_ADDRESSES[0], f.registry.getEthAddress(ctx, VALIDATORS[0]).orElseThrow());
    }

    @Test
    @DisplayName("Test unbonded validator and malformed addresses are rejected")
    void setEthAddressRejected() {
        assertThrows(PreconditionFailedException.class,
                () -> f.msgService.setEthAddress(ctx, setEthAddress(VALIDATORS[1], ETH_ADDRESSES[1])));
        assertThrows(InvalidRequestException.class,
                () -> f.msgService.setEthAddress(ctx, setEthAddress(VALIDATORS[0], "0x1234")));
        assertThrows(InvalidRequestException.class,
                () -> f.msgService.setEthAddress(ctx, setEthAddress("not a valid addr", ETH_ADDRESSES[0])));
    }

    @Test
    @DisplayName("Test valset request stores a snapshot of registered validators")
    void requestValset() {
        f.msgService.setEthAddress(ctx, setEthAddress(VALIDATORS[0], ETH_ADDRESSES[0]));
        MsgValsetRequest msg = new MsgValsetRequest();
        msg.setRequester(SENDER);

        Valset valset = f.msgService.requestValset(ctx, msg);

        assertEquals(1L, valset.nonce());
        assertEquals(50L, valset.height());
        assertEquals(Valset.MAX_POWER, valset.members().get(0).power());
    }

    @Test
    @DisplayName("Test send to eth validates amounts and escrows funds")
    void sendToEth() {
        f.fund(ctx, SENDER, TOKEN_CONTRACT, 100L);

        long id = f.msgService.sendToEth(ctx, sendToEth("90", "10"));

        assertEquals(1L, id);
        assertEquals(BigInteger.ZERO, f.balance(ctx, SENDER, TOKEN_CONTRACT));
        assertThrows(InsufficientFundsException.class, () -> f.msgService.sendToEth(ctx, sendToEth("1", "0")));
        assertThrows(InvalidRequestException.class, () -> f.msgService.sendToEth(ctx, sendToEth("0", "1")));
        assertThrows(InvalidRequestException.class, () -> f.msgService.sendToEth(ctx, sendToEth("-5", "1")));
        assertThrows(InvalidRequestException.class, () -> f.msgService.sendToEth(ctx, sendToEth("abc", "1")));
    }

    @Test
    @DisplayName("Test cancel send to eth refunds the pooled transfer")
    void cancelSendToEth() {
        f.fund(ctx, SENDER, TOKEN_CONTRACT, 100L);
        long id = f.msgService.sendToEth(ctx, sendToEth("90", "10"));
        MsgCancelSendToEth msg = new MsgCancelSendToEth();
        msg.setSender(SENDER);
        msg.setTransactionId(id);

        f.msgService.cancelSendToEth(ctx, msg);

        assertEquals(BigInteger.valueOf(100), f.balance(ctx, SENDER, TOKEN_CONTRACT));
        assertThrows(PreconditionFailedException.class, () -> f.msgService.cancelSendToEth(ctx, msg));
    }

    @Test
    @DisplayName("Test request batch falls back to the configured max size")
    void requestBatch() {
        f.props.getBatch().setMaxSize(1);
        f.fund(ctx, SENDER, TOKEN_CONTRACT, 100L);
        f.msgService.sendToEth(ctx, sendToEth("10", "1"));
        f.msgService.sendToEth(ctx, sendToEth("10", "2"));

        OutgoingTxBatch batch = f.msgService.requestBatch(ctx, requestBatch(null)).orElseThrow();

        assertEquals(1, batch.transactions().size());
        assertEquals(2L, batch.transactions().get(0).id());
        assertEquals(1, f.msgService.requestBatch(ctx, requestBatch(5)).orElseThrow().transactions().size());
        assertTrue(f.msgService.requestBatch(ctx, requestBatch(5)).isEmpty());
    }

    @Test
    @DisplayName("Test valset confirm requires an existing valset and hex signature")
    void confirmValset() {
        assertThrows(PreconditionFailedException.class, () -> f.msgService.confirmValset(ctx, valsetConfirm(1L, "0xaa")));

        f.valsetService.setValsetRequest(ctx);
        assertThrows(InvalidRequestException.class, () -> f.msgService.confirmValset(ctx, valsetConfirm(1L, "zz")));
        assertThrows(InvalidRequestException.class, () -> f.msgService.confirmValset(ctx, valsetConfirm(1L, "0x")));

        f.msgService.confirmValset(ctx, valsetConfirm(1L, "0xaa"));
        f.msgService.confirmValset(ctx, valsetConfirm(1L, "0xbb"));

        assertEquals("0xbb", f.valsetConfirms.getConfirms(ctx, 1L).get(0).signature());
        assertEquals(1, f.valsetConfirms.getConfirms(ctx, 1L).size());
    }

    @Test
    @DisplayName("Test batch confirm requires an existing batch")
    void confirmBatch() {
        MsgConfirmBatch msg = new MsgConfirmBatch();
        msg.setNonce(1L);
        msg.setTokenContract(TOKEN_CONTRACT);
        msg.setEthSigner(ETH_ADDRESSES[0]);
        msg.setOrchestrator(ORCHESTRATORS[0]);
        msg.setSignature("0xdeadbeef");

        assertThrows(PreconditionFailedException.class, () -> f.msgService.confirmBatch(ctx, msg));

        f.fund(ctx, SENDER, TOKEN_CONTRACT, 100L);
        f.msgService.sendToEth(ctx, sendToEth("10", "1"));
        f.msgService.requestBatch(ctx, requestBatch(5));
        f.msgService.confirmBatch(ctx, msg);

        assertTrue(f.queryService.lastPendingBatchRequest(ctx, ORCHESTRATORS[0], null).isEmpty());
    }

    @Test
    @DisplayName("Test logic call submission enforces increasing invalidation nonces")
    void submitLogicCall() {
        OutgoingLogicCall call = f.msgService.submitLogicCall(ctx, submitLogicCall(5L));

        assertArrayEquals(new byte[]{(byte) 0xab, (byte) 0xcd}, call.payload());
        assertEquals(5L, f.logicCallService.getLastInvalidationNonce(ctx, new byte[]{0x01}));
        assertThrows(PreconditionFailedException.class, () -> f.msgService.submitLogicCall(ctx, submitLogicCall(5L)));
        assertThrows(PreconditionFailedException.class, () -> f.msgService.submitLogicCall(ctx, submitLogicCall(4L)));

        f.msgService.submitLogicCall(ctx, submitLogicCall(6L));
        assertEquals(2, f.logicCallService.getOutgoingLogicCallsNewestFirst(ctx).size());
    }

    @Test
    @DisplayName("Test invalidation ids longer than 255 bytes are an input error")
    void oversizedInvalidationId() {
        MsgSubmitLogicCall submit = submitLogicCall(1L);
        submit.setInvalidationId("0x" + "ab".repeat(256));
        assertThrows(InvalidRequestException.class, () -> f.msgService.submitLogicCall(ctx, submit));

        MsgConfirmLogicCall confirm = new MsgConfirmLogicCall();
        confirm.setInvalidationId("0x" + "ab".repeat(256));
        confirm.setInvalidationNonce(1L);
        confirm.setEthSigner(ETH_ADDRESSES[0]);
        confirm.setOrchestrator(ORCHESTRATORS[0]);
        confirm.setSignature("0xaa");
        assertThrows(InvalidRequestException.class, () -> f.msgService.confirmLogicCall(ctx, confirm));

        submit.setInvalidationId("0x" + "ab".repeat(255));
        assertEquals(255, f.msgService.submitLogicCall(ctx, submit).invalidationId().length);
    }

    @Test
    @DisplayName("Test logic call executed removes the call, lower nonces and their confirmations")
    void logicCallExecuted() {
        f.msgService.submitLogicCall(ctx, submitLogicCall(5L));
        f.msgService.submitLogicCall(ctx, submitLogicCall(6L));
        MsgConfirmLogicCall confirm = new MsgConfirmLogicCall();
        confirm.setInvalidationId("0x01");
        confirm.setInvalidationNonce(6L);
        confirm.setEthSigner(ETH_ADDRESSES[0]);
        confirm.setOrchestrator(ORCHESTRATORS[0]);
        confirm.setSignature("0xaa");
        f.msgService.confirmLogicCall(ctx, confirm);

        MsgLogicCallExecuted msg = new MsgLogicCallExecuted();
        msg.setInvalidationId("0x01");
        msg.setInvalidationNonce(6L);
        OutgoingLogicCall executed = f.msgService.logicCallExecuted(ctx, msg);

        assertEquals(6L, executed.invalidationNonce());
        assertTrue(f.logicCallService.getOutgoingLogicCallsNewestFirst(ctx).isEmpty());
        assertTrue(f.queryService.allLogicCallConfirms(ctx, new byte[]{0x01}, 6L).isEmpty());
        assertEquals(6L, f.logicCallService.getLastInvalidationNonce(ctx, new byte[]{0x01}));
        assertThrows(PreconditionFailedException.class, () -> f.msgService.logicCallExecuted(ctx, msg));
    }

    @Test
    @DisplayName("Test logic call confirm requires an existing logic call")
    void confirmLogicCall() {
        MsgConfirmLogicCall msg = new MsgConfirmLogicCall();
        msg.setInvalidationId("0x01");
        msg.setInvalidationNonce(5L);
        msg.setEthSigner(ETH_ADDRESSES[0]);
        msg.setOrchestrator(ORCHESTRATORS[0]);
        msg.setSignature("0xaa");

        assertThrows(PreconditionFailedException.class, () -> f.msgService.confirmLogicCall(ctx, msg));

        f.msgService.submitLogicCall(ctx, submitLogicCall(5L));
        f.msgService.confirmLogicCall(ctx, msg);

        assertEquals(1, f.queryService.allLogicCallConfirms(ctx, new byte[]{0x01}, 5L).size());
    }

    @Test
    @DisplayName("Test asset mapping rejects malformed denoms")
    void setAssetMapping() {
        MsgSetAssetMapping msg = new MsgSetAssetMapping();
        msg.setDenom("uatom");
        msg.setErc20(TOKEN_CONTRACT);
        msg.setCosmosOriginated(true);

        f.msgService.setAssetMapping(ctx, msg);
        assertEquals("uatom", f.assetMapping.getMappingByErc20(ctx, TOKEN_CONTRACT).orElseThrow().denom());

        msg.setDenom("1bad");
        assertThrows(InvalidRequestException.class, () -> f.msgService.setAssetMapping(ctx, msg));
    }

    @Test
    @DisplayName("Test batch executed removes the batch")
    void batchExecuted() {
        f.fund(ctx, SENDER, TOKEN_CONTRACT, 100L);
        f.msgService.sendToEth(ctx, sendToEth("10", "1"));
        f.msgService.requestBatch(ctx, requestBatch(5));
        MsgBatchExecuted msg = new MsgBatchExecuted();
        msg.setTokenContract(TOKEN_CONTRACT);
        msg.setBatchNonce(1L);

        f.msgService.batchExecuted(ctx, msg);

        assertTrue(f.batchService.getOutgoingTxBatch(ctx, 1L, TOKEN_CONTRACT).isEmpty());
        assertThrows(PreconditionFailedException.class, () -> f.msgService.batchExecuted(ctx, msg));
    }

    private static MsgSetEthAddress setEthAddress(String validator, String ethAddress) {
        MsgSetEthAddress msg = new MsgSetEthAddress();
        msg.setValidator(validator);
        msg.setEthAddress(ethAddress);
        return msg;
    }

    private static MsgSendToEth sendToEth(String amount, String fee) {
        MsgSendToEth msg = new MsgSendToEth();
        msg.setSender(SENDER);
        msg.setEthDest(ETH_DEST);
        msg.setTokenContract(TOKEN_CONTRACT);
        msg.setAmount(amount);
        msg.setBridgeFee(fee);
        return msg;
    }

    private static MsgRequestBatch requestBatch(Integer maxSize) {
        MsgRequestBatch msg = new MsgRequestBatch();
        msg.setRequester(SENDER);
        msg.setTokenContract(TOKEN_CONTRACT);
        msg.setMaxSize(maxSize);
        return msg;
    }

    private static MsgValsetConfirm valsetConfirm(long nonce, String signature) {
        MsgValsetConfirm msg = new MsgValsetConfirm();
        msg.setNonce(nonce);
        msg.setOrchestrator(ORCHESTRATORS[0]);
        msg.setEthAddress(ETH_ADDRESSES[0]);
        msg.setSignature(signature);
        return msg;
    }

    private static MsgSubmitLogicCall submitLogicCall(long invalidationNonce) {
        MsgSubmitLogicCall msg = new MsgSubmitLogicCall();
        msg.setTransfers(List.of(new TokenAmount(TOKEN_CONTRACT, "100")));
        msg.setFees(List.of(new TokenAmount(TOKEN_CONTRACT, "1")));
        msg.setLogicContractAddress(ETH_DEST);
        msg.setPayload("0xabcd");
        msg.setTimeout(10_000L);
        msg.setInvalidationId("0x01");
        msg.setInvalidationNonce(invalidationNonce);
        return msg;
    }
}
