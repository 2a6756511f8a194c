package dao.cosmos.peggy;

import dao.cosmos.peggy.config.PeggyProperties;
import dao.cosmos.peggy.repository.BatchConfirmStore;
import dao.cosmos.peggy.repository.InMemoryKeyValueStore;
import dao.cosmos.peggy.repository.LogicCallConfirmStore;
import dao.cosmos.peggy.repository.StoreCodec;
import dao.cosmos.peggy.repository.StoreContext;
import dao.cosmos.peggy.repository.ValsetConfirmStore;
import dao.cosmos.peggy.service.AssetMappingService;
import dao.cosmos.peggy.service.BatchService;
import dao.cosmos.peggy.service.BridgeMsgService;
import dao.cosmos.peggy.service.EndBlocker;
import dao.cosmos.peggy.service.InMemoryStakingKeeper;
import dao.cosmos.peggy.service.LogicCallService;
import dao.cosmos.peggy.service.OutgoingPoolService;
import dao.cosmos.peggy.service.QueryService;
import dao.cosmos.peggy.service.StateManager;
import dao.cosmos.peggy.service.StoreBankKeeper;
import dao.cosmos.peggy.service.ValidatorRegistryService;
import dao.cosmos.peggy.service.ValsetService;

import java.math.BigInteger;

/**
 * Bridge services wired by hand over one in-memory store, the same graph
 * Spring builds at startup.
 */
public class BridgeFixture {

    public static final String TOKEN_CONTRACT = "0xAb5801a7D398351b8bE11C439e05C5B3259aeC9B";
    public static final String OTHER_CONTRACT = "0x429881672B9AE42b8EbA0E26cD9C73711b891Ca5";
    public static final String ETH_DEST = "0x320915BD0F1bad11cBf06e85D5199DBcAC4E9934";

    public static final String SENDER = "cosmos1ahx7f8wyertuus9r20284ej0asrs085case3kn";
    public static final String OTHER_SENDER = "cosmos1qyqszqgpqyqszqgpqyqszqgpqyqszqgpjnp7du";

    public static final String[] ORCHESTRATORS = {
            "cosmos1ees2tqhhhm9ahlhceh2zdguww9lqn2ckukn86l",
            "cosmos1u508cfnsk2nhakv80vdtq3nf558ngyvldkfjj9",
            "cosmos1krtcsrxhadj54px0vy6j33pjuzcd3jj8kmsazv",
            "cosmos1u94xef3cp9thkcpxecuvhtpwnmg8mhlja8hzkd",
            "cosmos1mgamdcs9dah0vn0gqupl05up7pedg2mvupe6hh",
    };

    public static final String[] VALIDATORS = {
            "cosmosvaloper1ees2tqhhhm9ahlhceh2zdguww9lqn2ckukn86l",
            "cosmosvaloper1u508cfnsk2nhakv80vdtq3nf558ngyvldkfjj9",
            "cosmosvaloper1krtcsrxhadj54px0vy6j33pjuzcd3jj8kmsazv",
            "cosmosvaloper1u94xef3cp9thkcpxecuvhtpwnmg8mhlja8hzkd",
            "cosmosvaloper1mgamdcs9dah0vn0gqupl05up7pedg2mvupe6hh",
            "cosmosvaloper1ahx7f8wyertuus9r20284ej0asrs085case3kn",
    };

    public static final String[] ETH_ADDRESSES = {
            "0x1111111111111111111111111111111111111111",
            "0x2222222222222222222222222222222222222222",
            "0x3333333333333333333333333333333333333333",
            "0x4444444444444444444444444444444444444444",
            "0x5555555555555555555555555555555555555555",
            "0x6666666666666666666666666666666666666666",
    };

    public final PeggyProperties props = new PeggyProperties();
    public final StoreCodec codec = new StoreCodec();
    public final InMemoryKeyValueStore store = new InMemoryKeyValueStore();

    public final InMemoryStakingKeeper staking = new InMemoryStakingKeeper();
    public final StoreBankKeeper bank = new StoreBankKeeper();
    public final ValidatorRegistryService registry = new ValidatorRegistryService();

    public final ValsetService valsetService = new ValsetService(staking, registry, codec);
    public final AssetMappingService assetMapping = new AssetMappingService(codec);
    public final OutgoingPoolService poolService = new OutgoingPoolService(bank, assetMapping, codec);

    public final ValsetConfirmStore valsetConfirms = new ValsetConfirmStore(codec);
    public final BatchConfirmStore batchConfirms = new BatchConfirmStore(codec);
    public final LogicCallConfirmStore logicCallConfirms = new LogicCallConfirmStore(codec);

    public final BatchService batchService = new BatchService(poolService, batchConfirms, codec);
    public final LogicCallService logicCallService = new LogicCallService(logicCallConfirms, codec);

    public final QueryService queryService = new QueryService(valsetService, batchService, logicCallService,
            poolService, assetMapping, valsetConfirms, batchConfirms, logicCallConfirms, props);
    public final BridgeMsgService msgService = new BridgeMsgService(staking, registry, valsetService,
            poolService, batchService, logicCallService, assetMapping,
            valsetConfirms, batchConfirms, logicCallConfirms, props);
    public final EndBlocker endBlocker = new EndBlocker(valsetService, batchService, poolService, props);
    public final StateManager stateManager = new StateManager(store, endBlocker);

    /** Context writing straight into the committed store. */
    public StoreContext ctx(long height) {
        return new StoreContext(store, height);
    }

    /** Bonds {@code count} validators with equal power and registers their Ethereum keys. */
    public void bondEqualValidators(StoreContext ctx, int count, long power) {
        for (int i = 0; i < count; i++) {
            staking.setValidatorPower(VALIDATORS[i], power);
            registry.setEthAddress(ctx, VALIDATORS[i], ETH_ADDRESSES[i]);
        }
    }

    public void fund(StoreContext ctx, String address, String contract, long amount) {
        bank.mint(ctx, address, assetMapping.voucherDenom(ctx, contract), BigInteger.valueOf(amount));
    }

    public BigInteger balance(StoreContext ctx, String address, String contract) {
        return bank.getBalance(ctx, address, assetMapping.voucherDenom(ctx, contract));
    }

    /** Number of entries in the committed store. */
    public int entryCount() {
        return store.iterate(new byte[0]).size();
    }
}
