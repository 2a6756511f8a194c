package dao.cosmos.peggy.service;

import dao.cosmos.peggy.config.PeggyProperties;
import dao.cosmos.peggy.model.Valset;
import dao.cosmos.peggy.repository.StoreContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * End-of-block policy: snapshot the validator set when bonded power has
 * drifted, and periodically batch whatever is waiting in the pool.
 */
@Slf4j
@Component
public class EndBlocker {

    private final ValsetService valsetService;
    private final BatchService batchService;
    private final OutgoingPoolService poolService;
    private final PeggyProperties props;

    public EndBlocker(ValsetService valsetService,
                      BatchService batchService,
                      OutgoingPoolService poolService,
                      PeggyProperties props) {
        this.valsetService = valsetService;
        this.batchService = batchService;
        this.poolService = poolService;
        this.props = props;
    }

    public void endBlock(StoreContext ctx) {
        maybeRequestValset(ctx);
        maybeBuildBatches(ctx);
    }

    void maybeRequestValset(StoreContext ctx) {
        Valset current = valsetService.getCurrentValset(ctx);
        Optional<Valset> latest = valsetService.getLatestValset(ctx);

        if (latest.isEmpty()) {
            if (!current.members().isEmpty()) {
                log.info("No valset stored yet, requesting one at height {}", ctx.blockHeight());
                valsetService.setValsetRequest(ctx);
            }
            return;
        }

        long diffBps = current.powerDiffBps(latest.get());
        if (diffBps > props.getValset().getPowerChangeThresholdBps()) {
            log.info("Bridge power changed by {} bps since valset {}, requesting new valset",
                    diffBps, latest.get().nonce());
            valsetService.setValsetRequest(ctx);
        }
    }

    void maybeBuildBatches(StoreContext ctx) {
        PeggyProperties.BatchConfig cfg = props.getBatch();
        if (!cfg.isAutoBuildEnabled() || cfg.getAutoBuildIntervalBlocks() <= 0) {
            return;
        }
        if (ctx.blockHeight() % cfg.getAutoBuildIntervalBlocks() != 0) {
            return;
        }
        for (String contract : poolService.getPendingTokenContracts(ctx)) {
            batchService.buildOutgoingTxBatch(ctx, contract, cfg.getMaxSize());
        }
    }
}
