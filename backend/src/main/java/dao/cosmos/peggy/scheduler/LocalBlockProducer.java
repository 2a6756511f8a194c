package dao.cosmos.peggy.scheduler;

import dao.cosmos.peggy.config.PeggyProperties;
import dao.cosmos.peggy.service.StateManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives block boundaries when no host chain is attached: ends the current
 * block, then opens the next one.
 */
@Slf4j
@Component
public class LocalBlockProducer {

    private final StateManager stateManager;
    private final PeggyProperties props;

    public LocalBlockProducer(StateManager stateManager, PeggyProperties props) {
        this.stateManager = stateManager;
        this.props = props;
    }

    @Scheduled(fixedDelayString = "${peggy.local-chain.block-interval-ms:5000}")
    public void produceBlock() {
        if (!props.getLocalChain().isEnabled()) {
            return;
        }
        try {
            stateManager.endBlock();
        } catch (RuntimeException e) {
            log.error("End block failed at height {}", stateManager.currentHeight(), e);
        }
        long next = stateManager.currentHeight() + 1;
        stateManager.beginBlock(next);
        log.debug("Began block {}", next);
    }
}
