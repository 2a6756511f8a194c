package dao.cosmos.peggy.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "peggy")
public class PeggyProperties {

    private ValsetConfig valset = new ValsetConfig();
    private BatchConfig batch = new BatchConfig();
    private QueryConfig query = new QueryConfig();
    private LocalChainConfig localChain = new LocalChainConfig();

    @Data
    public static class ValsetConfig {
        /**
         * Request a new valset at end of block when bonded power moved by
         * more than this many basis points since the latest stored valset.
         * Default: 500 (5%)
         */
        private long powerChangeThresholdBps = 500;
    }

    @Data
    public static class BatchConfig {
        /**
         * Maximum number of transfers per batch
         * Default: 100
         */
        private int maxSize = 100;

        /**
         * Enable/disable automatic batch building at end of block
         * Default: true
         */
        private boolean autoBuildEnabled = true;

        /**
         * Build batches every N blocks
         * Default: 10
         */
        private long autoBuildIntervalBlocks = 10;
    }

    @Data
    public static class QueryConfig {
        /**
         * Default length of "last N" query results
         * Default: 5
         */
        private int defaultLimit = 5;

        /**
         * Upper bound on any requested "last N" length
         * Default: 100
         */
        private int maxLimit = 100;
    }

    @Data
    public static class LocalChainConfig {
        /**
         * Produce blocks locally instead of waiting for a host chain.
         * Default: false
         */
        private boolean enabled = false;

        /**
         * Local block interval in milliseconds
         * Default: 5000ms
         */
        private long blockIntervalMs = 5000;

        /**
         * Balances credited once at startup, only when the local chain is
         * enabled. There is no host bank to fund accounts otherwise.
         * Default: none
         */
        private List<GenesisBalance> genesisBalances = new ArrayList<>();
    }

    @Data
    public static class GenesisBalance {
        private String address;
        private String denom;
        private String amount;  // decimal
    }
}
