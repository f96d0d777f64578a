package dao.metatx.relay.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "vault")
@Data
public class VaultProperties {

    private String address;

    private String owner;

    /**
     * Oldest price reading accepted for deposits and withdrawals.
     * Default: 3600 seconds
     */
    private long maxStalenessSeconds = 3600;

    /**
     * How often devnet feeds re-publish their price so it never goes stale.
     * Default: 60000 ms
     */
    private long feedRefreshIntervalMs = 60000;

    /**
     * Assets deployed and whitelisted on startup.
     */
    private List<AssetConfig> assets = new ArrayList<>();

    @Data
    public static class AssetConfig {
        private String address;
        private String symbol;
        private int decimals = 18;
        /**
         * Stablecoin-style asset: 1 unit buys 1 credit, no feed consulted.
         */
        private boolean fixedUnit;
        /**
         * Feed address; required unless fixedUnit.
         */
        private String feedAddress;
        private BigInteger feedPrice;
        private int feedDecimals = 8;
        /**
         * Token balances minted at startup, keyed by holder address.
         */
        private Map<String, BigInteger> mint = new LinkedHashMap<>();
    }
}
