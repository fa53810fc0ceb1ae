package com.riskradar.provider;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * External fact sources. Documented in application.yml under riskradar.providers.
 */
@ConfigurationProperties(prefix = "riskradar.providers")
@Getter
@Setter
public class ProviderProperties {

    /**
     * Per-call timeout in seconds for provider HTTP requests.
     */
    private int timeoutSeconds = 10;

    /**
     * How long a call may wait for a local rate limiter permit before failing, in milliseconds.
     */
    private long limiterTimeoutMs = 2_000;

    private CoinGecko coingecko = new CoinGecko();
    private Etherscan etherscan = new Etherscan();
    private GoPlus goplus = new GoPlus();

    @Getter
    @Setter
    public static class CoinGecko {
        private boolean enabled = true;
        /** CoinGecko API base URL (free: https://api.coingecko.com/api/v3). */
        private String baseUrl = "https://api.coingecko.com/api/v3";
        /** Asset platform for /simple/token_price. */
        private String platform = "ethereum";
        private int requestsPerSecond = 1;
        /**
         * Token contract (lowercase) -> CoinGecko coin id, priced through /simple/price instead of token_price.
         */
        private Map<String, String> contractToCoinId = new HashMap<>(Map.of(
                "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2", "ethereum"));
    }

    @Getter
    @Setter
    public static class Etherscan {
        private boolean enabled = true;
        private String baseUrl = "https://api.etherscan.io/api";
        private String apiKey = "";
        private int requestsPerSecond = 5;
        /** Most recent transactions fetched per address. */
        private int transactionLimit = 100;
    }

    @Getter
    @Setter
    public static class GoPlus {
        private boolean enabled = true;
        private String baseUrl = "https://api.gopluslabs.io/api/v1";
        private String chainId = "1";
        private int requestsPerSecond = 2;
    }
}
