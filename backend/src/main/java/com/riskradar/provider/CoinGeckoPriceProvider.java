package com.riskradar.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.riskradar.cache.FactKind;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * USD token price from CoinGecko. Contracts with a configured coin id (WETH -> ethereum) use /simple/price;
 * everything else goes through /simple/token_price/{platform}.
 */
@Slf4j
public class CoinGeckoPriceProvider extends HttpFactProvider<BigDecimal> {

    private static final int SCALE = 18;

    private final ProviderProperties.CoinGecko settings;

    public CoinGeckoPriceProvider(ProviderProperties.CoinGecko settings, WebClient.Builder webClientBuilder,
                                  RateLimiter rateLimiter, Duration timeout) {
        super(webClientBuilder, rateLimiter, timeout);
        this.settings = settings;
    }

    @Override
    public FactKind kind() {
        return FactKind.PRICE;
    }

    @Override
    public Optional<BigDecimal> lookup(String contractAddress) {
        if (!settings.isEnabled() || contractAddress == null || contractAddress.isBlank()) {
            return Optional.empty();
        }
        String contract = contractAddress.strip().toLowerCase(Locale.ROOT);
        String coinId = settings.getContractToCoinId().get(contract);
        if (coinId != null && !coinId.isBlank()) {
            String url = settings.getBaseUrl() + "/simple/price?ids=" + coinId + "&vs_currencies=usd";
            return parseUsdPrice(get(url), coinId);
        }
        String url = settings.getBaseUrl() + "/simple/token_price/" + settings.getPlatform()
                + "?contract_addresses=" + contract + "&vs_currencies=usd";
        Optional<BigDecimal> price = parseUsdPrice(get(url), contract);
        if (price.isEmpty()) {
            log.debug("No CoinGecko price for contract {}", contract);
        }
        return price;
    }

    static Optional<BigDecimal> parseUsdPrice(String json, String key) {
        try {
            JsonNode usd = MAPPER.readTree(json).path(key).path("usd");
            if (usd.isMissingNode() || !usd.isNumber()) {
                return Optional.empty();
            }
            return Optional.of(usd.decimalValue().setScale(SCALE, RoundingMode.HALF_UP));
        } catch (Exception e) {
            throw new ProviderException("Unparsable CoinGecko response for " + key, e);
        }
    }
}
