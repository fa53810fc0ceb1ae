package com.riskradar.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.riskradar.cache.FactKind;
import com.riskradar.domain.AddressHistory;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Activity summary from the Etherscan txlist endpoint over the most recent transactions of an address.
 * "No transactions found" is a valid, empty history; other non-OK statuses are failures.
 */
public class EtherscanHistoryProvider extends HttpFactProvider<AddressHistory> {

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final ProviderProperties.Etherscan settings;

    public EtherscanHistoryProvider(ProviderProperties.Etherscan settings, WebClient.Builder webClientBuilder,
                                    RateLimiter rateLimiter, Duration timeout) {
        super(webClientBuilder, rateLimiter, timeout);
        this.settings = settings;
    }

    @Override
    public FactKind kind() {
        return FactKind.HISTORY;
    }

    @Override
    public Optional<AddressHistory> lookup(String address) {
        if (!settings.isEnabled() || address == null || address.isBlank()) {
            return Optional.empty();
        }
        String url = settings.getBaseUrl()
                + "?module=account&action=txlist&address=" + address.strip().toLowerCase(Locale.ROOT)
                + "&startblock=0&endblock=99999999&page=1&offset=" + settings.getTransactionLimit()
                + "&sort=desc&apikey=" + settings.getApiKey();
        return Optional.of(parse(get(url)));
    }

    static AddressHistory parse(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (Exception e) {
            throw new ProviderException("Unparsable Etherscan response", e);
        }
        String status = root.path("status").asText("");
        String message = root.path("message").asText("");
        if (!"1".equals(status)) {
            if (message.toLowerCase(Locale.ROOT).startsWith("no transactions found")) {
                return AddressHistory.empty();
            }
            throw new ProviderException("Etherscan status " + status + ": " + message);
        }
        JsonNode txs = root.path("result");
        if (!txs.isArray() || txs.isEmpty()) {
            return AddressHistory.empty();
        }
        BigInteger total = BigInteger.ZERO;
        Set<String> contracts = new HashSet<>();
        long first = Long.MAX_VALUE;
        long last = Long.MIN_VALUE;
        int count = 0;
        for (JsonNode tx : txs) {
            count++;
            total = total.add(parseWei(tx.path("value").asText("0")));
            String to = tx.path("to").asText("");
            if (!to.isBlank()) {
                contracts.add(to.toLowerCase(Locale.ROOT));
            }
            long ts = tx.path("timeStamp").asLong(0);
            if (ts > 0) {
                first = Math.min(first, ts);
                last = Math.max(last, ts);
            }
        }
        Instant firstSeen = first == Long.MAX_VALUE ? null : Instant.ofEpochSecond(first);
        Instant lastSeen = last == Long.MIN_VALUE ? null : Instant.ofEpochSecond(last);
        double spanDays = firstSeen == null ? 1.0 : Math.max(1.0, (last - first) / SECONDS_PER_DAY);
        BigInteger average = total.divide(BigInteger.valueOf(count));
        return new AddressHistory(count, average, total, contracts, firstSeen, lastSeen, count / spanDays);
    }

    private static BigInteger parseWei(String value) {
        try {
            return new BigInteger(value.strip());
        } catch (NumberFormatException e) {
            return BigInteger.ZERO;
        }
    }
}
