package com.riskradar.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.riskradar.cache.FactKind;
import com.riskradar.domain.AddressReputation;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Address security indicators from GoPlus /address_security. An indicator is triggered when its value is "1".
 */
public class GoPlusReputationProvider extends HttpFactProvider<AddressReputation> {

    private final ProviderProperties.GoPlus settings;

    public GoPlusReputationProvider(ProviderProperties.GoPlus settings, WebClient.Builder webClientBuilder,
                                    RateLimiter rateLimiter, Duration timeout) {
        super(webClientBuilder, rateLimiter, timeout);
        this.settings = settings;
    }

    @Override
    public FactKind kind() {
        return FactKind.REPUTATION;
    }

    @Override
    public Optional<AddressReputation> lookup(String address) {
        if (!settings.isEnabled() || address == null || address.isBlank()) {
            return Optional.empty();
        }
        String normalized = address.strip().toLowerCase(Locale.ROOT);
        String url = settings.getBaseUrl() + "/address_security/" + normalized + "?chain_id=" + settings.getChainId();
        return parse(get(url), normalized);
    }

    static Optional<AddressReputation> parse(String json, String address) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (Exception e) {
            throw new ProviderException("Unparsable GoPlus response for " + address, e);
        }
        if (root.path("code").asInt(0) != 1) {
            throw new ProviderException("GoPlus error for " + address + ": " + root.path("message").asText(""));
        }
        JsonNode result = root.path("result");
        if (!result.isObject()) {
            return Optional.empty();
        }
        Set<String> triggered = new TreeSet<>();
        Iterator<Map.Entry<String, JsonNode>> fields = result.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if ("1".equals(field.getValue().asText())) {
                triggered.add(field.getKey().toLowerCase(Locale.ROOT));
            }
        }
        return Optional.of(new AddressReputation(address, triggered));
    }
}
