package com.riskradar.provider;

import com.riskradar.domain.AddressHistory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EtherscanHistoryProviderTest {

    private static final String TXLIST = """
            {"status": "1", "message": "OK", "result": [
              {"value": "3000000000000000000", "to": "0xDAC17F958D2ee523a2206206994597C13D831ec7", "timeStamp": "1700172800"},
              {"value": "1000000000000000000", "to": "0x2222222222222222222222222222222222222222", "timeStamp": "1700000000"},
              {"value": "2000000000000000000", "to": "", "timeStamp": "1700086400"}
            ]}
            """;

    @Test
    @DisplayName("txlist is summarized into count, totals, contracts and frequency")
    void summarizesTransactions() {
        AddressHistory history = EtherscanHistoryProvider.parse(TXLIST);

        assertThat(history.transactionCount()).isEqualTo(3);
        assertThat(history.totalValue()).isEqualTo(new BigInteger("6000000000000000000"));
        assertThat(history.averageValue()).isEqualTo(new BigInteger("2000000000000000000"));
        assertThat(history.seenContracts()).containsExactlyInAnyOrder(
                "0xdac17f958d2ee523a2206206994597c13d831ec7", "0x2222222222222222222222222222222222222222");
        assertThat(history.firstSeen()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(history.lastSeen()).isEqualTo(Instant.ofEpochSecond(1_700_172_800L));
        // two days between first and last
        assertThat(history.frequencyPerDay()).isCloseTo(1.5, within(1e-9));
    }

    @Test
    @DisplayName("no transactions is an empty history; other errors fail")
    void emptyAndErrors() {
        assertThat(EtherscanHistoryProvider.parse("{\"status\": \"0\", \"message\": \"No transactions found\", \"result\": []}")
                .isEmpty()).isTrue();
        assertThatThrownBy(() -> EtherscanHistoryProvider.parse("{\"status\": \"0\", \"message\": \"NOTOK\", \"result\": \"Invalid API Key\"}"))
                .isInstanceOf(ProviderException.class);
    }

    @Test
    @DisplayName("lookup requests the newest transactions up to the configured limit")
    void lookupBuildsUrl() {
        ProviderProperties properties = new ProviderProperties();
        properties.getEtherscan().setApiKey("key");
        List<URI> requested = StubWebClients.recorder();
        EtherscanHistoryProvider provider = new EtherscanHistoryProvider(properties.getEtherscan(),
                StubWebClients.answering(HttpStatus.OK, TXLIST, requested),
                ProviderConfig.rateLimiter("etherscan-test", 100, properties), Duration.ofSeconds(2));

        assertThat(provider.lookup("0x1111111111111111111111111111111111111111")).isPresent();
        assertThat(requested).singleElement().asString()
                .contains("action=txlist")
                .contains("offset=100")
                .contains("sort=desc")
                .contains("apikey=key");
    }
}
