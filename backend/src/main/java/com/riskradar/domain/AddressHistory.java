package com.riskradar.domain;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Summary of an address's recent on-chain activity. Values are in wei.
 *
 * @param seenContracts lowercase counterparties the address has sent transactions to
 * @param firstSeen     null when the address has no transactions
 */
public record AddressHistory(
        int transactionCount,
        BigInteger averageValue,
        BigInteger totalValue,
        Set<String> seenContracts,
        Instant firstSeen,
        Instant lastSeen,
        double frequencyPerDay
) {

    public AddressHistory {
        averageValue = averageValue != null ? averageValue : BigInteger.ZERO;
        totalValue = totalValue != null ? totalValue : BigInteger.ZERO;
        seenContracts = seenContracts == null ? Set.of() : Set.copyOf(seenContracts);
    }

    public static AddressHistory empty() {
        return new AddressHistory(0, BigInteger.ZERO, BigInteger.ZERO, Set.of(), null, null, 0.0);
    }

    public boolean isEmpty() {
        return transactionCount == 0;
    }

    public Optional<Duration> accountAge(Instant now) {
        if (firstSeen == null) {
            return Optional.empty();
        }
        Duration age = Duration.between(firstSeen, now);
        return Optional.of(age.isNegative() ? Duration.ZERO : age);
    }

    public boolean hasInteractedWith(String address) {
        String normalized = Addresses.normalize(address);
        return normalized != null && seenContracts.contains(normalized);
    }
}
