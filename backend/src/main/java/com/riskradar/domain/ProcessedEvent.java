package com.riskradar.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Canonical normalized event. The only event shape the engine and the stages accept.
 * Argument access goes through the typed accessors below; ERC-20 owner/spender names are
 * accepted as aliases of from/to.
 */
public record ProcessedEvent(
        String transactionHash,
        long blockNumber,
        int logIndex,
        String contractAddress,
        EventType eventType,
        Map<String, Object> parsedArgs,
        SuspicionLevel suspicionLevel,
        List<String> riskFactors,
        Instant timestamp
) {

    /** Decimal digits of 2^256 - 1. */
    static final int MAX_UINT256_DIGITS = 78;
    static final int MAX_NUMERIC_TEXT_LENGTH = 128;

    public static final String ARG_FROM = "from";
    public static final String ARG_TO = "to";
    public static final String ARG_VALUE = "value";
    public static final String ARG_DECIMALS = "decimals";

    private static final List<String> SENDER_KEYS = List.of(ARG_FROM, "owner", "sender");
    private static final List<String> COUNTERPARTY_KEYS = List.of(ARG_TO, "spender", "recipient");
    private static final List<String> AMOUNT_KEYS = List.of(ARG_VALUE, "amount");

    public ProcessedEvent {
        eventType = eventType != null ? eventType : EventType.UNKNOWN;
        parsedArgs = parsedArgs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parsedArgs));
        suspicionLevel = suspicionLevel != null ? suspicionLevel : SuspicionLevel.LOW;
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
    }

    public Optional<String> sender() {
        return firstString(SENDER_KEYS);
    }

    public Optional<String> counterparty() {
        return firstString(COUNTERPARTY_KEYS);
    }

    public boolean touchesZeroAddress() {
        return sender().map(Addresses::isZero).orElse(false)
                || counterparty().map(Addresses::isZero).orElse(false);
    }

    /**
     * Raw amount in the token's smallest unit.
     *
     * @throws MalformedEventException when the value is present but not a non-negative integer
     */
    public Optional<BigInteger> amount() {
        for (String key : AMOUNT_KEYS) {
            Object raw = parsedArgs.get(key);
            if (raw != null) {
                return Optional.of(toBigInteger(key, raw));
            }
        }
        return Optional.empty();
    }

    public OptionalInt decimals() {
        Object raw = parsedArgs.get(ARG_DECIMALS);
        if (raw == null) {
            return OptionalInt.empty();
        }
        try {
            int decimals = raw instanceof Number n ? n.intValue() : Integer.parseInt(raw.toString().strip());
            return decimals >= 0 && decimals <= 77 ? OptionalInt.of(decimals) : OptionalInt.empty();
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    public boolean hasParsedArgs() {
        return !parsedArgs.isEmpty();
    }

    /** Copy with suspicion and risk factors replaced by an analysis stage. */
    public ProcessedEvent withAnalysis(SuspicionLevel suspicion, List<String> factors) {
        return new ProcessedEvent(transactionHash, blockNumber, logIndex, contractAddress, eventType,
                parsedArgs, suspicion, factors, timestamp);
    }

    /** First ten characters of the transaction hash, for log lines and recommendation text. */
    public String shortHash() {
        if (transactionHash == null) {
            return "unknown";
        }
        return transactionHash.length() <= 10 ? transactionHash : transactionHash.substring(0, 10);
    }

    private Optional<String> firstString(List<String> keys) {
        for (String key : keys) {
            Object raw = parsedArgs.get(key);
            if (raw != null && !raw.toString().isBlank()) {
                return Optional.of(raw.toString().strip());
            }
        }
        return Optional.empty();
    }

    private static BigInteger toBigInteger(String key, Object raw) {
        BigInteger value;
        try {
            if (raw instanceof BigInteger bi) {
                value = bi;
            } else if (raw instanceof Long || raw instanceof Integer || raw instanceof Short) {
                value = BigInteger.valueOf(((Number) raw).longValue());
            } else if (raw instanceof Number n) {
                value = integralPart(key, new BigDecimal(n.toString()));
            } else {
                String text = raw.toString().strip();
                if (text.length() > MAX_NUMERIC_TEXT_LENGTH) {
                    throw new MalformedEventException("Argument '" + key + "' is too long: " + text.length() + " chars");
                }
                if (text.startsWith("0x") || text.startsWith("0X")) {
                    value = new BigInteger(text.substring(2), 16);
                } else {
                    value = integralPart(key, new BigDecimal(text));
                }
            }
        } catch (NumberFormatException e) {
            throw new MalformedEventException("Argument '" + key + "' is not numeric: " + raw, e);
        }
        if (value.signum() < 0) {
            throw new MalformedEventException("Argument '" + key + "' is negative: " + raw);
        }
        if (value.bitLength() > 256) {
            throw new MalformedEventException("Argument '" + key + "' exceeds uint256");
        }
        return value;
    }

    /** Rejects exponents like 1e300000 before they are expanded into a huge integer. */
    private static BigInteger integralPart(String key, BigDecimal decimal) {
        if (decimal.signum() != 0 && decimal.precision() - decimal.scale() > MAX_UINT256_DIGITS) {
            throw new MalformedEventException("Argument '" + key + "' exceeds uint256");
        }
        return decimal.toBigInteger();
    }
}
