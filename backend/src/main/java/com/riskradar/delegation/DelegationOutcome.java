package com.riskradar.delegation;

/**
 * Result of one delegation. {@code result} is non-null only for SUCCESS.
 */
public record DelegationOutcome<R>(R result, DelegationStatus status, String message) {

    public static <R> DelegationOutcome<R> success(R result) {
        return new DelegationOutcome<>(result, DelegationStatus.SUCCESS, null);
    }

    public static <R> DelegationOutcome<R> failed(DelegationStatus status, String message) {
        return new DelegationOutcome<>(null, status, message);
    }

    public boolean isSuccess() {
        return status == DelegationStatus.SUCCESS;
    }
}
