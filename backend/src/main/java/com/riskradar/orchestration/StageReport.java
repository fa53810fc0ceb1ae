package com.riskradar.orchestration;

import com.riskradar.delegation.DelegationStatus;
import com.riskradar.delegation.WorkerRole;

/**
 * How one pipeline stage was served.
 *
 * @param fallback true when the stage output was computed locally
 * @param message  failure reason for non-success delegations
 */
public record StageReport(WorkerRole role, DelegationStatus status, boolean fallback, String message) {
}
