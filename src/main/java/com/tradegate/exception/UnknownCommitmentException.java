package com.tradegate.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * Thrown when a close, reduce or cancel names a commitment the ledger does not hold.
 * Usually a double close upstream.
 */
public class UnknownCommitmentException extends BaseException {

    public UnknownCommitmentException(String accountId, String commitmentId) {
        super(
                ErrorCode.UNKNOWN_COMMITMENT,
                String.format("Commitment %s is not open on account %s", commitmentId, accountId),
                details(accountId, commitmentId));
    }

    // Either id may be null when the caller sent a malformed request
    private static Map<String, Object> details(String accountId, String commitmentId) {
        Map<String, Object> details = new HashMap<>();
        details.put("accountId", accountId);
        details.put("commitmentId", commitmentId);
        return details;
    }
}
