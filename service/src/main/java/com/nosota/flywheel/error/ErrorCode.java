package com.nosota.flywheel.error;

/**
 * Error codes surfaced by the flywheel registry, vaults and hooks.
 *
 * <p>Each code names the cause of a rejected call so that callers and tests can
 * assert on it. The HTTP status is the one the REST layer answers with.
 */
public enum ErrorCode {
    /** No campaign lives at the given address. */
    CAMPAIGN_DOES_NOT_EXIST(404),

    /** Operation not permitted in the campaign's current status, or no-op/terminal transition. */
    INVALID_CAMPAIGN_STATUS(409),

    /** Vault balance would no longer cover outstanding allocations. */
    INSUFFICIENT_CAMPAIGN_FUNDS(409),

    /** Withdrawal of a zero amount. */
    ZERO_AMOUNT(400),

    /** Caller is not allowed to perform the call. */
    UNAUTHORIZED(403),

    /** Vault transfer failed on a path that does not tolerate failures. */
    SEND_FAILED(409),

    /** Deallocation or fee distribution larger than the outstanding allocation. */
    ALLOCATION_UNDERFLOW(409),

    /** Hooks address does not resolve to a registered policy module. */
    UNKNOWN_HOOKS(400),

    /** Hooks do not implement the requested callback. */
    UNSUPPORTED_OPERATION(400),

    /** Hook payload could not be decoded or failed policy validation. */
    INVALID_HOOK_DATA(400),

    /** Malformed address, key or hex payload. */
    INVALID_ADDRESS(400);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
