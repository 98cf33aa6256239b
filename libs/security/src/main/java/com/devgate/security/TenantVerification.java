package com.devgate.security;

/**
 * How the principal's tenant was established.
 */
public enum TenantVerification {

    /** The token's {@code tid} claim matched the configured tenant. */
    VERIFIED,

    /**
     * The token carried no {@code tid} claim; the configured tenant was assumed. The token
     * was still issued by the tenant-specific issuer, but the tenant claim itself was not checked.
     */
    CLAIM_ABSENT
}
