package com.agentcouncil.common.model;

/**
 * Whether a {@link FinalDecision} passed the reflection check.
 *
 * <ul>
 *   <li>PENDING   : produced by the decision stage, not yet checked</li>
 *   <li>VERIFIED  : accepted by the verdict gate</li>
 *   <li>UNVERIFIED: retry budget exhausted; best-effort answer</li>
 * </ul>
 */
public enum VerificationStatus {
    PENDING,
    VERIFIED,
    UNVERIFIED
}
