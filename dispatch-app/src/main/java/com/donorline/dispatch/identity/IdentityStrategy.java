package com.donorline.dispatch.identity;

import java.util.Optional;

/**
 * One step of the sender fallback chain. Returns empty when the step does not apply
 * (no such person, or that person has no usable credential) so the next step is tried.
 */
public interface IdentityStrategy {

    Optional<SenderIdentity> resolve(IdentityRequest request);

    String name();
}
