package com.donorline.dispatch.identity;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Walks the {@link IdentityStrategy} chain in {@code @Order} sequence and returns the
 * first identity found.
 */
@Component
@Slf4j
public class SenderIdentityResolver {

    private final List<IdentityStrategy> strategies;

    public SenderIdentityResolver(List<IdentityStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * @throws NoIdentityAvailableException if no strategy applies
     */
    public SenderIdentity resolve(IdentityRequest request) {
        return tryResolve(request)
                .orElseThrow(() -> new NoIdentityAvailableException(request.donorId(), request.organizationId()));
    }

    public Optional<SenderIdentity> tryResolve(IdentityRequest request) {
        for (IdentityStrategy strategy : strategies) {
            Optional<SenderIdentity> identity = strategy.resolve(request);
            if (identity.isPresent()) {
                log.debug("Resolved sender {} for donor {} via {}",
                        identity.get().emailAddress(), request.donorId(), strategy.name());
                return identity;
            }
        }
        return Optional.empty();
    }
}
