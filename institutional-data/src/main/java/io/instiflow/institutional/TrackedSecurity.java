package io.instiflow.institutional;

import java.util.Objects;

public record TrackedSecurity(String securityId, Market market) {
    public TrackedSecurity {
        Objects.requireNonNull(securityId, "securityId");
        Objects.requireNonNull(market, "market");
        securityId = securityId.trim();
        if (securityId.isEmpty()) throw new IllegalArgumentException("securityId must not be blank");
    }
}
