package io.instiflow.institutional.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One security's share counts from one table. A null count means the source value was missing or not
 * numeric.
 */
public record CanonicalRow(String securityId, String securityName, Map<String, Long> shares) {
    public CanonicalRow {
        Objects.requireNonNull(securityId, "securityId");
        securityName = securityName == null ? "" : securityName;
        shares = Collections.unmodifiableMap(new LinkedHashMap<>(shares));
    }

    public Long share(String field) {
        return shares.get(field);
    }
}
