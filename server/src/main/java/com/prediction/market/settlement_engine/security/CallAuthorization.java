package com.prediction.market.settlement_engine.security;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Proof of caller: the principals whose signatures the host has already verified for
 * this call. The engine never verifies signatures itself.
 */
@ToString
@EqualsAndHashCode
public final class CallAuthorization {

    private static final CallAuthorization NONE = new CallAuthorization(Set.of());

    private final Set<String> principals;

    private CallAuthorization(Set<String> principals) {
        this.principals = principals;
    }

    public static CallAuthorization of(String... principals) {
        LinkedHashSet<String> set = new LinkedHashSet<>(Arrays.asList(principals));
        if (set.contains(null)) {
            throw new IllegalArgumentException("Principal cannot be null");
        }
        return new CallAuthorization(Collections.unmodifiableSet(set));
    }

    public static CallAuthorization none() {
        return NONE;
    }

    public boolean isAuthorizedBy(String principal) {
        return principal != null && principals.contains(principal);
    }

    public Set<String> getPrincipals() {
        return principals;
    }
}
