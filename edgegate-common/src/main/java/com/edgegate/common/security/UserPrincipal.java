package com.edgegate.common.security;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * Identity of a gateway caller, taken from a verified bearer token.
 * An anonymous principal has no subject and no claims.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPrincipal {

    private String subject;
    private List<String> roles;

    /**
     * Subscription tier claim, e.g. free, basic, premium
     */
    private String tier;
    private List<String> permissions;

    public static UserPrincipal anonymous() {
        return new UserPrincipal(null, Collections.emptyList(), null, Collections.emptyList());
    }

    public boolean isAuthenticated() {
        return subject != null;
    }

    public boolean hasRole(String role) {
        return roles != null && roles.contains(role);
    }

    public boolean hasPermission(String permission) {
        return permissions != null && permissions.contains(permission);
    }

    public boolean hasTier(String candidate) {
        return tier != null && tier.equalsIgnoreCase(candidate);
    }
}
