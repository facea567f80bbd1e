package com.mike.recipeimporter.util;

import java.util.Collection;
import java.util.Locale;

public final class DomainMatcher {

    private DomainMatcher() {
    }

    /**
     * "example.com" matches example.com and any subdomain of it; ".example.com" is the
     * explicit wildcard form with the same effect. Case-insensitive.
     */
    public static boolean matches(String host, String allowed) {
        if (host == null || allowed == null || allowed.isBlank()) {
            return false;
        }
        String h = host.trim().toLowerCase(Locale.ROOT);
        String a = allowed.trim().toLowerCase(Locale.ROOT);

        if (a.startsWith(".")) {
            String bare = a.substring(1);
            return h.equals(bare) || h.endsWith(a);
        }
        return h.equals(a) || h.endsWith("." + a);
    }

    public static boolean matchesAny(String host, Collection<String> allowedDomains) {
        if (allowedDomains == null) {
            return false;
        }
        for (String allowed : allowedDomains) {
            if (matches(host, allowed)) {
                return true;
            }
        }
        return false;
    }
}
