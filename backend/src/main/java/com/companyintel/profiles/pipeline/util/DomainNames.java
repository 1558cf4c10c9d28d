package com.companyintel.profiles.pipeline.util;

import java.util.List;
import java.util.Locale;

public final class DomainNames {
    private static final List<String> TWO_PART_TLDS = List.of(
        "co.uk",
        "com.au",
        "co.nz",
        "co.za",
        "com.br"
    );

    private DomainNames() {
    }

    /**
     * Strips scheme, path and subdomains: {@code api.app.example.com -> example.com},
     * {@code shop.example.co.uk -> example.co.uk}.
     */
    public static String rootDomain(String domain) {
        if (domain == null) {
            return "";
        }
        String host = domain.trim().replace("https://", "").replace("http://", "");
        int slash = host.indexOf('/');
        if (slash >= 0) {
            host = host.substring(0, slash);
        }
        String[] parts = host.split("\\.");
        if (parts.length >= 3) {
            String lastTwo = parts[parts.length - 2] + "." + parts[parts.length - 1];
            if (TWO_PART_TLDS.contains(lastTwo.toLowerCase(Locale.ROOT))) {
                return parts[parts.length - 3] + "." + lastTwo;
            }
        }
        if (parts.length > 1) {
            return parts[parts.length - 2] + "." + parts[parts.length - 1];
        }
        return host;
    }

    /**
     * Lookup key form: no scheme, no leading {@code www.}, no path, lowercase.
     */
    public static String normalizeLookupKey(String domain) {
        if (domain == null) {
            return "";
        }
        String value = domain.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("https://")) {
            value = value.substring("https://".length());
        } else if (value.startsWith("http://")) {
            value = value.substring("http://".length());
        }
        if (value.startsWith("www.")) {
            value = value.substring("www.".length());
        }
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }
        return value;
    }

    /**
     * {@code www.acme-labs.com -> Acme-labs}; empty input gives {@code Unknown Company}.
     */
    public static String nameFromDomain(String domain) {
        String value = domain == null ? "" : domain.trim();
        if (value.startsWith("www.")) {
            value = value.substring("www.".length());
        }
        String label = value.split("\\.")[0];
        if (label.isEmpty()) {
            return "Unknown Company";
        }
        return label.substring(0, 1).toUpperCase(Locale.ROOT) + label.substring(1).toLowerCase(Locale.ROOT);
    }
}
