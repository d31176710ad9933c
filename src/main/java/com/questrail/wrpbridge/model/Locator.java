package com.questrail.wrpbridge.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Parsed WRP destination locator.
 *
 * <pre>
 *   mac:112233445566/config/some/path
 *   \_/ \__________/ \____/\________/
 *  scheme authority service  ignored
 * </pre>
 *
 * <p>The {@link #service()} component is the routing key used by the router.
 * It may be empty here; the router rejects such locators itself.</p>
 */
public record Locator(String scheme, String authority, String service, String ignored)
{
    public static final String SCHEME_MAC = "mac";
    public static final String SCHEME_UUID = "uuid";
    public static final String SCHEME_DNS = "dns";
    public static final String SCHEME_SERIAL = "serial";
    public static final String SCHEME_EVENT = "event";
    public static final String SCHEME_SELF = "self";

    private static final Set<String> SCHEMES =
            Set.of(SCHEME_MAC, SCHEME_UUID, SCHEME_DNS, SCHEME_SERIAL, SCHEME_EVENT, SCHEME_SELF);

    public Locator {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(authority, "authority");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(ignored, "ignored");
    }

    /**
     * Parse a locator string.
     *
     * @throws InvalidLocatorException if the string is absent, has no scheme,
     *         uses an unknown scheme or has an empty/invalid authority
     */
    public static Locator parse(String locator) {
        if (locator == null || locator.isEmpty()) {
            throw new InvalidLocatorException(locator, "locator is empty");
        }

        int colon = locator.indexOf(':');
        if (colon <= 0) {
            throw new InvalidLocatorException(locator, "missing scheme");
        }

        String scheme = locator.substring(0, colon).toLowerCase(Locale.ROOT);
        if (!SCHEMES.contains(scheme)) {
            throw new InvalidLocatorException(locator, "unknown scheme '" + scheme + "'");
        }

        String rest = locator.substring(colon + 1);
        int slash = rest.indexOf('/');
        String authority = slash < 0 ? rest : rest.substring(0, slash);
        if (authority.isEmpty()) {
            throw new InvalidLocatorException(locator, "empty authority");
        }
        if (SCHEME_MAC.equals(scheme)) {
            authority = normalizeMac(locator, authority);
        }

        String service = "";
        String ignored = "";
        if (slash >= 0) {
            String tail = rest.substring(slash + 1);
            int next = tail.indexOf('/');
            service = next < 0 ? tail : tail.substring(0, next);
            ignored = next < 0 ? "" : tail.substring(next);
        }

        return new Locator(scheme, authority, service, ignored);
    }

    /**
     * @return {@code scheme:authority}, the device identity without service or path
     */
    public String id() {
        return scheme + ":" + authority;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(id());
        if (!service.isEmpty()) {
            sb.append('/').append(service);
        }
        return sb.append(ignored).toString();
    }

    private static String normalizeMac(String locator, String authority) {
        StringBuilder hex = new StringBuilder(12);
        for (int i = 0; i < authority.length(); i++) {
            char c = authority.charAt(i);
            switch (c) {
                case ':', '-', '.', ',' -> {
                    // separators are dropped
                }
                default -> {
                    if (Character.digit(c, 16) < 0) {
                        throw new InvalidLocatorException(locator, "invalid mac address");
                    }
                    hex.append(Character.toLowerCase(c));
                }
            }
        }
        if (hex.length() != 12) {
            throw new InvalidLocatorException(locator, "invalid mac address");
        }
        return hex.toString();
    }
}
