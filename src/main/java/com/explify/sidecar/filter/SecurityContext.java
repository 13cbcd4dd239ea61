package com.explify.sidecar.filter;

/**
 * Thread-local identity of the request being served. Set by {@link IdentityFilter}, cleared when
 * the request completes.
 */
public class SecurityContext {
    public static final String IDENTITY_ATTRIBUTE = "explify.identity";

    private static final ThreadLocal<String> currentIdentity = new ThreadLocal<>();

    public static void setCurrentIdentity(String identity) {
        currentIdentity.set(identity);
    }

    /**
     * @return the resolved identity, or null if the request is unauthenticated
     */
    public static String getCurrentIdentity() {
        return currentIdentity.get();
    }

    public static boolean isAuthenticated() {
        return currentIdentity.get() != null;
    }

    public static void clear() {
        currentIdentity.remove();
    }
}
