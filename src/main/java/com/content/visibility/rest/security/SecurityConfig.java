package com.content.visibility.rest.security;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for API key-based security.
 * Maps each API key to the user it authenticates and that user's role.
 *
 * <p>Populated from MicroProfile Config, one {@code key=userId} entry per key:</p>
 * <pre>
 * content-visibility.security.enabled=true
 * content-visibility.security.api-key-header=X-API-Key
 * content-visibility.security.admin-keys=cv-admin-xxxx=1
 * content-visibility.security.user-keys=cv-user-aaaa=2,cv-user-bbbb=3
 * </pre>
 */
public class SecurityConfig {

    private final boolean enabled;
    private final String apiKeyHeader;
    private final Map<String, KeyBinding> apiKeys;

    /**
     * The user and role an API key authenticates as.
     */
    public record KeyBinding(long userId, SecurityRole role) {}

    private SecurityConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.apiKeyHeader = builder.apiKeyHeader;
        this.apiKeys = Collections.unmodifiableMap(new HashMap<>(builder.apiKeys));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getApiKeyHeader() {
        return apiKeyHeader;
    }

    /**
     * Looks up the binding of an API key.
     *
     * @return the binding, or null if the key is not recognized
     */
    public KeyBinding getBindingForKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return null;
        }
        return apiKeys.get(apiKey);
    }

    /**
     * Looks up the role associated with an API key.
     *
     * @return the associated role, or null if the key is not recognized
     */
    public SecurityRole getRoleForKey(String apiKey) {
        KeyBinding binding = getBindingForKey(apiKey);
        return binding != null ? binding.role() : null;
    }

    public boolean isValidKey(String apiKey) {
        return apiKey != null && apiKeys.containsKey(apiKey);
    }

    public int keyCount() {
        return apiKeys.size();
    }

    public static SecurityConfig disabled() {
        return builder().enabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private String apiKeyHeader = "X-API-Key";
        private final Map<String, KeyBinding> apiKeys = new HashMap<>();

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder apiKeyHeader(String apiKeyHeader) {
            if (apiKeyHeader == null || apiKeyHeader.isBlank()) {
                throw new IllegalArgumentException("apiKeyHeader must not be null or blank");
            }
            this.apiKeyHeader = apiKeyHeader;
            return this;
        }

        /**
         * Adds a single API key for a user with the specified role.
         */
        public Builder addKey(String key, long userId, SecurityRole role) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("API key must not be null or blank");
            }
            if (role == null) {
                throw new IllegalArgumentException("Security role must not be null");
            }
            this.apiKeys.put(key, new KeyBinding(userId, role));
            return this;
        }

        /**
         * Adds keys given as {@code key=userId} entries, all with the same role.
         *
         * @throws IllegalArgumentException if an entry has no numeric user id
         */
        public Builder addKeys(List<String> entries, SecurityRole role) {
            if (entries == null) return this;
            for (String entry : entries) {
                if (entry == null || entry.isBlank()) {
                    continue;
                }
                int separator = entry.lastIndexOf('=');
                if (separator <= 0 || separator == entry.length() - 1) {
                    throw new IllegalArgumentException("API key entry must be key=userId: " + mask(entry));
                }
                String key = entry.substring(0, separator).trim();
                String userId = entry.substring(separator + 1).trim();
                try {
                    addKey(key, Long.parseLong(userId), role);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("API key entry has a non-numeric user id: " + mask(entry), e);
                }
            }
            return this;
        }

        public SecurityConfig build() {
            return new SecurityConfig(this);
        }

        private static String mask(String entry) {
            return entry.length() <= 4 ? "****" : entry.substring(0, 4) + "****";
        }
    }

    @Override
    public String toString() {
        return "SecurityConfig{" +
                "enabled=" + enabled +
                ", apiKeyHeader='" + apiKeyHeader + '\'' +
                ", keyCount=" + apiKeys.size() +
                '}';
    }
}
