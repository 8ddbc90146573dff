package com.github.dimitryivaniuta.temporalcache.policy;

/**
 * Invalid cache policy: malformed pattern, negative duration component, bad capacity.
 * Raised while the policy is built, never on the call path.
 */
public class CacheConfigurationException extends RuntimeException {

    public CacheConfigurationException(String message) {
        super(message);
    }

    public CacheConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
