package com.dealhunt.aggregator.search.provider;

public abstract class ProviderException extends RuntimeException {
    private final String providerId;

    protected ProviderException(String providerId, String message) {
        super(message);
        this.providerId = providerId;
    }

    protected ProviderException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
