package com.dealhunt.aggregator.search.provider;

public class UpstreamProviderException extends ProviderException {
    public UpstreamProviderException(String providerId, String message) {
        super(providerId, message);
    }

    public UpstreamProviderException(String providerId, String message, Throwable cause) {
        super(providerId, message, cause);
    }
}
