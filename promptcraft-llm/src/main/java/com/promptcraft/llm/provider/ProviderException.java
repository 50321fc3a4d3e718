package com.promptcraft.llm.provider;

/**
 * Failure of a single vendor attempt. Raised by vendor calls and absorbed by
 * {@link com.promptcraft.llm.provider.support.ProviderExecutor}; it never escapes a provider.
 */
public class ProviderException extends Exception {
    
    private final ProviderErrorType errorType;
    private final int statusCode;
    private final String provider;
    
    public ProviderException(String message, String provider, ProviderErrorType errorType, int statusCode) {
        super(message);
        this.provider = provider;
        this.errorType = errorType;
        this.statusCode = statusCode;
    }
    
    public ProviderException(String message, String provider, ProviderErrorType errorType, int statusCode,
                             Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.errorType = errorType;
        this.statusCode = statusCode;
    }
    
    public ProviderErrorType getErrorType() { return errorType; }
    public int getStatusCode() { return statusCode; }
    public String getProvider() { return provider; }
    public boolean isRetryable() { return errorType.isRetryable(); }
}
