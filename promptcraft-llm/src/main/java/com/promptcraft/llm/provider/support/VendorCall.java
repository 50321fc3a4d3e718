package com.promptcraft.llm.provider.support;

import com.promptcraft.llm.provider.ProviderException;

import java.time.Duration;

/**
 * One attempt against a vendor API for the given model.
 */
@FunctionalInterface
public interface VendorCall {
    
    VendorResult call(String model, Duration timeout) throws ProviderException;
}
