package com.promptcraft.llm.provider.support;

import lombok.Builder;
import lombok.Value;

/**
 * Raw outcome of one successful vendor attempt. Token counts are null when the vendor
 * did not report usage.
 */
@Value
@Builder
public class VendorResult {
    String content;
    String model;
    Integer inputTokens;
    Integer outputTokens;
    
    /** False for offline providers whose calls cost nothing. */
    @Builder.Default
    boolean billable = true;
}
