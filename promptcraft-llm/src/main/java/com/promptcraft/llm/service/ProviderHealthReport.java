package com.promptcraft.llm.service;

import com.promptcraft.llm.model.HealthStatus;
import com.promptcraft.llm.model.ProviderStats;

import java.util.List;

/**
 * Health sweep results together with the statistics read right after it.
 */
public record ProviderHealthReport(List<HealthStatus> health, List<ProviderStats> stats, String timestamp) {
}
