package com.promptcraft.api.controller;

import com.promptcraft.api.dto.response.ErrorResponse;
import com.promptcraft.llm.service.ProviderHealthReport;
import com.promptcraft.llm.service.UnifiedLlmService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/ai")
@RequiredArgsConstructor
@Slf4j
public class LlmMonitoringController {
    
    private final UnifiedLlmService llmService;
    
    /**
     * Provider health and usage. {@code type=health} runs a sweep, {@code type=stats} only
     * reads counters, no selector returns both.
     */
    @GetMapping("/monitoring")
    public ResponseEntity<?> monitoring(@RequestParam(name = "type", required = false) String type) {
        if (type != null && !type.equals("health") && !type.equals("stats")) {
            return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .error("Unknown monitoring type: " + type)
                .timestamp(Instant.now())
                .build());
        }
        
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            if ("stats".equals(type)) {
                body.put("stats", llmService.getProviderStats());
                body.put("timestamp", Instant.now().toString());
            } else if ("health".equals(type)) {
                body.put("health", llmService.checkProviderHealth());
                body.put("timestamp", Instant.now().toString());
            } else {
                ProviderHealthReport report = llmService.getProviderHealth();
                body.put("health", report.health());
                body.put("stats", report.stats());
                body.put("timestamp", report.timestamp());
            }
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("[MONITORING] Failed to fetch provider data | type={}", type, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.builder().error("Failed to fetch LLM provider data").build());
        }
    }
}
