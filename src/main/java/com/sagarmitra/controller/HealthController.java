package com.sagarmitra.controller;

import com.sagarmitra.config.AgentProperties;
import com.sagarmitra.tools.AgentTool;
import com.sagarmitra.tools.ToolRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@Tag(name = "Health")
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final AgentProperties properties;
    private final ToolRegistry toolRegistry;

    @Operation(summary = "Liveness and basic configuration")
    @GetMapping("/health")
    public Mono<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("service", "sagarmitra-agent");
        body.put("mode", properties.getMode());
        body.put("store", properties.getStore().getType());
        body.put("tools", toolRegistry.tools().stream().map(AgentTool::name).toList());
        return Mono.just(body);
    }
}
