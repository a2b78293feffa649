package com.slb.update_backend.modules.health.controller;

import com.slb.update_backend.modules.health.mapper.HealthMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 负载均衡 / 容器探针使用，返回裸 JSON。
 */
@RestController
@RequestMapping("/health")
@Tag(name = "系统/健康检查")
@Slf4j
public class HealthController {

    private final HealthMapper healthMapper;
    private final Clock clock;

    public HealthController(HealthMapper healthMapper, Clock clock) {
        this.healthMapper = healthMapper;
        this.clock = clock;
    }

    @GetMapping
    @Operation(summary = "健康检查")
    public Map<String, Object> health() {
        return status("ok");
    }

    @GetMapping("/live")
    @Operation(summary = "存活探针")
    public Map<String, Object> live() {
        return status("ok");
    }

    @GetMapping("/ready")
    @Operation(summary = "就绪探针", description = "数据库不可用时返回 503。")
    public ResponseEntity<Map<String, Object>> ready() {
        try {
            healthMapper.ping();
        } catch (DataAccessException e) {
            log.warn("Readiness check failed: {}", e.getMessage());
            Map<String, Object> body = status("unavailable");
            body.put("database", "down");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        Map<String, Object> body = status("ok");
        body.put("database", "up");
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> status(String status) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("timestamp", Instant.now(clock).toString());
        return body;
    }
}
