package com.pointbreak.award.controller;

import com.pointbreak.award.session.PoolStats;
import com.pointbreak.award.session.SessionPool;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/health")
public class HealthController {

    private final SessionPool sessionPool;

    @GetMapping
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    /**
     * UP while the pool holds at least one session that is warming, ready or in use.
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        PoolStats stats = sessionPool.stats();

        Map<String, Object> pool = new LinkedHashMap<>();
        pool.put("warming", stats.warming());
        pool.put("ready", stats.ready());
        pool.put("busy", stats.busy());
        pool.put("degraded", stats.degraded());
        pool.put("retired", stats.retiredTotal());
        pool.put("waiting", stats.waiting());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", stats.isHealthy() ? "UP" : "DOWN");
        response.put("pool", pool);

        return ResponseEntity.status(stats.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(response);
    }
}
