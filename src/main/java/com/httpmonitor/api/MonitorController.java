package com.httpmonitor.api;

import com.httpmonitor.model.HealthCheck;
import com.httpmonitor.model.HealthSummaryResponse;
import com.httpmonitor.model.Target;
import com.httpmonitor.model.TargetHealthSnapshot;
import com.httpmonitor.service.MonitorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "HTTP Monitor API", description = "Read-only view of monitored targets and their health")
public class MonitorController {
    private final MonitorService service;

    public MonitorController(MonitorService service) {
        this.service = service;
    }

    @GetMapping("/targets")
    @Operation(summary = "List all configured targets")
    @ApiResponse(responseCode = "200", description = "List of all targets")
    public ResponseEntity<List<Target>> listTargets() {
        return ResponseEntity.ok(service.listTargets());
    }

    @GetMapping("/health/targets")
    @Operation(summary = "Get the current health of every target")
    @ApiResponse(responseCode = "200", description = "One snapshot per target, in configuration order")
    public ResponseEntity<List<TargetHealthSnapshot>> listHealth() {
        return ResponseEntity.ok(service.snapshots());
    }

    @GetMapping("/health/targets/{name}")
    @Operation(summary = "Get the current health of one target")
    @ApiResponse(responseCode = "200", description = "Target found")
    @ApiResponse(responseCode = "404", description = "Target not found")
    public ResponseEntity<TargetHealthSnapshot> getHealth(@PathVariable String name) {
        TargetHealthSnapshot snapshot = service.snapshot(name);
        if (snapshot == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(snapshot);
    }

    @GetMapping("/health/targets/{name}/checks")
    @Operation(summary = "Get the most recent checks of one target",
               description = "Up to 100 checks, oldest first")
    @ApiResponse(responseCode = "200", description = "Recent checks")
    @ApiResponse(responseCode = "404", description = "Target not found")
    public ResponseEntity<List<HealthCheck>> getRecentChecks(@PathVariable String name) {
        List<HealthCheck> checks = service.recentChecks(name);
        if (checks == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(checks);
    }

    @GetMapping("/health/summary")
    @Operation(summary = "Get health status summary")
    @ApiResponse(responseCode = "200", description = "Count of targets by status")
    public ResponseEntity<HealthSummaryResponse> getSummary() {
        return ResponseEntity.ok(service.getSummary());
    }
}
