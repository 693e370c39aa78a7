package com.github.salilvnair.advisorengine.api.controller;

import com.github.salilvnair.advisorengine.resilience.CircuitBreakerRegistry;
import com.github.salilvnair.advisorengine.resilience.CircuitSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/circuits")
public class CircuitBreakerController {

    private final CircuitBreakerRegistry registry;

    @GetMapping
    public ResponseEntity<List<CircuitSnapshot>> circuits() {
        return ResponseEntity.ok(registry.snapshots());
    }

    @PostMapping("/{name}/reset")
    public ResponseEntity<CircuitSnapshot> reset(@PathVariable("name") String name) {
        log.info("AdvisorEngine Admin: manual reset requested for circuit '{}'", name);
        return ResponseEntity.ok(registry.reset(name));
    }
}
