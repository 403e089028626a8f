package com.trendrank.controller;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.trendrank.model.BenchmarkRecord;
import com.trendrank.service.RankingQueryService;

/**
 * Exposes the timings recorded by every board build and refresh.
 */
@RestController
@RequestMapping("/api/v1/benchmarks")
public class BenchmarkController {

    private final RankingQueryService queryService;

    @Autowired
    public BenchmarkController(RankingQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping
    public ResponseEntity<List<BenchmarkRecord>> getBenchmarks() {
        return ResponseEntity.ok(queryService.getBenchmarks());
    }

    @DeleteMapping
    public ResponseEntity<Void> clearBenchmarks() {
        queryService.clearBenchmarks();
        return ResponseEntity.noContent().build();
    }
}
