package com.careinsight.careinsight.data;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/data")
public class DataStatsController {

    private final DataStatsService dataStatsService;

    public DataStatsController(DataStatsService dataStatsService) {
        this.dataStatsService = dataStatsService;
    }

    @GetMapping("/stats")
    public ResponseEntity<DataStatsResponse> stats() {
        return ResponseEntity.ok(dataStatsService.getStats());
    }
}
