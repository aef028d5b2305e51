package com.labbackup.api.controller;

import com.labbackup.api.model.dto.GlobalStatistics;
import com.labbackup.api.service.ChainService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/statistics")
@RequiredArgsConstructor
@Tag(name = "Statistics", description = "Storage totals across all chains")
public class StatisticsController {

    private final ChainService chainService;

    @GetMapping
    @Operation(summary = "Get size, compression and chain health totals")
    public ResponseEntity<GlobalStatistics> getGlobalStatistics() {
        return ResponseEntity.ok(chainService.getGlobalStatistics());
    }
}
