package com.labbackup.api.controller;

import com.labbackup.api.engine.IntegrityReport;
import com.labbackup.api.model.dto.BackupListResponse;
import com.labbackup.api.model.dto.ChainStatistics;
import com.labbackup.api.service.ChainService;
import com.labbackup.api.service.IntegrityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/chains/{chainId}")
@RequiredArgsConstructor
@Tag(name = "Chains", description = "Backup chain inspection")
public class ChainController {

    private final ChainService chainService;
    private final IntegrityService integrityService;

    @GetMapping
    @Operation(summary = "List the members of a chain in sequence order")
    public ResponseEntity<BackupListResponse> getChain(@PathVariable UUID chainId) {
        return ResponseEntity.ok(BackupListResponse.fromEntities(chainService.getChain(chainId)));
    }

    @GetMapping("/integrity")
    @Operation(summary = "Check chain integrity")
    public ResponseEntity<IntegrityReport> checkIntegrity(@PathVariable UUID chainId) {
        return ResponseEntity.ok(integrityService.checkIntegrity(chainId));
    }

    @GetMapping("/statistics")
    @Operation(summary = "Get chain size and compression statistics")
    public ResponseEntity<ChainStatistics> getStatistics(@PathVariable UUID chainId) {
        return ResponseEntity.ok(chainService.getChainStatistics(chainId));
    }
}
