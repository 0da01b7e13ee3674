package com.contractlink.harvester.harvest.api;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.model.HarvestRunReport;
import com.contractlink.harvester.harvest.service.HarvestRunService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import static org.springframework.http.HttpStatus.NOT_FOUND;
import static org.springframework.http.HttpStatus.UNAUTHORIZED;

@RestController
@RequestMapping("/api/harvest")
public class HarvestController {
    static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    private final HarvestRunService runService;
    private final HarvesterProperties properties;

    public HarvestController(HarvestRunService runService, HarvesterProperties properties) {
        this.runService = runService;
        this.properties = properties;
    }

    @PostMapping("/run")
    public HarvestRunReport run(
        @RequestHeader(name = ADMIN_TOKEN_HEADER, required = false) String token,
        @RequestParam(name = "parallel", required = false, defaultValue = "true") boolean parallel
    ) {
        requireAdmin(token);
        return runService.runExclusive("admin", parallel);
    }

    @GetMapping("/runs/latest")
    public HarvestRunReport latest(@RequestHeader(name = ADMIN_TOKEN_HEADER, required = false) String token) {
        requireAdmin(token);
        return runService.latestRun()
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No harvest runs recorded"));
    }

    private void requireAdmin(String token) {
        String expected = properties.getAdmin().getToken();
        if (expected == null || expected.isBlank()) {
            throw new ResponseStatusException(UNAUTHORIZED, "Admin token is not configured");
        }
        if (token == null || !MessageDigest.isEqual(
            expected.trim().getBytes(StandardCharsets.UTF_8),
            token.trim().getBytes(StandardCharsets.UTF_8)
        )) {
            throw new ResponseStatusException(UNAUTHORIZED, "Invalid admin token");
        }
    }
}
