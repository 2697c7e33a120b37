package com.neuroshield.api.controller;

import com.neuroshield.api.dto.ErrorBody;
import com.neuroshield.common.Addresses;
import com.neuroshield.risk.oracle.OracleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Threat oracle reads for external protocols.
 */
@RestController
@RequestMapping("/api/v1/oracle/{address}")
@RequiredArgsConstructor
public class OracleController {

    private final OracleService oracleService;

    @GetMapping
    public ResponseEntity<?> summary(@PathVariable String address) {
        return withAddress(address, () -> oracleService.summary(address));
    }

    @GetMapping("/score")
    public ResponseEntity<?> score(@PathVariable String address) {
        return withAddress(address, () -> Map.of(
                "address", Addresses.normalize(address),
                "threatScore", oracleService.threatScore(address)));
    }

    @GetMapping("/check")
    public ResponseEntity<?> check(@PathVariable String address) {
        return withAddress(address, () -> Map.of(
                "address", Addresses.normalize(address),
                "isConfirmedScam", oracleService.isConfirmedScam(address)));
    }

    @GetMapping("/confidence")
    public ResponseEntity<?> confidence(@PathVariable String address) {
        return withAddress(address, () -> oracleService.daoConfidence(address));
    }

    @GetMapping("/full")
    public ResponseEntity<?> full(@PathVariable String address) {
        return withAddress(address, () -> oracleService.fullReport(address));
    }

    private static ResponseEntity<?> withAddress(String address, Supplier<Object> body) {
        if (!Addresses.isWellFormed(address)) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid wallet address format"));
        }
        return ResponseEntity.ok(body.get());
    }
}
