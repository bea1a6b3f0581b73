package com.claude.warehouse.controller;

import com.claude.warehouse.dto.CustomerInfoQualityReport;
import com.claude.warehouse.dto.KeyIntegrityReport;
import com.claude.warehouse.service.BronzeQualityService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/bronze/quality")
public class BronzeQualityController {

    private final BronzeQualityService qualityService;

    public BronzeQualityController(BronzeQualityService qualityService) {
        this.qualityService = qualityService;
    }

    @GetMapping("/customers")
    public ResponseEntity<CustomerInfoQualityReport> profileCustomers() {
        return ResponseEntity.ok(qualityService.profileCustomerInfo());
    }

    @GetMapping("/keys")
    public ResponseEntity<List<KeyIntegrityReport>> checkKeys() {
        return ResponseEntity.ok(qualityService.checkKeyIntegrity());
    }
}
