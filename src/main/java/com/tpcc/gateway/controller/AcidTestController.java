package com.tpcc.gateway.controller;

import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tpcc.gateway.domain.AcidProperty;
import com.tpcc.gateway.domain.AcidSuiteReport;
import com.tpcc.gateway.domain.AcidTestResult;
import com.tpcc.gateway.service.acid.AcidComplianceService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for the ACID conformance harness.
 *
 * Both endpoints answer 200 with the report; a failed property is a result,
 * not an HTTP error. An unknown property key answers 400.
 */
@Slf4j
@RestController
@RequestMapping("/api/acid")
@RequiredArgsConstructor
@Tag(name = "ACID Conformance", description = "Atomicity, consistency, isolation and durability checks")
public class AcidTestController {

    private final AcidComplianceService acidComplianceService;

    @PostMapping("/run")
    @Operation(summary = "Run all ACID tests",
               description = "Provisions session tables, runs the four property tests and drops the tables")
    public AcidSuiteReport runAll() {
        log.info("API: ACID suite run");
        return acidComplianceService.runAll();
    }

    @PostMapping("/run/{property}")
    @Operation(summary = "Run one ACID test",
               description = "property is one of atomicity, consistency, isolation, durability")
    public AcidTestResult runSingle(@PathVariable String property) {
        AcidProperty parsed = AcidProperty.fromKey(property);
        log.info("API: ACID {} run", parsed.key());
        return acidComplianceService.runSingle(parsed);
    }
}
