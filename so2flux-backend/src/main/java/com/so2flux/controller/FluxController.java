package com.so2flux.controller;

import com.so2flux.model.FluxRecord;
import com.so2flux.model.FluxTable;
import com.so2flux.service.FluxService;
import com.so2flux.service.ScanCatalogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/fluxes")
@CrossOrigin(origins = "*")
public class FluxController {

    private static final Logger logger = LoggerFactory.getLogger(FluxController.class);

    private final FluxService fluxService;

    public FluxController(FluxService fluxService) {
        this.fluxService = fluxService;
    }

    // Recalculates and writes the flux tables of a day; returns the rows by station
    @PostMapping("/calculate")
    public ResponseEntity<?> calculateFluxes(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "false") boolean reanalysis) {
        Map<String, FluxTable> tables = fluxService.runDailyAnalysis(date, reanalysis);

        Map<String, List<FluxRecord>> body = new LinkedHashMap<>();
        tables.forEach((station, table) -> body.put(station, table.getRecords()));
        return ResponseEntity.ok().body(body);
    }

    @ExceptionHandler(ScanCatalogException.class)
    public ResponseEntity<?> handleCatalogFailure(ScanCatalogException e) {
        logger.error("Flux calculation failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<?> handleBadParameter(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest().body("Invalid value for " + e.getName() + ": " + e.getValue());
    }
}
