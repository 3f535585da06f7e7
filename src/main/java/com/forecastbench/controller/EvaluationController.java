package com.forecastbench.controller;

import com.forecastbench.config.RequestIdFilter;
import com.forecastbench.dto.CategoryInfoResponse;
import com.forecastbench.dto.EvaluationRequest;
import com.forecastbench.dto.EvaluationResponse;
import com.forecastbench.service.EvaluationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class EvaluationController {

    private final EvaluationService evaluationService;

    @PostMapping("/evaluations")
    public ResponseEntity<EvaluationResponse> evaluate(
            @Valid @RequestBody EvaluationRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("POST /evaluations | label={} | series={} | requestId={}",
                 request.getLabel(), request.getForecasts().size(), requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(evaluationService.evaluate(request, requestId));
    }

    @PostMapping(value = "/evaluations/csv", consumes = "text/csv")
    public ResponseEntity<EvaluationResponse> evaluateCsv(
            @RequestBody String csv,
            @RequestParam(required = false) @Size(max = 100) String label,
            HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("POST /evaluations/csv | label={} | bytes={} | requestId={}", label, csv.length(), requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(evaluationService.evaluateCsv(csv, label, requestId));
    }

    @GetMapping("/evaluations/{id}")
    public ResponseEntity<EvaluationResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(evaluationService.get(id));
    }

    @GetMapping("/evaluations")
    public ResponseEntity<Page<EvaluationResponse>> history(
            @RequestParam(required = false) String label,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(evaluationService.history(label, PageRequest.of(page, size)));
    }

    @GetMapping("/dataset/categories")
    public ResponseEntity<List<CategoryInfoResponse>> categories() {
        return ResponseEntity.ok(evaluationService.categories());
    }
}
