package com.edgeplatform.analysis.controller;

import com.edgeplatform.analysis.service.PickGenerationService;
import com.edgeplatform.common.model.Analysis;
import com.edgeplatform.common.model.GameEvent;
import com.edgeplatform.common.model.Pick;
import com.edgeplatform.common.model.RiskProfile;
import com.edgeplatform.common.model.ValidationResult;
import com.edgeplatform.common.validation.PickValidator;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/picks")
public class PickController {

    private final PickGenerationService generationService;
    private final PickValidator validator;

    public PickController(PickGenerationService generationService, PickValidator validator) {
        this.generationService = generationService;
        this.validator         = validator;
    }

    @PostMapping("/analyze")
    public Mono<ResponseEntity<Analysis>> analyze(@RequestBody GameEvent event) {
        return generationService.analyze(event)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/generate")
    public Mono<ResponseEntity<List<Pick>>> generate(@RequestBody List<GameEvent> events) {
        return generationService.generate(events)
            .map(ResponseEntity::ok);
    }

    /** Runs the pipeline over the feed's slate. Defaults to today. */
    @GetMapping("/today")
    public Mono<ResponseEntity<List<Pick>>> today(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return generationService.generateForDate(date != null ? date : LocalDate.now())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@RequestBody Pick pick) {
        return ResponseEntity.ok(validator.validate(pick));
    }

    @PostMapping("/validate/batch")
    public ResponseEntity<PickValidator.BatchResult> validateBatch(@RequestBody List<Pick> picks) {
        return ResponseEntity.ok(validator.validateBatch(picks));
    }

    @GetMapping("/profile")
    public ResponseEntity<RiskProfile> profile() {
        return ResponseEntity.ok(generationService.profile());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
