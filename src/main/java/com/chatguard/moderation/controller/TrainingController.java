package com.chatguard.moderation.controller;

import com.chatguard.moderation.engine.checks.BayesCheck;
import com.chatguard.moderation.engine.checks.SimilarityCheck;
import com.chatguard.moderation.model.Actor;
import com.chatguard.moderation.model.AuditAction;
import com.chatguard.moderation.model.DetectionDecision;
import com.chatguard.moderation.model.TrainingLabel;
import com.chatguard.moderation.model.TrainingSample;
import com.chatguard.moderation.repository.DetectionDecisionRepository;
import com.chatguard.moderation.service.AuditService;
import com.chatguard.moderation.service.TrainingCorpusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/training")
@Tag(name = "Training", description = "Training corpus labels and model refresh for the learning checks")
public class TrainingController {

    private final TrainingCorpusService corpusService;
    private final DetectionDecisionRepository decisionRepository;
    private final AuditService auditService;
    private final BayesCheck bayesCheck;
    private final SimilarityCheck similarityCheck;

    public TrainingController(TrainingCorpusService corpusService,
                              DetectionDecisionRepository decisionRepository,
                              AuditService auditService,
                              BayesCheck bayesCheck,
                              SimilarityCheck similarityCheck) {
        this.corpusService = corpusService;
        this.decisionRepository = decisionRepository;
        this.auditService = auditService;
        this.bayesCheck = bayesCheck;
        this.similarityCheck = similarityCheck;
    }

    @Operation(summary = "Get training corpus statistics",
            description = "Sample counts per label and source, after bounding and de-duplication.")
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(corpusService.stats());
    }

    @Operation(summary = "Label a decision's message",
            description = "Stores an explicit SPAM or HAM sample, replacing any automatic one.")
    @PostMapping("/decisions/{decisionId}/label")
    public ResponseEntity<?> label(
            @Parameter(description = "Decision ID", example = "-1001234567890:4711:v0")
            @PathVariable String decisionId,
            @RequestBody Map<String, Object> body) {
        Object label = body.get("label");
        Object text = body.get("text");
        Object labeledBy = body.get("labeledBy");
        if (label == null) return ResponseEntity.badRequest().body(Map.of("error", "label is required", "field", "label"));
        if (text == null || text.toString().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "text is required", "field", "text"));
        }
        if (labeledBy == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "labeledBy is required", "field", "labeledBy"));
        }

        TrainingLabel trainingLabel;
        try {
            trainingLabel = TrainingLabel.valueOf(label.toString().toUpperCase());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "label must be SPAM or HAM", "field", "label"));
        }

        DetectionDecision decision = decisionRepository.findById(decisionId);
        if (decision == null) {
            return ResponseEntity.notFound().build();
        }

        Actor labeler = Actor.admin(labeledBy.toString());
        TrainingSample sample = corpusService.label(decisionId, text.toString(), trainingLabel,
                decision.getCommunityId(), labeler.asString());
        auditService.record(labeler, decision.getAccountId(), AuditAction.TRAINING_LABEL_CHANGED,
                trainingLabel.name(), "decision=" + decisionId, decision.getCommunityId());
        return ResponseEntity.ok(sample);
    }

    @Operation(summary = "Retrain the learning checks now",
            description = "Rebuilds the Bayes model and the similarity index from the current corpus.")
    @PostMapping("/retrain")
    public ResponseEntity<Map<String, Object>> retrain() {
        bayesCheck.refreshModel();
        similarityCheck.refreshModel();
        return getStats();
    }
}
