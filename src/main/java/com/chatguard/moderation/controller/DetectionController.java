package com.chatguard.moderation.controller;

import com.chatguard.moderation.engine.EvaluationCancelledException;
import com.chatguard.moderation.engine.EvaluationException;
import com.chatguard.moderation.model.ContentMessage;
import com.chatguard.moderation.model.DetectionDecision;
import com.chatguard.moderation.repository.DetectionDecisionRepository;
import com.chatguard.moderation.service.DetectionService;
import com.chatguard.moderation.service.TrainingCorpusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/messages")
@Tag(name = "Detection", description = "Submit messages for spam evaluation and query detection decisions")
public class DetectionController {

    private final DetectionService detectionService;
    private final DetectionDecisionRepository decisionRepository;
    private final TrainingCorpusService corpusService;

    public DetectionController(DetectionService detectionService,
                               DetectionDecisionRepository decisionRepository,
                               TrainingCorpusService corpusService) {
        this.detectionService = detectionService;
        this.decisionRepository = decisionRepository;
        this.corpusService = corpusService;
    }

    @Operation(summary = "Evaluate a message for spam",
            description = "Runs every applicable check, scores the results and acts on the decision " +
                    "(review queue or automatic ban) unless training mode is on. " +
                    "Returns the decision with its per-check breakdown.")
    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(@RequestBody ContentMessage message) {
        if (message.getMessageId() == null || message.getCommunityId() == null || message.getAccountId() == null) {
            return ResponseEntity.badRequest().body(Map.of(
                    "error", "messageId, communityId and accountId are required"));
        }
        if (message.getText() == null) {
            message.setText("");
        }

        try {
            DetectionDecision decision = detectionService.evaluate(message);
            return ResponseEntity.ok(decision);
        } catch (EvaluationCancelledException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", "Evaluation cancelled"));
        } catch (EvaluationException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Get the latest decision for a message",
            description = "Returns the decision of the highest evaluated edit version.")
    @GetMapping("/{messageId}/decision")
    public ResponseEntity<DetectionDecision> getLatestDecision(
            @Parameter(description = "Message ID", example = "-1001234567890:4711")
            @PathVariable String messageId) {
        DetectionDecision decision = decisionRepository.findLatestByMessageId(messageId);
        if (decision == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(decision);
    }

    @Operation(summary = "Get every decision recorded for a message",
            description = "One decision per evaluated edit version, newest version first.")
    @GetMapping("/{messageId}/decisions")
    public ResponseEntity<List<DetectionDecision>> getDecisionHistory(
            @Parameter(description = "Message ID", example = "-1001234567890:4711")
            @PathVariable String messageId) {
        return ResponseEntity.ok(decisionRepository.findHistory(messageId));
    }

    @Operation(summary = "Include or exclude a decision from the training corpus")
    @PutMapping("/decisions/{decisionId}/training-eligibility")
    public ResponseEntity<?> setTrainingEligibility(
            @Parameter(description = "Decision ID", example = "-1001234567890:4711:v0")
            @PathVariable String decisionId,
            @RequestBody Map<String, Object> body) {
        Object eligible = body.get("eligible");
        if (!(eligible instanceof Boolean flag)) {
            return ResponseEntity.badRequest().body(Map.of("error", "eligible must be true or false", "field", "eligible"));
        }
        if (!corpusService.setEligibility(decisionId, flag)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("decisionId", decisionId, "eligible", flag));
    }
}
