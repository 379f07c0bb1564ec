package com.chatguard.moderation.controller;

import com.chatguard.moderation.model.PagedResponse;
import com.chatguard.moderation.model.ReviewFeedbackResult;
import com.chatguard.moderation.model.ReviewQueueDetail;
import com.chatguard.moderation.model.ReviewQueueItem;
import com.chatguard.moderation.model.ReviewStatus;
import com.chatguard.moderation.service.ReviewQueueService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/review")
@Tag(name = "Review Queue", description = "Human review of messages the detector was unsure about")
public class ReviewQueueController {

    private final ReviewQueueService reviewQueueService;

    public ReviewQueueController(ReviewQueueService reviewQueueService) {
        this.reviewQueueService = reviewQueueService;
    }

    @GetMapping("/queue")
    @Operation(summary = "List review queue items",
               description = "Newest first. Filter by status, community or author; paginate with the before cursor.")
    public ResponseEntity<?> getQueueItems(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String communityId,
            @RequestParam(required = false) String accountId,
            @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "Cursor: return items enqueued before this value")
            @RequestParam(required = false) Long before) {
        ReviewStatus reviewStatus = null;
        if (status != null) {
            try {
                reviewStatus = ReviewStatus.valueOf(status.toUpperCase());
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "Unknown status: " + status));
            }
        }
        PagedResponse<ReviewQueueItem> items = reviewQueueService.getQueueItems(
                reviewStatus, communityId, accountId, limit, before);
        return ResponseEntity.ok(items);
    }

    @GetMapping("/queue/{decisionId}")
    @Operation(summary = "Get queue item detail",
               description = "Returns the queue item, its full decision and the author's action history")
    public ResponseEntity<?> getQueueItemDetail(@PathVariable String decisionId) {
        ReviewQueueDetail detail = reviewQueueService.getQueueItemDetail(decisionId);
        if (detail == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(detail);
    }

    @PostMapping("/queue/{decisionId}/feedback")
    @Operation(summary = "Submit a review verdict",
               description = "Mark the message CONFIRMED_SPAM or CONFIRMED_HAM. The verdict becomes an explicit " +
                       "training label; with banAuthor=true a spam verdict also bans the author.")
    public ResponseEntity<?> submitFeedback(@PathVariable String decisionId,
                                            @RequestBody Map<String, Object> body) {
        Object status = body.get("status");
        Object reviewerId = body.get("reviewerId");

        if (status == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "status is required"));
        }
        if (reviewerId == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "reviewerId is required"));
        }

        try {
            ReviewStatus reviewStatus = ReviewStatus.valueOf(status.toString().toUpperCase());
            ReviewFeedbackResult result = reviewQueueService.submitFeedback(decisionId, reviewStatus,
                    reviewerId.toString(), Boolean.TRUE.equals(body.get("banAuthor")));
            if (result.item() == null) {
                return ResponseEntity.notFound().build();
            }
            if (!result.applied()) {
                return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
            }
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/stats")
    @Operation(summary = "Get review queue statistics",
               description = "Returns counts by review status")
    public ResponseEntity<Map<String, Integer>> getStats() {
        return ResponseEntity.ok(reviewQueueService.getQueueStats());
    }
}
