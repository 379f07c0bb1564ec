package com.chatguard.moderation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A review queue item with the decision behind it and the author's moderation history")
public class ReviewQueueDetail {

    private ReviewQueueItem queueItem;

    private DetectionDecision decision;

    private List<ActionRecord> authorActions;
}
