package com.chatguard.moderation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Who or what authorized an action")
public class Actor {

    @Schema(description = "Actor type", example = "ADMIN")
    private ActorType type;

    @Schema(description = "Account id for admins, component name otherwise", example = "42")
    private String id;

    public static Actor admin(String accountId) {
        return new Actor(ActorType.ADMIN, accountId);
    }

    public static Actor autoDetection() {
        return new Actor(ActorType.AUTO_DETECTION, "detection-engine");
    }

    public static Actor system(String component) {
        return new Actor(ActorType.SYSTEM, component);
    }

    /** Storage form, e.g. {@code ADMIN:42}. */
    public String asString() {
        return type.name() + ":" + id;
    }

    public static Actor parse(String value) {
        if (value == null || value.isEmpty()) return null;
        int idx = value.indexOf(':');
        if (idx < 0) return new Actor(ActorType.SYSTEM, value);
        return new Actor(ActorType.valueOf(value.substring(0, idx)), value.substring(idx + 1));
    }
}
