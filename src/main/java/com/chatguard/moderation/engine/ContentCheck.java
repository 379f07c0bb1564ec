package com.chatguard.moderation.engine;

import com.chatguard.moderation.model.CheckConfig;
import com.chatguard.moderation.model.CheckName;
import com.chatguard.moderation.model.CheckResult;

/**
 * Interface for all content checks.
 * Each implementation handles exactly one CheckName.
 */
public interface ContentCheck {

    /**
     * The check this implementation provides.
     */
    CheckName getCheckName();

    /**
     * Score a message.
     *
     * The engine runs checks concurrently and enforces the timeout, so
     * implementations may block on I/O. They should honour thread interruption.
     * Thrown exceptions are turned into a neutral, non-voting result.
     *
     * @param context the message being evaluated
     * @param config  the effective configuration for this check and community
     * @return the verdict; duration and accuracy-only flags are filled in by the engine
     */
    CheckResult evaluate(CheckContext context, CheckConfig config);
}
