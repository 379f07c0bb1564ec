package com.chatguard.moderation.model;

public enum SampleSource {
    /** Labelled by a human (manual report, review feedback). */
    EXPLICIT,
    /** High-confidence automatic decision. */
    IMPLICIT
}
