package com.chatguard.moderation.model;

public enum TrainingLabel {
    SPAM,
    HAM
}
