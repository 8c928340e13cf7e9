package com.contentcuration.curator.entity;

/**
 * Lifecycle of a content item. Transitions only move forward; PUBLISHED is terminal.
 */
public enum ContentState {
    UNRATED,
    RATED,
    PUBLISHED
}
