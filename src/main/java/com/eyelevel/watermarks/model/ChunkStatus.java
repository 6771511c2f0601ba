package com.eyelevel.watermarks.model;

/**
 * Defines the states of a single chunk inside one pipeline run.
 */
public enum ChunkStatus {
    PENDING, PROCESSING, COMPLETED, ERROR
}
