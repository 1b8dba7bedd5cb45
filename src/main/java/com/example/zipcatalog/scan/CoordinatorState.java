package com.example.zipcatalog.scan;

public enum CoordinatorState {
    IDLE,
    PARTITIONING,
    RUNNING,
    MERGING,
    DONE,
    ABORTED
}
