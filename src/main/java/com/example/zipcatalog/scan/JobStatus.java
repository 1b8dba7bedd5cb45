package com.example.zipcatalog.scan;

public enum JobStatus {
    SUCCEEDED,
    FAILED,
    CANCELLED
}
