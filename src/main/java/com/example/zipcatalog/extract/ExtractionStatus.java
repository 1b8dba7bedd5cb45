package com.example.zipcatalog.extract;

public enum ExtractionStatus {
    SUCCESS,
    FAILED
}
