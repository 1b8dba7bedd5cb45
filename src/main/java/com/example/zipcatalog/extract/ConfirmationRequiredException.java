package com.example.zipcatalog.extract;

import com.example.zipcatalog.model.ErrorKind;

public class ConfirmationRequiredException extends ExtractionException {

    public ConfirmationRequiredException(String message) {
        super(ErrorKind.CONFIRMATION_REQUIRED, message);
    }
}
