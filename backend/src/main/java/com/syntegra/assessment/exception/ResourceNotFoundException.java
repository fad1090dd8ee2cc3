package com.syntegra.assessment.exception;

public class ResourceNotFoundException extends AssessmentException {

    public ResourceNotFoundException(String resource, String id) {
        super(ErrorKind.NOT_FOUND, resource + " not found: " + id);
    }
}
