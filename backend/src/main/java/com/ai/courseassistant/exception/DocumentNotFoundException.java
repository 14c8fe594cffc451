package com.ai.courseassistant.exception;

public class DocumentNotFoundException extends CourseAssistantException {

    public DocumentNotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
