package com.tradegate.access.domain;

import java.util.List;

public class ContentLockedException extends RuntimeException {
    private final String contentId;
    private final List<String> missingPrerequisites;

    public ContentLockedException(String contentId, List<String> missingPrerequisites) {
        super("Content " + contentId + " is locked until prerequisites are completed: " + missingPrerequisites);
        this.contentId = contentId;
        this.missingPrerequisites = List.copyOf(missingPrerequisites);
    }

    public String contentId() {
        return contentId;
    }

    public List<String> missingPrerequisites() {
        return missingPrerequisites;
    }
}
