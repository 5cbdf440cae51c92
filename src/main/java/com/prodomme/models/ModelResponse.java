package com.prodomme.models;

import java.util.List;

/**
 * Vendor-neutral result of one successful provider query.
 */
public final class ModelResponse {

    private final List<ContentItem> content;
    private final String id;
    private final String model;
    private final String role;
    private final String stopReason;
    private final String stopSequence;

    public ModelResponse(List<ContentItem> content, String id, String model, String role,
                         String stopReason, String stopSequence) {
        this.content = content == null ? List.of() : List.copyOf(content);
        this.id = id;
        this.model = model;
        this.role = role;
        this.stopReason = stopReason;
        this.stopSequence = stopSequence;
    }

    public List<ContentItem> getContent() {
        return content;
    }

    public String getId() {
        return id;
    }

    public String getModel() {
        return model;
    }

    public String getRole() {
        return role;
    }

    public String getStopReason() {
        return stopReason;
    }

    /**
     * @return the matched stop sequence, or null when the vendor reported none
     */
    public String getStopSequence() {
        return stopSequence;
    }

    public Message toAssistantMessage() {
        return Message.assistant(content);
    }
}
