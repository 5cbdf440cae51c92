package com.prodomme.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class TextContent extends ContentItem {

    private final String text;

    @JsonCreator
    public TextContent(@JsonProperty("text") String text) {
        this.text = text == null ? "" : text;
    }

    public String getText() {
        return text;
    }

    @Override
    public String describe() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextContent)) return false;
        return text.equals(((TextContent) o).text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }

    @Override
    public String toString() {
        return "Text(" + text + ")";
    }
}
