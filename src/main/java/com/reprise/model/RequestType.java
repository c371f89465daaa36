package com.reprise.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of generation request a cached response answers.
 */
public enum RequestType {
    TEXT_GENERATION("text_generation"),
    CODE_GENERATION("code_generation"),
    IMAGE_ANALYSIS("image_analysis"),
    AUDIO_TRANSCRIPTION("audio_transcription"),
    TRANSLATION("translation"),
    SUMMARIZATION("summarization"),
    QUESTION_ANSWERING("question_answering");

    private final String value;

    RequestType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RequestType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return TEXT_GENERATION;
        }
        for (RequestType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown request type: " + value);
    }
}
