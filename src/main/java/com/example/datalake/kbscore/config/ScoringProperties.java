package com.example.datalake.kbscore.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "kb-scoring")
@Validated
public class ScoringProperties {

    private String defaultVertical = "general";
    private final List<String> placeholderMarkers = new ArrayList<>();

    public String getDefaultVertical() {
        return defaultVertical;
    }

    public void setDefaultVertical(String defaultVertical) {
        this.defaultVertical = defaultVertical;
    }

    /** Extra whole-word markers flagged as placeholder content, on top of the built-in list. */
    public List<String> getPlaceholderMarkers() {
        return placeholderMarkers;
    }

    public void setPlaceholderMarkers(List<String> placeholderMarkers) {
        this.placeholderMarkers.clear();
        if (placeholderMarkers != null) {
            this.placeholderMarkers.addAll(placeholderMarkers);
        }
    }
}
