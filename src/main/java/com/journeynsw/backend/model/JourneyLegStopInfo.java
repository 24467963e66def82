package com.journeynsw.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.ZonedDateTime;

/**
 * Service information (alerts, notices) attached to a leg.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class JourneyLegStopInfo {

    Timestamps timestamps;
    InfoPriority priority;
    String id;
    int version;
    String urlText;
    String url;
    String content;
    String subtitle;

    @Builder
    @JsonCreator
    public JourneyLegStopInfo(
            @JsonProperty("timestamps") Timestamps timestamps,
            @JsonProperty("priority") @NonNull InfoPriority priority,
            @JsonProperty("id") @NonNull String id,
            @JsonProperty("version") @NonNull Integer version,
            @JsonProperty("urlText") String urlText,
            @JsonProperty("url") String url,
            @JsonProperty("content") String content,
            @JsonProperty("subtitle") String subtitle) {
        this.timestamps = timestamps;
        this.priority = priority;
        this.id = id;
        this.version = version;
        this.urlText = urlText;
        this.url = url;
        this.content = content;
        this.subtitle = subtitle;
    }

    @Value
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Timestamps {
        ZonedDateTime creation;
        ZonedDateTime lastModification;

        @JsonCreator
        public Timestamps(
                @JsonProperty("creation") @NonNull ZonedDateTime creation,
                @JsonProperty("lastModification") @NonNull ZonedDateTime lastModification) {
            this.creation = creation;
            this.lastModification = lastModification;
        }
    }
}
