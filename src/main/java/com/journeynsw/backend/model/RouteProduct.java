package com.journeynsw.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class RouteProduct {

    String name;
    @JsonProperty("class")
    RouteProductClass klass;
    int iconId;

    @Builder
    @JsonCreator
    public RouteProduct(
            @JsonProperty("name") @NonNull String name,
            @JsonProperty("class") @NonNull RouteProductClass klass,
            @JsonProperty("iconId") @NonNull Integer iconId) {
        this.name = name;
        this.klass = klass;
        this.iconId = iconId;
    }
}
