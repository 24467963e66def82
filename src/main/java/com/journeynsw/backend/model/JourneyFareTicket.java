package com.journeynsw.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class JourneyFareTicket {

    String id;
    String name;
    String comment;
    FarePerson person;
    String priceLevel;
    BigDecimal priceBrutto;

    @Builder
    @JsonCreator
    public JourneyFareTicket(
            @JsonProperty("id") @NonNull String id,
            @JsonProperty("name") @NonNull String name,
            @JsonProperty("comment") @NonNull String comment,
            @JsonProperty("person") @NonNull FarePerson person,
            @JsonProperty("priceLevel") String priceLevel,
            @JsonProperty("priceBrutto") @NonNull BigDecimal priceBrutto) {
        this.id = id;
        this.name = name;
        this.comment = comment;
        this.person = person;
        this.priceLevel = priceLevel;
        this.priceBrutto = priceBrutto;
    }
}
