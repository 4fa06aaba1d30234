package de.conciso.circulargraph.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexEntry(
        @JsonProperty("circular_no") String circularNo,
        String title,
        String url
) {}
