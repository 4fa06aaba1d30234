package de.conciso.circulargraph.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CorpusEntry(
        @JsonProperty("circular_no") String circularNo,
        String title,
        @JsonProperty("text_file") String textFile
) {}
