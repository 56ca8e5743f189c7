package htnlint.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Edge(String from, String to, @JsonProperty("type") String kind) {

    public static final String CALLS = "calls";
}
