package io.deadlockssh.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AddressStat {
    @JsonProperty("address")
    String address;
    @JsonProperty("connection_count")
    long connectionCount;
    @JsonProperty("current_delay_seconds")
    double currentDelaySeconds;
    @JsonProperty("first_seen")
    String firstSeen;
    @JsonProperty("last_seen")
    String lastSeen;
}
