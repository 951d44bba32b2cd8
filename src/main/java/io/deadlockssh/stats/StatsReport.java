package io.deadlockssh.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class StatsReport {
    @JsonProperty("start_time")
    String startTime;
    @JsonProperty("uptime_seconds")
    long uptimeSeconds;
    @JsonProperty("total_connections")
    long totalConnections;
    @JsonProperty("active_connections")
    int activeConnections;
    @JsonProperty("rejected_connections")
    long rejectedConnections;
    @JsonProperty("distinct_addresses")
    int distinctAddresses;
    @JsonProperty("top_addresses")
    List<AddressStat> topAddresses;
    @JsonProperty("connections_per_ip")
    Map<String, Long> connectionsPerIp;
}
