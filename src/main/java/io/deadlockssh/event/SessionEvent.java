package io.deadlockssh.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.deadlockssh.session.ConnectionSession;
import io.deadlockssh.session.SessionOutcome;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.codec.binary.Hex;

import java.time.Instant;

import static io.deadlockssh.utils.TimeUtils.toSeconds;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.nonNull;

/**
 * Terminal record of one session, emitted exactly once per accepted socket.
 */
@Value
@Builder
public class SessionEvent {
    @JsonProperty("timestamp")
    String timestamp;
    @JsonProperty("address")
    String address;
    @JsonProperty("port")
    int port;
    @JsonProperty("connection_count")
    long connectionCount;
    @JsonProperty("delay_seconds")
    double delaySeconds;
    @JsonProperty("bytes_sent")
    long bytesSent;
    @JsonProperty("bytes_received")
    long bytesReceived;
    @JsonProperty("input")
    String input;
    @JsonProperty("input_hex")
    String inputHex;
    @JsonProperty("input_truncated")
    boolean inputTruncated;
    @JsonProperty("outcome")
    SessionOutcome outcome;
    @JsonProperty("duration_ms")
    long durationMs;

    public static SessionEvent of(ConnectionSession session) {
        var input = session.capturedInput();
        return SessionEvent.builder()
                .timestamp(nonNull(session.getEndedAt()) ? session.getEndedAt().toString() : Instant.now().toString())
                .address(session.getAddress())
                .port(session.getPort())
                .connectionCount(session.getConnectionCount())
                .delaySeconds(toSeconds(session.getAssignedDelay()))
                .bytesSent(session.getBytesSent())
                .bytesReceived(session.getBytesReceived())
                // malformed sequences become U+FFFD
                .input(new String(input, UTF_8))
                .inputHex(Hex.encodeHexString(input))
                .inputTruncated(session.isInputTruncated())
                .outcome(session.getOutcome())
                .durationMs(session.duration().toMillis())
                .build();
    }

    /**
     * Event for a socket closed at accept time. {@code connectionCount} is the address's current count,
     * which rejection does not increment.
     */
    public static SessionEvent rejected(String address, int port, long connectionCount, Instant at) {
        return SessionEvent.builder()
                .timestamp(at.toString())
                .address(address)
                .port(port)
                .connectionCount(connectionCount)
                .input("")
                .inputHex("")
                .outcome(SessionOutcome.REJECTED)
                .build();
    }
}
