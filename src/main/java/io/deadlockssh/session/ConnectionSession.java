package io.deadlockssh.session;

import io.netty.buffer.ByteBuf;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static java.util.Objects.isNull;
import static java.util.Objects.nonNull;

/**
 * State of one accepted socket. Confined to the channel's event loop, so it needs no synchronization.
 */
@Getter
@ToString(exclude = "capture")
public class ConnectionSession {
    private final String address;
    private final int port;
    private final Instant startedAt;
    private final int maxInputLength;
    private final Clock clock;

    private long connectionCount;
    private Duration assignedDelay = Duration.ZERO;
    private long bytesSent;
    private long bytesReceived;
    private boolean inputTruncated;
    private SessionPhase phase = SessionPhase.LIMBO;
    private Instant endedAt;
    private SessionOutcome outcome;

    private final ByteArrayOutputStream capture = new ByteArrayOutputStream();

    public ConnectionSession(@NonNull String address, int port, int maxInputLength, @NonNull Clock clock) {
        this.address = address;
        this.port = port;
        this.maxInputLength = maxInputLength;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void assign(long connectionCount, Duration delay) {
        this.connectionCount = connectionCount;
        this.assignedDelay = delay;
    }

    public void enter(SessionPhase phase) {
        if (this.phase != SessionPhase.CLOSED) {
            this.phase = phase;
        }
    }

    public void sent(int bytes) {
        bytesSent += bytes;
    }

    /**
     * Counts every received byte but keeps at most {@code maxInputLength} of them.
     */
    public void received(ByteBuf data) {
        var readable = data.readableBytes();
        bytesReceived += readable;
        var room = maxInputLength - capture.size();
        if (room > 0) {
            var kept = Math.min(room, readable);
            var bytes = new byte[kept];
            data.getBytes(data.readerIndex(), bytes);
            capture.writeBytes(bytes);
        }
        if (readable > room) {
            inputTruncated = true;
        }
    }

    public byte[] capturedInput() {
        return capture.toByteArray();
    }

    /**
     * Records the terminal state. Only the first call counts.
     *
     * @return {@code false} when the session had already finished
     */
    public boolean finish(@NonNull SessionOutcome outcome) {
        if (nonNull(this.outcome)) {
            return false;
        }
        this.outcome = outcome;
        this.endedAt = clock.instant();
        this.phase = SessionPhase.CLOSED;

        return true;
    }

    public boolean isFinished() {
        return nonNull(outcome);
    }

    public Duration duration() {
        return Duration.between(startedAt, isNull(endedAt) ? clock.instant() : endedAt);
    }
}
