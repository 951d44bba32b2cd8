package io.deadlockssh.session;

import io.deadlockssh.MutableClock;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionSessionTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));

    @Test
    void captureIsBoundedButEveryByteIsCounted() {
        var session = new ConnectionSession("10.0.0.1", 50000, 8, clock);

        session.received(Unpooled.copiedBuffer("SSH-2.0-", US_ASCII));
        session.received(Unpooled.copiedBuffer("libssh\r\n", US_ASCII));

        assertEquals(16, session.getBytesReceived());
        assertArrayEquals("SSH-2.0-".getBytes(US_ASCII), session.capturedInput());
        assertTrue(session.isInputTruncated());
    }

    @Test
    void captureAcrossChunks() {
        var session = new ConnectionSession("10.0.0.1", 50000, 1024, clock);

        session.received(Unpooled.copiedBuffer("ro", US_ASCII));
        session.received(Unpooled.copiedBuffer("ot\n", US_ASCII));

        assertEquals("root\n", new String(session.capturedInput(), US_ASCII));
        assertFalse(session.isInputTruncated());
    }

    @Test
    void receivingDoesNotConsumeTheBuffer() {
        var session = new ConnectionSession("10.0.0.1", 50000, 4, clock);
        var buffer = Unpooled.copiedBuffer("abcdef", US_ASCII);

        session.received(buffer);

        assertEquals(6, buffer.readableBytes());
    }

    @Test
    void onlyFirstOutcomeCounts() {
        var session = new ConnectionSession("10.0.0.1", 50000, 1024, clock);
        session.enter(SessionPhase.BANNER);
        clock.advance(Duration.ofSeconds(3));

        assertTrue(session.finish(SessionOutcome.RESET));
        clock.advance(Duration.ofSeconds(3));
        assertFalse(session.finish(SessionOutcome.FORCED));

        assertEquals(SessionOutcome.RESET, session.getOutcome());
        assertEquals(SessionPhase.CLOSED, session.getPhase());
        assertEquals(Duration.ofSeconds(3), session.duration());
    }

    @Test
    void closedSessionStaysClosed() {
        var session = new ConnectionSession("10.0.0.1", 50000, 1024, clock);
        session.finish(SessionOutcome.TIMEOUT);

        session.enter(SessionPhase.LISTENING);

        assertEquals(SessionPhase.CLOSED, session.getPhase());
    }
}
