package io.deadlockssh.tarpit;

import io.deadlockssh.config.TarpitConf;
import io.deadlockssh.event.EventSink;
import io.deadlockssh.ledger.OffenseLedger;
import io.deadlockssh.policy.DelayPolicy;
import lombok.Getter;
import lombok.NonNull;

import java.time.Clock;
import java.util.List;

import static io.deadlockssh.constant.TarpitConstant.BANNER_LINE_END;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.stream.Collectors.toUnmodifiableList;

/**
 * Everything a session handler shares with the listener. Built once per server.
 */
@Getter
public class TarpitContext {
    private final TarpitConf conf;
    private final OffenseLedger ledger;
    private final DelayPolicy delayPolicy;
    private final EventSink eventSink;
    private final TarpitStats stats;
    private final DrainSignal drainSignal;
    private final Clock clock;
    private final List<byte[]> bannerUnits;

    public TarpitContext(
            @NonNull TarpitConf conf,
            @NonNull OffenseLedger ledger,
            @NonNull EventSink eventSink,
            @NonNull TarpitStats stats,
            @NonNull Clock clock
    ) {
        this.conf = conf;
        this.ledger = ledger;
        this.delayPolicy = new DelayPolicy(conf);
        this.eventSink = eventSink;
        this.stats = stats;
        this.drainSignal = new DrainSignal();
        this.clock = clock;
        this.bannerUnits = bannerUnits(conf.getSshBanner());
    }

    /**
     * Splits the banner line into the units sent one at a time: the UTF-8 bytes of each code point.
     */
    static List<byte[]> bannerUnits(String banner) {
        return (banner + BANNER_LINE_END).codePoints()
                .mapToObj(codePoint -> new String(Character.toChars(codePoint)).getBytes(UTF_8))
                .collect(toUnmodifiableList());
    }
}
