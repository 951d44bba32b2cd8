package io.deadlockssh;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public enum TarpitExceptionType {
    CONFIG_INVALID(1),
    BIND_FAILED(2),
    STATS_BIND_FAILED(3)
    ;

    /**
     * Process exit status reported when this failure aborts startup.
     */
    private final int exitCode;
}
