package de.cbfagree.batchdownload.download;

import java.time.Duration;

/**
 * Das Ergebnis der {@link RetryPolicy} für einen einzelnen Fehlschlag.
 */
public record RetryDecision(//
    boolean shouldRetry, //
    Duration delay)
{
    public static final RetryDecision GIVE_UP = new RetryDecision(false, Duration.ZERO);
}
