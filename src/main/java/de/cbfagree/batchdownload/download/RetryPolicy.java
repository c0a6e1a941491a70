package de.cbfagree.batchdownload.download;

import java.time.Duration;

import de.cbfagree.batchdownload.config.SettingsConfig;

/**
 * Entscheidet ob nach einem Fehlschlag ein weiterer Versuch unternommen wird.
 *
 * Nur transiente Fehler werden wiederholt, und zwar solange
 * <code>attempt &lt; retryCount</code> ist. Die Wartezeit ist fix, es gibt
 * kein exponentielles Backoff. Das Warten selbst ist Sache des Aufrufers.
 */
public class RetryPolicy
{
    private final int retryCount;
    private final Duration retryDelay;

    public RetryPolicy(SettingsConfig cfg)
    {
        this(cfg.getRetryCount(), cfg.getRetryDelayDuration());
    }

    public RetryPolicy(int retryCount, Duration retryDelay)
    {
        if (retryCount < 0)
        {
            throw new IllegalArgumentException("retryCount must not be negative: " + retryCount);
        }
        if (retryDelay.isNegative())
        {
            throw new IllegalArgumentException("retryDelay must not be negative: " + retryDelay);
        }
        this.retryCount = retryCount;
        this.retryDelay = retryDelay;
    }

    /**
     * @param attempt die Anzahl bereits erfolgter Wiederholungen, 0 nach dem ersten Versuch
     * @param kind
     * @return
     */
    public RetryDecision decide(int attempt, EFailureKind kind)
    {
        if (!kind.isTransient() || attempt >= this.retryCount)
        {
            return RetryDecision.GIVE_UP;
        }
        return new RetryDecision(true, this.retryDelay);
    }
}
