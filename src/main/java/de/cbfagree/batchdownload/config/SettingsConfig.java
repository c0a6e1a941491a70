package de.cbfagree.batchdownload.config;

import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonProperty;

import de.cbfagree.batchdownload.config.ConfigException.EMsgId;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

/**
 * Worker-Pool und Retry-Verhalten
 */
@Getter(AccessLevel.PUBLIC)
@ToString
public class SettingsConfig
{
    @JsonProperty("maxWorkers")
    private int maxWorkers = 4;

    @JsonProperty("retryCount")
    private int retryCount = 3;

    /**
     * Wartezeit zwischen zwei Versuchen in Sekunden. Die Wartezeit ist fix,
     * sie wächst nicht mit der Anzahl der Versuche.
     */
    @JsonProperty("retryDelay")
    private int retryDelay = 5;

    public Duration getRetryDelayDuration()
    {
        return Duration.ofSeconds(this.retryDelay);
    }

    public void validate() throws ConfigException
    {
        if (this.maxWorkers < 1)
        {
            throw new ConfigException(EMsgId.ERR_INV_MAX_WORKERS, this.maxWorkers);
        }

        if (this.retryCount < 0)
        {
            throw new ConfigException(EMsgId.ERR_INV_RETRY_COUNT, this.retryCount);
        }

        if (this.retryDelay < 0)
        {
            throw new ConfigException(EMsgId.ERR_INV_RETRY_DELAY, this.retryDelay);
        }
    }
}
