package de.cbfagree.batchdownload.config;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import de.cbfagree.batchdownload.config.ConfigException.EMsgId;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

/**
 * Das Config-Objekt für die HTTP-Verbindungen. Timeouts in Sekunden.
 */
@Getter(AccessLevel.PUBLIC)
@ToString
public class NetworkConfig
{
    private static final String NO_PROXY = "NONE";

    @JsonProperty("connectTimeout")
    private int connectTimeout = 10;

    @JsonProperty("readTimeout")
    private int readTimeout = 30;

    /**
     * "host:port" oder "NONE"
     */
    @JsonProperty("httpProxy")
    private String httpProxy = NO_PROXY;

    @JsonProperty("userAgent")
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/125.0.0.0 Safari/537.36";

    @JsonProperty("bufferSize")
    @JsonDeserialize(using = HumanReadableSizeDeserializer.class)
    private int bufferSize = 0x10000;

    /**
     * Mindestabstand zweier Progress-Meldungen eines Tasks in Millisekunden
     */
    @JsonProperty("progressInterval")
    private int progressInterval = 500;

    public Duration getConnectTimeoutDuration()
    {
        return Duration.ofSeconds(this.connectTimeout);
    }

    public Duration getReadTimeoutDuration()
    {
        return Duration.ofSeconds(this.readTimeout);
    }

    /**
     * konfiguriere einen Download-Proxy.
     *
     * @return {@link Proxy#NO_PROXY} wenn keiner konfiguriert ist
     */
    public Proxy createProxy()
    {
        Proxy result = Proxy.NO_PROXY;
        if (this.httpProxy != null && !this.httpProxy.equalsIgnoreCase(NO_PROXY))
        {
            String[] parts = this.httpProxy.split(":");
            result = new Proxy(Proxy.Type.HTTP, InetSocketAddress.createUnresolved(parts[0], Integer.parseInt(parts[1])));
        }
        return result;
    }

    /**
     * validiere das Konfigurations-Objekt.
     *
     * @throws ConfigException wenn die Config einen ungültigen Wert enthält
     */
    public void validate() throws ConfigException
    {
        if (this.connectTimeout <= 0)
        {
            throw new ConfigException(EMsgId.ERR_INV_CONN_TO, this.connectTimeout);
        }

        if (this.readTimeout <= 0)
        {
            throw new ConfigException(EMsgId.ERR_INV_READ_TO, this.readTimeout);
        }

        if (this.bufferSize < 1)
        {
            throw new ConfigException(EMsgId.ERR_INV_BUFFER_SIZE, this.bufferSize);
        }

        if (this.progressInterval < 0)
        {
            throw new ConfigException(EMsgId.ERR_INV_PROGRESS_INTERVAL, this.progressInterval);
        }

        this.validateProxy();
    }

    private void validateProxy() throws ConfigException
    {
        if (this.httpProxy == null || this.httpProxy.equalsIgnoreCase(NO_PROXY))
        {
            return;
        }

        String[] parts = this.httpProxy.split(":");
        if (parts.length != 2 || parts[0].isBlank())
        {
            throw new ConfigException(EMsgId.ERR_INV_HTTP_PROXY, this.httpProxy);
        }

        try
        {
            int port = Integer.parseInt(parts[1]);
            if (port <= 0 || port > 65535)
            {
                throw new ConfigException(EMsgId.ERR_INV_HTTP_PROXY, this.httpProxy);
            }
        }
        catch (NumberFormatException e)
        {
            throw new ConfigException(e, EMsgId.ERR_INV_HTTP_PROXY, this.httpProxy);
        }
    }
}
