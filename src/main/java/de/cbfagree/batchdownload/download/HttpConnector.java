package de.cbfagree.batchdownload.download;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.HttpURLConnection;
import java.net.Proxy;
import java.net.SocketTimeoutException;
import java.net.URL;

import javax.net.ssl.SSLHandshakeException;

import de.cbfagree.batchdownload.config.NetworkConfig;
import de.cbfagree.batchdownload.download.DownloadException.EMsgId;

/**
 * Erzeugt die HttpURLConnections für Metadaten-Probe und Download und
 * übersetzt die dabei auftretenden IOExceptions in {@link DownloadException}s.
 */
class HttpConnector
{
    private final Proxy proxy;
    private final int connTimeout;
    private final int readTimeout;
    private final String userAgent;
    private final StopSignal stopSignal;

    HttpConnector(NetworkConfig cfg, StopSignal stopSignal)
    {
        this.proxy = cfg.createProxy();
        this.connTimeout = Math.toIntExact(cfg.getConnectTimeoutDuration().toMillis());
        this.readTimeout = Math.toIntExact(cfg.getReadTimeoutDuration().toMillis());
        this.userAgent = cfg.getUserAgent();
        this.stopSignal = stopSignal;
    }

    /**
     * @param url
     * @param method GET oder HEAD
     * @return die noch nicht verbundene Connection
     * @throws DownloadException
     */
    HttpURLConnection open(URL url, String method) throws DownloadException
    {
        try
        {
            HttpURLConnection conn = (HttpURLConnection) url.openConnection(this.proxy);
            conn.setRequestMethod(method);
            conn.setRequestProperty("Accept", "*/*");
            if (this.userAgent != null && !this.userAgent.isBlank())
            {
                conn.setRequestProperty("User-Agent", this.userAgent);
            }
            conn.setConnectTimeout(this.connTimeout);
            conn.setReadTimeout(this.readTimeout);
            conn.setUseCaches(false);
            conn.setInstanceFollowRedirects(true);
            return conn;
        }
        catch (IOException e)
        {
            throw this.connectFailed(e, url);
        }
    }

    /**
     * Verbinde und liefere den Status-Code der Response.
     *
     * @param conn
     * @return
     * @throws DownloadException
     */
    int connect(HttpURLConnection conn) throws DownloadException
    {
        try
        {
            conn.connect();
        }
        catch (IOException e)
        {
            throw this.connectFailed(e, conn.getURL());
        }

        try
        {
            return conn.getResponseCode();
        }
        catch (IOException e)
        {
            throw this.readFailed(e, conn.getURL());
        }
    }

    /**
     * Fehler beim Verbindungsaufbau
     */
    DownloadException connectFailed(IOException e, URL url)
    {
        if (this.stopSignal.isStopped())
        {
            return new DownloadException(e, EFailureKind.CANCELLED, EMsgId.ERR_CANCELLED, url);
        }

        // Zertifikat oder Protokoll passen nicht, ein Retry ändert daran nichts
        if (e instanceof SSLHandshakeException)
        {
            return new DownloadException(e, EFailureKind.TLS_FAILED, EMsgId.ERR_TLS, url, e.getMessage());
        }

        // refused, unbekannter Host, connect-timeout usw.
        return new DownloadException(e, EFailureKind.CONNECTION_FAILED, EMsgId.ERR_CONNECT, url, e.toString());
    }

    /**
     * Fehler nachdem die Verbindung stand, also beim Warten auf den Header
     * oder mitten im Body.
     */
    DownloadException readFailed(IOException e, URL url)
    {
        if (this.stopSignal.isStopped() || (e instanceof InterruptedIOException && !(e instanceof SocketTimeoutException)))
        {
            return new DownloadException(e, EFailureKind.CANCELLED, EMsgId.ERR_CANCELLED, url);
        }

        if (e instanceof SSLHandshakeException)
        {
            return new DownloadException(e, EFailureKind.TLS_FAILED, EMsgId.ERR_TLS, url, e.getMessage());
        }

        if (e instanceof SocketTimeoutException)
        {
            return new DownloadException(e, EFailureKind.READ_TIMEOUT, EMsgId.ERR_TIMEOUT, url, this.readTimeout);
        }
        return new DownloadException(e, EFailureKind.READ_TIMEOUT, EMsgId.ERR_READ, url, e.toString());
    }
}
