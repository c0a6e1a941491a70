package de.cbfagree.batchdownload.download;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.FileChannel;

import de.cbfagree.batchdownload.config.NetworkConfig;
import de.cbfagree.batchdownload.download.DownloadException.EMsgId;

/**
 * Führt genau einen GET gegen eine URL aus und streamt den Body in einen
 * FileChannel.
 *
 * Bei einem Offset &gt; 0 wird ein <code>Range: bytes=offset-</code> Header
 * gesendet. Antwortet der Server darauf mit 200 statt 206, so wird nichts
 * geschrieben und ein {@link EFailureKind#RANGE_MISMATCH} gemeldet, der
 * Aufrufer muss dann von vorn beginnen.
 *
 * Der Body wird in Chunks von <code>bufferSize</code> Bytes kopiert, niemals
 * komplett im Speicher gehalten. Connection und FileChannel werden auf jedem
 * Weg aus der Methode heraus geschlossen.
 */
public class RangeFetcher
{
    private static final int HTTP_RANGE_NOT_SATISFIABLE = 416;

    private final HttpConnector connector;
    private final StopSignal stopSignal;
    private final IProgressReporter reporter;
    private final int bufferSize;
    private final long progressIntervalNanos;

    RangeFetcher(HttpConnector connector, NetworkConfig cfg, StopSignal stopSignal, IProgressReporter reporter)
    {
        this.connector = connector;
        this.stopSignal = stopSignal;
        this.reporter = reporter;
        this.bufferSize = cfg.getBufferSize();
        this.progressIntervalNanos = cfg.getProgressInterval() * 1_000_000L;
    }

    /**
     * @param state liefert URL und Zähler, <code>bytesDownloaded</code> muss bereits dem Offset entsprechen
     * @param offset
     * @param out bereits auf den Offset positioniert, wird immer geschlossen
     * @return
     * @throws DownloadException
     */
    public FetchResult fetch(TransferState state, long offset, FileChannel out) throws DownloadException
    {
        URL url = state.getRequestUrl();
        try (FileChannel channel = out)
        {
            if (this.stopSignal.isStopped())
            {
                throw new DownloadException(EFailureKind.CANCELLED, EMsgId.ERR_CANCELLED, url);
            }

            HttpURLConnection conn = this.connector.open(url, "GET");
            if (offset > 0)
            {
                conn.setRequestProperty("Range", String.format("bytes=%1$d-", offset));
            }

            try (StopSignal.Registration reg = this.stopSignal.register(conn::disconnect))
            {
                int statusCode = this.connector.connect(conn);
                this.checkStatus(url, offset, statusCode);

                if (!state.isExpectedKnown() && statusCode == HttpURLConnection.HTTP_OK)
                {
                    state.setBytesExpected(conn.getContentLengthLong());
                }

                long written = this.copyBody(state, conn, channel);
                return new FetchResult(written, statusCode);
            }
            finally
            {
                conn.disconnect();
            }
        }
        catch (IOException e)
        {
            // kann nur noch vom close() des FileChannels kommen
            throw new DownloadException(e, EFailureKind.FILE_SYSTEM, EMsgId.ERR_WRITE_FILE, state.getDestination(), e.toString());
        }
    }

    /**
     * @param url
     * @param offset
     * @param statusCode
     * @throws DownloadException
     */
    private void checkStatus(URL url, long offset, int statusCode) throws DownloadException
    {
        if (statusCode == HTTP_RANGE_NOT_SATISFIABLE)
        {
            throw new DownloadException(EFailureKind.RANGE_MISMATCH, EMsgId.ERR_RANGE_NOT_SATISFIABLE, url, offset);
        }

        if (statusCode < 200 || statusCode >= 300)
        {
            throw new DownloadException(EFailureKind.fromStatusCode(statusCode), EMsgId.ERR_HTTP_STATUS, url, statusCode);
        }

        // Byte-Alignment ist nicht mehr gegeben, also nichts anhängen
        if (offset > 0 && statusCode != HttpURLConnection.HTTP_PARTIAL)
        {
            throw new DownloadException(EFailureKind.RANGE_MISMATCH, EMsgId.ERR_RANGE_IGNORED, url, offset, statusCode);
        }
    }

    /**
     * Kopiere den Body chunk-weise in den Channel.
     *
     * @return die Anzahl geschriebener Bytes
     */
    private long copyBody(TransferState state, HttpURLConnection conn, FileChannel channel) throws DownloadException
    {
        URL url = conn.getURL();
        long written = 0L;
        long lastReport = System.nanoTime();

        try (InputStream in = conn.getInputStream())
        {
            byte[] buffer = new byte[this.bufferSize];
            int read = this.read(in, buffer, url);
            while (read != -1)
            {
                if (state.isExpectedKnown() && state.getBytesDownloaded() + read > state.getBytesExpected())
                {
                    throw new DownloadException(EFailureKind.RANGE_MISMATCH, EMsgId.ERR_SIZE_CHANGED, url, state.getBytesExpected());
                }

                this.write(channel, buffer, read, state);
                written += read;
                state.addBytes(read);

                long now = System.nanoTime();
                if (now - lastReport >= this.progressIntervalNanos)
                {
                    this.reporter.progress(state.getTaskId(), state.getBytesDownloaded(), state.getBytesExpected());
                    lastReport = now;
                }
                read = this.read(in, buffer, url);
            }
        }
        catch (IOException e)
        {
            // getInputStream() oder close()
            throw this.connector.readFailed(e, url);
        }

        this.reporter.progress(state.getTaskId(), state.getBytesDownloaded(), state.getBytesExpected());
        return written;
    }

    private int read(InputStream in, byte[] buffer, URL url) throws DownloadException
    {
        try
        {
            return in.read(buffer);
        }
        catch (IOException e)
        {
            throw this.connector.readFailed(e, url);
        }
    }

    private void write(FileChannel channel, byte[] buffer, int len, TransferState state) throws DownloadException
    {
        try
        {
            ByteBuffer src = ByteBuffer.wrap(buffer, 0, len);
            while (src.hasRemaining())
            {
                channel.write(src);
            }
        }
        catch (ClosedByInterruptException e)
        {
            throw new DownloadException(e, EFailureKind.CANCELLED, EMsgId.ERR_CANCELLED, state.getRequestUrl());
        }
        catch (IOException e)
        {
            throw new DownloadException(e, EFailureKind.FILE_SYSTEM, EMsgId.ERR_WRITE_FILE, state.getDestination(), e.toString());
        }
    }
}
