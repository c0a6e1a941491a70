package de.cbfagree.batchdownload.download;

import java.net.HttpURLConnection;
import java.net.URL;

import de.cbfagree.batchdownload.download.DownloadException.EMsgId;
import de.cbfagree.batchdownload.messages.MsgFactory;
import lombok.extern.log4j.Log4j2;

/**
 * Ermittelt per HEAD-Request Größe, Range-Support und Last-Modified einer
 * Resource.
 *
 * Die Probe liefert nur Metadaten, über Erfolg oder Misserfolg entscheidet
 * immer der GET. Lehnt der Server den HEAD mit einem 4xx ab (z.B. signierte
 * URLs, die nur für GET gelten), so sind die Metadaten eben unbekannt.
 */
@Log4j2
class RemoteMetadataProbe
{
    private final HttpConnector connector;
    private final StopSignal stopSignal;

    RemoteMetadataProbe(HttpConnector connector, StopSignal stopSignal)
    {
        this.connector = connector;
        this.stopSignal = stopSignal;
    }

    /**
     * @param url
     * @return niemals <code>null</code>, {@link RemoteMetadata#UNKNOWN} wenn
     *         der Server den HEAD nicht unterstützt oder ablehnt
     * @throws DownloadException wenn der Server überlastet oder nicht
     *         erreichbar ist
     */
    RemoteMetadata probe(URL url) throws DownloadException
    {
        HttpURLConnection conn = this.connector.open(url, "HEAD");
        try (StopSignal.Registration reg = this.stopSignal.register(conn::disconnect))
        {
            int statusCode = this.connector.connect(conn);
            if (statusCode == HttpURLConnection.HTTP_NOT_IMPLEMENTED)
            {
                log.debug(MsgFactory.get(RemoteMetadataProbe.class, EMsgIds.HEAD_NOT_SUPPORTED, url, statusCode));
                return RemoteMetadata.UNKNOWN;
            }

            if (statusCode < 200 || statusCode >= 300)
            {
                EFailureKind kind = EFailureKind.fromStatusCode(statusCode);
                if (kind.isTransient())
                {
                    throw new DownloadException(kind, EMsgId.ERR_HTTP_STATUS, url, statusCode);
                }

                // das endgültige Urteil fällt erst beim GET
                log.debug(MsgFactory.get(RemoteMetadataProbe.class, EMsgIds.HEAD_NOT_SUPPORTED, url, statusCode));
                return RemoteMetadata.UNKNOWN;
            }

            RemoteMetadata result = new RemoteMetadata( //
                conn.getContentLengthLong(), //
                this.acceptsRanges(conn.getHeaderField("Accept-Ranges")), //
                conn.getLastModified());

            log.debug(MsgFactory.get(RemoteMetadataProbe.class, EMsgIds.METADATA, url, result.contentLength(), result.acceptsRanges()));
            return result;
        }
        finally
        {
            conn.disconnect();
        }
    }

    /**
     * Ein fehlender Accept-Ranges Header schließt Range-Support nicht aus.
     * Nur ein explizites "none" (oder eine unbekannte Unit) wird als Absage
     * gewertet. Ignoriert der Server den Range dann doch, so greift der
     * RANGE_MISMATCH im {@link DownloadTask}.
     */
    private boolean acceptsRanges(String header)
    {
        return header == null || "bytes".equalsIgnoreCase(header.trim());
    }

    private enum EMsgIds
    {
        HEAD_NOT_SUPPORTED, //
        METADATA
    }
}
