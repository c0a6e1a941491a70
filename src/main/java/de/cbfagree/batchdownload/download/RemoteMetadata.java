package de.cbfagree.batchdownload.download;

/**
 * Was die Metadaten-Probe (HEAD) über die entfernte Resource weiss.
 *
 * @param contentLength Gesamtgröße oder {@link TransferState#UNKNOWN}
 * @param acceptsRanges der Server hat Range-Requests nicht per "Accept-Ranges: none" abgelehnt
 * @param lastModified Millis seit Epoch, 0 wenn unbekannt
 */
public record RemoteMetadata(//
    long contentLength, //
    boolean acceptsRanges, //
    long lastModified)
{
    /** Der Server unterstützt oder erlaubt kein HEAD */
    public static final RemoteMetadata UNKNOWN = new RemoteMetadata(TransferState.UNKNOWN, false, 0L);

    public boolean isLengthKnown()
    {
        return this.contentLength >= 0;
    }
}
