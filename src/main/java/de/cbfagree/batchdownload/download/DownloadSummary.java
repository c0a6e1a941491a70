package de.cbfagree.batchdownload.download;

import java.util.List;

/**
 * Das Gesamt-Ergebnis eines Laufs.
 *
 * @param total Anzahl der URLs
 * @param completed
 * @param failed
 * @param notDispatched nach einem Stop nicht mehr gestartete Requests
 * @param failures die fehlgeschlagenen Transfers in Reihenfolge ihres Abschlusses
 */
public record DownloadSummary(//
    int total, //
    int completed, //
    int failed, //
    int notDispatched, //
    List<TransferState> failures)
{
    public static DownloadSummary empty()
    {
        return new DownloadSummary(0, 0, 0, 0, List.of());
    }

    public boolean isSuccessful()
    {
        return this.failed == 0 && this.notDispatched == 0;
    }
}
