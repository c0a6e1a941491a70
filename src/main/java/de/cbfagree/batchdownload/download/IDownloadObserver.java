package de.cbfagree.batchdownload.download;

/**
 * Die Download-Worker benachrichtigen einen {@link IDownloadObserver}
 * sobald ein Task einen terminalen Status erreicht hat.
 */
public interface IDownloadObserver
{
    public void downloadFinished(TransferState state);
}
