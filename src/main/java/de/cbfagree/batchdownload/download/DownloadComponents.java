package de.cbfagree.batchdownload.download;

/**
 * Die von allen Tasks eines Laufs gemeinsam genutzten Komponenten. Alle
 * sind zustandslos bzw. thread-safe.
 */
record DownloadComponents(//
    DestinationResolver resolver, //
    RemoteMetadataProbe probe, //
    ResumePlanner planner, //
    RangeFetcher fetcher, //
    RetryPolicy retryPolicy, //
    StopSignal stopSignal, //
    IProgressReporter reporter)
{

}
