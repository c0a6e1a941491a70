package de.cbfagree.batchdownload.download;

/**
 * Ein Eintrag in der Queue des {@link WorkerPool}.
 *
 * Da es sich um ein immutable ValueObject handelt ist ein record grade richtig.
 */
record DownloadRequest(//
    int taskId, //
    String url)
{

}
