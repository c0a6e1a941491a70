package de.cbfagree.batchdownload.download;

/**
 * Das Ergebnis eines erfolgreichen {@link RangeFetcher#fetch}.
 *
 * @param bytesWritten die in diesem Fetch geschriebenen Bytes
 * @param statusCode 200 oder 206
 */
public record FetchResult(//
    long bytesWritten, //
    int statusCode)
{

}
