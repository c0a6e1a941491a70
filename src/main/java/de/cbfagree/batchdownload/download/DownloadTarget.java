package de.cbfagree.batchdownload.download;

import java.net.URL;
import java.nio.file.Path;

/**
 * Die normalisierte Request-URL und die Ziel-Datei eines Downloads.
 */
record DownloadTarget(//
    URL requestUrl, //
    Path destination)
{

}
