package de.cbfagree.batchdownload.download;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import de.cbfagree.batchdownload.download.DownloadException.EMsgId;
import de.cbfagree.batchdownload.download.ResumePlan.EResumeMode;

/**
 * Entscheidet anhand der lokalen Datei und der entfernten Metadaten ab
 * welcher Position ein Download (fort)gesetzt wird.
 *
 * <ul>
 * <li>lokal mindestens so groß wie die bekannte entfernte Größe: fertig, kein Request
 * <li>keine lokale Datei: ab 0
 * <li>Range-Support, bekannte Größe, lokal kleiner: ab der lokalen Größe
 * <li>sonst: ab 0, die lokale Datei wird verworfen
 * </ul>
 *
 * Ohne bekannte Gesamtgröße wird nie fortgesetzt, da sich dann nicht prüfen
 * lässt ob das Ergebnis vollständig ist.
 */
public class ResumePlanner
{
    /**
     * @param destination
     * @param remote
     * @param resumeAllowed <code>false</code> nachdem der Server einen Range-Request ignoriert hat
     * @return
     * @throws DownloadException wenn die lokale Datei nicht untersucht werden kann
     */
    public ResumePlan plan(Path destination, RemoteMetadata remote, boolean resumeAllowed) throws DownloadException
    {
        long localSize = this.localSize(destination);
        if (localSize < 0)
        {
            return new ResumePlan(EResumeMode.FRESH, 0L, 0L);
        }

        if (remote.isLengthKnown() && localSize >= remote.contentLength())
        {
            return new ResumePlan(EResumeMode.ALREADY_COMPLETE, remote.contentLength(), localSize);
        }

        if (resumeAllowed && remote.acceptsRanges() && remote.isLengthKnown() && localSize > 0)
        {
            return new ResumePlan(EResumeMode.RESUME, localSize, localSize);
        }
        return new ResumePlan(EResumeMode.RESTART, 0L, localSize);
    }

    /**
     * @return die Größe oder -1 wenn die Datei nicht existiert
     */
    private long localSize(Path destination) throws DownloadException
    {
        if (!Files.exists(destination))
        {
            return -1L;
        }

        if (!Files.isRegularFile(destination))
        {
            throw new DownloadException(EFailureKind.FILE_SYSTEM, EMsgId.ERR_INSPECT_FILE, destination, "not a regular file");
        }

        try
        {
            return Files.size(destination);
        }
        catch (IOException e)
        {
            throw new DownloadException(e, EFailureKind.FILE_SYSTEM, EMsgId.ERR_INSPECT_FILE, destination, e.toString());
        }
    }
}
