package de.cbfagree.batchdownload.download;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import de.cbfagree.batchdownload.config.FilesConfig;
import de.cbfagree.batchdownload.download.DownloadException.EMsgId;

/**
 * Bildet eine URL auf die Ziel-Datei im Download-Verzeichnis ab.
 *
 * Der Dateiname ist das letzte Segment des URL-Pfades. Beginnt er mit einem
 * der konfigurierten Prefixe gefolgt von '_', so landet die Datei im
 * gleichnamigen Unterverzeichnis.
 *
 * Jeder Pfad wird pro Lauf nur einmal vergeben, zwei Tasks schreiben also
 * niemals in dieselbe Datei.
 */
class DestinationResolver
{
    private final Path downloadsFolder;
    private final List<String> subfolderPrefixes;
    private final Set<Path> claimed = ConcurrentHashMap.newKeySet();

    DestinationResolver(FilesConfig cfg)
    {
        this.downloadsFolder = cfg.getDownloadsFolder().toPath().toAbsolutePath().normalize();
        this.subfolderPrefixes = List.copyOf(cfg.getSubfolderPrefixes());
    }

    /**
     * @param url so wie sie in der URL-Liste steht
     * @return
     * @throws DownloadException
     */
    DownloadTarget resolve(String url) throws DownloadException
    {
        URI uri = this.parse(url);
        String fileName = this.fileName(uri, url);

        Path folder = this.downloadsFolder;
        String subfolder = this.subfolderFor(fileName);
        if (subfolder != null)
        {
            folder = folder.resolve(subfolder);
        }

        Path destination = folder.resolve(fileName);
        if (!this.claimed.add(destination))
        {
            throw new DownloadException(EFailureKind.FILE_SYSTEM, EMsgId.ERR_DESTINATION_CLAIMED, url, destination);
        }

        try
        {
            Files.createDirectories(folder);
            return new DownloadTarget(uri.toURL(), destination);
        }
        catch (MalformedURLException e)
        {
            throw new DownloadException(e, EFailureKind.INVALID_URL, EMsgId.ERR_INVALID_URL, url, e.getMessage());
        }
        catch (IOException e)
        {
            throw new DownloadException(e, EFailureKind.FILE_SYSTEM, EMsgId.ERR_CREATE_FOLDER, folder, e.toString());
        }
    }

    /**
     * Parse die URL. Nicht erlaubte Zeichen (z.B. Leerzeichen) werden dabei
     * encoded.
     */
    private URI parse(String url) throws DownloadException
    {
        URI uri;
        try
        {
            uri = new URI(url);
        }
        catch (URISyntaxException e)
        {
            uri = this.encode(url);
        }

        String scheme = uri.getScheme();
        if (!uri.isAbsolute() || uri.getHost() == null
            || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)))
        {
            throw new DownloadException(EFailureKind.INVALID_URL, EMsgId.ERR_INVALID_URL, url, "no absolute http(s) url");
        }
        return uri;
    }

    private URI encode(String url) throws DownloadException
    {
        try
        {
            URL raw = new URL(url);
            return new URI(raw.getProtocol(), raw.getUserInfo(), raw.getHost(), raw.getPort(), raw.getPath(), raw.getQuery(), raw.getRef());
        }
        catch (MalformedURLException | URISyntaxException e)
        {
            throw new DownloadException(e, EFailureKind.INVALID_URL, EMsgId.ERR_INVALID_URL, url, e.getMessage());
        }
    }

    private String fileName(URI uri, String url) throws DownloadException
    {
        String path = uri.getPath();
        String name = path == null ? "" : path.substring(path.lastIndexOf('/') + 1);
        if (name.isBlank() || name.equals(".") || name.equals("..") || name.contains("\\"))
        {
            throw new DownloadException(EFailureKind.INVALID_URL, EMsgId.ERR_NO_FILE_NAME, url);
        }
        return name;
    }

    private String subfolderFor(String fileName)
    {
        for (String prefix : this.subfolderPrefixes)
        {
            if (fileName.startsWith(prefix + "_"))
            {
                return prefix;
            }
        }
        return null;
    }
}
