package de.cbfagree.batchdownload.input;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import de.cbfagree.batchdownload.config.ConfigException;
import de.cbfagree.batchdownload.config.ConfigException.EMsgId;
import de.cbfagree.batchdownload.messages.MsgFactory;
import lombok.extern.log4j.Log4j2;

/**
 * Liest die URL-Liste: eine URL pro Zeile, Leerzeilen und Zeilen die mit
 * '#' beginnen werden ignoriert. Die Reihenfolge bleibt erhalten, Duplikate
 * werden nicht entfernt.
 */
@Log4j2
public class UrlListReader
{
    private static final String COMMENT_PREFIX = "#";

    /**
     * @param inputFile
     * @return
     * @throws ConfigException wenn die Datei nicht existiert oder nicht lesbar ist
     */
    public List<String> read(Path inputFile) throws ConfigException
    {
        if (!Files.isRegularFile(inputFile))
        {
            throw new ConfigException(EMsgId.ERR_INPUT_NOT_A_FILE, inputFile);
        }

        List<String> urls = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(inputFile, StandardCharsets.UTF_8))
        {
            String line = reader.readLine();
            while (line != null)
            {
                String url = line.strip();
                if (!url.isEmpty() && !url.startsWith(COMMENT_PREFIX))
                {
                    urls.add(url);
                }
                line = reader.readLine();
            }
        }
        catch (IOException e)
        {
            throw new ConfigException(e, EMsgId.ERR_READ_INPUT_FILE, inputFile, e.toString());
        }

        log.info(MsgFactory.get(UrlListReader.class, EMsgIds.INF_URLS_READ, urls.size(), inputFile));
        return urls;
    }

    private enum EMsgIds
    {
        INF_URLS_READ
    }
}
