package de.cbfagree.batchdownload.config;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import de.cbfagree.batchdownload.config.ConfigException.EMsgId;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

/**
 * Das Config-Objekt für Ziel-Verzeichnis und URL-Liste
 */
@Getter(AccessLevel.PUBLIC)
@ToString
public class FilesConfig
{
    @JsonProperty("downloads")
    private File downloadsFolder;

    @JsonProperty("input")
    private File inputFile;

    /**
     * Beginnt ein Dateiname mit einem dieser Prefixe gefolgt von einem '_', so
     * landet die Datei im gleichnamigen Unterverzeichnis. "DM_report.pdf" also
     * in "DM/DM_report.pdf".
     */
    @JsonProperty("subfolderPrefixes")
    private List<String> subfolderPrefixes = new ArrayList<>();

    /**
     * @throws ConfigException
     */
    public void validate() throws ConfigException
    {
        if (this.downloadsFolder == null)
        {
            throw new ConfigException(EMsgId.ERR_NO_DOWNLOAD_FOLDER);
        }

        if (this.inputFile == null)
        {
            throw new ConfigException(EMsgId.ERR_NO_INPUT_FILE);
        }

        if (this.subfolderPrefixes == null)
        {
            this.subfolderPrefixes = new ArrayList<>();
        }

        for (String prefix : this.subfolderPrefixes)
        {
            if (prefix == null || prefix.isBlank() || prefix.contains("/") || prefix.contains("\\") || prefix.contains(".."))
            {
                throw new ConfigException(EMsgId.ERR_INV_SUBFOLDER_PREFIX, prefix);
            }
        }
    }
}
