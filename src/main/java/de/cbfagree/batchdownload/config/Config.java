package de.cbfagree.batchdownload.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import de.cbfagree.batchdownload.config.ConfigException.EMsgId;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

/**
 * Die Wurzel der Konfiguration. Alle drei Sektionen sind Pflicht.
 */
@Getter(AccessLevel.PUBLIC)
@ToString
public class Config
{
    @JsonProperty("files")
    private FilesConfig files;

    @JsonProperty("network")
    private NetworkConfig network;

    @JsonProperty("settings")
    private SettingsConfig settings;

    public void validate() throws ConfigException
    {
        if (this.files == null)
        {
            throw new ConfigException(EMsgId.ERR_MISSING_SECTION, "files");
        }

        if (this.network == null)
        {
            throw new ConfigException(EMsgId.ERR_MISSING_SECTION, "network");
        }

        if (this.settings == null)
        {
            throw new ConfigException(EMsgId.ERR_MISSING_SECTION, "settings");
        }

        this.files.validate();
        this.network.validate();
        this.settings.validate();
    }
}
