package de.cbfagree.batchdownload.config;

import java.io.File;
import java.io.IOException;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import de.cbfagree.batchdownload.config.ConfigException.EMsgId;

/**
 * Liest die JSON-Konfiguration. Kommentare im Java-Stil sind erlaubt,
 * unbekannte Properties führen zum Abbruch.
 */
public class ConfigReader
{
    /**
     *
     * @param cfgFile
     * @return die bereits validierte Config
     * @throws ConfigException
     */
    public Config readConfig(File cfgFile) throws ConfigException
    {
        try
        {
            ObjectMapper objectMapper = JsonMapper.builder() //
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS) //
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES) //
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES) //
                .build();

            Config cfg = objectMapper.readValue(cfgFile, Config.class);
            if (cfg == null)
            {
                throw new ConfigException(EMsgId.ERR_MISSING_SECTION, "files");
            }
            cfg.validate();

            return cfg;
        }
        catch (IOException e)
        {
            throw new ConfigException(e, EMsgId.ERR_LOAD_CONFIG, cfgFile);
        }
    }
}
