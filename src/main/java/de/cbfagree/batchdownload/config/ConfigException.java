package de.cbfagree.batchdownload.config;

import de.cbfagree.batchdownload.messages.MsgFactory;

/**
 * Eine ungültige oder nicht lesbare Konfiguration. Die Exception ist
 * immer fatal, es wird kein einziger Download gestartet.
 */
public class ConfigException extends Exception
{
    private static final long serialVersionUID = 1L;

    public ConfigException(EMsgId msgId, Object... args)
    {
        super( //
            MsgFactory.format(ConfigException.class, msgId, args) //
        );
    }

    public ConfigException(Throwable t, EMsgId msgId, Object... args)
    {
        super( //
            MsgFactory.format(ConfigException.class, msgId, args), //
            t //
        );
    }

    public enum EMsgId
    {
        ERR_LOAD_CONFIG, //
        ERR_MISSING_SECTION, //

        ERR_NO_DOWNLOAD_FOLDER, //
        ERR_NO_INPUT_FILE, //
        ERR_INPUT_NOT_A_FILE, //
        ERR_READ_INPUT_FILE, //
        ERR_INV_SUBFOLDER_PREFIX, //

        ERR_INV_CONN_TO, //
        ERR_INV_READ_TO, //
        ERR_INV_HTTP_PROXY, //
        ERR_INV_BUFFER_SIZE, //
        ERR_INV_PROGRESS_INTERVAL, //

        ERR_INV_MAX_WORKERS, //
        ERR_INV_RETRY_COUNT, //
        ERR_INV_RETRY_DELAY, //
    }
}
