package de.cbfagree.batchdownload.messages;

import java.util.ResourceBundle;

import org.apache.logging.log4j.message.LocalizedMessage;
import org.apache.logging.log4j.message.Message;

/**
 * Erzeuge Log4j2-Messages anhand eines ResourceBundles, einem IdEnum
 * und einer Liste optionaler Parameter.
 *
 * Das Bundle trägt den voll qualifizierten Namen der übergebenen Klasse,
 * zu <code>de.cbfagree.batchdownload.download.DownloadTask</code> gehört
 * also <code>de/cbfagree/batchdownload/download/DownloadTask.properties</code>.
 * Die Patterns verwenden die {@link java.text.MessageFormat}-Syntax.
 */
public class MsgFactory
{
    private MsgFactory()
    {
    }

    /**
     * @param clazz
     * @param key
     * @param args
     * @return
     */
    public static Message get(Class<?> clazz, Enum<?> key, Object... args)
    {
        ResourceBundle bundle = ResourceBundle.getBundle(clazz.getName());
        return new LocalizedMessage(bundle, key.name(), args);
    }

    /**
     * Liefere direkt den formatierten Text, z.B. für Exception-Messages.
     *
     * @param clazz
     * @param key
     * @param args
     * @return
     */
    public static String format(Class<?> clazz, Enum<?> key, Object... args)
    {
        return MsgFactory.get(clazz, key, args).getFormattedMessage();
    }
}
