package de.cbfagree.batchdownload.config;

import java.io.IOException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

/**
 * Dient als JSON-Deserializer für Menschen-lesbare Größen-Angaben.
 *
 * Statt "65536" reicht in der Konfiguration auch "64kb". Ohne Suffix wird
 * der Wert als Anzahl Bytes verwendet. Da das Ergebnis ein int ist, sind
 * nur Suffixe bis "gb" zulässig, ein Überlauf wird als Fehler gemeldet.
 *
 * <pre>
 *  &#64;JsonDeserialize(using = HumanReadableSizeDeserializer.class)
 * </pre>
 */
public class HumanReadableSizeDeserializer extends StdDeserializer<Integer>
{
    private static final long serialVersionUID = 1L;

    // Suffix -> Multiplikator
    private static final Map<String, Integer> suffixToMultiplier = Map.of( //
        "", 1, //
        "b", 1, //
        "kb", 1024, //
        "mb", 1024 * 1024, //
        "gb", 1024 * 1024 * 1024 //
    );

    private static final Pattern PARSER_PATTERN = Pattern.compile("\\s*([0-9]*)\\s*([a-z]*)\\s*");

    public HumanReadableSizeDeserializer()
    {
        super(Integer.class);
    }

    /**
     *
     */
    @Override
    public Integer deserialize(JsonParser jp, DeserializationContext ctxt) throws IOException
    {
        JsonNode node = jp.getCodec().readTree(jp);
        String val = node.asText().toLowerCase();

        Matcher m = PARSER_PATTERN.matcher(val);
        if (!m.matches() || m.group(1).isEmpty())
        {
            return (Integer) ctxt.handleWeirdStringValue(Integer.class, val, "Der Wert enthält keinen numerischen Anteil");
        }

        Integer multiplier = suffixToMultiplier.get(m.group(2));
        if (multiplier == null)
        {
            return (Integer) ctxt.handleWeirdStringValue(Integer.class, val, "Der Suffix '%s' ist ungültig", m.group(2));
        }

        try
        {
            return Math.multiplyExact(Integer.parseInt(m.group(1)), multiplier.intValue());
        }
        catch (ArithmeticException | NumberFormatException e)
        {
            return (Integer) ctxt.handleWeirdStringValue(Integer.class, val, "Der Wert ist zu groß");
        }
    }
}
