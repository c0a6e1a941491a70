package de.cbfagree.batchdownload.testsupport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import de.cbfagree.batchdownload.config.Config;
import de.cbfagree.batchdownload.config.ConfigException;
import de.cbfagree.batchdownload.config.ConfigReader;

/**
 * Schreibt eine Test-Konfiguration samt URL-Liste in ein TempDir und liest
 * sie über den {@link ConfigReader} wieder ein.
 */
public final class TestConfigs
{
    private final Path dir;
    private int maxWorkers = 2;
    private int retryCount = 0;
    private int retryDelay = 0;
    private int connectTimeout = 2;
    private int readTimeout = 5;
    private int progressInterval = 0;
    private String bufferSize = "1kb";
    private List<String> prefixes = new ArrayList<>();
    private List<String> urls = new ArrayList<>();

    private TestConfigs(Path dir)
    {
        this.dir = dir;
    }

    public static TestConfigs in(Path dir)
    {
        return new TestConfigs(dir);
    }

    public TestConfigs maxWorkers(int value)
    {
        this.maxWorkers = value;
        return this;
    }

    public TestConfigs retryCount(int value)
    {
        this.retryCount = value;
        return this;
    }

    public TestConfigs retryDelay(int value)
    {
        this.retryDelay = value;
        return this;
    }

    public TestConfigs readTimeout(int value)
    {
        this.readTimeout = value;
        return this;
    }

    public TestConfigs progressInterval(int value)
    {
        this.progressInterval = value;
        return this;
    }

    public TestConfigs bufferSize(String value)
    {
        this.bufferSize = value;
        return this;
    }

    public TestConfigs subfolderPrefixes(String... values)
    {
        this.prefixes = List.of(values);
        return this;
    }

    public TestConfigs urls(List<String> values)
    {
        this.urls = values;
        return this;
    }

    public Path downloads()
    {
        return this.dir.resolve("downloads");
    }

    public Path inputFile()
    {
        return this.dir.resolve("urls.txt");
    }

    /**
     * @return der Pfad der geschriebenen config.json
     */
    public Path write() throws IOException
    {
        Files.write(this.inputFile(), this.urls, StandardCharsets.UTF_8);

        StringBuilder prefixList = new StringBuilder();
        for (String prefix : this.prefixes)
        {
            prefixList.append(prefixList.length() == 0 ? "" : ", ").append('"').append(prefix).append('"');
        }

        String json = String.join("\n", //
            "// generated by TestConfigs", //
            "{", //
            "  \"files\": {", //
            "    \"downloads\": " + quote(this.downloads()) + ",", //
            "    \"input\": " + quote(this.inputFile()) + ",", //
            "    \"subfolderPrefixes\": [" + prefixList + "]", //
            "  },", //
            "  \"network\": {", //
            "    \"connectTimeout\": " + this.connectTimeout + ",", //
            "    \"readTimeout\": " + this.readTimeout + ",", //
            "    \"bufferSize\": \"" + this.bufferSize + "\",", //
            "    \"progressInterval\": " + this.progressInterval, //
            "  },", //
            "  \"settings\": {", //
            "    \"maxWorkers\": " + this.maxWorkers + ",", //
            "    \"retryCount\": " + this.retryCount + ",", //
            "    \"retryDelay\": " + this.retryDelay, //
            "  }", //
            "}");

        Path cfgFile = this.dir.resolve("config.json");
        Files.writeString(cfgFile, json, StandardCharsets.UTF_8);
        return cfgFile;
    }

    public Config build() throws IOException, ConfigException
    {
        return new ConfigReader().readConfig(this.write().toFile());
    }

    private static String quote(Path path)
    {
        return '"' + path.toAbsolutePath().toString().replace("\\", "\\\\") + '"';
    }
}
