package de.cbfagree.batchdownload;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;

import de.cbfagree.batchdownload.config.Config;
import de.cbfagree.batchdownload.config.ConfigException;
import de.cbfagree.batchdownload.config.ConfigReader;
import de.cbfagree.batchdownload.download.DownloadSummary;
import de.cbfagree.batchdownload.download.WorkerPool;
import de.cbfagree.batchdownload.input.UrlListReader;
import de.cbfagree.batchdownload.messages.MsgFactory;
import lombok.extern.log4j.Log4j2;

/**
 * Die Haupt-Klasse des Batch-Downloaders.
 *
 * Im wesentlichen wird die Konfiguration und die URL-Liste gelesen, der
 * WorkerPool hoch gezogen und der Exit-Code aus der Summary abgeleitet.
 *
 * <ul>
 * <li>0: alle Downloads erfolgreich
 * <li>1: mindestens ein Download fehlgeschlagen oder abgebrochen
 * <li>2: Konfigurations- oder Start-Fehler
 * </ul>
 */
@Log4j2
public class BatchDownloadMain
{
    static final int EXIT_OK = 0;
    static final int EXIT_DOWNLOAD_FAILED = 1;
    static final int EXIT_STARTUP_FAILED = 2;

    static final String LOG_FILE_PROPERTY = "batchdownload.logFile";
    private static final String DEFAULT_LOG_FILE = "download.log";

    /**
     * @param cfgFile
     * @return der Exit-Code
     */
    int run(File cfgFile)
    {
        try
        {
            Config cfg = new ConfigReader().readConfig(cfgFile);
            log.info(MsgFactory.get(BatchDownloadMain.class, EMsgIds.INF_START_WITH_CFG, cfg));

            List<String> urls = new UrlListReader().read(cfg.getFiles().getInputFile().toPath());
            WorkerPool pool = new WorkerPool(cfg, new LoggingProgressReporter(urls.size()));

            // Ctrl-C: laufende Downloads sauber abbrechen, die Teil-Dateien bleiben liegen
            Thread stopHook = new Thread(pool::stop, "download-stop-hook");
            Runtime.getRuntime().addShutdownHook(stopHook);

            DownloadSummary summary = pool.run(urls);
            this.removeHook(stopHook);

            if (summary.isSuccessful())
            {
                log.info(MsgFactory.get(BatchDownloadMain.class, EMsgIds.INF_ALL_DONE, summary.completed()));
                return EXIT_OK;
            }
            log.error(MsgFactory.get(BatchDownloadMain.class, EMsgIds.ERR_SOME_FAILED, summary.failed() + summary.notDispatched(), summary.total()));
            return EXIT_DOWNLOAD_FAILED;
        }
        catch (ConfigException | IOException e)
        {
            log.error(MsgFactory.get(BatchDownloadMain.class, EMsgIds.ERR_STARTUP, e.getMessage()), e);
            return EXIT_STARTUP_FAILED;
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            log.error(MsgFactory.get(BatchDownloadMain.class, EMsgIds.ERR_INTERRUPTED));
            return EXIT_DOWNLOAD_FAILED;
        }
    }

    private void removeHook(Thread hook)
    {
        try
        {
            Runtime.getRuntime().removeShutdownHook(hook);
        }
        catch (IllegalStateException e)
        {
            // die JVM fährt bereits herunter, der Hook läuft dann ohnehin
            log.debug(MsgFactory.get(BatchDownloadMain.class, EMsgIds.DBG_SHUTDOWN_IN_PROGRESS));
        }
    }

    /**
     * @param args
     */
    public static void main(String[] args)
    {
        Options opts = BatchDownloadMain.createOptions();
        CommandLine cmdLine;
        try
        {
            cmdLine = new DefaultParser().parse(opts, args);
        }
        catch (ParseException e)
        {
            System.err.println(e.getMessage());
            new HelpFormatter().printHelp("batch-downloader", opts, true);
            System.exit(EXIT_STARTUP_FAILED);
            return;
        }

        BatchDownloadMain.configureLogFile(cmdLine.getOptionValue("logFile", DEFAULT_LOG_FILE));

        int exitCode = new BatchDownloadMain().run(new File(cmdLine.getOptionValue("cfgFile")));
        LogManager.shutdown();
        System.exit(exitCode);
    }

    /**
     * Log4j ist beim Laden dieser Klasse bereits initialisiert, also nach dem
     * Setzen der Property neu konfigurieren.
     *
     * @param logFile
     */
    static void configureLogFile(String logFile)
    {
        System.setProperty(LOG_FILE_PROPERTY, logFile);
        ((LoggerContext) LogManager.getContext(false)).reconfigure();
    }

    static Options createOptions()
    {
        Options opts = new Options();

        opts.addOption(Option.builder("c") //
            .longOpt("cfgFile") //
            .hasArg(true) //
            .desc("Der Pfad zum Konfigurations-File. Die Angabe ist verpflichtend, oder verwende '--cfgFile'") //
            .required(true) //
            .build());

        opts.addOption(Option.builder("l") //
            .longOpt("logFile") //
            .hasArg(true) //
            .desc("Der Pfad zum Log-File. Die Angabe ist optional, Default ist 'download.log'") //
            .required(false) //
            .build());

        return opts;
    }

    /**
     *
     */
    private static enum EMsgIds
    {
        INF_START_WITH_CFG, //
        INF_ALL_DONE, //
        ERR_SOME_FAILED, //
        ERR_STARTUP, //
        ERR_INTERRUPTED, //
        DBG_SHUTDOWN_IN_PROGRESS
    }
}
