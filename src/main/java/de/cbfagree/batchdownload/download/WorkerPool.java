package de.cbfagree.batchdownload.download;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.message.Message;

import de.cbfagree.batchdownload.config.Config;
import de.cbfagree.batchdownload.messages.MsgFactory;
import lombok.extern.log4j.Log4j2;

/**
 * Lädt eine Liste von URLs mit einer festen Anzahl von {@link DownloadWorker}n
 * herunter.
 *
 * Alle URLs werden in Eingabe-Reihenfolge in eine Queue fester Kapazität
 * gestellt, die Worker holen sich daraus ihre Requests. Jeder Request wird
 * genau einmal vergeben. Abgeschlossene Tasks werden in der Reihenfolge ihres
 * Abschlusses an den {@link IProgressReporter} gemeldet.
 */
@Log4j2
public class WorkerPool
{
    private static final long WORKER_JOIN_TIMEOUT = 30000L;

    private final Config cfg;
    private final IProgressReporter reporter;
    private final StopSignal stopSignal;
    private final List<DownloadWorker> workers;

    /**
     * @param cfg
     * @param reporter
     * @throws IOException wenn das Download-Verzeichnis nicht angelegt werden kann
     */
    public WorkerPool(Config cfg, IProgressReporter reporter) throws IOException
    {
        int maxWorkers = cfg.getSettings().getMaxWorkers();
        if (maxWorkers < 1)
        {
            throw new IllegalArgumentException("maxWorkers must be at least 1: " + maxWorkers);
        }

        this.cfg = cfg;
        this.reporter = reporter;
        this.stopSignal = new StopSignal();
        this.workers = new ArrayList<>();
        this.createDownloadsFolder(cfg.getFiles().getDownloadsFolder().toPath());
    }

    /**
     * Lade alle URLs herunter und blockiere bis jeder Task terminal ist.
     *
     * @param urls
     * @return niemals <code>null</code>
     * @throws InterruptedException wenn der aufrufende Thread beim Warten auf
     *         die Worker unterbrochen wird
     */
    public DownloadSummary run(List<String> urls) throws InterruptedException
    {
        if (urls.isEmpty())
        {
            log.info(MsgFactory.get(WorkerPool.class, EMsgIds.INF_NOTHING_TO_DO));
            return DownloadSummary.empty();
        }

        int nrOfWorkers = Math.min(this.cfg.getSettings().getMaxWorkers(), urls.size());
        if (nrOfWorkers < this.cfg.getSettings().getMaxWorkers())
        {
            log.warn(MsgFactory.get(WorkerPool.class, EMsgIds.WARN_REDUCED_WORKERS, nrOfWorkers));
        }

        LinkedBlockingQueue<DownloadRequest> queue = new LinkedBlockingQueue<>(urls.size());
        for (int i = 0; i < urls.size(); ++i)
        {
            queue.add(new DownloadRequest(i + 1, urls.get(i)));
        }

        SummaryCollector collector = new SummaryCollector(this.reporter);
        DownloadComponents components = this.createComponents();

        log.info(MsgFactory.get(WorkerPool.class, EMsgIds.INF_RUN_START, urls.size(), nrOfWorkers));
        List<DownloadWorker> started = this.startWorkers(nrOfWorkers, queue, components, collector);
        for (DownloadWorker worker : started)
        {
            worker.join();
        }

        DownloadSummary summary = collector.toSummary(urls.size());
        this.logSummary(summary);
        return summary;
    }

    /**
     * Das externe Stop-Signal. Laufende Fetches werden abgebrochen, die
     * Teil-Dateien bleiben für einen späteren Lauf liegen. Noch nicht
     * gestartete Requests werden nicht mehr vergeben.
     */
    public void stop()
    {
        log.info(MsgFactory.get(WorkerPool.class, EMsgIds.INF_STOP));
        this.stopSignal.stop();

        List<DownloadWorker> current;
        synchronized (this.workers)
        {
            current = new ArrayList<>(this.workers);
        }

        for (DownloadWorker worker : current)
        {
            if (worker != Thread.currentThread())
            {
                this.shutdownWorker(worker);
            }
        }
    }

    public boolean isStopped()
    {
        return this.stopSignal.isStopped();
    }

    private DownloadComponents createComponents()
    {
        HttpConnector connector = new HttpConnector(this.cfg.getNetwork(), this.stopSignal);
        return new DownloadComponents( //
            new DestinationResolver(this.cfg.getFiles()), //
            new RemoteMetadataProbe(connector, this.stopSignal), //
            new ResumePlanner(), //
            new RangeFetcher(connector, this.cfg.getNetwork(), this.stopSignal, this.reporter), //
            new RetryPolicy(this.cfg.getSettings()), //
            this.stopSignal, //
            this.reporter);
    }

    private List<DownloadWorker> startWorkers(int nrOfWorkers, LinkedBlockingQueue<DownloadRequest> queue,
        DownloadComponents components, IDownloadObserver observer)
    {
        List<DownloadWorker> started = new ArrayList<>(nrOfWorkers);
        synchronized (this.workers)
        {
            this.workers.clear();
            for (int i = 0; i < nrOfWorkers; ++i)
            {
                DownloadWorker worker = new DownloadWorker(i, queue, components, observer);
                this.workers.add(worker);
                started.add(worker);
            }
        }

        for (DownloadWorker worker : started)
        {
            worker.start();
        }
        return started;
    }

    /**
     * @param worker
     */
    private void shutdownWorker(DownloadWorker worker)
    {
        try
        {
            worker.interrupt();
            worker.join(WORKER_JOIN_TIMEOUT);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @throws IOException
     */
    private void createDownloadsFolder(Path folder) throws IOException
    {
        if (!Files.isDirectory(folder))
        {
            log.info(MsgFactory.get(WorkerPool.class, EMsgIds.INF_CREATE_FOLDER, folder.toAbsolutePath()));
            try
            {
                Files.createDirectories(folder);
            }
            catch (IOException e)
            {
                Message msg = MsgFactory.get(WorkerPool.class, EMsgIds.ERR_CREATE_FOLDER, folder.toAbsolutePath(), e.toString());
                log.error(msg);
                throw new IOException(msg.getFormattedMessage(), e);
            }
        }
    }

    private void logSummary(DownloadSummary summary)
    {
        log.info(MsgFactory.get(WorkerPool.class, EMsgIds.INF_SUMMARY, //
            summary.total(), summary.completed(), summary.failed(), summary.notDispatched()));

        for (TransferState failure : summary.failures())
        {
            log.error(MsgFactory.get(WorkerPool.class, EMsgIds.ERR_FAILED_URL, //
                failure.getUrl(), failure.getFailureKind(), failure.getFailureMessage()));
        }
    }

    /**
     * Zählt die terminalen Events aller Worker und reicht sie an den
     * Reporter weiter.
     */
    private static class SummaryCollector implements IDownloadObserver
    {
        private final IProgressReporter reporter;
        private final AtomicInteger completed = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final ConcurrentLinkedQueue<TransferState> failures = new ConcurrentLinkedQueue<>();

        SummaryCollector(IProgressReporter reporter)
        {
            this.reporter = reporter;
        }

        @Override
        public void downloadFinished(TransferState state)
        {
            if (state.getStatus() == ETransferStatus.COMPLETED)
            {
                this.completed.incrementAndGet();
            }
            else
            {
                this.failed.incrementAndGet();
                this.failures.add(state);
            }
            this.reporter.taskFinished(state);
        }

        DownloadSummary toSummary(int total)
        {
            int nrCompleted = this.completed.get();
            int nrFailed = this.failed.get();
            return new DownloadSummary(total, nrCompleted, nrFailed, total - nrCompleted - nrFailed, List.copyOf(this.failures));
        }
    }

    private enum EMsgIds
    {
        INF_NOTHING_TO_DO, //
        WARN_REDUCED_WORKERS, //
        INF_RUN_START, //
        INF_STOP, //
        INF_CREATE_FOLDER, //
        ERR_CREATE_FOLDER, //
        INF_SUMMARY, //
        ERR_FAILED_URL
    }
}
