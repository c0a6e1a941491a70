package de.cbfagree.batchdownload.download;

import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;

import de.cbfagree.batchdownload.download.DownloadException.EMsgId;
import de.cbfagree.batchdownload.download.ResumePlan.EResumeMode;
import de.cbfagree.batchdownload.messages.MsgFactory;
import lombok.extern.log4j.Log4j2;

/**
 * Der komplette Lebenszyklus eines einzelnen Downloads:
 *
 * <pre>
 * PLANNING -&gt; FETCHING -&gt; SUCCEEDED
 *                      -&gt; RETRYING -&gt; FETCHING
 *                      -&gt; FAILED_PERMANENTLY
 * </pre>
 *
 * Vor jedem Versuch werden Metadaten und lokale Datei neu ausgewertet, ein
 * abgebrochener Download wird also auch über Retries hinweg fortgesetzt.
 * Alle Fehler bleiben innerhalb des Tasks, sie landen im {@link TransferState}.
 */
@Log4j2
public class DownloadTask implements Runnable
{
    private final TransferState state;
    private final DownloadComponents components;

    DownloadTask(TransferState state, DownloadComponents components)
    {
        this.state = state;
        this.components = components;
    }

    public TransferState getState()
    {
        return this.state;
    }

    /**
     * Führe den Task bis zu einem terminalen Status aus.
     */
    @Override
    public void run()
    {
        this.state.start();
        this.components.reporter().taskStarted(this.state);
        log.info(MsgFactory.get(DownloadTask.class, EMsgIds.INF_TASK_START, this.state.getTaskId(), this.state.getUrl()));

        try
        {
            DownloadTarget target = this.components.resolver().resolve(this.state.getUrl());
            this.state.assignTarget(target.requestUrl(), target.destination());

            boolean transferred = this.download();
            if (transferred)
            {
                this.applyLastModified();
            }

            this.state.complete();
            log.info(MsgFactory.get(DownloadTask.class, transferred ? EMsgIds.INF_TASK_SUCCESS : EMsgIds.INF_ALREADY_COMPLETE, //
                this.state.getTaskId(), this.state.getUrl(), this.state.getBytesDownloaded(), this.state.getDestination()));
        }
        catch (DownloadException e)
        {
            this.fail(e.getKind(), e.getMessage());
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            this.fail(EFailureKind.CANCELLED, MsgFactory.format(DownloadException.class, EMsgId.ERR_CANCELLED, this.state.getUrl()));
        }
        catch (RuntimeException e)
        {
            log.error(MsgFactory.get(DownloadTask.class, EMsgIds.ERR_UNEXPECTED, this.state.getUrl(), e.toString()), e);
            this.fail(EFailureKind.INTERNAL_ERROR, MsgFactory.format(DownloadException.class, EMsgId.ERR_INTERNAL, this.state.getUrl(), e.toString()));
        }
    }

    /**
     * Die Retry-Schleife.
     *
     * @return <code>false</code> wenn die Datei bereits vollständig war
     */
    private boolean download() throws DownloadException, InterruptedException
    {
        boolean resumeAllowed = true;
        while (true)
        {
            this.checkStopped();
            try
            {
                return this.attempt(resumeAllowed);
            }
            catch (DownloadException e)
            {
                // Ein ignorierter Range-Request zählt nicht als Versuch, es geht
                // sofort ohne Resume von vorn los
                if (e.getKind() == EFailureKind.RANGE_MISMATCH && resumeAllowed)
                {
                    log.warn(MsgFactory.get(DownloadTask.class, EMsgIds.WARN_RANGE_MISMATCH, this.state.getUrl(), e.getMessage()));
                    resumeAllowed = false;
                    continue;
                }

                RetryDecision decision = this.components.retryPolicy().decide(this.state.getAttempt(), e.getKind());
                if (!decision.shouldRetry())
                {
                    throw e;
                }

                log.warn(MsgFactory.get(DownloadTask.class, EMsgIds.WARN_RETRY, //
                    this.state.getUrl(), this.state.getAttempt() + 2, e.getKind(), e.getMessage(), decision.delay().toSeconds()));

                if (!this.components.stopSignal().sleep(decision.delay()))
                {
                    throw new DownloadException(EFailureKind.CANCELLED, EMsgId.ERR_CANCELLED, this.state.getUrl());
                }
                this.state.nextAttempt();
            }
        }
    }

    /**
     * Ein einzelner Versuch: Metadaten holen, planen, fetchen, prüfen.
     *
     * @return <code>false</code> wenn die Datei bereits vollständig war
     */
    private boolean attempt(boolean resumeAllowed) throws DownloadException
    {
        Path destination = this.state.getDestination();
        RemoteMetadata remote = this.components.probe().probe(this.state.getRequestUrl());
        ResumePlan plan = this.components.planner().plan(destination, remote, resumeAllowed);

        this.state.restartFrom(plan.offset());
        this.state.setBytesExpected(remote.contentLength());
        this.state.setRemoteLastModified(remote.lastModified());

        if (plan.isAlreadyComplete())
        {
            return false;
        }

        log.debug(MsgFactory.get(DownloadTask.class, EMsgIds.DBG_PLAN, this.state.getUrl(), plan.mode(), plan.offset(), plan.localSize()));

        FileChannel channel = this.openChannel(destination, plan.offset());
        FetchResult result;
        try
        {
            result = this.components.fetcher().fetch(this.state, plan.offset(), channel);
        }
        catch (DownloadException e)
        {
            if (plan.mode() == EResumeMode.FRESH)
            {
                this.removeEmptyFile(destination, e);
            }
            throw e;
        }

        log.debug(MsgFactory.get(DownloadTask.class, EMsgIds.DBG_FETCHED, //
            this.state.getUrl(), result.statusCode(), result.bytesWritten(), this.state.getBytesDownloaded()));
        this.verifySize(destination);
        return true;
    }

    /**
     * Ein Fetch der schon am Status scheitert soll keine leere Datei
     * hinterlassen.
     */
    private void removeEmptyFile(Path destination, DownloadException cause)
    {
        try
        {
            if (Files.size(destination) == 0L)
            {
                Files.delete(destination);
            }
        }
        catch (IOException e)
        {
            cause.addSuppressed(e);
        }
    }

    /**
     * Öffne die Ziel-Datei, kürze sie auf den Offset und positioniere dort.
     */
    private FileChannel openChannel(Path destination, long offset) throws DownloadException
    {
        FileChannel channel = null;
        try
        {
            channel = FileChannel.open(destination, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            channel.truncate(offset);
            channel.position(offset);
            return channel;
        }
        catch (ClosedByInterruptException e)
        {
            this.closeQuietly(channel, e);
            throw new DownloadException(e, EFailureKind.CANCELLED, EMsgId.ERR_CANCELLED, this.state.getUrl());
        }
        catch (IOException e)
        {
            this.closeQuietly(channel, e);
            throw new DownloadException(e, EFailureKind.FILE_SYSTEM, EMsgId.ERR_OPEN_FILE, destination, e.toString());
        }
    }

    private void closeQuietly(FileChannel channel, IOException cause)
    {
        if (channel != null)
        {
            try
            {
                channel.close();
            }
            catch (IOException e)
            {
                cause.addSuppressed(e);
            }
        }
    }

    /**
     * Bei bekannter Größe muss die Datei jetzt exakt so groß sein.
     */
    private void verifySize(Path destination) throws DownloadException
    {
        if (!this.state.isExpectedKnown())
        {
            return;
        }

        try
        {
            long actual = Files.size(destination);
            if (actual < this.state.getBytesExpected())
            {
                throw new DownloadException(EFailureKind.TRUNCATED, EMsgId.ERR_TRUNCATED, this.state.getUrl(), actual, this.state.getBytesExpected());
            }
        }
        catch (IOException e)
        {
            throw new DownloadException(e, EFailureKind.FILE_SYSTEM, EMsgId.ERR_INSPECT_FILE, destination, e.toString());
        }
    }

    /**
     * Übernimm das Last-Modified des Servers. Ein Fehler ist hier nur eine Warnung.
     */
    private void applyLastModified()
    {
        long lastModified = this.state.getRemoteLastModified();
        if (lastModified <= 0)
        {
            return;
        }

        try
        {
            Files.setLastModifiedTime(this.state.getDestination(), FileTime.fromMillis(lastModified));
        }
        catch (IOException e)
        {
            log.warn(MsgFactory.get(DownloadTask.class, EMsgIds.WARN_LAST_MODIFIED, this.state.getDestination(), e.toString()));
        }
    }

    private void checkStopped() throws DownloadException
    {
        if (this.components.stopSignal().isStopped())
        {
            throw new DownloadException(EFailureKind.CANCELLED, EMsgId.ERR_CANCELLED, this.state.getUrl());
        }
    }

    private void fail(EFailureKind kind, String message)
    {
        this.state.fail(kind, message);
        log.error(MsgFactory.get(DownloadTask.class, EMsgIds.ERR_TASK_FAILED, //
            this.state.getTaskId(), this.state.getUrl(), this.state.getAttempt() + 1, kind, message));
    }

    private enum EMsgIds
    {
        INF_TASK_START, //
        INF_TASK_SUCCESS, //
        INF_ALREADY_COMPLETE, //
        DBG_PLAN, //
        DBG_FETCHED, //
        WARN_RANGE_MISMATCH, //
        WARN_RETRY, //
        WARN_LAST_MODIFIED, //
        ERR_TASK_FAILED, //
        ERR_UNEXPECTED
    }
}
