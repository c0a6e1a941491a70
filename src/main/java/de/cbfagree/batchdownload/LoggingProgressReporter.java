package de.cbfagree.batchdownload;

import java.util.concurrent.atomic.AtomicInteger;

import de.cbfagree.batchdownload.download.IProgressReporter;
import de.cbfagree.batchdownload.download.TransferState;
import de.cbfagree.batchdownload.messages.MsgFactory;
import lombok.extern.log4j.Log4j2;

/**
 * Der Progress-Reporter der Kommandozeile. Fertige Dateien werden als
 * "n/total" auf INFO gemeldet, der Byte-Fortschritt nur auf DEBUG.
 */
@Log4j2
public class LoggingProgressReporter implements IProgressReporter
{
    private final int total;
    private final AtomicInteger finished = new AtomicInteger();

    public LoggingProgressReporter(int total)
    {
        this.total = total;
    }

    @Override
    public void progress(int taskId, long bytesDownloaded, long bytesExpected)
    {
        if (!log.isDebugEnabled())
        {
            return;
        }

        if (bytesExpected > 0)
        {
            long percent = bytesDownloaded * 100 / bytesExpected;
            log.debug(MsgFactory.get(LoggingProgressReporter.class, EMsgIds.DBG_PROGRESS, taskId, bytesDownloaded, bytesExpected, percent));
        }
        else
        {
            log.debug(MsgFactory.get(LoggingProgressReporter.class, EMsgIds.DBG_PROGRESS_UNKNOWN, taskId, bytesDownloaded));
        }
    }

    @Override
    public void taskFinished(TransferState state)
    {
        int done = this.finished.incrementAndGet();
        log.info(MsgFactory.get(LoggingProgressReporter.class, EMsgIds.INF_FILES_DONE, done, this.total, state.getStatus(), state.getUrl()));
    }

    private enum EMsgIds
    {
        DBG_PROGRESS, //
        DBG_PROGRESS_UNKNOWN, //
        INF_FILES_DONE
    }
}
