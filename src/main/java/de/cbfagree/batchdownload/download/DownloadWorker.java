package de.cbfagree.batchdownload.download;

import java.util.concurrent.BlockingQueue;

import de.cbfagree.batchdownload.messages.MsgFactory;
import lombok.extern.log4j.Log4j2;

/**
 * Der DownloadWorker holt sich so lange Requests aus der Queue des
 * {@link WorkerPool} bis diese leer ist oder das {@link StopSignal} gesetzt
 * wurde. Jeder Request wird auf diesem Thread komplett abgearbeitet, erst
 * danach wird der nächste geholt.
 */
@Log4j2
class DownloadWorker extends Thread
{
    private final BlockingQueue<DownloadRequest> queue;
    private final DownloadComponents components;
    private final IDownloadObserver observer;

    /**
     * @param workerNr
     * @param queue
     * @param components
     * @param observer
     */
    DownloadWorker(int workerNr, BlockingQueue<DownloadRequest> queue, DownloadComponents components, IDownloadObserver observer)
    {
        this.queue = queue;
        this.components = components;
        this.observer = observer;
        this.setName(String.format("download-worker-%1$d", workerNr));
        this.setDaemon(true);
    }

    /**
     * Hole den nächsten Request und führe ihn aus. Eine leere Queue beendet
     * den Worker, nachgeliefert wird nichts.
     */
    @Override
    public void run()
    {
        log.debug(MsgFactory.get(DownloadWorker.class, EMsgIds.DBG_WORKER_START, this.getName()));
        while (!this.isInterrupted() && !this.components.stopSignal().isStopped())
        {
            DownloadRequest request = this.queue.poll();
            if (request == null)
            {
                break;
            }
            this.execute(request);
        }
        log.debug(MsgFactory.get(DownloadWorker.class, EMsgIds.DBG_WORKER_END, this.getName()));
    }

    /**
     * @param request
     */
    private void execute(DownloadRequest request)
    {
        TransferState state = new TransferState(request.taskId(), request.url());
        try
        {
            new DownloadTask(state, this.components).run();
        }
        catch (RuntimeException e)
        {
            log.error(MsgFactory.get(DownloadWorker.class, EMsgIds.ERR_TASK_CRASHED, request.url(), e.toString()), e);
        }

        try
        {
            this.observer.downloadFinished(state);
        }
        catch (RuntimeException e)
        {
            log.error(MsgFactory.get(DownloadWorker.class, EMsgIds.ERR_OBSERVER, request.url(), e.toString()), e);
        }
    }

    private enum EMsgIds
    {
        DBG_WORKER_START, //
        DBG_WORKER_END, //
        ERR_TASK_CRASHED, //
        ERR_OBSERVER
    }
}
