package de.cbfagree.batchdownload.download;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import de.cbfagree.batchdownload.messages.MsgFactory;
import lombok.extern.log4j.Log4j2;

/**
 * Das externe Stop-Signal eines Download-Laufs.
 *
 * Blockierende Lese-Operationen auf einer HttpURLConnection lassen sich nicht
 * per Interrupt abbrechen. Deshalb registriert jeder laufende Fetch eine
 * Abort-Aktion (typischerweise <code>conn::disconnect</code>), welche beim
 * {@link #stop()} ausgeführt wird. Wartende Retries werden über den Latch
 * sofort geweckt.
 */
@Log4j2
public class StopSignal
{
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final Set<Runnable> abortActions = ConcurrentHashMap.newKeySet();

    /**
     * Setze das Signal und brich alle registrierten Operationen ab. Mehrfache
     * Aufrufe sind erlaubt.
     */
    public void stop()
    {
        if (this.isStopped())
        {
            return;
        }

        this.stopped.countDown();
        for (Runnable action : this.abortActions)
        {
            this.runAbortAction(action);
        }
    }

    public boolean isStopped()
    {
        return this.stopped.getCount() == 0;
    }

    /**
     * Warte die angegebene Zeit, es sei denn das Signal wird vorher gesetzt.
     *
     * @param delay
     * @return <code>true</code> wenn die Zeit komplett abgelaufen ist, <code>false</code>
     *         wenn das Signal gesetzt wurde
     * @throws InterruptedException
     */
    public boolean sleep(Duration delay) throws InterruptedException
    {
        if (delay.isZero() || delay.isNegative())
        {
            return !this.isStopped();
        }
        return !this.stopped.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Registriere eine Abort-Aktion für die Dauer einer Operation. Ist das
     * Signal bereits gesetzt, so wird die Aktion sofort ausgeführt.
     *
     * @param abortAction
     * @return beim close() wird die Aktion wieder entfernt
     */
    public Registration register(Runnable abortAction)
    {
        this.abortActions.add(abortAction);
        if (this.isStopped())
        {
            this.runAbortAction(abortAction);
        }
        return () -> this.abortActions.remove(abortAction);
    }

    private void runAbortAction(Runnable action)
    {
        try
        {
            action.run();
        }
        catch (RuntimeException e)
        {
            log.warn(MsgFactory.get(StopSignal.class, EMsgIds.WARN_ABORT_FAILED, e.toString()), e);
        }
    }

    /**
     * Eine registrierte Abort-Aktion
     */
    public interface Registration extends AutoCloseable
    {
        @Override
        public void close();
    }

    private enum EMsgIds
    {
        WARN_ABORT_FAILED
    }
}
