package de.cbfagree.batchdownload.download;

import java.net.URL;
import java.nio.file.Path;

import lombok.Getter;
import lombok.ToString;

/**
 * Der Zustand eines einzelnen Downloads.
 *
 * Geschrieben wird immer nur von dem einen Worker-Thread, welcher den
 * zugehörigen {@link DownloadTask} ausführt. Gelesen wird aber auch von
 * anderen Threads (Progress-Reporting, Summary), deshalb sind die
 * veränderlichen Felder volatile.
 */
@Getter
@ToString
public class TransferState
{
    /** Gesamtgröße ist nicht bekannt */
    public static final long UNKNOWN = -1L;

    private final int taskId;
    private final String url;

    private volatile URL requestUrl;
    private volatile Path destination;
    private volatile long bytesExpected = UNKNOWN;
    private volatile long bytesDownloaded;
    private volatile int attempt;
    private volatile ETransferStatus status = ETransferStatus.PENDING;

    private volatile long remoteLastModified;
    private volatile EFailureKind failureKind;
    private volatile String failureMessage;

    public TransferState(int taskId, String url)
    {
        this.taskId = taskId;
        this.url = url;
    }

    public boolean isExpectedKnown()
    {
        return this.bytesExpected >= 0;
    }

    /**
     * Request-URL und Ziel-Datei werden beim Planen festgelegt und danach nie
     * mehr geändert.
     */
    void assignTarget(URL requestUrl, Path destination)
    {
        this.checkNotTerminal();
        if (this.destination != null)
        {
            throw new IllegalStateException("target already assigned: " + this.destination);
        }
        this.requestUrl = requestUrl;
        this.destination = destination;
    }

    void setBytesExpected(long bytesExpected)
    {
        this.checkNotTerminal();
        this.bytesExpected = bytesExpected < 0 ? UNKNOWN : bytesExpected;
    }

    void setRemoteLastModified(long remoteLastModified)
    {
        this.remoteLastModified = remoteLastModified;
    }

    /**
     * Wird vom {@link RangeFetcher} für jeden geschriebenen Chunk aufgerufen.
     *
     * @param count
     */
    void addBytes(long count)
    {
        this.checkNotTerminal();
        if (count < 0)
        {
            throw new IllegalArgumentException("negative byte count: " + count);
        }

        long newValue = this.bytesDownloaded + count;
        if (this.isExpectedKnown() && newValue > this.bytesExpected)
        {
            throw new IllegalStateException(String.format("%1$d bytes exceed the expected %2$d bytes", newValue, this.bytesExpected));
        }
        this.bytesDownloaded = newValue;
    }

    /**
     * Setze den Zähler auf den tatsächlichen Datei-Stand vor einem Fetch.
     * Ist nur zwischen zwei Fetches erlaubt, nach einem RangeMismatch kann
     * der Wert also auch kleiner werden.
     *
     * @param offset
     */
    void restartFrom(long offset)
    {
        this.checkNotTerminal();
        this.bytesDownloaded = offset;
    }

    void nextAttempt()
    {
        this.checkNotTerminal();
        this.attempt++;
    }

    void start()
    {
        this.moveTo(ETransferStatus.IN_PROGRESS);
    }

    void complete()
    {
        this.moveTo(ETransferStatus.COMPLETED);
    }

    synchronized void fail(EFailureKind kind, String message)
    {
        this.checkTransition(ETransferStatus.FAILED);
        this.failureKind = kind;
        this.failureMessage = message;
        this.status = ETransferStatus.FAILED;
    }

    private synchronized void moveTo(ETransferStatus next)
    {
        this.checkTransition(next);
        this.status = next;
    }

    private void checkTransition(ETransferStatus next)
    {
        if (!this.status.canMoveTo(next))
        {
            throw new IllegalStateException(String.format("illegal transition %1$s -> %2$s for %3$s", this.status, next, this.url));
        }
    }

    private void checkNotTerminal()
    {
        if (this.status.isTerminal())
        {
            throw new IllegalStateException("transfer already terminated: " + this.url);
        }
    }
}
