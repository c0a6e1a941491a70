package de.cbfagree.batchdownload.download;

/**
 * Empfänger für Fortschritts-Meldungen. Die Methoden werden aus den
 * Worker-Threads heraus aufgerufen, Implementierungen müssen also
 * thread-safe sein.
 */
public interface IProgressReporter
{
    /** Ein Reporter, der alles verwirft */
    public static final IProgressReporter NONE = new IProgressReporter()
    {
    };

    public default void taskStarted(TransferState state)
    {
    }

    /**
     * Wird während des Downloads in begrenzter Frequenz aufgerufen.
     *
     * @param taskId
     * @param bytesDownloaded
     * @param bytesExpected oder {@link TransferState#UNKNOWN}
     */
    public default void progress(int taskId, long bytesDownloaded, long bytesExpected)
    {
    }

    /**
     * Der Task hat einen terminalen Status erreicht.
     */
    public default void taskFinished(TransferState state)
    {
    }
}
