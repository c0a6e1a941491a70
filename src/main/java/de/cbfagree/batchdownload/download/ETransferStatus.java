package de.cbfagree.batchdownload.download;

/**
 * Status eines {@link TransferState}. Die Übergänge laufen ausschließlich
 * PENDING -&gt; IN_PROGRESS -&gt; COMPLETED|FAILED.
 */
public enum ETransferStatus
{
    PENDING, //
    IN_PROGRESS, //
    COMPLETED, //
    FAILED;

    public boolean isTerminal()
    {
        return this == COMPLETED || this == FAILED;
    }

    boolean canMoveTo(ETransferStatus next)
    {
        switch (this)
        {
            case PENDING:
                return next == IN_PROGRESS;

            case IN_PROGRESS:
                return next.isTerminal();

            default:
                return false;
        }
    }
}
