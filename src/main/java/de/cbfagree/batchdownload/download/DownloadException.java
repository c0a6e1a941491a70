package de.cbfagree.batchdownload.download;

import de.cbfagree.batchdownload.messages.MsgFactory;
import lombok.Getter;

/**
 * Ein fehlgeschlagener Download-Schritt. Die Exception verlässt niemals
 * den {@link DownloadTask}, sie landet als FailureKind im
 * {@link TransferState}.
 */
@Getter
public class DownloadException extends Exception
{
    private static final long serialVersionUID = 1L;

    private final EFailureKind kind;

    public DownloadException(EFailureKind kind, EMsgId msgId, Object... args)
    {
        super(MsgFactory.format(DownloadException.class, msgId, args));
        this.kind = kind;
    }

    public DownloadException(Throwable t, EFailureKind kind, EMsgId msgId, Object... args)
    {
        super(MsgFactory.format(DownloadException.class, msgId, args), t);
        this.kind = kind;
    }

    public enum EMsgId
    {
        ERR_INVALID_URL, //
        ERR_NO_FILE_NAME, //
        ERR_DESTINATION_CLAIMED, //
        ERR_CREATE_FOLDER, //
        ERR_OPEN_FILE, //
        ERR_WRITE_FILE, //
        ERR_INSPECT_FILE, //
        ERR_CONNECT, //
        ERR_TLS, //
        ERR_READ, //
        ERR_TIMEOUT, //
        ERR_HTTP_STATUS, //
        ERR_RANGE_IGNORED, //
        ERR_RANGE_NOT_SATISFIABLE, //
        ERR_TRUNCATED, //
        ERR_SIZE_CHANGED, //
        ERR_INTERNAL, //
        ERR_CANCELLED, //
    }
}
