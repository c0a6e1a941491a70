package de.cbfagree.batchdownload.download;

/**
 * Die Fehler-Klassen eines Downloads.
 *
 * Nur transiente Fehler werden von der {@link RetryPolicy} wiederholt.
 * {@link #RANGE_MISMATCH} ist kein Fehler im eigentlichen Sinn, der
 * {@link DownloadTask} startet dann ohne Retry von vorn.
 */
public enum EFailureKind
{
    /** Verbindungsaufbau gescheitert: refused, DNS, connect-timeout */
    CONNECTION_FAILED(true),

    /** read-timeout oder Abbruch mitten im Stream */
    READ_TIMEOUT(true),

    /** der Server hat weniger Bytes geliefert als angekündigt */
    TRUNCATED(true),

    /** 5xx, 408 und 429 */
    SERVER_OVERLOAD(true),

    /** alle anderen 4xx sowie nicht verfolgte Redirects */
    SERVER_REJECTED(false),

    /** TLS-Handshake gescheitert: Zertifikat, Hostname oder Protokoll */
    TLS_FAILED(false),

    /** Range-Request wurde mit 200 oder 416 beantwortet */
    RANGE_MISMATCH(false),

    /** Ziel-Datei kann nicht angelegt, geöffnet oder geschrieben werden */
    FILE_SYSTEM(false),

    /** keine absolute http(s)-URL oder kein Dateiname ableitbar */
    INVALID_URL(false),

    /** Abbruch durch das StopSignal */
    CANCELLED(false),

    /** unerwarteter Programmfehler innerhalb eines Tasks */
    INTERNAL_ERROR(false);

    private final boolean isTransient;

    private EFailureKind(boolean isTransient)
    {
        this.isTransient = isTransient;
    }

    public boolean isTransient()
    {
        return this.isTransient;
    }

    /**
     * Klassifiziere einen HTTP-Status, der weder 200 noch 206 ist.
     *
     * @param statusCode
     * @return
     */
    public static EFailureKind fromStatusCode(int statusCode)
    {
        if (statusCode >= 500 || statusCode == 408 || statusCode == 429)
        {
            return SERVER_OVERLOAD;
        }
        return SERVER_REJECTED;
    }
}
