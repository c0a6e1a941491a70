package de.cbfagree.batchdownload.download;

/**
 * Die Entscheidung des {@link ResumePlanner}.
 *
 * @param mode
 * @param offset ab hier wird geschrieben, die Datei wird vorher auf diese Länge gekürzt
 * @param localSize die Größe der lokalen Datei zum Zeitpunkt der Planung
 */
public record ResumePlan(//
    EResumeMode mode, //
    long offset, //
    long localSize)
{
    public boolean isAlreadyComplete()
    {
        return this.mode == EResumeMode.ALREADY_COMPLETE;
    }

    public enum EResumeMode
    {
        /** keine lokale Datei */
        FRESH, //

        /** Fortsetzen ab der lokalen Dateigröße */
        RESUME, //

        /** lokale Datei wird verworfen */
        RESTART, //

        /** lokale Datei ist bereits vollständig */
        ALREADY_COMPLETE
    }
}
