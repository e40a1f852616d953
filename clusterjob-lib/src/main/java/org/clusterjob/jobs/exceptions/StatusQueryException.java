package org.clusterjob.jobs.exceptions;

/** Raised once the bounded number of consecutive inconclusive status queries
 * has been exhausted.
 */
public class StatusQueryException 
 extends JobException
{
    private static final long serialVersionUID = -8014362285306451924L;

    private final int _consecutiveFailures;

    public StatusQueryException(String message, int consecutiveFailures)
    {
        super(message);
        _consecutiveFailures = consecutiveFailures;
    }

    public StatusQueryException(String message, int consecutiveFailures, Throwable cause)
    {
        super(message, cause);
        _consecutiveFailures = consecutiveFailures;
    }

    public int getConsecutiveFailures() {return _consecutiveFailures;}
}
