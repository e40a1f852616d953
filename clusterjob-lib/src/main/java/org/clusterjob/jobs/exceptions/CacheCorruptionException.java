package org.clusterjob.jobs.exceptions;

/** An unreadable or schema-mismatched cache entry.  Corruption is always
 * reported rather than treated as an absent entry since the latter could
 * lead to a duplicate submission.
 */
public class CacheCorruptionException 
 extends JobException
{
    private static final long serialVersionUID = -1330757305785093411L;

    private final String _location;

    public CacheCorruptionException(String message, String location)
    {
        super(message);
        _location = location;
    }

    public CacheCorruptionException(String message, String location, Throwable cause)
    {
        super(message, cause);
        _location = location;
    }

    public String getLocation() {return _location;}
}
