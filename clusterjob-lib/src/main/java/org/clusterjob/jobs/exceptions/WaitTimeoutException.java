package org.clusterjob.jobs.exceptions;

import org.clusterjob.jobs.model.enumerations.JobStatusType;

public class WaitTimeoutException 
 extends JobException
{
    private static final long serialVersionUID = 3924506175813806418L;

    // The status observed by the last poll before the timeout expired.
    private final JobStatusType _lastStatus;

    public WaitTimeoutException(String message, JobStatusType lastStatus)
    {
        super(message);
        _lastStatus = lastStatus;
    }

    public JobStatusType getLastStatus() {return _lastStatus;}
}
