package org.clusterjob.jobs.exceptions;

public class CancelException 
 extends JobException
{
    private static final long serialVersionUID = 7710269152280613542L;

    public CancelException(String message) {super(message);}
    public CancelException(String message, Throwable cause) {super(message, cause);}
}
