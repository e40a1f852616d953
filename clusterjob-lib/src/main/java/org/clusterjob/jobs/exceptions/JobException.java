package org.clusterjob.jobs.exceptions;

/** Root of all checked exceptions raised by the jobs library.
 * 
 * @author clusterjob
 */
public class JobException 
 extends Exception
{
    private static final long serialVersionUID = 4871937620238402171L;

    public JobException(String message) {super(message);}
    public JobException(String message, Throwable cause) {super(message, cause);}
}
