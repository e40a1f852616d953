package org.clusterjob.jobs.exceptions;

/** The command runner could not execute a command at all (connection failure,
 * timeout, I/O error).  A command that ran and returned a non-zero exit code
 * does not raise this exception.
 */
public class CommandRunnerException 
 extends JobException
{
    private static final long serialVersionUID = -6655132419407251783L;

    public CommandRunnerException(String message) {super(message);}
    public CommandRunnerException(String message, Throwable cause) {super(message, cause);}
}
