package org.clusterjob.jobs.exceptions;

/** Raised when the scheduler's submit command fails or its output does not
 * contain a job id.  The captured command output is carried along so callers
 * can diagnose the failure.  Submissions are never retried automatically.
 */
public class SubmissionException 
 extends JobException
{
    private static final long serialVersionUID = 1602395146532960217L;

    // Captured command information, any of which can be null.
    private final String  _command;
    private final Integer _exitCode;
    private final String  _stdout;
    private final String  _stderr;

    public SubmissionException(String message) 
    {this(message, null, null, null, null, null);}

    public SubmissionException(String message, Throwable cause) 
    {this(message, null, null, null, null, cause);}

    public SubmissionException(String message, String command, Integer exitCode,
                               String stdout, String stderr)
    {this(message, command, exitCode, stdout, stderr, null);}

    public SubmissionException(String message, String command, Integer exitCode,
                               String stdout, String stderr, Throwable cause)
    {
        super(message, cause);
        _command  = command;
        _exitCode = exitCode;
        _stdout   = stdout;
        _stderr   = stderr;
    }

    public String getCommand() {return _command;}
    public Integer getExitCode() {return _exitCode;}
    public String getStdout() {return _stdout;}
    public String getStderr() {return _stderr;}
}
