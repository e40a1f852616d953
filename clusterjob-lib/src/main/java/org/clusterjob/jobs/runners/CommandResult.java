package org.clusterjob.jobs.runners;

/** The outcome of one external command.  Output strings are never null. */
public final class CommandResult 
{
    private final int    _exitCode;
    private final String _stdout;
    private final String _stderr;
    
    public CommandResult(int exitCode, String stdout, String stderr)
    {
        _exitCode = exitCode;
        _stdout = stdout == null ? "" : stdout;
        _stderr = stderr == null ? "" : stderr;
    }
    
    public boolean isSuccess() {return _exitCode == 0;}
    
    /** Stdout followed by stderr, for pattern searches over all output. */
    public String getCombinedOutput() 
    {
        if (_stderr.isEmpty()) return _stdout;
        if (_stdout.isEmpty()) return _stderr;
        return _stdout + "\n" + _stderr;
    }
    
    public int getExitCode() {return _exitCode;}
    public String getStdout() {return _stdout;}
    public String getStderr() {return _stderr;}
    
    @Override
    public String toString() 
    {
        return "CommandResult[exitCode=" + _exitCode + ", stdout=" + _stdout.strip() + 
               ", stderr=" + _stderr.strip() + "]";
    }
}
