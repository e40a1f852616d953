package org.clusterjob.jobs.exceptions;

public class HookScriptException 
 extends JobException
{
    private static final long serialVersionUID = 2418803937164045506L;

    public HookScriptException(String message) {super(message);}
    public HookScriptException(String message, Throwable cause) {super(message, cause);}
}
