package org.clusterjob.jobs.exceptions;

public class BackendDefinitionException 
 extends JobException
{
    private static final long serialVersionUID = 5152936102271190870L;

    public BackendDefinitionException(String message) {super(message);}
    public BackendDefinitionException(String message, Throwable cause) {super(message, cause);}
}
