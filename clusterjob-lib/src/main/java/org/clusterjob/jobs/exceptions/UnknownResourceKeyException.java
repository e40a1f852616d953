package org.clusterjob.jobs.exceptions;

public class UnknownResourceKeyException 
 extends TranslationException
{
    private static final long serialVersionUID = 6307425585431780622L;

    // The offending resource key and the backend that rejected it.
    private final String _resourceKey;
    private final String _backend;

    public UnknownResourceKeyException(String message, String resourceKey, String backend)
    {
        super(message);
        _resourceKey = resourceKey;
        _backend = backend;
    }

    public String getResourceKey() {return _resourceKey;}
    public String getBackend() {return _backend;}
}
