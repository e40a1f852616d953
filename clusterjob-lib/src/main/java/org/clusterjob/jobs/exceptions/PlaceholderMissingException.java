package org.clusterjob.jobs.exceptions;

public class PlaceholderMissingException 
 extends TranslationException
{
    private static final long serialVersionUID = -5406468316052417330L;

    private final String _placeholder;

    public PlaceholderMissingException(String message, String placeholder)
    {
        super(message);
        _placeholder = placeholder;
    }

    public String getPlaceholder() {return _placeholder;}
}
