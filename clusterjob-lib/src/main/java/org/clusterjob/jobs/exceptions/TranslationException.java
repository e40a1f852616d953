package org.clusterjob.jobs.exceptions;

/** Raised synchronously when a job description cannot be translated into a
 * scheduler script.  Translation problems are never silently ignored.
 */
public class TranslationException 
 extends JobException
{
    private static final long serialVersionUID = -2251890354066139115L;

    public TranslationException(String message) {super(message);}
    public TranslationException(String message, Throwable cause) {super(message, cause);}
}
