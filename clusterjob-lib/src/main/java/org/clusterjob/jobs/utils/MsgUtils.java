package org.clusterjob.jobs.utils;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Message catalog access.  All user-facing and log messages are looked up by
 * key in the clusterjobMessages bundle and formatted with MessageFormat.  An
 * unknown key never causes an exception; the key and its arguments are 
 * returned instead so that the original problem is not masked.
 * 
 * @author clusterjob
 */
public final class MsgUtils 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(MsgUtils.class);
    
    // The base name of the message bundle.
    public static final String MESSAGE_BUNDLE = "clusterjobMessages";
    
    // Lazily loaded bundle.
    private static volatile ResourceBundle _bundle;
    
    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    private MsgUtils() {}
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* getMsg:                                                                */
    /* ---------------------------------------------------------------------- */
    /** Get the message text for the key with its parameters filled in.
     * 
     * @param key the message key
     * @param parms the message parameters
     * @return the formatted message, never null
     */
    public static String getMsg(String key, Object... parms)
    {
        String template = null;
        try {template = getBundle().getString(key);}
        catch (MissingResourceException e) {
            _log.warn("Message key not found in " + MESSAGE_BUNDLE + ": " + key);
        }
        
        // Fallback to a readable rendering of the key and its parameters.
        if (template == null) {
            var buf = new StringBuilder(key);
            if (parms != null) 
                for (var p : parms) buf.append(' ').append(p);
            return buf.toString();
        }
        
        // No need to format parameterless messages.
        if (parms == null || parms.length == 0) return template;
        return new MessageFormat(template, Locale.ROOT).format(parms);
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    private static ResourceBundle getBundle()
    {
        if (_bundle == null) 
            synchronized (MsgUtils.class) {
                if (_bundle == null) _bundle = ResourceBundle.getBundle(MESSAGE_BUNDLE, Locale.ROOT);
            }
        return _bundle;
    }
}
