package org.clusterjob.jobs.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The output of rendering a job description for one backend.  The script
 * text is ready to be written to disk as is.  The consumed and ignored key
 * lists let callers see exactly which resources made it into the header.
 * Auxiliary scripts, the prologue and the epilogue have been rendered with the
 * same substitutions as the job body, but without a header block.
 * 
 * @author clusterjob
 */
public final class RenderedScript 
{
    private final String              _script;
    private final String              _filename;
    private final List<String>        _consumedKeys;
    private final List<String>        _ignoredKeys;
    private final Map<String,String>  _auxScripts;
    private final String              _prologue;    // can be null
    private final String              _epilogue;    // can be null

    public RenderedScript(String script, String filename, List<String> consumedKeys,
                          List<String> ignoredKeys, Map<String,String> auxScripts,
                          String prologue, String epilogue)
    {
        _script       = script;
        _filename     = filename;
        _consumedKeys = List.copyOf(consumedKeys);
        _ignoredKeys  = List.copyOf(ignoredKeys);
        _auxScripts   = Collections.unmodifiableMap(new LinkedHashMap<>(auxScripts));
        _prologue     = prologue;
        _epilogue     = epilogue;
    }

    public String getScript() {return _script;}
    public String getFilename() {return _filename;}
    public List<String> getConsumedKeys() {return _consumedKeys;}
    public List<String> getIgnoredKeys() {return _ignoredKeys;}
    public Map<String, String> getAuxScripts() {return _auxScripts;}
    public String getPrologue() {return _prologue;}
    public String getEpilogue() {return _epilogue;}

    @Override
    public String toString() {return _script;}
}
