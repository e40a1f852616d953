package org.clusterjob.jobs.model.enumerations;

import java.util.EnumSet;
import java.util.Set;

/** The resource keys every backend is expected to understand.  Resources
 * outside this set are backend specific and depend on the backend's 
 * pass-through rule.
 */
public enum CoreResource 
{
    JOBNAME("jobname"),
    NODES("nodes"),
    PPN("ppn"),
    THREADS("threads"),
    TIME("time"),
    MEM("mem"),
    QUEUE("queue"),
    STDOUT("stdout"),
    STDERR("stderr");
    
    // The three resources that together determine the core count.
    public static final Set<CoreResource> PARALLEL = EnumSet.of(NODES, PPN, THREADS);
    
    // ---- Fields
    private final String _key;
    
    // ---- Constructor
    CoreResource(String key) {_key = key;}
    
    // ---- Instance Methods
    public String getKey() {return _key;}
    
    // ---- Static Methods
    public static boolean isParallelKey(String key)
    {
        return NODES._key.equals(key) || PPN._key.equals(key) || THREADS._key.equals(key);
    }
}
