package org.clusterjob.jobs.model.enumerations;

/** Scheduler-agnostic environment variables that can appear in a job body.
 * Every backend descriptor maps both the $NAME and ${NAME} forms onto the
 * native equivalent.
 */
public enum CoreEnvVariable 
{
    JOB_ID("CLUSTERJOB_ID", "The job id assigned by the scheduler"),
    JOB_NAME("CLUSTERJOB_NAME", "The name of the job"),
    WORKDIR("CLUSTERJOB_WORKDIR", "The directory from which the job was submitted"),
    SUBMIT_HOST("CLUSTERJOB_SUBMIT_HOST", "The host from which the job was submitted"),
    NODELIST("CLUSTERJOB_NODELIST", "The host(s) on which the job is running"),
    ARRAY_INDEX("CLUSTERJOB_ARRAY_INDEX", "The index of the job in a job array");
    
    // ---- Fields
    private final String _varName;
    private final String _description;
    
    // ---- Constructor
    CoreEnvVariable(String varName, String description)
    {
        _varName = varName;
        _description = description;
    }
    
    // ---- Instance Methods
    public String getVarName() {return _varName;}
    public String getDescription() {return _description;}
    
    /** The plain reference, e.g. $CLUSTERJOB_ID. */
    public String getReference() {return "$" + _varName;}
    
    /** The braced reference, e.g. ${CLUSTERJOB_ID}. */
    public String getBracedReference() {return "${" + _varName + "}";}
}
