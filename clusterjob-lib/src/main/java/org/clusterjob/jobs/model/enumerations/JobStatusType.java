package org.clusterjob.jobs.model.enumerations;

/** The scheduler-independent status of a submitted job.  Each backend maps
 * its native status strings onto these values.  UNKNOWN is never stored as
 * the result of a scheduler report; it signals that a status query was 
 * inconclusive.
 * 
 * @author clusterjob
 */
public enum JobStatusType 
{
    PENDING(false),
    RUNNING(false),
    COMPLETED(true),
    FAILED(true),
    CANCELLED(true),
    UNKNOWN(false);
    
    // ---- Fields
    private final boolean _terminal;
    
    // ---- Constructor
    JobStatusType(boolean terminal) {_terminal = terminal;}
    
    // ---- Instance Methods
    public boolean isTerminal() {return _terminal;}
    
    /** Terminal states after which a non-forced submission under the same
     * cache key is allowed to resubmit.
     */
    public boolean isResubmittable() {return this == FAILED || this == CANCELLED;}
    
    /** True only for COMPLETED. */
    public boolean isSuccessful() {return this == COMPLETED;}
}
