package org.clusterjob.jobs.model;

import java.time.Instant;

import org.clusterjob.jobs.model.enumerations.JobStatusType;

/** The persisted state of one submitted job.  Instances are serialized as
 * JSON by the cache store and by AsyncResult.dump(), so field names are part
 * of the on-disk format.  Timestamps are kept as ISO-8601 strings.
 * 
 * Format history:
 * 
 *  1 - initial format
 * 
 * Records without a schemaVersion field were written by early versions that
 * stored the sleep interval under the name "sleep" and had no epilogue
 * fields.  Those are migrated on load. 
 */
public final class CacheEntry 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    public static final int CURRENT_SCHEMA_VERSION = 1;
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private int           schemaVersion = CURRENT_SCHEMA_VERSION;
    private String        cacheKey;
    private String        jobId;
    private String        backend;
    private String        remote;
    private String        workdir;
    private JobStatusType status;
    private int           failedPolls;
    private String        submittedAt;
    private String        updatedAt;
    private String        statusCommand;
    private String        fallbackStatusCommand;
    private String        cancelCommand;
    private int           sleepIntervalSeconds;
    private String        epilogue;
    private boolean       epilogueDone;
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /** Record a change by stamping the update time. */
    public void touch() {updatedAt = Instant.now().toString();}
    
    /** A field-by-field copy. */
    public CacheEntry copy()
    {
        var c = new CacheEntry();
        c.schemaVersion        = schemaVersion;
        c.cacheKey             = cacheKey;
        c.jobId                = jobId;
        c.backend              = backend;
        c.remote               = remote;
        c.workdir              = workdir;
        c.status               = status;
        c.failedPolls          = failedPolls;
        c.submittedAt          = submittedAt;
        c.updatedAt            = updatedAt;
        c.statusCommand        = statusCommand;
        c.fallbackStatusCommand = fallbackStatusCommand;
        c.cancelCommand        = cancelCommand;
        c.sleepIntervalSeconds = sleepIntervalSeconds;
        c.epilogue             = epilogue;
        c.epilogueDone         = epilogueDone;
        return c;
    }
    
    @Override
    public String toString() 
    {
        return "CacheEntry[cacheKey=" + cacheKey + ", jobId=" + jobId + ", backend=" + backend +
               ", status=" + status + ", failedPolls=" + failedPolls + "]";
    }
    
    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public int getSchemaVersion() {return schemaVersion;}
    public void setSchemaVersion(int schemaVersion) {this.schemaVersion = schemaVersion;}
    public String getCacheKey() {return cacheKey;}
    public void setCacheKey(String cacheKey) {this.cacheKey = cacheKey;}
    public String getJobId() {return jobId;}
    public void setJobId(String jobId) {this.jobId = jobId;}
    public String getBackend() {return backend;}
    public void setBackend(String backend) {this.backend = backend;}
    public String getRemote() {return remote;}
    public void setRemote(String remote) {this.remote = remote;}
    public String getWorkdir() {return workdir;}
    public void setWorkdir(String workdir) {this.workdir = workdir;}
    public JobStatusType getStatus() {return status;}
    public void setStatus(JobStatusType status) {this.status = status;}
    public int getFailedPolls() {return failedPolls;}
    public void setFailedPolls(int failedPolls) {this.failedPolls = failedPolls;}
    public String getSubmittedAt() {return submittedAt;}
    public void setSubmittedAt(String submittedAt) {this.submittedAt = submittedAt;}
    public String getUpdatedAt() {return updatedAt;}
    public void setUpdatedAt(String updatedAt) {this.updatedAt = updatedAt;}
    public String getStatusCommand() {return statusCommand;}
    public void setStatusCommand(String statusCommand) {this.statusCommand = statusCommand;}
    public String getFallbackStatusCommand() {return fallbackStatusCommand;}
    public void setFallbackStatusCommand(String fallbackStatusCommand) {this.fallbackStatusCommand = fallbackStatusCommand;}
    public String getCancelCommand() {return cancelCommand;}
    public void setCancelCommand(String cancelCommand) {this.cancelCommand = cancelCommand;}
    public int getSleepIntervalSeconds() {return sleepIntervalSeconds;}
    public void setSleepIntervalSeconds(int sleepIntervalSeconds) {this.sleepIntervalSeconds = sleepIntervalSeconds;}
    public String getEpilogue() {return epilogue;}
    public void setEpilogue(String epilogue) {this.epilogue = epilogue;}
    public boolean isEpilogueDone() {return epilogueDone;}
    public void setEpilogueDone(boolean epilogueDone) {this.epilogueDone = epilogueDone;}
}
