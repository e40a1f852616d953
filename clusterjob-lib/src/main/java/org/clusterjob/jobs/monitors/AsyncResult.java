package org.clusterjob.jobs.monitors;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.clusterjob.jobs.cache.CacheEntryCodec;
import org.clusterjob.jobs.cache.CacheStore;
import org.clusterjob.jobs.config.JobsConfig;
import org.clusterjob.jobs.exceptions.CacheCorruptionException;
import org.clusterjob.jobs.exceptions.CancelException;
import org.clusterjob.jobs.exceptions.CommandRunnerException;
import org.clusterjob.jobs.exceptions.HookScriptException;
import org.clusterjob.jobs.exceptions.JobException;
import org.clusterjob.jobs.exceptions.StatusQueryException;
import org.clusterjob.jobs.exceptions.WaitTimeoutException;
import org.clusterjob.jobs.launchers.JobSubmitter;
import org.clusterjob.jobs.model.CacheEntry;
import org.clusterjob.jobs.model.enumerations.JobStatusType;
import org.clusterjob.jobs.runners.CommandResult;
import org.clusterjob.jobs.runners.CommandRunner;
import org.clusterjob.jobs.runners.HookScriptRunner;
import org.clusterjob.jobs.schedulers.JobScheduler;
import org.clusterjob.jobs.utils.JobUtils;
import org.clusterjob.jobs.utils.MsgUtils;

/** Tracks one submitted job.  Every query goes to the scheduler through the
 * job's command runner until the job reaches a terminal state; after that the
 * recorded status is returned without contacting the scheduler again.  Every
 * change of the recorded state is written to the cache store, so a process
 * that restarts picks up where the previous one left off.
 * 
 * A backend can name a fallback status command, which is asked only when the
 * status command gives no usable answer.  Only when both fail is the query
 * inconclusive.
 * 
 * Inconclusive status queries are absorbed: each one yields UNKNOWN and is
 * counted, and any conclusive answer resets the count.  Once the count reaches
 * the configured maximum a {@link StatusQueryException} is raised.
 * 
 * When the job first reaches a terminal state through a status query, the
 * job's epilogue runs on the local host.  If it fails, it is retried on the
 * next status query.
 * 
 * Instances are not thread-safe.
 * 
 * @author clusterjob
 */
public final class AsyncResult 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(AsyncResult.class);
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final CacheEntry       _entry;
    private final JobScheduler     _scheduler;
    private final CommandRunner    _runner;
    private final HookScriptRunner _hookRunner;
    private final CacheStore       _cache;
    private final JobsConfig       _config;
    
    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    public AsyncResult(CacheEntry entry, JobScheduler scheduler, CommandRunner runner,
                       HookScriptRunner hookRunner, CacheStore cache, JobsConfig config)
    {
        _entry      = entry;
        _scheduler  = scheduler;
        _runner     = runner;
        _hookRunner = hookRunner;
        _cache      = cache;
        _config     = config;
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* status:                                                                */
    /* ---------------------------------------------------------------------- */
    /** Get the job's current status.
     * 
     * @return the status, UNKNOWN if the scheduler's answer was inconclusive
     * @throws StatusQueryException if too many consecutive queries were 
     *          inconclusive
     * @throws HookScriptException if the epilogue failed
     * @throws JobException if the new state could not be persisted
     */
    public JobStatusType status() throws JobException
    {
        // Finished jobs don't change, but a failed epilogue gets another chance.
        if (_entry.getStatus().isTerminal()) {
            runEpilogueOnce();
            return _entry.getStatus();
        }
        
        // Ask the scheduler, then its fallback source if it has no answer.
        JobStatusType status = queryStatus(_entry.getStatusCommand());
        if (status == JobStatusType.UNKNOWN && _entry.getFallbackStatusCommand() != null)
            status = queryStatus(_entry.getFallbackStatusCommand());
        
        // Count inconclusive answers and give up after too many in a row.
        if (status == JobStatusType.UNKNOWN) {
            _entry.setFailedPolls(_entry.getFailedPolls() + 1);
            persist();
            int failures = _entry.getFailedPolls();
            if (failures >= _config.getMaxStatusFailures()) {
                String msg = MsgUtils.getMsg("JOBS_STATUS_QUERY_FAILED", _entry.getJobId(), 
                                             _scheduler.getName(), failures);
                throw new StatusQueryException(msg, failures);
            }
            return JobStatusType.UNKNOWN;
        }
        
        // Record a conclusive answer.
        JobStatusType prevStatus = _entry.getStatus();
        if (status != prevStatus || _entry.getFailedPolls() != 0) {
            _entry.setStatus(status);
            _entry.setFailedPolls(0);
            persist();
            if (status != prevStatus)
                _log.info(MsgUtils.getMsg("JOBS_STATUS_CHANGED", _entry.getJobId(), _scheduler.getName(),
                                          prevStatus, status));
        }
        if (status.isTerminal()) runEpilogueOnce();
        return status;
    }
    
    /* ---------------------------------------------------------------------- */
    /* wait:                                                                  */
    /* ---------------------------------------------------------------------- */
    /** Poll the job's status until it reaches a terminal state.
     * 
     * @param pollInterval the time between status queries
     * @param timeout the maximum time to wait or null to wait indefinitely
     * @return the terminal status
     * @throws WaitTimeoutException if the timeout expires first
     * @throws JobException if a status query fails or the thread is interrupted
     */
    public JobStatusType wait(Duration pollInterval, Duration timeout) throws JobException
    {
        final long start = System.nanoTime();
        while (true) {
            JobStatusType status = status();
            if (status.isTerminal()) return status;
            
            // Sleep no longer than the time left.
            Duration sleep = pollInterval;
            if (timeout != null) {
                Duration left = timeout.minus(Duration.ofNanos(System.nanoTime() - start));
                if (left.isZero() || left.isNegative()) {
                    String msg = MsgUtils.getMsg("JOBS_WAIT_TIMEOUT", _entry.getJobId(), 
                                                 timeout.toSeconds(), _entry.getStatus());
                    throw new WaitTimeoutException(msg, _entry.getStatus());
                }
                if (left.compareTo(sleep) < 0) sleep = left;
            }
            
            try {Thread.sleep(sleep.toMillis());}
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                String msg = MsgUtils.getMsg("JOBS_WAIT_INTERRUPTED", _entry.getJobId());
                throw new JobException(msg, e);
            }
        }
    }
    
    /** Wait without a timeout, polling at the job's sleep interval. */
    public JobStatusType waitForCompletion() throws JobException
    {
        return wait(Duration.ofSeconds(_entry.getSleepIntervalSeconds()), null);
    }
    
    /* ---------------------------------------------------------------------- */
    /* get:                                                                   */
    /* ---------------------------------------------------------------------- */
    /** Wait at most the given time for the job to finish, polling at the 
     * job's sleep interval, and return whatever status it has then.  Unlike
     * {@link #wait(Duration, Duration)} this does not treat an unfinished job
     * as an error.
     * 
     * @param timeout the maximum time to wait or null to wait indefinitely
     * @return the terminal status, or the last recorded status on timeout
     * @throws JobException if a status query fails or the thread is interrupted
     */
    public JobStatusType get(Duration timeout) throws JobException
    {
        try {return wait(Duration.ofSeconds(_entry.getSleepIntervalSeconds()), timeout);}
        catch (WaitTimeoutException e) {return e.getLastStatus();}
    }
    
    /* ---------------------------------------------------------------------- */
    /* cancel:                                                                */
    /* ---------------------------------------------------------------------- */
    /** Ask the scheduler to cancel the job.  Does nothing if the job is 
     * already finished.  If the cancel command fails, the job's status is
     * queried once more; a job that finished in the meantime is not an error.
     * 
     * @throws CancelException if the job could not be cancelled
     */
    public void cancel() throws JobException
    {
        if (_entry.getStatus().isTerminal()) return;
        
        String cmd = _entry.getCancelCommand();
        String problem;
        try {
            CommandResult result = _runner.execute(cmd, null, _config.getCommandTimeout());
            problem = result.isSuccess() ? null : 
                          "exit code " + result.getExitCode() + ": " + result.getCombinedOutput().strip();
        }
        catch (CommandRunnerException e) {problem = e.getMessage();}
        
        // Recheck the status when the command didn't succeed.
        if (problem != null) {
            _log.warn(MsgUtils.getMsg("JOBS_CANCEL_CMD_ERROR", _entry.getJobId(), cmd, problem));
            if (status().isTerminal()) return;
            String msg = MsgUtils.getMsg("JOBS_CANCEL_FAILED", _entry.getJobId(), _scheduler.getName(), problem);
            throw new CancelException(msg);
        }
        
        JobStatusType prevStatus = _entry.getStatus();
        _entry.setStatus(JobStatusType.CANCELLED);
        _entry.setFailedPolls(0);
        persist();
        _log.info(MsgUtils.getMsg("JOBS_STATUS_CHANGED", _entry.getJobId(), _scheduler.getName(),
                                  prevStatus, JobStatusType.CANCELLED));
    }
    
    /** True if the job has reached a terminal state. */
    public boolean ready() throws JobException {return status().isTerminal();}
    
    /** True if the job completed successfully.
     * 
     * @throws IllegalStateException if the job hasn't finished yet
     */
    public boolean successful() throws JobException
    {
        JobStatusType status = status();
        if (!status.isTerminal()) 
            throw new IllegalStateException(MsgUtils.getMsg("JOBS_NOT_FINISHED", _entry.getJobId(), status));
        return status.isSuccessful();
    }
    
    /* ---------------------------------------------------------------------- */
    /* dump:                                                                  */
    /* ---------------------------------------------------------------------- */
    /** Write this job's state to a file in the versioned cache format.  The
     * file is replaced atomically, so it always holds a complete record.
     */
    public void dump(Path file) throws JobException
    {
        try {JobUtils.writeAtomically(file, CacheEntryCodec.toJson(_entry));}
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBS_CACHE_WRITE_ERROR", file, e.getMessage());
            throw new JobException(msg, e);
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* load:                                                                  */
    /* ---------------------------------------------------------------------- */
    /** Recreate a job tracker from a file written by {@link #dump(Path)}.
     * 
     * @param file the dump file
     * @param submitter supplies the scheduler, runner and cache for the job
     * @return the tracker
     * @throws CacheCorruptionException if the file can't be read or parsed
     * @throws JobException if the job's backend is not known
     */
    public static AsyncResult load(Path file, JobSubmitter submitter) throws JobException
    {
        String json;
        try {json = Files.readString(file, StandardCharsets.UTF_8);}
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBS_CACHE_CORRUPT", file, e.getMessage());
            throw new CacheCorruptionException(msg, file.toString(), e);
        }
        return submitter.resume(CacheEntryCodec.fromJson(json, file.toString()));
    }
    
    @Override
    public String toString() {return "AsyncResult[" + _entry + "]";}
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* queryStatus:                                                           */
    /* ---------------------------------------------------------------------- */
    /** Run one status command, UNKNOWN if it can't be run or interpreted. */
    private JobStatusType queryStatus(String cmd)
    {
        try {
            CommandResult result = _runner.execute(cmd, null, _config.getCommandTimeout());
            return _scheduler.parseStatus(result);
        }
        catch (CommandRunnerException e) {
            _log.warn(MsgUtils.getMsg("JOBS_STATUS_CMD_ERROR", _entry.getJobId(), cmd, e.getMessage()));
            return JobStatusType.UNKNOWN;
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* runEpilogueOnce:                                                       */
    /* ---------------------------------------------------------------------- */
    private void runEpilogueOnce() throws JobException
    {
        if (_entry.getEpilogue() == null || _entry.isEpilogueDone()) return;
        
        // Failure leaves the epilogue pending.
        _hookRunner.run("epilogue", _entry.getEpilogue());
        _entry.setEpilogueDone(true);
        persist();
    }
    
    /* ---------------------------------------------------------------------- */
    /* persist:                                                               */
    /* ---------------------------------------------------------------------- */
    private void persist() throws JobException
    {
        _entry.touch();
        _cache.write(_entry);
    }
    
    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public String getJobId() {return _entry.getJobId();}
    public String getCacheKey() {return _entry.getCacheKey();}
    public String getBackend() {return _entry.getBackend();}
    public String getRemote() {return _entry.getRemote();}
    public String getWorkdir() {return _entry.getWorkdir();}
    public int getSleepInterval() {return _entry.getSleepIntervalSeconds();}
    public int getFailedPolls() {return _entry.getFailedPolls();}
    
    /** The last recorded status, without querying the scheduler. */
    public JobStatusType getCachedStatus() {return _entry.getStatus();}
    
    /** A copy of the persisted state. */
    public CacheEntry getEntry() {return _entry.copy();}
}
