package org.clusterjob.jobs.launchers;

import java.time.Duration;
import java.time.Instant;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.clusterjob.jobs.cache.CacheKeys;
import org.clusterjob.jobs.cache.CacheStore;
import org.clusterjob.jobs.cache.DisabledCacheStore;
import org.clusterjob.jobs.cache.FileCacheStore;
import org.clusterjob.jobs.config.JobsConfig;
import org.clusterjob.jobs.exceptions.BackendDefinitionException;
import org.clusterjob.jobs.exceptions.CacheCorruptionException;
import org.clusterjob.jobs.exceptions.CommandRunnerException;
import org.clusterjob.jobs.exceptions.JobException;
import org.clusterjob.jobs.exceptions.SubmissionException;
import org.clusterjob.jobs.exceptions.TranslationException;
import org.clusterjob.jobs.model.CacheEntry;
import org.clusterjob.jobs.model.JobDescription;
import org.clusterjob.jobs.model.RenderedScript;
import org.clusterjob.jobs.model.enumerations.CoreResource;
import org.clusterjob.jobs.model.enumerations.JobStatusType;
import org.clusterjob.jobs.monitors.AsyncResult;
import org.clusterjob.jobs.runners.CommandResult;
import org.clusterjob.jobs.runners.CommandRunner;
import org.clusterjob.jobs.runners.CommandRunnerFactory;
import org.clusterjob.jobs.runners.HookScriptRunner;
import org.clusterjob.jobs.schedulers.BackendRegistry;
import org.clusterjob.jobs.schedulers.JobScheduler;
import org.clusterjob.jobs.stagers.JobScriptRenderer;
import org.clusterjob.jobs.utils.JobUtils;
import org.clusterjob.jobs.utils.MsgUtils;

/** Submits jobs to batch schedulers and hands back trackers for them.
 * 
 * A submission is idempotent per cache key.  If the cache already records a
 * job under the key, a tracker for that job is returned and nothing is sent to
 * the scheduler, unless the recorded job failed or was cancelled or the caller
 * forces a new submission.  Otherwise the key is claimed so no other process
 * can submit under it at the same time, the prologue runs, the script is
 * rendered and staged next to its auxiliary scripts, and the scheduler's submit
 * command is run in the job's directory.  Failed submissions are never 
 * retried.
 * 
 * @author clusterjob
 */
public final class JobSubmitter 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(JobSubmitter.class);
    
    // Poll interval bounds and default, in seconds.
    public static final int MIN_SLEEP_INTERVAL     = 10;
    public static final int MAX_SLEEP_INTERVAL     = 1800;
    public static final int DEFAULT_SLEEP_INTERVAL = 60;
    
    // A claim older than this many command timeouts belongs to a dead process.
    private static final int CLAIM_TIMEOUT_FACTOR = 5;
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final JobsConfig           _config;
    private final BackendRegistry      _registry;
    private final CommandRunnerFactory _runners;
    private final CacheStore           _cache;
    private final JobScriptRenderer    _renderer;
    private final HookScriptRunner     _hookRunner;
    
    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    public JobSubmitter(JobsConfig config, BackendRegistry registry, CommandRunnerFactory runners,
                        CacheStore cache)
    {
        _config     = config;
        _registry   = registry;
        _runners    = runners;
        _cache      = cache;
        _renderer   = new JobScriptRenderer(config.getDefaultShell());
        _hookRunner = new HookScriptRunner(runners.getRunner(null), config.getDefaultShell(), 
                                           config.getCommandTimeout());
    }
    
    /* ---------------------------------------------------------------------- */
    /* create:                                                                */
    /* ---------------------------------------------------------------------- */
    /** Create a submitter with the built-in backends, local and SSH runners
     * and the cache store the configuration calls for.
     */
    public static JobSubmitter create(JobsConfig config) throws BackendDefinitionException
    {
        return new JobSubmitter(config, BackendRegistry.load(), new CommandRunnerFactory(config), 
                                createCacheStore(config));
    }
    
    /** The cache store for a configuration: file based, or disabled if no
     * cache directory is set.
     */
    public static CacheStore createCacheStore(JobsConfig config)
    {
        if (!config.isCacheEnabled()) return new DisabledCacheStore();
        Duration claimTimeout = config.getCommandTimeout().multipliedBy(CLAIM_TIMEOUT_FACTOR);
        return new FileCacheStore(config.getCacheDir(), config.getCachePrefix(), claimTimeout);
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /** Submit under the derived cache key without forcing. */
    public AsyncResult submit(JobDescription job) throws JobException {return submit(job, null, false);}
    
    /* ---------------------------------------------------------------------- */
    /* submit:                                                                */
    /* ---------------------------------------------------------------------- */
    /** Submit a job unless the cache already knows it.
     * 
     * @param job the job description
     * @param cacheKey the cache key or null to derive one from the job
     * @param force submit even if the cache records a job under the key
     * @return the tracker for the new or cached job
     * @throws TranslationException if the job can't be expressed for its backend
     * @throws SubmissionException if the scheduler didn't accept the job
     * @throws CacheCorruptionException if the cached entry is unreadable
     * @throws JobException on other failures
     */
    public AsyncResult submit(JobDescription job, String cacheKey, boolean force) 
     throws JobException
    {
        return submit(job, cacheKey, force, true);
    }
    
    /** Submit a job unless the cache already knows it.  Without retry, a 
     * cached job that failed or was cancelled is returned as is instead of 
     * being submitted again.
     * 
     * @param job the job description
     * @param cacheKey the cache key or null to derive one from the job
     * @param force submit even if the cache records a job under the key
     * @param retry resubmit a cached job that failed or was cancelled
     * @return the tracker for the new or cached job
     * @throws JobException as for {@link #submit(JobDescription, String, boolean)}
     */
    public AsyncResult submit(JobDescription job, String cacheKey, boolean force, boolean retry) 
     throws JobException
    {
        JobScheduler scheduler = getScheduler(job);
        String filename = job.resolveFilename(scheduler.getExtension());
        String key = StringUtils.isBlank(cacheKey) ? CacheKeys.derive(job, scheduler.getName(), filename) : cacheKey;
        
        // Fast path, no claim needed to find an existing job.
        if (!force) {
            var cached = lookupReusable(key, retry);
            if (cached != null) return cached;
        }
        
        // Only the claim holder can submit.
        if (!_cache.claim(key, force)) {
            String msg = MsgUtils.getMsg("JOBS_SUBMIT_CLAIMED", key);
            throw new SubmissionException(msg);
        }
        try {
            // Someone may have finished submitting while we were claiming.
            if (!force) {
                var cached = lookupReusable(key, retry);
                if (cached != null) return cached;
            }
            return doSubmit(job, scheduler, filename, key);
        }
        finally {_cache.release(key);}
    }
    
    /* ---------------------------------------------------------------------- */
    /* submitAndWait:                                                         */
    /* ---------------------------------------------------------------------- */
    /** Submit a job as {@link #submit(JobDescription, String, boolean, boolean)}
     * does and block until it finishes, polling at the job's sleep interval.
     * 
     * @return the job's terminal status
     */
    public JobStatusType submitAndWait(JobDescription job, String cacheKey, boolean force, boolean retry)
     throws JobException
    {
        return submit(job, cacheKey, force, retry).waitForCompletion();
    }
    
    /** Submit under the derived cache key and block until the job finishes. */
    public JobStatusType submitAndWait(JobDescription job) throws JobException
    {
        return submitAndWait(job, null, false, true);
    }
    
    /* ---------------------------------------------------------------------- */
    /* render:                                                                */
    /* ---------------------------------------------------------------------- */
    /** Render a job for its backend without side effects. */
    public RenderedScript render(JobDescription job) throws JobException
    {
        return _renderer.render(job, getScheduler(job).getDescriptor());
    }
    
    /* ---------------------------------------------------------------------- */
    /* write:                                                                 */
    /* ---------------------------------------------------------------------- */
    /** Render a job and write its script and auxiliary scripts to the job
     * directory, on the remote host if the job has one, without submitting.
     * 
     * @return the path of the job script
     */
    public String write(JobDescription job) throws JobException
    {
        var rendered = render(job);
        return stage(job, rendered, _runners.getRunner(job.getRemote()));
    }
    
    /** Remove all cached jobs and claims. */
    public void clearCache() throws JobException {_cache.clear();}
    
    /* ---------------------------------------------------------------------- */
    /* resume:                                                                */
    /* ---------------------------------------------------------------------- */
    /** Rebuild the tracker for a persisted job. */
    public AsyncResult resume(CacheEntry entry) throws JobException
    {
        var scheduler = _registry.getScheduler(entry.getBackend());
        return new AsyncResult(entry, scheduler, _runners.getRunner(entry.getRemote()), 
                               _hookRunner, _cache, _config);
    }
    
    /* ---------------------------------------------------------------------- */
    /* computeSleepInterval:                                                  */
    /* ---------------------------------------------------------------------- */
    /** The poll interval for a job: the explicit interval if the job has one,
     * otherwise a tenth of its walltime within the interval bounds, or the
     * default if the job has no usable walltime.
     */
    public static int computeSleepInterval(JobDescription job)
    {
        if (job.getSleepInterval() != null) return job.getSleepInterval();
        Object time = job.getResources().get(CoreResource.TIME.getKey());
        if (time == null || Boolean.FALSE.equals(time)) return DEFAULT_SLEEP_INTERVAL;
        
        try {
            long interval = JobUtils.timeToSeconds(String.valueOf(time)) / 10;
            return (int) Math.max(MIN_SLEEP_INTERVAL, Math.min(MAX_SLEEP_INTERVAL, interval));
        }
        catch (TranslationException e) {
            _log.warn(MsgUtils.getMsg("JOBS_SLEEP_INTERVAL_DEFAULT", job.getJobname(), time, 
                                      DEFAULT_SLEEP_INTERVAL));
            return DEFAULT_SLEEP_INTERVAL;
        }
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* doSubmit:                                                              */
    /* ---------------------------------------------------------------------- */
    private AsyncResult doSubmit(JobDescription job, JobScheduler scheduler, String filename, String key)
     throws JobException
    {
        // Render before anything runs so translation errors have no side effects.
        var rendered = _renderer.render(job, scheduler.getDescriptor());
        if (rendered.getPrologue() != null) _hookRunner.run("prologue", rendered.getPrologue());
        
        CommandRunner runner = _runners.getRunner(job.getRemote());
        stage(job, rendered, runner);
        
        // Submit from the job directory.
        String dir = JobUtils.joinPath(job.getRootdir(), job.getWorkdir());
        String cmd = scheduler.getSubmitCommand(filename, job.getJobname());
        if (_log.isDebugEnabled()) 
            _log.debug(MsgUtils.getMsg("JOBS_SUBMIT_CMD", scheduler.getName(), key, cmd));
        
        CommandResult result;
        try {result = runner.execute(cmd, dir, _config.getCommandTimeout());}
        catch (CommandRunnerException e) {
            String msg = MsgUtils.getMsg("JOBS_SUBMIT_ERROR", scheduler.getName(), key, cmd, e.getMessage());
            _log.error(msg);
            throw new SubmissionException(msg, cmd, null, null, null, e);
        }
        if (!result.isSuccess()) {
            String msg = MsgUtils.getMsg("JOBS_SUBMIT_REJECTED", scheduler.getName(), key, cmd, 
                                         result.getExitCode(), result.getStderr().strip());
            _log.error(msg);
            throw new SubmissionException(msg, cmd, result.getExitCode(), result.getStdout(), result.getStderr());
        }
        
        // The job exists now, but we can't track it without its id.
        String jobId = scheduler.parseJobId(result.getStdout());
        if (StringUtils.isBlank(jobId)) {
            String msg = MsgUtils.getMsg("JOBS_SUBMIT_NO_JOB_ID", scheduler.getName(), key, cmd, 
                                         result.getStdout().strip());
            _log.error(msg);
            throw new SubmissionException(msg, cmd, result.getExitCode(), result.getStdout(), result.getStderr());
        }
        
        // Record the new job.
        var entry = new CacheEntry();
        entry.setCacheKey(key);
        entry.setJobId(jobId);
        entry.setBackend(scheduler.getName());
        entry.setRemote(job.getRemote());
        entry.setWorkdir(dir);
        entry.setStatus(JobStatusType.PENDING);
        entry.setSubmittedAt(Instant.now().toString());
        entry.setStatusCommand(scheduler.getStatusCommand(jobId));
        entry.setFallbackStatusCommand(scheduler.getFallbackStatusCommand(jobId));
        entry.setCancelCommand(scheduler.getCancelCommand(jobId));
        entry.setSleepIntervalSeconds(computeSleepInterval(job));
        entry.setEpilogue(rendered.getEpilogue());
        entry.touch();
        _cache.write(entry);
        
        _log.info(MsgUtils.getMsg("JOBS_SUBMITTED", job.getJobname(), jobId, scheduler.getName(),
                                  job.isRemote() ? job.getRemote() : "localhost", key));
        return resume(entry);
    }
    
    /* ---------------------------------------------------------------------- */
    /* stage:                                                                 */
    /* ---------------------------------------------------------------------- */
    /** Write the job script and auxiliary scripts as executables. */
    private String stage(JobDescription job, RenderedScript rendered, CommandRunner runner)
     throws SubmissionException
    {
        String dir = JobUtils.joinPath(job.getRootdir(), job.getWorkdir());
        String scriptPath = JobUtils.joinPath(dir, rendered.getFilename());
        String path = scriptPath;
        try {
            runner.stageFile(rendered.getScript(), scriptPath, true);
            for (var aux : rendered.getAuxScripts().entrySet()) {
                path = JobUtils.joinPath(dir, aux.getKey());
                runner.stageFile(aux.getValue(), path, true);
            }
        }
        catch (CommandRunnerException e) {
            String msg = MsgUtils.getMsg("JOBS_STAGE_ERROR", job.getJobname(), runner.getHost(), path, e.getMessage());
            _log.error(msg);
            throw new SubmissionException(msg, e);
        }
        return scriptPath;
    }
    
    /* ---------------------------------------------------------------------- */
    /* lookupReusable:                                                        */
    /* ---------------------------------------------------------------------- */
    /** A tracker for the cached job under the key, or null if there is no
     * entry or the cached job failed or was cancelled.
     */
    private AsyncResult lookupReusable(String key, boolean retry) throws JobException
    {
        CacheEntry entry = _cache.read(key);
        if (entry == null) return null;
        if (retry && entry.getStatus().isResubmittable()) {
            _log.info(MsgUtils.getMsg("JOBS_RESUBMITTING", key, entry.getJobId(), entry.getStatus()));
            return null;
        }
        _log.info(MsgUtils.getMsg("JOBS_SUBMIT_CACHED", key, entry.getJobId(), entry.getStatus()));
        return resume(entry);
    }
    
    private JobScheduler getScheduler(JobDescription job) throws BackendDefinitionException
    {
        return _registry.getScheduler(job.resolveBackend(_config.getDefaultBackend()));
    }
    
    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public JobsConfig getConfig() {return _config;}
    public BackendRegistry getRegistry() {return _registry;}
    public CacheStore getCache() {return _cache;}
}
