package org.clusterjob.jobs.launchers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import org.clusterjob.jobs.cache.FileCacheStore;
import org.clusterjob.jobs.config.JobsConfig;
import org.clusterjob.jobs.exceptions.BackendDefinitionException;
import org.clusterjob.jobs.exceptions.CacheCorruptionException;
import org.clusterjob.jobs.exceptions.CommandRunnerException;
import org.clusterjob.jobs.exceptions.HookScriptException;
import org.clusterjob.jobs.exceptions.JobException;
import org.clusterjob.jobs.exceptions.SubmissionException;
import org.clusterjob.jobs.exceptions.TranslationException;
import org.clusterjob.jobs.model.JobDescription;
import org.clusterjob.jobs.model.enumerations.JobStatusType;
import org.clusterjob.jobs.runners.CommandResult;
import org.clusterjob.jobs.runners.CommandRunnerFactory;
import org.clusterjob.jobs.runners.LocalCommandRunner;
import org.clusterjob.jobs.runners.ScriptedCommandRunner;
import org.clusterjob.jobs.schedulers.BackendRegistry;

@Test(groups={"unit"})
public class JobSubmitterTest 
{
    private static final String REMOTE_HOST = "cluster.example.org";
    private static final String HELLO_KEY   = "hello-hello.slr-slurm";
    
    private Path                  _dir;
    private JobsConfig            _config;
    private ScriptedCommandRunner _local;
    private ScriptedCommandRunner _remote;
    private JobSubmitter          _submitter;
    
    @BeforeMethod
    public void setup() throws IOException, JobException
    {
        _dir = Files.createTempDirectory("clusterjob-submit-test");
        _config = JobsConfig.builder().cacheDir(_dir).build();
        _local = new ScriptedCommandRunner();
        _remote = new ScriptedCommandRunner(REMOTE_HOST);
        _submitter = newSubmitter(_config);
    }
    
    @AfterMethod
    public void cleanup() throws IOException {FileUtils.deleteDirectory(_dir.toFile());}
    
    /* ---------------------------------------------------------------------- */
    /* submitTest:                                                            */
    /* ---------------------------------------------------------------------- */
    @Test
    public void submitTest() throws JobException
    {
        _local.replyOut("sbatch", "Submitted batch job 101\n");
        var result = _submitter.submit(hello().time("01:00:00").build());
        
        Assert.assertEquals(result.getJobId(), "101");
        Assert.assertEquals(result.getBackend(), "slurm");
        Assert.assertEquals(result.getCacheKey(), HELLO_KEY);
        Assert.assertNull(result.getRemote());
        Assert.assertEquals(result.getCachedStatus(), JobStatusType.PENDING);
        Assert.assertEquals(result.getSleepInterval(), 360);
        
        // The script is staged before it's submitted.
        Assert.assertEquals(_local.getCommands(), List.of("sbatch hello.slr"));
        String script = _local.getStagedFiles().get("hello.slr");
        Assert.assertTrue(script.startsWith("#!/bin/bash\n#SBATCH --job-name=hello\n"), script);
        
        // Recorded in the cache with the claim released.
        var entry = store().read(HELLO_KEY);
        Assert.assertEquals(entry.getJobId(), "101");
        Assert.assertEquals(entry.getStatus(), JobStatusType.PENDING);
        Assert.assertNotNull(entry.getSubmittedAt());
        Assert.assertTrue(entry.getStatusCommand().contains("101"));
        Assert.assertEquals(entry.getCancelCommand(), "scancel 101");
        Assert.assertFalse(Files.exists(store().getClaimPath(HELLO_KEY)));
    }
    
    @Test
    public void idempotentSubmitTest() throws JobException
    {
        _local.replyOut("sbatch", "Submitted batch job 101\n", "Submitted batch job 102\n");
        var first = _submitter.submit(hello().build());
        var second = _submitter.submit(hello().build());
        Assert.assertEquals(second.getJobId(), first.getJobId());
        Assert.assertEquals(_local.getCommands("sbatch").size(), 1);
        
        // A new submitter over the same cache directory sees the job too.
        var third = newSubmitter(_config).submit(hello().build());
        Assert.assertEquals(third.getJobId(), "101");
        Assert.assertEquals(_local.getCommands("sbatch").size(), 1);
    }
    
    @Test
    public void forceSubmitTest() throws JobException
    {
        _local.replyOut("sbatch", "Submitted batch job 101\n", "Submitted batch job 102\n");
        Assert.assertEquals(_submitter.submit(hello().build()).getJobId(), "101");
        Assert.assertEquals(_submitter.submit(hello().build(), null, true).getJobId(), "102");
        Assert.assertEquals(_local.getCommands("sbatch").size(), 2);
        
        // The forced job replaced the cached one.
        Assert.assertEquals(_submitter.submit(hello().build()).getJobId(), "102");
        Assert.assertEquals(_local.getCommands("sbatch").size(), 2);
    }
    
    @Test
    public void explicitCacheKeyTest() throws JobException
    {
        _local.replyOut("sbatch", "Submitted batch job 101\n", "Submitted batch job 102\n");
        var first = _submitter.submit(hello().build(), "experiment-7", false);
        var other = JobDescription.builder("different", "date\n").build();
        var second = _submitter.submit(other, "experiment-7", false);
        
        Assert.assertEquals(second.getJobId(), first.getJobId());
        Assert.assertEquals(second.getCacheKey(), "experiment-7");
        Assert.assertEquals(_local.getCommands("sbatch").size(), 1);
    }
    
    /* ---------------------------------------------------------------------- */
    /* rejectedSubmitTest:                                                    */
    /* ---------------------------------------------------------------------- */
    @Test
    public void rejectedSubmitTest() throws JobException
    {
        String stderr = "sbatch: error: invalid partition specified: nope\n";
        _local.reply("sbatch", new CommandResult(1, "", stderr));
        try {
            _submitter.submit(hello().queue("nope").build());
            Assert.fail("Expected the submission to fail");
        }
        catch (SubmissionException e) {
            Assert.assertEquals(e.getStderr(), stderr);
            Assert.assertEquals(e.getExitCode(), Integer.valueOf(1));
            Assert.assertEquals(e.getCommand(), "sbatch hello.slr");
            Assert.assertTrue(e.getMessage().contains("invalid partition specified"), e.getMessage());
        }
        
        // Never retried, nothing cached, claim released.
        Assert.assertEquals(_local.getCommands("sbatch").size(), 1);
        Assert.assertNull(store().read(HELLO_KEY));
        Assert.assertFalse(Files.exists(store().getClaimPath(HELLO_KEY)));
    }
    
    @Test
    public void missingJobIdTest() throws JobException
    {
        _local.replyOut("sbatch", "queued, maybe\n");
        try {
            _submitter.submit(hello().build());
            Assert.fail("Expected the submission to fail");
        }
        catch (SubmissionException e) {
            Assert.assertEquals(e.getExitCode(), Integer.valueOf(0));
            Assert.assertEquals(e.getStdout(), "queued, maybe\n");
            Assert.assertTrue(e.getMessage().contains("JOBS_SUBMIT_NO_JOB_ID"), e.getMessage());
        }
        Assert.assertNull(store().read(HELLO_KEY));
    }
    
    @Test
    public void runnerFailureTest() throws JobException
    {
        _local.fail("sbatch", "connection reset by peer");
        try {
            _submitter.submit(hello().build());
            Assert.fail("Expected the submission to fail");
        }
        catch (SubmissionException e) {
            Assert.assertTrue(e.getCause() instanceof CommandRunnerException);
            Assert.assertNull(e.getExitCode());
        }
        Assert.assertNull(store().read(HELLO_KEY));
    }
    
    /* ---------------------------------------------------------------------- */
    /* resubmitAfterFailureTest:                                              */
    /* ---------------------------------------------------------------------- */
    @Test
    public void resubmitAfterFailureTest() throws JobException
    {
        _local.replyOut("sbatch", "Submitted batch job 101\n", "Submitted batch job 102\n");
        _local.replyOut("squeue", "FAILED\n");
        
        var first = _submitter.submit(hello().build());
        Assert.assertEquals(first.status(), JobStatusType.FAILED);
        
        var second = _submitter.submit(hello().build());
        Assert.assertEquals(second.getJobId(), "102");
        Assert.assertEquals(second.getCachedStatus(), JobStatusType.PENDING);
        Assert.assertEquals(_local.getCommands("sbatch").size(), 2);
    }
    
    @Test
    public void resubmitAfterCancelTest() throws JobException
    {
        _local.replyOut("sbatch", "Submitted batch job 101\n", "Submitted batch job 102\n");
        
        var first = _submitter.submit(hello().build());
        first.cancel();
        Assert.assertEquals(first.getCachedStatus(), JobStatusType.CANCELLED);
        
        Assert.assertEquals(_submitter.submit(hello().build()).getJobId(), "102");
        Assert.assertEquals(_local.getCommands("sbatch").size(), 2);
    }
    
    @Test
    public void noRetryAfterFailureTest() throws JobException
    {
        _local.replyOut("sbatch", "Submitted batch job 101\n", "Submitted batch job 102\n");
        _local.replyOut("squeue", "FAILED\n");
        
        var first = _submitter.submit(hello().build());
        Assert.assertEquals(first.status(), JobStatusType.FAILED);
        
        // Without retry the failed job is what the caller gets back.
        var second = _submitter.submit(hello().build(), null, false, false);
        Assert.assertEquals(second.getJobId(), "101");
        Assert.assertEquals(second.getCachedStatus(), JobStatusType.FAILED);
        Assert.assertFalse(second.successful());
        Assert.assertEquals(_local.getCommands("sbatch").size(), 1);
        
        // Forcing still submits.
        Assert.assertEquals(_submitter.submit(hello().build(), null, true, false).getJobId(), "102");
    }
    
    @Test
    public void submitAndWaitTest() throws JobException
    {
        _local.replyOut("sbatch", "Submitted batch job 101\n");
        _local.replyOut("squeue", "COMPLETED\n");
        
        Assert.assertEquals(_submitter.submitAndWait(hello().sleepInterval(1).build()), JobStatusType.COMPLETED);
        Assert.assertEquals(store().read(HELLO_KEY).getStatus(), JobStatusType.COMPLETED);
        
        // A finished job is answered from the cache.
        Assert.assertEquals(_submitter.submitAndWait(hello().sleepInterval(1).build(), null, false, true), 
                            JobStatusType.COMPLETED);
        Assert.assertEquals(_local.getCommands("sbatch").size(), 1);
        Assert.assertEquals(_local.getCommands("squeue").size(), 1);
    }
    
    @Test
    public void completedJobNotResubmittedTest() throws JobException
    {
        _local.replyOut("sbatch", "Submitted batch job 101\n", "Submitted batch job 102\n");
        _local.replyOut("squeue", "COMPLETED\n");
        
        var first = _submitter.submit(hello().build());
        Assert.assertTrue(first.ready());
        
        var second = _submitter.submit(hello().build());
        Assert.assertEquals(second.getJobId(), "101");
        Assert.assertEquals(second.getCachedStatus(), JobStatusType.COMPLETED);
        Assert.assertEquals(_local.getCommands("sbatch").size(), 1);
    }
    
    @Test
    public void corruptCacheTest() throws JobException, IOException
    {
        Files.writeString(store().getEntryPath(HELLO_KEY), "{\"jobId\": ", StandardCharsets.UTF_8);
        try {
            _submitter.submit(hello().build());
            Assert.fail("Expected a corrupt cache entry");
        }
        catch (CacheCorruptionException e) {
            Assert.assertEquals(e.getLocation(), store().getEntryPath(HELLO_KEY).toString());
        }
        Assert.assertTrue(_local.getCommands("sbatch").isEmpty());
    }
    
    @Test
    public void claimedKeyTest() throws JobException
    {
        _local.replyOut("sbatch", "Submitted batch job 101\n");
        
        // Another process is in the middle of submitting.
        Assert.assertTrue(store().claim(HELLO_KEY, false));
        try {
            _submitter.submit(hello().build());
            Assert.fail("Expected the claim to block the submission");
        }
        catch (SubmissionException e) {
            Assert.assertTrue(e.getMessage().contains("JOBS_SUBMIT_CLAIMED"), e.getMessage());
        }
        Assert.assertTrue(_local.getCommands("sbatch").isEmpty());
        
        Assert.assertEquals(_submitter.submit(hello().build(), null, true).getJobId(), "101");
    }
    
    /* ---------------------------------------------------------------------- */
    /* prologueTest:                                                          */
    /* ---------------------------------------------------------------------- */
    @Test
    public void prologueTest() throws JobException
    {
        _local.replyOut("sbatch", "Submitted batch job 101\n");
        var job = hello().rootdir("/scratch").workdir("run1").prologue("mkdir -p {fulldir}").build();
        _submitter.submit(job);
        
        // The prologue runs locally before the submission.
        var commands = _local.getCommands();
        Assert.assertEquals(commands.size(), 2, commands.toString());
        Assert.assertTrue(commands.get(0).contains("clusterjob-prologue-"), commands.get(0));
        Assert.assertEquals(commands.get(1), "sbatch hello.slr");
        Assert.assertEquals(_local.getWorkdirs().get(1), "/scratch/run1");
        Assert.assertTrue(_local.getStagedFiles().containsValue("#!/bin/bash\nmkdir -p /scratch/run1"));
        Assert.assertTrue(_local.getStagedFiles().containsKey("/scratch/run1/hello.slr"));
    }
    
    @Test
    public void prologueFailureTest() throws JobException
    {
        _local.reply("clusterjob-prologue", new CommandResult(3, "", "disk full"));
        _local.replyOut("sbatch", "Submitted batch job 101\n");
        try {
            _submitter.submit(hello().prologue("exit 3").build());
            Assert.fail("Expected the prologue to fail");
        }
        catch (HookScriptException e) {
            Assert.assertTrue(e.getMessage().contains("disk full"), e.getMessage());
        }
        Assert.assertTrue(_local.getCommands("sbatch").isEmpty());
        Assert.assertFalse(_local.getStagedFiles().containsKey("hello.slr"));
        Assert.assertNull(store().read(HELLO_KEY));
    }
    
    @Test
    public void translationErrorHasNoSideEffectsTest() throws JobException
    {
        var job = hello().resource("nodes", "two").prologue("touch marker").build();
        try {
            _submitter.submit(job);
            Assert.fail("Expected a translation error");
        }
        catch (TranslationException e) {}
        Assert.assertTrue(_local.getCommands().isEmpty());
        Assert.assertTrue(_local.getStagedFiles().isEmpty());
    }
    
    /* ---------------------------------------------------------------------- */
    /* remoteSubmitTest:                                                      */
    /* ---------------------------------------------------------------------- */
    @Test
    public void remoteSubmitTest() throws JobException
    {
        _remote.replyOut("sbatch", "Submitted batch job 9001\n");
        _remote.replyOut("squeue", "RUNNING\n");
        var job = hello().remote(REMOTE_HOST).rootdir("/scratch").workdir("run1")
                    .auxScript("post.sh", "echo $CLUSTERJOB_ID").build();
        var result = _submitter.submit(job);
        
        Assert.assertEquals(result.getRemote(), REMOTE_HOST);
        Assert.assertEquals(result.getWorkdir(), "/scratch/run1");
        Assert.assertTrue(_remote.getStagedFiles().containsKey("/scratch/run1/hello.slr"));
        Assert.assertEquals(_remote.getStagedFiles().get("/scratch/run1/post.sh"), "echo $SLURM_JOB_ID");
        Assert.assertEquals(_remote.getWorkdirs().get(0), "/scratch/run1");
        Assert.assertTrue(_local.getCommands().isEmpty());
        
        // Status queries go to the same host.
        Assert.assertEquals(result.status(), JobStatusType.RUNNING);
        Assert.assertEquals(_remote.getCommands("squeue").size(), 1);
    }
    
    @Test
    public void writeAndRenderTest() throws JobException
    {
        var job = hello().rootdir("/scratch").backend("pbs").build();
        Assert.assertEquals(_submitter.render(job).getFilename(), "hello.pbs");
        
        String path = _submitter.write(job);
        Assert.assertEquals(path, "/scratch/hello.pbs");
        Assert.assertTrue(_local.getStagedFiles().get(path).contains("#PBS -N hello\n"));
        Assert.assertTrue(_local.getCommands().isEmpty());
    }
    
    @Test(expectedExceptions = BackendDefinitionException.class)
    public void unknownBackendTest() throws JobException
    {
        _submitter.submit(hello().backend("condor").build());
    }
    
    @Test
    public void defaultBackendTest() throws JobException
    {
        var submitter = newSubmitter(_config.toBuilder().defaultBackend("lsf").build());
        _local.replyOut("bsub", "Job <77> is submitted to queue <normal>.\n");
        
        var result = submitter.submit(hello().build());
        Assert.assertEquals(result.getJobId(), "77");
        Assert.assertEquals(result.getBackend(), "lsf");
        Assert.assertEquals(_local.getCommands("bsub"), List.of("bsub < hello.lsf"));
    }
    
    @Test
    public void cacheDisabledTest() throws JobException
    {
        var submitter = newSubmitter(JobsConfig.defaults());
        _local.replyOut("sbatch", "Submitted batch job 101\n", "Submitted batch job 102\n");
        Assert.assertEquals(submitter.submit(hello().build()).getJobId(), "101");
        Assert.assertEquals(submitter.submit(hello().build()).getJobId(), "102");
        Assert.assertFalse(submitter.getCache().isEnabled());
    }
    
    @Test
    public void clearCacheTest() throws JobException
    {
        _local.replyOut("sbatch", "Submitted batch job 101\n", "Submitted batch job 102\n");
        _submitter.submit(hello().build());
        _submitter.clearCache();
        Assert.assertNull(store().read(HELLO_KEY));
        Assert.assertEquals(_submitter.submit(hello().build()).getJobId(), "102");
    }
    
    @Test
    public void sleepIntervalTest()
    {
        Assert.assertEquals(JobSubmitter.computeSleepInterval(hello().build()), 60);
        Assert.assertEquals(JobSubmitter.computeSleepInterval(hello().time("01:00:00").build()), 360);
        Assert.assertEquals(JobSubmitter.computeSleepInterval(hello().time("1").build()), 10);
        Assert.assertEquals(JobSubmitter.computeSleepInterval(hello().time("5-00").build()), 1800);
        Assert.assertEquals(JobSubmitter.computeSleepInterval(hello().time("soon").build()), 60);
        Assert.assertEquals(JobSubmitter.computeSleepInterval(hello().time("1:00:00").sleepInterval(42).build()), 42);
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    private JobSubmitter newSubmitter(JobsConfig config) throws BackendDefinitionException
    {
        var runners = new CommandRunnerFactory(host -> LocalCommandRunner.LOCALHOST.equals(host) ? _local : _remote);
        return new JobSubmitter(config, BackendRegistry.load(), runners, JobSubmitter.createCacheStore(config));
    }
    
    private FileCacheStore store() {return (FileCacheStore) _submitter.getCache();}
    
    private static JobDescription.Builder hello() {return JobDescription.builder("hello", "srun ./a.out\n");}
}
