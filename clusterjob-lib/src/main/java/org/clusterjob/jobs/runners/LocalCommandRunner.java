package org.clusterjob.jobs.runners;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.clusterjob.jobs.exceptions.CommandRunnerException;
import org.clusterjob.jobs.utils.MsgUtils;

/** Runs commands as child processes of this JVM using /bin/sh.  Output is
 * captured in temporary files so that large outputs can never block the child
 * process on a full pipe.
 */
public final class LocalCommandRunner 
 implements CommandRunner
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(LocalCommandRunner.class);
    
    public static final String LOCALHOST = "localhost";
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* execute:                                                               */
    /* ---------------------------------------------------------------------- */
    @Override
    public CommandResult execute(String command, String workdir, Duration timeout)
     throws CommandRunnerException
    {
        if (_log.isDebugEnabled()) 
            _log.debug(MsgUtils.getMsg("JOBS_RUNNER_EXEC", LOCALHOST, workdir, command));
        
        File outFile = null;
        File errFile = null;
        try {
            outFile = File.createTempFile("clusterjob-", ".out");
            errFile = File.createTempFile("clusterjob-", ".err");
            
            var pb = new ProcessBuilder("/bin/sh", "-c", command);
            if (StringUtils.isNotBlank(workdir)) pb.directory(resolveLocal(workdir));
            pb.redirectOutput(outFile);
            pb.redirectError(errFile);
            
            // Wait for the command, killing it when the timeout expires.
            Process process = pb.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                String msg = MsgUtils.getMsg("JOBS_RUNNER_TIMEOUT", LOCALHOST, timeout.toSeconds(), command);
                throw new CommandRunnerException(msg);
            }
            
            var result = new CommandResult(process.exitValue(),
                                           FileUtils.readFileToString(outFile, StandardCharsets.UTF_8),
                                           FileUtils.readFileToString(errFile, StandardCharsets.UTF_8));
            if (_log.isDebugEnabled()) 
                _log.debug(MsgUtils.getMsg("JOBS_RUNNER_RESULT", LOCALHOST, result.getExitCode(), 
                                           result.getStdout().strip(), result.getStderr().strip()));
            return result;
        }
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBS_RUNNER_EXEC_ERROR", LOCALHOST, command, e.getMessage());
            throw new CommandRunnerException(msg, e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            String msg = MsgUtils.getMsg("JOBS_RUNNER_INTERRUPTED", LOCALHOST, command);
            throw new CommandRunnerException(msg, e);
        }
        finally {
            FileUtils.deleteQuietly(outFile);
            FileUtils.deleteQuietly(errFile);
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* stageFile:                                                             */
    /* ---------------------------------------------------------------------- */
    @Override
    public void stageFile(String content, String path, boolean executable)
     throws CommandRunnerException
    {
        File file = resolveLocal(path);
        try {
            FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
            if (executable && !file.setExecutable(true, true)) {
                String msg = MsgUtils.getMsg("JOBS_RUNNER_CHMOD_ERROR", LOCALHOST, file.getPath());
                throw new CommandRunnerException(msg);
            }
        }
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBS_RUNNER_STAGE_ERROR", LOCALHOST, file.getPath(), e.getMessage());
            throw new CommandRunnerException(msg, e);
        }
        if (_log.isDebugEnabled()) 
            _log.debug(MsgUtils.getMsg("JOBS_RUNNER_STAGED", LOCALHOST, file.getPath()));
    }
    
    @Override
    public String getHost() {return LOCALHOST;}
    
    @Override
    public void close() {}
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* resolveLocal:                                                          */
    /* ---------------------------------------------------------------------- */
    /** Expand a leading ~ the way the shell would. */
    private static File resolveLocal(String path)
    {
        if (path.equals("~")) return FileUtils.getUserDirectory();
        if (path.startsWith("~/")) return new File(FileUtils.getUserDirectory(), path.substring(2));
        return new File(path);
    }
}
