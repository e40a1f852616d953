package org.clusterjob.jobs.runners;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.clusterjob.jobs.exceptions.CommandRunnerException;
import org.clusterjob.jobs.exceptions.HookScriptException;
import org.clusterjob.jobs.utils.JobUtils;
import org.clusterjob.jobs.utils.MsgUtils;

/** Runs prologue and epilogue scripts on the local host, in the current
 * working directory.  The script is written to a temporary executable file,
 * with an interpreter line added if it has none, and removed afterwards.
 */
public final class HookScriptRunner 
{
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(HookScriptRunner.class);
    
    private final CommandRunner _localRunner;
    private final String        _shell;
    private final Duration      _timeout;
    
    public HookScriptRunner(CommandRunner localRunner, String shell, Duration timeout)
    {
        _localRunner = localRunner;
        _shell       = shell;
        _timeout     = timeout;
    }
    
    /* ---------------------------------------------------------------------- */
    /* run:                                                                   */
    /* ---------------------------------------------------------------------- */
    /** Run a hook script.
     * 
     * @param hookName "prologue" or "epilogue", used in messages
     * @param script the rendered script text
     * @throws HookScriptException if the script can't be run or exits with a
     *          non-zero code
     */
    public void run(String hookName, String script) throws HookScriptException
    {
        String text = script.startsWith("#!") ? script : "#!" + _shell + "\n" + script;
        Path file = null;
        try {
            file = Files.createTempFile("clusterjob-" + hookName + "-", ".sh");
            _localRunner.stageFile(text, file.toString(), true);
            
            var result = _localRunner.execute(JobUtils.conditionalQuote(file.toString()), null, _timeout);
            if (!result.isSuccess()) {
                String msg = MsgUtils.getMsg("JOBS_HOOK_FAILED", hookName, result.getExitCode(), 
                                             System.getProperty("user.dir"), script, 
                                             result.getCombinedOutput().strip());
                _log.error(msg);
                throw new HookScriptException(msg);
            }
            if (_log.isDebugEnabled()) _log.debug(MsgUtils.getMsg("JOBS_HOOK_DONE", hookName));
        }
        catch (IOException | CommandRunnerException e) {
            String msg = MsgUtils.getMsg("JOBS_HOOK_RUN_ERROR", hookName, e.getMessage());
            _log.error(msg, e);
            throw new HookScriptException(msg, e);
        }
        finally {
            if (file != null) 
                try {Files.deleteIfExists(file);}
                catch (IOException e) {_log.warn(MsgUtils.getMsg("JOBS_FILE_DELETE_ERROR", file, e.getMessage()));}
        }
    }
}
