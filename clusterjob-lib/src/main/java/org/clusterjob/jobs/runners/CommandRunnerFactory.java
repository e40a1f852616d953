package org.clusterjob.jobs.runners;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.clusterjob.jobs.config.JobsConfig;

/** Hands out one command runner per host.  Runners are created on first use
 * and reused afterwards so that all jobs on a remote host share a single SSH
 * session.  A null host designates the local machine.
 */
public final class CommandRunnerFactory 
 implements AutoCloseable
{
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(CommandRunnerFactory.class);
    
    // Key used for the local runner.
    private static final String LOCAL_KEY = LocalCommandRunner.LOCALHOST;
    
    // Runner creation and the pool of created runners.
    private final Function<String,CommandRunner> _creator;
    private final Map<String,CommandRunner>      _runners = new ConcurrentHashMap<>();
    
    /** Create local runners for the local host and SSH runners for all others. */
    public CommandRunnerFactory(JobsConfig config)
    {
        this(host -> LOCAL_KEY.equals(host) ? new LocalCommandRunner() : new SshCommandRunner(host, config));
    }
    
    /** Create runners with the given function, which receives "localhost" 
     * for the local host. 
     */
    public CommandRunnerFactory(Function<String,CommandRunner> creator) {_creator = creator;}
    
    /** Get the runner for a host, null meaning the local host. */
    public CommandRunner getRunner(String remote)
    {
        String key = remote == null ? LOCAL_KEY : remote;
        return _runners.computeIfAbsent(key, _creator);
    }
    
    /** Close all pooled runners. */
    @Override
    public void close()
    {
        for (var runner : _runners.values()) 
            try {runner.close();}
            catch (Exception e) {_log.warn(e.getMessage(), e);}
        _runners.clear();
    }
}
