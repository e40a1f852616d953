package org.clusterjob.jobs.runners;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpException;

import org.clusterjob.jobs.config.JobsConfig;
import org.clusterjob.jobs.exceptions.CommandRunnerException;
import org.clusterjob.jobs.utils.JobUtils;
import org.clusterjob.jobs.utils.MsgUtils;

/** Runs commands on a remote host over SSH.  One JSch session is opened
 * lazily and reused for every command and file transfer issued through this
 * runner.  When opening a channel fails on an established session, the
 * session is discarded and the operation is retried once on a new session.
 * 
 * Authentication uses public keys only: the configured identity file, or the
 * keys JSch finds by default.  Host keys are checked against the configured
 * known hosts file unless strict checking is turned off.
 */
public final class SshCommandRunner 
 implements CommandRunner
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(SshCommandRunner.class);
    
    // Channel completion polling interval.
    private static final long POLL_MILLIS = 100;
    
    // Permissions of staged executable files.
    private static final int EXEC_PERMISSIONS = 0700;
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final String     _host;
    private final String     _user;
    private final JobsConfig _config;
    
    // Lazily opened, reset on channel failure.
    private Session          _session;
    
    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    /** Create a runner for the given host.  The host can have the form 
     * user@host, in which case the user overrides the configured SSH user.
     */
    public SshCommandRunner(String host, JobsConfig config)
    {
        String user = config.getSshUser();
        int at = host.indexOf('@');
        if (at > 0) {
            user = host.substring(0, at);
            host = host.substring(at + 1);
        }
        if (StringUtils.isBlank(user)) user = System.getProperty("user.name");
        
        _host   = host;
        _user   = user;
        _config = config;
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* execute:                                                               */
    /* ---------------------------------------------------------------------- */
    @Override
    public synchronized CommandResult execute(String command, String workdir, Duration timeout)
     throws CommandRunnerException
    {
        // Remote commands start in the home directory.
        String fullCommand = command;
        if (StringUtils.isNotBlank(workdir)) fullCommand = "cd " + quoteRemotePath(workdir) + " && " + command;
        if (_log.isDebugEnabled()) 
            _log.debug(MsgUtils.getMsg("JOBS_RUNNER_EXEC", _host, workdir, command));
        
        ChannelExec channel = openChannel("exec", ChannelExec.class, timeout);
        var out = new ByteArrayOutputStream();
        var err = new ByteArrayOutputStream();
        try {
            channel.setCommand(fullCommand);
            channel.setInputStream(null);
            channel.setOutputStream(out);
            channel.setErrStream(err);
            channel.connect((int) timeout.toMillis());
            
            // Wait for the remote command to exit.
            long deadline = System.currentTimeMillis() + timeout.toMillis();
            while (!channel.isClosed()) {
                if (System.currentTimeMillis() >= deadline) {
                    String msg = MsgUtils.getMsg("JOBS_RUNNER_TIMEOUT", _host, timeout.toSeconds(), command);
                    throw new CommandRunnerException(msg);
                }
                Thread.sleep(POLL_MILLIS);
            }
            
            var result = new CommandResult(channel.getExitStatus(), 
                                           out.toString(StandardCharsets.UTF_8),
                                           err.toString(StandardCharsets.UTF_8));
            if (_log.isDebugEnabled()) 
                _log.debug(MsgUtils.getMsg("JOBS_RUNNER_RESULT", _host, result.getExitCode(), 
                                           result.getStdout().strip(), result.getStderr().strip()));
            return result;
        }
        catch (JSchException e) {
            String msg = MsgUtils.getMsg("JOBS_RUNNER_EXEC_ERROR", _host, command, e.getMessage());
            throw new CommandRunnerException(msg, e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            String msg = MsgUtils.getMsg("JOBS_RUNNER_INTERRUPTED", _host, command);
            throw new CommandRunnerException(msg, e);
        }
        finally {channel.disconnect();}
    }
    
    /* ---------------------------------------------------------------------- */
    /* stageFile:                                                             */
    /* ---------------------------------------------------------------------- */
    @Override
    public synchronized void stageFile(String content, String path, boolean executable)
     throws CommandRunnerException
    {
        // Make sure the parent directory exists.
        int slash = path.lastIndexOf('/');
        if (slash > 0) {
            String parent = path.substring(0, slash);
            var result = execute("mkdir -p " + quoteRemotePath(parent), null, _config.getCommandTimeout());
            if (!result.isSuccess()) {
                String msg = MsgUtils.getMsg("JOBS_RUNNER_STAGE_ERROR", _host, path, result.getStderr().strip());
                throw new CommandRunnerException(msg);
            }
        }
        
        // SFTP paths are relative to the home directory and know nothing of ~.
        String sftpPath = path.startsWith("~/") ? path.substring(2) : path;
        ChannelSftp sftp = openChannel("sftp", ChannelSftp.class, _config.getCommandTimeout());
        try {
            sftp.connect((int) _config.getCommandTimeout().toMillis());
            sftp.put(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), sftpPath);
            if (executable) sftp.chmod(EXEC_PERMISSIONS, sftpPath);
        }
        catch (JSchException | SftpException e) {
            String msg = MsgUtils.getMsg("JOBS_RUNNER_STAGE_ERROR", _host, path, e.getMessage());
            throw new CommandRunnerException(msg, e);
        }
        finally {sftp.disconnect();}
        
        if (_log.isDebugEnabled()) 
            _log.debug(MsgUtils.getMsg("JOBS_RUNNER_STAGED", _host, path));
    }
    
    @Override
    public String getHost() {return _host;}
    
    /* ---------------------------------------------------------------------- */
    /* close:                                                                 */
    /* ---------------------------------------------------------------------- */
    @Override
    public synchronized void close() 
    {
        if (_session != null) {
            _session.disconnect();
            _session = null;
        }
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* openChannel:                                                           */
    /* ---------------------------------------------------------------------- */
    /** Open a channel of the given type, reconnecting once if the current
     * session turns out to be unusable.
     */
    private <T> T openChannel(String type, Class<T> channelClass, Duration timeout)
     throws CommandRunnerException
    {
        try {return channelClass.cast(getSession(timeout).openChannel(type));}
        catch (JSchException e) {
            _log.warn(MsgUtils.getMsg("JOBS_SSH_RECONNECT", _host, e.getMessage()));
            close();
        }
        
        try {return channelClass.cast(getSession(timeout).openChannel(type));}
        catch (JSchException e) {
            close();
            String msg = MsgUtils.getMsg("JOBS_SSH_CONNECT_ERROR", _user, _host, _config.getSshPort(), e.getMessage());
            throw new CommandRunnerException(msg, e);
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* getSession:                                                            */
    /* ---------------------------------------------------------------------- */
    private Session getSession(Duration timeout) throws JSchException
    {
        if (_session != null && _session.isConnected()) return _session;
        
        var jsch = new JSch();
        if (StringUtils.isNotBlank(_config.getSshIdentity())) jsch.addIdentity(_config.getSshIdentity());
        if (StringUtils.isNotBlank(_config.getSshKnownHosts())) jsch.setKnownHosts(_config.getSshKnownHosts());
        
        Session session = jsch.getSession(_user, _host, _config.getSshPort());
        session.setConfig("StrictHostKeyChecking", _config.isSshStrictHostKeyChecking() ? "yes" : "no");
        session.setConfig("PreferredAuthentications", "publickey");
        session.connect((int) timeout.toMillis());
        
        _log.info(MsgUtils.getMsg("JOBS_SSH_CONNECTED", _user, _host, _config.getSshPort()));
        _session = session;
        return session;
    }
    
    /* ---------------------------------------------------------------------- */
    /* quoteRemotePath:                                                       */
    /* ---------------------------------------------------------------------- */
    /** Quote a path for the remote shell, leaving a leading ~ unquoted so that
     * it still expands to the home directory.
     */
    private static String quoteRemotePath(String path)
    {
        if (path.equals("~")) return path;
        if (path.startsWith("~/")) return "~/" + JobUtils.conditionalQuote(path.substring(2));
        return JobUtils.conditionalQuote(path);
    }
}
