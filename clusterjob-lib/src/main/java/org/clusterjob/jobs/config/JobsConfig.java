package org.clusterjob.jobs.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.clusterjob.jobs.exceptions.JobException;
import org.clusterjob.jobs.utils.MsgUtils;

/** Explicit configuration for the submission pipeline and job trackers.  There
 * is no process-wide default instance; callers construct one and pass it to
 * the components that need it.
 *
 * Instances are immutable.  Use the builder or one of the properties-based
 * factory methods.  Recognized properties:
 *
 * <pre>
 *   clusterjob.backend                 default backend name
 *   clusterjob.cache.dir               cache directory, caching disabled if absent
 *   clusterjob.cache.prefix            cache file name prefix
 *   clusterjob.shell                   default interpreter for job scripts
 *   clusterjob.command.timeout.seconds timeout for each external command
 *   clusterjob.status.maxFailures      consecutive inconclusive polls tolerated
 *   clusterjob.ssh.user                remote user, defaults to the local user
 *   clusterjob.ssh.port                remote ssh port
 *   clusterjob.ssh.identity            private key file
 *   clusterjob.ssh.knownHosts          known hosts file
 *   clusterjob.ssh.strictHostKeyChecking  yes or no
 * </pre>
 *
 * @author clusterjob
 */
public final class JobsConfig
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(JobsConfig.class);

    // The optional classpath resource read by load().
    public static final String CONFIG_RESOURCE = "clusterjob.properties";

    // Property names.
    public static final String PROP_BACKEND          = "clusterjob.backend";
    public static final String PROP_CACHE_DIR        = "clusterjob.cache.dir";
    public static final String PROP_CACHE_PREFIX     = "clusterjob.cache.prefix";
    public static final String PROP_SHELL            = "clusterjob.shell";
    public static final String PROP_COMMAND_TIMEOUT  = "clusterjob.command.timeout.seconds";
    public static final String PROP_MAX_FAILURES     = "clusterjob.status.maxFailures";
    public static final String PROP_SSH_USER         = "clusterjob.ssh.user";
    public static final String PROP_SSH_PORT         = "clusterjob.ssh.port";
    public static final String PROP_SSH_IDENTITY     = "clusterjob.ssh.identity";
    public static final String PROP_SSH_KNOWN_HOSTS  = "clusterjob.ssh.knownHosts";
    public static final String PROP_SSH_STRICT       = "clusterjob.ssh.strictHostKeyChecking";

    // Defaults.
    public static final String   DEFAULT_BACKEND         = "slurm";
    public static final String   DEFAULT_CACHE_PREFIX    = "clusterjob";
    public static final String   DEFAULT_SHELL           = "/bin/bash";
    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(60);
    public static final int      DEFAULT_MAX_FAILURES    = 5;
    public static final int      DEFAULT_SSH_PORT        = 22;

    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final String   _defaultBackend;
    private final Path     _cacheDir;
    private final String   _cachePrefix;
    private final String   _defaultShell;
    private final Duration _commandTimeout;
    private final int      _maxStatusFailures;
    private final String   _sshUser;
    private final int      _sshPort;
    private final String   _sshIdentity;
    private final String   _sshKnownHosts;
    private final boolean  _sshStrictHostKeyChecking;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    private JobsConfig(Builder b)
    {
        _defaultBackend           = b.defaultBackend;
        _cacheDir                 = b.cacheDir;
        _cachePrefix              = b.cachePrefix;
        _defaultShell             = b.defaultShell;
        _commandTimeout           = b.commandTimeout;
        _maxStatusFailures        = b.maxStatusFailures;
        _sshUser                  = b.sshUser;
        _sshPort                  = b.sshPort;
        _sshIdentity              = b.sshIdentity;
        _sshKnownHosts            = b.sshKnownHosts;
        _sshStrictHostKeyChecking = b.sshStrictHostKeyChecking;
    }

    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    public static Builder builder() {return new Builder();}

    /** A configuration with all defaults and caching disabled. */
    public static JobsConfig defaults() {return new Builder().build();}

    /* ---------------------------------------------------------------------- */
    /* load:                                                                  */
    /* ---------------------------------------------------------------------- */
    /** Read the optional clusterjob.properties resource from the classpath.
     * If the resource does not exist the defaults are returned.
     *
     * @return the configuration
     * @throws JobException if the resource exists but cannot be parsed
     */
    public static JobsConfig load() throws JobException
    {
        var props = new Properties();
        try (InputStream ins = JobsConfig.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (ins == null) {
                if (_log.isDebugEnabled())
                    _log.debug(MsgUtils.getMsg("JOBS_CONFIG_NOT_FOUND", CONFIG_RESOURCE));
                return defaults();
            }
            props.load(ins);
        }
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBS_CONFIG_LOAD_ERROR", CONFIG_RESOURCE, e.getMessage());
            throw new JobException(msg, e);
        }
        return fromProperties(props);
    }

    /* ---------------------------------------------------------------------- */
    /* fromProperties:                                                        */
    /* ---------------------------------------------------------------------- */
    public static JobsConfig fromProperties(Properties props) throws JobException
    {
        var b = new Builder();
        String s;
        if (StringUtils.isNotBlank(s = props.getProperty(PROP_BACKEND))) b.defaultBackend(s.strip());
        if (StringUtils.isNotBlank(s = props.getProperty(PROP_CACHE_DIR))) b.cacheDir(Paths.get(s.strip()));
        if (StringUtils.isNotBlank(s = props.getProperty(PROP_CACHE_PREFIX))) b.cachePrefix(s.strip());
        if (StringUtils.isNotBlank(s = props.getProperty(PROP_SHELL))) b.defaultShell(s.strip());
        if (StringUtils.isNotBlank(s = props.getProperty(PROP_COMMAND_TIMEOUT)))
            b.commandTimeout(Duration.ofSeconds(parseInt(PROP_COMMAND_TIMEOUT, s)));
        if (StringUtils.isNotBlank(s = props.getProperty(PROP_MAX_FAILURES)))
            b.maxStatusFailures(parseInt(PROP_MAX_FAILURES, s));
        if (StringUtils.isNotBlank(s = props.getProperty(PROP_SSH_USER))) b.sshUser(s.strip());
        if (StringUtils.isNotBlank(s = props.getProperty(PROP_SSH_PORT))) b.sshPort(parseInt(PROP_SSH_PORT, s));
        if (StringUtils.isNotBlank(s = props.getProperty(PROP_SSH_IDENTITY))) b.sshIdentity(s.strip());
        if (StringUtils.isNotBlank(s = props.getProperty(PROP_SSH_KNOWN_HOSTS))) b.sshKnownHosts(s.strip());
        if (StringUtils.isNotBlank(s = props.getProperty(PROP_SSH_STRICT)))
            b.sshStrictHostKeyChecking("yes".equalsIgnoreCase(s.strip()) || "true".equalsIgnoreCase(s.strip()));
        return b.build();
    }

    /** True when a cache directory has been configured. */
    public boolean isCacheEnabled() {return _cacheDir != null;}

    /** A builder initialized with this configuration's values. */
    public Builder toBuilder()
    {
        return new Builder()
                .defaultBackend(_defaultBackend)
                .cacheDir(_cacheDir)
                .cachePrefix(_cachePrefix)
                .defaultShell(_defaultShell)
                .commandTimeout(_commandTimeout)
                .maxStatusFailures(_maxStatusFailures)
                .sshUser(_sshUser)
                .sshPort(_sshPort)
                .sshIdentity(_sshIdentity)
                .sshKnownHosts(_sshKnownHosts)
                .sshStrictHostKeyChecking(_sshStrictHostKeyChecking);
    }

    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    private static int parseInt(String prop, String value) throws JobException
    {
        try {return Integer.parseInt(value.strip());}
        catch (NumberFormatException e) {
            String msg = MsgUtils.getMsg("JOBS_CONFIG_INVALID_VALUE", prop, value);
            throw new JobException(msg, e);
        }
    }

    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public String getDefaultBackend() {return _defaultBackend;}
    public Path getCacheDir() {return _cacheDir;}
    public String getCachePrefix() {return _cachePrefix;}
    public String getDefaultShell() {return _defaultShell;}
    public Duration getCommandTimeout() {return _commandTimeout;}
    public int getMaxStatusFailures() {return _maxStatusFailures;}
    public String getSshUser() {return _sshUser;}
    public int getSshPort() {return _sshPort;}
    public String getSshIdentity() {return _sshIdentity;}
    public String getSshKnownHosts() {return _sshKnownHosts;}
    public boolean isSshStrictHostKeyChecking() {return _sshStrictHostKeyChecking;}

    /* ********************************************************************** */
    /*                             Builder Class                              */
    /* ********************************************************************** */
    public static final class Builder
    {
        private String   defaultBackend    = DEFAULT_BACKEND;
        private Path     cacheDir;
        private String   cachePrefix       = DEFAULT_CACHE_PREFIX;
        private String   defaultShell      = DEFAULT_SHELL;
        private Duration commandTimeout    = DEFAULT_COMMAND_TIMEOUT;
        private int      maxStatusFailures = DEFAULT_MAX_FAILURES;
        private String   sshUser;
        private int      sshPort           = DEFAULT_SSH_PORT;
        private String   sshIdentity;
        private String   sshKnownHosts;
        private boolean  sshStrictHostKeyChecking = true;

        private Builder() {}

        public Builder defaultBackend(String v) {defaultBackend = v; return this;}
        public Builder cacheDir(Path v) {cacheDir = v; return this;}
        public Builder cachePrefix(String v) {cachePrefix = v; return this;}
        public Builder defaultShell(String v) {defaultShell = v; return this;}
        public Builder commandTimeout(Duration v) {commandTimeout = v; return this;}
        public Builder maxStatusFailures(int v) {maxStatusFailures = v; return this;}
        public Builder sshUser(String v) {sshUser = v; return this;}
        public Builder sshPort(int v) {sshPort = v; return this;}
        public Builder sshIdentity(String v) {sshIdentity = v; return this;}
        public Builder sshKnownHosts(String v) {sshKnownHosts = v; return this;}
        public Builder sshStrictHostKeyChecking(boolean v) {sshStrictHostKeyChecking = v; return this;}

        public JobsConfig build()
        {
            if (StringUtils.isBlank(defaultBackend))
                throw new IllegalArgumentException(MsgUtils.getMsg("JOBS_CONFIG_MISSING_VALUE", "defaultBackend"));
            if (StringUtils.isBlank(cachePrefix))
                throw new IllegalArgumentException(MsgUtils.getMsg("JOBS_CONFIG_MISSING_VALUE", "cachePrefix"));
            if (StringUtils.isBlank(defaultShell))
                throw new IllegalArgumentException(MsgUtils.getMsg("JOBS_CONFIG_MISSING_VALUE", "defaultShell"));
            if (commandTimeout == null || commandTimeout.isNegative() || commandTimeout.isZero())
                throw new IllegalArgumentException(MsgUtils.getMsg("JOBS_CONFIG_INVALID_VALUE", "commandTimeout", commandTimeout));
            if (maxStatusFailures < 1)
                throw new IllegalArgumentException(MsgUtils.getMsg("JOBS_CONFIG_INVALID_VALUE", "maxStatusFailures", maxStatusFailures));
            return new JobsConfig(this);
        }
    }
}
