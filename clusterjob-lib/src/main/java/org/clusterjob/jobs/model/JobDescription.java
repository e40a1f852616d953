package org.clusterjob.jobs.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

import org.clusterjob.jobs.model.enumerations.CoreResource;
import org.clusterjob.jobs.utils.MsgUtils;

/** The scheduler-agnostic description of one job: a shell body, its resource
 * requirements and the metadata needed to place and submit it.  A description
 * is identified by its job name and file name.  Instances are immutable; use
 * {@link #builder(String, String)} or {@link #toBuilder()} to derive variants.
 *
 * Resource values are strings, integers or booleans.  A boolean true becomes a
 * bare flag in the script header, false and null values are ignored.  The
 * insertion order of resources is kept but does not affect rendering, which
 * always orders header lines deterministically.
 *
 * @author clusterjob
 */
public final class JobDescription
{
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final String              _jobname;
    private final String              _filename;      // null means derive from jobname
    private final String              _body;
    private final Map<String,Object>  _resources;
    private final String              _backend;       // null means configured default
    private final String              _remote;        // null means local host
    private final String              _shell;         // null means configured default
    private final String              _rootdir;
    private final String              _workdir;
    private final String              _prologue;
    private final String              _epilogue;
    private final Map<String,String>  _auxScripts;
    private final Map<String,String>  _placeholders;
    private final Integer             _sleepInterval; // seconds, null means derive

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    private JobDescription(Builder b)
    {
        _jobname       = b.jobname;
        _filename      = b.filename;
        _body          = b.body;
        _resources     = Collections.unmodifiableMap(new LinkedHashMap<>(b.resources));
        _backend       = b.backend;
        _remote        = b.remote;
        _shell         = b.shell;
        _rootdir       = b.rootdir;
        _workdir       = b.workdir;
        _prologue      = b.prologue;
        _epilogue      = b.epilogue;
        _auxScripts    = Collections.unmodifiableMap(new LinkedHashMap<>(b.auxScripts));
        _placeholders  = Collections.unmodifiableMap(new LinkedHashMap<>(b.placeholders));
        _sleepInterval = b.sleepInterval;
    }

    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    public static Builder builder(String jobname, String body) {return new Builder(jobname, body);}

    public Builder toBuilder()
    {
        var b = new Builder(_jobname, _body);
        b.filename      = _filename;
        b.resources.putAll(_resources);
        b.backend       = _backend;
        b.remote        = _remote;
        b.shell         = _shell;
        b.rootdir       = _rootdir;
        b.workdir       = _workdir;
        b.prologue      = _prologue;
        b.epilogue      = _epilogue;
        b.auxScripts.putAll(_auxScripts);
        b.placeholders.putAll(_placeholders);
        b.sleepInterval = _sleepInterval;
        return b;
    }

    /** True if the job runs on a remote host. */
    public boolean isRemote() {return _remote != null;}

    /** The backend name, falling back to the given default. */
    public String resolveBackend(String defaultBackend)
    {return _backend != null ? _backend : defaultBackend;}

    /** The script file name, falling back to jobname.extension. */
    public String resolveFilename(String extension)
    {
        if (_filename != null) return _filename;
        return StringUtils.isBlank(extension) ? _jobname : _jobname + "." + extension;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof JobDescription)) return false;
        var that = (JobDescription) o;
        return _jobname.equals(that._jobname) && Objects.equals(_filename, that._filename)
               && _body.equals(that._body) && _resources.equals(that._resources)
               && Objects.equals(_backend, that._backend) && Objects.equals(_remote, that._remote)
               && Objects.equals(_shell, that._shell) && _rootdir.equals(that._rootdir)
               && _workdir.equals(that._workdir) && Objects.equals(_prologue, that._prologue)
               && Objects.equals(_epilogue, that._epilogue) && _auxScripts.equals(that._auxScripts)
               && _placeholders.equals(that._placeholders)
               && Objects.equals(_sleepInterval, that._sleepInterval);
    }

    @Override
    public int hashCode() {return Objects.hash(_jobname, _filename, _backend, _remote);}

    @Override
    public String toString()
    {
        return "JobDescription[jobname=" + _jobname + ", filename=" + _filename +
               ", backend=" + _backend + ", remote=" + _remote + "]";
    }

    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public String getJobname() {return _jobname;}
    public String getFilename() {return _filename;}
    public String getBody() {return _body;}
    public Map<String, Object> getResources() {return _resources;}
    public String getBackend() {return _backend;}
    public String getRemote() {return _remote;}
    public String getShell() {return _shell;}
    public String getRootdir() {return _rootdir;}
    public String getWorkdir() {return _workdir;}
    public String getPrologue() {return _prologue;}
    public String getEpilogue() {return _epilogue;}
    public Map<String, String> getAuxScripts() {return _auxScripts;}
    public Map<String, String> getPlaceholders() {return _placeholders;}
    public Integer getSleepInterval() {return _sleepInterval;}

    /* ********************************************************************** */
    /*                             Builder Class                              */
    /* ********************************************************************** */
    public static final class Builder
    {
        private final String              jobname;
        private final String              body;
        private String                    filename;
        private final Map<String,Object>  resources = new LinkedHashMap<>();
        private String                    backend;
        private String                    remote;
        private String                    shell;
        private String                    rootdir = "";
        private String                    workdir = "";
        private String                    prologue;
        private String                    epilogue;
        private final Map<String,String>  auxScripts = new LinkedHashMap<>();
        private final Map<String,String>  placeholders = new LinkedHashMap<>();
        private Integer                   sleepInterval;

        private Builder(String jobname, String body)
        {
            if (StringUtils.isBlank(jobname))
                throw new IllegalArgumentException(MsgUtils.getMsg("JOBS_NULL_PARAMETER", "JobDescription", "jobname"));
            if (body == null)
                throw new IllegalArgumentException(MsgUtils.getMsg("JOBS_NULL_PARAMETER", "JobDescription", "body"));
            this.jobname = jobname.strip();
            this.body = body;
        }

        public Builder filename(String v) {filename = StringUtils.isBlank(v) ? null : v.strip(); return this;}
        public Builder backend(String v) {backend = StringUtils.isBlank(v) ? null : v.strip(); return this;}
        public Builder remote(String v) {remote = StringUtils.isBlank(v) ? null : v.strip(); return this;}
        public Builder shell(String v) {shell = StringUtils.isBlank(v) ? null : v.strip(); return this;}
        public Builder rootdir(String v) {rootdir = stripDir(v); return this;}
        public Builder workdir(String v) {workdir = stripDir(v); return this;}
        public Builder prologue(String v) {prologue = StringUtils.isBlank(v) ? null : v; return this;}
        public Builder epilogue(String v) {epilogue = StringUtils.isBlank(v) ? null : v; return this;}
        public Builder sleepInterval(Integer seconds) {sleepInterval = seconds; return this;}

        public Builder resource(String key, Object value)
        {
            if (StringUtils.isBlank(key))
                throw new IllegalArgumentException(MsgUtils.getMsg("JOBS_NULL_PARAMETER", "resource", "key"));
            if (CoreResource.JOBNAME.getKey().equals(key))
                throw new IllegalArgumentException(MsgUtils.getMsg("JOBS_RESERVED_RESOURCE_KEY", key));
            resources.put(key, value);
            return this;
        }

        public Builder resources(Map<String,?> map)
        {
            if (map != null) for (var e : map.entrySet()) resource(e.getKey(), e.getValue());
            return this;
        }

        // Shortcuts for the core resources.
        public Builder nodes(int n) {return resource(CoreResource.NODES.getKey(), n);}
        public Builder ppn(int n) {return resource(CoreResource.PPN.getKey(), n);}
        public Builder threads(int n) {return resource(CoreResource.THREADS.getKey(), n);}
        public Builder time(String t) {return resource(CoreResource.TIME.getKey(), t);}
        public Builder mem(int mb) {return resource(CoreResource.MEM.getKey(), mb);}
        public Builder queue(String q) {return resource(CoreResource.QUEUE.getKey(), q);}
        public Builder stdout(String f) {return resource(CoreResource.STDOUT.getKey(), f);}
        public Builder stderr(String f) {return resource(CoreResource.STDERR.getKey(), f);}

        public Builder auxScript(String filename, String content)
        {
            if (StringUtils.isBlank(filename) || content == null)
                throw new IllegalArgumentException(MsgUtils.getMsg("JOBS_NULL_PARAMETER", "auxScript", "filename"));
            auxScripts.put(filename.strip(), content);
            return this;
        }

        public Builder placeholder(String name, String value)
        {
            if (StringUtils.isBlank(name) || value == null)
                throw new IllegalArgumentException(MsgUtils.getMsg("JOBS_NULL_PARAMETER", "placeholder", name));
            placeholders.put(name.strip(), value);
            return this;
        }

        public Builder placeholders(Map<String,String> map)
        {
            if (map != null) for (var e : map.entrySet()) placeholder(e.getKey(), e.getValue());
            return this;
        }

        public JobDescription build() {return new JobDescription(this);}

        // Directories never keep a trailing slash.
        private static String stripDir(String dir)
        {
            if (dir == null) return "";
            String s = dir.strip();
            while (s.length() > 1 && s.endsWith("/")) s = s.substring(0, s.length() - 1);
            return s;
        }
    }
}
