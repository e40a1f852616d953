package org.clusterjob.jobs.schedulers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.apache.commons.lang3.StringUtils;

import org.clusterjob.jobs.exceptions.BackendDefinitionException;
import org.clusterjob.jobs.model.enumerations.CoreEnvVariable;
import org.clusterjob.jobs.model.enumerations.CoreResource;
import org.clusterjob.jobs.model.enumerations.JobStatusType;
import org.clusterjob.jobs.utils.MsgUtils;

/** The data-only translation table for one batch scheduler.  Descriptors are
 * read from JSON documents by {@link BackendRegistry} and never modified after
 * registration.  All behavior that differs between schedulers is expressed
 * here, except for the few output formats that cannot be parsed with a regex
 * or a column lookup; those use the parser overrides in the registry.
 * 
 * Template tokens:
 * 
 *  directives          - {value}, {minutes}, {seconds}, {hms}
 *  parallelDirectives  - {nodes}, {ppn}, {threads}, {cores_per_node},
 *                        {total_tasks}, {total_cores}
 *  passThrough         - {key}, {value}
 *  commands            - {filename}, {job_id}, {jobname}
 * 
 * The optional fallback status command is run when the status command's
 * answer is inconclusive, typically to consult the accounting records of a
 * job that has already left the queue.
 * 
 * @author clusterjob
 */
public final class BackendDescriptor 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Parallel template tokens that tie a directive to individual nodes.
    private static final String[] NODE_TOKENS = {"{nodes}", "{ppn}", "{cores_per_node}"};
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    // Gson populates these fields directly.
    private String                     name;
    private String                     prefix;
    private String                     extension;
    private String                     submitCommand;
    private String                     statusCommand;
    private String                     fallbackStatusCommand;
    private String                     cancelCommand;
    private String                     jobIdPattern;
    private Map<String,String>         directives = new LinkedHashMap<>();
    private List<String>               parallelDirectives = new ArrayList<>();
    private PassThroughRule            passThrough = new PassThroughRule();
    private Map<String,Object>         defaults = new LinkedHashMap<>();
    private Map<String,String>         envVars = new LinkedHashMap<>();
    private StatusParsing              statusParsing;
    private List<StatusMessage>        statusMessages = new ArrayList<>();
    private Map<String,JobStatusType>  statusMap = new LinkedHashMap<>();
    private Capabilities               capabilities = new Capabilities();
    
    // Compiled on first use.
    private transient Pattern          _jobIdRegex;
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* validate:                                                              */
    /* ---------------------------------------------------------------------- */
    /** Check that this descriptor is complete and self-consistent.  Parser
     * overrides relax the corresponding requirements since the overriding code
     * takes over that part of the translation.
     * 
     * @param hasIdParser true if a job id parser override is registered
     * @param hasStatusParser true if a status parser override is registered
     * @throws BackendDefinitionException on the first problem found
     */
    public void validate(boolean hasIdParser, boolean hasStatusParser)
     throws BackendDefinitionException
    {
        // Required scalar fields.
        String label = StringUtils.isBlank(name) ? "<unnamed>" : name;
        require(label, "name", name);
        require(label, "prefix", prefix);
        require(label, "submitCommand", submitCommand);
        require(label, "statusCommand", statusCommand);
        require(label, "cancelCommand", cancelCommand);
        if (!name.matches("[A-Za-z0-9_-]+")) 
            throw new BackendDefinitionException(MsgUtils.getMsg("JOBS_BACKEND_INVALID_FIELD", label, "name", name));
        
        // The job id pattern needs a group unless an override extracts the id.
        if (!hasIdParser) {
            require(label, "jobIdPattern", jobIdPattern);
            Pattern p = compile(label, "jobIdPattern", jobIdPattern);
            if (p.matcher("").groupCount() < 1)
                throw new BackendDefinitionException(MsgUtils.getMsg("JOBS_BACKEND_INVALID_FIELD", label, "jobIdPattern", jobIdPattern));
        }
        
        // Status parsing needs a mode unless an override interprets the output.
        if (!hasStatusParser) {
            if (statusParsing == null || statusParsing.getMode() == null)
                throw new BackendDefinitionException(MsgUtils.getMsg("JOBS_BACKEND_MISSING_FIELD", label, "statusParsing.mode"));
            statusParsing.validate(label);
        }
        if (statusMessages != null)
            for (var msg : statusMessages) {
                if (msg == null || msg.getStatus() == null) 
                    throw new BackendDefinitionException(MsgUtils.getMsg("JOBS_BACKEND_MISSING_FIELD", label, "statusMessages.status"));
                compile(label, "statusMessages.pattern", msg.getPattern());
            }
        
        // The jobname directive is mandatory since every script has a name.
        if (directives == null || StringUtils.isBlank(directives.get(CoreResource.JOBNAME.getKey())))
            throw new BackendDefinitionException(MsgUtils.getMsg("JOBS_BACKEND_MISSING_FIELD", label, "directives.jobname"));
        
        // Parallel templates that cannot express a per-node layout must be
        // explicitly declared as collapsing all cores onto one request.
        if (parallelDirectives == null || parallelDirectives.isEmpty())
            throw new BackendDefinitionException(MsgUtils.getMsg("JOBS_BACKEND_MISSING_FIELD", label, "parallelDirectives"));
        boolean perNode = false;
        for (var template : parallelDirectives) 
            for (var token : NODE_TOKENS) 
                if (template.contains(token)) perNode = true;
        if (!perNode && !getCapabilities().isCoalescesNodes())
            throw new BackendDefinitionException(MsgUtils.getMsg("JOBS_BACKEND_NOT_COALESCING", label));
        
        // Every core environment variable is translated in both forms.
        for (var v : CoreEnvVariable.values()) {
            if (envVars == null || !envVars.containsKey(v.getReference()) 
                || !envVars.containsKey(v.getBracedReference()))
                throw new BackendDefinitionException(MsgUtils.getMsg("JOBS_BACKEND_MISSING_ENV", label, v.getVarName()));
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* getJobIdRegex:                                                         */
    /* ---------------------------------------------------------------------- */
    /** The compiled job id pattern or null if none is defined. */
    public Pattern getJobIdRegex()
    {
        if (_jobIdRegex == null && StringUtils.isNotBlank(jobIdPattern)) 
            _jobIdRegex = Pattern.compile(jobIdPattern);
        return _jobIdRegex;
    }
    
    @Override
    public String toString() {return "BackendDescriptor[" + name + "]";}
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    private static void require(String label, String field, String value)
     throws BackendDefinitionException
    {
        if (StringUtils.isBlank(value))
            throw new BackendDefinitionException(MsgUtils.getMsg("JOBS_BACKEND_MISSING_FIELD", label, field));
    }
    
    private static <K,V> Map<K,V> readOnly(Map<K,V> map)
    {
        return map == null ? Map.of() : Collections.unmodifiableMap(map);
    }
    
    private static <T> List<T> readOnly(List<T> list)
    {
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }
    
    private static Pattern compile(String label, String field, String regex)
     throws BackendDefinitionException
    {
        if (StringUtils.isBlank(regex))
            throw new BackendDefinitionException(MsgUtils.getMsg("JOBS_BACKEND_MISSING_FIELD", label, field));
        try {return Pattern.compile(regex);}
        catch (PatternSyntaxException e) {
            String msg = MsgUtils.getMsg("JOBS_BACKEND_INVALID_FIELD", label, field, regex);
            throw new BackendDefinitionException(msg, e);
        }
    }
    
    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public String getName() {return name;}
    public String getPrefix() {return prefix;}
    public String getExtension() {return extension;}
    public String getSubmitCommand() {return submitCommand;}
    public String getStatusCommand() {return statusCommand;}
    public String getCancelCommand() {return cancelCommand;}
    public String getJobIdPattern() {return jobIdPattern;}
    public String getFallbackStatusCommand() {return fallbackStatusCommand;}
    public Map<String, String> getDirectives() {return readOnly(directives);}
    public List<String> getParallelDirectives() {return readOnly(parallelDirectives);}
    public PassThroughRule getPassThrough() {return passThrough == null ? new PassThroughRule() : passThrough;}
    public Map<String, Object> getDefaults() {return readOnly(defaults);}
    public Map<String, String> getEnvVars() {return readOnly(envVars);}
    public StatusParsing getStatusParsing() {return statusParsing;}
    public List<StatusMessage> getStatusMessages() {return readOnly(statusMessages);}
    public Map<String, JobStatusType> getStatusMap() {return readOnly(statusMap);}
    public Capabilities getCapabilities() {return capabilities == null ? new Capabilities() : capabilities;}
    
    /* ********************************************************************** */
    /*                            PassThroughRule                             */
    /* ********************************************************************** */
    /** How resource keys without a directive mapping become header lines.
     * Keys that start with a dash are taken to be literal scheduler options
     * and use the verbatim templates.  Single letter keys use the short
     * templates, all others the long ones.  Boolean true values select the
     * flag templates.
     */
    public static final class PassThroughRule
    {
        private boolean enabled = true;
        private String  longTemplate = "--{key}={value}";
        private String  shortTemplate = "-{key} {value}";
        private String  longFlagTemplate = "--{key}";
        private String  shortFlagTemplate = "-{key}";
        private String  verbatimTemplate = "{key} {value}";
        private String  verbatimFlagTemplate = "{key}";
        
        public boolean isEnabled() {return enabled;}
        public String getLongTemplate() {return longTemplate;}
        public String getShortTemplate() {return shortTemplate;}
        public String getLongFlagTemplate() {return longFlagTemplate;}
        public String getShortFlagTemplate() {return shortFlagTemplate;}
        public String getVerbatimTemplate() {return verbatimTemplate;}
        public String getVerbatimFlagTemplate() {return verbatimFlagTemplate;}
        
        /** Select the template for a key and value type. */
        public String templateFor(String key, boolean flag)
        {
            if (key.startsWith("-")) return flag ? verbatimFlagTemplate : verbatimTemplate;
            if (key.length() == 1) return flag ? shortFlagTemplate : shortTemplate;
            return flag ? longFlagTemplate : longTemplate;
        }
    }
    
    /* ********************************************************************** */
    /*                             StatusParsing                              */
    /* ********************************************************************** */
    /** Where the native status string sits in the status command's output. */
    public static final class StatusParsing
    {
        public enum Mode {FIRST_TOKEN, COLUMN, HEADER_COLUMN}
        
        private Mode   mode;
        private int    column;          // COLUMN: zero-based index in the last line
        private String headerAnchor;    // HEADER_COLUMN: first token of the header line
        private String headerName;      // HEADER_COLUMN: name of the status column
        
        public Mode getMode() {return mode;}
        public int getColumn() {return column;}
        public String getHeaderAnchor() {return headerAnchor;}
        public String getHeaderName() {return headerName;}
        
        private void validate(String label) throws BackendDefinitionException
        {
            if (mode == Mode.COLUMN && column < 0)
                throw new BackendDefinitionException(MsgUtils.getMsg("JOBS_BACKEND_INVALID_FIELD", label, "statusParsing.column", column));
            if (mode == Mode.HEADER_COLUMN) {
                require(label, "statusParsing.headerAnchor", headerAnchor);
                require(label, "statusParsing.headerName", headerName);
            }
        }
    }
    
    /* ********************************************************************** */
    /*                             StatusMessage                              */
    /* ********************************************************************** */
    /** A regex searched for in the combined status command output.  A match
     * determines the status regardless of the command's exit code.
     */
    public static final class StatusMessage
    {
        private String        pattern;
        private JobStatusType status;
        
        private transient Pattern _regex;
        
        public String getPattern() {return pattern;}
        public JobStatusType getStatus() {return status;}
        
        public boolean matches(String text)
        {
            if (_regex == null) _regex = Pattern.compile(pattern);
            return _regex.matcher(text).find();
        }
    }
    
    /* ********************************************************************** */
    /*                              Capabilities                              */
    /* ********************************************************************** */
    public static final class Capabilities
    {
        // All cores are requested as one pool, without a node layout.
        private boolean coalescesNodes;
        
        public boolean isCoalescesNodes() {return coalescesNodes;}
    }
}
