package org.clusterjob.jobs.schedulers;

import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import org.clusterjob.jobs.model.enumerations.JobStatusType;
import org.clusterjob.jobs.runners.CommandResult;
import org.clusterjob.jobs.utils.JobUtils;

/** A batch scheduler as seen by the submission and monitoring code: a
 * backend descriptor combined with the job id and status parsers that apply
 * to it.  Instances are obtained from {@link BackendRegistry#getScheduler}.
 */
public final class JobScheduler
{
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final BackendDescriptor _descriptor;
    private final JobIdParser       _idParser;
    private final StatusParser      _statusParser;

    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    public JobScheduler(BackendDescriptor descriptor, JobIdParser idParser, StatusParser statusParser)
    {
        _descriptor   = descriptor;
        _idParser     = idParser != null ? idParser : new PatternJobIdParser(descriptor.getJobIdRegex());
        _statusParser = statusParser != null ? statusParser : new TableStatusParser(descriptor);
    }

    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* getSubmitCommand:                                                      */
    /* ---------------------------------------------------------------------- */
    /** The command that submits the named script file from its directory. */
    public String getSubmitCommand(String filename, String jobname)
    {
        return JobUtils.fillTemplate(_descriptor.getSubmitCommand(), 
                                     Map.of("filename", JobUtils.conditionalQuote(filename),
                                            "jobname", JobUtils.conditionalQuote(jobname)));
    }

    /* ---------------------------------------------------------------------- */
    /* getStatusCommand:                                                      */
    /* ---------------------------------------------------------------------- */
    public String getStatusCommand(String jobId)
    {
        return JobUtils.fillTemplate(_descriptor.getStatusCommand(), 
                                     Map.of("job_id", JobUtils.conditionalQuote(jobId)));
    }

    /** The command to ask when the status command has no answer, null if the
     * backend has none.
     */
    public String getFallbackStatusCommand(String jobId)
    {
        String template = _descriptor.getFallbackStatusCommand();
        if (StringUtils.isBlank(template)) return null;
        return JobUtils.fillTemplate(template, Map.of("job_id", JobUtils.conditionalQuote(jobId)));
    }

    /* ---------------------------------------------------------------------- */
    /* getCancelCommand:                                                      */
    /* ---------------------------------------------------------------------- */
    public String getCancelCommand(String jobId)
    {
        return JobUtils.fillTemplate(_descriptor.getCancelCommand(), 
                                     Map.of("job_id", JobUtils.conditionalQuote(jobId)));
    }

    /** @return the job id in the submit output or null */
    public String parseJobId(String stdout) {return _idParser.parseJobId(stdout);}

    /** @return the core status, UNKNOWN if the result cannot be interpreted */
    public JobStatusType parseStatus(CommandResult result) {return _statusParser.parseStatus(result);}

    /* ********************************************************************** */
    /*                               Accessors                                */
    /* ********************************************************************** */
    public String getName() {return _descriptor.getName();}
    public String getExtension() {return _descriptor.getExtension();}
    public BackendDescriptor getDescriptor() {return _descriptor;}
}
