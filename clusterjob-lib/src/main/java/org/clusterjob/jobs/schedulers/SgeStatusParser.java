package org.clusterjob.jobs.schedulers;

import java.util.regex.Pattern;

import org.clusterjob.jobs.model.enumerations.JobStatusType;
import org.clusterjob.jobs.runners.CommandResult;

/** SGE's "qstat -j" prints a job record rather than a status string.  A
 * record means the job is still known to the scheduler; once it finishes
 * qstat reports that the job does not exist.  SGE does not let us tell a
 * queued job from a running one through this command, so any listed job is
 * reported as RUNNING.
 */
public final class SgeStatusParser 
 implements StatusParser
{
    private static final Pattern JOB_GONE   = Pattern.compile("Following jobs do not exist");
    private static final Pattern JOB_RECORD = Pattern.compile("(?m)^job_number:");
    
    @Override
    public JobStatusType parseStatus(CommandResult result)
    {
        if (JOB_GONE.matcher(result.getCombinedOutput()).find()) return JobStatusType.COMPLETED;
        if (result.isSuccess() && JOB_RECORD.matcher(result.getStdout()).find()) 
            return JobStatusType.RUNNING;
        return JobStatusType.UNKNOWN;
    }
}
