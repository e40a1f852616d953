package org.clusterjob.jobs.schedulers;

import org.clusterjob.jobs.model.enumerations.JobStatusType;
import org.clusterjob.jobs.runners.CommandResult;

/** Interprets the result of a status command.  Implementations never throw;
 * output that cannot be interpreted maps to UNKNOWN.
 */
@FunctionalInterface
public interface StatusParser
{
    JobStatusType parseStatus(CommandResult result);
}
