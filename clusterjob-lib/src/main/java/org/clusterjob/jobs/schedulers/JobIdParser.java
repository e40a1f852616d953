package org.clusterjob.jobs.schedulers;

/** Extracts the scheduler's job id from the output of a submit command. */
@FunctionalInterface
public interface JobIdParser
{
    /** @return the job id or null if the output does not contain one */
    String parseJobId(String stdout);
}
