package org.clusterjob.jobs.cache;

import org.apache.commons.io.FilenameUtils;

import org.clusterjob.jobs.model.JobDescription;
import org.clusterjob.jobs.utils.JobUtils;

/** Cache key derivation. */
public final class CacheKeys 
{
    private CacheKeys() {}
    
    /** The key used when a submission doesn't supply one:
     * jobname-filename-backend, with the file name stripped of directories
     * and every character that is unsafe in a file name replaced.
     */
    public static String derive(JobDescription job, String backend, String filename)
    {
        String base = FilenameUtils.getName(filename);
        return JobUtils.sanitizeKey(job.getJobname() + "-" + base + "-" + backend);
    }
}
