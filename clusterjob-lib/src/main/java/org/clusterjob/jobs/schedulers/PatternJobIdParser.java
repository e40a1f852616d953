package org.clusterjob.jobs.schedulers;

import java.util.regex.Pattern;

import org.clusterjob.jobs.utils.JobUtils;

/** The default id parser: the descriptor's jobIdPattern applied to the
 * submit output from the last line backwards.
 */
public final class PatternJobIdParser 
 implements JobIdParser
{
    private final Pattern _pattern;
    
    public PatternJobIdParser(Pattern pattern) {_pattern = pattern;}
    
    @Override
    public String parseJobId(String stdout) {return JobUtils.findIdInOutput(_pattern, stdout);}
}
