package org.clusterjob.jobs.schedulers;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.clusterjob.jobs.model.enumerations.JobStatusType;
import org.clusterjob.jobs.runners.CommandResult;
import org.clusterjob.jobs.schedulers.BackendDescriptor.StatusParsing;
import org.clusterjob.jobs.utils.JobUtils;
import org.clusterjob.jobs.utils.MsgUtils;

/** The default status parser, driven entirely by descriptor data.
 * 
 * Status messages are searched first in all of the command's output, whatever
 * its exit code.  This covers schedulers that report finished jobs as errors,
 * such as "qstat: Unknown Job".  Otherwise, if the command succeeded, the
 * native status string is located according to the parsing mode and looked up
 * in the status map.  Anything else yields UNKNOWN.
 */
public final class TableStatusParser 
 implements StatusParser
{
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(TableStatusParser.class);
    
    private final BackendDescriptor _descriptor;
    
    public TableStatusParser(BackendDescriptor descriptor) {_descriptor = descriptor;}
    
    /* ---------------------------------------------------------------------- */
    /* parseStatus:                                                           */
    /* ---------------------------------------------------------------------- */
    @Override
    public JobStatusType parseStatus(CommandResult result)
    {
        // Messages take precedence over everything else.
        String combined = result.getCombinedOutput();
        for (var message : _descriptor.getStatusMessages())
            if (message.matches(combined)) return message.getStatus();
        
        // Tabular output is only meaningful when the command succeeded.
        if (!result.isSuccess()) return JobStatusType.UNKNOWN;
        
        String nativeStatus = extract(_descriptor.getStatusParsing(), result.getStdout());
        if (nativeStatus == null) return JobStatusType.UNKNOWN;
        
        JobStatusType status = _descriptor.getStatusMap().get(nativeStatus);
        if (status == null) {
            _log.warn(MsgUtils.getMsg("JOBS_STATUS_UNMAPPED", _descriptor.getName(), nativeStatus));
            return JobStatusType.UNKNOWN;
        }
        return status;
    }
    
    /* ---------------------------------------------------------------------- */
    /* extract:                                                               */
    /* ---------------------------------------------------------------------- */
    /** Locate the native status string, returning null if it's not there. */
    private static String extract(StatusParsing parsing, String stdout)
    {
        if (parsing == null || StringUtils.isBlank(stdout)) return null;
        switch (parsing.getMode()) {
            case FIRST_TOKEN: {
                for (var line : JobUtils.splitLines(stdout)) {
                    if (StringUtils.isBlank(line)) continue;
                    return line.strip().split("\\s+")[0];
                }
                return null;
            }
            case COLUMN: {
                String[] tokens = JobUtils.getLastLine(stdout).split("\\s+");
                return parsing.getColumn() < tokens.length ? tokens[parsing.getColumn()] : null;
            }
            case HEADER_COLUMN: {
                String[] lines = JobUtils.splitLines(stdout);
                for (int i = 0; i < lines.length; i++) {
                    String[] header = lines[i].strip().split("\\s+");
                    if (!parsing.getHeaderAnchor().equals(header[0])) continue;
                    
                    // The status column in the header line.
                    int col = -1;
                    for (int j = 0; j < header.length; j++) 
                        if (parsing.getHeaderName().equals(header[j])) {col = j; break;}
                    if (col < 0) return null;
                    
                    // The first non-blank data line after the header.
                    for (int k = i + 1; k < lines.length; k++) {
                        if (StringUtils.isBlank(lines[k])) continue;
                        String[] row = lines[k].strip().split("\\s+");
                        return col < row.length ? row[col] : null;
                    }
                    return null;
                }
                return null;
            }
            default:
                return null;
        }
    }
}
