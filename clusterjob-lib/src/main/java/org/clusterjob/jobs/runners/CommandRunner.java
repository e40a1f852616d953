package org.clusterjob.jobs.runners;

import java.time.Duration;

import org.clusterjob.jobs.exceptions.CommandRunnerException;

/** Executes shell commands and writes files on the host where a job's
 * scheduler lives.  The local implementation runs commands as child
 * processes, the remote one over an SSH connection.
 * 
 * A command that runs and exits with a non-zero code is a normal result.  
 * Only the inability to run the command at all, including a timeout, raises
 * {@link CommandRunnerException}.
 */
public interface CommandRunner
 extends AutoCloseable
{
    /** Run a shell command line.
     * 
     * @param command the command line, interpreted by /bin/sh
     * @param workdir the directory to run in, null or empty for the default
     * @param timeout the maximum time to wait for the command to finish
     * @return the exit code and captured output
     * @throws CommandRunnerException if the command could not be run
     */
    CommandResult execute(String command, String workdir, Duration timeout)
     throws CommandRunnerException;
    
    /** Write a file, creating missing parent directories.
     * 
     * @param content the file content
     * @param path the destination path on the runner's host
     * @param executable true to set the user execute permission
     * @throws CommandRunnerException if the file could not be written
     */
    void stageFile(String content, String path, boolean executable)
     throws CommandRunnerException;
    
    /** The host this runner executes on, "localhost" for local runners. */
    String getHost();
    
    /** Release any connection held by this runner.  Runners can be used
     * again after closing; connections are reopened on demand.
     */
    @Override
    void close();
}
