package org.clusterjob.jobs.config;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

import org.testng.Assert;
import org.testng.annotations.Test;

import org.clusterjob.jobs.exceptions.JobException;

@Test(groups={"unit"})
public class JobsConfigTest 
{
    @Test
    public void defaultsTest() throws JobException
    {
        // No clusterjob.properties on the test classpath.
        var config = JobsConfig.load();
        Assert.assertEquals(config.getDefaultBackend(), "slurm");
        Assert.assertFalse(config.isCacheEnabled());
        Assert.assertEquals(config.getCachePrefix(), "clusterjob");
        Assert.assertEquals(config.getDefaultShell(), "/bin/bash");
        Assert.assertEquals(config.getCommandTimeout(), Duration.ofSeconds(60));
        Assert.assertEquals(config.getMaxStatusFailures(), 5);
        Assert.assertEquals(config.getSshPort(), 22);
        Assert.assertTrue(config.isSshStrictHostKeyChecking());
    }
    
    @Test
    public void fromPropertiesTest() throws JobException
    {
        var props = new Properties();
        props.setProperty(JobsConfig.PROP_BACKEND, "pbspro");
        props.setProperty(JobsConfig.PROP_CACHE_DIR, "/tmp/cj-cache");
        props.setProperty(JobsConfig.PROP_CACHE_PREFIX, "proj");
        props.setProperty(JobsConfig.PROP_SHELL, "/bin/sh");
        props.setProperty(JobsConfig.PROP_COMMAND_TIMEOUT, " 15 ");
        props.setProperty(JobsConfig.PROP_MAX_FAILURES, "3");
        props.setProperty(JobsConfig.PROP_SSH_USER, "alice");
        props.setProperty(JobsConfig.PROP_SSH_PORT, "2222");
        props.setProperty(JobsConfig.PROP_SSH_STRICT, "no");
        
        var config = JobsConfig.fromProperties(props);
        Assert.assertEquals(config.getDefaultBackend(), "pbspro");
        Assert.assertTrue(config.isCacheEnabled());
        Assert.assertEquals(config.getCacheDir(), Paths.get("/tmp/cj-cache"));
        Assert.assertEquals(config.getCachePrefix(), "proj");
        Assert.assertEquals(config.getDefaultShell(), "/bin/sh");
        Assert.assertEquals(config.getCommandTimeout(), Duration.ofSeconds(15));
        Assert.assertEquals(config.getMaxStatusFailures(), 3);
        Assert.assertEquals(config.getSshUser(), "alice");
        Assert.assertEquals(config.getSshPort(), 2222);
        Assert.assertFalse(config.isSshStrictHostKeyChecking());
        
        // Round trip through the builder.
        var copy = config.toBuilder().maxStatusFailures(7).build();
        Assert.assertEquals(copy.getDefaultBackend(), "pbspro");
        Assert.assertEquals(copy.getMaxStatusFailures(), 7);
    }
    
    @Test(expectedExceptions = JobException.class)
    public void badNumberTest() throws JobException
    {
        var props = new Properties();
        props.setProperty(JobsConfig.PROP_COMMAND_TIMEOUT, "a minute");
        JobsConfig.fromProperties(props);
    }
    
    @Test
    public void builderValidationTest()
    {
        try {
            JobsConfig.builder().maxStatusFailures(0).build();
            Assert.fail("Expected zero failures to be rejected");
        }
        catch (IllegalArgumentException e) {}
        
        try {
            JobsConfig.builder().commandTimeout(Duration.ZERO).build();
            Assert.fail("Expected a zero timeout to be rejected");
        }
        catch (IllegalArgumentException e) {}
        
        try {
            JobsConfig.builder().defaultBackend(" ").build();
            Assert.fail("Expected a blank backend to be rejected");
        }
        catch (IllegalArgumentException e) {}
    }
}
