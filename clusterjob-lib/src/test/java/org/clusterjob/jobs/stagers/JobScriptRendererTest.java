package org.clusterjob.jobs.stagers;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import org.clusterjob.jobs.exceptions.JobException;
import org.clusterjob.jobs.exceptions.PlaceholderMissingException;
import org.clusterjob.jobs.exceptions.TranslationException;
import org.clusterjob.jobs.exceptions.UnknownResourceKeyException;
import org.clusterjob.jobs.model.JobDescription;
import org.clusterjob.jobs.schedulers.BackendDescriptor;
import org.clusterjob.jobs.schedulers.BackendRegistry;
import org.clusterjob.jobs.schedulers.DescriptorFixtures;

@Test(groups={"unit"})
public class JobScriptRendererTest 
{
    private BackendRegistry   _registry;
    private JobScriptRenderer _renderer;
    
    @BeforeClass
    public void setup() throws JobException
    {
        _registry = BackendRegistry.load();
        _renderer = new JobScriptRenderer("/bin/bash");
    }
    
    /* ---------------------------------------------------------------------- */
    /* slurmScriptTest:                                                       */
    /* ---------------------------------------------------------------------- */
    @Test
    public void slurmScriptTest() throws JobException
    {
        var job = JobDescription.builder("hello", "echo $CLUSTERJOB_ID\n")
                    .nodes(2).ppn(4).time("01:00:00").queue("debug").build();
        var rendered = _renderer.render(job, slurm());
        
        String expected = "#!/bin/bash\n" +
                          "#SBATCH --job-name=hello\n" +
                          "#SBATCH --nodes=2\n" +
                          "#SBATCH --ntasks-per-node=4\n" +
                          "#SBATCH --cpus-per-task=1\n" +
                          "#SBATCH --partition=debug\n" +
                          "#SBATCH --time=01:00:00\n" +
                          "echo $SLURM_JOB_ID\n";
        Assert.assertEquals(rendered.getScript(), expected);
        Assert.assertEquals(rendered.getFilename(), "hello.slr");
        Assert.assertEquals(rendered.getConsumedKeys(), List.of("jobname", "nodes", "ppn", "queue", "time"));
        Assert.assertTrue(rendered.getIgnoredKeys().isEmpty());
    }
    
    @Test
    public void renderIsPureTest() throws JobException
    {
        var job = JobDescription.builder("pure", "cd {fulldir}\nsrun ./a.out $CLUSTERJOB_NODELIST\n")
                    .rootdir("/scratch/").workdir("run1").nodes(3).threads(2).mem(1000)
                    .resource("account", "proj").auxScript("post.sh", "echo $CLUSTERJOB_NAME").build();
        var copy = job.toBuilder().build();
        
        for (var name : _registry.getNames()) {
            var descriptor = _registry.getDescriptor(name);
            var first = _renderer.render(job, descriptor);
            var second = _renderer.render(job, descriptor);
            Assert.assertEquals(second.getScript(), first.getScript(), name);
            Assert.assertEquals(second.getAuxScripts(), first.getAuxScripts(), name);
            Assert.assertEquals(second.getConsumedKeys(), first.getConsumedKeys(), name);
        }
        Assert.assertEquals(job, copy);
        Assert.assertEquals(job.getWorkdir(), "run1");
        Assert.assertEquals(job.getRootdir(), "/scratch");
    }
    
    /* ---------------------------------------------------------------------- */
    /* coreCountTest:                                                         */
    /* ---------------------------------------------------------------------- */
    @Test
    public void coreCountTest() throws JobException
    {
        int[][] triples = {{1, 1, 1}, {2, 4, 1}, {3, 2, 5}, {1, 16, 2}, {8, 1, 3}};
        for (var name : _registry.getNames()) {
            var descriptor = _registry.getDescriptor(name);
            for (var t : triples) {
                var job = JobDescription.builder("cores", "hostname\n").nodes(t[0]).ppn(t[1]).threads(t[2]).build();
                String script = _renderer.render(job, descriptor).getScript();
                Assert.assertEquals(totalCores(name, script), (long) t[0] * t[1] * t[2], 
                                    name + " " + t[0] + "x" + t[1] + "x" + t[2] + "\n" + script);
            }
        }
    }
    
    @Test
    public void parallelDirectivesTest() throws JobException
    {
        var job = JobDescription.builder("par", "").nodes(2).ppn(3).threads(2).time("1:30:00").build();
        
        String lsf = _renderer.render(job, _registry.getDescriptor("lsf")).getScript();
        Assert.assertTrue(lsf.contains("#BSUB -n 12\n"), lsf);
        Assert.assertTrue(lsf.contains("#BSUB -R \"span[ptile=6]\"\n"), lsf);
        Assert.assertTrue(lsf.contains("#BSUB -W 90\n"), lsf);
        
        String pbspro = _renderer.render(job, _registry.getDescriptor("pbspro")).getScript();
        Assert.assertTrue(pbspro.contains("#PBS -l select=2:ncpus=6:mpiprocs=3:ompthreads=2\n"), pbspro);
        
        String sge = _renderer.render(job, _registry.getDescriptor("sge")).getScript();
        Assert.assertTrue(sge.contains("#$ -pe smp 12\n"), sge);
        
        // No parallel block without parallel resources.
        var serial = JobDescription.builder("serial", "").nodes(1).build();
        Assert.assertTrue(_renderer.render(serial, slurm()).getScript().contains("--nodes=1"));
        var none = JobDescription.builder("none", "").build();
        Assert.assertFalse(_renderer.render(none, slurm()).getScript().contains("--nodes"));
    }
    
    @Test
    public void invalidParallelValueTest() throws JobException
    {
        for (Object bad : new Object[] {"two", 0, -1, 1.5}) {
            var job = JobDescription.builder("bad", "").resource("nodes", bad).build();
            try {
                _renderer.render(job, slurm());
                Assert.fail("Expected nodes=" + bad + " to be rejected");
            }
            catch (TranslationException e) {
                Assert.assertTrue(e.getMessage().contains("JOBS_INVALID_PARALLEL_VALUE"), e.getMessage());
            }
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* envVarTest:                                                            */
    /* ---------------------------------------------------------------------- */
    @Test
    public void envVarTest() throws JobException
    {
        String body = "echo $CLUSTERJOB_ID ${CLUSTERJOB_NAME} $CLUSTERJOB_IDX $CLUSTERJOB_ID.out\n";
        var job = JobDescription.builder("env", body).build();
        
        String script = _renderer.render(job, slurm()).getScript();
        Assert.assertTrue(script.endsWith("echo $SLURM_JOB_ID ${SLURM_JOB_NAME} $CLUSTERJOB_IDX $SLURM_JOB_ID.out\n"), script);
        
        String pbs = _renderer.render(job, _registry.getDescriptor("pbs")).getScript();
        Assert.assertTrue(pbs.endsWith("echo $PBS_JOBID ${PBS_JOBNAME} $CLUSTERJOB_IDX $PBS_JOBID.out\n"), pbs);
    }
    
    @Test
    public void substituteEnvVarsTest()
    {
        // Longest alias first, and replacements are not rescanned.
        var aliases = Map.of("$A", "$B", "$AB", "Y", "$B", "C");
        Assert.assertEquals(JobScriptRenderer.substituteEnvVars("$AB $A $B", aliases), "Y $B C");
        Assert.assertEquals(JobScriptRenderer.substituteEnvVars("$A_1", aliases), "$A_1");
        Assert.assertEquals(JobScriptRenderer.substituteEnvVars("", aliases), "");
    }
    
    /* ---------------------------------------------------------------------- */
    /* placeholderTest:                                                       */
    /* ---------------------------------------------------------------------- */
    @Test
    public void placeholderTest() throws JobException
    {
        String body = "cd {rundir}\n" +
                      "echo {{literal}}\n" +
                      "awk '{print $1}' in.txt\n" +
                      "echo ${HOME} {jobname} {queue} {filename}\n";
        var job = JobDescription.builder("hello", body).queue("debug").placeholder("rundir", "/scratch/x").build();
        String script = _renderer.render(job, slurm()).getScript();
        
        String expected = "cd /scratch/x\n" +
                          "echo {literal}\n" +
                          "awk '{print $1}' in.txt\n" +
                          "echo ${HOME} hello debug hello.slr\n";
        Assert.assertTrue(script.endsWith(expected), script);
        
        // Explicit placeholders take precedence over resources, but not in the header.
        var override = job.toBuilder().placeholder("queue", "override").build();
        script = _renderer.render(override, slurm()).getScript();
        Assert.assertTrue(script.contains("#SBATCH --partition=debug\n"), script);
        Assert.assertTrue(script.contains("hello override hello.slr"), script);
    }
    
    @Test
    public void placeholderMissingTest() throws JobException
    {
        var job = JobDescription.builder("hello", "echo {undefined}\n").build();
        try {
            _renderer.render(job, slurm());
            Assert.fail("Expected a missing placeholder");
        }
        catch (PlaceholderMissingException e) {
            Assert.assertEquals(e.getPlaceholder(), "undefined");
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* passThroughTest:                                                       */
    /* ---------------------------------------------------------------------- */
    @Test
    public void passThroughTest() throws JobException
    {
        var job = JobDescription.builder("pt", "")
                    .resource("account", "proj")
                    .resource("x", 1)
                    .resource("exclusive", true)
                    .resource("requeue", false)
                    .resource("--gres", "gpu:1")
                    .build();
        var rendered = _renderer.render(job, slurm());
        
        String expected = "#!/bin/bash\n" +
                          "#SBATCH --job-name=pt\n" +
                          "#SBATCH --gres gpu:1\n" +
                          "#SBATCH --account=proj\n" +
                          "#SBATCH --exclusive\n" +
                          "#SBATCH -x 1\n";
        Assert.assertEquals(rendered.getScript(), expected);
        Assert.assertEquals(rendered.getIgnoredKeys(), List.of("requeue"));
        
        String pbs = _renderer.render(job, _registry.getDescriptor("pbs")).getScript();
        Assert.assertTrue(pbs.contains("#PBS -l account=proj\n"), pbs);
        Assert.assertTrue(pbs.contains("#PBS -l exclusive\n"), pbs);
    }
    
    @Test
    public void passThroughDisabledTest() throws JobException
    {
        var registry = new BackendRegistry();
        var toy = registry.register(DescriptorFixtures.toy("[\"--nodes={nodes} --cores={cores_per_node}\"]", false, false));
        
        // Mapped keys still work.
        var job = JobDescription.builder("toyjob", "").time("90").build();
        Assert.assertTrue(_renderer.render(job, toy).getScript().contains("#TOY walltime=01:30:00\n"));
        
        var unmapped = job.toBuilder().resource("account", "proj").build();
        try {
            _renderer.render(unmapped, toy);
            Assert.fail("Expected an unknown resource key");
        }
        catch (UnknownResourceKeyException e) {
            Assert.assertEquals(e.getResourceKey(), "account");
            Assert.assertEquals(e.getBackend(), "toy");
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* defaultsTest:                                                          */
    /* ---------------------------------------------------------------------- */
    @Test
    public void defaultsTest() throws JobException
    {
        var job = JobDescription.builder("hello", "date\n").mem(2048).build();
        String pbs = _renderer.render(job, _registry.getDescriptor("pbs")).getScript();
        String expected = "#!/bin/bash\n" +
                          "#PBS -N hello\n" +
                          "#PBS -V\n" +
                          "#PBS -j oe\n" +
                          "#PBS -l mem=2048m\n" +
                          "date\n";
        Assert.assertEquals(pbs, expected);
        
        // The job's own value replaces the backend default.
        var joined = job.toBuilder().resource("-j", "n").build();
        pbs = _renderer.render(joined, _registry.getDescriptor("pbs")).getScript();
        Assert.assertTrue(pbs.contains("#PBS -j n\n"), pbs);
        Assert.assertFalse(pbs.contains("-j oe"), pbs);
        
        String sge = _renderer.render(job, _registry.getDescriptor("sge")).getScript();
        Assert.assertTrue(sge.contains("#$ -V\n#$ -cwd\n#$ -j y\n"), sge);
        
        // Whole numbers parsed from JSON arrive as doubles.
        var dbl = JobDescription.builder("hello", "").resource("mem", 2048.0).build();
        pbs = _renderer.render(dbl, _registry.getDescriptor("pbs")).getScript();
        Assert.assertTrue(pbs.contains("#PBS -l mem=2048m\n"), pbs);
    }
    
    @Test
    public void shellAndCompanionScriptsTest() throws JobException
    {
        var job = JobDescription.builder("hello", "#!/bin/sh\necho hi\n")
                    .shell("/bin/zsh")
                    .filename("custom.sh")
                    .auxScript("helper.sh", "echo $CLUSTERJOB_WORKDIR {jobname}")
                    .prologue("mkdir -p {fulldir}")
                    .epilogue("echo ${CLUSTERJOB_ID} done")
                    .workdir("out")
                    .build();
        var rendered = _renderer.render(job, slurm());
        
        Assert.assertTrue(rendered.getScript().startsWith("#!/bin/zsh\n#SBATCH --job-name=hello\n"));
        Assert.assertFalse(rendered.getScript().contains("#!/bin/sh"));
        Assert.assertTrue(rendered.getScript().endsWith("echo hi\n"));
        Assert.assertEquals(rendered.getFilename(), "custom.sh");
        Assert.assertEquals(rendered.getAuxScripts().get("helper.sh"), "echo $SLURM_SUBMIT_DIR hello");
        Assert.assertEquals(rendered.getPrologue(), "mkdir -p out");
        Assert.assertEquals(rendered.getEpilogue(), "echo ${SLURM_JOB_ID} done");
    }
    
    @Test
    public void reservedJobnameTest()
    {
        try {
            JobDescription.builder("hello", "").resource("jobname", "other");
            Assert.fail("Expected jobname to be reserved");
        }
        catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("JOBS_RESERVED_RESOURCE_KEY"), e.getMessage());
        }
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    private BackendDescriptor slurm() throws JobException {return _registry.getDescriptor("slurm");}
    
    /** The total core count a backend's header requests. */
    private static long totalCores(String backend, String script)
    {
        switch (backend) {
            case "slurm":
                return find(script, "--nodes=(\\d+)") * find(script, "--ntasks-per-node=(\\d+)") 
                       * find(script, "--cpus-per-task=(\\d+)");
            case "pbs":
            case "lpbs":
                return find(script, "-l nodes=(\\d+):") * find(script, ":ppn=(\\d+)");
            case "pbspro":
                return find(script, "-l select=(\\d+):") * find(script, ":ncpus=(\\d+)");
            case "lsf":
                return find(script, "-n (\\d+)");
            case "sge":
                return find(script, "-pe smp (\\d+)");
            default:
                throw new IllegalArgumentException("No core count rule for backend " + backend);
        }
    }
    
    private static long find(String script, String regex)
    {
        Matcher m = Pattern.compile(regex).matcher(script);
        Assert.assertTrue(m.find(), regex + " not found in\n" + script);
        return Long.parseLong(m.group(1));
    }
}
