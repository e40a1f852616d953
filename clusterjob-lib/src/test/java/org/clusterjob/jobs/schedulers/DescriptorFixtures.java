package org.clusterjob.jobs.schedulers;

import org.clusterjob.jobs.model.enumerations.CoreEnvVariable;

/** JSON text for small backend descriptors used in tests. */
public final class DescriptorFixtures 
{
    private DescriptorFixtures() {}
    
    /** A complete, valid descriptor for a scheduler named "toy". */
    public static String toy() {return toy("[\"--nodes={nodes}\", \"--cores={cores_per_node}\"]", false, true);}
    
    /** A descriptor with the given parallel templates (a JSON array), 
     * coalescing capability and pass-through switch.
     */
    public static String toy(String parallelDirectives, boolean coalescesNodes, boolean passThrough)
    {
        return "{\n" +
               "  \"name\": \"toy\",\n" +
               "  \"prefix\": \"#TOY\",\n" +
               "  \"extension\": \"toy\",\n" +
               "  \"submitCommand\": \"toysub {filename}\",\n" +
               "  \"statusCommand\": \"toystat {job_id}\",\n" +
               "  \"cancelCommand\": \"toykill {job_id}\",\n" +
               "  \"jobIdPattern\": \"^toy-(\\\\d+)$\",\n" +
               "  \"directives\": {\"jobname\": \"name={value}\", \"time\": \"walltime={hms}\"},\n" +
               "  \"parallelDirectives\": " + parallelDirectives + ",\n" +
               "  \"passThrough\": {\"enabled\": " + passThrough + "},\n" +
               "  \"envVars\": " + envVars("TOY_") + ",\n" +
               "  \"statusParsing\": {\"mode\": \"FIRST_TOKEN\"},\n" +
               "  \"statusMap\": {\"Q\": \"PENDING\", \"R\": \"RUNNING\", \"D\": \"COMPLETED\", \"X\": \"FAILED\"},\n" +
               "  \"capabilities\": {\"coalescesNodes\": " + coalescesNodes + "}\n" +
               "}\n";
    }
    
    /** Both reference forms of every core variable mapped to prefix + name. */
    public static String envVars(String nativePrefix)
    {
        var buf = new StringBuilder("{");
        for (var v : CoreEnvVariable.values()) {
            if (buf.length() > 1) buf.append(", ");
            String target = nativePrefix + v.getVarName();
            buf.append('"').append(v.getReference()).append("\": \"$").append(target).append("\", ");
            buf.append('"').append(v.getBracedReference()).append("\": \"${").append(target).append("}\"");
        }
        return buf.append('}').toString();
    }
}
