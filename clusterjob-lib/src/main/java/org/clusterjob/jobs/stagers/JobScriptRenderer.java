package org.clusterjob.jobs.stagers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import org.clusterjob.jobs.exceptions.PlaceholderMissingException;
import org.clusterjob.jobs.exceptions.TranslationException;
import org.clusterjob.jobs.exceptions.UnknownResourceKeyException;
import org.clusterjob.jobs.model.JobDescription;
import org.clusterjob.jobs.model.RenderedScript;
import org.clusterjob.jobs.model.enumerations.CoreResource;
import org.clusterjob.jobs.schedulers.BackendDescriptor;
import org.clusterjob.jobs.utils.JobUtils;
import org.clusterjob.jobs.utils.MsgUtils;

/** Translates a scheduler independent job description into the submission
 * script of one backend.  Rendering is a pure function of its inputs: no
 * files are touched and no commands are run, so the same description and
 * descriptor always produce the same text.
 * 
 * The generated script has this layout:
 * 
 *  #!shell
 *  prefix jobname-directive
 *  prefix parallel-directives      (only if nodes, ppn or threads is set)
 *  prefix other-directives         (sorted by resource key)
 *  body
 * 
 * In the body, core environment variables such as $CLUSTERJOB_ID are replaced
 * by the backend's native variables and then {name} placeholders are filled
 * in.  A doubled brace is a literal brace, and a brace that follows a dollar
 * sign belongs to a shell variable reference and is left alone.
 */
public final class JobScriptRenderer 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Valid placeholder names.
    private static final Pattern PLACEHOLDER_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    
    // Characters that continue a shell variable name.
    private static final Pattern VAR_NAME_CHAR = Pattern.compile("[A-Za-z0-9_]");
    
    // Interpreter lines in the body are superseded by the generated one.
    private static final String SHEBANG = "#!";
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    // Shell used when a job doesn't name one.
    private final String _defaultShell;
    
    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    public JobScriptRenderer(String defaultShell) {_defaultShell = defaultShell;}
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* render:                                                                */
    /* ---------------------------------------------------------------------- */
    /** Render the job script and its companion scripts for a backend.
     * 
     * @param job the job description
     * @param descriptor the target backend
     * @return the rendered scripts
     * @throws UnknownResourceKeyException if a resource cannot be expressed
     * @throws PlaceholderMissingException if a placeholder has no value
     * @throws TranslationException on other invalid resource values
     */
    public RenderedScript render(JobDescription job, BackendDescriptor descriptor)
     throws TranslationException
    {
        // Defaults first so the job's own resources win.
        var effective = new LinkedHashMap<String,Object>(descriptor.getDefaults());
        effective.putAll(job.getResources());
        effective.remove(CoreResource.JOBNAME.getKey());
        
        var consumed = new ArrayList<String>();
        var ignored  = new ArrayList<String>();
        var header   = new ArrayList<String>();
        
        // ----- Job name.
        String jobnameTemplate = descriptor.getDirectives().get(CoreResource.JOBNAME.getKey());
        header.add(JobUtils.fillTemplate(jobnameTemplate, Map.of("value", job.getJobname())));
        consumed.add(CoreResource.JOBNAME.getKey());
        
        // ----- Parallel block.
        header.addAll(renderParallel(effective, descriptor, consumed, ignored));
        
        // ----- Everything else in key order.
        var remaining = new TreeMap<String,Object>();
        for (var entry : effective.entrySet())
            if (!CoreResource.isParallelKey(entry.getKey())) remaining.put(entry.getKey(), entry.getValue());
        for (var entry : remaining.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value == null || Boolean.FALSE.equals(value)) {ignored.add(key); continue;}
            header.add(renderDirective(key, value, descriptor));
            consumed.add(key);
        }
        
        // ----- Assemble the script.
        String shell = job.getShell() != null ? job.getShell() : _defaultShell;
        String filename = job.resolveFilename(descriptor.getExtension());
        var values = collectValues(job, effective, descriptor, filename, shell);
        
        var buf = new StringBuilder(1024);
        buf.append(SHEBANG).append(shell).append("\n");
        for (var line : header) buf.append(descriptor.getPrefix()).append(' ').append(line).append("\n");
        
        var body = new ArrayList<String>();
        for (var line : JobUtils.splitLines(job.getBody())) 
            if (!line.startsWith(SHEBANG)) body.add(line);
        buf.append(substitute(String.join("\n", body), descriptor, values));
        
        // ----- Companion scripts, without header.
        var aux = new LinkedHashMap<String,String>();
        for (var entry : job.getAuxScripts().entrySet())
            aux.put(entry.getKey(), substitute(entry.getValue(), descriptor, values));
        String prologue = job.getPrologue() == null ? null : substitute(job.getPrologue(), descriptor, values);
        String epilogue = job.getEpilogue() == null ? null : substitute(job.getEpilogue(), descriptor, values);
        
        return new RenderedScript(buf.toString(), filename, consumed, ignored, aux, prologue, epilogue);
    }
    
    /* ---------------------------------------------------------------------- */
    /* substituteEnvVars:                                                     */
    /* ---------------------------------------------------------------------- */
    /** Replace core environment variable references with the backend's
     * native ones.  The text is scanned once from left to right and at each
     * position the longest matching reference wins, so replacement text is
     * never rescanned.  An unbraced reference only matches if it is not
     * followed by another variable name character.
     */
    public static String substituteEnvVars(String text, Map<String,String> envVars)
    {
        if (StringUtils.isEmpty(text) || envVars.isEmpty()) return text;
        
        var aliases = new ArrayList<String>(envVars.keySet());
        aliases.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        
        var buf = new StringBuilder(text.length() + 64);
        int i = 0;
        outer:
        while (i < text.length()) {
            if (text.charAt(i) == '$') 
                for (var alias : aliases) {
                    if (!text.startsWith(alias, i)) continue;
                    int end = i + alias.length();
                    if (!alias.endsWith("}") && end < text.length() 
                        && VAR_NAME_CHAR.matcher(String.valueOf(text.charAt(end))).matches()) continue;
                    buf.append(envVars.get(alias));
                    i = end;
                    continue outer;
                }
            buf.append(text.charAt(i++));
        }
        return buf.toString();
    }
    
    /* ---------------------------------------------------------------------- */
    /* substitutePlaceholders:                                                */
    /* ---------------------------------------------------------------------- */
    /** Fill in {name} placeholders in a single pass.
     * 
     * @param text the text to process
     * @param values placeholder name to value
     * @return the text with placeholders replaced and doubled braces collapsed
     * @throws PlaceholderMissingException if a placeholder has no value
     */
    public static String substitutePlaceholders(String text, Map<String,String> values)
     throws PlaceholderMissingException
    {
        if (StringUtils.isEmpty(text)) return text;
        
        var buf = new StringBuilder(text.length() + 64);
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;
            
            if (c == '{' && next == '{') {buf.append('{'); i += 2; continue;}
            if (c == '}' && next == '}') {buf.append('}'); i += 2; continue;}
            if (c != '{') {buf.append(c); i++; continue;}
            
            // Shell variable reference, copied up to its closing brace.
            int close = text.indexOf('}', i + 1);
            if (i > 0 && text.charAt(i - 1) == '$') {
                int end = close < 0 ? text.length() : close + 1;
                buf.append(text, i, end);
                i = end;
                continue;
            }
            
            // Anything that isn't a well-formed name is ordinary shell text.
            String name = close < 0 ? null : text.substring(i + 1, close);
            if (name == null || !PLACEHOLDER_NAME.matcher(name).matches()) {buf.append(c); i++; continue;}
            
            String value = values.get(name);
            if (value == null) {
                String msg = MsgUtils.getMsg("JOBS_PLACEHOLDER_MISSING", name);
                throw new PlaceholderMissingException(msg, name);
            }
            buf.append(value);
            i = close + 1;
        }
        return buf.toString();
    }
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* renderParallel:                                                        */
    /* ---------------------------------------------------------------------- */
    private static List<String> renderParallel(Map<String,Object> effective, BackendDescriptor descriptor,
                                               List<String> consumed, List<String> ignored)
     throws TranslationException
    {
        // Collect the parallel resources that are actually set.
        var counts = new HashMap<String,Long>();
        for (var res : CoreResource.PARALLEL) {
            String key = res.getKey();
            if (!effective.containsKey(key)) continue;
            Object value = effective.get(key);
            if (value == null || Boolean.FALSE.equals(value)) {ignored.add(key); continue;}
            counts.put(key, toPositiveCount(key, value));
        }
        if (counts.isEmpty()) return List.of();
        
        long nodes   = counts.getOrDefault(CoreResource.NODES.getKey(), 1L);
        long ppn     = counts.getOrDefault(CoreResource.PPN.getKey(), 1L);
        long threads = counts.getOrDefault(CoreResource.THREADS.getKey(), 1L);
        var tokens = Map.of("nodes",          String.valueOf(nodes),
                            "ppn",            String.valueOf(ppn),
                            "threads",        String.valueOf(threads),
                            "cores_per_node", String.valueOf(ppn * threads),
                            "total_tasks",    String.valueOf(nodes * ppn),
                            "total_cores",    String.valueOf(nodes * ppn * threads));
        
        var lines = new ArrayList<String>();
        for (var template : descriptor.getParallelDirectives()) 
            lines.add(JobUtils.fillTemplate(template, tokens));
        for (var res : CoreResource.PARALLEL) 
            if (counts.containsKey(res.getKey())) consumed.add(res.getKey());
        return lines;
    }
    
    /* ---------------------------------------------------------------------- */
    /* renderDirective:                                                       */
    /* ---------------------------------------------------------------------- */
    private static String renderDirective(String key, Object value, BackendDescriptor descriptor)
     throws TranslationException
    {
        // Mapped resources use the descriptor's template.
        String template = descriptor.getDirectives().get(key);
        String text = formatValue(value);
        if (template != null) {
            var tokens = new HashMap<String,String>();
            tokens.put("value", text);
            if (template.contains("{minutes}") || template.contains("{seconds}") || template.contains("{hms}")) {
                long seconds = JobUtils.timeToSeconds(text);
                tokens.put("seconds", String.valueOf(seconds));
                tokens.put("minutes", String.valueOf(seconds / 60));
                tokens.put("hms", JobUtils.secondsToHms(seconds));
            }
            return JobUtils.fillTemplate(template, tokens);
        }
        
        // Everything else depends on the pass-through rule.
        var rule = descriptor.getPassThrough();
        if (!rule.isEnabled()) {
            String msg = MsgUtils.getMsg("JOBS_UNKNOWN_RESOURCE_KEY", key, descriptor.getName());
            throw new UnknownResourceKeyException(msg, key, descriptor.getName());
        }
        boolean flag = Boolean.TRUE.equals(value);
        return JobUtils.fillTemplate(rule.templateFor(key, flag), Map.of("key", key, "value", text));
    }
    
    /* ---------------------------------------------------------------------- */
    /* collectValues:                                                         */
    /* ---------------------------------------------------------------------- */
    /** Placeholder values in order of precedence: explicit placeholders, then
     * resources, then job attributes.
     */
    private static Map<String,String> collectValues(JobDescription job, Map<String,Object> effective,
                                                    BackendDescriptor descriptor, String filename,
                                                    String shell)
    {
        var values = new HashMap<String,String>();
        putIfAbsent(values, "jobname", job.getJobname());
        putIfAbsent(values, "filename", filename);
        putIfAbsent(values, "backend", descriptor.getName());
        putIfAbsent(values, "remote", job.getRemote());
        putIfAbsent(values, "rootdir", job.getRootdir());
        putIfAbsent(values, "workdir", job.getWorkdir());
        putIfAbsent(values, "fulldir", JobUtils.joinPath(job.getRootdir(), job.getWorkdir()));
        putIfAbsent(values, "shell", shell);
        
        // Later puts take precedence.
        for (var entry : effective.entrySet())
            if (entry.getValue() != null) values.put(entry.getKey(), formatValue(entry.getValue()));
        values.putAll(job.getPlaceholders());
        return values;
    }
    
    private static void putIfAbsent(Map<String,String> values, String key, String value)
    {if (value != null) values.putIfAbsent(key, value);}
    
    /* ---------------------------------------------------------------------- */
    /* substitute:                                                            */
    /* ---------------------------------------------------------------------- */
    private static String substitute(String text, BackendDescriptor descriptor, Map<String,String> values)
     throws PlaceholderMissingException
    {
        return substitutePlaceholders(substituteEnvVars(text, descriptor.getEnvVars()), values);
    }
    
    /* ---------------------------------------------------------------------- */
    /* formatValue:                                                           */
    /* ---------------------------------------------------------------------- */
    /** Render a resource value.  Whole numbers parsed from JSON arrive as
     * doubles and are printed without a fraction.
     */
    private static String formatValue(Object value)
    {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) return String.valueOf((long) d);
        }
        return String.valueOf(value).strip();
    }
    
    /* ---------------------------------------------------------------------- */
    /* toPositiveCount:                                                       */
    /* ---------------------------------------------------------------------- */
    private static long toPositiveCount(String key, Object value) throws TranslationException
    {
        long count;
        try {
            if (value instanceof Number) {
                double d = ((Number) value).doubleValue();
                if (d != Math.rint(d)) throw new NumberFormatException(String.valueOf(value));
                count = (long) d;
            }
            else count = Long.parseLong(String.valueOf(value).strip());
        }
        catch (NumberFormatException e) {
            String msg = MsgUtils.getMsg("JOBS_INVALID_PARALLEL_VALUE", key, value);
            throw new TranslationException(msg, e);
        }
        if (count < 1) {
            String msg = MsgUtils.getMsg("JOBS_INVALID_PARALLEL_VALUE", key, value);
            throw new TranslationException(msg);
        }
        return count;
    }
}
