package org.clusterjob.jobs.schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import org.clusterjob.jobs.exceptions.BackendDefinitionException;
import org.clusterjob.jobs.utils.JobsGsonUtils;
import org.clusterjob.jobs.utils.MsgUtils;

/** The set of known batch schedulers.  The built-in schedulers are defined by
 * JSON descriptors on the classpath: backends/index.txt lists one name per
 * line and backends/&lt;name&gt;.json holds the corresponding descriptor.  More
 * schedulers can be registered at runtime, either as descriptor objects or as
 * JSON text.
 * 
 * The registry also holds the capability table of parser overrides.  An
 * override replaces the descriptor driven job id or status parsing for one
 * backend when the scheduler's output cannot be described as data.  The
 * overrides for built-in schedulers are installed by {@link #load()}. 
 * 
 * Registries are independent of each other and safe for concurrent use.
 */
public final class BackendRegistry 
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(BackendRegistry.class);
    
    // Classpath locations of the built-in descriptors.
    public static final String BACKEND_DIR   = "backends/";
    public static final String BACKEND_INDEX = BACKEND_DIR + "index.txt";
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final Map<String,BackendDescriptor> _descriptors   = new ConcurrentHashMap<>();
    private final Map<String,JobIdParser>       _idParsers     = new ConcurrentHashMap<>();
    private final Map<String,StatusParser>      _statusParsers = new ConcurrentHashMap<>();
    
    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    /** An empty registry. */
    public BackendRegistry() {}
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* load:                                                                  */
    /* ---------------------------------------------------------------------- */
    /** Create a registry with all built-in schedulers.
     * 
     * @return the populated registry
     * @throws BackendDefinitionException if a built-in descriptor is missing 
     *          or invalid
     */
    public static BackendRegistry load() throws BackendDefinitionException
    {
        var registry = new BackendRegistry();
        
        // Parser overrides must be in place before validation.
        registry.registerStatusParser("sge", new SgeStatusParser());
        
        for (var name : readIndex()) {
            String resource = BACKEND_DIR + name + ".json";
            try (InputStream in = getResourceStream(resource)) {
                if (in == null) {
                    String msg = MsgUtils.getMsg("JOBS_BACKEND_RESOURCE_NOT_FOUND", resource);
                    throw new BackendDefinitionException(msg);
                }
                var descriptor = parse(new InputStreamReader(in, StandardCharsets.UTF_8), resource);
                if (!name.equals(descriptor.getName())) {
                    String msg = MsgUtils.getMsg("JOBS_BACKEND_INVALID_FIELD", resource, "name", descriptor.getName());
                    throw new BackendDefinitionException(msg);
                }
                registry.register(descriptor);
            }
            catch (IOException e) {
                String msg = MsgUtils.getMsg("JOBS_BACKEND_LOAD_ERROR", resource, e.getMessage());
                throw new BackendDefinitionException(msg, e);
            }
        }
        
        if (_log.isDebugEnabled()) 
            _log.debug(MsgUtils.getMsg("JOBS_BACKENDS_LOADED", registry.getNames()));
        return registry;
    }
    
    /* ---------------------------------------------------------------------- */
    /* parse:                                                                 */
    /* ---------------------------------------------------------------------- */
    /** Parse a descriptor without validating or registering it.
     * 
     * @param reader the JSON source
     * @param source a name for the source used in error messages
     * @return the descriptor
     * @throws BackendDefinitionException if the JSON is malformed
     */
    public static BackendDescriptor parse(Reader reader, String source)
     throws BackendDefinitionException
    {
        BackendDescriptor descriptor;
        try {descriptor = JobsGsonUtils.getGson().fromJson(reader, BackendDescriptor.class);}
        catch (JsonParseException e) {
            String msg = MsgUtils.getMsg("JOBS_BACKEND_LOAD_ERROR", source, e.getMessage());
            throw new BackendDefinitionException(msg, e);
        }
        if (descriptor == null) {
            String msg = MsgUtils.getMsg("JOBS_BACKEND_LOAD_ERROR", source, "empty document");
            throw new BackendDefinitionException(msg);
        }
        return descriptor;
    }
    
    /* ---------------------------------------------------------------------- */
    /* register:                                                              */
    /* ---------------------------------------------------------------------- */
    /** Validate and add a descriptor, replacing any descriptor of the same 
     * name.
     */
    public void register(BackendDescriptor descriptor) throws BackendDefinitionException
    {
        String name = descriptor.getName();
        descriptor.validate(name != null && _idParsers.containsKey(name), 
                            name != null && _statusParsers.containsKey(name));
        if (_descriptors.put(name, descriptor) != null)
            _log.info(MsgUtils.getMsg("JOBS_BACKEND_REPLACED", name));
    }
    
    /** Parse, validate and add a descriptor given as JSON text. */
    public BackendDescriptor register(String json) throws BackendDefinitionException
    {
        var descriptor = parse(new StringReader(json), "json");
        register(descriptor);
        return descriptor;
    }
    
    /** Install a job id parser override for the named backend. */
    public void registerIdParser(String backend, JobIdParser parser)
    {_idParsers.put(backend, parser);}
    
    /** Install a status parser override for the named backend. */
    public void registerStatusParser(String backend, StatusParser parser)
    {_statusParsers.put(backend, parser);}
    
    /* ---------------------------------------------------------------------- */
    /* getScheduler:                                                          */
    /* ---------------------------------------------------------------------- */
    /** Get the scheduler for a backend name.
     * 
     * @param name the backend name
     * @return the scheduler combining the descriptor with its overrides
     * @throws BackendDefinitionException if the backend is unknown
     */
    public JobScheduler getScheduler(String name) throws BackendDefinitionException
    {
        var descriptor = getDescriptor(name);
        return new JobScheduler(descriptor, _idParsers.get(name), _statusParsers.get(name));
    }
    
    /** Get a registered descriptor by name. */
    public BackendDescriptor getDescriptor(String name) throws BackendDefinitionException
    {
        var descriptor = name == null ? null : _descriptors.get(name);
        if (descriptor == null) {
            String msg = MsgUtils.getMsg("JOBS_UNKNOWN_BACKEND", name, getNames());
            throw new BackendDefinitionException(msg);
        }
        return descriptor;
    }
    
    /** The sorted names of all registered backends. */
    public Set<String> getNames() {return new TreeSet<>(_descriptors.keySet());}
    
    public boolean contains(String name) {return name != null && _descriptors.containsKey(name);}
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* readIndex:                                                             */
    /* ---------------------------------------------------------------------- */
    /** Read the backend names from the index, skipping blanks and comments. */
    private static List<String> readIndex() throws BackendDefinitionException
    {
        try (InputStream in = getResourceStream(BACKEND_INDEX)) {
            if (in == null) {
                String msg = MsgUtils.getMsg("JOBS_BACKEND_RESOURCE_NOT_FOUND", BACKEND_INDEX);
                throw new BackendDefinitionException(msg);
            }
            var names = new ArrayList<String>();
            var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            for (var line : IOUtils.readLines(reader)) {
                String name = line.strip();
                if (StringUtils.isEmpty(name) || name.startsWith("#")) continue;
                names.add(name);
            }
            return names;
        }
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBS_BACKEND_LOAD_ERROR", BACKEND_INDEX, e.getMessage());
            throw new BackendDefinitionException(msg, e);
        }
    }
    
    private static InputStream getResourceStream(String resource)
    {
        return BackendRegistry.class.getClassLoader().getResourceAsStream(resource);
    }
}
