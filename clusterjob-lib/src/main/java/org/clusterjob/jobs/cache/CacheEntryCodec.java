package org.clusterjob.jobs.cache;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.clusterjob.jobs.exceptions.CacheCorruptionException;
import org.clusterjob.jobs.model.CacheEntry;
import org.clusterjob.jobs.utils.JobsGsonUtils;
import org.clusterjob.jobs.utils.MsgUtils;

/** Converts cache entries to and from their versioned JSON form.  Older 
 * formats are migrated to the current one when read.  Records written by a
 * newer version of this library, and records that aren't valid entries, are
 * reported as corrupt.
 */
public final class CacheEntryCodec 
{
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(CacheEntryCodec.class);
    
    private static final String SCHEMA_VERSION = "schemaVersion";
    
    private CacheEntryCodec() {}
    
    /* ---------------------------------------------------------------------- */
    /* toJson:                                                                */
    /* ---------------------------------------------------------------------- */
    public static String toJson(CacheEntry entry)
    {
        entry.setSchemaVersion(CacheEntry.CURRENT_SCHEMA_VERSION);
        return JobsGsonUtils.getGson(true).toJson(entry);
    }
    
    /* ---------------------------------------------------------------------- */
    /* fromJson:                                                              */
    /* ---------------------------------------------------------------------- */
    /** Parse and, if necessary, migrate an entry.
     * 
     * @param json the record text
     * @param location where the record came from, for error messages
     * @return the entry in the current format
     * @throws CacheCorruptionException if the record can't be used
     */
    public static CacheEntry fromJson(String json, String location)
     throws CacheCorruptionException
    {
        // Get the generic tree so we can look at the version first.
        JsonObject obj;
        try {
            JsonElement root = JsonParser.parseString(json);
            if (!root.isJsonObject()) {
                String msg = MsgUtils.getMsg("JOBS_CACHE_CORRUPT", location, "not a JSON object");
                throw new CacheCorruptionException(msg, location);
            }
            obj = root.getAsJsonObject();
        }
        catch (JsonParseException e) {
            String msg = MsgUtils.getMsg("JOBS_CACHE_CORRUPT", location, e.getMessage());
            throw new CacheCorruptionException(msg, location, e);
        }
        
        // Bring older records up to date.
        int version;
        try {version = obj.has(SCHEMA_VERSION) ? obj.get(SCHEMA_VERSION).getAsInt() : 0;}
        catch (RuntimeException e) {
            String msg = MsgUtils.getMsg("JOBS_CACHE_CORRUPT", location, SCHEMA_VERSION);
            throw new CacheCorruptionException(msg, location, e);
        }
        if (version > CacheEntry.CURRENT_SCHEMA_VERSION) {
            String msg = MsgUtils.getMsg("JOBS_CACHE_VERSION_UNSUPPORTED", location, version, 
                                         CacheEntry.CURRENT_SCHEMA_VERSION);
            throw new CacheCorruptionException(msg, location);
        }
        if (version < 1) migrateFromV0(obj, location);
        
        // Bind to the entry class.
        CacheEntry entry;
        try {entry = JobsGsonUtils.getGson().fromJson(obj, CacheEntry.class);}
        catch (JsonParseException e) {
            String msg = MsgUtils.getMsg("JOBS_CACHE_CORRUPT", location, e.getMessage());
            throw new CacheCorruptionException(msg, location, e);
        }
        
        // Gson leaves unknown enum constants null.
        if (entry == null || StringUtils.isBlank(entry.getJobId()) || StringUtils.isBlank(entry.getBackend())
            || entry.getStatus() == null) {
            String msg = MsgUtils.getMsg("JOBS_CACHE_CORRUPT", location, "missing jobId, backend or status");
            throw new CacheCorruptionException(msg, location);
        }
        return entry;
    }
    
    /* ---------------------------------------------------------------------- */
    /* migrateFromV0:                                                         */
    /* ---------------------------------------------------------------------- */
    /** Unversioned records named the poll interval "sleep" and had no 
     * epilogue tracking.
     */
    private static void migrateFromV0(JsonObject obj, String location)
    {
        if (obj.has("sleep") && !obj.has("sleepIntervalSeconds")) 
            obj.add("sleepIntervalSeconds", obj.remove("sleep"));
        obj.addProperty(SCHEMA_VERSION, CacheEntry.CURRENT_SCHEMA_VERSION);
        _log.info(MsgUtils.getMsg("JOBS_CACHE_MIGRATED", location, 0, CacheEntry.CURRENT_SCHEMA_VERSION));
    }
}
