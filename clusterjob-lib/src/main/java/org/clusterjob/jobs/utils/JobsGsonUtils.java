package org.clusterjob.jobs.utils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/** Shared Gson instances for backend descriptors and persisted job state. */
public final class JobsGsonUtils 
{
    // Gson instances are thread-safe.
    private static final Gson _gson = new GsonBuilder().disableHtmlEscaping().create();
    private static final Gson _prettyGson = 
        new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();
    
    private JobsGsonUtils() {}
    
    /** A compact Gson instance. */
    public static Gson getGson() {return _gson;}
    
    /** A Gson instance that pretty prints, used for files people may read. */
    public static Gson getGson(boolean prettyPrint) {return prettyPrint ? _prettyGson : _gson;}
}
