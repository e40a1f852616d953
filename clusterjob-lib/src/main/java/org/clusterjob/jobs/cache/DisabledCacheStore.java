package org.clusterjob.jobs.cache;

import org.clusterjob.jobs.model.CacheEntry;

/** The store used when caching is turned off: nothing is remembered and
 * every claim succeeds.
 */
public final class DisabledCacheStore 
 implements CacheStore
{
    @Override
    public CacheEntry read(String key) {return null;}
    
    @Override
    public void write(CacheEntry entry) {}
    
    @Override
    public void remove(String key) {}
    
    @Override
    public boolean claim(String key, boolean force) {return true;}
    
    @Override
    public void release(String key) {}
    
    @Override
    public void clear() {}
    
    @Override
    public boolean isEnabled() {return false;}
}
