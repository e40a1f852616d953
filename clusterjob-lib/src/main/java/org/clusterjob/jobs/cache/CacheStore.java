package org.clusterjob.jobs.cache;

import org.clusterjob.jobs.exceptions.CacheCorruptionException;
import org.clusterjob.jobs.exceptions.JobException;
import org.clusterjob.jobs.model.CacheEntry;

/** Persistent map from cache key to the state of a submitted job.
 * 
 * Writers never expose partially written entries: an entry is either absent,
 * the previous version or the new version.  Claims give one process at a time
 * the right to submit under a key, so that two processes racing on the same
 * key cannot both submit.
 */
public interface CacheStore
{
    /** Read an entry.
     * 
     * @return the entry or null if there is none
     * @throws CacheCorruptionException if the entry exists but can't be read
     */
    CacheEntry read(String key) throws CacheCorruptionException;
    
    /** Atomically create or replace the entry under its cache key. */
    void write(CacheEntry entry) throws JobException;
    
    /** Remove an entry if it exists. */
    void remove(String key) throws JobException;
    
    /** Try to claim a key for submission.
     * 
     * @param key the cache key
     * @param force take over a claim held by someone else
     * @return true if the caller now holds the claim
     */
    boolean claim(String key, boolean force) throws JobException;
    
    /** Release a claim held by the caller.  Never fails. */
    void release(String key);
    
    /** Remove all entries and claims. */
    void clear() throws JobException;
    
    /** False if this store doesn't persist anything. */
    boolean isEnabled();
}
