package org.clusterjob.jobs.cache;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.clusterjob.jobs.exceptions.CacheCorruptionException;
import org.clusterjob.jobs.exceptions.JobException;
import org.clusterjob.jobs.model.CacheEntry;
import org.clusterjob.jobs.utils.JobUtils;
import org.clusterjob.jobs.utils.MsgUtils;

/** Cache store that keeps one JSON file per key in a directory:
 * 
 *  cacheDir/prefix.key.cache   the entry
 *  cacheDir/prefix.key.claim   present while a submission is in progress
 * 
 * Entries are written to a temporary file in the same directory and then 
 * renamed over the old entry.  Claims are created with CREATE_NEW so that
 * exactly one process succeeds.  A claim older than the claim timeout is
 * assumed to belong to a process that died and is taken over.
 */
public final class FileCacheStore 
 implements CacheStore
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(FileCacheStore.class);
    
    public static final String CACHE_SUFFIX = ".cache";
    public static final String CLAIM_SUFFIX = ".claim";
    public static final String LOCK_SUFFIX  = ".lock";
    
    // Serializes claim takeovers among the stores of this JVM.
    private static final Object TAKEOVER_MUTEX = new Object();
    
    /* ********************************************************************** */
    /*                                 Fields                                 */
    /* ********************************************************************** */
    private final Path     _dir;
    private final String   _prefix;
    private final Duration _claimTimeout;
    
    /* ********************************************************************** */
    /*                              Constructors                              */
    /* ********************************************************************** */
    public FileCacheStore(Path dir, String prefix, Duration claimTimeout)
    {
        _dir = dir;
        _prefix = prefix;
        _claimTimeout = claimTimeout;
    }
    
    /* ********************************************************************** */
    /*                             Public Methods                             */
    /* ********************************************************************** */
    /* ---------------------------------------------------------------------- */
    /* read:                                                                  */
    /* ---------------------------------------------------------------------- */
    @Override
    public CacheEntry read(String key) throws CacheCorruptionException
    {
        Path file = getEntryPath(key);
        String json;
        try {json = Files.readString(file, StandardCharsets.UTF_8);}
        catch (NoSuchFileException e) {return null;}
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBS_CACHE_CORRUPT", file, e.getMessage());
            throw new CacheCorruptionException(msg, file.toString(), e);
        }
        return CacheEntryCodec.fromJson(json, file.toString());
    }
    
    /* ---------------------------------------------------------------------- */
    /* write:                                                                 */
    /* ---------------------------------------------------------------------- */
    @Override
    public void write(CacheEntry entry) throws JobException
    {
        Path file = getEntryPath(entry.getCacheKey());
        try {JobUtils.writeAtomically(file, CacheEntryCodec.toJson(entry));}
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBS_CACHE_WRITE_ERROR", file, e.getMessage());
            throw new JobException(msg, e);
        }
        if (_log.isDebugEnabled()) 
            _log.debug(MsgUtils.getMsg("JOBS_CACHE_WRITTEN", file, entry.getStatus()));
    }
    
    /* ---------------------------------------------------------------------- */
    /* remove:                                                                */
    /* ---------------------------------------------------------------------- */
    @Override
    public void remove(String key) throws JobException
    {
        Path file = getEntryPath(key);
        try {Files.deleteIfExists(file);}
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBS_CACHE_WRITE_ERROR", file, e.getMessage());
            throw new JobException(msg, e);
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* claim:                                                                 */
    /* ---------------------------------------------------------------------- */
    @Override
    public boolean claim(String key, boolean force) throws JobException
    {
        Path claim = getClaimPath(key);
        try {
            Files.createDirectories(_dir);
            if (tryCreateClaim(claim)) return true;
            
            // Someone else holds the claim, possibly a process that died.
            if (!force && !isStale(claim)) return false;
            return takeOver(key, claim, force);
        }
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBS_CACHE_WRITE_ERROR", claim, e.getMessage());
            throw new JobException(msg, e);
        }
    }
    
    /* ---------------------------------------------------------------------- */
    /* release:                                                               */
    /* ---------------------------------------------------------------------- */
    @Override
    public void release(String key) {deleteQuietly(getClaimPath(key));}
    
    /* ---------------------------------------------------------------------- */
    /* clear:                                                                 */
    /* ---------------------------------------------------------------------- */
    @Override
    public void clear() throws JobException
    {
        if (!Files.isDirectory(_dir)) return;
        String glob = _prefix + ".*{" + CACHE_SUFFIX + "," + CLAIM_SUFFIX + "," + LOCK_SUFFIX + "}";
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(_dir, glob)) {
            for (var file : stream) Files.deleteIfExists(file);
        }
        catch (IOException e) {
            String msg = MsgUtils.getMsg("JOBS_CACHE_WRITE_ERROR", _dir, e.getMessage());
            throw new JobException(msg, e);
        }
        _log.info(MsgUtils.getMsg("JOBS_CACHE_CLEARED", _dir, _prefix));
    }
    
    @Override
    public boolean isEnabled() {return true;}
    
    /** The file holding the entry for a key. */
    public Path getEntryPath(String key) {return _dir.resolve(fileBase(key) + CACHE_SUFFIX);}
    
    /** The claim file for a key. */
    public Path getClaimPath(String key) {return _dir.resolve(fileBase(key) + CLAIM_SUFFIX);}
    
    /* ********************************************************************** */
    /*                            Private Methods                             */
    /* ********************************************************************** */
    private String fileBase(String key) {return _prefix + "." + JobUtils.sanitizeKey(key);}
    
    /* ---------------------------------------------------------------------- */
    /* tryCreateClaim:                                                        */
    /* ---------------------------------------------------------------------- */
    private static boolean tryCreateClaim(Path claim) throws IOException
    {
        String owner = ProcessHandle.current().pid() + " " + Instant.now() + "\n";
        try {
            Files.writeString(claim, owner, StandardCharsets.UTF_8, 
                              StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        }
        catch (FileAlreadyExistsException e) {return false;}
    }
    
    /* ---------------------------------------------------------------------- */
    /* takeOver:                                                              */
    /* ---------------------------------------------------------------------- */
    /** Replace a stale (or, when forced, any) claim with our own.  Takeovers 
     * of a key are serialized by a lock on the key's lock file, and within
     * this JVM by a mutex since file locks are held per process.  The old
     * claim is renamed away before it is deleted so that a claim created by
     * someone else after our check is never removed.
     */
    private boolean takeOver(String key, Path claim, boolean force) throws IOException
    {
        Path lockFile = _dir.resolve(fileBase(key) + LOCK_SUFFIX);
        synchronized (TAKEOVER_MUTEX) {
            try (var channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 var lock = channel.lock()) 
            {
                // Look again now that no one else can take over.
                String owner = readOwner(claim);
                if (owner == null) return tryCreateClaim(claim);
                if (!force && !isStale(claim)) return false;
                
                Path tombstone = _dir.resolve(claim.getFileName() + "." + UUID.randomUUID() + JobUtils.TEMP_SUFFIX);
                try {Files.move(claim, tombstone, StandardCopyOption.ATOMIC_MOVE);}
                catch (NoSuchFileException e) {return tryCreateClaim(claim);}
                
                // A claim created after we looked goes back to its owner.
                if (!owner.equals(readOwner(tombstone))) {
                    try {Files.move(tombstone, claim);}
                    catch (FileAlreadyExistsException e) {deleteQuietly(tombstone);}
                    return false;
                }
                deleteQuietly(tombstone);
                _log.warn(MsgUtils.getMsg("JOBS_CACHE_CLAIM_TAKEOVER", claim, force));
                return tryCreateClaim(claim);
            }
        }
    }
    
    /** The owner line of a claim file, null if there is none. */
    private static String readOwner(Path claim) throws IOException
    {
        try {return Files.readString(claim, StandardCharsets.UTF_8);}
        catch (NoSuchFileException e) {return null;}
    }
    
    /* ---------------------------------------------------------------------- */
    /* isStale:                                                               */
    /* ---------------------------------------------------------------------- */
    private boolean isStale(Path claim) throws IOException
    {
        try {
            Instant modified = Files.getLastModifiedTime(claim).toInstant();
            return modified.plus(_claimTimeout).isBefore(Instant.now());
        }
        catch (NoSuchFileException e) {return true;}
    }
    
    private static void deleteQuietly(Path path)
    {
        if (path == null) return;
        try {Files.deleteIfExists(path);}
        catch (IOException e) {_log.warn(MsgUtils.getMsg("JOBS_FILE_DELETE_ERROR", path, e.getMessage()));}
    }
}
