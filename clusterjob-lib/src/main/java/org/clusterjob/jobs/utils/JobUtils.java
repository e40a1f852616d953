package org.clusterjob.jobs.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.clusterjob.jobs.exceptions.TranslationException;

public final class JobUtils
{
    /* ********************************************************************** */
    /*                               Constants                                */
    /* ********************************************************************** */
    // Tracing.
    private static final Logger _log = LoggerFactory.getLogger(JobUtils.class);

    // Line splitter that tolerates carriage returns in remote output.
    private static final Pattern LINE_PATTERN = Pattern.compile("\r?\n");

    // Characters that never require quoting on a shell command line.
    private static final Pattern SAFE_SHELL_CHARS = Pattern.compile("[A-Za-z0-9_./:=@%+,-]+");

    // Characters allowed in cache file names.
    private static final Pattern UNSAFE_KEY_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    // Supported walltime formats, see timeToSeconds().
    private static final Pattern TIME_HMS      = Pattern.compile("(\\d+):(\\d+):(\\d+)");
    private static final Pattern TIME_DH       = Pattern.compile("(\\d+)-(\\d+)");
    private static final Pattern TIME_M        = Pattern.compile("(\\d+)");
    private static final Pattern TIME_MS       = Pattern.compile("(\\d+):(\\d+)");
    private static final Pattern TIME_DHM      = Pattern.compile("(\\d+)-(\\d+):(\\d+)");
    private static final Pattern TIME_DHMS     = Pattern.compile("(\\d+)-(\\d+):(\\d+):(\\d+)");

    // Suffix of temporary files written by writeAtomically().
    public static final String TEMP_SUFFIX = ".tmp";

    // Simple {name} tokens in command and directive templates.
    private static final Pattern TEMPLATE_TOKEN = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)\\}");

    /* **************************************************************************** */
    /*                                Constructors                                  */
    /* **************************************************************************** */
    private JobUtils() {}

    /* **************************************************************************** */
    /*                               Public Methods                                 */
    /* **************************************************************************** */
    /* ---------------------------------------------------------------------------- */
    /* timeToSeconds:                                                               */
    /* ---------------------------------------------------------------------------- */
    /** Convert a walltime string into seconds.  The accepted formats are the ones
     * understood by most batch schedulers:
     *
     *    minutes, minutes:seconds, hours:minutes:seconds, days-hours,
     *    days-hours:minutes, days-hours:minutes:seconds
     *
     * @param time the walltime string
     * @return the number of seconds
     * @throws TranslationException if the string does not match any format
     */
    public static long timeToSeconds(String time)
     throws TranslationException
    {
        String s = StringUtils.strip(time);
        if (StringUtils.isEmpty(s)) {
            String msg = MsgUtils.getMsg("JOBS_INVALID_TIME_FORMAT", time);
            throw new TranslationException(msg);
        }

        Matcher m;
        if ((m = TIME_HMS.matcher(s)).matches())
            return 3600L * toLong(m.group(1)) + 60L * toLong(m.group(2)) + toLong(m.group(3));
        if ((m = TIME_DH.matcher(s)).matches())
            return 86400L * toLong(m.group(1)) + 3600L * toLong(m.group(2));
        if ((m = TIME_M.matcher(s)).matches())
            return 60L * toLong(m.group(1));
        if ((m = TIME_MS.matcher(s)).matches())
            return 60L * toLong(m.group(1)) + toLong(m.group(2));
        if ((m = TIME_DHM.matcher(s)).matches())
            return 86400L * toLong(m.group(1)) + 3600L * toLong(m.group(2)) + 60L * toLong(m.group(3));
        if ((m = TIME_DHMS.matcher(s)).matches())
            return 86400L * toLong(m.group(1)) + 3600L * toLong(m.group(2))
                   + 60L * toLong(m.group(3)) + toLong(m.group(4));

        String msg = MsgUtils.getMsg("JOBS_INVALID_TIME_FORMAT", time);
        throw new TranslationException(msg);
    }

    /* ---------------------------------------------------------------------------- */
    /* findIdInOutput:                                                              */
    /* ---------------------------------------------------------------------------- */
    /** Extract the job id a scheduler reports from the output of its submission
     * command.  The id is usually on the last line of output, but to accommodate
     * installations that write banners or other information around the submit
     * output, we do a reverse search on the output lines.  The first line that
     * contains a match wins and group 1 of the pattern is the id.
     *
     * @param pattern the extraction pattern with at least one group
     * @param output the submit command's stdout
     * @return the id or null if no line matched
     */
    public static String findIdInOutput(Pattern pattern, String output)
    {
        if (StringUtils.isBlank(output)) return null;

        String[] lines = LINE_PATTERN.split(output.strip());
        for (int i = lines.length - 1; i >= 0; i--) {
            Matcher m = pattern.matcher(lines[i].strip());
            if (!m.find()) continue;
            if (m.groupCount() < 1) {
                _log.warn(MsgUtils.getMsg("JOBS_ID_PATTERN_NO_GROUP", pattern.pattern()));
                return null;
            }
            String id = m.group(1);
            if (StringUtils.isNotBlank(id)) return id.strip();
        }
        return null;
    }

    /* ---------------------------------------------------------------------------- */
    /* splitLines:                                                                  */
    /* ---------------------------------------------------------------------------- */
    /** Split output into lines without dropping interior blank lines. */
    public static String[] splitLines(String s)
    {
        if (s == null || s.isEmpty()) return new String[0];
        return LINE_PATTERN.split(s, -1);
    }

    /* ---------------------------------------------------------------------------- */
    /* getLastLine:                                                                 */
    /* ---------------------------------------------------------------------------- */
    /** Get the last non-blank line of a string or the empty string. */
    public static String getLastLine(String s)
    {
        if (StringUtils.isBlank(s)) return "";
        String[] lines = LINE_PATTERN.split(s.strip());
        return lines[lines.length - 1].strip();
    }

    /* ---------------------------------------------------------------------------- */
    /* conditionalQuote:                                                            */
    /* ---------------------------------------------------------------------------- */
    /** Single quote a shell word only when it contains characters that the shell
     * would interpret.  Embedded single quotes are escaped.
     *
     * @param s the word to quote
     * @return the word, possibly quoted
     */
    public static String conditionalQuote(String s)
    {
        if (s == null) return "''";
        if (SAFE_SHELL_CHARS.matcher(s).matches()) return s;
        return alwaysSingleQuote(s);
    }

    /* ---------------------------------------------------------------------------- */
    /* alwaysSingleQuote:                                                           */
    /* ---------------------------------------------------------------------------- */
    public static String alwaysSingleQuote(String s)
    {
        if (s == null) return "''";
        return "'" + s.replace("'", "'\\''") + "'";
    }

    /* ---------------------------------------------------------------------------- */
    /* sanitizeKey:                                                                 */
    /* ---------------------------------------------------------------------------- */
    /** Replace every character that is not safe in a file name with an underscore. */
    public static String sanitizeKey(String key)
    {
        if (key == null) return null;
        return UNSAFE_KEY_CHARS.matcher(key).replaceAll("_");
    }

    /* ---------------------------------------------------------------------------- */
    /* joinPath:                                                                    */
    /* ---------------------------------------------------------------------------- */
    /** Join POSIX path segments, skipping empty ones.  Remote paths are always
     * POSIX paths regardless of the local platform, so java.nio is not used.
     */
    public static String joinPath(String... segments)
    {
        var buf = new StringBuilder();
        for (var seg : segments) {
            if (StringUtils.isEmpty(seg)) continue;
            if (buf.length() == 0) buf.append(seg);
            else if (seg.startsWith("/")) {buf.setLength(0); buf.append(seg);}
            else {
                if (buf.charAt(buf.length() - 1) != '/') buf.append('/');
                buf.append(seg);
            }
        }
        return buf.toString();
    }

    /* ---------------------------------------------------------------------------- */
    /* fillTemplate:                                                                */
    /* ---------------------------------------------------------------------------- */
    /** Replace each {token} in the template whose name is a key in the values map.
     * Tokens without a value are left in place so that callers can detect them.
     *
     * @param template text containing {token} references
     * @param values token name to replacement text
     * @return the filled in template
     */
    public static String fillTemplate(String template, Map<String,String> values)
    {
        if (template == null) return null;
        Matcher m = TEMPLATE_TOKEN.matcher(template);
        var buf = new StringBuilder(template.length() + 32);
        while (m.find()) {
            String replacement = values.get(m.group(1));
            if (replacement == null) replacement = m.group();
            m.appendReplacement(buf, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(buf);
        return buf.toString();
    }

    /* ---------------------------------------------------------------------------- */
    /* secondsToHms:                                                                */
    /* ---------------------------------------------------------------------------- */
    /** Format seconds as HH:MM:SS, where hours can exceed 24. */
    public static String secondsToHms(long seconds)
    {
        return String.format("%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    /* ---------------------------------------------------------------------------- */
    /* writeAtomically:                                                             */
    /* ---------------------------------------------------------------------------- */
    /** Replace a file's content so that readers see either the old or the new
     * content, never a partial write.  The text goes to a temporary file in 
     * the target's directory, which is then renamed over the target.
     * 
     * @param file the target file, its directory is created if necessary
     * @param content the new content
     * @throws IOException if the file can't be written, in which case the
     *          target is left unchanged
     */
    public static void writeAtomically(Path file, String content) throws IOException
    {
        Path dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, file.getFileName().toString(), TEMP_SUFFIX);
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);}
            catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        finally {
            try {Files.deleteIfExists(temp);}
            catch (IOException e) {_log.warn(MsgUtils.getMsg("JOBS_FILE_DELETE_ERROR", temp, e.getMessage()));}
        }
    }

    /* **************************************************************************** */
    /*                               Private Methods                                */
    /* **************************************************************************** */
    private static long toLong(String s) {return Long.parseLong(s);}
}
