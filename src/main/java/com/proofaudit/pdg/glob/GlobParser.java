package com.proofaudit.pdg.glob;

import com.proofaudit.pdg.model.ByteRange;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the text of a {@code .glob} file.
 *
 * Line formats:
 * <pre>
 *   DIGEST &lt;hex&gt;
 *   F&lt;logical path&gt;
 *   &lt;kind&gt; &lt;start&gt;:&lt;end&gt; &lt;secpath&gt; &lt;name&gt;
 *   R&lt;start&gt;:&lt;end&gt; &lt;module&gt; &lt;secpath&gt; &lt;name&gt; &lt;kind&gt;
 * </pre>
 *
 * Every reference belongs to the closest preceding definition record that is
 * not a binder. Binder records name local variables of the declaration being
 * read; they are dropped and do not start a new scope, so references after a
 * binder stay with the enclosing declaration instead of being lost with a
 * local name. References to notation artefacts (names
 * starting with {@code ::} or {@code '}) are dropped.
 */
public final class GlobParser {
    private GlobParser() {
        // Utility class
    }

    private static final String EMPTY = "<>";
    private static final Pattern DEFINITION = Pattern.compile("^(\\w+)\\s+(\\d+):(\\d+)\\s+(\\S+)\\s+(.+)$");
    private static final Pattern REFERENCE = Pattern.compile(
            "^R(\\d+):(\\d+)\\s+(\\S+)\\s+(\\S+)\\s+(.+)\\s+(\\w+)$");
    private static final Pattern BINDER_SUFFIX = Pattern.compile("^(.+):(\\d+)$");

    /**
     * @throws IllegalArgumentException on the first line that matches no known
     *                                  record format
     */
    public static GlobFile parse(String text) {
        String logicalPath = "";
        List<GlobReference> preamble = new ArrayList<>();
        List<GlobFile.Scope> scopes = new ArrayList<>();
        GlobDefinition current = null;
        List<GlobReference> refs = preamble;

        String[] lines = text.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("DIGEST"))
                continue;
            try {
                if (line.startsWith("F")) {
                    logicalPath = line.substring(1).strip();
                } else if (line.startsWith("R") && line.length() > 1 && Character.isDigit(line.charAt(1))) {
                    GlobReference ref = parseReference(line);
                    if (ref != null)
                        refs.add(ref);
                } else {
                    GlobDefinition def = parseDefinition(line);
                    if (def == null)
                        continue;
                    if (current != null)
                        scopes.add(new GlobFile.Scope(current, refs));
                    current = def;
                    refs = new ArrayList<>();
                }
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Malformed metadata at line " + (i + 1) + ": " + e.getMessage(),
                        e);
            }
        }
        if (current != null)
            scopes.add(new GlobFile.Scope(current, refs));
        return new GlobFile(logicalPath, preamble, scopes);
    }

    /** Returns null for binder records. */
    private static GlobDefinition parseDefinition(String line) {
        Matcher m = DEFINITION.matcher(line);
        if (!m.matches())
            throw new IllegalArgumentException("unrecognized record '" + line + "'");
        String kind = m.group(1);
        if ("binder".equals(kind))
            return null;
        ByteRange range = new ByteRange(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        return new GlobDefinition(kind, range, section(m.group(4)), cleanName(m.group(5).strip()));
    }

    /** Returns null for references to notation artefacts. */
    private static GlobReference parseReference(String line) {
        Matcher m = REFERENCE.matcher(line);
        if (!m.matches())
            throw new IllegalArgumentException("unrecognized reference '" + line + "'");
        String rawName = m.group(5).strip();
        if (rawName.startsWith("::") || rawName.startsWith("'"))
            return null;
        ByteRange range = new ByteRange(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        String name = EMPTY.equals(rawName) ? null : cleanName(rawName);
        return new GlobReference(range, m.group(3), section(m.group(4)), name, m.group(6));
    }

    /** Strips a binder suffix such as {@code :2}. */
    static String cleanName(String raw) {
        Matcher m = BINDER_SUFFIX.matcher(raw);
        return m.matches() ? m.group(1) : raw;
    }

    private static String section(String raw) {
        return EMPTY.equals(raw) ? null : raw;
    }
}
