package com.proofaudit.pdg.scan;

import com.proofaudit.pdg.model.SymbolKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Vernacular keyword tables and the patterns built from them.
 *
 * Shared by both front-ends: the heuristic scanner classifies sentences with
 * {@link #matchDeclaration(String)}, the metadata scanner uses
 * {@link #STATEMENT_KEYWORDS} to find where a statement begins and
 * {@link #startsTopLevelCommand(String)} to notice that a proof never came.
 */
public final class VernacularKeywords {
    private VernacularKeywords() {
        // Utility class
    }

    /** Identifier: letter or underscore, then letters, digits, underscores, primes. */
    public static final String IDENT = "[\\p{L}_][\\p{L}\\p{N}_']*";

    private static final Map<String, SymbolKind> GROUPS = new LinkedHashMap<>();

    static {
        for (String k : List.of("Lemma", "Theorem", "Corollary", "Proposition", "Fact", "Remark", "Example",
                "Property"))
            GROUPS.put(k, SymbolKind.PROVABLE);
        for (String k : List.of("Definition", "Fixpoint", "CoFixpoint", "Let", "Function", "Program Definition",
                "Program Fixpoint"))
            GROUPS.put(k, SymbolKind.DEFINITIONAL);
        for (String k : List.of("Inductive", "CoInductive", "Record", "Structure", "Class", "Variant"))
            GROUPS.put(k, SymbolKind.TYPE_FORMER);
        for (String k : List.of("Axiom", "Parameter", "Hypothesis", "Variable", "Conjecture", "Context",
                "Declare Assumption"))
            GROUPS.put(k, SymbolKind.ASSUMPTION);
        for (String k : List.of("Instance", "Global Instance", "Local Instance", "Program Instance"))
            GROUPS.put(k, SymbolKind.INSTANCE);
    }

    /**
     * Keywords that may open a statement, searched backwards from a name
     * reported by compiler metadata.
     */
    public static final List<String> STATEMENT_KEYWORDS = List.of(
            "Theorem", "Lemma", "Corollary", "Proposition", "Fact", "Remark", "Example", "Property",
            "Definition", "Fixpoint", "CoFixpoint", "Let", "Function",
            "Inductive", "CoInductive", "Record", "Structure", "Class", "Variant",
            "Axiom", "Parameter", "Hypothesis", "Variable", "Conjecture", "Context",
            "Instance", "Global Instance", "Local Instance",
            "Program Definition", "Program Fixpoint", "Program Lemma");

    private static final Pattern DECLARATION = Pattern.compile(
            "^(?:#\\[[^\\]]*\\]\\s*)?(" + alternation(GROUPS.keySet()) + ")\\s+(" + IDENT + ")([\\s\\S]*)$");

    private static final Pattern TOP_LEVEL_COMMAND = Pattern.compile(
            "^(?:Theorem|Lemma|Corollary|Definition|Fixpoint|Inductive|CoInductive|Record|Structure|Class|"
                    + "Axiom|Parameter|Hypothesis|Variable|Instance|Module|Section|End|From|Require|Import|"
                    + "Export|Notation|Ltac|Set|Unset)\\b");

    static final Pattern SCOPE_OPEN = Pattern.compile(
            "^(?:Module|Section)(?:\\s+(?:Type|Import|Export)\\b)?\\s+(" + IDENT + ")([\\s\\S]*)$");

    static final Pattern SCOPE_CLOSE = Pattern.compile("^End\\s+(" + IDENT + ")");

    static final Pattern REQUIRE = Pattern.compile(
            "^(?:From\\s+\\S+\\s+)?Require(?:\\s+(?:Import|Export))?\\s+([\\s\\S]*)$");

    static final Pattern IMPORT = Pattern.compile("^(?:Import|Export)\\s+([\\s\\S]*)$");

    static final Pattern PROOF_START = Pattern.compile("^(?:Proof\\b|Next\\s+Obligation\\b)");

    /** A bare proof opener, with no proof term of its own. */
    static final Pattern PROOF_OPENER = Pattern.compile("^Proof(?:\\s+(?:using|with)\\b[\\s\\S]*)?$");

    /**
     * Classifies a sentence as a declaration.
     *
     * @param sentence the full sentence, trailing period included
     * @return the match, or null if the sentence does not declare a named symbol
     */
    public static Declaration matchDeclaration(String sentence) {
        Matcher m = DECLARATION.matcher(sentence);
        if (!m.matches())
            return null;
        String keyword = m.group(1).replaceAll("\\s+", " ");
        return new Declaration(keyword, GROUPS.get(keyword), m.group(2), m.group(3));
    }

    public static boolean startsTopLevelCommand(String sentenceBody) {
        return TOP_LEVEL_COMMAND.matcher(sentenceBody).find();
    }

    /** Longest first, so "Global Instance" wins over "Instance". */
    private static String alternation(Iterable<String> keywords) {
        List<String> sorted = new ArrayList<>();
        keywords.forEach(sorted::add);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return sorted.stream()
                .map(k -> Pattern.quote(k).replace(" ", "\\E\\s+\\Q"))
                .collect(Collectors.joining("|"));
    }

    /**
     * A recognized declaration sentence.
     *
     * @param keyword the keyword as written, e.g. "Global Instance"
     * @param kind    its kind group
     * @param name    the declared bare name
     * @param rest    everything after the name, trailing period included
     */
    public record Declaration(String keyword, SymbolKind kind, String name, String rest) {

        /**
         * Any {@code :=} counts, including one inside a {@code let} of the
         * statement; the scanner re-opens such a declaration when a
         * {@code Proof} follows it.
         */
        public boolean hasInlineBody() {
            return rest.contains(":=");
        }

        /** Declaration text without the proof: keyword, name and the rest. */
        public String statement() {
            String tail = rest.trim();
            return tail.isEmpty() ? keyword + " " + name : keyword + " " + name + " " + tail;
        }
    }
}
