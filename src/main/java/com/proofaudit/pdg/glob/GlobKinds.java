package com.proofaudit.pdg.glob;

import com.proofaudit.pdg.model.SymbolKind;

import java.util.Map;
import java.util.Set;

/**
 * Kind codes used in {@code .glob} metadata and what the analyzer makes of
 * them.
 */
public final class GlobKinds {
    private GlobKinds() {
        // Utility class
    }

    /** Definition codes that become symbols. Everything else is skipped. */
    public static final Set<String> TRACKED = Set.of(
            "thm", "lem", "def", "ax", "ind", "constr", "rec", "corec", "inst", "class", "proj", "meth",
            "prop", "ex", "morph", "scheme", "syndef", "prf");

    /** Codes whose status is decided by a proof terminator in the source. */
    public static final Set<String> PROVABLE = Set.of("thm", "lem", "prf", "prop", "ex", "morph");

    public static final Set<String> ASSUMED = Set.of("ax");

    /** Reference codes that never become dependency edges. */
    public static final Set<String> IGNORED_REFERENCES = Set.of("not", "var", "binder", "lib");

    private static final Map<String, String> DISPLAY = Map.ofEntries(
            Map.entry("thm", "theorem"),
            Map.entry("lem", "lemma"),
            Map.entry("def", "definition"),
            Map.entry("ax", "axiom"),
            Map.entry("ind", "inductive"),
            Map.entry("constr", "constructor"),
            Map.entry("rec", "fixpoint"),
            Map.entry("corec", "cofixpoint"),
            Map.entry("not", "notation"),
            Map.entry("sec", "section"),
            Map.entry("var", "variable"),
            Map.entry("inst", "instance"),
            Map.entry("class", "class"),
            Map.entry("proj", "projection"),
            Map.entry("meth", "method"),
            Map.entry("modtype", "module type"),
            Map.entry("mod", "module"),
            Map.entry("syndef", "abbreviation"),
            Map.entry("scheme", "scheme"),
            Map.entry("prf", "proof"),
            Map.entry("binder", "binder"),
            Map.entry("lib", "library"),
            Map.entry("prop", "proposition"),
            Map.entry("coe", "coercion"),
            Map.entry("ex", "example"),
            Map.entry("morph", "morphism"));

    public static boolean isTracked(String code) {
        return TRACKED.contains(code);
    }

    /** Human readable keyword for a code; unknown codes are shown as-is. */
    public static String display(String code) {
        return DISPLAY.getOrDefault(code, code);
    }

    public static SymbolKind symbolKind(String code) {
        return switch (code) {
            case "thm", "lem", "prop", "ex", "morph" -> SymbolKind.PROVABLE;
            case "prf" -> SymbolKind.PROOF_STEP;
            case "def", "rec", "corec", "scheme", "syndef" -> SymbolKind.DEFINITIONAL;
            case "ind", "class" -> SymbolKind.TYPE_FORMER;
            case "ax" -> SymbolKind.ASSUMPTION;
            case "inst" -> SymbolKind.INSTANCE;
            case "constr" -> SymbolKind.CONSTRUCTOR;
            case "proj", "meth" -> SymbolKind.PROJECTION;
            default -> throw new IllegalArgumentException("Untracked kind code: " + code);
        };
    }
}
