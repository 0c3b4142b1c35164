package com.proofaudit.pdg.resolve;

import com.proofaudit.pdg.model.ScannedDeclaration;
import com.proofaudit.pdg.scan.VernacularKeywords;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolver for the heuristic front-end.
 *
 * Every identifier-shaped token of the declaration text, and every
 * dot-separated component of a dotted token, that names a symbol in the table
 * is a dependency. Over-approximates: a local binder or tactic name that
 * happens to match a project symbol becomes an edge.
 */
public final class TextualResolver implements ReferenceResolver {
    private static final Pattern STRING_LITERAL = Pattern.compile("\"[^\"]*\"");
    private static final Pattern TOKEN = Pattern.compile(
            VernacularKeywords.IDENT + "(?:\\." + VernacularKeywords.IDENT + ")*");

    private final SymbolTable table;
    private final boolean proofBodyReferences;

    /**
     * @param proofBodyReferences also scan proof-internal text; without it a
     *                            lemma used only inside a proof is not seen
     */
    public TextualResolver(SymbolTable table, boolean proofBodyReferences) {
        this.table = table;
        this.proofBodyReferences = proofBodyReferences;
    }

    @Override
    public Resolution resolve(ScannedDeclaration decl) {
        String text = decl.statement();
        if (proofBodyReferences && !decl.proofText().isEmpty())
            text = text + " " + decl.proofText();
        text = STRING_LITERAL.matcher(text).replaceAll(" ");

        Set<String> deps = new LinkedHashSet<>();
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            String token = m.group();
            match(decl, token, deps);
            if (token.indexOf('.') >= 0) {
                for (String part : token.split("\\."))
                    match(decl, part, deps);
            }
        }
        return new Resolution(deps, Set.of());
    }

    private void match(ScannedDeclaration decl, String token, Set<String> deps) {
        if (token.equals(decl.name()))
            return;
        String target = table.resolve(token);
        if (target != null && !target.equals(decl.qualifiedName()))
            deps.add(target);
    }
}
