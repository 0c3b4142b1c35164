package com.proofaudit.pdg.scan;

import com.proofaudit.pdg.model.ScannedDeclaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable state of the heuristic scan of one file.
 *
 * The scanner folds sentences over this value; every transition returns a new
 * state and leaves the old one untouched. Each file starts from its own
 * {@link #initial(String)} state, so concurrent scans share nothing.
 *
 * @param modulePrefix   logical module path prefixed to every qualified name,
 *                       or null
 * @param scopes         open Module/Section names, outermost first
 * @param declarations   finalized declarations in source order
 * @param imports        modules named by import statements
 * @param pending        declaration waiting for its proof terminator, or null
 * @param detachedProof  inside a proof block that belongs to no tracked
 *                       declaration (e.g. a {@code Next Obligation})
 */
public record ScannerState(
        String modulePrefix,
        List<String> scopes,
        List<ScannedDeclaration> declarations,
        List<String> imports,
        Pending pending,
        boolean detachedProof) {

    public static ScannerState initial(String modulePrefix) {
        return new ScannerState(modulePrefix, List.of(), List.of(), List.of(), null, false);
    }

    /** Qualifies a bare name with the module prefix and the open scopes. */
    public String qualify(String name) {
        StringBuilder sb = new StringBuilder();
        if (modulePrefix != null && !modulePrefix.isEmpty())
            sb.append(modulePrefix).append('.');
        for (String s : scopes)
            sb.append(s).append('.');
        return sb.append(name).toString();
    }

    public ScannerState openScope(String name) {
        return new ScannerState(modulePrefix, append(scopes, name), declarations, imports, pending, detachedProof);
    }

    /**
     * Closes the named scope. If it is not the innermost one, the scopes opened
     * inside it are closed with it. Returns this same instance when no open
     * scope has that name.
     */
    public ScannerState closeScope(String name) {
        int idx = scopes.lastIndexOf(name);
        if (idx < 0)
            return this;
        return new ScannerState(modulePrefix, List.copyOf(scopes.subList(0, idx)), declarations, imports, pending,
                detachedProof);
    }

    public ScannerState addImports(List<String> modules) {
        List<String> next = new ArrayList<>(imports);
        next.addAll(modules);
        return new ScannerState(modulePrefix, scopes, declarations, Collections.unmodifiableList(next), pending,
                detachedProof);
    }

    /** Records a declaration whose status is already final. */
    public ScannerState declare(ScannedDeclaration decl) {
        return new ScannerState(modulePrefix, scopes, append(declarations, decl), imports, null, false);
    }

    /**
     * Holds a declaration until a terminator decides its status.
     *
     * @param proofFrom index of the first sentence after the statement
     */
    public ScannerState awaitProof(ScannedDeclaration decl, int proofFrom) {
        return new ScannerState(modulePrefix, scopes, declarations, imports, new Pending(decl, proofFrom), false);
    }

    /**
     * Takes the last finalized declaration back to pending, for a statement
     * that looked inline but is followed by a proof.
     */
    public ScannerState reopenLast(int proofFrom) {
        ScannedDeclaration last = declarations.get(declarations.size() - 1);
        List<ScannedDeclaration> rest = declarations.subList(0, declarations.size() - 1);
        return new ScannerState(modulePrefix, scopes, List.copyOf(rest), imports, new Pending(last, proofFrom), false);
    }

    public ScannerState beginDetachedProof() {
        return new ScannerState(modulePrefix, scopes, declarations, imports, pending, true);
    }

    public ScannerState endDetachedProof() {
        return new ScannerState(modulePrefix, scopes, declarations, imports, pending, false);
    }

    private static <T> List<T> append(List<T> list, T item) {
        List<T> next = new ArrayList<>(list.size() + 1);
        next.addAll(list);
        next.add(item);
        return Collections.unmodifiableList(next);
    }

    /** A declaration whose proof is open. */
    public record Pending(ScannedDeclaration declaration, int proofFrom) {
    }
}
