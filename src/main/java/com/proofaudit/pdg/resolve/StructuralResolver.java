package com.proofaudit.pdg.resolve;

import com.proofaudit.pdg.model.RawReference;
import com.proofaudit.pdg.model.ScannedDeclaration;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Resolver for the metadata front-end.
 *
 * A reference resolves, in order, to:
 * <ol>
 * <li>the symbol with exactly its qualified name;</li>
 * <li>the owner of its short name;</li>
 * <li>itself, kept as an unresolved dependency, if it lies in a project
 * module;</li>
 * <li>otherwise an external reference.</li>
 * </ol>
 */
public final class StructuralResolver implements ReferenceResolver {
    private final SymbolTable table;

    public StructuralResolver(SymbolTable table) {
        this.table = table;
    }

    @Override
    public Resolution resolve(ScannedDeclaration decl) {
        Set<String> deps = new LinkedHashSet<>();
        Set<String> externals = new LinkedHashSet<>();
        String self = decl.qualifiedName();

        for (RawReference ref : decl.references()) {
            String qualified = ref.qualifiedName();
            if (table.contains(qualified)) {
                addUnlessSelf(deps, qualified, self);
                continue;
            }
            String target = table.byShortName(shortName(qualified));
            if (target != null) {
                addUnlessSelf(deps, target, self);
            } else if (table.isProjectName(qualified, ref.modulePath())) {
                addUnlessSelf(deps, qualified, self);
            } else {
                externals.add(qualified);
            }
        }
        return new Resolution(deps, externals);
    }

    private static void addUnlessSelf(Set<String> deps, String target, String self) {
        if (!target.equals(self))
            deps.add(target);
    }

    private static String shortName(String qualified) {
        int dot = qualified.lastIndexOf('.');
        return dot < 0 ? qualified : qualified.substring(dot + 1);
    }
}
