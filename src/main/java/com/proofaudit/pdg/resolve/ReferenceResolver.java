package com.proofaudit.pdg.resolve;

import com.proofaudit.pdg.model.ScannedDeclaration;

/** Turns the references of one scanned declaration into dependencies. */
public interface ReferenceResolver {

    /**
     * @param decl a declaration registered in the resolver's table
     * @return its dependencies; never contains {@code decl} itself
     */
    Resolution resolve(ScannedDeclaration decl);
}
