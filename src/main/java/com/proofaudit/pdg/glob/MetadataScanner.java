package com.proofaudit.pdg.glob;

import com.proofaudit.pdg.api.FrontEndScanner;
import com.proofaudit.pdg.lex.CommentStripper;
import com.proofaudit.pdg.lex.LineIndex;
import com.proofaudit.pdg.model.FileScan;
import com.proofaudit.pdg.model.RawReference;
import com.proofaudit.pdg.model.ScannedDeclaration;
import com.proofaudit.pdg.model.SourceFile;
import com.proofaudit.pdg.model.SourceUnit;
import com.proofaudit.pdg.model.SymbolStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Compiler-metadata front-end.
 *
 * Symbols, their extents and their references come from the {@code .glob}
 * records; the source bytes are only re-read to recover statement text and
 * proof status. Units without metadata are rejected.
 */
@Log4j2
public final class MetadataScanner implements FrontEndScanner {
    private final StatementExtractor statements;
    private final ProofStatusProbe proofs;

    public MetadataScanner(StatementExtractor statements, ProofStatusProbe proofs) {
        this.statements = statements;
        this.proofs = proofs;
    }

    public MetadataScanner() {
        this(new StatementExtractor(300, 2000), new ProofStatusProbe(500_000));
    }

    @Override
    public boolean accepts(SourceUnit unit) {
        return unit.hasMetadata();
    }

    @Override
    public FileScan scan(SourceUnit unit) {
        if (!unit.hasMetadata())
            throw new IllegalArgumentException("No compiler metadata for " + unit.path());

        GlobFile glob = GlobParser.parse(unit.metadata());
        String logicalPath = glob.logicalPath();
        byte[] stripped = CommentStripper.strip(unit.source());
        LineIndex lines = LineIndex.of(unit.source());

        List<ScannedDeclaration> declarations = new ArrayList<>();
        int skipped = 0;
        for (GlobFile.Scope scope : glob.scopes()) {
            GlobDefinition def = scope.definition();
            if (!GlobKinds.isTracked(def.kindCode()) || def.isNotationArtefact()) {
                skipped++;
                continue;
            }
            declarations.add(declaration(unit.path(), logicalPath, def, scope.references(), stripped, lines));
        }

        Set<String> declared = new LinkedHashSet<>();
        for (ScannedDeclaration d : declarations)
            declared.add(d.qualifiedName());

        List<String> imports = new ArrayList<>();
        Set<String> modules = new LinkedHashSet<>();
        for (GlobReference ref : glob.allReferences()) {
            String module = ref.modulePath();
            if (module.isEmpty() || module.equals(logicalPath))
                continue;
            modules.add(module);
            if ("lib".equals(ref.kindCode()) && !imports.contains(module))
                imports.add(module);
        }

        log.debug("{}: module {}, {} tracked, {} skipped definitions, {} referenced modules", unit.path(),
                logicalPath, declarations.size(), skipped, modules.size());

        SourceFile file = new SourceFile(unit.path(), logicalPath.isEmpty() ? null : logicalPath, imports,
                declared, modules);
        return new FileScan(file, declarations);
    }

    private ScannedDeclaration declaration(String path, String logicalPath, GlobDefinition def,
            List<GlobReference> scopeRefs, byte[] stripped, LineIndex lines) {
        String code = def.kindCode();
        String qualified = def.qualifiedIn(logicalPath);

        String statement = statements.extract(stripped, def.range());
        if (statement.isEmpty())
            statement = GlobKinds.display(code) + " " + def.name();

        SymbolStatus status;
        if (GlobKinds.ASSUMED.contains(code))
            status = SymbolStatus.ASSUMED;
        else if (GlobKinds.PROVABLE.contains(code))
            status = proofs.probe(stripped, Math.min(def.range().start(), stripped.length));
        else
            status = SymbolStatus.DEFINED;

        // de-duplicate by target, first occurrence kept
        Map<String, RawReference> refs = new LinkedHashMap<>();
        for (GlobReference ref : scopeRefs) {
            if (GlobKinds.IGNORED_REFERENCES.contains(ref.kindCode()) || ref.name() == null)
                continue;
            RawReference raw = ref.toRaw();
            String target = raw.qualifiedName();
            if (!target.equals(qualified))
                refs.putIfAbsent(target, raw);
        }

        return new ScannedDeclaration(def.name(), qualified, GlobKinds.symbolKind(code), GlobKinds.display(code),
                code, status, path, lines.lineOf(def.range().start()), def.range(), statement, "",
                List.copyOf(refs.values()));
    }
}
