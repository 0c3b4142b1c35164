package com.proofaudit.pdg.scan;

import com.proofaudit.pdg.api.FrontEndScanner;
import com.proofaudit.pdg.lex.CommentStripper;
import com.proofaudit.pdg.lex.Sentence;
import com.proofaudit.pdg.lex.SentenceSplitter;
import com.proofaudit.pdg.model.FileScan;
import com.proofaudit.pdg.model.ScannedDeclaration;
import com.proofaudit.pdg.model.SourceFile;
import com.proofaudit.pdg.model.SourceUnit;
import com.proofaudit.pdg.model.SymbolKind;
import com.proofaudit.pdg.model.SymbolStatus;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

/**
 * Heuristic front-end: recovers declarations from raw vernacular text.
 *
 * Processing:
 * 1. Strip comments, split into sentences.
 * 2. Fold every sentence into a {@link ScannerState}: scope commands move the
 * scope stack, import commands record imports, declaration keywords create
 * declarations.
 * 3. Provable, instance and tactic-mode definitions without an inline
 * {@code :=} body are held pending. Everything up to the next terminator
 * (Qed, Admitted, Defined, Abort) is proof-internal: it is kept out of the
 * statement and recorded as proof text. A {@code Proof} right after a
 * statement that only looked inline re-opens that declaration.
 * 4. At end of file a still-pending declaration is resolved with the
 * configured {@link UnterminatedProofPolicy}.
 *
 * Proof blocks that belong to no tracked declaration (Next Obligation, or a
 * Proof after a command the scanner does not track) are skipped up to their
 * terminator or the next declaration keyword.
 *
 * Stateless; safe to share between threads.
 */
@Log4j2
public final class HeuristicScanner implements FrontEndScanner {
    private final UnterminatedProofPolicy unterminatedPolicy;

    public HeuristicScanner() {
        this(UnterminatedProofPolicy.MARK_UNTERMINATED);
    }

    public HeuristicScanner(UnterminatedProofPolicy unterminatedPolicy) {
        this.unterminatedPolicy = unterminatedPolicy;
    }

    @Override
    public FileScan scan(SourceUnit unit) {
        String text = CommentStripper.strip(unit.sourceText());
        List<Sentence> sentences = SentenceSplitter.split(text);

        ScannerState state = ScannerState.initial(unit.logicalModulePath());
        for (int i = 0; i < sentences.size(); i++)
            state = step(state, sentences, i, unit.path());
        state = finish(state, sentences);

        Set<String> declared = state.declarations().stream()
                .map(ScannedDeclaration::qualifiedName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        log.debug("{}: {} sentences, {} declarations", unit.path(), sentences.size(), declared.size());

        SourceFile file = new SourceFile(unit.path(), unit.logicalModulePath(), state.imports(), declared, Set.of());
        return new FileScan(file, state.declarations());
    }

    /** One transition of the fold. */
    ScannerState step(ScannerState state, List<Sentence> sentences, int index, String path) {
        Sentence sentence = sentences.get(index);
        String body = sentence.body();
        SymbolStatus terminated = SymbolStatus.fromSentence(body);

        if (state.pending() != null) {
            if (terminated == null)
                return state;
            ScannerState.Pending p = state.pending();
            return state.declare(p.declaration()
                    .withStatus(terminated)
                    .appendProof(proofText(sentences, p.proofFrom(), index)));
        }

        if (state.detachedProof()) {
            if (terminated != null)
                return state.endDetachedProof();
            if (VernacularKeywords.matchDeclaration(sentence.text()) == null)
                return state;
            state = state.endDetachedProof();
        }

        if (terminated != null)
            return state;

        if (VernacularKeywords.PROOF_OPENER.matcher(body).matches()
                && followsInlineStatement(state, sentences, index))
            return state.reopenLast(index);
        if (VernacularKeywords.PROOF_START.matcher(body).find())
            return state.beginDetachedProof();

        Matcher m = VernacularKeywords.SCOPE_OPEN.matcher(body);
        if (m.matches()) {
            // "Module M := N." is an alias and has no End
            return m.group(2).contains(":=") ? state : state.openScope(m.group(1));
        }

        m = VernacularKeywords.SCOPE_CLOSE.matcher(body);
        if (m.find()) {
            ScannerState closed = state.closeScope(m.group(1));
            if (closed == state)
                log.debug("{}:{}: End {} does not match any open scope {}", path, sentence.line(), m.group(1),
                        state.scopes());
            return closed;
        }

        m = VernacularKeywords.REQUIRE.matcher(body);
        if (!m.matches())
            m = VernacularKeywords.IMPORT.matcher(body);
        if (m.matches())
            return state.addImports(modules(m.group(1)));

        VernacularKeywords.Declaration d = VernacularKeywords.matchDeclaration(sentence.text());
        if (d == null)
            return state;

        ScannedDeclaration decl = new ScannedDeclaration(d.name(), state.qualify(d.name()), d.kind(),
                d.keyword().toLowerCase(), null, initialStatus(d), path, sentence.line(), null, d.statement(), "",
                List.of());

        if (awaitsProof(d))
            return state.awaitProof(decl, index + 1);
        return state.declare(decl);
    }

    private ScannerState finish(ScannerState state, List<Sentence> sentences) {
        ScannerState.Pending p = state.pending();
        if (p == null)
            return state;
        ScannedDeclaration decl = p.declaration();
        SymbolStatus status = switch (unterminatedPolicy) {
            case MARK_UNTERMINATED -> SymbolStatus.UNTERMINATED;
            case ASSUME_COMPLETE -> decl.kind() == SymbolKind.DEFINITIONAL ? SymbolStatus.DEFINED : SymbolStatus.PROVED;
        };
        log.debug("{}:{}: proof of {} never terminated, reporting {}", decl.file(), decl.line(),
                decl.qualifiedName(), status);
        return state.declare(decl.withStatus(status).appendProof(proofText(sentences, p.proofFrom(), sentences.size())));
    }

    private static boolean awaitsProof(VernacularKeywords.Declaration d) {
        return !d.hasInlineBody() && provableKind(d.kind());
    }

    private static boolean provableKind(SymbolKind kind) {
        return kind == SymbolKind.PROVABLE || kind == SymbolKind.INSTANCE || kind == SymbolKind.DEFINITIONAL;
    }

    /**
     * True when the previous sentence declared the last finalized symbol with
     * a {@code :=} in its statement, e.g. {@code Lemma c : let n := 1 in n = n.}
     */
    private static boolean followsInlineStatement(ScannerState state, List<Sentence> sentences, int index) {
        if (index == 0 || state.declarations().isEmpty())
            return false;
        Sentence previous = sentences.get(index - 1);
        VernacularKeywords.Declaration d = VernacularKeywords.matchDeclaration(previous.text());
        if (d == null || !d.hasInlineBody() || !provableKind(d.kind()))
            return false;
        ScannedDeclaration last = state.declarations().get(state.declarations().size() - 1);
        return last.line() == previous.line() && last.qualifiedName().equals(state.qualify(d.name()));
    }

    private static SymbolStatus initialStatus(VernacularKeywords.Declaration d) {
        return switch (d.kind()) {
            case ASSUMPTION -> SymbolStatus.ASSUMED;
            // a provable with a term body is as proved as one ending in Qed
            case PROVABLE -> SymbolStatus.PROVED;
            default -> SymbolStatus.DEFINED;
        };
    }

    private static String proofText(List<Sentence> sentences, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (sb.length() > 0)
                sb.append(' ');
            sb.append(sentences.get(i).text());
        }
        return sb.toString();
    }

    private static List<String> modules(String text) {
        return Arrays.stream(text.trim().split("\\s+"))
                .map(s -> s.endsWith(".") ? s.substring(0, s.length() - 1) : s)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
