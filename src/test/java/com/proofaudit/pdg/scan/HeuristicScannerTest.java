package com.proofaudit.pdg.scan;

import com.proofaudit.pdg.model.FileScan;
import com.proofaudit.pdg.model.ScannedDeclaration;
import com.proofaudit.pdg.model.SourceUnit;
import com.proofaudit.pdg.model.SymbolKind;
import com.proofaudit.pdg.model.SymbolStatus;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

public class HeuristicScannerTest {

    private final HeuristicScanner scanner = new HeuristicScanner();

    private FileScan scan(String source) {
        return scanner.scan(SourceUnit.of("T.v", source));
    }

    private static List<String> names(FileScan scan) {
        return scan.declarations().stream().map(ScannedDeclaration::qualifiedName).collect(Collectors.toList());
    }

    @Test
    public void testProvedLemma() {
        FileScan fs = scan("Lemma foo : True. Proof. exact I. Qed.");
        assertEquals(1, fs.declarations().size());
        ScannedDeclaration d = fs.declarations().get(0);
        assertEquals("foo", d.name());
        assertEquals("foo", d.qualifiedName());
        assertEquals(SymbolKind.PROVABLE, d.kind());
        assertEquals(SymbolStatus.PROVED, d.status());
        assertEquals("lemma", d.keyword());
        assertEquals("Lemma foo : True.", d.statement());
        assertEquals("Proof. exact I.", d.proofText());
        assertEquals("T.v", d.file());
        assertEquals(1, d.line());
        assertNull(d.kindCode());
        assertNull(d.byteRange());
    }

    @Test
    public void testAxiomIsAssumed() {
        ScannedDeclaration d = scan("Axiom bar : False.").declarations().get(0);
        assertEquals(SymbolKind.ASSUMPTION, d.kind());
        assertEquals(SymbolStatus.ASSUMED, d.status());
        assertEquals("axiom", d.keyword());
    }

    @Test
    public void testInlineDefinitionIsNeverPending() {
        FileScan fs = scan("Definition x := 5.\nLemma y : True.\nAdmitted.");
        assertEquals(List.of("x", "y"), names(fs));
        assertEquals(SymbolStatus.DEFINED, fs.declarations().get(0).status());
        assertEquals(SymbolStatus.ADMITTED, fs.declarations().get(1).status());
        assertEquals(2, fs.declarations().get(1).line());
    }

    @Test
    public void testTerminators() {
        FileScan fs = scan("Lemma a : True. Proof. Abort.\n"
                + "Instance i : C. Proof. Defined.\n"
                + "Theorem t : True. Proof. Admitted.\n"
                + "Corollary c : True. Proof. Qed.");
        List<ScannedDeclaration> d = fs.declarations();
        assertEquals(4, d.size());
        assertEquals(SymbolStatus.ABORTED, d.get(0).status());
        assertEquals(SymbolKind.INSTANCE, d.get(1).kind());
        assertEquals(SymbolStatus.DEFINED, d.get(1).status());
        assertEquals(SymbolStatus.ADMITTED, d.get(2).status());
        assertEquals(SymbolStatus.PROVED, d.get(3).status());
    }

    @Test
    public void testInlineBodies() {
        FileScan fs = scan("Lemma l : True := I.\nInstance j : C := {}.\nLemma after : True. Proof. Admitted.");
        List<ScannedDeclaration> d = fs.declarations();
        assertEquals(SymbolStatus.PROVED, d.get(0).status());
        assertEquals(SymbolStatus.DEFINED, d.get(1).status());
        assertEquals(SymbolStatus.ADMITTED, d.get(2).status());
    }

    @Test
    public void testTypeFormer() {
        ScannedDeclaration d = scan("Inductive color := Red | Green.").declarations().get(0);
        assertEquals(SymbolKind.TYPE_FORMER, d.kind());
        assertEquals(SymbolStatus.DEFINED, d.status());
        assertEquals("Inductive color := Red | Green.", d.statement());
    }

    @Test
    public void testTacticModeDefinition() {
        FileScan fs = scan("Definition k : nat.\nProof. exact 0. Defined.\nDefinition m : nat.\nAdmitted.");
        assertEquals(SymbolStatus.DEFINED, fs.declarations().get(0).status());
        assertEquals(SymbolStatus.ADMITTED, fs.declarations().get(1).status());
    }

    @Test
    public void testProofInternalsAreNotDeclarations() {
        FileScan fs = scan("Lemma p : True.\nProof.\n  assert (H : True).\n  Definition fake := 1.\nQed.");
        assertEquals(List.of("p"), names(fs));
        assertEquals("Lemma p : True.", fs.declarations().get(0).statement());
    }

    @Test
    public void testCommentsAreIgnored() {
        FileScan fs = scan("(* Lemma fake : False. *)\nLemma real : True. Proof. Qed.");
        assertEquals(List.of("real"), names(fs));
        assertEquals(2, fs.declarations().get(0).line());
    }

    @Test
    public void testScopesQualifyNames() {
        FileScan fs = scan("Module M.\nSection S.\nLemma a : True. Proof. Qed.\nEnd S.\n"
                + "Definition b := 1.\nEnd M.\nDefinition c := 2.");
        assertEquals(List.of("M.S.a", "M.b", "c"), names(fs));
        assertEquals("a", fs.declarations().get(0).name());
    }

    @Test
    public void testModuleAliasOpensNoScope() {
        FileScan fs = scan("Module N := M.\nDefinition d := 1.");
        assertEquals(List.of("d"), names(fs));
    }

    @Test
    public void testModuleTypeAndImportOpenScopes() {
        FileScan fs = scan("Module Type T.\nParameter p : nat.\nEnd T.\nModule Import X.\nDefinition e := 1.\nEnd X.");
        assertEquals(List.of("T.p", "X.e"), names(fs));
    }

    @Test
    public void testEndOfOuterScopeClosesInnerOnes() {
        FileScan fs = scan("Module A.\nModule B.\nEnd A.\nDefinition f := 1.");
        assertEquals(List.of("f"), names(fs));
    }

    @Test
    public void testEndOfUnknownScopeIsIgnored() {
        FileScan fs = scan("Module A.\nEnd Z.\nDefinition g := 1.\nEnd A.");
        assertEquals(List.of("A.g"), names(fs));
    }

    @Test
    public void testLogicalModulePathPrefixesNames() {
        FileScan fs = scanner.scan(SourceUnit.of("A.v", "Section S. Definition x := 1. End S.")
                .withLogicalModulePath("Lib.A"));
        assertEquals(List.of("Lib.A.S.x"), names(fs));
        assertEquals("Lib.A", fs.file().logicalModulePath());
        assertTrue(fs.file().declaredSymbols().contains("Lib.A.S.x"));
    }

    @Test
    public void testImports() {
        FileScan fs = scan("From Coq Require Import List Arith.\nRequire Export Foo.Bar.\nImport Baz.\n"
                + "Require Coq.Init.Nat.");
        assertEquals(List.of("List", "Arith", "Foo.Bar", "Baz", "Coq.Init.Nat"), fs.file().imports());
        assertTrue(fs.declarations().isEmpty());
        assertTrue(fs.file().referencedModules().isEmpty());
    }

    @Test
    public void testUnterminatedProofIsMarked() {
        FileScan fs = scan("Lemma h : True.\nProof.\nintros.");
        ScannedDeclaration d = fs.declarations().get(0);
        assertEquals(SymbolStatus.UNTERMINATED, d.status());
        assertEquals("Proof. intros.", d.proofText());
    }

    @Test
    public void testAssumeCompletePolicy() {
        HeuristicScanner lenient = new HeuristicScanner(UnterminatedProofPolicy.ASSUME_COMPLETE);
        assertEquals(SymbolStatus.PROVED,
                lenient.scan(SourceUnit.of("T.v", "Lemma h : True.\nProof.")).declarations().get(0).status());
        assertEquals(SymbolStatus.DEFINED,
                lenient.scan(SourceUnit.of("T.v", "Definition k : nat.\nexact 0.")).declarations().get(0).status());
    }

    @Test
    public void testDetachedProofIsSkipped() {
        FileScan fs = scan("Program Definition pd : nat := _.\nNext Obligation. exact 0. Qed.\n"
                + "Lemma z : True. Proof. Qed.");
        assertEquals(List.of("pd", "z"), names(fs));
        assertEquals(SymbolStatus.DEFINED, fs.declarations().get(0).status());
        assertEquals(SymbolStatus.PROVED, fs.declarations().get(1).status());
    }

    @Test
    public void testDeclarationEndsUnterminatedDetachedProof() {
        FileScan fs = scan("Next Obligation. apply x.\nLemma z : True. Proof. Admitted.");
        assertEquals(List.of("z"), names(fs));
        assertEquals(SymbolStatus.ADMITTED, fs.declarations().get(0).status());
    }

    @Test
    public void testAttributesAndMultiWordKeywords() {
        FileScan fs = scan("#[global] Instance k : C := {}.\nGlobal  Instance g : C := {}.\n"
                + "Program Fixpoint f (n : nat) : nat := n.");
        List<ScannedDeclaration> d = fs.declarations();
        assertEquals(List.of("k", "g", "f"), names(fs));
        assertEquals("instance", d.get(0).keyword());
        assertEquals("global instance", d.get(1).keyword());
        assertEquals(SymbolKind.INSTANCE, d.get(1).kind());
        assertEquals(SymbolKind.DEFINITIONAL, d.get(2).kind());
        assertEquals("program fixpoint", d.get(2).keyword());
    }

    @Test
    public void testScansAreIndependent() {
        scan("Module Open.\nLemma a : True.");
        FileScan fs = scan("Definition b := 1.");
        assertEquals(List.of("b"), names(fs));
    }

    @Test
    public void testTerminatorAfterClosingBrace() {
        FileScan fs = scan("Lemma a : True.\nProof.\n{ exact I. }\nQed.\nLemma b : False.\nProof.\nAdmitted.");
        assertEquals(List.of("a", "b"), names(fs));
        assertEquals(SymbolStatus.PROVED, fs.declarations().get(0).status());
        assertEquals(SymbolStatus.ADMITTED, fs.declarations().get(1).status());
        assertEquals(5, fs.declarations().get(1).line());
    }

    @Test
    public void testTerminatorAfterBullet() {
        FileScan fs = scan("Lemma a : True /\\ True.\nProof.\nsplit.\n- exact I.\n- Admitted.\nAxiom z : False.");
        assertEquals(List.of("a", "z"), names(fs));
        assertEquals(SymbolStatus.ADMITTED, fs.declarations().get(0).status());
    }

    @Test
    public void testLetInStatementIsReopenedByProof() {
        FileScan fs = scan("Lemma c : let n := 1 in n = n.\nProof.\nAdmitted.\nDefinition d := c.");
        assertEquals(List.of("c", "d"), names(fs));
        ScannedDeclaration c = fs.declarations().get(0);
        assertEquals(SymbolStatus.ADMITTED, c.status());
        assertEquals("Lemma c : let n := 1 in n = n.", c.statement());
        assertEquals("Proof.", c.proofText());
        assertEquals(1, c.line());
        assertEquals(SymbolStatus.DEFINED, fs.declarations().get(1).status());
    }
}
