package org.sensiblaw.semantic.logic;

import org.sensiblaw.semantic.TestDocuments;
import org.sensiblaw.semantic.model.TokenStream;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogicTreeBuilderTest {

    private final LogicTreeBuilder builder = new LogicTreeBuilder();

    private LogicTree build(String text) {
        return builder.build(TestDocuments.tokens(text));
    }

    private static List<NodeType> childTypes(LogicTree tree, LogicNode node) {
        return tree.children(node).stream().map(LogicNode::type).toList();
    }

    @Test
    void prohibitionWithException() {
        LogicTree tree = build("A person must not sell spray paint unless licensed.");
        assertEquals(1, tree.clauses().size());
        LogicNode clause = tree.clauses().get(0);
        assertEquals(List.of(NodeType.MODAL, NodeType.EXCEPTION), childTypes(tree, clause));

        LogicNode modal = tree.children(clause).get(0);
        assertEquals("must not", modal.text());
        assertEquals("prohibition", modal.label());

        LogicNode exception = tree.children(clause).get(1);
        assertEquals("unless licensed", exception.text());
        assertEquals("unless", exception.label());
    }

    @Test
    void semicolonSeparatesClauses() {
        LogicTree tree = build("A person must keep records; the Minister may waive the fee.");
        assertEquals(2, tree.clauses().size());
        assertEquals("the", tree.stream().get(tree.clauses().get(1).span().start()).text());
    }

    @Test
    void coordinatorSplitsOnlyBetweenModals() {
        LogicTree split = build("A retailer must keep records and the Minister may waive the fee.");
        assertEquals(2, split.clauses().size());
        assertEquals("and", split.stream().get(split.clauses().get(1).span().start()).text());

        LogicTree joined = build("A retailer must keep records and receipts.");
        assertEquals(1, joined.clauses().size());
    }

    @Test
    void conditionContainsItsReference() {
        LogicTree tree = build("Subject to section 4, a licensee may sell paint.");
        LogicNode clause = tree.clauses().get(0);
        assertEquals(List.of(NodeType.CONDITION, NodeType.MODAL), childTypes(tree, clause));
        LogicNode condition = tree.children(clause).get(0);
        assertEquals("subject_to", condition.label());
        assertEquals("Subject to section 4", condition.text());
        List<LogicNode> refs = tree.children(condition);
        assertEquals(1, refs.size());
        assertEquals(NodeType.REFERENCE, refs.get(0).type());
        assertEquals("provision", refs.get(0).label());
    }

    @Test
    void modalWordInsideCommaClosedConditionNestsUnderIt() {
        LogicTree tree = build("If a licence is required, the holder must renew it.");
        LogicNode clause = tree.clauses().get(0);
        assertEquals(List.of(NodeType.CONDITION, NodeType.MODAL), childTypes(tree, clause));

        LogicNode condition = tree.children(clause).get(0);
        assertEquals("If a licence is required", condition.text());
        assertEquals(List.of(NodeType.MODAL), childTypes(tree, condition));
        assertEquals("must", tree.children(clause).get(1).text());
        assertTrue(LogicTreeValidator.validate(tree).isValid());
    }

    @Test
    void strayPunctuationInsideModalPhrase() {
        LogicTree tree = build("A person must ( not sell paint.");
        LogicNode modal = tree.nodesOfType(NodeType.MODAL).get(0);
        assertEquals("must ( not", modal.text());
        assertEquals("prohibition", modal.label());
    }

    @Test
    void actReferenceLabel() {
        LogicTree tree = build("A person must comply with section 5 of the Crimes Act 1900.");
        List<LogicNode> refs = tree.nodesOfType(NodeType.REFERENCE);
        assertEquals(1, refs.size());
        assertEquals("act", refs.get(0).label());
        assertEquals("section 5 of the Crimes Act 1900", refs.get(0).text());
    }

    @Test
    void dependencyPhraseDoesNotBecomeModal() {
        LogicTree tree = build("A licensee must keep records as required by section 9.");
        assertEquals(1, tree.nodesOfType(NodeType.MODAL).size());
        assertEquals("must", tree.nodesOfType(NodeType.MODAL).get(0).text());
    }

    @Test
    void clauseLabelFromNumbering() {
        LogicTree tree = build("(a) A retailer must keep records. 2. The Minister may waive the fee.");
        assertEquals("a", tree.clauses().get(0).label());
        assertEquals("2", tree.clauses().get(1).label());
    }

    @Test
    void clauseWithoutModalIsKept() {
        LogicTree tree = build("This Part applies to retailers.");
        assertEquals(1, tree.clauses().size());
        assertTrue(tree.nodesOfType(NodeType.MODAL).isEmpty());
    }

    @Test
    void idsDeriveFromTypeAndSpan() {
        TokenStream stream = TestDocuments.tokens("A person must not sell spray paint unless licensed.");
        LogicTree tree = builder.build(stream);
        assertEquals(LogicTreeBuilder.nodeId("doc", "r1", NodeType.ROOT, 0, stream.size()), tree.rootId());
        assertTrue(tree.rootId().matches("n[0-9a-f]{16}"));
    }

    @Test
    void buildIsDeterministic() {
        String text = "Subject to section 4, a licensee may sell paint; a retailer must not sell paint unless licensed.";
        LogicTree first = build(text);
        LogicTree second = build(text);
        assertEquals(LogicTreeExport.toJson(first), LogicTreeExport.toJson(second));
        assertEquals(first.nodes(), second.nodes());
        assertEquals(first.edges(), second.edges());
    }

    @Test
    void tokenLeavesCoverUnstructuredTokens() {
        TokenStream stream = TestDocuments.tokens("A person must not sell spray paint unless licensed.");
        LogicTree tree = builder.build(stream, true);
        LogicNode clause = tree.clauses().get(0);
        List<LogicNode> children = tree.children(clause);
        assertEquals(NodeType.TOKEN, children.get(0).type());
        assertEquals("A", children.get(0).text());
        assertTrue(LogicTreeValidator.validate(tree).isValid());
        // "A person", "sell spray paint", "." under the clause; "unless licensed" under the exception
        assertEquals(8, tree.nodesOfType(NodeType.TOKEN).size());
    }

    @Test
    void structuralThenSequenceEdges() {
        LogicTree tree = build("A person must not sell spray paint unless licensed.");
        LogicNode clause = tree.clauses().get(0);
        List<LogicEdge> fromClause = tree.edges().stream().filter(e -> e.sourceId().equals(clause.id())).toList();
        assertEquals(EdgeType.STRUCTURAL, fromClause.get(0).type());
        assertEquals(EdgeType.STRUCTURAL, fromClause.get(1).type());
        LogicNode modal = tree.children(clause).get(0);
        assertTrue(tree.edges().contains(new LogicEdge(EdgeType.SEQUENCE, modal.id(), tree.children(clause).get(1).id())));
    }

    @Test
    void unbalancedBracketIsRecoveredAtClauseEnd() {
        LogicTree tree = build("A person must (except in an emergency keep the gate closed.");
        assertEquals(1, tree.clauses().size());
        assertTrue(LogicTreeValidator.validate(tree).isValid());
    }

    @Test
    void traversals() {
        LogicTree tree = build("A person must not sell spray paint unless licensed.");
        List<LogicNode> post = tree.postorder();
        assertEquals(tree.rootId(), post.get(post.size() - 1).id());
        assertEquals(tree.rootId(), tree.preorder().get(0).id());
        List<List<String>> paths = tree.rootToLeafPaths();
        assertEquals(2, paths.size());
        assertEquals(3, paths.get(0).size());
        assertEquals(tree.rootId(), paths.get(0).get(0));
    }

    @Test
    void emptyStreamYieldsRootOnly() {
        LogicTree tree = builder.build(TestDocuments.tokens(""));
        assertEquals(1, tree.nodes().size());
        assertTrue(tree.clauses().isEmpty());
    }
}
