package com.e2eq.cnl.validation;

import com.e2eq.cnl.TestSchemas;
import com.e2eq.cnl.graph.*;
import com.e2eq.cnl.parser.CnlStatementParser;
import com.e2eq.cnl.parser.RelationStatement;
import com.e2eq.cnl.schema.SchemaRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StatementValidatorTest {

    private final SchemaRegistry schema = TestSchemas.global();
    private final KnowledgeGraph graph = new KnowledgeGraph("g1");
    private final NodeRegistry nodes = new NodeRegistry(graph, schema);
    private final StatementValidator validator = new StatementValidator(schema, graph);
    private final CnlStatementParser parser = new CnlStatementParser();

    private Node socrates;
    private Node athens;

    @BeforeEach
    void setUp() {
        socrates = nodes.create(new NodeDraft("Socrates", null, "all", null, "Philosopher", null));
        athens = nodes.create(new NodeDraft("Athens", null, null, null, "City", null));
        nodes.create(new NodeDraft("Plato", null, null, null, "Person", null));
    }

    @Test
    void testValidRelationGroundsToEdge() {
        ValidationResult result = validator.validate(socrates, parser.parse("<lives_in> *mostly* Athens [probably]"));
        assertTrue(result.isValid(), result.errors().toString());
        RelationEdge edge = result.relationEdge().orElseThrow();
        assertEquals("socrates::lives_in::athens", edge.id());
        assertEquals("athens", edge.targetId());
        assertEquals(Optional.of("all"), edge.subjectQuantifier());
        assertEquals(Optional.of("mostly"), edge.objectQuantifier());
        assertEquals(Optional.of("probably"), edge.modality());
    }

    @Test
    void testRelationNameIsCaseAndSpaceInsensitive() {
        ValidationResult upper = validator.validate(socrates, parser.parse("<Teaches> Plato"));
        assertTrue(upper.isValid(), upper.errors().toString());
        RelationEdge edge = upper.relationEdge().orElseThrow();
        assertEquals("teaches", edge.name());
        assertEquals("socrates::teaches::plato", edge.id());

        ValidationResult spaced = validator.validate(socrates, RelationStatement.of("Lives  In", "Athens"));
        assertTrue(spaced.isValid(), spaced.errors().toString());
        assertEquals(Optional.of("socrates::lives_in::athens"), spaced.edgeId());
    }

    @Test
    void testUnknownRelationType() {
        ValidationResult result = validator.validate(socrates, parser.parse("<flies_to> Athens"));
        assertFalse(result.isValid());
        ValidationError error = result.errors().get(0);
        assertEquals(ValidationErrorKind.UNKNOWN_TYPE, error.kind());
        assertEquals("name", error.field());
        assertEquals("flies_to", error.value());
        assertEquals(Optional.of("socrates::flies_to::athens"), result.edgeId());
    }

    @Test
    void testRangeMismatch() {
        ValidationResult result = validator.validate(socrates, parser.parse("<lives_in> Plato"));
        assertEquals(1, result.errors().size());
        assertEquals(ValidationErrorKind.DOMAIN_RANGE_MISMATCH, result.errors().get(0).kind());
        assertEquals("range", result.errors().get(0).field());
    }

    @Test
    void testDomainMismatch() {
        ValidationResult result = validator.validate(athens, parser.parse("<teaches> Plato"));
        assertEquals(ValidationErrorKind.DOMAIN_RANGE_MISMATCH, result.errors().get(0).kind());
        assertEquals("domain", result.errors().get(0).field());
        assertEquals("City", result.errors().get(0).value());
    }

    @Test
    void testUntypedOrMissingTargetIsAccepted() {
        assertTrue(validator.validate(socrates, parser.parse("<lives_in> Sparta")).isValid());
        Node untyped = graph.requireNode(nodes.resolveOrCreate("Someone"));
        assertTrue(validator.validate(untyped, parser.parse("<teaches> Plato")).isValid());
    }

    @Test
    void testAttributeDataType() {
        ValidationResult ok = validator.validate(socrates, parser.parse("has era: -470 *year*"));
        assertTrue(ok.isValid());
        AttributeEdge edge = ok.attributeEdge().orElseThrow();
        assertEquals("socrates::era", edge.id());
        assertEquals(Optional.of("year"), edge.unit());
        assertEquals(Optional.of("all"), edge.quantifier());

        ValidationResult bad = validator.validate(socrates, parser.parse("has era: classical"));
        assertEquals(ValidationErrorKind.BAD_DATA_TYPE, bad.errors().get(0).kind());
        assertEquals("value", bad.errors().get(0).field());

        assertTrue(validator.validate(socrates, parser.parse("has alive: no")).isValid());
        assertFalse(validator.validate(socrates, parser.parse("has alive: perhaps")).isValid());
    }

    @Test
    void testAllowedValues() {
        assertTrue(validator.validate(athens, parser.parse("has color: White")).isValid());
        ValidationResult result = validator.validate(athens, parser.parse("has color: purple"));
        assertEquals(ValidationErrorKind.DISALLOWED_VALUE, result.errors().get(0).kind());
    }

    @Test
    void testUnknownAttributeType() {
        ValidationResult result = validator.validate(athens, parser.parse("has altitude: 70"));
        assertEquals(ValidationErrorKind.UNKNOWN_TYPE, result.errors().get(0).kind());
        assertTrue(result.attributeEdge().isPresent());
    }
}
