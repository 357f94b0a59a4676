package org.docmigrations.pipeline;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.docmigrations.pipeline.ir.MigrationResult;
import org.docmigrations.pipeline.steps.MigrationStep;
import org.docmigrations.pipeline.steps.StepRegistry;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.docmigrations.pipeline.TestDocuments.MARKER;
import static org.docmigrations.pipeline.TestDocuments.doc;
import static org.docmigrations.pipeline.TestDocuments.settingField;
import static org.docmigrations.pipeline.TestDocuments.unversioned;
import static org.junit.jupiter.api.Assertions.*;

class DocumentMigratorTest {

    private static DocumentMigrator migratorFor(MigrationStep... steps) {
        return new DocumentMigrator(StepRegistry.of(List.of(steps)), MARKER);
    }

    private static MigrationResult migrate(DocumentMigrator migrator, ObjectNode doc, int target) {
        return migrator.migrate(doc, target).block();
    }

    @Test
    void rewriteThenStampOnlyStepsLeaveDocumentModified() {
        var addX = MigrationStep.of(1, "add-x", doc -> doc.put("x", 1));
        var stampOnly = MigrationStep.stampOnly(2, "noop");
        var migrator = migratorFor(addX, stampOnly);

        var result = migrate(migrator, doc("a", 0), 2);

        assertEquals(2, MARKER.read(result.document()));
        assertEquals(1, result.document().get("x").asInt());
        assertTrue(result.modified());
        assertEquals(0, result.startVersion());
        assertEquals(2, result.endVersion());
    }

    @Test
    void stampOnlyChainAdvancesWithoutMarkingModified() {
        var migrator = migratorFor(MigrationStep.stampOnly(1, "a"), MigrationStep.stampOnly(2, "b"));

        var result = migrate(migrator, doc("a", 0), 2);

        assertEquals(2, result.endVersion());
        assertFalse(result.modified());
        assertTrue(result.changed());
    }

    @Test
    void modifiedFlagStaysSetAfterLaterStampOnlySteps() {
        var migrator = migratorFor(
            settingField(1, "first"),
            MigrationStep.stampOnly(2, "b"),
            MigrationStep.stampOnly(3, "c"));

        var result = migrate(migrator, doc("a", 0), 3);

        assertTrue(result.modified());
        assertEquals(3, result.endVersion());
    }

    @Test
    void documentAtOrAboveTargetIsReturnedUnchanged() {
        var calls = new AtomicInteger();
        var migrator = migratorFor(TestDocuments.counting(1, calls), TestDocuments.counting(2, calls));
        var original = doc("a", 2);

        var result = migrate(migrator, original.deepCopy(), 2);

        assertEquals(original, result.document());
        assertFalse(result.modified());
        assertFalse(result.changed());
        assertEquals(0, calls.get());
    }

    @Test
    void missingVersionFieldReadsAsZero() {
        var migrator = migratorFor(settingField(1, "x"));

        var result = migrate(migrator, unversioned("a"), 1);

        assertEquals(0, result.startVersion());
        assertEquals(1, MARKER.read(result.document()));
    }

    @Test
    void stopsAtTargetEvenWhenLaterStepsExist() {
        var calls = new AtomicInteger();
        var migrator = migratorFor(
            TestDocuments.counting(1, calls),
            TestDocuments.counting(2, calls),
            TestDocuments.counting(3, calls));

        var result = migrate(migrator, doc("a", 0), 2);

        assertEquals(2, result.endVersion());
        assertEquals(2, calls.get());
    }

    @Test
    void contiguousChainReachesExactlyTheTarget() {
        var migrator = migratorFor(
            settingField(1, "a"), settingField(2, "b"), settingField(3, "c"), settingField(4, "d"));

        for (int start = 0; start < 4; start++) {
            var result = migrate(migrator, doc("doc-" + start, start), 4);
            assertEquals(4, MARKER.read(result.document()), "starting from " + start);
            assertTrue(result.reachedTarget(4));
        }
    }

    @Test
    void versionsNeedNotBeContiguous() {
        var migrator = migratorFor(settingField(10, "a"), settingField(20, "b"));

        var result = migrate(migrator, doc("a", 0), 20);

        assertEquals(20, result.endVersion());
        assertEquals(10, result.document().get("a").asInt());
        assertEquals(20, result.document().get("b").asInt());
    }

    @Test
    void documentWithoutApplicableStepStalls() {
        var migrator = migratorFor(settingField(1, "a"), settingField(2, "b"));
        var original = doc("a", 5);

        var result = migrate(migrator, original.deepCopy(), 10);

        assertEquals(original, result.document());
        assertEquals(5, result.endVersion());
        assertFalse(result.modified());
        assertFalse(result.reachedTarget(10));
    }

    @Test
    void documentBetweenStepVersionsStalls() {
        var migrator = migratorFor(settingField(2, "a"), settingField(5, "b"));

        var result = migrate(migrator, doc("a", 3), 5);

        assertEquals(3, result.endVersion());
        assertFalse(result.changed());
    }

    @Test
    void replacementDocumentBecomesTheWorkingDocument() {
        var replace = new MigrationStep(1, "replace", doc -> {
            var fresh = TestDocuments.MAPPER.createObjectNode();
            fresh.put("_id", doc.get("_id").asText());
            fresh.put("shape", "new");
            return Mono.just(fresh);
        });
        var migrator = migratorFor(replace, settingField(2, "after"));
        var original = doc("a", 0);
        original.put("legacy", true);

        var result = migrate(migrator, original, 2);

        assertFalse(result.document().has("legacy"));
        assertEquals("new", result.document().get("shape").asText());
        assertEquals(2, result.document().get("after").asInt());
        assertEquals(2, MARKER.read(result.document()));
    }

    @Test
    void remigratingIsANoOp() {
        var migrator = migratorFor(settingField(1, "a"), MigrationStep.stampOnly(2, "b"));

        var first = migrate(migrator, doc("a", 0), 2);
        var firstDocument = first.document().deepCopy();
        var second = migrate(migrator, first.document(), 2);

        assertEquals(firstDocument, second.document());
        assertFalse(second.changed());
    }

    @Test
    void asynchronousTransformsAreAwaited() {
        var delayed = new MigrationStep(1, "delayed", doc ->
            Mono.delay(java.time.Duration.ofMillis(20)).map(tick -> doc.put("late", true)));
        var migrator = migratorFor(delayed);

        StepVerifier.create(migrator.migrate(doc("a", 0), 1))
            .assertNext(result -> {
                assertTrue(result.document().get("late").asBoolean());
                assertEquals(1, result.endVersion());
            })
            .verifyComplete();
    }

    @Test
    void transformFailurePropagates() {
        var failing = new MigrationStep(1, "boom", doc -> Mono.error(new IllegalStateException("boom")));
        var migrator = migratorFor(failing);

        StepVerifier.create(migrator.migrate(doc("a", 0), 1))
            .expectErrorMessage("boom")
            .verify();
    }
}
