package com.identity.reconciliation.store;

import com.identity.reconciliation.core.model.DateRange;
import com.identity.reconciliation.core.model.EnrollmentField;
import com.identity.reconciliation.core.model.EnrollmentRecord;
import com.identity.reconciliation.core.model.IdentityField;
import com.identity.reconciliation.core.model.IdentityRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SqlExecutor Tests")
class SqlExecutorTest {

    private TestStore db;
    private SqlExecutor executor;

    @BeforeEach
    void setUp() {
        db = TestStore.create();
        executor = db.executor();
        db.person("u1").identity("i1", "u1", "  Jane ", null, "jane@example.com", "github");
    }

    @Nested
    @DisplayName("Reads")
    class ReadTests {

        @Test
        @DisplayName("Should trim text columns and read NULL as empty")
        void findIdentityNormalizes() {
            Optional<IdentityRecord> found = executor.findIdentity("i1");

            assertTrue(found.isPresent());
            assertEquals("u1", found.get().uuid());
            assertEquals("Jane", found.get().name());
            assertEquals("", found.get().username());
            assertEquals("github", found.get().source());
        }

        @Test
        @DisplayName("Should return empty for unknown identity")
        void findIdentityMissing() {
            assertTrue(executor.findIdentity("nope").isEmpty());
            assertTrue(executor.findIdentityUuid("nope").isEmpty());
        }

        @Test
        @DisplayName("Should resolve organizations and slug mappings")
        void lookups() {
            int id = db.organization("Acme");
            db.slug("sf-proj", "da/proj");

            assertEquals(Optional.of(id), executor.findOrganizationId("Acme"));
            assertEquals(Optional.of("da/proj"), executor.findInternalSlug("sf-proj"));
            assertTrue(executor.findOrganizationId("Nobody").isEmpty());
        }

        @Test
        @DisplayName("Should match enrollments on the exact date range")
        void findEnrollmentsByRange() {
            int org = db.organization("Acme");
            db.enrollment("u1", org, "", DateRange.OPEN_START, DateRange.OPEN_END);
            db.enrollment("u1", org, "", LocalDate.of(2020, 1, 1), DateRange.OPEN_END);

            List<EnrollmentRecord> open = executor.findEnrollments("u1", "", org, DateRange.open(), 10);
            assertEquals(1, open.size());
            assertEquals(DateRange.open(), open.get(0).range());

            DateRange dated = new DateRange(LocalDate.of(2020, 1, 1), DateRange.OPEN_END);
            List<EnrollmentRecord> narrowed = executor.findEnrollments("u1", "", org, dated, 10);
            assertEquals(1, narrowed.size());
            assertEquals(dated, narrowed.get(0).range());

            DateRange missing = new DateRange(LocalDate.of(2021, 1, 1), DateRange.OPEN_END);
            assertTrue(executor.findEnrollments("u1", "", org, missing, 10).isEmpty());
        }

        @Test
        @DisplayName("Should honor the row limit")
        void findEnrollmentsLimit() {
            int org = db.organization("Acme");
            db.enrollment("u1", org, "p", DateRange.OPEN_START, DateRange.OPEN_END);
            db.enrollment("u1", org, " p", DateRange.OPEN_START, DateRange.OPEN_END);

            // both slugs trim to the same project
            assertEquals(2, executor.findEnrollments("u1", "p", org, DateRange.open(), 10).size());
            assertEquals(1, executor.findEnrollments("u1", "p", org, DateRange.open(), 1).size());
        }
    }

    @Nested
    @DisplayName("Statements")
    class StatementTests {

        @Test
        @DisplayName("Identity update should set only the given columns plus the stamps")
        void identityUpdate() {
            Map<IdentityField, String> changes = new EnumMap<>(IdentityField.class);
            changes.put(IdentityField.NAME, "Jane X");
            SqlStatement statement = executor.identityUpdate("i1", changes, "email:a,sfid:b");

            assertEquals("update identities set name = ?, last_modified = now(), last_modified_by = ?, "
                    + "locked_by = ? where id = ?", statement.sql());
            assertEquals(List.of("Jane X", "email:a,sfid:b", "individual", "i1"), statement.arguments());
        }

        @Test
        @DisplayName("Enrollment update should filter by enrollment id")
        void enrollmentUpdate() {
            Map<EnrollmentField, Object> changes = new EnumMap<>(EnrollmentField.class);
            changes.put(EnrollmentField.ORGANIZATION_ID, 7);
            SqlStatement statement = executor.enrollmentUpdate(42L, changes, "actor");

            assertTrue(statement.sql().startsWith("update enrollments set organization_id = ?, last_modified"));
            assertTrue(statement.sql().endsWith("where id = ?"));
            assertEquals(42L, statement.arguments().get(statement.arguments().size() - 1));
        }
    }

    @Nested
    @DisplayName("Transactions")
    class TransactionTests {

        @Test
        @DisplayName("Should roll back when closed without commit")
        void rollbackOnClose() {
            try (StoreTransaction tx = executor.begin()) {
                assertEquals(1, tx.update(executor.uidentityTouch("u1", "actor")));
            }
            assertNull(db.string("select last_modified_by from uidentities where uuid = ?", "u1"));
        }

        @Test
        @DisplayName("Should persist committed changes")
        void commit() {
            try (StoreTransaction tx = executor.begin()) {
                tx.update(executor.profileTouch("u1", "actor"));
                tx.commit();
                assertTrue(tx.isCommitted());
            }
            assertEquals("actor", db.string("select last_modified_by from profiles where uuid = ?", "u1"));
            assertEquals("individual", db.string("select locked_by from profiles where uuid = ?", "u1"));
        }

        @Test
        @DisplayName("Should classify a duplicate insert as a unique violation")
        void duplicateInsert() {
            int org = db.organization("Acme");
            db.enrollment("u1", org, "", DateRange.OPEN_START, DateRange.OPEN_END);

            try (StoreTransaction tx = executor.begin()) {
                StoreException e = assertThrows(StoreException.class,
                        () -> tx.update(executor.enrollmentInsert("u1", org, "", DateRange.open(), "actor")));
                assertTrue(e.isUniqueViolation());
                assertNotNull(e.statement());
                assertEquals("u1", e.arguments().get(0));
            }
        }

        @Test
        @DisplayName("Should classify other failures as OTHER")
        void otherFailure() {
            try (StoreTransaction tx = executor.begin()) {
                StoreException e = assertThrows(StoreException.class,
                        () -> tx.update(SqlStatement.of("update no_such_table set x = ?", 1)));
                assertEquals(StoreErrorKind.OTHER, e.kind());
            }
        }

        @Test
        @DisplayName("Should reject use after close")
        void useAfterClose() {
            StoreTransaction tx = executor.begin();
            tx.close();
            assertThrows(IllegalStateException.class, tx::commit);
        }
    }
}
