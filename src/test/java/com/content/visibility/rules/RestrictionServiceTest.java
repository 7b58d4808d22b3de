package com.content.visibility.rules;

import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.RestrictionMode;
import com.content.visibility.core.model.RestrictionRule;
import com.content.visibility.core.model.RuleSet;
import com.content.visibility.error.NotFoundException;
import com.content.visibility.error.ValidationException;
import com.content.visibility.metrics.MicrometerMetricsService;
import com.content.visibility.user.InMemoryUserDirectory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("RestrictionService")
class RestrictionServiceTest {

    private static final long USER = 1L;

    private InMemoryRestrictionRuleRepository repository;
    private InMemoryUserDirectory users;
    private RestrictionService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRestrictionRuleRepository();
        users = new InMemoryUserDirectory().addUser(USER);
        service = new RestrictionService(repository, users);
    }

    private static RestrictionRuleInput input(String type, String mode, List<String> ids, Boolean restrictEmpty) {
        return new RestrictionRuleInput(type, mode, ids, restrictEmpty);
    }

    @Nested
    @DisplayName("setRules")
    class SetRules {

        @Test
        @DisplayName("stores rules and bumps the version")
        void storesRules() {
            RuleSet first = service.setRules(USER, List.of(
                    input("tags", "INCLUDE", List.of("T1", "T2"), true),
                    input("studio", "exclude", List.of("S9"), null)));

            assertEquals(1L, first.version());
            RestrictionRule tags = first.ruleFor(EntityType.TAG).orElseThrow();
            assertEquals(RestrictionMode.INCLUDE, tags.mode());
            assertEquals(Set.of("T1", "T2"), tags.entityIds());
            assertTrue(tags.restrictEmpty());
            assertFalse(first.restrictEmpty(EntityType.STUDIO));

            RuleSet second = service.setRules(USER, List.of());
            assertEquals(2L, second.version());
            assertTrue(second.isEmpty());
        }

        @Test
        @DisplayName("replaces the previous rule set completely")
        void replaces() {
            service.setRules(USER, List.of(input("tag", "EXCLUDE", List.of("T1"), false)));
            service.setRules(USER, List.of(input("performer", "EXCLUDE", List.of("P1"), false)));

            RuleSet rules = service.getRules(USER);
            assertTrue(rules.ruleFor(EntityType.TAG).isEmpty());
            assertTrue(rules.ruleFor(EntityType.PERFORMER).isPresent());
        }

        @Test
        @DisplayName("rejects a missing list")
        void rejectsNull() {
            ValidationException e = assertThrows(ValidationException.class, () -> service.setRules(USER, null));
            assertEquals("Restrictions must be an array", e.getMessage());
        }

        @Test
        @DisplayName("rejects an unknown entity type and writes nothing")
        void rejectsUnknownType() {
            ValidationException e = assertThrows(ValidationException.class, () -> service.setRules(USER, List.of(
                    input("tag", "EXCLUDE", List.of("T1"), false),
                    input("movies", "EXCLUDE", List.of("M1"), false))));

            assertEquals("Invalid entity type: movies", e.getMessage());
            assertEquals(0L, repository.load(USER).version());
        }

        @Test
        @DisplayName("rejects an unknown mode")
        void rejectsUnknownMode() {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> service.setRules(USER, List.of(input("tag", "ALLOW", List.of(), false))));
            assertEquals("Invalid mode: ALLOW", e.getMessage());
        }

        @Test
        @DisplayName("rejects missing or blank entity ids")
        void rejectsBadIds() {
            assertThrows(ValidationException.class,
                    () -> service.setRules(USER, List.of(input("tag", "INCLUDE", null, false))));
            assertThrows(ValidationException.class,
                    () -> service.setRules(USER, List.of(input("tag", "INCLUDE", Arrays.asList("T1", " "), false))));
        }

        @Test
        @DisplayName("rejects two rules for the same type, including aliases")
        void rejectsDuplicates() {
            ValidationException e = assertThrows(ValidationException.class, () -> service.setRules(USER, List.of(
                    input("tag", "INCLUDE", List.of(), false),
                    input("tags", "EXCLUDE", List.of(), false))));
            assertEquals("Duplicate restriction for entity type: tag", e.getMessage());
        }

        @Test
        @DisplayName("unknown user is not found")
        void unknownUser() {
            assertThrows(NotFoundException.class, () -> service.setRules(99L, List.of()));
        }
    }

    @Nested
    @DisplayName("deleteRules")
    class DeleteRules {

        @Test
        @DisplayName("removes every rule and reports the count")
        void deletes() {
            service.setRules(USER, List.of(
                    input("tag", "INCLUDE", List.of(), false),
                    input("studio", "EXCLUDE", List.of("S1"), false)));

            assertEquals(2, service.deleteRules(USER));
            RuleSet rules = service.getRules(USER);
            assertTrue(rules.isEmpty());
            assertEquals(2L, rules.version());
        }

        @Test
        @DisplayName("deleting without rules removes nothing")
        void deleteEmpty() {
            assertEquals(0, service.deleteRules(USER));
        }
    }

    @Nested
    @DisplayName("rule cache")
    class Cache {

        @Test
        @DisplayName("second read is served from cache")
        void cachesReads() {
            RestrictionRuleRepository repo = spy(new InMemoryRestrictionRuleRepository());
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            RestrictionService cached = new RestrictionService(repo, users, RuleCacheConfig.defaults(),
                    new MicrometerMetricsService(registry));

            cached.getRules(USER);
            cached.getRules(USER);

            verify(repo, times(1)).load(USER);
            assertEquals(1.0, registry.get("visibility.rules.cache.hit").counter().count());
            assertEquals(1.0, registry.get("visibility.rules.cache.miss").counter().count());
        }

        @Test
        @DisplayName("writes invalidate the cached rule set")
        void writeInvalidates() {
            service.getRules(USER);
            service.setRules(USER, List.of(input("tag", "EXCLUDE", List.of("T1"), false)));

            assertEquals(1L, service.getRules(USER).version());
        }

        @Test
        @DisplayName("disabled cache always reads the repository")
        void disabled() {
            RestrictionRuleRepository repo = spy(new InMemoryRestrictionRuleRepository());
            RestrictionService uncached = new RestrictionService(repo, users, RuleCacheConfig.disabled(), null);

            uncached.getRules(USER);
            uncached.getRules(USER);

            verify(repo, times(2)).load(USER);
        }
    }

    @Nested
    @DisplayName("InMemoryRestrictionRuleRepository")
    class RepositoryTests {

        @Test
        @DisplayName("rejects rules of another user")
        void rejectsForeignRule() {
            RestrictionRule foreign = RestrictionRule.unrestricted(2L, EntityType.TAG);
            assertThrows(IllegalArgumentException.class, () -> repository.replaceAll(USER, List.of(foreign)));
        }
    }
}
