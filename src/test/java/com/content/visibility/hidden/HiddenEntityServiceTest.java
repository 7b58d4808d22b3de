package com.content.visibility.hidden;

import com.content.visibility.catalog.InMemoryEntityCatalog;
import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.ExcludedEntity;
import com.content.visibility.core.model.ExclusionReason;
import com.content.visibility.core.model.HiddenEntity;
import com.content.visibility.error.NotFoundException;
import com.content.visibility.error.ValidationException;
import com.content.visibility.exclusion.InMemoryExclusionStore;
import com.content.visibility.metrics.MicrometerMetricsService;
import com.content.visibility.rules.InMemoryRestrictionRuleRepository;
import com.content.visibility.rules.RestrictionRuleInput;
import com.content.visibility.rules.RestrictionService;
import com.content.visibility.user.InMemoryUserDirectory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("HiddenEntityService")
class HiddenEntityServiceTest {

    private static final long USER = 1L;
    private static final String LIB = "lib";

    private InMemoryHiddenEntityRepository repository;
    private InMemoryUserDirectory users;
    private InMemoryRestrictionRuleRepository rules;
    private InMemoryExclusionStore store;
    private InMemoryEntityCatalog catalog;
    private SimpleMeterRegistry registry;
    private HiddenEntityService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryHiddenEntityRepository();
        users = new InMemoryUserDirectory().addUser(USER);
        rules = new InMemoryRestrictionRuleRepository();
        store = new InMemoryExclusionStore();
        catalog = InMemoryEntityCatalog.builder()
                .link(LIB, EntityType.MEDIA_ITEM, "S1", EntityType.PERFORMER, "P")
                .link(LIB, EntityType.MEDIA_ITEM, "S2", EntityType.PERFORMER, "P")
                .link(LIB, EntityType.MEDIA_ITEM, "S2", EntityType.PERFORMER, "Q")
                .build();
        registry = new SimpleMeterRegistry();
        service = new HiddenEntityService(repository, users, rules, store, catalog,
                new MicrometerMetricsService(registry));
    }

    @Nested
    @DisplayName("hide")
    class Hide {

        @Test
        @DisplayName("stores the hidden entity and excludes it immediately")
        void hides() {
            assertTrue(service.hide(USER, EntityType.TAG, EntityKey.of(LIB, "T1")));

            assertTrue(service.isHidden(USER, EntityType.TAG, EntityKey.of(LIB, "T1")));
            ExcludedEntity row = store.rows(USER, EntityType.TAG).get(0);
            assertEquals(ExclusionReason.HIDDEN, row.reason());
            assertEquals(1.0, registry.get("visibility.hidden").tag("entityType", "tag").counter().count());
        }

        @Test
        @DisplayName("hiding twice is idempotent")
        void idempotent() {
            service.hide(USER, EntityType.TAG, EntityKey.of(LIB, "T1"));
            assertFalse(service.hide(USER, EntityType.TAG, EntityKey.of(LIB, "T1")));

            assertEquals(1, service.listHidden(USER, null).size());
            assertEquals(1, store.rows(USER, EntityType.TAG).size());
        }

        @Test
        @DisplayName("accepts ids the catalog does not know")
        void opaqueReference() {
            assertTrue(service.hide(USER, new HideRequestItem("studio", "not-synced-yet")));

            assertTrue(service.isHidden(USER, EntityType.STUDIO, EntityKey.of("other-lib", "not-synced-yet")));
        }

        @Test
        @DisplayName("validates the request item")
        void validates() {
            ValidationException missing = assertThrows(ValidationException.class,
                    () -> service.hide(USER, new HideRequestItem("tag", " ")));
            assertEquals("entityType and entityId are required for each entity", missing.getMessage());

            ValidationException unknown = assertThrows(ValidationException.class,
                    () -> service.hide(USER, new HideRequestItem("movie", "M1")));
            assertEquals("Invalid entity type: movie", unknown.getMessage());
        }

        @Test
        @DisplayName("unknown user is not found")
        void unknownUser() {
            assertThrows(NotFoundException.class, () -> service.hide(9L, EntityType.TAG, EntityKey.of("T1")));
        }

        @Test
        @DisplayName("cascades one level when the rules ask for empty entities to be restricted")
        void immediateCascade() {
            new RestrictionService(rules, users).setRules(USER, List.of(
                    new RestrictionRuleInput("performer", "EXCLUDE", List.of(), true)));

            service.hide(USER, EntityType.PERFORMER, EntityKey.of("P"));

            Map<EntityKey, ExclusionReason> scenes = store.rows(USER, EntityType.MEDIA_ITEM).stream()
                    .collect(Collectors.toMap(ExcludedEntity::key, ExcludedEntity::reason));
            assertEquals(Map.of(EntityKey.of(LIB, "S1"), ExclusionReason.CASCADE), scenes);
        }

        @Test
        @DisplayName("does not cascade without restrictEmpty")
        void noCascadeWithoutFlag() {
            service.hide(USER, EntityType.PERFORMER, EntityKey.of(LIB, "P"));

            assertTrue(store.rows(USER, EntityType.MEDIA_ITEM).isEmpty());
        }

        @Test
        @DisplayName("still hides when no catalog is available")
        void withoutCatalog() {
            HiddenEntityService noCatalog = new HiddenEntityService(repository, users, rules, store, null, null);

            assertTrue(noCatalog.hide(USER, EntityType.PERFORMER, EntityKey.of("P")));
            assertEquals(1, store.rows(USER, EntityType.PERFORMER).size());
        }
    }

    @Nested
    @DisplayName("bulkHide")
    class BulkHide {

        @Test
        @DisplayName("hides every item and counts them")
        void hidesAll() {
            BulkHideResult result = service.bulkHide(USER, List.of(
                    new HideRequestItem("tag", "T1"),
                    new HideRequestItem("performers", "P", LIB),
                    new HideRequestItem("tag", "T1")));

            assertEquals(3, result.successCount());
            assertEquals(0, result.failCount());
            assertEquals(2, service.listHidden(USER, null).size());
        }

        @Test
        @DisplayName("rejects an empty batch")
        void rejectsEmpty() {
            ValidationException e = assertThrows(ValidationException.class, () -> service.bulkHide(USER, List.of()));
            assertEquals("entities must be a non-empty array", e.getMessage());
            assertThrows(ValidationException.class, () -> service.bulkHide(USER, null));
        }

        @Test
        @DisplayName("a malformed item rejects the whole batch before writing")
        void malformedItem() {
            assertThrows(ValidationException.class, () -> service.bulkHide(USER, List.of(
                    new HideRequestItem("tag", "T1"),
                    new HideRequestItem(null, "T2"))));

            assertTrue(service.listHidden(USER, null).isEmpty());
        }

        @Test
        @DisplayName("an item that fails to save is counted and the rest continue")
        void partialFailure() {
            HiddenEntityRepository flaky = spy(new InMemoryHiddenEntityRepository());
            doThrow(new IllegalStateException("disk full"))
                    .when(flaky).save(argThat(h -> h.key().entityId().equals("T2")));
            HiddenEntityService flakyService = new HiddenEntityService(flaky, users, rules, store, catalog, null);

            BulkHideResult result = flakyService.bulkHide(USER, List.of(
                    new HideRequestItem("tag", "T1"),
                    new HideRequestItem("tag", "T2"),
                    new HideRequestItem("tag", "T3")));

            assertEquals(2, result.successCount());
            assertEquals(1, result.failCount());
        }
    }

    @Nested
    @DisplayName("unhide")
    class Unhide {

        @Test
        @DisplayName("removes the hidden entity and notifies listeners")
        void unhides() {
            HiddenEntityListener listener = mock(HiddenEntityListener.class);
            service.addListener(listener);
            service.hide(USER, EntityType.TAG, EntityKey.of(LIB, "T1"));

            assertTrue(service.unhide(USER, EntityType.TAG, EntityKey.of(LIB, "T1")));

            assertFalse(service.isHidden(USER, EntityType.TAG, EntityKey.of(LIB, "T1")));
            verify(listener).onUnhide(USER, EntityType.TAG);
            assertEquals(1.0, registry.get("visibility.unhidden").tag("entityType", "tag").counter().count());
        }

        @Test
        @DisplayName("unhiding something not hidden changes nothing")
        void notHidden() {
            HiddenEntityListener listener = mock(HiddenEntityListener.class);
            service.addListener(listener);

            assertFalse(service.unhide(USER, EntityType.TAG, EntityKey.of(LIB, "T1")));

            verifyNoInteractions(listener);
        }

        @Test
        @DisplayName("unhideAll can be restricted to one type")
        void unhideAllByType() {
            service.hide(USER, EntityType.TAG, EntityKey.of("T1"));
            service.hide(USER, EntityType.TAG, EntityKey.of("T2"));
            service.hide(USER, EntityType.STUDIO, EntityKey.of("S1"));

            assertEquals(2, service.unhideAll(USER, EntityType.TAG));
            assertEquals(Set.of(EntityType.STUDIO), service.idsByType(USER).keySet());
            assertEquals(1, service.unhideAll(USER, null));
        }

        @Test
        @DisplayName("a failing listener does not fail the unhide")
        void listenerFailure() {
            HiddenEntityListener listener = mock(HiddenEntityListener.class);
            doThrow(new IllegalStateException("queue closed")).when(listener).onUnhide(anyLong(), any());
            service.addListener(listener);
            service.hide(USER, EntityType.TAG, EntityKey.of("T1"));

            assertTrue(service.unhide(USER, EntityType.TAG, EntityKey.of("T1")));

            service.removeListener(listener);
        }
    }

    @Nested
    @DisplayName("InMemoryHiddenEntityRepository")
    class Repository {

        @Test
        @DisplayName("lists newest first and filters by type")
        void newestFirst() {
            Instant base = Instant.parse("2024-01-01T00:00:00Z");
            repository.save(new HiddenEntity(USER, EntityType.TAG, EntityKey.of("T1"), base));
            repository.save(new HiddenEntity(USER, EntityType.TAG, EntityKey.of("T2"), base.plusSeconds(10)));
            repository.save(new HiddenEntity(USER, EntityType.STUDIO, EntityKey.of("S1"), base.plusSeconds(5)));

            List<HiddenEntity> all = repository.findByUser(USER, null);
            assertEquals(List.of("T2", "S1", "T1"), all.stream().map(h -> h.key().entityId()).toList());
            assertEquals(2, repository.findByUser(USER, EntityType.TAG).size());
            assertTrue(repository.findByUser(2L, null).isEmpty());
        }
    }
}
