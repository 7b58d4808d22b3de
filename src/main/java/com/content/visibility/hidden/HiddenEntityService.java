package com.content.visibility.hidden;

import com.content.visibility.catalog.EntityCatalog;
import com.content.visibility.core.model.EntityKey;
import com.content.visibility.core.model.EntityType;
import com.content.visibility.core.model.ExcludedEntity;
import com.content.visibility.core.model.ExclusionReason;
import com.content.visibility.core.model.HiddenEntity;
import com.content.visibility.core.model.Relation;
import com.content.visibility.core.model.RuleSet;
import com.content.visibility.error.NotFoundException;
import com.content.visibility.error.ValidationException;
import com.content.visibility.exclusion.CascadeRule;
import com.content.visibility.exclusion.CascadeRules;
import com.content.visibility.exclusion.ExclusionStore;
import com.content.visibility.logging.LogContext;
import com.content.visibility.metrics.MetricsService;
import com.content.visibility.metrics.NoOpMetricsService;
import com.content.visibility.rules.RestrictionRuleRepository;
import com.content.visibility.user.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * User-facing hide/unhide operations.
 *
 * <p>Hiding writes the hidden entity and, on a best-effort basis, the matching
 * exclusion rows so the entity disappears before the next recompute. Unhiding only
 * removes the hidden entity; registered {@link HiddenEntityListener}s decide when
 * the exclusion rows are rebuilt.</p>
 */
public class HiddenEntityService {
    private static final Logger log = LoggerFactory.getLogger(HiddenEntityService.class);

    private final HiddenEntityRepository repository;
    private final UserDirectory users;
    private final RestrictionRuleRepository rules;
    private final ExclusionStore store;
    private final EntityCatalog catalog;
    private final MetricsService metrics;
    private final List<HiddenEntityListener> listeners = new CopyOnWriteArrayList<>();

    public HiddenEntityService(HiddenEntityRepository repository, UserDirectory users,
                               RestrictionRuleRepository rules, ExclusionStore store,
                               EntityCatalog catalog, MetricsService metrics) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.users = Objects.requireNonNull(users, "users");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.store = Objects.requireNonNull(store, "store");
        this.catalog = catalog;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    public void addListener(HiddenEntityListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(HiddenEntityListener listener) {
        listeners.remove(listener);
    }

    /**
     * Hides an entity for the user. Hiding an already hidden entity changes nothing.
     *
     * @return true if the entity was not hidden before
     * @throws NotFoundException if the user does not exist
     */
    public boolean hide(long userId, EntityType type, EntityKey key) {
        requireUser(userId);
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(key, "key");

        try (LogContext ctx = LogContext.forHide(userId, type.getWireName())) {
            boolean created = repository.save(new HiddenEntity(userId, type, key, Instant.now()));
            if (created) {
                metrics.incrementHidden(type);
                log.info("entity.hidden userId={} type={} key={}", userId, type, key);
            }
            writeExclusions(userId, type, key);
            return created;
        }
    }

    /**
     * Validates an item from the API and hides it.
     *
     * @throws ValidationException if the item is malformed
     */
    public boolean hide(long userId, HideRequestItem item) {
        ValidItem valid = validate(item);
        return hide(userId, valid.type(), valid.key());
    }

    /**
     * Hides a batch of entities. The whole batch is validated before anything is
     * written; afterwards every item is hidden on its own.
     *
     * @throws ValidationException if the batch is empty or any item is malformed
     */
    public BulkHideResult bulkHide(long userId, List<HideRequestItem> items) {
        requireUser(userId);
        if (items == null || items.isEmpty()) {
            throw new ValidationException("entities must be a non-empty array");
        }
        List<ValidItem> validated = new ArrayList<>(items.size());
        for (HideRequestItem item : items) {
            validated.add(validate(item));
        }

        int success = 0;
        int failed = 0;
        for (ValidItem item : validated) {
            try {
                hide(userId, item.type(), item.key());
                success++;
            } catch (RuntimeException e) {
                failed++;
                log.error("bulkHide.itemFailed userId={} type={} key={} error={}",
                        userId, item.type(), item.key(), e.getMessage(), e);
            }
        }
        log.info("bulkHide.completed userId={} success={} failed={}", userId, success, failed);
        return new BulkHideResult(success, failed);
    }

    /**
     * Removes one hidden entity.
     *
     * @return true if the entity was hidden
     */
    public boolean unhide(long userId, EntityType type, EntityKey key) {
        requireUser(userId);
        boolean removed = repository.delete(userId, type, key);
        if (removed) {
            metrics.incrementUnhidden(type);
            log.info("entity.unhidden userId={} type={} key={}", userId, type, key);
            notifyUnhide(userId, type);
        }
        return removed;
    }

    /**
     * Removes every hidden entity of the user, or of one type when given.
     *
     * @param type the type to clear, or null for all
     * @return the number of hidden entities removed
     */
    public int unhideAll(long userId, EntityType type) {
        requireUser(userId);
        int removed = repository.deleteAll(userId, type);
        if (removed > 0) {
            log.info("entity.unhiddenAll userId={} type={} removed={}",
                    userId, type != null ? type : "all", removed);
            notifyUnhide(userId, type);
        }
        return removed;
    }

    /**
     * Lists the user's hidden entities, newest first.
     *
     * @param type the type to list, or null for all
     */
    public List<HiddenEntity> listHidden(long userId, EntityType type) {
        requireUser(userId);
        return repository.findByUser(userId, type);
    }

    public Map<EntityType, Set<EntityKey>> idsByType(long userId) {
        requireUser(userId);
        return repository.keysByType(userId);
    }

    public boolean isHidden(long userId, EntityType type, EntityKey key) {
        Set<EntityKey> keys = repository.keysByType(userId).getOrDefault(type, Set.of());
        for (EntityKey hiddenKey : keys) {
            if (hiddenKey.matches(key)) {
                return true;
            }
        }
        return false;
    }

    static ValidItem validate(HideRequestItem item) {
        if (item == null || isBlank(item.entityType()) || isBlank(item.entityId())) {
            throw new ValidationException("entityType and entityId are required for each entity");
        }
        EntityType type = EntityType.fromWire(item.entityType())
                .orElseThrow(() -> new ValidationException("Invalid entity type: " + item.entityType()));
        return new ValidItem(type, EntityKey.of(item.instanceId(), item.entityId().trim()));
    }

    /**
     * Writes the hidden row and, for containers, cascade rows for dependents whose
     * related entities are now all excluded. Only one level deep; the next
     * recompute settles the rest.
     */
    private void writeExclusions(long userId, EntityType type, EntityKey key) {
        try {
            store.insertIfAbsent(new ExcludedEntity(userId, type, key, ExclusionReason.HIDDEN, Instant.now()));
            if (!type.isContainer() || catalog == null || !catalog.isReady()) {
                return;
            }
            RuleSet ruleSet = rules.load(userId);
            int cascaded = 0;
            for (CascadeRule rule : CascadeRules.active(ruleSet)) {
                if (rule.dependsOn(type)) {
                    cascaded += cascadeDependents(userId, rule, type, concreteKeys(userId, type, key));
                }
            }
            if (cascaded > 0) {
                log.info("hide.cascaded userId={} type={} key={} cascaded={}", userId, type, key, cascaded);
            }
        } catch (RuntimeException e) {
            log.warn("hide.cascadeSkipped userId={} type={} key={} error={}", userId, type, key, e.getMessage());
        }
    }

    private int cascadeDependents(long userId, CascadeRule rule, EntityType type, Collection<EntityKey> hiddenKeys) {
        int cascaded = 0;
        for (Relation relation : rule.relations()) {
            if (relation.target() != type) {
                continue;
            }
            for (EntityKey hiddenKey : hiddenKeys) {
                for (EntityKey dependent : catalog.relatedIds(type, hiddenKey, relation.inverse())) {
                    if (isEmptied(userId, rule, dependent)
                            && store.insertIfAbsent(new ExcludedEntity(userId, rule.dependent(), dependent,
                            ExclusionReason.CASCADE, Instant.now()))) {
                        cascaded++;
                    }
                }
            }
        }
        return cascaded;
    }

    private boolean isEmptied(long userId, CascadeRule rule, EntityKey dependent) {
        boolean anyRelated = false;
        for (Relation relation : rule.relations()) {
            for (EntityKey related : catalog.relatedIds(rule.dependent(), dependent, relation)) {
                anyRelated = true;
                if (!store.isExcluded(userId, relation.target(), related)) {
                    return false;
                }
            }
        }
        return anyRelated;
    }

    private Collection<EntityKey> concreteKeys(long userId, EntityType type, EntityKey key) {
        if (!key.isGlobal()) {
            return List.of(key);
        }
        List<EntityKey> matches = new ArrayList<>();
        for (EntityKey candidate : catalog.allIds(type, users.instanceScope(userId))) {
            if (key.matches(candidate)) {
                matches.add(candidate);
            }
        }
        return matches;
    }

    private void notifyUnhide(long userId, EntityType type) {
        for (HiddenEntityListener listener : listeners) {
            try {
                listener.onUnhide(userId, type);
            } catch (RuntimeException e) {
                log.warn("unhide.listenerFailed userId={} error={}", userId, e.getMessage());
            }
        }
    }

    private void requireUser(long userId) {
        if (!users.exists(userId)) {
            throw NotFoundException.user(userId);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    record ValidItem(EntityType type, EntityKey key) {}
}
