package com.example.kiosksync.sync;

import com.example.kiosksync.error.ReservedIdentifierException;
import com.example.kiosksync.model.Avatar;
import com.example.kiosksync.model.Cohort;
import com.example.kiosksync.model.SyncEntity;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Everything that differs between the synced entity types: naming, storage layout, id style and
 * the defaults a freshly created record receives.
 */
public final class EntityKind<T extends SyncEntity> {

    /** Route token of the "create new" screens; never a valid id. */
    public static final String NEW_TOKEN = "new";

    private static final String ACCESS_CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    public static final EntityKind<Avatar> AVATAR =
            new EntityKind<>("avatar", Avatar.class, "avatars/", false, avatar -> {
                if (avatar.getPublished() == null) avatar.setPublished(false);
            });

    public static final EntityKind<Cohort> COHORT =
            new EntityKind<>("cohort", Cohort.class, "cohorts/", true, EntityKind::initCohort);

    private final String name;
    private final Class<T> type;
    private final String storePrefix;
    private final boolean timeSuffixedIds;
    private final Consumer<T> initializer;
    private final Set<String> reservedIds = Set.of(NEW_TOKEN);

    private EntityKind(String name, Class<T> type, String storePrefix, boolean timeSuffixedIds, Consumer<T> initializer) {
        this.name = name;
        this.type = type;
        this.storePrefix = storePrefix;
        this.timeSuffixedIds = timeSuffixedIds;
        this.initializer = initializer;
    }

    public String getName() { return name; }
    public Class<T> getType() { return type; }

    /** {@code avatars/prof-smith/prof-smith.json} */
    public String objectKey(String id) {
        return storePrefix + id + "/" + id + ".json";
    }

    public String manifestKey() {
        return storePrefix + "version.json";
    }

    public String cacheKey(String id) {
        return cachePrefix() + id;
    }

    public String cachePrefix() {
        return name + ":record:";
    }

    /**
     * Derives the immutable id of a new record from its display name.
     *
     * @throws ReservedIdentifierException when the slug is empty or reserved
     */
    public String newId(String displayName, long nowMillis) {
        String slug = Slugs.slugify(displayName);
        if (slug.isEmpty() || reservedIds.contains(slug)) {
            throw new ReservedIdentifierException(displayName, slug);
        }
        return timeSuffixedIds ? slug + "-" + Long.toString(nowMillis, 36) : slug;
    }

    public boolean isReserved(String id) {
        return id == null || id.isBlank() || reservedIds.contains(id);
    }

    public void initialize(T entity) {
        initializer.accept(entity);
    }

    @Override
    public String toString() {
        return name;
    }

    private static void initCohort(Cohort cohort) {
        if (cohort.getAccessCode() == null) {
            StringBuilder code = new StringBuilder(6);
            for (int i = 0; i < 6; i++) {
                code.append(ACCESS_CODE_ALPHABET.charAt(RANDOM.nextInt(ACCESS_CODE_ALPHABET.length())));
            }
            cohort.setAccessCode(code.toString());
        }
        if (cohort.getActive() == null) cohort.setActive(true);
        if (cohort.getStudents() == null) cohort.setStudents(new ArrayList<>());
        if (cohort.getPublished() == null) cohort.setPublished(false);
    }
}
