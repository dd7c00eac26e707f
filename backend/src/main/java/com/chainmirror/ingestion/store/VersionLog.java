package com.chainmirror.ingestion.store;

import com.chainmirror.domain.CurrentVersion;
import com.chainmirror.domain.EntityKind;
import com.chainmirror.domain.EntityVersion;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Sole writer of entity versions and of the current_versions pointer.
 * <p>
 * Every pointer move is a compare-and-set on the version id the caller last saw, and the {@code current} flag
 * on version documents is changed in the same call, so flag and pointer agree whenever the surrounding
 * transaction commits. Must be called inside a transaction.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VersionLog {

    private final MongoTemplate mongoTemplate;

    /**
     * Insert a new version and make it current for its business id, demoting the previous current version.
     * A second append for the same business id, block and transaction index replaces the version written by the
     * first one, so one transaction leaves at most one version per entity.
     *
     * @return the stored version (id, businessId, current and createdAt filled in)
     * @throws ConcurrentVersionUpdateException when the pointer moved under us
     */
    public <T extends EntityVersion> T append(T version) {
        EntityKind kind = version.kind();
        String businessId = version.naturalKey();
        String versionId = EntityVersion.versionId(businessId, version.getBlockhash(), version.getTxIndex());
        version.setBusinessId(businessId);
        version.setId(versionId);
        version.setCurrent(true);
        if (version.getCreatedAt() == null) {
            version.setCreatedAt(Instant.now());
        }

        String pointerId = CurrentVersion.idOf(kind, businessId);
        CurrentVersion pointer = mongoTemplate.findById(pointerId, CurrentVersion.class);
        if (pointer == null) {
            insertPointer(pointerId, kind, businessId, version);
        } else if (versionId.equals(pointer.getVersionId())) {
            // another event of the same transaction for this entity: the later payload wins
            mongoTemplate.save(version);
            log.debug("Replaced {} {} within transaction {}", kind, versionId, version.getTxHash());
            return version;
        } else {
            demote(kind, pointer.getVersionId());
            movePointer(pointerId, pointer.getVersionId(), version);
        }
        mongoTemplate.insert(version);
        return version;
    }

    /**
     * Undo everything {@code kind} recorded in one block: delete its versions and make the predecessor of each
     * touched business id current again, or drop the pointer when there is none.
     * Predecessor: latest version in an earlier block, by blocknumber then position in block.
     *
     * @return business ids whose current version changed
     */
    public Set<String> revertBlock(EntityKind kind, String blockhash, Long blocknumber) {
        Class<? extends EntityVersion> type = kind.versionType();
        List<? extends EntityVersion> reverted = mongoTemplate.find(new Query(where("blockhash").is(blockhash)), type);
        if (reverted.isEmpty()) {
            return Set.of();
        }
        Map<String, Set<String>> revertedIdsByBusinessId = new LinkedHashMap<>();
        for (EntityVersion v : reverted) {
            revertedIdsByBusinessId.computeIfAbsent(v.getBusinessId(), k -> new LinkedHashSet<>()).add(v.getId());
        }

        DeleteResult deleted = mongoTemplate.remove(new Query(where("blockhash").is(blockhash)), type);
        log.debug("Reverted {} {} versions of block {}", deleted.getDeletedCount(), kind, blockhash);

        for (Map.Entry<String, Set<String>> entry : revertedIdsByBusinessId.entrySet()) {
            String businessId = entry.getKey();
            EntityVersion predecessor = findPredecessor(type, businessId, blocknumber);
            String pointerId = CurrentVersion.idOf(kind, businessId);
            if (predecessor == null) {
                DeleteResult removed = mongoTemplate.remove(
                        new Query(where("_id").is(pointerId).and("versionId").in(entry.getValue())), CurrentVersion.class);
                if (removed.getDeletedCount() != 1) {
                    throw new ConcurrentVersionUpdateException("Pointer " + pointerId
                            + " did not reference a version of reverted block " + blockhash);
                }
            } else {
                mongoTemplate.updateFirst(new Query(where("_id").is(predecessor.getId())),
                        Update.update("current", true), type);
                UpdateResult moved = mongoTemplate.updateFirst(
                        new Query(where("_id").is(pointerId).and("versionId").in(entry.getValue())),
                        pointerUpdate(predecessor), CurrentVersion.class);
                if (moved.getMatchedCount() != 1) {
                    throw new ConcurrentVersionUpdateException("Pointer " + pointerId
                            + " did not reference a version of reverted block " + blockhash);
                }
            }
        }
        return revertedIdsByBusinessId.keySet();
    }

    private EntityVersion findPredecessor(Class<? extends EntityVersion> type, String businessId, Long blocknumber) {
        if (blocknumber == null) {
            return null;
        }
        Query query = new Query(Criteria.where("businessId").is(businessId).and("blocknumber").lt(blocknumber))
                .with(Sort.by(Sort.Order.desc("blocknumber"), Sort.Order.desc("txIndex")))
                .limit(1);
        return mongoTemplate.findOne(query, type);
    }

    private void demote(EntityKind kind, String versionId) {
        mongoTemplate.updateFirst(new Query(where("_id").is(versionId)), Update.update("current", false), kind.versionType());
    }

    private void insertPointer(String pointerId, EntityKind kind, String businessId, EntityVersion version) {
        CurrentVersion pointer = new CurrentVersion();
        pointer.setId(pointerId);
        pointer.setKind(kind);
        pointer.setBusinessId(businessId);
        pointer.setVersionId(version.getId());
        pointer.setBlockhash(version.getBlockhash());
        pointer.setBlocknumber(version.getBlocknumber());
        pointer.setUpdatedAt(Instant.now());
        try {
            mongoTemplate.insert(pointer);
        } catch (DuplicateKeyException e) {
            throw new ConcurrentVersionUpdateException("Pointer " + pointerId + " created concurrently");
        }
    }

    private void movePointer(String pointerId, String expectedVersionId, EntityVersion version) {
        UpdateResult result = mongoTemplate.updateFirst(
                new Query(where("_id").is(pointerId).and("versionId").is(expectedVersionId)),
                pointerUpdate(version), CurrentVersion.class);
        if (result.getMatchedCount() != 1) {
            throw new ConcurrentVersionUpdateException("Pointer " + pointerId + " moved away from " + expectedVersionId);
        }
    }

    private static Update pointerUpdate(EntityVersion version) {
        return new Update()
                .set("versionId", version.getId())
                .set("blockhash", version.getBlockhash())
                .set("blocknumber", version.getBlocknumber())
                .set("updatedAt", Instant.now());
    }
}
