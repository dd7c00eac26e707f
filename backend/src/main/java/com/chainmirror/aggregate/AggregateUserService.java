package com.chainmirror.aggregate;

import com.chainmirror.aggregate.config.AggregateProperties;
import com.chainmirror.coordination.CheckpointStore;
import com.chainmirror.domain.AggregateUser;
import com.chainmirror.domain.AggregateUserRepository;
import com.chainmirror.domain.Block;
import com.chainmirror.domain.BlockRepository;
import com.chainmirror.domain.EntityVersion;
import com.chainmirror.domain.FollowVersion;
import com.chainmirror.domain.PlaylistVersion;
import com.chainmirror.domain.RepostVersion;
import com.chainmirror.domain.SaveVersion;
import com.chainmirror.domain.SocialItemType;
import com.chainmirror.domain.TrackVersion;
import com.chainmirror.domain.UserVersion;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Incremental per-user counters. Users touched by a current row newer than the checkpoint get all their counters
 * recomputed from the current view and overwritten; the checkpoint then moves to the current block number.
 * <p>
 * Each batch of user ids is recounted in its own transaction and the checkpoint is written after the last batch.
 * A run that fails part way leaves the checkpoint where it was, and the next run recounts the same users again.
 */
@Service
@Slf4j
public class AggregateUserService {

    public static final String CHECKPOINT_NAME = "aggregate_user";

    private final MongoTemplate mongoTemplate;
    private final BlockRepository blockRepository;
    private final AggregateUserRepository aggregateUserRepository;
    private final CheckpointStore checkpointStore;
    private final AggregateProperties aggregateProperties;
    private final TransactionTemplate transactionTemplate;

    public AggregateUserService(MongoTemplate mongoTemplate,
                                BlockRepository blockRepository,
                                AggregateUserRepository aggregateUserRepository,
                                CheckpointStore checkpointStore,
                                AggregateProperties aggregateProperties,
                                PlatformTransactionManager transactionManager) {
        this.mongoTemplate = mongoTemplate;
        this.blockRepository = blockRepository;
        this.aggregateUserRepository = aggregateUserRepository;
        this.checkpointStore = checkpointStore;
        this.aggregateProperties = aggregateProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public AggregateRunResult recompute() {
        long checkpoint = checkpointStore.get(CHECKPOINT_NAME).orElse(0L);
        long latest = latestBlocknumber();
        log.info("Aggregate user: checkpoint {} latest block {}", checkpoint, latest);

        if (checkpoint == 0L) {
            log.info("Aggregate user: no checkpoint, repopulating {}", CHECKPOINT_NAME);
            transactionTemplate.executeWithoutResult(status -> mongoTemplate.remove(new Query(), AggregateUser.class));
        } else if (latest == checkpoint) {
            log.info("Aggregate user: skipped, no block newer than {}", checkpoint);
            return AggregateRunResult.skipped(checkpoint);
        }

        TreeSet<Long> changed = changedUserIds(checkpoint);
        int batchSize = Math.max(1, aggregateProperties.getIdBatchSize());
        int updated = 0;
        List<Long> batch = new ArrayList<>(batchSize);
        for (Long userId : changed) {
            batch.add(userId);
            if (batch.size() >= batchSize) {
                updated += recountInTransaction(batch);
                batch.clear();
            }
        }
        if (!batch.isEmpty()) {
            updated += recountInTransaction(batch);
        }

        if (latest > 0) {
            checkpointStore.save(CHECKPOINT_NAME, latest);
        }
        log.info("Aggregate user: recounted {} users ({} changed) for blocks ({}, {}]", updated, changed.size(), checkpoint, latest);
        return new AggregateRunResult(checkpoint, latest, updated, false);
    }

    private int recountInTransaction(List<Long> batch) {
        List<Long> userIds = List.copyOf(batch);
        Integer recounted = transactionTemplate.execute(status -> recount(userIds));
        return recounted == null ? 0 : recounted;
    }

    private long latestBlocknumber() {
        List<Block> current = blockRepository.findByCurrentTrue();
        if (current.isEmpty()) {
            log.error("Aggregate user: unable to get latest block number, no current block");
            return 0L;
        }
        return Optional.ofNullable(current.get(0).getNumber()).orElse(0L);
    }

    /** Users whose counters may have changed: owners, followers, followees, reposters and savers of newer current rows. */
    TreeSet<Long> changedUserIds(long afterBlock) {
        TreeSet<Long> ids = new TreeSet<>();
        addNonNull(ids, distinctNewer(UserVersion.class, "userId", afterBlock, null));
        addNonNull(ids, distinctNewer(TrackVersion.class, "ownerId", afterBlock, null));
        addNonNull(ids, distinctNewer(PlaylistVersion.class, "playlistOwnerId", afterBlock, null));
        addNonNull(ids, distinctNewer(FollowVersion.class, "followeeUserId", afterBlock, null));
        addNonNull(ids, distinctNewer(FollowVersion.class, "followerUserId", afterBlock, null));
        addNonNull(ids, distinctNewer(RepostVersion.class, "userId", afterBlock, null));
        addNonNull(ids, distinctNewer(SaveVersion.class, "userId", afterBlock, where("saveType").is(SocialItemType.TRACK)));
        return ids;
    }

    /** Rows with a missing user reference have no counter to update. */
    private static void addNonNull(TreeSet<Long> ids, List<Long> found) {
        found.stream().filter(Objects::nonNull).forEach(ids::add);
    }

    private List<Long> distinctNewer(Class<? extends EntityVersion> type, String field, long afterBlock, Criteria extra) {
        Criteria criteria = where("current").is(true).and("blocknumber").gt(afterBlock);
        Query query = extra == null ? new Query(criteria) : new Query(new Criteria().andOperator(criteria, extra));
        return mongoTemplate.findDistinct(query, field, type, Long.class);
    }

    private int recount(List<Long> userIds) {
        List<Long> existing = mongoTemplate.findDistinct(
                new Query(where("current").is(true).and("userId").in(userIds)), "userId", UserVersion.class, Long.class);
        if (existing.isEmpty()) {
            return 0;
        }
        Map<Long, Long> tracks = countBy(TrackVersion.class, "ownerId", existing,
                where("isUnlisted").is(false).and("stemOf").is(null));
        Map<Long, Long> playlists = countBy(PlaylistVersion.class, "playlistOwnerId", existing,
                where("isAlbum").is(false).and("isPrivate").is(false));
        Map<Long, Long> albums = countBy(PlaylistVersion.class, "playlistOwnerId", existing,
                where("isAlbum").is(true).and("isPrivate").is(false));
        Map<Long, Long> followers = countBy(FollowVersion.class, "followeeUserId", existing, null);
        Map<Long, Long> following = countBy(FollowVersion.class, "followerUserId", existing, null);
        Map<Long, Long> reposts = countBy(RepostVersion.class, "userId", existing, null);
        Map<Long, Long> trackSaves = countBy(SaveVersion.class, "userId", existing,
                where("saveType").is(SocialItemType.TRACK));

        List<AggregateUser> rows = new ArrayList<>(existing.size());
        for (Long userId : existing) {
            AggregateUser row = new AggregateUser();
            row.setUserId(userId);
            row.setTrackCount(tracks.getOrDefault(userId, 0L));
            row.setPlaylistCount(playlists.getOrDefault(userId, 0L));
            row.setAlbumCount(albums.getOrDefault(userId, 0L));
            row.setFollowerCount(followers.getOrDefault(userId, 0L));
            row.setFollowingCount(following.getOrDefault(userId, 0L));
            row.setRepostCount(reposts.getOrDefault(userId, 0L));
            row.setTrackSaveCount(trackSaves.getOrDefault(userId, 0L));
            rows.add(row);
        }
        aggregateUserRepository.saveAll(rows);
        return rows.size();
    }

    /** Current, not deleted rows grouped by {@code field}, restricted to {@code userIds}. */
    private Map<Long, Long> countBy(Class<? extends EntityVersion> type, String field, List<Long> userIds, Criteria extra) {
        Criteria base = where("current").is(true).and("isDelete").is(false).and(field).in(userIds);
        Criteria criteria = extra == null ? base : new Criteria().andOperator(base, extra);
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(criteria),
                Aggregation.group(field).count().as("count"));
        Map<Long, Long> counts = new HashMap<>();
        for (Document doc : mongoTemplate.aggregate(aggregation, type, Document.class).getMappedResults()) {
            Object id = doc.get("_id");
            Object count = doc.get("count");
            if (id instanceof Number n && count instanceof Number c) {
                counts.put(n.longValue(), c.longValue());
            }
        }
        return counts;
    }
}
