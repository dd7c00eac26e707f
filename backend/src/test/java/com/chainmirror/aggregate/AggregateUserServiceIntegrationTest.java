package com.chainmirror.aggregate;

import com.chainmirror.coordination.CheckpointStore;
import com.chainmirror.domain.AggregateUser;
import com.chainmirror.domain.AggregateUserRepository;
import com.chainmirror.domain.Block;
import com.chainmirror.domain.EntityVersion;
import com.chainmirror.domain.FollowVersion;
import com.chainmirror.domain.PlaylistVersion;
import com.chainmirror.domain.UserVersion;
import com.chainmirror.ingestion.store.VersionLog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.data.mongodb.core.query.Criteria.where;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers
class AggregateUserServiceIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    AggregateUserService service;
    @Autowired
    AggregateUserRepository aggregateUserRepository;
    @Autowired
    CheckpointStore checkpointStore;
    @Autowired
    VersionLog versionLog;
    @Autowired
    MongoTemplate mongoTemplate;

    @Test
    @DisplayName("user with two public playlists, one an album, and nothing else counts 0/1/1/0, then picks up a new follower")
    void recomputesCountersFromCurrentView() {
        mongoTemplate.insert(new Block("0xb10", 10L, "0xb9", true));
        versionLog.append(user(7L, "0xb5", 5L));
        versionLog.append(playlist(1L, 7L, false, "0xb6", 6L));
        versionLog.append(playlist(2L, 7L, true, "0xb6", 6L));

        AggregateRunResult first = service.recompute();

        assertThat(first.skipped()).isFalse();
        assertThat(first.toBlock()).isEqualTo(10L);
        AggregateUser row = aggregateUserRepository.findById(7L).orElseThrow();
        assertThat(row.getTrackCount()).isZero();
        assertThat(row.getPlaylistCount()).isEqualTo(1L);
        assertThat(row.getAlbumCount()).isEqualTo(1L);
        assertThat(row.getFollowerCount()).isZero();
        assertThat(checkpointStore.get(AggregateUserService.CHECKPOINT_NAME)).contains(10L);

        assertThat(service.recompute().skipped()).isTrue();

        mongoTemplate.updateFirst(new Query(where("_id").is("0xb10")), Update.update("current", false), Block.class);
        mongoTemplate.insert(new Block("0xb11", 11L, "0xb10", true));
        versionLog.append(follow(8L, 7L, "0xb11", 11L));

        AggregateRunResult second = service.recompute();

        assertThat(second.fromBlock()).isEqualTo(10L);
        assertThat(second.usersUpdated()).isEqualTo(1);
        assertThat(aggregateUserRepository.findById(7L).orElseThrow().getFollowerCount()).isEqualTo(1L);
        assertThat(aggregateUserRepository.findById(8L)).isEmpty();
        assertThat(checkpointStore.get(AggregateUserService.CHECKPOINT_NAME)).contains(11L);
    }

    private static UserVersion user(Long userId, String blockhash, Long blocknumber) {
        UserVersion v = new UserVersion();
        v.setUserId(userId);
        v.setHandle("user" + userId);
        stamp(v, blockhash, blocknumber);
        return v;
    }

    private static PlaylistVersion playlist(Long playlistId, Long ownerId, boolean album, String blockhash, Long blocknumber) {
        PlaylistVersion v = new PlaylistVersion();
        v.setPlaylistId(playlistId);
        v.setPlaylistOwnerId(ownerId);
        v.setPlaylistName("playlist" + playlistId);
        v.setAlbum(album);
        v.setTxIndex(playlistId.intValue());
        stamp(v, blockhash, blocknumber);
        return v;
    }

    private static FollowVersion follow(Long follower, Long followee, String blockhash, Long blocknumber) {
        FollowVersion v = new FollowVersion();
        v.setFollowerUserId(follower);
        v.setFolloweeUserId(followee);
        stamp(v, blockhash, blocknumber);
        return v;
    }

    private static void stamp(EntityVersion v, String blockhash, Long blocknumber) {
        v.setBlockhash(blockhash);
        v.setBlocknumber(blocknumber);
        v.setTxHash("0xtx" + blockhash + v.getTxIndex());
    }
}
