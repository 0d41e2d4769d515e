package com.hubsync.ingestion.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubsync.HubFixtures;
import com.hubsync.domain.HubEvent;
import com.hubsync.domain.StreamCheckpointRepository;
import com.hubsync.ingestion.adapter.HubJsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest
@Testcontainers(disabledWithoutDocker = true)
class MongoDurableStreamIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    MongoTemplate mongoTemplate;
    @Autowired
    StreamCheckpointRepository checkpointRepository;

    private final HubJsonCodec codec = new HubJsonCodec(new ObjectMapper());
    private MongoDurableStream stream;

    @BeforeEach
    void setUp() {
        mongoTemplate.getDb().drop();
        stream = new MongoDurableStream(mongoTemplate, checkpointRepository, codec);
    }

    @Test
    @DisplayName("entry ids increase per shard independently")
    void append_allocatesIncreasingIdsPerShard() {
        assertThat(stream.append("0", HubFixtures.mergeCast(10, 2))).isEqualTo(1L);
        assertThat(stream.append("1", HubFixtures.mergeCast(11, 3))).isEqualTo(1L);
        assertThat(stream.append("0", HubFixtures.mergeCast(12, 4))).isEqualTo(2L);
    }

    @Test
    void readAfter_returnsEntriesInOrderWithLimit() {
        for (long id = 1; id <= 5; id++) {
            stream.append("all", HubFixtures.mergeCast(id, id));
        }

        List<StreamRecord> page = stream.readAfter("all", 2, 2);

        assertThat(page).extracting(StreamRecord::entryId).containsExactly(3L, 4L);
        assertThat(page).extracting(StreamRecord::hubEventId).containsExactly(3L, 4L);
        HubEvent decoded = codec.readEvent(page.get(0).payload());
        assertThat(decoded).isEqualTo(HubFixtures.mergeCast(3, 3));
        assertThat(stream.readAfter("all", 5, 10)).isEmpty();
        assertThat(stream.readAfter("other", 0, 10)).isEmpty();
    }

    @Test
    void checkpoint_overwritesPerConsumer() {
        assertThat(stream.getCheckpoint("hub-sync:all")).isEmpty();

        stream.setCheckpoint("hub-sync:all", 3);
        stream.setCheckpoint("hub-sync:all", 4);
        stream.setCheckpoint("other:all", 1);

        assertThat(stream.getCheckpoint("hub-sync:all")).contains(4L);
        assertThat(stream.getCheckpoint("other:all")).contains(1L);
    }
}
