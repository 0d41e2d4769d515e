package com.hubsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Named position: a consumer's last processed stream entry, or the subscriber's last appended Hub event id.
 */
@Document(collection = "stream_checkpoints")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class StreamCheckpoint {

    @Id
    @EqualsAndHashCode.Include
    private String name;
    private long position;
    private Instant updatedAt;
}
