package com.hubsync.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Monotonic counter, incremented with findAndModify. Backs stream entry ids and task enqueue order.
 */
@Document(collection = "sequence_counters")
@NoArgsConstructor
@Getter
@Setter
public class SequenceCounter {

    @Id
    private String name;
    private long value;
}
