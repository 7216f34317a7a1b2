package com.lpradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A destination following a position's range status. lastInRange is the last status sent,
 * so a restart does not repeat a transition notice.
 */
@Document(collection = "position_watches")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PositionWatch {

    /** positionId#chatKey */
    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String positionId;
    private String chatKey;
    private String messageId;
    private Boolean lastInRange;
    private Instant createdAt;

    public static String id(String positionId, String chatKey) {
        return positionId + "#" + chatKey;
    }
}
