package com.prediction.market.amm.entity;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One voter's opinion on the winning outcome. Unique per (market, voter):
 * the id is derived from both so a re-vote overwrites the earlier one.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "resolution_votes")
@CompoundIndex(name = "market_voter_idx", def = "{'marketId':1,'voterId':1}", unique = true)
public class ResolutionVote {

    public static final int DEFAULT_WEIGHT = 1;
    public static final int MIN_CONFIDENCE = 1;
    public static final int MAX_CONFIDENCE = 10;

    @Id
    private String id;

    private String marketId;
    private String voterId;
    private String chosenOutcome;

    /**
     * 1..10, null when the voter gave none.
     */
    private Integer confidence;

    private String reasoning;

    @Builder.Default
    private int weight = DEFAULT_WEIGHT;

    private boolean isFinal;

    private Instant createdAt;
    private Instant updatedAt;

    public static String idFor(String marketId, String voterId) {
        return marketId + ":" + voterId;
    }

    public void revise(String chosenOutcome, Integer confidence, String reasoning, int weight,
            boolean isFinal, Instant at) {
        if (this.isFinal) {
            throw new IllegalStateException(String.format(
                    "Vote is final: voter=%s market=%s", voterId, marketId));
        }
        this.chosenOutcome = chosenOutcome;
        this.confidence = confidence;
        this.reasoning = reasoning;
        this.weight = weight;
        this.isFinal = isFinal;
        this.updatedAt = at;
    }
}
