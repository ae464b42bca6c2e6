package com.prediction.market.amm.controller;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.market.amm.controller.dto.AdminActionRequest;
import com.prediction.market.amm.controller.dto.ApiErrorResponse;
import com.prediction.market.amm.controller.dto.CastVoteRequest;
import com.prediction.market.amm.controller.dto.CreateMarketRequest;
import com.prediction.market.amm.controller.dto.PlaceBetRequest;
import com.prediction.market.amm.controller.dto.ResolveRequest;
import com.prediction.market.amm.entity.Market;
import com.prediction.market.amm.entity.Payout;
import com.prediction.market.amm.entity.Position;
import com.prediction.market.amm.entity.Resolution;
import com.prediction.market.amm.entity.ResolutionVote;
import com.prediction.market.amm.entity.TradeQuote;
import com.prediction.market.amm.result.EngineError;
import com.prediction.market.amm.result.EngineResult;
import com.prediction.market.amm.service.MarketDefinition;
import com.prediction.market.amm.service.MarketLifecycleService;
import com.prediction.market.amm.service.MarketQueryService;
import com.prediction.market.amm.service.MarketSnapshot;
import com.prediction.market.amm.service.ResolutionCoordinator;
import com.prediction.market.amm.service.SettlementEngine;
import com.prediction.market.amm.service.SettlementSummary;
import com.prediction.market.amm.service.TradeExecutor;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * REST surface of the engine.
 *
 * Endpoints (all under /api/markets):
 * POST   /                       create a market
 * GET    /{id}                   market state with implied prices
 * GET    /{id}/quote             price a bet without placing it
 * POST   /{id}/bets              place a bet
 * GET    /{id}/positions         positions, optionally of one user
 * POST   /{id}/pause|resume|close
 * POST   /{id}/votes             cast or revise a resolution vote
 * POST   /{id}/resolve           admin decision or consensus attempt
 * POST   /{id}/refund|cancel
 * POST   /{id}/settle            re-run settlement, idempotent
 * GET    /{id}/resolution
 * GET    /{id}/payouts
 *
 * Failed results map to the HTTP status of their error kind.
 */
@RestController
@RequestMapping("/api/markets")
@RequiredArgsConstructor
public class MarketController {

    static final String RETRY_AFTER_SECONDS = "1";

    private final MarketLifecycleService lifecycleService;
    private final TradeExecutor tradeExecutor;
    private final ResolutionCoordinator resolutionCoordinator;
    private final SettlementEngine settlementEngine;
    private final MarketQueryService queryService;

    @PostMapping
    public ResponseEntity<?> createMarket(@Valid @RequestBody CreateMarketRequest request) {
        MarketDefinition definition = MarketDefinition.builder()
                .question(request.getQuestion())
                .description(request.getDescription())
                .creatorId(request.getCreatorId())
                .outcomes(request.getOutcomes())
                .endTime(request.getEndTime())
                .resolutionDeadline(request.getResolutionDeadline())
                .initialLiquidity(request.getInitialLiquidity())
                .build();
        EngineResult<Market> created = lifecycleService.createMarket(definition);
        if (created.isFailure()) {
            return error(created.getError());
        }
        return respond(queryService.getMarketState(created.getValue().getId()), HttpStatus.CREATED);
    }

    @GetMapping("/{marketId}")
    public ResponseEntity<?> getMarket(@PathVariable String marketId) {
        EngineResult<MarketSnapshot> result = queryService.getMarketState(marketId);
        return respond(result, HttpStatus.OK);
    }

    @GetMapping("/{marketId}/quote")
    public ResponseEntity<?> getQuote(@PathVariable String marketId, @RequestParam String outcome,
            @RequestParam BigDecimal amount) {
        EngineResult<TradeQuote> result = queryService.getQuote(marketId, outcome, amount);
        return respond(result, HttpStatus.OK);
    }

    @PostMapping("/{marketId}/bets")
    public ResponseEntity<?> placeBet(@PathVariable String marketId, @Valid @RequestBody PlaceBetRequest request) {
        EngineResult<Position> result = tradeExecutor.placeBet(marketId, request.getOutcome(), request.getAmount(),
                request.getUserId());
        return respond(result, HttpStatus.CREATED);
    }

    @GetMapping("/{marketId}/positions")
    public ResponseEntity<?> getPositions(@PathVariable String marketId,
            @RequestParam(required = false) String userId) {
        EngineResult<List<Position>> result = queryService.getPositions(marketId, userId);
        return respond(result, HttpStatus.OK);
    }

    @PostMapping("/{marketId}/pause")
    public ResponseEntity<?> pause(@PathVariable String marketId) {
        return respondWithState(lifecycleService.pause(marketId));
    }

    @PostMapping("/{marketId}/resume")
    public ResponseEntity<?> resume(@PathVariable String marketId) {
        return respondWithState(lifecycleService.resume(marketId));
    }

    @PostMapping("/{marketId}/close")
    public ResponseEntity<?> close(@PathVariable String marketId) {
        return respondWithState(lifecycleService.close(marketId));
    }

    @PostMapping("/{marketId}/votes")
    public ResponseEntity<?> castVote(@PathVariable String marketId, @Valid @RequestBody CastVoteRequest request) {
        EngineResult<ResolutionVote> result = resolutionCoordinator.castVote(marketId, request.getVoterId(),
                request.getOutcome(), request.getConfidence(), request.getWeight(), Boolean.TRUE.equals(request.getIsFinal()),
                request.getReasoning());
        return respond(result, HttpStatus.OK);
    }

    @PostMapping("/{marketId}/resolve")
    public ResponseEntity<?> resolve(@PathVariable String marketId, @Valid @RequestBody ResolveRequest request) {
        EngineResult<SettlementSummary> result = resolutionCoordinator.resolve(marketId, request.getOutcome(),
                request.getResolvedBy());
        return respond(result, HttpStatus.OK);
    }

    @PostMapping("/{marketId}/refund")
    public ResponseEntity<?> refund(@PathVariable String marketId, @Valid @RequestBody AdminActionRequest request) {
        return respond(lifecycleService.refund(marketId, request.getActor()), HttpStatus.OK);
    }

    @PostMapping("/{marketId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String marketId, @Valid @RequestBody AdminActionRequest request) {
        return respond(lifecycleService.cancel(marketId, request.getActor()), HttpStatus.OK);
    }

    @PostMapping("/{marketId}/settle")
    public ResponseEntity<?> settle(@PathVariable String marketId) {
        return respond(settlementEngine.settle(marketId), HttpStatus.OK);
    }

    @GetMapping("/{marketId}/resolution")
    public ResponseEntity<?> getResolution(@PathVariable String marketId) {
        EngineResult<Resolution> result = queryService.getResolution(marketId);
        return respond(result, HttpStatus.OK);
    }

    @GetMapping("/{marketId}/payouts")
    public ResponseEntity<?> getPayouts(@PathVariable String marketId) {
        EngineResult<List<Payout>> result = queryService.getPayouts(marketId);
        return respond(result, HttpStatus.OK);
    }

    private ResponseEntity<?> respondWithState(EngineResult<Market> result) {
        if (result.isFailure()) {
            return error(result.getError());
        }
        return respond(queryService.getMarketState(result.getValue().getId()), HttpStatus.OK);
    }

    private static ResponseEntity<?> respond(EngineResult<?> result, HttpStatus successStatus) {
        if (result.isFailure()) {
            return error(result.getError());
        }
        return ResponseEntity.status(successStatus).body(result.getValue());
    }

    private static ResponseEntity<ApiErrorResponse> error(EngineError error) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .code(error.getCode().name())
                .kind(error.getKind().name())
                .message(error.getMessage())
                .retryable(error.getKind().isRetryable())
                .build();
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(error.getKind().getHttpStatus());
        if (error.getKind().isRetryable()) {
            builder.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        return builder.body(body);
    }
}
