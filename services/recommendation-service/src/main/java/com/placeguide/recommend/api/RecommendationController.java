package com.placeguide.recommend.api;

import com.placeguide.recommend.api.dto.ErrorResponse;
import com.placeguide.recommend.api.dto.TurnRequest;
import com.placeguide.recommend.api.dto.TurnResponse;
import com.placeguide.recommend.query.InvalidTurnRequestException;
import com.placeguide.recommend.service.RecommendationService;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RecommendationController {
    private final RecommendationService recommendationService;

    public RecommendationController(RecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/recommendations")
    public ResponseEntity<?> recommend(
        @RequestBody(required = false) TurnRequest request,
        @RequestHeader(value = RequestIdUtil.TRACE_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIdUtil.REQUEST_HEADER, required = false) String requestIdHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceIdHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestIdHeader);
        if (request == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "request body is required", traceId, requestId)
            );
        }
        try {
            TurnResponse response = recommendationService.recommend(request, traceId, requestId);
            return ResponseEntity.ok(response);
        } catch (InvalidTurnRequestException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        }
    }
}
