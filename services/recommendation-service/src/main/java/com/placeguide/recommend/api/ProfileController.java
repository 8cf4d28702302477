package com.placeguide.recommend.api;

import com.placeguide.recommend.api.dto.ErrorResponse;
import com.placeguide.recommend.api.dto.InteractionRequest;
import com.placeguide.recommend.api.dto.ProfileRequest;
import com.placeguide.recommend.api.dto.ProfileResponse;
import com.placeguide.recommend.model.InteractionType;
import com.placeguide.recommend.model.UserProfile;
import com.placeguide.recommend.profile.ProfileService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {
    private final ProfileService profileService;

    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @GetMapping("/users/{userId}/profile")
    public ProfileResponse getProfile(@PathVariable long userId) {
        return ProfileResponse.from(profileService.getProfile(userId));
    }

    @PutMapping("/users/{userId}/profile")
    public ProfileResponse updateProfile(@PathVariable long userId, @RequestBody ProfileRequest request) {
        UserProfile updated = profileService.updateProfile(
            userId,
            request.getPreferredTags(),
            request.getAvoidedTags(),
            request.getFavoriteDistricts()
        );
        return ProfileResponse.from(updated);
    }

    @PostMapping("/interactions")
    public ResponseEntity<?> recordInteraction(
        @RequestBody(required = false) InteractionRequest request,
        HttpServletRequest httpRequest
    ) {
        String error = validate(request);
        if (error != null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse(
                    "bad_request",
                    error,
                    RequestIdUtil.traceId(httpRequest),
                    RequestIdUtil.requestId(httpRequest)
                )
            );
        }
        InteractionType type = InteractionType.fromCode(request.getType());
        profileService.recordInteractionAsync(request.getUserId(), request.getVenueId(), type);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("status", "accepted"));
    }

    private static String validate(InteractionRequest request) {
        if (request == null) {
            return "request body is required";
        }
        if (request.getUserId() == null || request.getVenueId() == null) {
            return "user_id and venue_id are required";
        }
        if (InteractionType.fromCode(request.getType()) == null) {
            return "type must be one of: liked, disliked";
        }
        return null;
    }
}
