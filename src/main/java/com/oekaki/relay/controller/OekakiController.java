package com.oekaki.relay.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oekaki.relay.dto.ApiResponse;
import com.oekaki.relay.dto.ArtifactDetail;
import com.oekaki.relay.dto.GalleryResponse;
import com.oekaki.relay.dto.HistoryView;
import com.oekaki.relay.dto.SubmissionRequest;
import com.oekaki.relay.dto.ValidationOutcome;
import com.oekaki.relay.exception.ValidationException;
import com.oekaki.relay.model.Artifact;
import com.oekaki.relay.service.GalleryService;
import com.oekaki.relay.service.SubmissionCoordinator;
import com.oekaki.relay.service.SubmissionValidator;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

@RestController
@RequestMapping("/api/oekaki")
@RequiredArgsConstructor
@Slf4j
public class OekakiController {

    private final SubmissionValidator validator;
    private final SubmissionCoordinator coordinator;
    private final GalleryService gallery;
    private final ObjectMapper objectMapper;

    @Value("${app.submitter-address-header:CF-Connecting-IP}")
    private String submitterAddressHeader;

    /**
     * Start a new drawing (no id) or add a revision to an existing one.
     * POST /api/oekaki/post
     *
     * The body is read as JSON whatever Content-Type the client sends.
     */
    @PostMapping("/post")
    public ApiResponse<String> submit(@RequestBody(required = false) byte[] body,
                                      HttpServletRequest http) {
        SubmissionRequest request = readSubmission(body);
        ValidationOutcome outcome = validator.validate(request);
        if (!outcome.isValid()) {
            throw new ValidationException(outcome.getRejection());
        }

        String artifactId = coordinator.submit(outcome.getSubmission(), request.getId(), submitterAddress(http));
        return ApiResponse.ok(artifactId);
    }

    /**
     * Most recently drawn or revised drawings.
     * GET /api/oekaki/images?page=0
     */
    @GetMapping("/images")
    public GalleryResponse listImages(@RequestParam(value = "page", defaultValue = "0") int page) {
        int clamped = GalleryService.clampPage(page);
        return new GalleryResponse(true, clamped, gallery.listRecent(clamped));
    }

    /**
     * GET /api/oekaki/histories?image_id=...
     */
    @GetMapping("/histories")
    public ApiResponse<List<HistoryView>> listHistories(@RequestParam("image_id") String imageId) {
        return ApiResponse.ok(gallery.listHistory(imageId));
    }

    /**
     * GET /api/oekaki/image?image_id=...
     */
    @GetMapping("/image")
    public ApiResponse<ArtifactDetail> getImage(@RequestParam("image_id") String imageId) {
        return ApiResponse.ok(gallery.getArtifact(imageId));
    }

    private SubmissionRequest readSubmission(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        try {
            return objectMapper.readValue(body, SubmissionRequest.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("unreadable body: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // Informational only, so an oversized header is cut to fit the column.
    private String submitterAddress(HttpServletRequest http) {
        String forwarded = http.getHeader(submitterAddressHeader);
        String address = StringUtils.hasText(forwarded) ? forwarded : http.getRemoteAddr();
        if (address != null && address.length() > Artifact.ADDRESS_MAX_LENGTH) {
            return address.substring(0, Artifact.ADDRESS_MAX_LENGTH);
        }
        return address;
    }
}
