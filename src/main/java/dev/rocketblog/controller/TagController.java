package dev.rocketblog.controller;

import dev.rocketblog.dto.ApiResponse;
import dev.rocketblog.dto.PostListRequest;
import dev.rocketblog.dto.TagResponse;
import dev.rocketblog.service.TagService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tags")
@RequiredArgsConstructor
@Validated
@io.swagger.v3.oas.annotations.tags.Tag(name = "Tags", description = "Public tag endpoints")
@Slf4j
public class TagController {

    private final TagService tagService;

    @GetMapping
    @Operation(summary = "List tags", description = "Paginated list of tags ordered by name")
    public Mono<ApiResponse<List<TagResponse>>> getTags(
            @RequestParam(defaultValue = "0") @Min(0) @Max(PostListRequest.MAX_OFFSET) int offset,
            @RequestParam(defaultValue = "50") @Min(1) @Max(PostListRequest.MAX_LIMIT) int limit) {
        log.debug("Fetching tags: offset={}, limit={}", offset, limit);
        return tagService.getTags(offset, limit);
    }
}
