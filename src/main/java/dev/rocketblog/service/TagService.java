package dev.rocketblog.service;

import dev.rocketblog.config.ResilienceConfig;
import dev.rocketblog.dto.ApiResponse;
import dev.rocketblog.dto.PageMeta;
import dev.rocketblog.dto.TagResponse;
import dev.rocketblog.repository.TagRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TagService {

    public static final int DEFAULT_LIMIT = 50;

    private final TagRepository tagRepository;
    private final ResilienceConfig resilience;

    public Mono<ApiResponse<List<TagResponse>>> getTags(int offset, int limit) {
        log.debug("Listing tags: limit={}, offset={}", limit, offset);
        return tagRepository.findAllOrderByName(limit, offset)
                .map(PostResponseAssembler::toTagResponse)
                .collectList()
                .zipWith(tagRepository.countAll().defaultIfEmpty(0L))
                .map(tuple -> ApiResponse.withMeta(tuple.getT1(), PageMeta.of(tuple.getT2(), limit, offset)))
                .transform(op -> resilience.bounded(op, "getTags limit=" + limit + " offset=" + offset));
    }
}
