package com.mysteryhub.gameservice.games.mystery.interfaces.http;

import com.mysteryhub.gameservice.games.mystery.domain.repository.StoryRepository;
import com.mysteryhub.gameservice.games.mystery.domain.story.StoryLocation;
import com.mysteryhub.gameservice.games.mystery.domain.view.StoryDetail;
import com.mysteryhub.gameservice.games.mystery.domain.view.StorySummary;
import com.mysteryhub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 剧本目录（只读）：开局前可公开的内容
 */
@RestController
@RequestMapping("/api/stories")
@RequiredArgsConstructor
public class StoryController {

    private final StoryRepository storyRepository;

    @GetMapping
    public ResponseEntity<ApiResponse<List<StorySummary>>> list() {
        List<StorySummary> stories = storyRepository.findAll().stream().map(StorySummary::of).toList();
        return ResponseEntity.ok(ApiResponse.success(stories));
    }

    @GetMapping("/{storyId}")
    public ResponseEntity<ApiResponse<StoryDetail>> detail(@PathVariable String storyId) {
        return ResponseEntity.ok(ApiResponse.success(StoryDetail.of(storyRepository.require(storyId))));
    }

    @GetMapping("/{storyId}/locations")
    public ResponseEntity<ApiResponse<List<StoryLocation>>> locations(@PathVariable String storyId) {
        return ResponseEntity.ok(ApiResponse.success(List.copyOf(storyRepository.require(storyId).getLocations())));
    }
}
