package com.mysteryhub.gameservice.games.mystery.interfaces.http;

import com.mysteryhub.gameservice.games.mystery.domain.view.CharacterCard;
import com.mysteryhub.gameservice.games.mystery.domain.view.CharacterSheet;
import com.mysteryhub.gameservice.games.mystery.domain.view.JoinTicket;
import com.mysteryhub.gameservice.games.mystery.domain.view.SessionView;
import com.mysteryhub.gameservice.games.mystery.interfaces.http.dto.ChatRequest;
import com.mysteryhub.gameservice.games.mystery.interfaces.http.dto.CreateGameRequest;
import com.mysteryhub.gameservice.games.mystery.interfaces.http.dto.JoinGameRequest;
import com.mysteryhub.gameservice.games.mystery.interfaces.http.dto.PlayerActionRequest;
import com.mysteryhub.gameservice.games.mystery.interfaces.http.dto.SearchRequest;
import com.mysteryhub.gameservice.games.mystery.interfaces.http.dto.SearchResponse;
import com.mysteryhub.gameservice.games.mystery.interfaces.http.dto.SelectCharacterRequest;
import com.mysteryhub.gameservice.games.mystery.interfaces.http.dto.VoteRequest;
import com.mysteryhub.gameservice.games.mystery.service.GameSessionService;
import com.mysteryhub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 剧本杀对局 http 接口
 * ----------------------------------------
 * 所有变更都委托给 {@link GameSessionService}，广播由引擎提交后统一扇出，控制器不直接推送。
 * 失败由 WebExceptionAdvice 统一映射为 ApiResponse。
 */
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class GameRestController {

    private final GameSessionService gameSessionService;

    /**
     * 创建房间，创建者成为房主
     */
    @PostMapping
    public ResponseEntity<ApiResponse<JoinTicket>> create(@Valid @RequestBody CreateGameRequest req) {
        JoinTicket ticket = gameSessionService.createSession(req.getStoryId(), req.getHostName());
        return ResponseEntity.ok(ApiResponse.success(ticket));
    }

    /**
     * 全量状态（首屏渲染 / 断线重连后对齐）；playerId 决定能看到哪个角色的私密信息
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<SessionView>> view(@PathVariable String sessionId,
                                                         @RequestParam(name = "playerId", required = false) String playerId) {
        return ResponseEntity.ok(ApiResponse.success(gameSessionService.view(sessionId, playerId)));
    }

    @PostMapping("/{sessionId}/join")
    public ResponseEntity<ApiResponse<JoinTicket>> join(@PathVariable String sessionId,
                                                        @Valid @RequestBody JoinGameRequest req) {
        return ResponseEntity.ok(ApiResponse.success(gameSessionService.joinSession(sessionId, req.getPlayerName())));
    }

    /**
     * 角色列表 + 占用情况
     */
    @GetMapping("/{sessionId}/characters")
    public ResponseEntity<ApiResponse<List<CharacterCard>>> characters(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(gameSessionService.characters(sessionId)));
    }

    @PostMapping("/{sessionId}/select-character")
    public ResponseEntity<ApiResponse<List<CharacterCard>>> selectCharacter(@PathVariable String sessionId,
                                                                           @Valid @RequestBody SelectCharacterRequest req) {
        gameSessionService.selectCharacter(sessionId, req.getPlayerId(), req.getCharacterId());
        return ResponseEntity.ok(ApiResponse.success(gameSessionService.characters(sessionId)));
    }

    @PostMapping("/{sessionId}/start")
    public ResponseEntity<ApiResponse<SessionView>> start(@PathVariable String sessionId,
                                                          @Valid @RequestBody PlayerActionRequest req) {
        gameSessionService.startGame(sessionId, req.getPlayerId());
        return ResponseEntity.ok(ApiResponse.success(gameSessionService.view(sessionId, req.getPlayerId())));
    }

    /**
     * 推进到下一阶段（仅房主）
     */
    @PostMapping("/{sessionId}/phase")
    public ResponseEntity<ApiResponse<SessionView>> advance(@PathVariable String sessionId,
                                                            @Valid @RequestBody PlayerActionRequest req) {
        gameSessionService.advancePhase(sessionId, req.getPlayerId());
        return ResponseEntity.ok(ApiResponse.success(gameSessionService.view(sessionId, req.getPlayerId())));
    }

    /**
     * 搜证（仅 investigation 阶段）
     */
    @PostMapping("/{sessionId}/search")
    public ResponseEntity<ApiResponse<SearchResponse>> search(@PathVariable String sessionId,
                                                              @Valid @RequestBody SearchRequest req) {
        var discovery = gameSessionService.recordClueFound(sessionId, req.getPlayerId(), req.getLocationId(), req.getItemId());
        return ResponseEntity.ok(ApiResponse.success(SearchResponse.of(discovery)));
    }

    @PostMapping("/{sessionId}/chat")
    public ResponseEntity<ApiResponse<Void>> chat(@PathVariable String sessionId,
                                                  @Valid @RequestBody ChatRequest req) {
        gameSessionService.relayChat(sessionId, req.getPlayerId(), req.getContent());
        return ResponseEntity.ok(ApiResponse.success());
    }

    /**
     * 投票（仅 voting 阶段，可改票）
     */
    @PostMapping("/{sessionId}/vote")
    public ResponseEntity<ApiResponse<Void>> vote(@PathVariable String sessionId,
                                                  @Valid @RequestBody VoteRequest req) {
        gameSessionService.castVote(sessionId, req.getPlayerId(), req.getSuspectCharacterId());
        return ResponseEntity.ok(ApiResponse.success());
    }

    /**
     * 本人的角色剧本（含私密信息）
     */
    @GetMapping("/{sessionId}/my-character")
    public ResponseEntity<ApiResponse<CharacterSheet>> myCharacter(@PathVariable String sessionId,
                                                                   @RequestParam("playerId") String playerId) {
        return ResponseEntity.ok(ApiResponse.success(gameSessionService.myCharacter(sessionId, playerId)));
    }
}
