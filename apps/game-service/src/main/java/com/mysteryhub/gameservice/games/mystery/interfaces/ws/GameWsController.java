package com.mysteryhub.gameservice.games.mystery.interfaces.ws;

import com.mysteryhub.gameservice.games.mystery.domain.exception.GameError;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameException;
import com.mysteryhub.gameservice.games.mystery.interfaces.http.dto.SearchResponse;
import com.mysteryhub.gameservice.games.mystery.interfaces.ws.dto.GameCommands.ChatCmd;
import com.mysteryhub.gameservice.games.mystery.interfaces.ws.dto.GameCommands.ErrorReply;
import com.mysteryhub.gameservice.games.mystery.interfaces.ws.dto.GameCommands.SearchCmd;
import com.mysteryhub.gameservice.games.mystery.interfaces.ws.dto.GameCommands.SelectCmd;
import com.mysteryhub.gameservice.games.mystery.interfaces.ws.dto.GameCommands.VoteCmd;
import com.mysteryhub.gameservice.games.mystery.service.GameSessionService;
import com.mysteryhub.gameservice.platform.ws.PlayerPrincipal;
import com.mysteryhub.gameservice.platform.ws.StompEventTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import java.util.function.Consumer;

/**
 * 剧本杀 WebSocket 控制器
 * ----------------------------------------
 * 接收前端通过 STOMP 发送的指令（/app/game.*），交给会话引擎执行。
 * 成功后的广播由引擎提交后统一扇出；失败只回给发起者，不会广播到房间。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class GameWsController {

    private final GameSessionService gameSessionService;
    private final SimpMessagingTemplate messaging;

    @MessageMapping("/game.chat")
    public void chat(ChatCmd cmd, SimpMessageHeaderAccessor sha) {
        handle("game.chat", sha, p -> gameSessionService.relayChat(p.sessionId(), p.playerId(), cmd.getContent()));
    }

    /**
     * 搜证：结果（命中 / 未命中）回给发起者；首次发现另由引擎广播 clue_found
     */
    @MessageMapping("/game.search")
    public void search(SearchCmd cmd, SimpMessageHeaderAccessor sha) {
        handle("game.search", sha, p -> {
            var discovery = gameSessionService.recordClueFound(p.sessionId(), p.playerId(),
                    cmd.getLocationId(), cmd.getItemId());
            reply(p, sha, StompEventTransport.REPLIES_DESTINATION, SearchResponse.of(discovery));
        });
    }

    @MessageMapping("/game.select")
    public void select(SelectCmd cmd, SimpMessageHeaderAccessor sha) {
        handle("game.select", sha, p -> gameSessionService.selectCharacter(p.sessionId(), p.playerId(), cmd.getCharacterId()));
    }

    @MessageMapping("/game.start")
    public void start(SimpMessageHeaderAccessor sha) {
        handle("game.start", sha, p -> gameSessionService.startGame(p.sessionId(), p.playerId()));
    }

    @MessageMapping("/game.advance")
    public void advance(SimpMessageHeaderAccessor sha) {
        handle("game.advance", sha, p -> gameSessionService.advancePhase(p.sessionId(), p.playerId()));
    }

    @MessageMapping("/game.vote")
    public void vote(VoteCmd cmd, SimpMessageHeaderAccessor sha) {
        handle("game.vote", sha, p -> gameSessionService.castVote(p.sessionId(), p.playerId(), cmd.getSuspectCharacterId()));
    }

    private void handle(String command, SimpMessageHeaderAccessor sha, Consumer<PlayerPrincipal> action) {
        if (!(sha.getUser() instanceof PlayerPrincipal player)) {
            log.warn("收到未认证的 STOMP 指令: command={}, connectionId={}", command, sha.getSessionId());
            return;
        }
        try {
            action.accept(player);
        } catch (GameException e) {
            log.debug("指令失败: command={}, sessionId={}, playerId={}, error={}",
                    command, player.sessionId(), player.playerId(), e.getError());
            Object details = e.getDetails().isEmpty() ? null : e.getDetails();
            reply(player, sha, StompEventTransport.ERRORS_DESTINATION,
                    new ErrorReply(command, e.getError().name(), e.getMessage(), details));
        } catch (IllegalArgumentException e) {
            reply(player, sha, StompEventTransport.ERRORS_DESTINATION,
                    new ErrorReply(command, GameError.INVALID_ARGUMENT.name(), e.getMessage(), null));
        }
    }

    /**
     * 点对点回执：只投递到发起指令的那条连接
     */
    private void reply(PlayerPrincipal player, SimpMessageHeaderAccessor sha, String destination, Object payload) {
        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headers.setSessionId(sha.getSessionId());
        headers.setLeaveMutable(true);
        messaging.convertAndSendToUser(player.playerId(), destination, payload, headers.getMessageHeaders());
    }
}
