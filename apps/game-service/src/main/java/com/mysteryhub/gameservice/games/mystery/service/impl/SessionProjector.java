package com.mysteryhub.gameservice.games.mystery.service.impl;

import com.mysteryhub.gameservice.games.mystery.domain.enums.GamePhase;
import com.mysteryhub.gameservice.games.mystery.domain.event.ChatPayload;
import com.mysteryhub.gameservice.games.mystery.domain.model.DiscoveredClue;
import com.mysteryhub.gameservice.games.mystery.domain.model.GameSession;
import com.mysteryhub.gameservice.games.mystery.domain.model.PhaseTrack;
import com.mysteryhub.gameservice.games.mystery.domain.model.Player;
import com.mysteryhub.gameservice.games.mystery.domain.story.Story;
import com.mysteryhub.gameservice.games.mystery.domain.story.StoryClue;
import com.mysteryhub.gameservice.games.mystery.domain.view.CharacterCard;
import com.mysteryhub.gameservice.games.mystery.domain.view.CharacterSheet;
import com.mysteryhub.gameservice.games.mystery.domain.view.ClueView;
import com.mysteryhub.gameservice.games.mystery.domain.view.PlayerView;
import com.mysteryhub.gameservice.games.mystery.domain.view.SessionView;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 会话 -> 视图 的投影（调用方须处于会话互斥区内）
 */
final class SessionProjector {

    private SessionProjector() {
    }

    static SessionView project(GameSession session, Story story, String viewerId) {
        GamePhase phase = session.getPhase();
        boolean revealed = PhaseTrack.isAtOrAfter(phase, GamePhase.REVEAL);

        List<PlayerView> players = session.players().stream().map(PlayerView::of).toList();

        List<ClueView> clues = new ArrayList<>();
        for (DiscoveredClue d : session.discoveredClues()) {
            Optional<StoryClue> clue = story.findClue(d.clueId());
            clue.ifPresent(c -> clues.add(ClueView.of(c, d)));
        }

        CharacterSheet mine = session.findPlayer(viewerId)
                .map(Player::getCharacterId)
                .flatMap(story::findCharacter)
                .map(CharacterSheet::of)
                .orElse(null);

        Map<String, String> votes = session.votes();
        List<String> voted = session.players().stream()
                .map(Player::getId)
                .filter(votes::containsKey)
                .toList();
        Map<String, Long> tally = null;
        if (revealed) {
            tally = new LinkedHashMap<>();
            for (String suspect : votes.values()) {
                tally.merge(suspect, 1L, Long::sum);
            }
        }

        List<ChatPayload> chat = session.chatHistory().stream()
                .map(l -> new ChatPayload(l.senderId(), l.senderName(), l.content(), l.sentAt().toEpochMilli()))
                .toList();

        return new SessionView(
                session.getId(),
                session.getStoryId(),
                story.getTitle(),
                session.getStatus(),
                phase,
                session.getHostId(),
                session.getCreatedAt().toEpochMilli(),
                session.getEventSeq(),
                story.narrationFor(phase),
                players,
                characterCards(session, story),
                clues,
                mine,
                voted,
                tally,
                revealed ? story.getSolution() : null,
                chat);
    }

    static List<CharacterCard> characterCards(GameSession session, Story story) {
        Map<String, String> assignments = session.characterAssignments();
        return story.getCharacters().stream()
                .map(c -> CharacterCard.of(c, assignments.get(c.getId())))
                .toList();
    }
}
