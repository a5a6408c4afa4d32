package com.mysteryhub.gameservice.games.mystery.infrastructure.story;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mysteryhub.gameservice.games.mystery.domain.enums.GamePhase;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameError;
import com.mysteryhub.gameservice.games.mystery.domain.story.Story;
import org.junit.jupiter.api.Test;

import static com.mysteryhub.gameservice.games.mystery.support.GameTestSupport.MANOR;
import static com.mysteryhub.gameservice.games.mystery.support.GameTestSupport.errorOf;
import static com.mysteryhub.gameservice.games.mystery.support.GameTestSupport.loadStories;
import static org.assertj.core.api.Assertions.assertThat;

class ClasspathStoryRepositoryTest {

    @Test
    void loadsBundledStories() {
        ClasspathStoryRepository repo = loadStories();

        Story manor = repo.require(MANOR);
        assertThat(manor.getTitleCn()).isEqualTo("午夜庄园谋杀案");
        assertThat(manor.minPlayers()).isEqualTo(2);
        assertThat(manor.maxPlayers()).isEqualTo(4);
        assertThat(manor.getCharacters()).hasSize(4);
        assertThat(manor.clueIds()).contains("clue-001", "clue-005");
        assertThat(manor.getSolution().getMurdererCharacterId()).isEqualTo("char-002");
        assertThat(manor.narrationFor(GamePhase.SCRIPT_READING)).startsWith("雷声");
        assertThat(manor.narrationFor(GamePhase.LOBBY)).isNull();
        assertThat(repo.findAll()).extracting(Story::getId).contains(MANOR, "cabin-trio");
    }

    @Test
    void badFilesAreSkipped() {
        ClasspathStoryRepository repo = new ClasspathStoryRepository(new ObjectMapper(), "classpath*:stories-mixed/*.json");

        assertThat(repo.reload()).isEqualTo(1);
        assertThat(repo.require("tiny").getTitle()).isEqualTo("Tiny Case");
        assertThat(repo.findById("broken")).isEmpty();
        assertThat(repo.require("tiny").narrationFor(GamePhase.VOTING)).isEqualTo("Choose.");
        assertThat(repo.require("tiny").narrationFor(GamePhase.DISCUSSION)).isNull();
    }

    @Test
    void unknownStory() {
        ClasspathStoryRepository repo = loadStories();

        assertThat(repo.findById(null)).isEmpty();
        assertThat(errorOf(() -> repo.require("nope"))).isEqualTo(GameError.STORY_NOT_FOUND);
    }

    @Test
    void clueLookupByItemOrHint() {
        Story manor = loadStories().require(MANOR);

        assertThat(manor.locateClue("garden", "FOUNTAIN")).get().extracting(c -> c.getId()).isEqualTo("clue-004");
        assertThat(manor.locateClue("garden", null)).get().extracting(c -> c.getId()).isEqualTo("clue-003");
        assertThat(manor.locateClue("study", "drawer")).isEmpty();
        assertThat(manor.locateClue(null, "desk")).isEmpty();
    }
}
