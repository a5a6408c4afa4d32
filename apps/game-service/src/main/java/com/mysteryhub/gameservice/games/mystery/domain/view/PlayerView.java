package com.mysteryhub.gameservice.games.mystery.domain.view;

import com.mysteryhub.gameservice.games.mystery.domain.model.Player;

public record PlayerView(String id, String name, String characterId, boolean host, boolean connected) {

    public static PlayerView of(Player p) {
        return new PlayerView(p.getId(), p.getName(), p.getCharacterId(), p.isHost(), p.isConnected());
    }
}
