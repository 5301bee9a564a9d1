package com.codenames.backend.service;

import com.codenames.backend.exception.ConfigurationException;
import com.codenames.backend.model.Board;
import com.codenames.backend.model.Card;
import com.codenames.backend.model.CardType;
import com.codenames.backend.model.Team;
import com.codenames.backend.model.WordCorpus;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Deals standard boards. All randomness comes from the {@link Random} passed in, so two deals from
 * generators seeded alike are identical.
 */
@Component
public class BoardGenerator {

    private final WordCorpus corpus;

    public BoardGenerator(WordCorpus corpus) {
        this.corpus = corpus;
    }

    @Value
    public static class Deal {
        Board board;
        Team startingTeam;
    }

    public Deal deal(Random random) {
        if (corpus.size() < Board.SIZE) {
            throw new ConfigurationException("Word corpus has " + corpus.size()
                    + " distinct entries, at least " + Board.SIZE + " are required");
        }

        List<String> words = new ArrayList<>(corpus.getWords());
        Collections.shuffle(words, random);
        words = words.subList(0, Board.SIZE);

        Team startingTeam = random.nextBoolean() ? Team.RED : Team.BLUE;

        List<CardType> types = new ArrayList<>(Board.SIZE);
        addCopies(types, startingTeam.cardType(), Board.STARTING_TEAM_CARDS);
        addCopies(types, startingTeam.opponent().cardType(), Board.SECOND_TEAM_CARDS);
        addCopies(types, CardType.NEUTRAL, Board.NEUTRAL_CARDS);
        addCopies(types, CardType.ASSASSIN, Board.ASSASSIN_CARDS);
        Collections.shuffle(types, random);

        List<Card> cards = new ArrayList<>(Board.SIZE);
        for (int i = 0; i < Board.SIZE; i++) {
            cards.add(new Card(words.get(i), types.get(i)));
        }
        return new Deal(new Board(cards), startingTeam);
    }

    private static void addCopies(List<CardType> types, CardType type, int copies) {
        for (int i = 0; i < copies; i++) {
            types.add(type);
        }
    }
}
