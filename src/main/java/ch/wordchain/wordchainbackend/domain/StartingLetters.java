package ch.wordchain.wordchainbackend.domain;

import java.util.Random;
import java.util.Set;

/**
 * Picks the letter a new game starts with. Letters that begin very few words are excluded.
 */
public final class StartingLetters {

    public static final Set<Character> EXCLUDED = Set.of('Q', 'X', 'Z', 'J');

    private static final char[] CANDIDATES = "ABCDEFGHIKLMNOPRSTUVWY".toCharArray();

    private StartingLetters() {
    }

    public static char random(Random random) {
        return CANDIDATES[random.nextInt(CANDIDATES.length)];
    }

    public static boolean isTricky(char letter) {
        return EXCLUDED.contains(Character.toUpperCase(letter));
    }
}
