package software.amazon.dfa.jmh;

import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import software.amazon.dfa.Dfa;

import java.util.Random;

@State(Scope.Thread)
public class SearchState {

    public static final int TEXT_LENGTH = 1 << 20;

    private static final String ALPHABET = "ACGT";

    @Param({ "8", "64", "512" })
    public int patternLength;

    Dfa<Character> dfa;
    String text;

    @Setup
    public void setup() {
        Random random = new Random(patternLength);
        StringBuilder sb = new StringBuilder(TEXT_LENGTH);
        for (int i = 0; i < TEXT_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        text = sb.toString();

        // taken from the end of the text so there is at least one match
        String pattern = text.substring(TEXT_LENGTH - patternLength - 1, TEXT_LENGTH - 1);
        dfa = Dfa.forCharacters(pattern);
    }
}
