package pl.marcinmilkowski.vocab_store.attrs;

/**
 * Orthographic shape of a word: letters become x/X, digits d, other characters
 * stay as they are. Runs of the same shape character are cut at four,
 * so "Wellington" -> "Xxxxx" and "1984" -> "dddd".
 */
public final class WordShape {

    private static final int MAX_RUN = 4;

    private WordShape() {
    }

    public static String of(String string) {
        StringBuilder shape = new StringBuilder(Math.min(string.length(), 16));
        char last = 0;
        int seq = 0;
        for (int i = 0; i < string.length(); i++) {
            char c = string.charAt(i);
            char shapeChar;
            if (Character.isLetter(c)) {
                shapeChar = Character.isUpperCase(c) ? 'X' : 'x';
            } else if (Character.isDigit(c)) {
                shapeChar = 'd';
            } else {
                shapeChar = c;
            }
            if (i > 0 && shapeChar == last) {
                seq++;
            } else {
                seq = 0;
                last = shapeChar;
            }
            if (seq < MAX_RUN) {
                shape.append(shapeChar);
            }
        }
        return shape.toString();
    }
}
