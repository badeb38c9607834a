package polyalgebra;

public class Lexer {
    private final String input;
    private int pos = 0;
    private String curToken = "";

    public Lexer(String input) {
        this.input = input;
        this.next();
    }

    private String getNumber() {
        StringBuilder sb = new StringBuilder();
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            sb.append(input.charAt(pos));
            ++pos;
        }
        return sb.toString();
    }

    private String getName() {
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()
            && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
            sb.append(input.charAt(pos));
            ++pos;
        }
        return sb.toString();
    }

    public void next() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            ++pos;
        }
        if (pos == input.length()) {
            curToken = "";
            return;
        }
        char c = input.charAt(pos);
        if (Character.isDigit(c)) {
            curToken = getNumber();
        }
        else if (Character.isLetter(c)) {
            curToken = getName();
        }
        else if (c == '+' || c == '-' || c == '*' || c == '/' || c == '^' || c == '(' || c == ')') {
            pos += 1;
            curToken = String.valueOf(c);
        }
        else {
            throw new IllegalArgumentException("unexpected character '" + c + "' at " + pos + " in " + input);
        }
    }

    public String peek() {
        return curToken;
    }

    public boolean atEnd() {
        return curToken.isEmpty();
    }
}
