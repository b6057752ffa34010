package com.raditha.cpptokens.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lexer for preprocessed C and C++ code.
 * <p>
 * Recognizes identifiers, numbers, string and character literals (with encoding
 * and raw prefixes), punctuators by longest match and the line markers
 * {@code #line N "file"} / {@code # N "file"} that a preprocessor leaves behind.
 * Other directives are skipped. Non-ASCII characters and unterminated literals are
 * reported as diagnostics.
 */
public class SimpleLexer implements Lexer {

    private static final Logger logger = LoggerFactory.getLogger(SimpleLexer.class);

    private static final String[] PUNCTUATORS_3 = {"<<=", ">>=", "...", "->*", "<=>"};
    private static final Set<String> PUNCTUATORS_2 = Set.of(
            "::", "->", "++", "--", "<<", ">>", "<=", ">=", "==", "!=", "&&", "||",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", ".*", "##");
    private static final String PUNCTUATORS_1 = "{}[]()<>;:,.?+-*/%&|^~!=#\\@";
    private static final Set<String> STRING_PREFIXES = Set.of(
            "L", "u", "U", "u8", "R", "LR", "uR", "UR", "u8R");

    @Override
    public LexedTokens lex(Reader code, List<String> files, String file0) throws LexerException {
        String text;
        try {
            text = readAll(code);
        } catch (IOException e) {
            throw new LexerException("Cannot read code: " + e.getMessage(), e);
        }
        List<String> fileTable = new ArrayList<>(files);
        int fileIndex = indexOf(fileTable, file0 == null ? "" : file0);
        State state = new State(text, fileTable, fileIndex);
        state.run();
        logger.debug("Lexed {} tokens from {} ({} diagnostics)", state.tokens.size(), file0, state.diagnostics.size());
        return new LexedTokens(state.tokens, fileTable, state.diagnostics);
    }

    private static String readAll(Reader reader) throws IOException {
        StringBuilder sb = new StringBuilder();
        char[] buf = new char[8192];
        int n;
        while ((n = reader.read(buf)) >= 0) {
            sb.append(buf, 0, n);
        }
        return sb.toString();
    }

    private static int indexOf(List<String> files, String file) {
        int i = files.indexOf(file);
        if (i >= 0) {
            return i;
        }
        files.add(file);
        return files.size() - 1;
    }

    private static final class State {
        private final String text;
        private final List<String> files;
        private final List<RawToken> tokens = new ArrayList<>();
        private final List<String> diagnostics = new ArrayList<>();
        private int pos;
        private int line = 1;
        private int lineStart;
        private int fileIndex;
        private boolean atLineStart = true;

        State(String text, List<String> files, int fileIndex) {
            this.text = text;
            this.files = files;
            this.fileIndex = fileIndex;
        }

        void run() {
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '\n') {
                    newLine();
                } else if (c == '\\' && peek(1) == '\n') {
                    pos++;
                    newLine();
                } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B') {
                    pos++;
                } else if (c == '/' && peek(1) == '/') {
                    skipToEndOfLine();
                } else if (c == '/' && peek(1) == '*') {
                    skipBlockComment();
                } else if (c == '#' && atLineStart) {
                    directive();
                } else {
                    atLineStart = false;
                    token(c);
                }
            }
        }

        private char peek(int offset) {
            int p = pos + offset;
            return p < text.length() ? text.charAt(p) : '\0';
        }

        private void newLine() {
            pos++;
            line++;
            lineStart = pos;
            atLineStart = true;
        }

        private void skipToEndOfLine() {
            while (pos < text.length() && text.charAt(pos) != '\n') {
                pos++;
            }
        }

        private void skipBlockComment() {
            pos += 2;
            while (pos < text.length() && !(text.charAt(pos) == '*' && peek(1) == '/')) {
                if (text.charAt(pos) == '\n') {
                    line++;
                    lineStart = pos + 1;
                }
                pos++;
            }
            pos = Math.min(text.length(), pos + 2);
        }

        private void directive() {
            int end = text.indexOf('\n', pos);
            if (end < 0) {
                end = text.length();
            }
            String body = text.substring(pos + 1, end).trim();
            pos = end;
            if (body.startsWith("line")) {
                body = body.substring(4).trim();
            }
            if (!body.isEmpty() && Character.isDigit(body.charAt(0))) {
                lineMarker(body);
            } else {
                logger.debug("Skipping directive #{} at line {}", body, line);
            }
        }

        private void lineMarker(String body) {
            int i = 0;
            while (i < body.length() && Character.isDigit(body.charAt(i))) {
                i++;
            }
            int markerLine = Integer.parseInt(body.substring(0, i));
            int q1 = body.indexOf('"', i);
            int q2 = q1 < 0 ? -1 : body.indexOf('"', q1 + 1);
            if (q1 >= 0 && q2 > q1) {
                fileIndex = indexOf(files, body.substring(q1 + 1, q2));
            }
            // the newline ending the marker line increments to markerLine
            line = markerLine - 1;
        }

        private void token(char c) {
            int startPos = pos;
            int column = pos - lineStart + 1;
            String str;
            if (c > 127) {
                diagnostics.add(files.get(fileIndex) + ":" + line + ": Unhandled character '" + c + "'");
                pos++;
                return;
            } else if (isIdentifierStart(c)) {
                str = identifierOrPrefixedLiteral();
            } else if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
                str = number();
            } else if (c == '"' || c == '\'') {
                str = quoted(pos, c);
            } else {
                str = punctuator();
            }
            if (str == null || str.isEmpty()) {
                pos = startPos + 1;
                return;
            }
            tokens.add(new RawToken(str, fileIndex, line, column));
        }

        private String identifierOrPrefixedLiteral() {
            int start = pos;
            while (pos < text.length() && isIdentifierChar(text.charAt(pos))) {
                pos++;
            }
            String ident = text.substring(start, pos);
            char c = peek(0);
            if ((c == '"' || c == '\'') && STRING_PREFIXES.contains(ident)) {
                if (ident.endsWith("R") && c == '"') {
                    return rawString(start);
                }
                return quoted(start, c);
            }
            return ident;
        }

        private static boolean isIdentifierStart(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c == '$';
        }

        private static boolean isIdentifierChar(char c) {
            return isIdentifierStart(c) || isDigit(c);
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private String number() {
            int start = pos;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (isIdentifierChar(c) || c == '.') {
                    pos++;
                } else if (c == '\'' && isIdentifierChar(peek(1))) {
                    pos++;
                } else if ((c == '+' || c == '-') && pos > start
                        && "eEpP".indexOf(text.charAt(pos - 1)) >= 0 && !isHexWithoutExponent(start)) {
                    pos++;
                } else {
                    break;
                }
            }
            return text.substring(start, pos);
        }

        private boolean isHexWithoutExponent(int start) {
            String sofar = text.substring(start, pos);
            boolean hex = sofar.startsWith("0x") || sofar.startsWith("0X");
            char last = sofar.charAt(sofar.length() - 1);
            return hex && (last == 'e' || last == 'E');
        }

        private String quoted(int start, char quote) {
            pos++;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '\\' && pos + 1 < text.length() && text.charAt(pos + 1) != '\n') {
                    pos += 2;
                } else if (c == quote) {
                    pos++;
                    return text.substring(start, pos);
                } else if (c == '\n') {
                    break;
                } else {
                    pos++;
                }
            }
            diagnostics.add(files.get(fileIndex) + ":" + line + ": No pair for character (" + quote + ")");
            return text.substring(start, pos);
        }

        private String rawString(int start) {
            int open = text.indexOf('(', pos);
            int eol = text.indexOf('\n', pos);
            if (open < 0 || (eol >= 0 && eol < open)) {
                return quoted(start, '"');
            }
            String delimiter = text.substring(pos + 1, open);
            String terminator = ")" + delimiter + "\"";
            int close = text.indexOf(terminator, open);
            if (close < 0) {
                diagnostics.add(files.get(fileIndex) + ":" + line + ": Raw string literal is not terminated");
                pos = text.length();
                return text.substring(start);
            }
            pos = close + terminator.length();
            return text.substring(start, pos);
        }

        private String punctuator() {
            for (String p : PUNCTUATORS_3) {
                if (text.startsWith(p, pos)) {
                    pos += 3;
                    return p;
                }
            }
            if (pos + 2 <= text.length()) {
                String two = text.substring(pos, pos + 2);
                if (PUNCTUATORS_2.contains(two)) {
                    pos += 2;
                    return two;
                }
            }
            char c = text.charAt(pos);
            pos++;
            if (PUNCTUATORS_1.indexOf(c) >= 0) {
                return String.valueOf(c);
            }
            diagnostics.add(files.get(fileIndex) + ":" + line + ": Unhandled character '" + c + "'");
            return null;
        }
    }
}
